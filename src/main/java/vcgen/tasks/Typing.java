// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vcgen.tasks;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import vcgen.core.Computation;
import vcgen.core.GenerationError;
import vcgen.core.Goal;
import vcgen.core.Logic;
import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;
import vcgen.core.Relation;
import vcgen.core.SiteId;
import vcgen.core.State;
import vcgen.util.ExpressionTyping;

/**
 * Checks that a goal is well-formed before any obligations are generated. This
 * determines the type of every computation, and records for each site the
 * variables live there (along with their types). Problems are collected rather
 * than thrown, so that every problem in a goal is reported at once. A
 * computation found to be ill-formed is marked as such, and generation does
 * not proceed beyond it.
 *
 * @author David J. Pearce
 *
 */
public class Typing {
	/**
	 * The name given to the value passed to the target or exceptional relation
	 * when checking them.
	 */
	private static final String VALUE = "relation.value";

	/**
	 * Information about a single site.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Site {
		private final SiteId id;
		private final Computation node;
		private final Map<String, Type> live;
		private final Type element;
		private final Set<String> modified;

		private Site(SiteId id, Computation node, Map<String, Type> live, Type element, Set<String> modified) {
			this.id = id;
			this.node = node;
			this.live = Collections.unmodifiableMap(new LinkedHashMap<>(live));
			this.element = element;
			this.modified = Collections.unmodifiableSet(modified);
		}

		public SiteId getId() {
			return id;
		}

		public Computation getNode() {
			return node;
		}

		public boolean isLoop() {
			return node instanceof Computation.For;
		}

		/**
		 * Get the variables in scope at this site, excluding the loop binder.
		 *
		 * @return
		 */
		public Map<String, Type> getLive() {
			return live;
		}

		/**
		 * Get the element type of the sequence iterated over, or <code>null</code>
		 * if this site is not a loop.
		 *
		 * @return
		 */
		public Type getElement() {
			return element;
		}

		/**
		 * Get the live variables which may be assigned within the loop body (or
		 * either branch of a conditional). These are exactly the variables whose
		 * values are forgotten at the site.
		 *
		 * @return
		 */
		public Set<String> getModified() {
			return modified;
		}
	}

	private final Goal goal;
	private final Map<SiteId, Site> sites = new LinkedHashMap<>();
	private final List<GenerationError> errors = new ArrayList<>();
	private final Map<Computation, Type> types = new IdentityHashMap<>();
	private final Set<Computation> invalid = Collections.newSetFromMap(new IdentityHashMap<>());
	private Type returned = Type.Void;
	private Type thrown = Type.Void;
	private Type result;
	private boolean valid = true;

	private Typing(Goal goal) {
		this.goal = goal;
	}

	/**
	 * Check a given goal.
	 *
	 * @param goal
	 * @return
	 */
	public static Typing check(Goal goal) {
		Typing typing = new Typing(goal);
		typing.checkGoal();
		return typing;
	}

	public Goal getGoal() {
		return goal;
	}

	public Collection<Site> getSites() {
		return Collections.unmodifiableCollection(sites.values());
	}

	public Site getSite(SiteId id) {
		return sites.get(id);
	}

	public List<GenerationError> getErrors() {
		return Collections.unmodifiableList(errors);
	}

	/**
	 * Check whether a given computation was found to be ill-formed. No
	 * obligations are generated for any path reaching it.
	 *
	 * @param node
	 * @return
	 */
	public boolean isInvalid(Computation node) {
		return invalid.contains(node);
	}

	/**
	 * Check whether the goal as a whole (i.e. its parameters, precondition and
	 * relations) is well-formed. If not, no obligations can be generated at all.
	 *
	 * @return
	 */
	public boolean isValid() {
		return valid;
	}

	/**
	 * Get the type of the value produced by a given computation, or
	 * <code>null</code> if it was not reached.
	 *
	 * @param node
	 * @return
	 */
	public Type getType(Computation node) {
		return types.get(node);
	}

	/**
	 * Get the type of the value passed to the target relation.
	 *
	 * @return
	 */
	public Type getResultType() {
		return result;
	}

	// =========================================================================
	// Goal
	// =========================================================================

	private void checkGoal() {
		Environment env = Environment.EMPTY;
		for (Goal.Parameter p : goal.getParameters()) {
			String problem = env.canDeclare(p.getName());
			if (problem != null) {
				goalError("parameter " + problem);
			} else {
				env = env.declare(p.getName(), p.getType(), true);
			}
		}
		try {
			Type t = new ExpressionTyping(env.types).check(goal.getPrecondition());
			if (!t.equals(Type.Bool)) {
				goalError("precondition must be bool, found " + t);
			}
		} catch (ExpressionTyping.TypeError e) {
			goalError("precondition is ill-typed: " + e.getMessage());
		}
		Type body = check(goal.getBody(), env, 0);
		// Determine the type of values reaching the target relation
		Type declared = goal.getReturns();
		if (declared != null) {
			if (ExpressionTyping.unify(declared, body) == null) {
				error(goal.getBody(), "expected result of type " + declared + ", found " + body);
			}
			result = declared;
		} else {
			result = ExpressionTyping.unify(body, returned);
			if (result == null) {
				error(goal.getBody(), "result of type " + body + " is inconsistent with returned " + returned);
				result = body;
			}
		}
		checkRelation("target", goal.getTarget(), result, env);
		Type exceptional = goal.getThrowing() != null ? goal.getThrowing() : thrown;
		if (goal.getThrowing() != null || !thrown.equals(Type.Void)) {
			checkRelation("exceptional", goal.getExceptional(), exceptional, env);
		}
	}

	/**
	 * Check a relation by applying it to a symbolic value and a state holding
	 * the parameters.
	 */
	private void checkRelation(String name, Relation relation, Type value, Environment env) {
		State symbolic = State.EMPTY;
		for (String var : env.types.keySet()) {
			symbolic = symbolic.put(var, Logic.VAR(var));
		}
		Map<String, Type> types = new LinkedHashMap<>(env.types);
		types.put(VALUE, value);
		try {
			Expr.Logical e = relation.apply(Logic.VAR(VALUE), symbolic);
			Type t = new ExpressionTyping(types).check(e);
			if (!t.equals(Type.Bool)) {
				goalError(name + " relation must be bool, found " + t);
			}
		} catch (IllegalArgumentException e) {
			goalError(name + " relation is ill-typed: " + e.getMessage());
		}
	}

	// =========================================================================
	// Computations
	// =========================================================================

	private Type check(Computation c, Environment env, int loops) {
		Type t;
		switch (c.getTag()) {
		case PURE:
			t = checkExpression(((Computation.Pure) c).getValue(), env, c);
			break;
		case BIND:
			t = checkBind((Computation.Bind) c, env, loops);
			break;
		case GET:
			t = checkGet((Computation.Get) c, env);
			break;
		case SET:
			t = checkSet((Computation.Set) c, env);
			break;
		case IF:
			t = checkIfElse((Computation.IfElse) c, env, loops);
			break;
		case FOR:
			t = checkFor((Computation.For) c, env, loops);
			break;
		case BREAK:
		case CONTINUE:
			if (loops == 0) {
				t = error(c, c.getTag().name().toLowerCase() + " outside of loop");
			} else {
				t = Type.Void;
			}
			break;
		case RETURN:
			t = checkReturn((Computation.Return) c, env);
			break;
		case THROW:
			t = checkThrow((Computation.Throw) c, env);
			break;
		case BLOCK:
			t = checkBlock((Computation.Block) c, env, loops);
			break;
		case CHOICE:
			t = checkChoice((Computation.Choice) c, env, loops);
			break;
		default:
			throw new IllegalArgumentException("unknown computation encountered (" + c.getTag() + ")");
		}
		types.put(c, t);
		return t;
	}

	private Type checkBind(Computation.Bind c, Environment env, int loops) {
		Type first = check(c.getFirst(), env, loops);
		String binder = c.getBinder();
		if (binder != null) {
			String problem = env.canDeclare(binder);
			if (problem != null) {
				return error(c, "binder " + problem);
			}
			env = env.declare(binder, first, false);
		}
		Type rest = check(c.getRest(), env, loops);
		return first.equals(Type.Void) ? Type.Void : rest;
	}

	private Type checkGet(Computation.Get c, Environment env) {
		Type t = env.types.get(c.getVariable());
		if (t == null) {
			return error(c, "unknown variable " + c.getVariable());
		}
		return t;
	}

	private Type checkSet(Computation.Set c, Environment env) {
		String var = c.getVariable();
		Type declared = env.types.get(var);
		if (declared == null) {
			return error(c, "unknown variable " + var);
		} else if (!env.mutable.contains(var)) {
			return error(c, "cannot assign immutable variable " + var);
		}
		Type t = checkExpression(c.getValue(), env, c);
		if (!invalid.contains(c) && ExpressionTyping.unify(declared, t) == null) {
			return error(c, "cannot assign " + t + " to " + var + " of type " + declared);
		}
		return Type.Unit;
	}

	private Type checkIfElse(Computation.IfElse c, Environment env, int loops) {
		Type cond = checkExpression(c.getCondition(), env, c);
		if (!invalid.contains(c) && ExpressionTyping.unify(Type.Bool, cond) == null) {
			return error(c, "condition must be bool, found " + cond);
		}
		Type lhs = check(c.getTrueBranch(), env, loops);
		Type rhs = check(c.getFalseBranch(), env, loops);
		Type t = ExpressionTyping.unify(lhs, rhs);
		if (t == null) {
			t = error(c, "branches have incompatible types " + lhs + " and " + rhs);
		}
		if (c.getSite() != null) {
			Set<String> modified = assigned(c.getTrueBranch(), new LinkedHashSet<>());
			assigned(c.getFalseBranch(), modified);
			modified.retainAll(env.types.keySet());
			declareSite(c.getSite(), c, env, null, modified);
		}
		return t;
	}

	private Type checkFor(Computation.For c, Environment env, int loops) {
		Type source = checkExpression(c.getSequence(), env, c);
		if (invalid.contains(c)) {
			return Type.Unit;
		} else if (!(source instanceof Type.Sequence)) {
			return error(c, "cannot iterate over " + source);
		}
		Type element = ((Type.Sequence) source).getElement();
		Set<String> modified = assigned(c.getBody(), new LinkedHashSet<>());
		modified.retainAll(env.types.keySet());
		declareSite(c.getSite(), c, env, element, modified);
		String problem = env.canDeclare(c.getBinder());
		if (problem != null) {
			return error(c, "loop binder " + problem);
		}
		check(c.getBody(), env.declare(c.getBinder(), element, false), loops + 1);
		// A body which can leave the loop early, has effects and makes choices
		// gives rise to an unbounded number of distinct exit states.
		if (exits(c.getBody(), true) && hasEffects(c.getBody()) && contains(c.getBody(), Computation.Tag.CHOICE)) {
			return error(c, "loop body combines early exit, state effects and choice");
		}
		return Type.Unit;
	}

	private Type checkReturn(Computation.Return c, Environment env) {
		Type t = checkExpression(c.getValue(), env, c);
		if (invalid.contains(c)) {
			return Type.Void;
		}
		Type expected = goal.getReturns() != null ? goal.getReturns() : returned;
		Type u = ExpressionTyping.unify(expected, t);
		if (u == null) {
			return error(c, "cannot return " + t + ", expected " + expected);
		}
		if (goal.getReturns() == null) {
			returned = u;
		}
		return Type.Void;
	}

	private Type checkThrow(Computation.Throw c, Environment env) {
		Type t = checkExpression(c.getValue(), env, c);
		if (invalid.contains(c)) {
			return Type.Void;
		}
		Type expected = goal.getThrowing() != null ? goal.getThrowing() : thrown;
		Type u = ExpressionTyping.unify(expected, t);
		if (u == null) {
			return error(c, "cannot throw " + t + ", expected " + expected);
		}
		if (goal.getThrowing() == null) {
			thrown = u;
		}
		return Type.Void;
	}

	private Type checkBlock(Computation.Block c, Environment env, int loops) {
		for (Computation.Local l : c.getLocals()) {
			String problem = env.canDeclare(l.getName());
			if (problem != null) {
				return error(c, "local " + problem);
			}
			Type t = checkExpression(l.getInitialiser(), env, c);
			if (invalid.contains(c)) {
				return Type.Void;
			} else if (ExpressionTyping.unify(l.getType(), t) == null) {
				return error(c, "cannot initialise " + l.getName() + " of type " + l.getType() + " with " + t);
			}
			env = env.declare(l.getName(), l.getType(), true);
		}
		return check(c.getBody(), env, loops);
	}

	private Type checkChoice(Computation.Choice c, Environment env, int loops) {
		Type lhs = check(c.getLeft(), env, loops);
		Type rhs = check(c.getRight(), env, loops);
		Type t = ExpressionTyping.unify(lhs, rhs);
		if (t == null) {
			return error(c, "alternatives have incompatible types " + lhs + " and " + rhs);
		}
		return t;
	}

	private Type checkExpression(Expr e, Environment env, Computation node) {
		try {
			return new ExpressionTyping(env.types).check(e);
		} catch (ExpressionTyping.TypeError ex) {
			return error(node, "ill-typed expression: " + ex.getMessage());
		}
	}

	private void declareSite(SiteId id, Computation node, Environment env, Type element, Set<String> modified) {
		if (sites.containsKey(id)) {
			error(node, "duplicate site " + id);
		} else {
			sites.put(id, new Site(id, node, env.types, element, modified));
		}
	}

	/**
	 * Record a problem with a given computation, which is then excluded from
	 * generation. This returns <code>void</code>, since that is compatible with
	 * everything and does not give rise to further errors.
	 */
	private Type error(Computation node, String reason) {
		errors.add(GenerationError.unsupported(node, reason));
		invalid.add(node);
		return Type.Void;
	}

	private void goalError(String reason) {
		errors.add(GenerationError.unsupported(null, reason));
		valid = false;
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	/**
	 * Determine the variables assigned anywhere within a computation.
	 */
	private static Set<String> assigned(Computation c, Set<String> vars) {
		Computation.Shape shape = Computation.shape(c);
		if (shape.getTag() == Computation.Tag.SET) {
			vars.add(((Computation.Set) c).getVariable());
		}
		for (Computation child : shape.getChildren()) {
			assigned(child, vars);
		}
		return vars;
	}

	/**
	 * Determine whether a computation can leave the enclosing loop other than by
	 * completing normally or continuing. A <code>break</code> only counts when
	 * it is not inside a nested loop.
	 */
	private static boolean exits(Computation c, boolean breaks) {
		Computation.Shape shape = Computation.shape(c);
		Computation.Tag tag = shape.getTag();
		if (tag.isExit()) {
			switch (tag) {
			case BREAK:
				return breaks;
			case CONTINUE:
				return false;
			default:
				return true;
			}
		}
		boolean inner = breaks && tag != Computation.Tag.FOR;
		for (Computation child : shape.getChildren()) {
			if (exits(child, inner)) {
				return true;
			}
		}
		return false;
	}

	private static boolean hasEffects(Computation c) {
		return contains(c, Computation.Tag.SET) || contains(c, Computation.Tag.THROW);
	}

	private static boolean contains(Computation c, Computation.Tag tag) {
		Computation.Shape shape = Computation.shape(c);
		if (shape.getTag() == tag) {
			return true;
		}
		for (Computation child : shape.getChildren()) {
			if (contains(child, tag)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * The variables in scope at some point, along with their types and whether
	 * they can be assigned.
	 */
	private static final class Environment {
		private static final Environment EMPTY = new Environment(Collections.emptyMap(), Collections.emptySet());

		private final Map<String, Type> types;
		private final Set<String> mutable;

		private Environment(Map<String, Type> types, Set<String> mutable) {
			this.types = types;
			this.mutable = mutable;
		}

		/**
		 * Check whether a given name can be introduced here, returning a
		 * description of the problem if not.
		 */
		private String canDeclare(String name) {
			if (name.isEmpty() || name.indexOf('$') >= 0 || name.indexOf('.') >= 0) {
				return "has invalid name \"" + name + "\"";
			} else if (types.containsKey(name)) {
				return name + " shadows an existing variable";
			} else {
				return null;
			}
		}

		private Environment declare(String name, Type type, boolean isMutable) {
			LinkedHashMap<String, Type> ntypes = new LinkedHashMap<>(types);
			ntypes.put(name, type);
			Set<String> nmutable = mutable;
			if (isMutable) {
				nmutable = new LinkedHashSet<>(mutable);
				nmutable.add(name);
			}
			return new Environment(ntypes, nmutable);
		}
	}
}
