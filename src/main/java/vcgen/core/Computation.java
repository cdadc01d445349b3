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
package vcgen.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;

/**
 * A description of an effectful computation in an imperative style. This is
 * pure data: nothing here says how a computation runs, only how it is built.
 * The set of constructs is closed and every node exposes its {@link Tag}, so
 * that clients recurse over computations by switching on the tag rather than
 * testing for concrete classes.
 *
 * @author David J. Pearce
 *
 */
public interface Computation {

	/**
	 * The kinds of computation. Early exits (<code>BREAK</code>,
	 * <code>CONTINUE</code>, <code>RETURN</code> and <code>THROW</code>) are
	 * distinguished from normal completion.
	 */
	public enum Tag {
		PURE, BIND, GET, SET, IF, FOR, BREAK, CONTINUE, RETURN, THROW, BLOCK, CHOICE;

		public boolean isExit() {
			return this == BREAK || this == CONTINUE || this == RETURN || this == THROW;
		}
	}

	public Tag getTag();

	/**
	 * Get the immediate subcomputations of this computation, in a fixed order.
	 *
	 * @return
	 */
	public List<Computation> getChildren();

	/**
	 * The tag and children of a computation, as used for structural recursion.
	 */
	public static final class Shape {
		private final Tag tag;
		private final List<Computation> children;

		private Shape(Tag tag, List<Computation> children) {
			this.tag = tag;
			this.children = children;
		}

		public Tag getTag() {
			return tag;
		}

		public List<Computation> getChildren() {
			return children;
		}

		@Override
		public String toString() {
			return tag + "/" + children.size();
		}
	}

	public static abstract class AbstractComputation implements Computation {
		private final Tag tag;

		private AbstractComputation(Tag tag) {
			this.tag = tag;
		}

		@Override
		public Tag getTag() {
			return tag;
		}

		@Override
		public List<Computation> getChildren() {
			return Collections.emptyList();
		}

		@Override
		public String toString() {
			return tag.toString();
		}
	}

	/**
	 * Completes normally with a given value.
	 */
	public static class Pure extends AbstractComputation {
		private final Expr value;

		private Pure(Expr value) {
			super(Tag.PURE);
			this.value = Objects.requireNonNull(value);
		}

		public Expr getValue() {
			return value;
		}
	}

	/**
	 * Runs one computation and then another, optionally binding the value of the
	 * first to an (immutable) name visible in the second.
	 */
	public static class Bind extends AbstractComputation {
		private final Computation first;
		private final String binder;
		private final Computation rest;

		private Bind(Computation first, String binder, Computation rest) {
			super(Tag.BIND);
			this.first = Objects.requireNonNull(first);
			this.binder = binder;
			this.rest = Objects.requireNonNull(rest);
		}

		public Computation getFirst() {
			return first;
		}

		/**
		 * Get the name bound to the value of the first computation, or
		 * <code>null</code> if that value is discarded.
		 *
		 * @return
		 */
		public String getBinder() {
			return binder;
		}

		public Computation getRest() {
			return rest;
		}

		@Override
		public List<Computation> getChildren() {
			return Arrays.asList(first, rest);
		}
	}

	public static class Get extends AbstractComputation {
		private final String variable;

		private Get(String variable) {
			super(Tag.GET);
			this.variable = Objects.requireNonNull(variable);
		}

		public String getVariable() {
			return variable;
		}
	}

	public static class Set extends AbstractComputation {
		private final String variable;
		private final Expr value;

		private Set(String variable, Expr value) {
			super(Tag.SET);
			this.variable = Objects.requireNonNull(variable);
			this.value = Objects.requireNonNull(value);
		}

		public String getVariable() {
			return variable;
		}

		public Expr getValue() {
			return value;
		}
	}

	public static class IfElse extends AbstractComputation {
		private final SiteId site;
		private final Expr.Logical condition;
		private final Computation trueBranch;
		private final Computation falseBranch;

		private IfElse(SiteId site, Expr.Logical condition, Computation trueBranch, Computation falseBranch) {
			super(Tag.IF);
			this.site = site;
			this.condition = Objects.requireNonNull(condition);
			this.trueBranch = Objects.requireNonNull(trueBranch);
			this.falseBranch = Objects.requireNonNull(falseBranch);
		}

		/**
		 * Get the site of this conditional, or <code>null</code> if it has none. An
		 * invariant attached to this site acts as a join point after both branches.
		 *
		 * @return
		 */
		public SiteId getSite() {
			return site;
		}

		public Expr.Logical getCondition() {
			return condition;
		}

		public Computation getTrueBranch() {
			return trueBranch;
		}

		public Computation getFalseBranch() {
			return falseBranch;
		}

		@Override
		public List<Computation> getChildren() {
			return Arrays.asList(trueBranch, falseBranch);
		}

		@Override
		public String toString() {
			return site == null ? "IF" : "IF@" + site;
		}
	}

	/**
	 * Runs a body once for each element of a sequence, in order, with the
	 * element bound to a given name.
	 */
	public static class For extends AbstractComputation {
		private final SiteId site;
		private final String binder;
		private final Expr sequence;
		private final Computation body;

		private For(SiteId site, String binder, Expr sequence, Computation body) {
			super(Tag.FOR);
			this.site = Objects.requireNonNull(site);
			this.binder = Objects.requireNonNull(binder);
			this.sequence = Objects.requireNonNull(sequence);
			this.body = Objects.requireNonNull(body);
		}

		public SiteId getSite() {
			return site;
		}

		public String getBinder() {
			return binder;
		}

		public Expr getSequence() {
			return sequence;
		}

		public Computation getBody() {
			return body;
		}

		@Override
		public List<Computation> getChildren() {
			return Collections.singletonList(body);
		}

		@Override
		public String toString() {
			return "FOR@" + site;
		}
	}

	/**
	 * Leaves the innermost enclosing loop.
	 */
	public static class Break extends AbstractComputation {
		private Break() {
			super(Tag.BREAK);
		}
	}

	/**
	 * Ends the current iteration of the innermost enclosing loop.
	 */
	public static class Continue extends AbstractComputation {
		private Continue() {
			super(Tag.CONTINUE);
		}
	}

	/**
	 * Leaves the entire computation with a given value.
	 */
	public static class Return extends AbstractComputation {
		private final Expr value;

		private Return(Expr value) {
			super(Tag.RETURN);
			this.value = Objects.requireNonNull(value);
		}

		public Expr getValue() {
			return value;
		}
	}

	/**
	 * Leaves the entire computation exceptionally with a given value.
	 */
	public static class Throw extends AbstractComputation {
		private final Expr value;

		private Throw(Expr value) {
			super(Tag.THROW);
			this.value = Objects.requireNonNull(value);
		}

		public Expr getValue() {
			return value;
		}
	}

	/**
	 * A nested block declaring zero or more mutable local variables. These are
	 * visible only within the block.
	 */
	public static class Block extends AbstractComputation {
		private final List<Local> locals;
		private final Computation body;

		private Block(List<Local> locals, Computation body) {
			super(Tag.BLOCK);
			this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
			this.body = Objects.requireNonNull(body);
		}

		public List<Local> getLocals() {
			return locals;
		}

		public Computation getBody() {
			return body;
		}

		@Override
		public List<Computation> getChildren() {
			return Collections.singletonList(body);
		}
	}

	/**
	 * Nondeterministically runs one of two computations.
	 */
	public static class Choice extends AbstractComputation {
		private final Computation left;
		private final Computation right;

		private Choice(Computation left, Computation right) {
			super(Tag.CHOICE);
			this.left = Objects.requireNonNull(left);
			this.right = Objects.requireNonNull(right);
		}

		public Computation getLeft() {
			return left;
		}

		public Computation getRight() {
			return right;
		}

		@Override
		public List<Computation> getChildren() {
			return Arrays.asList(left, right);
		}
	}

	/**
	 * A mutable local variable declared by a block, along with its initial value.
	 */
	public static final class Local {
		private final String name;
		private final Type type;
		private final Expr initialiser;

		public Local(String name, Type type, Expr initialiser) {
			this.name = Objects.requireNonNull(name);
			this.type = Objects.requireNonNull(type);
			this.initialiser = Objects.requireNonNull(initialiser);
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		public Expr getInitialiser() {
			return initialiser;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Shape shape(Computation c) {
		return new Shape(c.getTag(), c.getChildren());
	}

	public static Computation PURE(Expr value) {
		return new Pure(value);
	}

	public static Computation BIND(Computation first, String binder, Computation rest) {
		return new Bind(first, binder, rest);
	}

	/**
	 * Sequence zero or more computations, discarding all values except that of the
	 * last. The empty sequence is <code>PURE(UNIT)</code>.
	 *
	 * @param items
	 * @return
	 */
	public static Computation SEQUENCE(Computation... items) {
		if (items.length == 0) {
			return PURE(Logic.UNIT);
		}
		Computation r = items[items.length - 1];
		for (int i = items.length - 2; i >= 0; --i) {
			r = new Bind(items[i], null, r);
		}
		return r;
	}

	public static Computation GET(String variable) {
		return new Get(variable);
	}

	public static Computation SET(String variable, Expr value) {
		return new Set(variable, value);
	}

	public static Computation IF(Expr.Logical condition, Computation trueBranch, Computation falseBranch) {
		return new IfElse(null, condition, trueBranch, falseBranch);
	}

	public static Computation IF(Expr.Logical condition, Computation trueBranch) {
		return new IfElse(null, condition, trueBranch, PURE(Logic.UNIT));
	}

	public static Computation IF(SiteId site, Expr.Logical condition, Computation trueBranch,
			Computation falseBranch) {
		return new IfElse(Objects.requireNonNull(site), condition, trueBranch, falseBranch);
	}

	public static Computation FOR(SiteId site, String binder, Expr sequence, Computation body) {
		return new For(site, binder, sequence, body);
	}

	public static Computation BREAK() {
		return new Break();
	}

	public static Computation CONTINUE() {
		return new Continue();
	}

	public static Computation RETURN(Expr value) {
		return new Return(value);
	}

	public static Computation THROW(Expr value) {
		return new Throw(value);
	}

	public static Computation BLOCK(List<Local> locals, Computation body) {
		return new Block(locals, body);
	}

	public static Computation BLOCK(Local local, Computation body) {
		return new Block(Collections.singletonList(local), body);
	}

	public static Local LOCAL(String name, Type type, Expr initialiser) {
		return new Local(name, type, initialiser);
	}

	public static Computation CHOICE(Computation left, Computation right) {
		return new Choice(left, right);
	}
}
