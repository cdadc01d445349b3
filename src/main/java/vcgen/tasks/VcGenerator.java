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

import static vcgen.core.Logic.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import vcgen.core.Computation;
import vcgen.core.GenerationError;
import vcgen.core.GenerationException;
import vcgen.core.Goal;
import vcgen.core.Label;
import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;
import vcgen.core.Obligation;
import vcgen.core.ObligationSet;
import vcgen.core.Path;
import vcgen.core.Relation;
import vcgen.core.SiteId;
import vcgen.core.State;
import vcgen.spec.Invariant;
import vcgen.spec.InvariantChecker;
import vcgen.spec.InvariantMap;
import vcgen.util.Substitution;

/**
 * Decomposes a goal into a set of obligations by symbolic execution. Starting
 * from the precondition, every path through the computation is followed,
 * accumulating hypotheses from conditionals and updating the symbolic state.
 * Each way of leaving the computation (normal completion, <code>return</code>
 * or <code>throw</code>) gives an obligation that the goal's relation holds.
 * Loops are cut using their invariants (see {@link LoopScheme}), so the number
 * of obligations is bounded by the size of the computation rather than the
 * length of any sequence.
 *
 * <p>
 * Generation is deterministic: the same goal and invariants always give the
 * same obligations, with the same identifiers, in the same order.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class VcGenerator {
	private static final Logger LOGGER = LogManager.getLogger(VcGenerator.class);

	private boolean simplify;
	private boolean keepDischarged;
	private int maxSimplifierRounds;

	public VcGenerator() {
		this(Options.load());
	}

	public VcGenerator(Options options) {
		this.simplify = options.simplify;
		this.keepDischarged = options.keepDischarged;
		this.maxSimplifierRounds = options.maxSimplifierRounds;
	}

	/**
	 * Determine whether obligations are simplified after generation.
	 *
	 * @param flag
	 * @return
	 */
	public VcGenerator setSimplify(boolean flag) {
		this.simplify = flag;
		return this;
	}

	/**
	 * Determine whether obligations discharged by simplification are included in
	 * the result.
	 *
	 * @param flag
	 * @return
	 */
	public VcGenerator setKeepDischarged(boolean flag) {
		this.keepDischarged = flag;
		return this;
	}

	public VcGenerator setMaxSimplifierRounds(int rounds) {
		if (rounds < 1) {
			throw new IllegalArgumentException("invalid number of rounds: " + rounds);
		}
		this.maxSimplifierRounds = rounds;
		return this;
	}

	public ObligationSet generate(Goal goal, InvariantMap invariants) throws GenerationException {
		return generate(goal, invariants.asMap());
	}

	/**
	 * Generate the obligations for a given goal.
	 *
	 * @param goal       The goal to decompose.
	 * @param invariants The invariants for the sites in the goal. Every loop must
	 *                   have one, and invariants for conditionals are optional.
	 * @return
	 * @throws GenerationException if some part of the goal could not be handled.
	 *                             All such problems are reported together, along
	 *                             with the obligations for the unaffected parts.
	 */
	public ObligationSet generate(Goal goal, Map<SiteId, Invariant> invariants) throws GenerationException {
		long start = System.currentTimeMillis();
		Typing typing = Typing.check(goal);
		List<GenerationError> errors = new ArrayList<>(typing.getErrors());
		Set<SiteId> broken = new HashSet<>();
		for (Typing.Site site : typing.getSites()) {
			Invariant inv = invariants.get(site.getId());
			GenerationError error = null;
			if (inv == null && site.isLoop()) {
				error = GenerationError.missingInvariant(site.getId());
			} else if (inv != null) {
				error = InvariantChecker.check(site.getId(), inv, site.getLive(), site.getElement());
			}
			if (error != null) {
				errors.add(error);
				broken.add(site.getId());
			}
		}
		for (SiteId id : invariants.keySet()) {
			if (typing.getSite(id) == null) {
				LOGGER.warn("ignoring invariant for unknown site {}", id);
			}
		}
		List<Obligation> obligations = Collections.emptyList();
		if (typing.isValid()) {
			Generation g = new Generation(typing, invariants, broken);
			g.run();
			obligations = postprocess(g.obligations);
		}
		ObligationSet result = new ObligationSet(obligations);
		long discharged = result.discharged().size();
		LOGGER.info("generated {} obligations ({} discharged, {} errors) in {}ms", result.size(), discharged,
				errors.size(), System.currentTimeMillis() - start);
		if (!errors.isEmpty()) {
			for (GenerationError e : errors) {
				LOGGER.debug("error {}", e);
			}
			throw new GenerationException(errors, result);
		}
		return result;
	}

	private List<Obligation> postprocess(List<Obligation> obligations) {
		if (!simplify) {
			return obligations;
		}
		Simplifier simplifier = new Simplifier(maxSimplifierRounds);
		ArrayList<Obligation> result = new ArrayList<>();
		for (Obligation o : obligations) {
			Obligation s = simplifier.simplify(o);
			if (s.isDischarged()) {
				LOGGER.debug("discharged {}", s.getLabel());
				if (!keepDischarged) {
					continue;
				}
			}
			result.add(s);
		}
		return result;
	}

	/**
	 * Holds the state of a single call to generate. In particular, fresh
	 * variables are numbered from one on every call.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static final class Generation {
		private final Typing typing;
		private final Goal goal;
		private final Map<SiteId, Invariant> invariants;
		private final Set<SiteId> broken;
		private final List<Obligation> obligations = new ArrayList<>();
		private int fresh;

		private Generation(Typing typing, Map<SiteId, Invariant> invariants, Set<SiteId> broken) {
			this.typing = typing;
			this.goal = typing.getGoal();
			this.invariants = invariants;
			this.broken = broken;
		}

		private void run() {
			Context root = new Context(Path.ROOT, Collections.emptyList(), goal.initialState())
					.assume(goal.getPrecondition());
			Exits exits = new Exits(
					(c, v) -> emit(c, "result", relation(goal.getTarget(), v, c), "target holds on completion"),
					null, null,
					(c, v) -> emit(c, "return", relation(goal.getTarget(), v, c), "target holds on return"),
					(c, v) -> emit(c, "throw", relation(goal.getExceptional(), v, c), "exceptional relation holds"));
			visit(goal.getBody(), "0", root, exits);
		}

		private void visit(Computation c, String pos, Context ctx, Exits k) {
			if (typing.isInvalid(c)) {
				// Reported already
				return;
			}
			switch (c.getTag()) {
			case PURE:
				k.normal.apply(ctx, eval(((Computation.Pure) c).getValue(), ctx));
				break;
			case BIND:
				visitBind((Computation.Bind) c, pos, ctx, k);
				break;
			case GET:
				k.normal.apply(ctx, ctx.state.get(((Computation.Get) c).getVariable()));
				break;
			case SET: {
				Computation.Set s = (Computation.Set) c;
				Expr value = eval(s.getValue(), ctx);
				k.normal.apply(ctx.with(ctx.state.put(s.getVariable(), value)), UNIT);
				break;
			}
			case IF:
				visitIfElse((Computation.IfElse) c, pos, ctx, k);
				break;
			case FOR:
				visitFor((Computation.For) c, pos, ctx, k);
				break;
			case BREAK:
				k.breaks.apply(ctx, UNIT);
				break;
			case CONTINUE:
				k.continues.apply(ctx, UNIT);
				break;
			case RETURN:
				k.returns.apply(ctx, eval(((Computation.Return) c).getValue(), ctx));
				break;
			case THROW:
				k.raises.apply(ctx, eval(((Computation.Throw) c).getValue(), ctx));
				break;
			case BLOCK:
				visitBlock((Computation.Block) c, pos, ctx, k);
				break;
			case CHOICE: {
				Computation.Choice ch = (Computation.Choice) c;
				visit(ch.getLeft(), pos + ".0", ctx.decide("choice@" + pos + ":left"), k);
				visit(ch.getRight(), pos + ".1", ctx.decide("choice@" + pos + ":right"), k);
				break;
			}
			default:
				throw new IllegalArgumentException("unknown computation encountered (" + c.getTag() + ")");
			}
		}

		private void visitBind(Computation.Bind c, String pos, Context ctx, Exits k) {
			String binder = c.getBinder();
			visit(c.getFirst(), pos + ".0", ctx, k.withNormal((c1, v) -> {
				Context c2 = binder == null ? c1 : c1.with(c1.state.put(binder, v));
				visit(c.getRest(), pos + ".1", c2, k);
			}));
		}

		private void visitBlock(Computation.Block c, String pos, Context ctx, Exits k) {
			State state = ctx.state;
			for (Computation.Local l : c.getLocals()) {
				Expr init = new Substitution(state.bindings()).apply(l.getInitialiser());
				state = state.put(l.getName(), init);
			}
			// Locals go out of scope however the block is left
			Exits inner = k.map(c1 -> {
				State s = c1.state;
				for (Computation.Local l : c.getLocals()) {
					s = s.remove(l.getName());
				}
				return c1.with(s);
			});
			visit(c.getBody(), pos + ".0", ctx.with(state), inner);
		}

		private void visitIfElse(Computation.IfElse c, String pos, Context ctx, Exits k) {
			Expr.Logical condition = eval(c.getCondition(), ctx);
			SiteId site = c.getSite();
			if (site != null && broken.contains(site)) {
				return;
			}
			Invariant join = site == null ? null : invariants.get(site);
			String segment = site == null ? "if@" + pos : site.getName();
			Context tt = ctx.assume(condition).decide(segment + ":then");
			Context ff = ctx.assume(NOT(condition)).decide(segment + ":else");
			if (join == null) {
				visit(c.getTrueBranch(), pos + ".0", tt, k);
				visit(c.getFalseBranch(), pos + ".1", ff, k);
				return;
			}
			// Each branch establishes the join invariant, and the continuation
			// proceeds once from a state where modified variables are unknown.
			Exits branches = k.withNormal((c1, v) -> emit(c1, "join", join.apply(null, c1.state),
					"invariant of " + site + " holds after branch"));
			visit(c.getTrueBranch(), pos + ".0", tt, branches);
			visit(c.getFalseBranch(), pos + ".1", ff, branches);
			Type type = typing.getType(c);
			if (!Type.Void.equals(type)) {
				State joined = havoc(ctx.state, typing.getSite(site).getModified());
				Context after = ctx.with(joined).decide(segment + ":join").assume(join.apply(null, joined));
				Expr value = Type.Unit.equals(type) ? UNIT : fresh(site.getName());
				k.normal.apply(after, value);
			}
		}

		private void visitFor(Computation.For c, String pos, Context ctx, Exits k) {
			SiteId site = c.getSite();
			if (broken.contains(site)) {
				return;
			}
			Invariant inv = invariants.get(site);
			Set<String> modified = typing.getSite(site).getModified();
			String binder = c.getBinder();
			Expr sequence = eval(c.getSequence(), ctx);
			// (1) Establish invariant on entry
			State start = havoc(ctx.state, modified);
			LoopScheme scheme = new LoopScheme(inv, sequence, fresh("p"), fresh(binder), fresh("xs"));
			emit(ctx.decide(Label.Phase.PRE.segment(site)), "invariant", scheme.establish(ctx.state),
					"invariant of " + site + " holds on entry");
			// (2) Preserve invariant over an arbitrary iteration
			Context step = ctx.with(start.put(binder, scheme.getElement()))
					.decide(Label.Phase.STEP.segment(site)).assume(scheme.arbitrary(start));
			Continuation preserve = (c1, v) -> emit(c1, "invariant", scheme.preserve(c1.state.remove(binder)),
					"invariant of " + site + " preserved by iteration");
			Exits body = new Exits(preserve,
					(c1, v) -> k.normal.apply(
							c1.with(c1.state.remove(binder)).decide(Label.Phase.EXIT.segment(site)), UNIT),
					preserve, k.returns, k.raises);
			visit(c.getBody(), pos + ".0", step, body);
			// (3) Continue after the loop has consumed the whole sequence
			State end = havoc(ctx.state, modified);
			Context post = ctx.with(end).decide(Label.Phase.POST.segment(site)).assume(scheme.conclude(end));
			k.normal.apply(post, UNIT);
		}

		private State havoc(State state, Set<String> variables) {
			for (String var : variables) {
				if (state.contains(var)) {
					state = state.put(var, fresh(var));
				}
			}
			return state;
		}

		private Expr.VariableAccess fresh(String base) {
			return VAR(base + "$" + (++fresh));
		}

		private Expr eval(Expr e, Context ctx) {
			return new Substitution(ctx.state.bindings()).apply(e);
		}

		private Expr.Logical eval(Expr.Logical e, Context ctx) {
			return new Substitution(ctx.state.bindings()).apply(e);
		}

		private Expr.Logical relation(Relation r, Expr value, Context ctx) {
			return r.apply(value, ctx.state);
		}

		private void emit(Context ctx, String kind, Expr.Logical conclusion, String hint) {
			Label label = new Label(ctx.trace.append(kind), hint);
			Obligation o = new Obligation(label, ctx.hypotheses, conclusion);
			LOGGER.debug("obligation {}: {}", label.getStableId(), o.getProposition());
			obligations.add(o);
		}
	}

	/**
	 * What happens next along a path, given the current context and the value
	 * produced so far.
	 */
	@FunctionalInterface
	private interface Continuation {
		public void apply(Context ctx, Expr value);
	}

	/**
	 * The continuations for each way of leaving a computation. Those for
	 * <code>break</code> and <code>continue</code> are <code>null</code> outside
	 * of a loop.
	 */
	private static final class Exits {
		private final Continuation normal;
		private final Continuation breaks;
		private final Continuation continues;
		private final Continuation returns;
		private final Continuation raises;

		private Exits(Continuation normal, Continuation breaks, Continuation continues, Continuation returns,
				Continuation raises) {
			this.normal = normal;
			this.breaks = breaks;
			this.continues = continues;
			this.returns = returns;
			this.raises = raises;
		}

		private Exits withNormal(Continuation k) {
			return new Exits(k, breaks, continues, returns, raises);
		}

		private Exits map(UnaryOperator<Context> fn) {
			return new Exits(map(normal, fn), map(breaks, fn), map(continues, fn), map(returns, fn),
					map(raises, fn));
		}

		private static Continuation map(Continuation k, UnaryOperator<Context> fn) {
			return k == null ? null : (c, v) -> k.apply(fn.apply(c), v);
		}
	}

	/**
	 * A point along a path, made up of the decisions taken to reach it, the
	 * hypotheses accumulated and the current state.
	 */
	private static final class Context {
		private final Path trace;
		private final List<Expr.Logical> hypotheses;
		private final State state;

		private Context(Path trace, List<Expr.Logical> hypotheses, State state) {
			this.trace = trace;
			this.hypotheses = hypotheses;
			this.state = state;
		}

		private Context with(State s) {
			return new Context(trace, hypotheses, s);
		}

		private Context decide(String segment) {
			return new Context(trace.append(segment), hypotheses, state);
		}

		private Context assume(Expr.Logical h) {
			return assume(Collections.singletonList(h));
		}

		private Context assume(List<Expr.Logical> hs) {
			ArrayList<Expr.Logical> nhypotheses = new ArrayList<>(hypotheses);
			for (Expr.Logical h : hs) {
				if (!h.isTrue()) {
					nhypotheses.add(h);
				}
			}
			return new Context(trace, nhypotheses, state);
		}
	}

	/**
	 * Configuration for the generator. This is normally bound from a
	 * <code>vcgen.properties</code> resource on the classpath, where every key
	 * is prefixed by <code>vcgen.</code> and any missing key takes its default
	 * value.
	 *
	 * @author David J. Pearce
	 *
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static final class Options {
		public static final String RESOURCE = "vcgen.properties";
		public static final String SIMPLIFY = "vcgen.simplify";
		public static final String KEEP_DISCHARGED = "vcgen.keepDischarged";
		public static final String SIMPLIFIER_ROUNDS = "vcgen.maxSimplifierRounds";

		public static final Options DEFAULTS = new Options(true, true, 64);

		private static final JavaPropsMapper MAPPER = new JavaPropsMapper();

		private final boolean simplify;
		private final boolean keepDischarged;
		private final int maxSimplifierRounds;

		public Options(boolean simplify, boolean keepDischarged, int maxSimplifierRounds) {
			if (maxSimplifierRounds < 1) {
				throw new IllegalArgumentException("invalid number of rounds: " + maxSimplifierRounds);
			}
			this.simplify = simplify;
			this.keepDischarged = keepDischarged;
			this.maxSimplifierRounds = maxSimplifierRounds;
		}

		@JsonCreator
		public static Options bind(@JsonProperty("simplify") Boolean simplify,
				@JsonProperty("keepDischarged") Boolean keepDischarged,
				@JsonProperty("maxSimplifierRounds") Integer maxSimplifierRounds) {
			return new Options(simplify != null ? simplify : DEFAULTS.simplify,
					keepDischarged != null ? keepDischarged : DEFAULTS.keepDischarged,
					maxSimplifierRounds != null ? maxSimplifierRounds : DEFAULTS.maxSimplifierRounds);
		}

		public boolean isSimplify() {
			return simplify;
		}

		public boolean isKeepDischarged() {
			return keepDischarged;
		}

		public int getMaxSimplifierRounds() {
			return maxSimplifierRounds;
		}

		/**
		 * Load options from the classpath, falling back to the defaults when no
		 * resource is present.
		 *
		 * @return
		 * @throws IllegalArgumentException if the resource holds an invalid value.
		 */
		public static Options load() {
			try (InputStream in = VcGenerator.class.getClassLoader().getResourceAsStream(RESOURCE)) {
				if (in == null) {
					LOGGER.debug("no {} found, using defaults", RESOURCE);
					return DEFAULTS;
				}
				return MAPPER.readValue(in, Resource.class).get();
			} catch (JsonProcessingException e) {
				throw new IllegalArgumentException("invalid configuration in " + RESOURCE, e);
			} catch (IOException e) {
				throw new UncheckedIOException("cannot read " + RESOURCE, e);
			}
		}

		/**
		 * Bind options from a given set of properties.
		 *
		 * @param properties
		 * @return
		 * @throws IllegalArgumentException if a property has an invalid value.
		 */
		public static Options load(Properties properties) {
			try {
				return MAPPER.readPropertiesAs(properties, Resource.class).get();
			} catch (IOException e) {
				throw new IllegalArgumentException("invalid configuration: " + e.getMessage(), e);
			}
		}
	}

	/**
	 * The top level of the properties resource, under which all options sit.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	static final class Resource {
		@JsonProperty("vcgen")
		Options vcgen;

		private Options get() {
			return vcgen != null ? vcgen : Options.DEFAULTS;
		}
	}
}
