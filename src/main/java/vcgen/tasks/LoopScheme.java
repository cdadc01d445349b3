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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import vcgen.core.Cursor;
import vcgen.core.Logic.Expr;
import vcgen.core.State;
import vcgen.spec.Invariant;

/**
 * Derives the propositions needed to reason about a single loop over a sequence
 * <code>S</code> with invariant <code>I</code>. Writing <code>p</code>,
 * <code>x</code> and <code>xs</code> for fresh variables, these are:
 *
 * <ul>
 * <li><b>establish</b>: <code>I(([], S), s)</code> in the state on entry.</li>
 * <li><b>arbitrary iteration</b>: assuming <code>p ++ ([x] ++ xs) == S</code>
 * and <code>I((p, [x] ++ xs), s0)</code> for a state <code>s0</code> in which
 * every variable the body modifies is unknown, running the body with
 * <code>x</code> bound must give a state <code>s1</code> with
 * <code>I((p ++ [x], xs), s1)</code>.</li>
 * <li><b>conclude</b>: after the loop, <code>I((S, []), s2)</code> may be
 * assumed for a state <code>s2</code> in which every variable the body modifies
 * is again unknown.</li>
 * </ul>
 *
 * These are sound by induction on the length of the suffix: any cursor reached
 * after <code>n</code> iterations satisfies the invariant, and every such
 * cursor can be written in the form <code>(p, [x] ++ xs)</code> except the
 * terminal one. Since <code>p</code>, <code>x</code> and <code>xs</code> are
 * unconstrained except by the hypotheses above, a proof of the arbitrary
 * iteration covers every iteration at once. A loop which exits early never
 * reaches the terminal cursor, and its exit state is handled separately.
 *
 * @author David J. Pearce
 *
 */
public final class LoopScheme {
	private final Invariant invariant;
	private final Expr sequence;
	private final Expr.VariableAccess element;
	private final Cursor cursor;

	/**
	 * Construct the scheme for a given loop.
	 *
	 * @param invariant The loop invariant.
	 * @param sequence  The (symbolic) sequence being iterated over.
	 * @param prefix    Fresh variable for the elements already processed.
	 * @param element   Fresh variable for the element being processed.
	 * @param suffix    Fresh variable for the elements after that.
	 */
	public LoopScheme(Invariant invariant, Expr sequence, Expr.VariableAccess prefix, Expr.VariableAccess element,
			Expr.VariableAccess suffix) {
		this.invariant = Objects.requireNonNull(invariant);
		this.sequence = Objects.requireNonNull(sequence);
		this.element = Objects.requireNonNull(element);
		this.cursor = Cursor.of(prefix, APPEND(SEQ(element), suffix));
	}

	/**
	 * Get the variable bound to the loop binder during an arbitrary iteration.
	 *
	 * @return
	 */
	public Expr.VariableAccess getElement() {
		return element;
	}

	/**
	 * Get the cursor at the start of an arbitrary iteration.
	 *
	 * @return
	 */
	public Cursor getCursor() {
		return cursor;
	}

	/**
	 * The proposition which must hold on entry to the loop.
	 *
	 * @param entry
	 * @return
	 */
	public Expr.Logical establish(State entry) {
		return invariant.apply(Cursor.initial(sequence), entry);
	}

	/**
	 * The hypotheses which hold at the start of an arbitrary iteration.
	 *
	 * @param start The state at the start of the iteration, where every modified
	 *              variable is unknown.
	 * @return
	 */
	public List<Expr.Logical> arbitrary(State start) {
		return Arrays.asList(EQ(cursor.whole(), sequence), invariant.apply(cursor, start));
	}

	/**
	 * The proposition which must hold at the end of an arbitrary iteration (or
	 * when it continues).
	 *
	 * @param end
	 * @return
	 */
	public Expr.Logical preserve(State end) {
		return invariant.apply(cursor.step(), end);
	}

	/**
	 * The proposition which can be assumed when the loop has consumed the whole
	 * sequence.
	 *
	 * @param exit The state after the loop, where every modified variable is
	 *             unknown.
	 * @return
	 */
	public Expr.Logical conclude(State exit) {
		return invariant.apply(Cursor.terminal(sequence), exit);
	}
}
