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

import static vcgen.core.Logic.APPEND;
import static vcgen.core.Logic.SEQ;

import java.util.List;
import java.util.Objects;

import vcgen.core.Logic.Expr;

/**
 * Tracks the progress of a loop over a sequence by splitting that sequence into
 * a <i>prefix</i> of elements already processed and a <i>suffix</i> of elements
 * still to come. Both halves are sequence-valued expressions, so a cursor can
 * describe a concrete point in the iteration (e.g. <code>([1], [2,3])</code>)
 * or an arbitrary one (e.g. <code>(p, [x] ++ xs)</code>). At every point
 * <code>prefix ++ suffix</code> equals the sequence being iterated.
 *
 * @author David J. Pearce
 *
 */
public final class Cursor {
	private final Expr prefix;
	private final Expr suffix;

	private Cursor(Expr prefix, Expr suffix) {
		this.prefix = Objects.requireNonNull(prefix);
		this.suffix = Objects.requireNonNull(suffix);
	}

	/**
	 * Construct the cursor positioned before the first element of a given
	 * sequence.
	 *
	 * @param sequence
	 * @return
	 */
	public static Cursor initial(Expr sequence) {
		return new Cursor(SEQ(), sequence);
	}

	/**
	 * Construct the cursor positioned after the last element of a given sequence.
	 *
	 * @param sequence
	 * @return
	 */
	public static Cursor terminal(Expr sequence) {
		return new Cursor(sequence, SEQ());
	}

	/**
	 * Construct a cursor at an arbitrary position. The caller is responsible for
	 * ensuring <code>prefix ++ suffix</code> is the sequence in question.
	 *
	 * @param prefix
	 * @param suffix
	 * @return
	 */
	public static Cursor of(Expr prefix, Expr suffix) {
		return new Cursor(prefix, suffix);
	}

	public Expr prefix() {
		return prefix;
	}

	public Expr suffix() {
		return suffix;
	}

	/**
	 * Check whether the suffix is known to be empty.
	 *
	 * @return
	 */
	public boolean isExhausted() {
		return suffix instanceof Expr.Sequence && ((Expr.Sequence) suffix).isEmpty();
	}

	/**
	 * Check whether the suffix is known to be non-empty, meaning it has a
	 * recognisable head element.
	 *
	 * @return
	 */
	public boolean canStep() {
		return head(suffix) != null;
	}

	/**
	 * Get the next element to be processed.
	 *
	 * @return
	 */
	public Expr head() {
		Expr h = head(suffix);
		if (h == null) {
			throw new IllegalStateException("cursor suffix has no head: " + suffix);
		}
		return h;
	}

	/**
	 * Move the head of the suffix onto the end of the prefix. This is only valid
	 * when the suffix is known to be non-empty.
	 *
	 * @return
	 */
	public Cursor step() {
		Expr h = head();
		return new Cursor(APPEND(prefix, SEQ(h)), tail(suffix));
	}

	/**
	 * Apply <code>step()</code> a given number of times.
	 *
	 * @param n
	 * @return
	 * @throws IllegalArgumentException if <code>n</code> is negative.
	 */
	public Cursor step(int n) {
		if (n < 0) {
			throw new IllegalArgumentException("negative number of steps: " + n);
		}
		Cursor c = this;
		for (int i = 0; i != n; ++i) {
			c = c.step();
		}
		return c;
	}

	/**
	 * Reconstruct the sequence being iterated, i.e. <code>prefix ++ suffix</code>.
	 *
	 * @return
	 */
	public Expr whole() {
		return APPEND(prefix, suffix);
	}

	private static Expr head(Expr suffix) {
		if (suffix instanceof Expr.Sequence) {
			Expr.Sequence s = (Expr.Sequence) suffix;
			return s.isEmpty() ? null : s.get(0);
		} else if (suffix instanceof Expr.Append) {
			Expr lhs = ((Expr.Append) suffix).getLeftHandSide();
			return head(lhs);
		} else {
			return null;
		}
	}

	private static Expr tail(Expr suffix) {
		if (suffix instanceof Expr.Sequence) {
			List<Expr> items = ((Expr.Sequence) suffix).getOperands();
			return SEQ(items.subList(1, items.size()));
		} else {
			Expr.Append a = (Expr.Append) suffix;
			return APPEND(tail(a.getLeftHandSide()), a.getRightHandSide());
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Cursor) {
			Cursor c = (Cursor) o;
			return prefix.equals(c.prefix) && suffix.equals(c.suffix);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return prefix.hashCode() * 31 + suffix.hashCode();
	}

	@Override
	public String toString() {
		return "(" + prefix + ", " + suffix + ")";
	}
}
