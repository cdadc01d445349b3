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
package vcgen.spec;

import java.util.Objects;
import java.util.function.Function;

import vcgen.core.Cursor;
import vcgen.core.Logic.Expr;
import vcgen.core.State;

/**
 * A proposition attached to a site in a computation. For a loop this relates
 * how far iteration has progressed (the cursor) to the state at that point.
 * For example, the following invariant holds for a loop summing a sequence
 * into <code>out</code>:
 *
 * <pre>
 * Invariant.loop("out is sum of prefix", (c, s) -&gt; EQ(SUM(c.prefix()), s.get("out")));
 * </pre>
 *
 * An invariant is a function rather than a fixed proposition, since it must be
 * instantiated at several different cursors and states.
 *
 * @author David J. Pearce
 *
 */
public final class Invariant {

	@FunctionalInterface
	public interface Body {
		public Expr.Logical apply(Cursor cursor, State state);
	}

	private final String description;
	private final boolean readsCursor;
	private final Body body;

	private Invariant(String description, boolean readsCursor, Body body) {
		this.description = Objects.requireNonNull(description);
		this.readsCursor = readsCursor;
		this.body = Objects.requireNonNull(body);
	}

	/**
	 * Construct an invariant over both the loop cursor and the state.
	 *
	 * @param description
	 * @param body
	 * @return
	 */
	public static Invariant loop(String description, Body body) {
		return new Invariant(description, true, body);
	}

	/**
	 * Construct an invariant over the state alone. This can be attached to any
	 * site.
	 *
	 * @param description
	 * @param body
	 * @return
	 */
	public static Invariant state(String description, Function<State, Expr.Logical> body) {
		return new Invariant(description, false, (c, s) -> body.apply(s));
	}

	public String getDescription() {
		return description;
	}

	public boolean readsCursor() {
		return readsCursor;
	}

	/**
	 * Instantiate this invariant.
	 *
	 * @param cursor The cursor, which may be <code>null</code> only if this
	 *               invariant does not read it.
	 * @param state
	 * @return
	 */
	public Expr.Logical apply(Cursor cursor, State state) {
		if (readsCursor && cursor == null) {
			throw new IllegalStateException("invariant \"" + description + "\" requires a cursor");
		}
		return body.apply(cursor, state);
	}

	@Override
	public String toString() {
		return description;
	}
}
