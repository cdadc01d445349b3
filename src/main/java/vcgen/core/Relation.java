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

import vcgen.core.Logic.Expr;

/**
 * Relates the value produced by a computation to the state it finishes in. A
 * goal uses one relation for normal completion (and <code>return</code>) and
 * another for exceptional completion.
 *
 * @author David J. Pearce
 *
 */
@FunctionalInterface
public interface Relation {
	/**
	 * The relation which never holds. Using this for exceptional completion
	 * requires every <code>throw</code> to be unreachable.
	 */
	public static final Relation FALSE = (value, state) -> Logic.CONST(false);

	/**
	 * The relation which always holds.
	 */
	public static final Relation TRUE = (value, state) -> Logic.CONST(true);

	public Expr.Logical apply(Expr value, State state);
}
