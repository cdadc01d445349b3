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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static vcgen.core.Logic.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;

/**
 * Tests for the smart constructors of the logic, which resolve trivial cases
 * as terms are built.
 *
 * @author David J. Pearce
 *
 */
public class LogicTest {
	private static final Expr.Logical A = VAR("a");
	private static final Expr.Logical B = VAR("b");

	@Test
	public void and_01() {
		assertEquals(CONST(true), AND(Collections.<Expr.Logical>emptyList()));
		assertEquals(A, AND(A, CONST(true)));
		assertEquals(CONST(false), AND(A, CONST(false), B));
		// Nested conjunctions are flattened
		assertEquals(AND(Arrays.asList(A, B, A)), AND(AND(A, B), A));
	}

	@Test
	public void or_01() {
		assertEquals(CONST(false), OR(Collections.<Expr.Logical>emptyList()));
		assertEquals(B, OR(CONST(false), B));
		assertEquals(CONST(true), OR(A, CONST(true)));
	}

	@Test
	public void implies_01() {
		assertEquals(CONST(true), IMPLIES(CONST(false), A));
		assertEquals(CONST(true), IMPLIES(A, CONST(true)));
		assertEquals(B, IMPLIES(CONST(true), B));
		assertEquals(NOT(A), IMPLIES(A, CONST(false)));
		assertTrue(IMPLIES(A, B) instanceof Expr.Implies);
	}

	@Test
	public void not_01() {
		assertEquals(A, NOT(NOT(A)));
		assertTrue(NOT(CONST(false)).isTrue());
		assertTrue(NOT(CONST(true)).isFalse());
	}

	@Test
	public void iff_01() {
		assertEquals(CONST(true), IFF(CONST(false), CONST(false)));
		assertEquals(CONST(false), IFF(CONST(true), CONST(false)));
		assertTrue(IFF(A, B) instanceof Expr.Iff);
	}

	@Test
	public void append_01() {
		Expr xs = VAR("xs");
		assertEquals(xs, APPEND(SEQ(), xs));
		assertEquals(xs, APPEND(xs, SEQ()));
		assertEquals(SEQ(1, 2, 3), APPEND(SEQ(1), SEQ(2, 3)));
		assertTrue(APPEND(SEQ(1), xs) instanceof Expr.Append);
	}

	@Test
	public void append_02() {
		Expr s = VAR("s");
		Expr t = VAR("t");
		// Concatenation associates to the right
		assertEquals(APPEND(s, APPEND(SEQ(1), t)), APPEND(APPEND(s, SEQ(1)), t));
		// Leading literals are merged
		assertEquals(APPEND(SEQ(1, 2), s), APPEND(SEQ(1), APPEND(SEQ(2), s)));
		assertEquals(APPEND(SEQ(1, 2, 3), s), APPEND(APPEND(SEQ(1), SEQ(2)), APPEND(SEQ(3), s)));
		assertEquals("[1, 2] ++ s", APPEND(SEQ(1), APPEND(SEQ(2), s)).toString());
		assertTrue(((Expr.Append) APPEND(APPEND(s, t), s)).getLeftHandSide() instanceof Expr.VariableAccess);
	}

	@Test
	public void equality_01() {
		assertEquals(EQ(VAR("x"), CONST(1)), EQ(VAR("x"), CONST(1)));
		assertNotEquals(EQ(VAR("x"), CONST(1)), NEQ(VAR("x"), CONST(1)));
		assertNotEquals(SEQ(1, 2), SEQ(2, 1));
		assertEquals(SEQUENCE(Type.Int), SEQUENCE(Type.Int));
		assertFalse(CONST(1).equals(CONST(2)));
	}
}
