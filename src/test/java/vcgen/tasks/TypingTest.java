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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static vcgen.core.Computation.*;
import static vcgen.core.Logic.*;
import static vcgen.tasks.Goals.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import vcgen.core.Computation;
import vcgen.core.GenerationError;
import vcgen.core.Goal;
import vcgen.core.Logic.Type;
import vcgen.core.Relation;

/**
 * Tests for well-formedness checking of goals.
 *
 * @author David J. Pearce
 *
 */
public class TypingTest {

	private static Goal goal(Computation body) {
		return Goal.builder().parameter("n", Type.Int).parameter("xs", SEQUENCE(Type.Int)).body(body)
				.ensures(Relation.TRUE).build();
	}

	private static void assertUnsupported(Typing typing, Computation node) {
		assertEquals(typing.getErrors().toString(), 1, typing.getErrors().size());
		GenerationError error = typing.getErrors().get(0);
		assertEquals(GenerationError.Kind.UNSUPPORTED_CONSTRUCT, error.getKind());
		assertTrue(error.getNode() == node);
		assertTrue(typing.isInvalid(node));
	}

	@Test
	public void valid_01() {
		Typing typing = Typing.check(sumOf(SEQ(1, 2), 3));
		assertTrue(typing.getErrors().isEmpty());
		assertTrue(typing.isValid());
		assertEquals(Type.Int, typing.getResultType());
	}

	@Test
	public void valid_02() {
		// The loop binder is not live at the loop itself
		Typing typing = Typing.check(sumOf(SEQ(1, 2), 3));
		Typing.Site site = typing.getSite(SUM);
		assertTrue(site.isLoop());
		assertEquals(Arrays.asList("out"), Arrays.asList(site.getLive().keySet().toArray()));
		assertEquals(Type.Int, site.getElement());
		assertEquals(Collections.singleton("out"), site.getModified());
	}

	@Test
	public void valid_03() {
		Typing typing = Typing.check(join());
		Typing.Site site = typing.getSite(JOIN);
		assertFalse(site.isLoop());
		assertNull(site.getElement());
		assertEquals(Type.Int, site.getLive().get("n"));
		assertEquals(Collections.singleton("x"), site.getModified());
	}

	@Test
	public void valid_04() {
		// Modified variables exclude those declared in the body
		Computation body = BLOCK(LOCAL("t", Type.Int, VAR("x")), SET("t", ADD(VAR("t"), CONST(1))));
		Typing typing = Typing.check(goal(FOR(SUM, "x", VAR("xs"), body)));
		assertTrue(typing.getErrors().isEmpty());
		assertTrue(typing.getSite(SUM).getModified().isEmpty());
	}

	@Test
	public void valid_05() {
		// Break within nested loop does not leave the outer loop
		Computation inner = FOR(INNER, "y", VAR("xs"), CHOICE(SET("n", VAR("y")), BREAK()));
		Typing typing = Typing.check(goal(FOR(OUTER, "x", VAR("xs"), SET("n", VAR("x")))));
		assertTrue(typing.getErrors().isEmpty());
		typing = Typing.check(goal(FOR(OUTER, "x", VAR("xs"), SEQUENCE(inner, CHOICE(SET("n", CONST(0)), PURE(UNIT))))));
		// Only the inner loop mixes exits, effects and choice
		assertEquals(1, typing.getErrors().size());
		assertTrue(typing.getErrors().get(0).getNode() == typing.getSite(INNER).getNode());
	}

	@Test
	public void invalid_break() {
		Computation c = BREAK();
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_continue() {
		Computation c = CONTINUE();
		assertUnsupported(Typing.check(goal(SEQUENCE(c, PURE(CONST(1))))), c);
	}

	@Test
	public void invalid_shadow() {
		Computation c = BLOCK(LOCAL("n", Type.Int, CONST(0)), GET("n"));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_shadow_binder() {
		Computation c = BIND(PURE(CONST(1)), "xs", GET("xs"));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_reserved() {
		Computation c = BIND(PURE(CONST(1)), "y$1", PURE(UNIT));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_duplicate_site() {
		Computation second = FOR(SUM, "y", VAR("xs"), PURE(UNIT));
		Computation c = SEQUENCE(FOR(SUM, "x", VAR("xs"), PURE(UNIT)), second);
		assertUnsupported(Typing.check(goal(c)), second);
	}

	@Test
	public void invalid_assign_immutable() {
		Computation c = SET("x", CONST(1));
		assertUnsupported(Typing.check(goal(FOR(SUM, "x", VAR("xs"), c))), c);
	}

	@Test
	public void invalid_assign_type() {
		Computation c = SET("n", CONST(true));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_unknown_variable() {
		Computation c = GET("m");
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_expression() {
		Computation c = PURE(ADD(VAR("n"), VAR("xs")));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_iteration() {
		Computation c = FOR(SUM, "x", VAR("n"), PURE(UNIT));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_branches() {
		Computation c = IF(GT(VAR("n"), CONST(0)), PURE(CONST(1)), PURE(CONST(true)));
		assertUnsupported(Typing.check(goal(c)), c);
	}

	@Test
	public void invalid_return() {
		Computation c = RETURN(CONST(true));
		Goal g = Goal.builder().body(SEQUENCE(c, PURE(CONST(1)))).returns(Type.Int).ensures(Relation.TRUE).build();
		assertUnsupported(Typing.check(g), c);
	}

	@Test
	public void invalid_precondition() {
		Goal g = Goal.builder().parameter("n", Type.Int).requires(EQ(VAR("n"), CONST(true))).body(PURE(UNIT))
				.ensures(Relation.TRUE).build();
		Typing typing = Typing.check(g);
		assertFalse(typing.isValid());
		assertEquals(1, typing.getErrors().size());
	}

	@Test
	public void invalid_target() {
		Goal g = Goal.builder().body(PURE(CONST(1))).ensures((v, s) -> EQ(v, CONST(false))).build();
		Typing typing = Typing.check(g);
		assertFalse(typing.isValid());
		assertEquals(GenerationError.Kind.UNSUPPORTED_CONSTRUCT, typing.getErrors().get(0).getKind());
	}

	@Test
	public void invalid_target_state() {
		Goal g = Goal.builder().body(PURE(CONST(1))).ensures((v, s) -> EQ(v, s.get("out"))).build();
		assertFalse(Typing.check(g).isValid());
	}
}
