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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static vcgen.core.Computation.*;
import static vcgen.core.Logic.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import org.junit.Test;

import vcgen.core.Logic.Type;

/**
 * Tests for the structure of computations as seen through their shape.
 *
 * @author David J. Pearce
 *
 */
public class ComputationTest {
	private static final SiteId LOOP = SiteId.of("loop");
	private static final SiteId JOIN = SiteId.of("join");

	private static final Computation A = SET("x", CONST(1));
	private static final Computation B = GET("x");

	private static void check(Computation c, Tag tag, Computation... children) {
		Shape shape = shape(c);
		assertEquals(tag, shape.getTag());
		List<Computation> actual = shape.getChildren();
		assertEquals(children.length, actual.size());
		for (int i = 0; i != children.length; ++i) {
			assertSame(children[i], actual.get(i));
		}
	}

	@Test
	public void leaves() {
		check(PURE(UNIT), Tag.PURE);
		check(B, Tag.GET);
		check(A, Tag.SET);
		check(BREAK(), Tag.BREAK);
		check(CONTINUE(), Tag.CONTINUE);
		check(RETURN(CONST(0)), Tag.RETURN);
		check(THROW(CONST(0)), Tag.THROW);
	}

	@Test
	public void bind() {
		check(BIND(A, null, B), Tag.BIND, A, B);
		check(BIND(B, "y", A), Tag.BIND, B, A);
		// Sequencing nests to the right
		Computation c = SEQUENCE(A, B, A);
		check(c, Tag.BIND, A, ((Bind) c).getRest());
		check(((Bind) c).getRest(), Tag.BIND, B, A);
		check(SEQUENCE(), Tag.PURE);
	}

	@Test
	public void conditional() {
		// True branch first, then false branch
		check(IF(VAR("b"), A, B), Tag.IF, A, B);
		check(IF(JOIN, VAR("b"), B, A), Tag.IF, B, A);
		Computation c = IF(VAR("b"), A);
		assertEquals(Tag.PURE, shape(c).getChildren().get(1).getTag());
	}

	@Test
	public void loop() {
		check(FOR(LOOP, "x", VAR("xs"), A), Tag.FOR, A);
	}

	@Test
	public void block() {
		check(BLOCK(LOCAL("x", Type.Int, CONST(0)), A), Tag.BLOCK, A);
		check(BLOCK(Collections.<Local>emptyList(), B), Tag.BLOCK, B);
		Computation c = BLOCK(Arrays.asList(LOCAL("x", Type.Int, CONST(0)), LOCAL("y", Type.Bool, CONST(true))), A);
		assertEquals(2, ((Block) c).getLocals().size());
	}

	@Test
	public void choice() {
		check(CHOICE(A, B), Tag.CHOICE, A, B);
		check(CHOICE(B, A), Tag.CHOICE, B, A);
	}

	@Test
	public void exits() {
		EnumSet<Tag> exits = EnumSet.of(Tag.BREAK, Tag.CONTINUE, Tag.RETURN, Tag.THROW);
		for (Tag t : Tag.values()) {
			assertEquals(t.toString(), exits.contains(t), t.isExit());
		}
		assertTrue(shape(BREAK()).getTag().isExit());
		assertFalse(shape(FOR(LOOP, "x", VAR("xs"), BREAK())).getTag().isExit());
	}
}
