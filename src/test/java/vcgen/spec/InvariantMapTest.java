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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static vcgen.core.Computation.*;
import static vcgen.core.Logic.*;

import org.junit.Test;

import vcgen.core.GenerationError;
import vcgen.core.GenerationException;
import vcgen.core.Goal;
import vcgen.core.Logic.Type;
import vcgen.core.SiteId;
import vcgen.core.State;

/**
 * Tests for attaching invariants to sites.
 *
 * @author David J. Pearce
 *
 */
public class InvariantMapTest {
	private static final SiteId LOOP = SiteId.of("loop");

	private static Goal goal() {
		return Goal.builder().parameter("xs", SEQUENCE(Type.Int))
				.body(BLOCK(LOCAL("n", Type.Int, CONST(0)),
						SEQUENCE(FOR(LOOP, "x", VAR("xs"), SET("n", ADD(VAR("n"), CONST(1)))), GET("n"))))
				.ensures((v, s) -> EQ(v, LENGTH(s.get("xs")))).build();
	}

	private static final Invariant COUNT = Invariant.loop("n counts prefix",
			(c, s) -> EQ(s.get("n"), LENGTH(c.prefix())));

	@Test
	public void attach_01() throws GenerationException {
		InvariantMap map = InvariantMap.forGoal(goal()).attach(LOOP, COUNT);
		assertSame(COUNT, map.get(LOOP));
		assertEquals(1, map.size());
		assertTrue(map.contains(LOOP));
	}

	@Test
	public void attach_02() throws GenerationException {
		// Unbound maps accept anything
		InvariantMap map = new InvariantMap().attach(SiteId.of("anywhere"), COUNT);
		assertEquals(1, map.asMap().size());
	}

	@Test
	public void attach_03() {
		// Invalid invariants are rejected eagerly
		Invariant inv = Invariant.state("unknown", s -> EQ(s.get("m"), CONST(0)));
		try {
			InvariantMap.forGoal(goal()).attach(LOOP, inv);
			fail("expected attach to fail");
		} catch (GenerationException e) {
			assertEquals(1, e.getErrors().size());
			assertEquals(GenerationError.Kind.TYPE_MISMATCH_INVARIANT, e.getErrors().get(0).getKind());
			assertTrue(e.getPartialObligations().isEmpty());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void attach_04() throws GenerationException {
		new InvariantMap().attach(LOOP, COUNT).attach(LOOP, COUNT);
	}

	@Test(expected = IllegalArgumentException.class)
	public void attach_05() throws GenerationException {
		InvariantMap.forGoal(goal()).attach(SiteId.of("missing"), COUNT);
	}

	@Test(expected = IllegalStateException.class)
	public void apply_01() {
		COUNT.apply(null, State.EMPTY);
	}
}
