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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static vcgen.core.Logic.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import vcgen.core.GenerationError;
import vcgen.core.Logic.Type;
import vcgen.core.SiteId;

/**
 * Tests for checking invariants against the variables live at their site.
 *
 * @author David J. Pearce
 *
 */
public class InvariantCheckerTest {
	private static final SiteId SITE = SiteId.of("site");

	private static Map<String, Type> live() {
		Map<String, Type> live = new LinkedHashMap<>();
		live.put("n", Type.Int);
		live.put("b", Type.Bool);
		live.put("xs", SEQUENCE(Type.Int));
		return live;
	}

	private static void assertKind(GenerationError.Kind kind, GenerationError error) {
		assertTrue("expected error", error != null);
		assertEquals(kind, error.getKind());
		assertEquals(SITE, error.getSite());
	}

	@Test
	public void valid_01() {
		Invariant inv = Invariant.loop("prefix bounded", (c, s) -> LTEQ(LENGTH(c.prefix()), LENGTH(s.get("xs"))));
		assertNull(InvariantChecker.check(SITE, inv, live(), Type.Int));
	}

	@Test
	public void valid_02() {
		Invariant inv = Invariant.state("state only", s -> AND(s.getLogical("b"), GT(s.get("n"), CONST(0))));
		assertNull(InvariantChecker.check(SITE, inv, live(), Type.Int));
		assertNull(InvariantChecker.check(SITE, inv, live(), null));
	}

	@Test
	public void valid_03() {
		// Elements of the cursor have the element type
		Invariant inv = Invariant.loop("elements", (c, s) -> GTEQ(SUM(APPEND(c.prefix(), c.suffix())), CONST(0)));
		assertNull(InvariantChecker.check(SITE, inv, live(), Type.Int));
	}

	@Test
	public void mismatch_unknown() {
		Invariant inv = Invariant.state("unknown", s -> GT(s.get("m"), CONST(0)));
		assertKind(GenerationError.Kind.TYPE_MISMATCH_INVARIANT, InvariantChecker.check(SITE, inv, live(), null));
	}

	@Test
	public void mismatch_operand() {
		Invariant inv = Invariant.state("operand", s -> GT(s.get("b"), CONST(0)));
		assertKind(GenerationError.Kind.TYPE_MISMATCH_INVARIANT, InvariantChecker.check(SITE, inv, live(), null));
	}

	@Test
	public void mismatch_element() {
		// A sequence of booleans cannot be summed
		Invariant inv = Invariant.loop("sum", (c, s) -> GTEQ(SUM(c.prefix()), CONST(0)));
		assertKind(GenerationError.Kind.TYPE_MISMATCH_INVARIANT,
				InvariantChecker.check(SITE, inv, live(), Type.Bool));
	}

	@Test
	public void mismatch_result() {
		Invariant inv = Invariant.state("not bool", s -> INDEX(s.get("xs"), CONST(0)));
		assertKind(GenerationError.Kind.TYPE_MISMATCH_INVARIANT, InvariantChecker.check(SITE, inv, live(), null));
	}

	@Test
	public void mismatch_logical() {
		Invariant inv = Invariant.state("not logical", s -> s.getLogical("n"));
		assertKind(GenerationError.Kind.TYPE_MISMATCH_INVARIANT, InvariantChecker.check(SITE, inv, live(), null));
	}

	@Test
	public void malformed_no_loop() {
		Invariant inv = Invariant.loop("cursor", (c, s) -> GTEQ(LENGTH(c.prefix()), CONST(0)));
		assertKind(GenerationError.Kind.MALFORMED_CURSOR_USE, InvariantChecker.check(SITE, inv, live(), null));
	}

	@Test
	public void malformed_head() {
		Invariant inv = Invariant.loop("head", (c, s) -> EQ(c.head(), s.get("n")));
		assertKind(GenerationError.Kind.MALFORMED_CURSOR_USE, InvariantChecker.check(SITE, inv, live(), Type.Int));
	}

	@Test
	public void malformed_step() {
		Invariant inv = Invariant.loop("step", (c, s) -> GTEQ(LENGTH(c.step().prefix()), CONST(1)));
		assertKind(GenerationError.Kind.MALFORMED_CURSOR_USE, InvariantChecker.check(SITE, inv, live(), Type.Int));
	}
}
