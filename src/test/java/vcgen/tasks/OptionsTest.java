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
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

public class OptionsTest {

	@Test
	public void load_01() {
		VcGenerator.Options o = VcGenerator.Options.load(new Properties());
		assertTrue(o.isSimplify());
		assertTrue(o.isKeepDischarged());
		assertEquals(64, o.getMaxSimplifierRounds());
	}

	@Test
	public void load_02() {
		Properties p = new Properties();
		p.setProperty(VcGenerator.Options.SIMPLIFY, "false");
		p.setProperty(VcGenerator.Options.KEEP_DISCHARGED, "false");
		p.setProperty(VcGenerator.Options.SIMPLIFIER_ROUNDS, "3");
		VcGenerator.Options o = VcGenerator.Options.load(p);
		assertFalse(o.isSimplify());
		assertFalse(o.isKeepDischarged());
		assertEquals(3, o.getMaxSimplifierRounds());
	}

	@Test
	public void load_04() {
		// Missing keys take their defaults, unknown keys are ignored
		Properties p = new Properties();
		p.setProperty(VcGenerator.Options.SIMPLIFIER_ROUNDS, "8");
		p.setProperty("vcgen.unknown", "1");
		p.setProperty("other.key", "x");
		VcGenerator.Options o = VcGenerator.Options.load(p);
		assertTrue(o.isSimplify());
		assertTrue(o.isKeepDischarged());
		assertEquals(8, o.getMaxSimplifierRounds());
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalid_04() {
		new VcGenerator.Options(true, true, 0);
	}

	@Test
	public void load_03() {
		// The bundled resource matches the defaults
		VcGenerator.Options o = VcGenerator.Options.load();
		assertTrue(o.isSimplify());
		assertTrue(o.isKeepDischarged());
		assertEquals(64, o.getMaxSimplifierRounds());
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalid_01() {
		Properties p = new Properties();
		p.setProperty(VcGenerator.Options.SIMPLIFY, "yes");
		VcGenerator.Options.load(p);
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalid_02() {
		Properties p = new Properties();
		p.setProperty(VcGenerator.Options.SIMPLIFIER_ROUNDS, "many");
		VcGenerator.Options.load(p);
	}

	@Test(expected = IllegalArgumentException.class)
	public void invalid_03() {
		Properties p = new Properties();
		p.setProperty(VcGenerator.Options.SIMPLIFIER_ROUNDS, "0");
		VcGenerator.Options.load(p);
	}
}
