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
package vcgen.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static vcgen.core.Logic.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.junit.Test;

import vcgen.core.Logic.Expr;

public class SubstitutionTest {

    @Test
    public void substitute_01() {
        Expr.Logical e = EQ(ADD(VAR("x"), CONST(1)), VAR("y"));
        Expr.Logical r = new Substitution("x", CONST(2)).apply(e);
        assertEquals(EQ(ADD(CONST(2), CONST(1)), VAR("y")), r);
    }

    @Test
    public void substitute_02() {
        // Substitution is simultaneous
        Map<String, Expr> mapping = new HashMap<>();
        mapping.put("x", VAR("y"));
        mapping.put("y", VAR("x"));
        Expr.Logical r = new Substitution(mapping).apply(LT(VAR("x"), VAR("y")));
        assertEquals(LT(VAR("y"), VAR("x")), r);
    }

    @Test
    public void substitute_03() {
        Expr.Logical e = AND(VAR("b"), EQ(SUM(VAR("xs")), CONST(0)));
        Expr.Logical r = new Substitution("b", CONST(true)).apply(e);
        assertEquals(EQ(SUM(VAR("xs")), CONST(0)), r);
        assertSame(e, new Substitution("z", CONST(0)).apply(e));
    }

    @Test
    public void substitute_04() {
        Expr r = new Substitution("xs", SEQ(1, 2)).apply(APPEND(VAR("xs"), VAR("ys")));
        assertEquals(APPEND(SEQ(1, 2), VAR("ys")), r);
    }

    @Test(expected = IllegalArgumentException.class)
    public void substitute_05() {
        // A term cannot replace a variable used as a proposition
        new Substitution("b", CONST(1)).apply(AND(VAR("b"), VAR("c")));
    }

    @Test
    public void free_01() {
        Set<String> vars = FreeVariables.of(IMPLIES(LT(VAR("x"), LENGTH(VAR("xs"))), EQ(INDEX(VAR("xs"), VAR("x")), VAR("y"))));
        assertEquals(new TreeSet<>(Arrays.asList("x", "xs", "y")), vars);
        assertTrue(FreeVariables.of(ADD(CONST(1), CONST(2))).isEmpty());
    }
}
