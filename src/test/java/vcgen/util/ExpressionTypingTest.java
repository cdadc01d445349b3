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
import static org.junit.Assert.assertNull;
import static vcgen.core.Logic.*;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;

public class ExpressionTypingTest {

    private static Type check(Expr e) {
        Map<String, Type> env = new HashMap<>();
        env.put("n", Type.Int);
        env.put("b", Type.Bool);
        env.put("xs", SEQUENCE(Type.Int));
        env.put("xss", SEQUENCE(SEQUENCE(Type.Int)));
        return new ExpressionTyping(env).check(e);
    }

    @Test
    public void valid_01() {
        assertEquals(Type.Int, check(ADD(VAR("n"), MUL(CONST(2), NEG(VAR("n"))))));
        assertEquals(Type.Int, check(SUM(APPEND(VAR("xs"), SEQ(1, 2)))));
        assertEquals(Type.Int, check(LENGTH(VAR("xss"))));
        assertEquals(Type.Int, check(INDEX(VAR("xs"), SUB(LENGTH(VAR("xs")), CONST(1)))));
        assertEquals(Type.Unit, check(UNIT));
    }

    @Test
    public void valid_02() {
        assertEquals(Type.Bool, check(AND(VAR("b"), LT(VAR("n"), CONST(0)))));
        assertEquals(Type.Bool, check(IMPLIES(VAR("b"), EQ(VAR("xs"), SEQ()))));
        assertEquals(Type.Bool, check(NEQ(VAR("xss"), SEQ(SEQ(), VAR("xs")))));
    }

    @Test
    public void valid_03() {
        // The empty literal has no element type of its own
        assertEquals(SEQUENCE(Type.Void), check(SEQ()));
        assertEquals(SEQUENCE(Type.Int), check(APPEND(SEQ(), VAR("xs"))));
        assertEquals(SEQUENCE(SEQUENCE(Type.Int)), check(SEQ(SEQ(), SEQ(1))));
    }

    @Test
    public void unify_01() {
        assertEquals(Type.Int, ExpressionTyping.unify(Type.Void, Type.Int));
        assertEquals(SEQUENCE(Type.Bool), ExpressionTyping.unify(SEQUENCE(Type.Void), SEQUENCE(Type.Bool)));
        assertNull(ExpressionTyping.unify(Type.Int, Type.Bool));
        assertNull(ExpressionTyping.unify(SEQUENCE(Type.Int), Type.Int));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_01() {
        check(ADD(VAR("n"), VAR("b")));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_02() {
        check(SEQ(CONST(1), CONST(true)));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_03() {
        check(SUM(VAR("xss")));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_04() {
        check(EQ(VAR("xs"), VAR("n")));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_05() {
        check(LENGTH(VAR("n")));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_06() {
        check(ADD(VAR("m"), CONST(1)));
    }

    @Test(expected = ExpressionTyping.TypeError.class)
    public void invalid_07() {
        check(NOT(LT(VAR("b"), CONST(1))));
    }
}
