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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import vcgen.core.Logic;
import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;

/**
 * Determines the type of an expression with respect to an environment of typed
 * variables. The empty sequence literal has type <code>seq&lt;void&gt;</code>,
 * which is compatible with every sequence type.
 */
public class ExpressionTyping extends AbstractExpressionVisitor<Type, Type> {
    private final Map<String, Type> environment;

    public ExpressionTyping(Map<String, ? extends Type> environment) {
        this.environment = new HashMap<>(environment);
    }

    /**
     * Determine the type of a given expression.
     *
     * @param expr
     * @return
     * @throws TypeError if the expression is ill-typed.
     */
    public Type check(Expr expr) {
        return visitExpression(expr);
    }

    /**
     * Find the most precise type compatible with both arguments, or
     * <code>null</code> if they are incompatible. For example, unifying
     * <code>void</code> with <code>int</code> gives <code>int</code>.
     *
     * @param lhs
     * @param rhs
     * @return
     */
    public static Type unify(Type lhs, Type rhs) {
        if (lhs.equals(rhs)) {
            return lhs;
        } else if (lhs.equals(Type.Void)) {
            return rhs;
        } else if (rhs.equals(Type.Void)) {
            return lhs;
        } else if (lhs instanceof Type.Sequence && rhs instanceof Type.Sequence) {
            Type element = unify(((Type.Sequence) lhs).getElement(), ((Type.Sequence) rhs).getElement());
            return element == null ? null : Logic.SEQUENCE(element);
        } else {
            return null;
        }
    }

    @Override
    protected Type constructInteger(Expr.Integer expr) {
        return Type.Int;
    }

    @Override
    protected Type constructUnit(Expr.Unit expr) {
        return Type.Unit;
    }

    @Override
    protected Type constructBoolean(Expr.Boolean expr) {
        return Type.Bool;
    }

    @Override
    protected Type constructVariableAccess(Expr.VariableAccess expr) {
        Type t = environment.get(expr.getVariable());
        if (t == null) {
            throw new TypeError("unknown variable " + expr.getVariable());
        }
        return t;
    }

    @Override
    protected Type constructNegation(Expr.Negation expr, Type operand) {
        return expect(expr, Type.Int, operand);
    }

    @Override
    protected Type constructAddition(Expr.Addition expr, Type lhs, Type rhs) {
        return arithmetic(expr, lhs, rhs);
    }

    @Override
    protected Type constructSubtraction(Expr.Subtraction expr, Type lhs, Type rhs) {
        return arithmetic(expr, lhs, rhs);
    }

    @Override
    protected Type constructMultiplication(Expr.Multiplication expr, Type lhs, Type rhs) {
        return arithmetic(expr, lhs, rhs);
    }

    @Override
    protected Type constructSequence(Expr.Sequence expr, List<Type> operands) {
        Type element = Type.Void;
        for (Type t : operands) {
            Type u = unify(element, t);
            if (u == null) {
                throw new TypeError("inconsistent elements in " + expr + ": " + element + " and " + t);
            }
            element = u;
        }
        return Logic.SEQUENCE(element);
    }

    @Override
    protected Type constructAppend(Expr.Append expr, Type lhs, Type rhs) {
        sequence(expr, lhs);
        sequence(expr, rhs);
        Type t = unify(lhs, rhs);
        if (t == null) {
            throw new TypeError("cannot append " + lhs + " and " + rhs + " in " + expr);
        }
        return t;
    }

    @Override
    protected Type constructLength(Expr.Length expr, Type operand) {
        sequence(expr, operand);
        return Type.Int;
    }

    @Override
    protected Type constructSum(Expr.Sum expr, Type operand) {
        Type element = sequence(expr, operand);
        expect(expr, Type.Int, element);
        return Type.Int;
    }

    @Override
    protected Type constructIndex(Expr.Index expr, Type source, Type index) {
        Type element = sequence(expr, source);
        expect(expr, Type.Int, index);
        return element;
    }

    @Override
    protected Type constructEquals(Expr.Equals expr, Type lhs, Type rhs) {
        return comparable(expr, lhs, rhs);
    }

    @Override
    protected Type constructNotEquals(Expr.NotEquals expr, Type lhs, Type rhs) {
        return comparable(expr, lhs, rhs);
    }

    @Override
    protected Type constructLessThan(Expr.LessThan expr, Type lhs, Type rhs) {
        return ordered(expr, lhs, rhs);
    }

    @Override
    protected Type constructLessThanOrEqual(Expr.LessThanOrEqual expr, Type lhs, Type rhs) {
        return ordered(expr, lhs, rhs);
    }

    @Override
    protected Type constructGreaterThan(Expr.GreaterThan expr, Type lhs, Type rhs) {
        return ordered(expr, lhs, rhs);
    }

    @Override
    protected Type constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Type lhs, Type rhs) {
        return ordered(expr, lhs, rhs);
    }

    @Override
    protected Type constructLogicalAnd(Expr.LogicalAnd expr, List<Type> operands) {
        for (Type t : operands) {
            expect(expr, Type.Bool, t);
        }
        return Type.Bool;
    }

    @Override
    protected Type constructLogicalOr(Expr.LogicalOr expr, List<Type> operands) {
        for (Type t : operands) {
            expect(expr, Type.Bool, t);
        }
        return Type.Bool;
    }

    @Override
    protected Type constructLogicalImplication(Expr.Implies expr, Type lhs, Type rhs) {
        expect(expr, Type.Bool, lhs);
        return expect(expr, Type.Bool, rhs);
    }

    @Override
    protected Type constructLogicalIff(Expr.Iff expr, Type lhs, Type rhs) {
        expect(expr, Type.Bool, lhs);
        return expect(expr, Type.Bool, rhs);
    }

    @Override
    protected Type constructLogicalNot(Expr.LogicalNot expr, Type operand) {
        return expect(expr, Type.Bool, operand);
    }

    private Type arithmetic(Expr expr, Type lhs, Type rhs) {
        expect(expr, Type.Int, lhs);
        return expect(expr, Type.Int, rhs);
    }

    private Type comparable(Expr expr, Type lhs, Type rhs) {
        if (unify(lhs, rhs) == null) {
            throw new TypeError("cannot compare " + lhs + " with " + rhs + " in " + expr);
        }
        return Type.Bool;
    }

    private Type ordered(Expr expr, Type lhs, Type rhs) {
        expect(expr, Type.Int, lhs);
        expect(expr, Type.Int, rhs);
        return Type.Bool;
    }

    private static Type sequence(Expr expr, Type actual) {
        if (actual instanceof Type.Sequence) {
            return ((Type.Sequence) actual).getElement();
        }
        throw new TypeError("expected sequence, found " + actual + " in " + expr);
    }

    private static Type expect(Expr expr, Type expected, Type actual) {
        if (unify(expected, actual) == null) {
            throw new TypeError("expected " + expected + ", found " + actual + " in " + expr);
        }
        return expected;
    }

    /**
     * Signals an ill-typed expression.
     */
    public static class TypeError extends IllegalArgumentException {
        private static final long serialVersionUID = 1L;

        public TypeError(String message) {
            super(message);
        }
    }
}
