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

import java.util.List;

import vcgen.core.Logic;
import vcgen.core.Logic.Expr;

/**
 * Rebuilds an expression bottom-up. By default every node is reconstructed only
 * when one of its children changed, otherwise the original node is returned.
 * Subclasses override individual <code>construct</code> methods to rewrite
 * particular nodes.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr, Expr.Logical> {

    // Integers
    @Override
    protected Expr constructInteger(Expr.Integer expr) {
        return expr;
    }

    @Override
    protected Expr constructUnit(Expr.Unit expr) {
        return expr;
    }

    @Override
    protected Expr constructNegation(Expr.Negation expr, Expr operand) {
        if(expr.getOperand() == operand) {
            return expr;
        } else {
            return Logic.NEG(operand);
        }
    }
    @Override
    protected Expr constructAddition(Expr.Addition expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.ADD(lhs, rhs);
        }
    }
    @Override
    protected Expr constructSubtraction(Expr.Subtraction expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.SUB(lhs, rhs);
        }
    }
    @Override
    protected Expr constructMultiplication(Expr.Multiplication expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.MUL(lhs, rhs);
        }
    }

    // Sequences
    @Override
    protected Expr constructSequence(Expr.Sequence expr, List<Expr> operands) {
        if (same(expr.getOperands(), operands)) {
            return expr;
        } else {
            return Logic.SEQ(operands);
        }
    }
    @Override
    protected Expr constructAppend(Expr.Append expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.APPEND(lhs, rhs);
        }
    }
    @Override
    protected Expr constructLength(Expr.Length expr, Expr operand) {
        if(expr.getOperand() == operand) {
            return expr;
        } else {
            return Logic.LENGTH(operand);
        }
    }
    @Override
    protected Expr constructSum(Expr.Sum expr, Expr operand) {
        if(expr.getOperand() == operand) {
            return expr;
        } else {
            return Logic.SUM(operand);
        }
    }
    @Override
    protected Expr.Logical constructIndex(Expr.Index expr, Expr source, Expr index) {
        if (expr.getSource() == source && expr.getIndex() == index) {
            return expr;
        } else {
            return Logic.INDEX(source, index);
        }
    }

    // Relational
    @Override
    protected Expr.Logical constructEquals(Expr.Equals expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.EQ(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructNotEquals(Expr.NotEquals expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.NEQ(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructLessThan(Expr.LessThan expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.LT(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructLessThanOrEqual(Expr.LessThanOrEqual expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.LTEQ(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructGreaterThan(Expr.GreaterThan expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.GT(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.GTEQ(lhs, rhs);
        }
    }

    // Logical
    @Override
    protected Expr.Logical constructBoolean(Expr.Boolean expr) {
        return expr;
    }

    @Override
    protected Expr.Logical constructVariableAccess(Expr.VariableAccess expr) {
        return expr;
    }

    @Override
    protected Expr.Logical constructLogicalAnd(Expr.LogicalAnd expr, List<Expr.Logical> operands) {
        if(same(expr.getOperands(),operands)) {
            return expr;
        } else {
            return Logic.AND(operands);
        }
    }
    @Override
    protected Expr.Logical constructLogicalOr(Expr.LogicalOr expr, List<Expr.Logical> operands) {
        if(same(expr.getOperands(),operands)) {
            return expr;
        } else {
            return Logic.OR(operands);
        }
    }
    @Override
    protected Expr.Logical constructLogicalImplication(Expr.Implies expr, Expr.Logical lhs, Expr.Logical rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.IMPLIES(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructLogicalIff(Expr.Iff expr, Expr.Logical lhs, Expr.Logical rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return Logic.IFF(lhs, rhs);
        }
    }
    @Override
    protected Expr.Logical constructLogicalNot(Expr.LogicalNot expr, Expr.Logical operand) {
        if (expr.getOperand() == operand) {
            return expr;
        } else {
            return Logic.NOT(operand);
        }
    }

    private static boolean same(List<? extends Expr> before, List<? extends Expr> after) {
        if (before.size() != after.size()) {
            return false;
        }
        for (int i = 0; i != before.size(); ++i) {
            if (before.get(i) != after.get(i)) {
                return false;
            }
        }
        return true;
    }
}
