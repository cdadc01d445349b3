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

import vcgen.core.Logic.Expr;

/**
 * Folds a function over every node of an expression. Variables are handled by
 * the subclass, other leaves give <code>BOTTOM()</code>, and each operator
 * joins the results for its operands from left to right. Since every operator
 * exposes its operands through one of the operator interfaces, no case is
 * needed per kind of node.
 *
 * @param <E>
 */
public abstract class AbstractExpressionFold<E> {

    public E visitExpression(Expr expr) {
        if (expr instanceof Expr.VariableAccess) {
            return constructVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.UnaryOperator) {
            return visitExpression(((Expr.UnaryOperator) expr).getOperand());
        } else if (expr instanceof Expr.BinaryOperator) {
            Expr.BinaryOperator b = (Expr.BinaryOperator) expr;
            return join(visitExpression(b.getLeftHandSide()), visitExpression(b.getRightHandSide()));
        } else if (expr instanceof Expr.NaryOperator) {
            E result = BOTTOM();
            for (Expr operand : ((Expr.NaryOperator) expr).getOperands()) {
                result = join(result, visitExpression(operand));
            }
            return result;
        } else {
            // integer, boolean or unit constant
            return BOTTOM();
        }
    }

    protected abstract E constructVariableAccess(Expr.VariableAccess expr);

    public abstract E join(E lhs, E rhs);

    public abstract E BOTTOM();
}
