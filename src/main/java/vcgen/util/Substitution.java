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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import vcgen.core.Logic.Expr;

/**
 * Replaces variables in an expression. Since the logic has no binding
 * constructs, substitution cannot capture variables.
 */
public class Substitution extends AbstractExpressionTransform {
    private final Map<String, Expr> mapping;

    public Substitution(Map<String, ? extends Expr> mapping) {
        this.mapping = new HashMap<>(mapping);
    }

    public Substitution(String variable, Expr replacement) {
        this(Collections.singletonMap(variable, replacement));
    }

    @Override
    protected Expr.Logical constructVariableAccess(Expr.VariableAccess expr) {
        Expr e = mapping.get(expr.getVariable());
        if (e == null) {
            return expr;
        } else if (e instanceof Expr.Logical) {
            return (Expr.Logical) e;
        } else {
            throw new IllegalArgumentException("cannot substitute non-logical expression for " + expr.getVariable());
        }
    }

    /**
     * Variables never appear in logical position unless substituted by a
     * logical expression. However, they may appear in term position, in which
     * case any replacement is fine.
     */
    @Override
    public Expr visitExpression(Expr expr) {
        if (expr instanceof Expr.VariableAccess) {
            Expr e = mapping.get(((Expr.VariableAccess) expr).getVariable());
            return e == null ? expr : e;
        }
        return super.visitExpression(expr);
    }

    public Expr.Logical apply(Expr.Logical expr) {
        return visitLogical(expr);
    }

    public Expr apply(Expr expr) {
        return visitExpression(expr);
    }
}
