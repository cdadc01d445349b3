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
import java.util.Set;
import java.util.TreeSet;

import vcgen.core.Logic.Expr;

/**
 * Determines the set of variables used in an expression.
 */
public class FreeVariables extends AbstractExpressionFold<Set<String>> {

    public static Set<String> of(Expr expr) {
        return new FreeVariables().visitExpression(expr);
    }

    @Override
    protected Set<String> constructVariableAccess(Expr.VariableAccess expr) {
        return Collections.singleton(expr.getVariable());
    }

    @Override
    public Set<String> join(Set<String> lhs, Set<String> rhs) {
        if (lhs.isEmpty()) {
            return rhs;
        } else if (rhs.isEmpty()) {
            return lhs;
        }
        TreeSet<String> result = new TreeSet<>(lhs);
        result.addAll(rhs);
        return result;
    }

    @Override
    public Set<String> BOTTOM() {
        return Collections.emptySet();
    }
}
