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
package vcgen.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import vcgen.core.Logic.Expr;

/**
 * Maps variables to their (symbolic) values at a given point in a computation.
 * A state is never modified in place. Instead, every update produces a new
 * state, meaning the two sides of a branch can never observe each other's
 * updates.
 *
 * @author David J. Pearce
 *
 */
public final class State {
	public static final State EMPTY = new State(Collections.<String, Expr>emptyMap());

	private final Map<String, Expr> bindings;

	private State(Map<String, Expr> bindings) {
		this.bindings = bindings;
	}

	/**
	 * Get the value of a given variable.
	 *
	 * @param variable
	 * @return
	 * @throws IllegalArgumentException if the variable is not bound in this state.
	 */
	public Expr get(String variable) {
		Expr e = bindings.get(variable);
		if (e == null) {
			throw new IllegalArgumentException("variable not in scope: " + variable);
		}
		return e;
	}

	/**
	 * Get the value of a given variable as a logical expression. This is useful
	 * when a boolean variable is used directly within a proposition.
	 *
	 * @param variable
	 * @return
	 */
	public Expr.Logical getLogical(String variable) {
		Expr e = get(variable);
		if (e instanceof Expr.Logical) {
			return (Expr.Logical) e;
		}
		throw new IllegalArgumentException("variable is not logical: " + variable);
	}

	public boolean contains(String variable) {
		return bindings.containsKey(variable);
	}

	public Set<String> variables() {
		return Collections.unmodifiableSet(bindings.keySet());
	}

	/**
	 * Get the bindings of this state, in the order they were introduced.
	 *
	 * @return
	 */
	public Map<String, Expr> bindings() {
		return Collections.unmodifiableMap(bindings);
	}

	/**
	 * Produce a new state which is identical to this, except for the given
	 * variable.
	 *
	 * @param variable
	 * @param value
	 * @return
	 */
	public State put(String variable, Expr value) {
		LinkedHashMap<String, Expr> nbindings = new LinkedHashMap<>(bindings);
		nbindings.put(variable, value);
		return new State(nbindings);
	}

	/**
	 * Produce a new state without the given variable. This is used when a
	 * variable goes out of scope.
	 *
	 * @param variable
	 * @return
	 */
	public State remove(String variable) {
		if (!bindings.containsKey(variable)) {
			return this;
		}
		LinkedHashMap<String, Expr> nbindings = new LinkedHashMap<>(bindings);
		nbindings.remove(variable);
		return new State(nbindings);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof State && ((State) o).bindings.equals(bindings);
	}

	@Override
	public int hashCode() {
		return bindings.hashCode();
	}

	@Override
	public String toString() {
		return bindings.toString();
	}
}
