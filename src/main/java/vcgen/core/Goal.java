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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;

/**
 * The top-level claim to be decomposed: for all values of the parameters
 * satisfying the precondition, running the computation either completes
 * normally (or returns) with a value satisfying the target relation, or throws
 * a value satisfying the exceptional relation.
 *
 * @author David J. Pearce
 *
 */
public final class Goal {
	private final List<Parameter> parameters;
	private final Expr.Logical precondition;
	private final Computation body;
	private final Type returns;
	private final Relation target;
	private final Type throwing;
	private final Relation exceptional;

	private Goal(Builder b) {
		this.parameters = Collections.unmodifiableList(new ArrayList<>(b.parameters));
		this.precondition = b.precondition;
		this.body = Objects.requireNonNull(b.body, "missing computation");
		this.returns = b.returns;
		this.target = Objects.requireNonNull(b.target, "missing target relation");
		this.throwing = b.throwing;
		this.exceptional = b.exceptional;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Get the variables which are in scope at the start of the computation. These
	 * are mutable, and their initial values are arbitrary (subject to the
	 * precondition).
	 *
	 * @return
	 */
	public List<Parameter> getParameters() {
		return parameters;
	}

	public Expr.Logical getPrecondition() {
		return precondition;
	}

	public Computation getBody() {
		return body;
	}

	/**
	 * Get the type of the value produced on normal completion, or
	 * <code>null</code> if this should be inferred.
	 *
	 * @return
	 */
	public Type getReturns() {
		return returns;
	}

	public Relation getTarget() {
		return target;
	}

	/**
	 * Get the type of thrown values, or <code>null</code> if any type is
	 * permitted.
	 *
	 * @return
	 */
	public Type getThrowing() {
		return throwing;
	}

	public Relation getExceptional() {
		return exceptional;
	}

	/**
	 * Construct the state at the start of the computation, where every parameter
	 * is bound to a variable of the same name.
	 *
	 * @return
	 */
	public State initialState() {
		State s = State.EMPTY;
		for (Parameter p : parameters) {
			s = s.put(p.getName(), Logic.VAR(p.getName()));
		}
		return s;
	}

	public static final class Parameter {
		private final String name;
		private final Type type;

		public Parameter(String name, Type type) {
			this.name = Objects.requireNonNull(name);
			this.type = Objects.requireNonNull(type);
		}

		public String getName() {
			return name;
		}

		public Type getType() {
			return type;
		}

		@Override
		public String toString() {
			return name + ":" + type;
		}
	}

	public static final class Builder {
		private final List<Parameter> parameters = new ArrayList<>();
		private Expr.Logical precondition = Logic.CONST(true);
		private Computation body;
		private Type returns;
		private Relation target;
		private Type throwing;
		private Relation exceptional = Relation.FALSE;

		private Builder() {

		}

		public Builder parameter(String name, Type type) {
			parameters.add(new Parameter(name, type));
			return this;
		}

		public Builder requires(Expr.Logical precondition) {
			this.precondition = Objects.requireNonNull(precondition);
			return this;
		}

		public Builder body(Computation body) {
			this.body = body;
			return this;
		}

		public Builder returns(Type type) {
			this.returns = type;
			return this;
		}

		public Builder ensures(Relation target) {
			this.target = target;
			return this;
		}

		public Builder throwing(Type type, Relation exceptional) {
			this.throwing = type;
			this.exceptional = Objects.requireNonNull(exceptional);
			return this;
		}

		public Goal build() {
			return new Goal(this);
		}
	}
}
