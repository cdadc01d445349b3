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

import static vcgen.core.Logic.AND;
import static vcgen.core.Logic.IMPLIES;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import vcgen.core.Logic.Expr;

/**
 * A pure proposition which must be proven in order to establish a goal. An
 * obligation is made up of a list of hypotheses and a single conclusion. It
 * additionally records the normal form of its proposition produced by
 * simplification (if that was applied). An obligation is <i>discharged</i>
 * when its normal form is <code>true</code>.
 *
 * @author David J. Pearce
 *
 */
public final class Obligation {
	private final Label label;
	private final List<Expr.Logical> hypotheses;
	private final Expr.Logical conclusion;
	private final Expr.Logical normalised;

	public Obligation(Label label, List<? extends Expr.Logical> hypotheses, Expr.Logical conclusion) {
		this(label, hypotheses, conclusion, null);
	}

	private Obligation(Label label, List<? extends Expr.Logical> hypotheses, Expr.Logical conclusion,
			Expr.Logical normalised) {
		this.label = Objects.requireNonNull(label);
		this.hypotheses = Collections.unmodifiableList(new ArrayList<>(hypotheses));
		this.conclusion = Objects.requireNonNull(conclusion);
		this.normalised = normalised;
	}

	public Label getLabel() {
		return label;
	}

	public List<Expr.Logical> getHypotheses() {
		return hypotheses;
	}

	public Expr.Logical getConclusion() {
		return conclusion;
	}

	/**
	 * Get the proposition <code>h1 && ... && hn ==> c</code> as originally
	 * generated.
	 *
	 * @return
	 */
	public Expr.Logical getProposition() {
		return IMPLIES(AND(hypotheses), conclusion);
	}

	/**
	 * Get the normal form of this obligation. When no simplification was applied,
	 * this is just the original proposition.
	 *
	 * @return
	 */
	public Expr.Logical getNormalised() {
		return normalised != null ? normalised : getProposition();
	}

	public boolean isSimplified() {
		return normalised != null;
	}

	public boolean isDischarged() {
		return getNormalised().isTrue();
	}

	/**
	 * Produce a copy of this obligation which records a given normal form.
	 *
	 * @param normalised
	 * @return
	 */
	public Obligation withNormalised(Expr.Logical normalised) {
		return new Obligation(label, hypotheses, conclusion, Objects.requireNonNull(normalised));
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Obligation) {
			Obligation ob = (Obligation) o;
			return label.equals(ob.label) && hypotheses.equals(ob.hypotheses) && conclusion.equals(ob.conclusion)
					&& getNormalised().equals(ob.getNormalised());
		}
		return false;
	}

	@Override
	public int hashCode() {
		return (label.hashCode() * 31 + hypotheses.hashCode()) * 31 + conclusion.hashCode();
	}

	@Override
	public String toString() {
		return label.getStableId() + ": " + getNormalised();
	}
}
