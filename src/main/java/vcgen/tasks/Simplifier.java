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
package vcgen.tasks;

import static vcgen.core.Logic.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import vcgen.core.Logic.Expr;
import vcgen.core.Obligation;
import vcgen.util.AbstractExpressionTransform;
import vcgen.util.FreeVariables;
import vcgen.util.Substitution;

/**
 * Rewrites obligations into a simpler but equivalent form. This folds
 * constants, applies arithmetic identities and the algebra of sequence
 * literals, and eliminates hypotheses of the form <code>v == t</code> by
 * substituting <code>t</code> for <code>v</code>. An obligation which
 * simplifies to <code>true</code> is discharged. Simplification never makes an
 * obligation harder to prove, and never discharges an obligation which does
 * not hold.
 *
 * @author David J. Pearce
 *
 */
public class Simplifier {
	private static final Logger LOGGER = LogManager.getLogger(Simplifier.class);

	private final int maxRounds;

	public Simplifier(int maxRounds) {
		if (maxRounds < 1) {
			throw new IllegalArgumentException("invalid number of rounds: " + maxRounds);
		}
		this.maxRounds = maxRounds;
	}

	/**
	 * Simplify a given obligation, recording the result as its normal form.
	 *
	 * @param obligation
	 * @return
	 */
	public Obligation simplify(Obligation obligation) {
		return obligation.withNormalised(normalise(obligation.getHypotheses(), obligation.getConclusion()));
	}

	/**
	 * Rewrite a proposition until no further rewrites apply (or the round limit
	 * is reached).
	 *
	 * @param expr
	 * @return
	 */
	public Expr.Logical simplify(Expr.Logical expr) {
		Rewriter rewriter = new Rewriter();
		for (int i = 0; i != maxRounds; ++i) {
			Expr.Logical next = rewriter.visitLogical(expr);
			if (next.equals(expr)) {
				break;
			}
			expr = next;
		}
		return expr;
	}

	private Expr.Logical normalise(List<Expr.Logical> hypotheses, Expr.Logical conclusion) {
		List<Expr.Logical> hyps = new ArrayList<>(hypotheses);
		for (int round = 0; round != maxRounds; ++round) {
			hyps = rewrite(hyps);
			conclusion = simplify(conclusion);
			if (hyps == null || conclusion.isTrue() || hyps.contains(conclusion)) {
				return CONST(true);
			}
			// Eliminate one variable per round
			int index = -1;
			Substitution substitution = null;
			for (int i = 0; i != hyps.size() && substitution == null; ++i) {
				substitution = eliminate(hyps.get(i));
				index = i;
			}
			if (substitution == null) {
				break;
			}
			LOGGER.trace("round {}: eliminating {}", round, hyps.get(index));
			hyps.remove(index);
			for (int i = 0; i != hyps.size(); ++i) {
				hyps.set(i, substitution.apply(hyps.get(i)));
			}
			conclusion = substitution.apply(conclusion);
		}
		return IMPLIES(AND(hyps), conclusion);
	}

	/**
	 * Simplify each hypothesis, splitting conjunctions and dropping those which
	 * are trivially true. This returns <code>null</code> if some hypothesis is
	 * <code>false</code>, since the obligation then holds vacuously.
	 */
	private List<Expr.Logical> rewrite(List<Expr.Logical> hyps) {
		ArrayList<Expr.Logical> result = new ArrayList<>();
		for (Expr.Logical h : hyps) {
			h = simplify(h);
			if (h.isFalse()) {
				return null;
			} else if (h instanceof Expr.LogicalAnd) {
				for (Expr.Logical c : ((Expr.LogicalAnd) h).getOperands()) {
					if (!result.contains(c)) {
						result.add(c);
					}
				}
			} else if (!h.isTrue() && !result.contains(h)) {
				result.add(h);
			}
		}
		return result;
	}

	/**
	 * Determine whether a hypothesis fixes the value of some variable, and if so
	 * construct the substitution which eliminates it.
	 */
	private static Substitution eliminate(Expr.Logical h) {
		if (h instanceof Expr.Equals) {
			Expr.Equals eq = (Expr.Equals) h;
			Expr lhs = eq.getLeftHandSide();
			Expr rhs = eq.getRightHandSide();
			if (lhs instanceof Expr.VariableAccess && !FreeVariables.of(rhs).contains(name(lhs))) {
				return new Substitution(name(lhs), rhs);
			} else if (rhs instanceof Expr.VariableAccess && !FreeVariables.of(lhs).contains(name(rhs))) {
				return new Substitution(name(rhs), lhs);
			}
		} else if (h instanceof Expr.VariableAccess) {
			return new Substitution(name(h), CONST(true));
		} else if (h instanceof Expr.LogicalNot && ((Expr.LogicalNot) h).getOperand() instanceof Expr.VariableAccess) {
			return new Substitution(name(((Expr.LogicalNot) h).getOperand()), CONST(false));
		}
		return null;
	}

	private static String name(Expr e) {
		return ((Expr.VariableAccess) e).getVariable();
	}

	/**
	 * Applies a single bottom-up pass of rewrites.
	 */
	private static class Rewriter extends AbstractExpressionTransform {

		@Override
		public Expr visitExpression(Expr expr) {
			if (expr instanceof Expr.Index) {
				Expr.Index e = (Expr.Index) expr;
				Expr element = select(visitExpression(e.getSource()), visitExpression(e.getIndex()));
				if (element != null) {
					return element;
				}
			}
			return super.visitExpression(expr);
		}

		@Override
		protected Expr constructNegation(Expr.Negation expr, Expr operand) {
			if (operand instanceof Expr.Integer) {
				return CONST(value(operand).negate());
			} else if (operand instanceof Expr.Negation) {
				return ((Expr.Negation) operand).getOperand();
			}
			return super.constructNegation(expr, operand);
		}

		@Override
		protected Expr constructAddition(Expr.Addition expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).add(value(rhs)));
			} else if (isConstant(lhs, 0)) {
				return rhs;
			} else if (isConstant(rhs, 0)) {
				return lhs;
			}
			return super.constructAddition(expr, lhs, rhs);
		}

		@Override
		protected Expr constructSubtraction(Expr.Subtraction expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).subtract(value(rhs)));
			} else if (isConstant(rhs, 0)) {
				return lhs;
			} else if (lhs.equals(rhs)) {
				return CONST(0);
			}
			return super.constructSubtraction(expr, lhs, rhs);
		}

		@Override
		protected Expr constructMultiplication(Expr.Multiplication expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).multiply(value(rhs)));
			} else if (isConstant(lhs, 0) || isConstant(rhs, 0)) {
				return CONST(0);
			} else if (isConstant(lhs, 1)) {
				return rhs;
			} else if (isConstant(rhs, 1)) {
				return lhs;
			}
			return super.constructMultiplication(expr, lhs, rhs);
		}

		@Override
		protected Expr constructLength(Expr.Length expr, Expr operand) {
			if (operand instanceof Expr.Sequence) {
				return CONST(((Expr.Sequence) operand).size());
			} else if (operand instanceof Expr.Append) {
				Expr.Append a = (Expr.Append) operand;
				return ADD(LENGTH(a.getLeftHandSide()), LENGTH(a.getRightHandSide()));
			}
			return super.constructLength(expr, operand);
		}

		@Override
		protected Expr constructSum(Expr.Sum expr, Expr operand) {
			if (operand instanceof Expr.Sequence) {
				Expr.Sequence s = (Expr.Sequence) operand;
				if (s.isEmpty()) {
					return CONST(0);
				}
				Expr result = s.get(0);
				for (int i = 1; i < s.size(); ++i) {
					result = ADD(result, s.get(i));
				}
				return result;
			} else if (operand instanceof Expr.Append) {
				Expr.Append a = (Expr.Append) operand;
				return ADD(SUM(a.getLeftHandSide()), SUM(a.getRightHandSide()));
			}
			return super.constructSum(expr, operand);
		}

		@Override
		protected Expr.Logical constructIndex(Expr.Index expr, Expr source, Expr index) {
			Expr element = select(source, index);
			if (element instanceof Expr.Logical) {
				return (Expr.Logical) element;
			}
			return super.constructIndex(expr, source, index);
		}

		@Override
		protected Expr.Logical constructEquals(Expr.Equals expr, Expr lhs, Expr rhs) {
			if (lhs.equals(rhs)) {
				return CONST(true);
			} else if (isLiteral(lhs) && isLiteral(rhs)) {
				// Distinct literals
				return CONST(false);
			} else if (lhs instanceof Expr.Sequence && rhs instanceof Expr.Sequence) {
				Expr.Sequence l = (Expr.Sequence) lhs;
				Expr.Sequence r = (Expr.Sequence) rhs;
				if (l.size() != r.size()) {
					return CONST(false);
				}
				ArrayList<Expr.Logical> items = new ArrayList<>();
				for (int i = 0; i != l.size(); ++i) {
					items.add(EQ(l.get(i), r.get(i)));
				}
				return AND(items);
			}
			return super.constructEquals(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructNotEquals(Expr.NotEquals expr, Expr lhs, Expr rhs) {
			if (lhs.equals(rhs)) {
				return CONST(false);
			} else if (isLiteral(lhs) && isLiteral(rhs)) {
				return CONST(true);
			}
			return super.constructNotEquals(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructLessThan(Expr.LessThan expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).compareTo(value(rhs)) < 0);
			} else if (lhs.equals(rhs)) {
				return CONST(false);
			}
			return super.constructLessThan(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructLessThanOrEqual(Expr.LessThanOrEqual expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).compareTo(value(rhs)) <= 0);
			} else if (lhs.equals(rhs)) {
				return CONST(true);
			}
			return super.constructLessThanOrEqual(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructGreaterThan(Expr.GreaterThan expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).compareTo(value(rhs)) > 0);
			} else if (lhs.equals(rhs)) {
				return CONST(false);
			}
			return super.constructGreaterThan(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructGreaterThanOrEqual(Expr.GreaterThanOrEqual expr, Expr lhs, Expr rhs) {
			if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
				return CONST(value(lhs).compareTo(value(rhs)) >= 0);
			} else if (lhs.equals(rhs)) {
				return CONST(true);
			}
			return super.constructGreaterThanOrEqual(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructLogicalImplication(Expr.Implies expr, Expr.Logical lhs, Expr.Logical rhs) {
			if (lhs.equals(rhs)) {
				return CONST(true);
			}
			return super.constructLogicalImplication(expr, lhs, rhs);
		}

		@Override
		protected Expr.Logical constructLogicalIff(Expr.Iff expr, Expr.Logical lhs, Expr.Logical rhs) {
			if (lhs.equals(rhs)) {
				return CONST(true);
			}
			return super.constructLogicalIff(expr, lhs, rhs);
		}

		private static Expr select(Expr source, Expr index) {
			if (source instanceof Expr.Sequence && index instanceof Expr.Integer) {
				Expr.Sequence s = (Expr.Sequence) source;
				BigInteger i = value(index);
				if (i.signum() >= 0 && i.compareTo(BigInteger.valueOf(s.size())) < 0) {
					return s.get(i.intValue());
				}
			}
			return null;
		}

		private static boolean isLiteral(Expr e) {
			return e instanceof Expr.Integer || e instanceof Expr.Boolean || e instanceof Expr.Unit;
		}

		private static boolean isConstant(Expr e, int v) {
			return e instanceof Expr.Integer && value(e).equals(BigInteger.valueOf(v));
		}

		private static BigInteger value(Expr e) {
			return ((Expr.Integer) e).getValue();
		}
	}
}
