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
package vcgen.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import vcgen.core.Logic.Expr;
import vcgen.core.Logic.Type;
import vcgen.core.Obligation;
import vcgen.core.ObligationSet;
import vcgen.util.MappablePrintWriter;

/**
 * Writes obligations in a readable textual form. For example, the obligation
 * establishing a loop invariant might be written as follows:
 *
 * <pre>
 * obligation sum:step/invariant // invariant of sum preserved by iteration
 *    assume (p$2 ++ ([x$3] ++ xs$4)) == [1, 2, 3];
 *    assume sum(p$2) == out$1;
 *    prove sum(p$2 ++ [x$3]) == (out$1 + x$3);
 * </pre>
 *
 * The printer records which obligation (and which expression) produced each
 * region of output, so that positions reported against the text can be mapped
 * back.
 *
 * @author David J. Pearce
 *
 */
public class ObligationPrinter {
	private final MappablePrintWriter<Object> out;
	/**
	 * Signals whether to print the normal form of each obligation, rather than
	 * the obligation as generated.
	 */
	private boolean normalised = false;

	public ObligationPrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public ObligationPrinter setNormalised(boolean flag) {
		this.normalised = flag;
		return this;
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<Object> getMapping() {
		return out.getMapping();
	}

	/**
	 * Determine the obligation printed on a given line (starting from 1), or
	 * <code>null</code> if there is none.
	 *
	 * @param line
	 * @return
	 */
	public Obligation getObligation(int line) {
		for (Object tag : out.getMapping().get(line)) {
			if (tag instanceof Obligation) {
				return (Obligation) tag;
			}
		}
		return null;
	}

	public void write(ObligationSet obligations) {
		for (Obligation o : obligations) {
			write(o);
		}
		out.flush();
	}

	public void write(Obligation o) {
		out.print("obligation ", o);
		out.print(o.getLabel().getStableId().toString(), o);
		if (!o.getLabel().getHint().isEmpty()) {
			out.print(" // " + o.getLabel().getHint(), o);
		}
		if (o.isDischarged()) {
			out.print(" [discharged]", o);
		}
		out.println();
		if (normalised) {
			out.tab(1);
			out.print("prove ", o);
			writeExpression(o.getNormalised());
			out.println(";", o);
		} else {
			List<Expr.Logical> hypotheses = o.getHypotheses();
			for (int i = 0; i != hypotheses.size(); ++i) {
				out.tab(1);
				out.print("assume ", o);
				writeExpression(hypotheses.get(i));
				out.println(";", o);
			}
			out.tab(1);
			out.print("prove ", o);
			writeExpression(o.getConclusion());
			out.println(";", o);
		}
	}

	private void writeExpressionWithBraces(Expr e) {
		if (needsBraces(e)) {
			out.print("(", e);
			writeExpression(e);
			out.print(")", e);
		} else {
			writeExpression(e);
		}
	}

	private static boolean needsBraces(Expr e) {
		if (e instanceof Expr.Index) {
			return false;
		}
		return e instanceof Expr.BinaryOperator || e instanceof Expr.LogicalAnd || e instanceof Expr.LogicalOr
				|| e instanceof Expr.Negation;
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Equals) {
			writeInfix((Expr.BinaryOperator) e, " == ");
		} else if (e instanceof Expr.NotEquals) {
			writeInfix((Expr.BinaryOperator) e, " != ");
		} else if (e instanceof Expr.Iff) {
			writeInfix((Expr.BinaryOperator) e, " <==> ");
		} else if (e instanceof Expr.Implies) {
			writeInfix((Expr.BinaryOperator) e, " ==> ");
		} else if (e instanceof Expr.LessThan) {
			writeInfix((Expr.BinaryOperator) e, " < ");
		} else if (e instanceof Expr.LessThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " <= ");
		} else if (e instanceof Expr.GreaterThan) {
			writeInfix((Expr.BinaryOperator) e, " > ");
		} else if (e instanceof Expr.GreaterThanOrEqual) {
			writeInfix((Expr.BinaryOperator) e, " >= ");
		} else if (e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ");
		} else if (e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ");
		} else if (e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ");
		} else if (e instanceof Expr.Append) {
			writeInfix((Expr.BinaryOperator) e, " ++ ");
		} else if (e instanceof Expr.Boolean) {
			out.print(Boolean.toString(((Expr.Boolean) e).getValue()), e);
		} else if (e instanceof Expr.Integer) {
			out.print(((Expr.Integer) e).getValue().toString(), e);
		} else if (e instanceof Expr.Unit) {
			out.print("()", e);
		} else if (e instanceof Expr.LogicalAnd) {
			writeNary((Expr.LogicalAnd) e, " && ");
		} else if (e instanceof Expr.LogicalOr) {
			writeNary((Expr.LogicalOr) e, " || ");
		} else if (e instanceof Expr.Sequence) {
			writeSequence((Expr.Sequence) e);
		} else if (e instanceof Expr.Index) {
			writeIndex((Expr.Index) e);
		} else if (e instanceof Expr.Length) {
			out.print("|", e);
			writeExpression(((Expr.Length) e).getOperand());
			out.print("|", e);
		} else if (e instanceof Expr.Sum) {
			out.print("sum(", e);
			writeExpression(((Expr.Sum) e).getOperand());
			out.print(")", e);
		} else if (e instanceof Expr.LogicalNot) {
			out.print("!", e);
			writeExpressionWithBraces(((Expr.LogicalNot) e).getOperand());
		} else if (e instanceof Expr.Negation) {
			out.print("-", e);
			writeExpressionWithBraces(((Expr.Negation) e).getOperand());
		} else if (e instanceof Expr.VariableAccess) {
			out.print(((Expr.VariableAccess) e).getVariable(), e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator, e);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeNary(Expr.NaryOperator e, String operator) {
		List<? extends Expr> operands = e.getOperands();
		for (int i = 0; i != operands.size(); ++i) {
			if (i != 0) {
				out.print(operator, e);
			}
			writeExpressionWithBraces(operands.get(i));
		}
	}

	private void writeSequence(Expr.Sequence e) {
		out.print("[", e);
		for (int i = 0; i != e.size(); ++i) {
			if (i != 0) {
				out.print(", ", e);
			}
			writeExpression(e.get(i));
		}
		out.print("]", e);
	}

	private void writeIndex(Expr.Index e) {
		writeExpressionWithBraces(e.getSource());
		out.print("[", e);
		writeExpression(e.getIndex());
		out.print("]", e);
	}

	private void writeType(Type t) {
		if (t == Type.Bool) {
			out.print("bool", t);
		} else if (t == Type.Int) {
			out.print("int", t);
		} else if (t == Type.Unit) {
			out.print("unit", t);
		} else if (t == Type.Void) {
			out.print("void", t);
		} else if (t instanceof Type.Sequence) {
			out.print("seq<", t);
			writeType(((Type.Sequence) t).getElement());
			out.print(">", t);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ObligationPrinter p = new ObligationPrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	public static String toString(Type type) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ObligationPrinter p = new ObligationPrinter(buf);
		p.writeType(type);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	public static String toString(ObligationSet obligations) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ObligationPrinter p = new ObligationPrinter(buf);
		p.write(obligations);
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}
