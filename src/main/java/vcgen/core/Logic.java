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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import vcgen.io.ObligationPrinter;

/**
 * The pure logic in which obligations are stated. This covers integer
 * arithmetic, propositional connectives and a small theory of finite sequences
 * (literals, concatenation, length, sum and indexing). Expressions are
 * immutable and compare structurally, which means two independently generated
 * obligations can be checked for equality directly.
 *
 * @author David J. Pearce
 *
 */
public class Logic {

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {

	}

	public static abstract class AbstractItem implements Item {

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}

		@Override
		public String toString() {
			if (this instanceof Expr) {
				return ObligationPrinter.toString((Expr) this);
			} else {
				return ObligationPrinter.toString((Type) this);
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		/**
		 * An expression which can be used in a position requiring a boolean (e.g. as
		 * a hypothesis of an obligation).
		 */
		public interface Logical extends Expr {
			public boolean isTrue();

			public boolean isFalse();
		}

		public interface UnaryOperator {
			public Expr getOperand();
		}

		public interface BinaryOperator {
			public Expr getLeftHandSide();

			public Expr getRightHandSide();
		}

		public interface NaryOperator {
			public List<? extends Expr> getOperands();
		}

		public static abstract class AbstractUnary extends AbstractItem implements UnaryOperator {
			private final Expr operand;

			private AbstractUnary(Expr operand) {
				this.operand = Objects.requireNonNull(operand);
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && operand.equals(((AbstractUnary) o).operand);
			}

			@Override
			public int hashCode() {
				return getClass().getSimpleName().hashCode() * 31 + operand.hashCode();
			}
		}

		public static abstract class AbstractBinary extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private AbstractBinary(Expr lhs, Expr rhs) {
				this.lhs = Objects.requireNonNull(lhs);
				this.rhs = Objects.requireNonNull(rhs);
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o != null && o.getClass() == getClass()) {
					AbstractBinary b = (AbstractBinary) o;
					return lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return (getClass().getSimpleName().hashCode() * 31 + lhs.hashCode()) * 31 + rhs.hashCode();
			}
		}

		public static abstract class AbstractNary<T extends Expr> extends AbstractItem implements NaryOperator {
			private final List<T> operands;

			private AbstractNary(List<T> operands) {
				this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
			}

			@Override
			public List<T> getOperands() {
				return operands;
			}

			public int size() {
				return operands.size();
			}

			public T get(int i) {
				return operands.get(i);
			}

			@Override
			public boolean equals(Object o) {
				return o != null && o.getClass() == getClass() && operands.equals(((AbstractNary<?>) o).operands);
			}

			@Override
			public int hashCode() {
				return getClass().getSimpleName().hashCode() * 31 + operands.hashCode();
			}
		}

		// Relational operators

		public static class Equals extends AbstractBinary implements Logical {
			private Equals(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class NotEquals extends AbstractBinary implements Logical {
			private NotEquals(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class LessThan extends AbstractBinary implements Logical {
			private LessThan(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class LessThanOrEqual extends AbstractBinary implements Logical {
			private LessThanOrEqual(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class GreaterThan extends AbstractBinary implements Logical {
			private GreaterThan(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinary implements Logical {
			private GreaterThanOrEqual(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class Iff extends AbstractBinary implements Logical {
			private Iff(Logical lhs, Logical rhs) {
				super(lhs, rhs);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) super.getLeftHandSide();
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) super.getRightHandSide();
			}
		}

		public static class Implies extends AbstractBinary implements Logical {
			private Implies(Logical lhs, Logical rhs) {
				super(lhs, rhs);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) super.getLeftHandSide();
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) super.getRightHandSide();
			}
		}

		// Arithmetic operators

		public static class Addition extends AbstractBinary implements Expr {
			private Addition(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class Subtraction extends AbstractBinary implements Expr {
			private Subtraction(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class Multiplication extends AbstractBinary implements Expr {
			private Multiplication(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class Negation extends AbstractUnary implements Expr {
			private Negation(Expr operand) {
				super(operand);
			}
		}

		// Sequence operators

		/**
		 * A sequence literal <code>[e1, e2, ..., en]</code>. The empty literal
		 * <code>[]</code> is the only way to write the empty sequence.
		 */
		public static class Sequence extends AbstractNary<Expr> implements Expr {
			private Sequence(List<Expr> operands) {
				super(operands);
			}

			public boolean isEmpty() {
				return size() == 0;
			}
		}

		/**
		 * Concatenation of two sequences, written <code>s1 ++ s2</code>.
		 */
		public static class Append extends AbstractBinary implements Expr {
			private Append(Expr lhs, Expr rhs) {
				super(lhs, rhs);
			}
		}

		public static class Length extends AbstractUnary implements Expr {
			private Length(Expr operand) {
				super(operand);
			}
		}

		/**
		 * The sum of all elements in a sequence of integers. The sum of the empty
		 * sequence is <code>0</code>.
		 */
		public static class Sum extends AbstractUnary implements Expr {
			private Sum(Expr operand) {
				super(operand);
			}
		}

		/**
		 * Access the element at a given index of a sequence. Since elements may be
		 * booleans, this can be used as a logical expression.
		 */
		public static class Index extends AbstractBinary implements Logical {
			private Index(Expr source, Expr index) {
				super(source, index);
			}

			public Expr getSource() {
				return getLeftHandSide();
			}

			public Expr getIndex() {
				return getRightHandSide();
			}
		}

		// Logical connectives

		public static class LogicalNot extends AbstractUnary implements Logical {
			private LogicalNot(Logical operand) {
				super(operand);
			}

			@Override
			public Logical getOperand() {
				return (Logical) super.getOperand();
			}
		}

		public static class LogicalAnd extends AbstractNary<Logical> implements Logical {
			private LogicalAnd(List<Logical> operands) {
				super(operands);
			}
		}

		public static class LogicalOr extends AbstractNary<Logical> implements Logical {
			private LogicalOr(List<Logical> operands) {
				super(operands);
			}
		}

		// Atoms

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean v) {
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Boolean && ((Boolean) o).value == value;
			}

			@Override
			public int hashCode() {
				return value ? 1231 : 1237;
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger value) {
				this.value = Objects.requireNonNull(value);
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Integer && ((Integer) o).value.equals(value);
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}
		}

		/**
		 * The value produced by computations which produce nothing of interest (e.g.
		 * an assignment or a loop).
		 */
		public static class Unit extends AbstractItem implements Expr {
			private Unit() {

			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Unit;
			}

			@Override
			public int hashCode() {
				return 7;
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical {
			private final String name;

			private VariableAccess(String name) {
				if (name == null || name.isEmpty()) {
					throw new IllegalArgumentException("invalid variable name");
				}
				this.name = name;
			}

			public String getVariable() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof VariableAccess && ((VariableAccess) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Unit = new Unit();
		/**
		 * The type of a computation which never completes normally (e.g.
		 * <code>break</code> or <code>return</code>). This is compatible with every
		 * other type.
		 */
		public static final Type Void = new Void();

		public static class Bool extends AbstractItem implements Type {
			private Bool() {

			}
		}

		public static class Int extends AbstractItem implements Type {
			private Int() {

			}
		}

		public static class Unit extends AbstractItem implements Type {
			private Unit() {

			}
		}

		public static class Void extends AbstractItem implements Type {
			private Void() {

			}
		}

		public static class Sequence extends AbstractItem implements Type {
			private final Type element;

			public Sequence(Type element) {
				this.element = Objects.requireNonNull(element);
			}

			public Type getElement() {
				return element;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Sequence && ((Sequence) o).element.equals(element);
			}

			@Override
			public int hashCode() {
				return element.hashCode() * 13 + 1;
			}
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static final Expr.Unit UNIT = new Expr.Unit();

	// Logical Operators
	public static Expr.Logical AND(List<? extends Expr.Logical> operands) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isFalse()) {
				return CONST(false);
			} else if (ith instanceof Expr.LogicalAnd) {
				noperands.addAll(((Expr.LogicalAnd) ith).getOperands());
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
		case 0:
			return CONST(true);
		case 1:
			return noperands.get(0);
		default:
			return new Expr.LogicalAnd(noperands);
		}
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2) {
		return AND(Arrays.asList(operand1, operand2));
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Expr.Logical operand3) {
		return AND(Arrays.asList(operand1, operand2, operand3));
	}

	public static Expr.Logical OR(List<? extends Expr.Logical> operands) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for (int i = 0; i != operands.size(); ++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isTrue()) {
				return CONST(true);
			} else if (ith instanceof Expr.LogicalOr) {
				noperands.addAll(((Expr.LogicalOr) ith).getOperands());
			} else if (!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
		case 0:
			return CONST(false);
		case 1:
			return noperands.get(0);
		default:
			return new Expr.LogicalOr(noperands);
		}
	}

	public static Expr.Logical OR(Expr.Logical operand1, Expr.Logical operand2) {
		return OR(Arrays.asList(operand1, operand2));
	}

	public static Expr.Logical IFF(Expr.Logical lhs, Expr.Logical rhs) {
		if (lhs instanceof Expr.Boolean && rhs instanceof Expr.Boolean) {
			return CONST(lhs.equals(rhs));
		} else {
			return new Expr.Iff(lhs, rhs);
		}
	}

	public static Expr.Logical IMPLIES(Expr.Logical lhs, Expr.Logical rhs) {
		if (lhs.isFalse() || rhs.isTrue()) {
			return CONST(true);
		} else if (lhs.isTrue()) {
			return rhs;
		} else if (rhs.isFalse()) {
			return NOT(lhs);
		} else {
			return new Expr.Implies(lhs, rhs);
		}
	}

	public static Expr.Logical NOT(Expr.Logical lhs) {
		if (lhs.isFalse()) {
			return CONST(true);
		} else if (lhs.isTrue()) {
			return CONST(false);
		} else if (lhs instanceof Expr.LogicalNot) {
			return ((Expr.LogicalNot) lhs).getOperand();
		} else {
			return new Expr.LogicalNot(lhs);
		}
	}

	// Relational Operators

	public static Expr.Logical EQ(Expr lhs, Expr rhs) {
		return new Expr.Equals(lhs, rhs);
	}

	public static Expr.Logical NEQ(Expr lhs, Expr rhs) {
		return new Expr.NotEquals(lhs, rhs);
	}

	public static Expr.Logical GTEQ(Expr lhs, Expr rhs) {
		return new Expr.GreaterThanOrEqual(lhs, rhs);
	}

	public static Expr.Logical GT(Expr lhs, Expr rhs) {
		return new Expr.GreaterThan(lhs, rhs);
	}

	public static Expr.Logical LTEQ(Expr lhs, Expr rhs) {
		return new Expr.LessThanOrEqual(lhs, rhs);
	}

	public static Expr.Logical LT(Expr lhs, Expr rhs) {
		return new Expr.LessThan(lhs, rhs);
	}

	// Arithmetic Operators
	public static Expr ADD(Expr lhs, Expr rhs) {
		return new Expr.Addition(lhs, rhs);
	}

	public static Expr NEG(Expr lhs) {
		return new Expr.Negation(lhs);
	}

	public static Expr SUB(Expr lhs, Expr rhs) {
		return new Expr.Subtraction(lhs, rhs);
	}

	public static Expr MUL(Expr lhs, Expr rhs) {
		return new Expr.Multiplication(lhs, rhs);
	}

	// Sequences

	public static Expr.Sequence SEQ() {
		return new Expr.Sequence(Collections.<Expr>emptyList());
	}

	public static Expr.Sequence SEQ(Expr... elements) {
		return new Expr.Sequence(Arrays.asList(elements));
	}

	public static Expr.Sequence SEQ(List<? extends Expr> elements) {
		return new Expr.Sequence(new ArrayList<>(elements));
	}

	public static Expr.Sequence SEQ(int... elements) {
		ArrayList<Expr> items = new ArrayList<>();
		for (int i = 0; i != elements.length; ++i) {
			items.add(CONST(elements[i]));
		}
		return new Expr.Sequence(items);
	}

	/**
	 * Concatenate two sequences. Concatenation is kept in a normal form:
	 * concatenation with the empty literal and of two literals is resolved,
	 * nested concatenations associate to the right, and a literal is merged
	 * into a concatenation which starts with a literal. Hence,
	 * <code>APPEND(SEQ(1), APPEND(SEQ(2), s))</code> gives <code>[1, 2] ++ s</code>
	 * and splitting a sequence into a prefix and suffix then joining them back
	 * gives the original term.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr APPEND(Expr lhs, Expr rhs) {
		if (lhs instanceof Expr.Sequence && ((Expr.Sequence) lhs).isEmpty()) {
			return rhs;
		} else if (rhs instanceof Expr.Sequence && ((Expr.Sequence) rhs).isEmpty()) {
			return lhs;
		} else if (lhs instanceof Expr.Sequence && rhs instanceof Expr.Sequence) {
			ArrayList<Expr> items = new ArrayList<>(((Expr.Sequence) lhs).getOperands());
			items.addAll(((Expr.Sequence) rhs).getOperands());
			return new Expr.Sequence(items);
		} else if (lhs instanceof Expr.Append) {
			// (a ++ b) ++ c ==> a ++ (b ++ c)
			Expr.Append l = (Expr.Append) lhs;
			return APPEND(l.getLeftHandSide(), APPEND(l.getRightHandSide(), rhs));
		} else if (lhs instanceof Expr.Sequence && rhs instanceof Expr.Append
				&& ((Expr.Append) rhs).getLeftHandSide() instanceof Expr.Sequence) {
			// [a] ++ ([b] ++ c) ==> [a, b] ++ c
			Expr.Append r = (Expr.Append) rhs;
			return APPEND(APPEND(lhs, r.getLeftHandSide()), r.getRightHandSide());
		} else {
			return new Expr.Append(lhs, rhs);
		}
	}

	public static Expr LENGTH(Expr operand) {
		return new Expr.Length(operand);
	}

	public static Expr SUM(Expr operand) {
		return new Expr.Sum(operand);
	}

	public static Expr.Index INDEX(Expr source, Expr index) {
		return new Expr.Index(source, index);
	}

	// Misc
	public static Expr.Logical CONST(boolean b) {
		return new Expr.Boolean(b);
	}

	public static Expr.Integer CONST(int i) {
		return new Expr.Integer(BigInteger.valueOf(i));
	}

	public static Expr.Integer CONST(BigInteger i) {
		return new Expr.Integer(i);
	}

	public static Expr.VariableAccess VAR(String name) {
		return new Expr.VariableAccess(name);
	}

	public static Type.Sequence SEQUENCE(Type element) {
		return new Type.Sequence(element);
	}
}
