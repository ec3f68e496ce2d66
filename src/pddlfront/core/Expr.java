// This file is part of the PDDL Front-End (pfe).
//
// The PDDL Front-End is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The PDDL Front-End is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the PDDL Front-End. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package pddlfront.core;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import pddlfront.util.Rational;

/**
 * A typed expression, as produced by compiling the body of a precondition,
 * effect, goal, etc. Expressions are immutable trees whose nodes are
 * distinguished by their {@link Kind}. Equality is structural, though the
 * referenced model elements (fluents, objects, parameters and variables) are
 * compared by identity. Expressions should be constructed through an
 * {@link ExpressionManager}, which checks they are well-typed.
 *
 * @author David J. Pearce
 *
 */
public abstract class Expr {

	public enum Kind {
		BOOL_CONSTANT, INT_CONSTANT, REAL_CONSTANT, PARAMETER, VARIABLE, OBJECT, FLUENT, AND, OR, NOT, IMPLIES,
		EQUALS, LE, LT, PLUS, MINUS, TIMES, DIV, EXISTS, FORALL, ALWAYS, SOMETIME, SOMETIME_BEFORE, SOMETIME_AFTER,
		AT_MOST_ONCE;

		public boolean isConstant() {
			return this == BOOL_CONSTANT || this == INT_CONSTANT || this == REAL_CONSTANT;
		}
	}

	private final Kind kind;
	private final Types.Type type;
	private final List<Expr> children;
	private final int hash;

	protected Expr(Kind kind, Types.Type type, List<Expr> children, Object head) {
		this.kind = kind;
		this.type = type;
		this.children = children;
		// Children are hashed when constructed, hence this never recurses deeply
		this.hash = kind.hashCode() ^ (Objects.hashCode(head) * 31) ^ (children.hashCode() * 17);
	}

	public Kind kind() {
		return kind;
	}

	public Types.Type type() {
		return type;
	}

	public List<Expr> children() {
		return children;
	}

	public Expr child(int i) {
		return children.get(i);
	}

	public boolean isConstant() {
		return kind.isConstant();
	}

	public boolean isTrue() {
		return this instanceof Constant && Boolean.TRUE.equals(((Constant) this).value);
	}

	public boolean isFalse() {
		return this instanceof Constant && Boolean.FALSE.equals(((Constant) this).value);
	}

	/**
	 * The non-child part of this node which distinguishes it from another of
	 * the same kind (e.g. the value of a constant or the referenced fluent).
	 *
	 * @return
	 */
	protected abstract Object head();

	/**
	 * Check whether a given fluent is applied anywhere in this expression.
	 *
	 * @param fluent
	 * @return
	 */
	public boolean mentions(Model.Fluent fluent) {
		ArrayDeque<Expr> worklist = new ArrayDeque<>();
		worklist.push(this);
		while (!worklist.isEmpty()) {
			Expr e = worklist.pop();
			if (e instanceof FluentApp && ((FluentApp) e).fluent() == fluent) {
				return true;
			}
			for (Expr c : e.children) {
				worklist.push(c);
			}
		}
		return false;
	}

	@Override
	public int hashCode() {
		return hash;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Expr)) {
			return false;
		}
		ArrayDeque<Expr> lhs = new ArrayDeque<>();
		ArrayDeque<Expr> rhs = new ArrayDeque<>();
		lhs.push(this);
		rhs.push((Expr) o);
		while (!lhs.isEmpty()) {
			Expr l = lhs.pop();
			Expr r = rhs.pop();
			if (l == r) {
				continue;
			} else if (l.hash != r.hash || l.kind != r.kind || l.type != r.type
					|| l.children.size() != r.children.size() || !Objects.equals(l.head(), r.head())) {
				return false;
			}
			for (int i = 0; i != l.children.size(); ++i) {
				lhs.push(l.children.get(i));
				rhs.push(r.children.get(i));
			}
		}
		return true;
	}

	// ==============================================================
	// Leaves
	// ==============================================================

	/**
	 * A boolean, integer or real constant. The value is held as a
	 * {@link Boolean}, {@link BigInteger} or {@link Rational} respectively.
	 */
	public static final class Constant extends Expr {
		private final Object value;

		Constant(Kind kind, Types.Type type, Object value) {
			super(kind, type, Collections.emptyList(), value);
			this.value = value;
		}

		public Object value() {
			return value;
		}

		public boolean booleanValue() {
			return (Boolean) value;
		}

		/**
		 * The value of a numeric constant as an exact rational.
		 *
		 * @return
		 */
		public Rational rationalValue() {
			if (value instanceof BigInteger) {
				return Rational.valueOf((BigInteger) value);
			}
			return (Rational) value;
		}

		@Override
		protected Object head() {
			return value;
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	/**
	 * A reference to a parameter of the enclosing action, method or task
	 * network.
	 */
	public static final class ParameterRef extends Expr {
		private final Model.Parameter parameter;

		ParameterRef(Model.Parameter parameter) {
			super(Kind.PARAMETER, parameter.type(), Collections.emptyList(), parameter);
			this.parameter = parameter;
		}

		public Model.Parameter parameter() {
			return parameter;
		}

		@Override
		protected Object head() {
			return parameter;
		}

		@Override
		public String toString() {
			return "?" + parameter.name();
		}
	}

	/**
	 * A reference to a variable bound by an enclosing quantifier.
	 */
	public static final class VariableRef extends Expr {
		private final Model.Variable variable;

		VariableRef(Model.Variable variable) {
			super(Kind.VARIABLE, variable.type(), Collections.emptyList(), variable);
			this.variable = variable;
		}

		public Model.Variable variable() {
			return variable;
		}

		@Override
		protected Object head() {
			return variable;
		}

		@Override
		public String toString() {
			return "?" + variable.name();
		}
	}

	public static final class ObjectRef extends Expr {
		private final Model.PlanningObject object;

		ObjectRef(Model.PlanningObject object) {
			super(Kind.OBJECT, object.type(), Collections.emptyList(), object);
			this.object = object;
		}

		public Model.PlanningObject object() {
			return object;
		}

		@Override
		protected Object head() {
			return object;
		}

		@Override
		public String toString() {
			return object.name();
		}
	}

	// ==============================================================
	// Compound expressions
	// ==============================================================

	/**
	 * The application of a fluent to zero or more arguments, such as
	 * <code>(on ?x ?y)</code>.
	 */
	public static final class FluentApp extends Expr {
		private final Model.Fluent fluent;

		FluentApp(Model.Fluent fluent, Expr... arguments) {
			super(Kind.FLUENT, fluent.type(), List.of(arguments), fluent);
			this.fluent = fluent;
		}

		public Model.Fluent fluent() {
			return fluent;
		}

		/**
		 * Check whether every argument of this application is an object, and
		 * hence it identifies a single state variable.
		 *
		 * @return
		 */
		public boolean isGround() {
			for (Expr arg : children()) {
				if (arg.kind() != Kind.OBJECT) {
					return false;
				}
			}
			return true;
		}

		@Override
		protected Object head() {
			return fluent;
		}

		@Override
		public String toString() {
			return children().isEmpty() ? "(" + fluent.name() + ")" : "(" + fluent.name() + " " + join(children()) + ")";
		}
	}

	/**
	 * A boolean, relational, arithmetic or trajectory operator applied to one or
	 * more operands.
	 */
	public static final class Operator extends Expr {
		Operator(Kind kind, Types.Type type, Expr... operands) {
			super(kind, type, List.of(operands), null);
		}

		@Override
		protected Object head() {
			return null;
		}

		@Override
		public String toString() {
			return "(" + symbol(kind()) + " " + join(children()) + ")";
		}
	}

	/**
	 * An existential or universal quantifier over one or more variables.
	 */
	public static final class Quantifier extends Expr {
		private final List<Model.Variable> variables;

		Quantifier(Kind kind, Types.Type type, List<Model.Variable> variables, Expr body) {
			super(kind, type, List.of(body), variables);
			this.variables = variables;
		}

		public List<Model.Variable> variables() {
			return variables;
		}

		public Expr body() {
			return child(0);
		}

		@Override
		protected Object head() {
			return variables;
		}

		@Override
		public String toString() {
			String vs = "";
			for (Model.Variable v : variables) {
				vs += (vs.isEmpty() ? "?" : " ?") + v.name() + " - " + v.type();
			}
			return "(" + symbol(kind()) + " (" + vs + ") " + body() + ")";
		}
	}

	private static String symbol(Kind kind) {
		switch (kind) {
		case EQUALS:
			return "=";
		case LE:
			return "<=";
		case LT:
			return "<";
		case PLUS:
			return "+";
		case MINUS:
			return "-";
		case TIMES:
			return "*";
		case DIV:
			return "/";
		default:
			return kind.name().toLowerCase().replace('_', '-');
		}
	}

	private static String join(List<Expr> exprs) {
		String r = "";
		for (Expr e : exprs) {
			r += r.isEmpty() ? e : " " + e;
		}
		return r;
	}
}
