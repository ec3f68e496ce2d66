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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import pddlfront.core.Expr.Constant;
import pddlfront.core.Expr.Kind;
import pddlfront.util.Rational;

/**
 * Responsible for constructing well-typed expressions. Every factory method
 * checks the types of its operands and throws an
 * {@link IllegalArgumentException} describing the problem when they are
 * unsuitable. Boolean operators require boolean operands, arithmetic and
 * ordering operators require numeric operands, and fluent applications must
 * match the fluent's signature.
 *
 * @author David J. Pearce
 *
 */
public class ExpressionManager {
	private final Types.Manager types;
	public final Expr TRUE;
	public final Expr FALSE;

	public ExpressionManager(Types.Manager types) {
		this.types = types;
		this.TRUE = new Constant(Kind.BOOL_CONSTANT, types.bool(), Boolean.TRUE);
		this.FALSE = new Constant(Kind.BOOL_CONSTANT, types.bool(), Boolean.FALSE);
	}

	public Types.Manager types() {
		return types;
	}

	// ==============================================================
	// Constants and references
	// ==============================================================

	public Expr bool(boolean value) {
		return value ? TRUE : FALSE;
	}

	public Expr integer(long value) {
		return integer(BigInteger.valueOf(value));
	}

	public Expr integer(BigInteger value) {
		return new Constant(Kind.INT_CONSTANT, types.integer(), value);
	}

	public Expr real(Rational value) {
		return new Constant(Kind.REAL_CONSTANT, types.real(), value);
	}

	/**
	 * Construct a numeric constant which is an integer when the given value is
	 * integral, and a real otherwise.
	 *
	 * @param value
	 * @return
	 */
	public Expr number(Rational value) {
		return value.isInteger() ? integer(value.numerator()) : real(value);
	}

	public Expr parameter(Model.Parameter parameter) {
		return new Expr.ParameterRef(parameter);
	}

	public Expr variable(Model.Variable variable) {
		return new Expr.VariableRef(variable);
	}

	public Expr object(Model.PlanningObject object) {
		return new Expr.ObjectRef(object);
	}

	/**
	 * Apply a fluent to some arguments.
	 *
	 * @param fluent
	 * @param arguments
	 * @return
	 */
	public Expr.FluentApp fluent(Model.Fluent fluent, List<Expr> arguments) {
		List<Model.Parameter> signature = fluent.signature();
		if (signature.size() != arguments.size()) {
			throw new IllegalArgumentException("fluent " + fluent + " expects " + signature.size()
					+ " argument(s), but " + arguments.size() + " given");
		}
		for (int i = 0; i != arguments.size(); ++i) {
			Types.Type expected = signature.get(i).type();
			Expr arg = arguments.get(i);
			if (expected.isUser() && !arg.type().isUser()) {
				throw new IllegalArgumentException("argument " + arg + " of fluent " + fluent + " is not an object");
			} else if (!Types.isCompatible(expected, arg.type())) {
				throw new IllegalArgumentException("argument " + arg + " of fluent " + fluent + " has type "
						+ arg.type() + ", expected " + expected);
			}
		}
		return new Expr.FluentApp(fluent, arguments.toArray(new Expr[arguments.size()]));
	}

	// ==============================================================
	// Boolean operators
	// ==============================================================

	/**
	 * Construct a conjunction. The empty conjunction is <code>true</code>, and a
	 * conjunction of one operand is that operand.
	 *
	 * @param operands
	 * @return
	 */
	public Expr and(List<Expr> operands) {
		checkBoolean("and", operands);
		if (operands.isEmpty()) {
			return TRUE;
		} else if (operands.size() == 1) {
			return operands.get(0);
		}
		return new Expr.Operator(Kind.AND, types.bool(), toArray(operands));
	}

	public Expr and(Expr... operands) {
		return and(Arrays.asList(operands));
	}

	/**
	 * Construct a disjunction. The empty disjunction is <code>false</code>, and
	 * a disjunction of one operand is that operand.
	 *
	 * @param operands
	 * @return
	 */
	public Expr or(List<Expr> operands) {
		checkBoolean("or", operands);
		if (operands.isEmpty()) {
			return FALSE;
		} else if (operands.size() == 1) {
			return operands.get(0);
		}
		return new Expr.Operator(Kind.OR, types.bool(), toArray(operands));
	}

	public Expr or(Expr... operands) {
		return or(Arrays.asList(operands));
	}

	public Expr not(Expr operand) {
		checkBoolean("not", List.of(operand));
		return new Expr.Operator(Kind.NOT, types.bool(), operand);
	}

	public Expr implies(Expr lhs, Expr rhs) {
		checkBoolean("imply", List.of(lhs, rhs));
		return new Expr.Operator(Kind.IMPLIES, types.bool(), lhs, rhs);
	}

	/**
	 * Construct an equality. Both sides must be numeric, or must be objects of
	 * related types.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public Expr equals(Expr lhs, Expr rhs) {
		Types.Type l = lhs.type();
		Types.Type r = rhs.type();
		boolean ok = (l.isNumeric() && r.isNumeric()) || Types.isCompatible(l, r) || Types.isCompatible(r, l);
		if (!ok) {
			throw new IllegalArgumentException("cannot compare " + lhs + " with " + rhs);
		}
		return new Expr.Operator(Kind.EQUALS, types.bool(), lhs, rhs);
	}

	public Expr le(Expr lhs, Expr rhs) {
		checkNumeric("<=", List.of(lhs, rhs));
		return new Expr.Operator(Kind.LE, types.bool(), lhs, rhs);
	}

	public Expr lt(Expr lhs, Expr rhs) {
		checkNumeric("<", List.of(lhs, rhs));
		return new Expr.Operator(Kind.LT, types.bool(), lhs, rhs);
	}

	/**
	 * Construct <code>lhs &gt;= rhs</code>, which is represented as
	 * <code>rhs &lt;= lhs</code>.
	 */
	public Expr ge(Expr lhs, Expr rhs) {
		return le(rhs, lhs);
	}

	/**
	 * Construct <code>lhs &gt; rhs</code>, which is represented as
	 * <code>rhs &lt; lhs</code>.
	 */
	public Expr gt(Expr lhs, Expr rhs) {
		return lt(rhs, lhs);
	}

	// ==============================================================
	// Arithmetic operators
	// ==============================================================

	public Expr plus(List<Expr> operands) {
		return arithmetic(Kind.PLUS, "+", operands);
	}

	public Expr minus(List<Expr> operands) {
		return arithmetic(Kind.MINUS, "-", operands);
	}

	public Expr times(List<Expr> operands) {
		return arithmetic(Kind.TIMES, "*", operands);
	}

	public Expr times(Expr... operands) {
		return times(Arrays.asList(operands));
	}

	/**
	 * Construct a division, which is always real-valued.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public Expr div(Expr lhs, Expr rhs) {
		checkNumeric("/", List.of(lhs, rhs));
		return new Expr.Operator(Kind.DIV, types.real(), lhs, rhs);
	}

	private Expr arithmetic(Kind kind, String symbol, List<Expr> operands) {
		if (operands.isEmpty()) {
			throw new IllegalArgumentException("'" + symbol + "' requires at least one operand");
		}
		checkNumeric(symbol, operands);
		return new Expr.Operator(kind, numericType(operands), toArray(operands));
	}

	/**
	 * The type of an arithmetic operation, which is an integer only when every
	 * operand is an integer.
	 */
	private Types.Type numericType(List<Expr> operands) {
		for (Expr e : operands) {
			if (!(e.type() instanceof Types.Int)) {
				return types.real();
			}
		}
		return types.integer();
	}

	// ==============================================================
	// Quantifiers and trajectory constraints
	// ==============================================================

	public Expr exists(List<Model.Variable> variables, Expr body) {
		return quantifier(Kind.EXISTS, variables, body);
	}

	public Expr forall(List<Model.Variable> variables, Expr body) {
		return quantifier(Kind.FORALL, variables, body);
	}

	private Expr quantifier(Kind kind, List<Model.Variable> variables, Expr body) {
		if (variables.isEmpty()) {
			throw new IllegalArgumentException("quantifier requires at least one variable");
		}
		checkBoolean(kind.name().toLowerCase(), List.of(body));
		return new Expr.Quantifier(kind, types.bool(), List.copyOf(variables), body);
	}

	public Expr always(Expr e) {
		return trajectory(Kind.ALWAYS, e);
	}

	public Expr sometime(Expr e) {
		return trajectory(Kind.SOMETIME, e);
	}

	public Expr atMostOnce(Expr e) {
		return trajectory(Kind.AT_MOST_ONCE, e);
	}

	public Expr sometimeBefore(Expr phi, Expr psi) {
		return trajectory(Kind.SOMETIME_BEFORE, phi, psi);
	}

	public Expr sometimeAfter(Expr phi, Expr psi) {
		return trajectory(Kind.SOMETIME_AFTER, phi, psi);
	}

	private Expr trajectory(Kind kind, Expr... operands) {
		checkBoolean(kind.name().toLowerCase().replace('_', '-'), Arrays.asList(operands));
		return new Expr.Operator(kind, types.bool(), operands);
	}

	// ==============================================================
	// Simplification
	// ==============================================================

	/**
	 * Simplify an expression by folding constants, flattening nested
	 * conjunctions and disjunctions, and removing their neutral elements. This
	 * is bottom-up and uses an explicit stack, hence it does not depend on the
	 * depth of the expression.
	 *
	 * @param e
	 * @return
	 */
	public Expr simplify(Expr e) {
		ArrayDeque<Expr> todo = new ArrayDeque<>();
		ArrayDeque<Boolean> visited = new ArrayDeque<>();
		ArrayDeque<Expr> results = new ArrayDeque<>();
		todo.push(e);
		visited.push(false);
		while (!todo.isEmpty()) {
			Expr next = todo.pop();
			boolean ready = visited.pop();
			List<Expr> children = next.children();
			if (children.isEmpty()) {
				results.push(next);
			} else if (!ready) {
				todo.push(next);
				visited.push(true);
				for (int i = children.size() - 1; i >= 0; --i) {
					todo.push(children.get(i));
					visited.push(false);
				}
			} else {
				Expr[] operands = new Expr[children.size()];
				for (int i = operands.length - 1; i >= 0; --i) {
					operands[i] = results.pop();
				}
				results.push(rebuild(next, operands));
			}
		}
		return results.pop();
	}

	/**
	 * Reconstruct a node from its simplified operands.
	 */
	private Expr rebuild(Expr original, Expr[] operands) {
		switch (original.kind()) {
		case AND:
			return simplifyJunction(Kind.AND, operands);
		case OR:
			return simplifyJunction(Kind.OR, operands);
		case NOT: {
			Expr o = operands[0];
			if (o.isConstant()) {
				return bool(!((Constant) o).booleanValue());
			} else if (o.kind() == Kind.NOT) {
				return o.child(0);
			}
			return not(o);
		}
		case IMPLIES: {
			Expr l = operands[0];
			Expr r = operands[1];
			if (l.isFalse() || r.isTrue()) {
				return TRUE;
			} else if (l.isTrue()) {
				return r;
			} else if (r.isFalse()) {
				return rebuild(not(l), new Expr[] { l });
			}
			return implies(l, r);
		}
		case EQUALS: {
			Expr l = operands[0];
			Expr r = operands[1];
			if (l.isConstant() && r.isConstant()) {
				if (l.type().isNumeric()) {
					return bool(compare(l, r) == 0);
				}
				return bool(((Constant) l).value().equals(((Constant) r).value()));
			} else if (l.kind() == Kind.OBJECT && r.kind() == Kind.OBJECT) {
				return bool(l.equals(r));
			}
			return equals(l, r);
		}
		case LE:
			if (operands[0].isConstant() && operands[1].isConstant()) {
				return bool(compare(operands[0], operands[1]) <= 0);
			}
			return le(operands[0], operands[1]);
		case LT:
			if (operands[0].isConstant() && operands[1].isConstant()) {
				return bool(compare(operands[0], operands[1]) < 0);
			}
			return lt(operands[0], operands[1]);
		case PLUS:
		case MINUS:
		case TIMES:
		case DIV:
			return fold(original, operands);
		case FLUENT:
			return fluent(((Expr.FluentApp) original).fluent(), Arrays.asList(operands));
		case EXISTS:
		case FORALL:
			if (operands[0].isConstant()) {
				return operands[0];
			}
			return quantifier(original.kind(), ((Expr.Quantifier) original).variables(), operands[0]);
		default:
			return trajectory(original.kind(), operands);
		}
	}

	private Expr simplifyJunction(Kind kind, Expr[] operands) {
		// the absorbing element of a conjunction is false, for a disjunction it is true
		boolean absorbing = kind == Kind.OR;
		ArrayList<Expr> flat = new ArrayList<>();
		for (Expr o : operands) {
			List<Expr> items = o.kind() == kind ? o.children() : List.of(o);
			for (Expr i : items) {
				if (i.isConstant()) {
					if (((Constant) i).booleanValue() == absorbing) {
						return bool(absorbing);
					}
				} else if (!flat.contains(i)) {
					flat.add(i);
				}
			}
		}
		return kind == Kind.AND ? and(flat) : or(flat);
	}

	private Expr fold(Expr original, Expr[] operands) {
		for (Expr o : operands) {
			if (!o.isConstant()) {
				return rebuildArithmetic(original.kind(), operands);
			}
		}
		Rational r = ((Constant) operands[0]).rationalValue();
		if (operands.length == 1 && original.kind() == Kind.MINUS) {
			r = r.negate();
		}
		for (int i = 1; i < operands.length; ++i) {
			Rational v = ((Constant) operands[i]).rationalValue();
			switch (original.kind()) {
			case PLUS:
				r = r.add(v);
				break;
			case MINUS:
				r = r.subtract(v);
				break;
			case TIMES:
				r = r.multiply(v);
				break;
			default:
				if (v.signum() == 0) {
					return rebuildArithmetic(original.kind(), operands);
				}
				r = r.divide(v);
			}
		}
		return original.type() instanceof Types.Int ? integer(r.numerator()) : real(r);
	}

	private Expr rebuildArithmetic(Kind kind, Expr[] operands) {
		switch (kind) {
		case PLUS:
			return plus(Arrays.asList(operands));
		case MINUS:
			return minus(Arrays.asList(operands));
		case TIMES:
			return times(Arrays.asList(operands));
		default:
			return div(operands[0], operands[1]);
		}
	}

	private static int compare(Expr lhs, Expr rhs) {
		return ((Constant) lhs).rationalValue().compareTo(((Constant) rhs).rationalValue());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static void checkBoolean(String operator, List<Expr> operands) {
		for (Expr e : operands) {
			if (!e.type().isBool()) {
				throw new IllegalArgumentException("operand " + e + " of '" + operator + "' is not boolean");
			}
		}
	}

	private static void checkNumeric(String operator, List<Expr> operands) {
		for (Expr e : operands) {
			if (!e.type().isNumeric()) {
				throw new IllegalArgumentException("operand " + e + " of '" + operator + "' is not numeric");
			}
		}
	}

	private static Expr[] toArray(List<Expr> operands) {
		return operands.toArray(new Expr[operands.size()]);
	}
}
