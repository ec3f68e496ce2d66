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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import pddlfront.core.Syntax.Group;
import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.Node;
import pddlfront.core.Syntax.TypedList;
import pddlfront.io.Parser;
import pddlfront.util.Rational;
import pddlfront.util.SyntacticElement;
import pddlfront.util.SyntaxError;

/**
 * Responsible for compiling the raw parse tree of a formula (e.g. a
 * precondition, goal or effect value) into a typed {@link Expr}. Compilation
 * is driven by an explicit stack of frames, rather than by recursion, so that
 * formulas of arbitrary depth can be compiled. Each frame either
 * <i>descends</i> into a node, pushing frames for its children, or
 * <i>combines</i> the already compiled children of a node into the node
 * itself. For example, compiling <code>(and (p ?x) (not (q)))</code> proceeds
 * as follows:
 *
 * <pre>
 * descend (and ...)   => push combine(and,2), descend (p ?x), descend (not (q))
 * descend (p ?x)      => push combine(p,1), descend ?x
 * ...
 * combine(and,2)      => pop two results, push and(...)
 * </pre>
 *
 * A bare word is resolved, in order, as: a variable bound by an enclosing
 * quantifier; an object bound by the expansion of a universal effect; a
 * parameter of the enclosing action, method or task network (when it starts
 * with <code>?</code>); a fluent of no arguments; an object; and, finally, a
 * numeric literal.
 *
 * @author David J. Pearce
 *
 */
public class ExpressionCompiler {
	public final static String UNDEFINED_NAME = "Undefined name found";
	public final static String UNDEFINED_PARAMETER = "Undefined parameter";
	public final static String INVALID_EXPRESSION = "Found invalid expression";
	public final static String UNRECOGNISED_EXPRESSION = "Not able to handle";
	public final static String INVALID_ARITY = "Wrong number of operands";

	/**
	 * The forms of compound expression which are recognised by name.
	 */
	public enum Form {
		AND("and"), OR("or"), NOT("not"), IMPLY("imply"), GE(">="), LE("<="), GT(">"), LT("<"), EQUALS("="),
		PLUS("+"), MINUS("-"), DIV("/"), TIMES("*"), EXISTS("exists"), FORALL("forall"), ALWAYS("always"),
		SOMETIME("sometime"), SOMETIME_BEFORE("sometime-before"), SOMETIME_AFTER("sometime-after"),
		AT_MOST_ONCE("at-most-once"), UNRECOGNIZED(null);

		private final String keyword;

		private Form(String keyword) {
			this.keyword = keyword;
		}
	}

	private final ExpressionManager em;
	private final Model.Problem problem;
	private final TypeResolver.Table table;
	private final String source;
	private final Map<String, Form> forms;

	/**
	 * Construct a compiler for expressions in a given document.
	 *
	 * @param em
	 *            For constructing expressions
	 * @param problem
	 *            Provides the fluents and objects which names resolve to
	 * @param table
	 *            Provides the types of quantified variables
	 * @param source
	 *            Text of the document (for error reporting)
	 */
	public ExpressionCompiler(ExpressionManager em, Model.Problem problem, TypeResolver.Table table, String source) {
		this.em = em;
		this.problem = problem;
		this.table = table;
		this.source = source;
		HashMap<String, Form> forms = new HashMap<>();
		for (Form f : Form.values()) {
			if (f.keyword != null) {
				forms.put(f.keyword, f);
			}
		}
		this.forms = Collections.unmodifiableMap(forms);
	}

	public ExpressionManager manager() {
		return em;
	}

	public String source() {
		return source;
	}

	/**
	 * Determine the form of a compound expression from its leading word.
	 *
	 * @param head
	 * @return
	 */
	public Form form(Leaf head) {
		return head == null ? Form.UNRECOGNIZED : forms.getOrDefault(head.key(), Form.UNRECOGNIZED);
	}

	public Expr compile(Model.Parameterised enclosing, Scope scope, Node node) {
		return compile(enclosing, scope, node, Collections.emptyMap());
	}

	/**
	 * Compile a given node into a typed expression.
	 *
	 * @param enclosing
	 *            The action, method or task network whose parameters may be
	 *            referred to (or <code>null</code> if none).
	 * @param scope
	 *            Variables bound by enclosing quantifiers.
	 * @param node
	 *            Node to compile.
	 * @param assignments
	 *            Objects bound to the variables of an enclosing universal effect
	 *            which is being expanded, keyed by (lower case) variable name
	 *            including the leading <code>?</code>.
	 * @return
	 */
	public Expr compile(Model.Parameterised enclosing, Scope scope, Node node,
			Map<String, Model.PlanningObject> assignments) {
		ArrayDeque<Frame> stack = new ArrayDeque<>();
		ArrayDeque<Expr> results = new ArrayDeque<>();
		stack.push(new Frame(scope, node));
		while (!stack.isEmpty()) {
			Frame frame = stack.pop();
			if (frame.combine != null) {
				Expr[] operands = new Expr[frame.arity];
				for (int i = frame.arity - 1; i >= 0; --i) {
					operands[i] = results.pop();
				}
				results.push(combine(frame, operands));
			} else if (frame.node instanceof Leaf) {
				results.push(resolve(enclosing, frame.scope, (Leaf) frame.node, assignments));
			} else {
				descend(frame.scope, (Group) frame.node, stack, results);
			}
		}
		return results.pop();
	}

	/**
	 * Determine what kind of compound expression a group is, and schedule the
	 * compilation of its children.
	 */
	private void descend(Scope scope, Group g, ArrayDeque<Frame> stack, ArrayDeque<Expr> results) {
		if (g.isEmpty()) {
			results.push(em.TRUE);
			return;
		}
		Leaf head = g.head();
		Form form = form(head);
		switch (form) {
		case UNRECOGNIZED:
			if (head != null && problem.hasFluent(head.key())) {
				Model.Fluent fluent = problem.fluent(head.key());
				schedule(scope, g, 1, ops -> em.fluent(fluent, Arrays.asList(ops)), stack);
			} else if (g.size() == 1) {
				// redundant brackets
				stack.push(new Frame(scope, g.get(0)));
			} else {
				syntaxError(SyntaxError.Kind.RESOLUTION, UNRECOGNISED_EXPRESSION + ": " + g, g);
			}
			break;
		case EXISTS:
		case FORALL: {
			checkArity(g, 3);
			List<Model.Variable> variables = variables(g.get(1));
			Scope inner = scope.extend(variables);
			if (form == Form.EXISTS) {
				schedule(inner, g, 2, ops -> em.exists(variables, ops[0]), stack);
			} else {
				schedule(inner, g, 2, ops -> em.forall(variables, ops[0]), stack);
			}
			break;
		}
		case MINUS:
			if (g.size() == 2) {
				schedule(scope, g, 1, ops -> em.times(em.integer(-1), ops[0]), stack);
			} else {
				checkArity(g, 3);
				schedule(scope, g, 1, ops -> em.minus(Arrays.asList(ops)), stack);
			}
			break;
		case AND:
			schedule(scope, g, 1, ops -> em.and(Arrays.asList(ops)), stack);
			break;
		case OR:
			schedule(scope, g, 1, ops -> em.or(Arrays.asList(ops)), stack);
			break;
		case PLUS:
			checkMinimumArity(g, 2);
			schedule(scope, g, 1, ops -> em.plus(Arrays.asList(ops)), stack);
			break;
		case TIMES:
			checkMinimumArity(g, 2);
			schedule(scope, g, 1, ops -> em.times(Arrays.asList(ops)), stack);
			break;
		case NOT:
		case ALWAYS:
		case SOMETIME:
		case AT_MOST_ONCE:
			checkArity(g, 2);
			schedule(scope, g, 1, ops -> unary(form, ops[0]), stack);
			break;
		default:
			checkArity(g, 3);
			schedule(scope, g, 1, ops -> binary(form, ops[0], ops[1]), stack);
		}
	}

	private Expr unary(Form form, Expr operand) {
		switch (form) {
		case NOT:
			return em.not(operand);
		case ALWAYS:
			return em.always(operand);
		case SOMETIME:
			return em.sometime(operand);
		default:
			return em.atMostOnce(operand);
		}
	}

	private Expr binary(Form form, Expr lhs, Expr rhs) {
		switch (form) {
		case IMPLY:
			return em.implies(lhs, rhs);
		case GE:
			return em.ge(lhs, rhs);
		case LE:
			return em.le(lhs, rhs);
		case GT:
			return em.gt(lhs, rhs);
		case LT:
			return em.lt(lhs, rhs);
		case EQUALS:
			return em.equals(lhs, rhs);
		case DIV:
			return em.div(lhs, rhs);
		case SOMETIME_BEFORE:
			return em.sometimeBefore(lhs, rhs);
		default:
			return em.sometimeAfter(lhs, rhs);
		}
	}

	/**
	 * Push a combine frame for a group followed by descend frames for its
	 * children from a given index. Children are pushed in reverse, hence they are
	 * compiled (and their results pushed) from left to right.
	 */
	private void schedule(Scope scope, Group g, int from, Combiner combiner, ArrayDeque<Frame> stack) {
		int arity = g.size() - from;
		stack.push(new Frame(g, arity, combiner));
		for (int i = g.size() - 1; i >= from; --i) {
			stack.push(new Frame(scope, g.get(i)));
		}
	}

	private Expr combine(Frame frame, Expr[] operands) {
		try {
			return frame.combine.apply(operands);
		} catch (IllegalArgumentException e) {
			syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_EXPRESSION + ": " + e.getMessage(), frame.node, e);
			return null; // dead code
		}
	}

	/**
	 * Resolve a single word.
	 */
	private Expr resolve(Model.Parameterised enclosing, Scope scope, Leaf leaf,
			Map<String, Model.PlanningObject> assignments) {
		String key = leaf.key();
		Model.Variable variable = scope.get(key);
		if (variable != null) {
			return em.variable(variable);
		}
		Model.PlanningObject assigned = assignments.get(key);
		if (assigned != null) {
			return em.object(assigned);
		} else if (leaf.isVariable()) {
			Model.Parameter p = enclosing == null ? null : enclosing.parameter(leaf.name());
			if (p == null) {
				syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_PARAMETER + ": " + leaf, leaf);
			}
			return em.parameter(p);
		} else if (problem.hasFluent(key)) {
			try {
				return em.fluent(problem.fluent(key), Collections.emptyList());
			} catch (IllegalArgumentException e) {
				syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_EXPRESSION + ": " + e.getMessage(), leaf, e);
			}
		} else if (problem.hasObject(key)) {
			return em.object(problem.object(key));
		}
		try {
			return em.number(Rational.parse(leaf.text()));
		} catch (NumberFormatException e) {
			syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_NAME + ": " + leaf, leaf);
			return null; // dead code
		}
	}

	/**
	 * Declare the variables of a quantifier, such as
	 * <code>(?x ?y - block ?z)</code>. Untyped variables have the
	 * <code>object</code> type.
	 *
	 * @param node
	 * @return
	 */
	public List<Model.Variable> variables(Node node) {
		if (!(node instanceof Group)) {
			syntaxError(SyntaxError.Kind.STRUCTURAL, "expecting variable list, found " + node, node);
		}
		ArrayList<Model.Variable> variables = new ArrayList<>();
		ArrayList<String> names = new ArrayList<>();
		for (TypedList tl : Parser.parseTypedList(source, (Group) node, 0, true)) {
			Types.User type = table.resolve(tl, source);
			for (Leaf name : tl.names()) {
				if (names.contains(name.key())) {
					syntaxError(SyntaxError.Kind.DECLARATION, "Variable declared more than once: " + name, name);
				}
				names.add(name.key());
				variables.add(new Model.Variable(name.name(), type));
			}
		}
		if (variables.isEmpty()) {
			syntaxError(SyntaxError.Kind.STRUCTURAL, "expecting at least one variable", node);
		}
		return variables;
	}

	private void checkArity(Group g, int size) {
		if (g.size() != size) {
			syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_ARITY + ": " + g, g);
		}
	}

	private void checkMinimumArity(Group g, int size) {
		if (g.size() < size) {
			syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_ARITY + ": " + g, g);
		}
	}

	private void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e) {
		SyntaxError.syntaxError(kind, msg, source, e);
	}

	private void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e, Throwable ex) {
		SyntaxError.syntaxError(kind, msg, source, e, ex);
	}

	/**
	 * Constructs an expression from its compiled operands.
	 */
	private interface Combiner {
		public Expr apply(Expr[] operands);
	}

	/**
	 * An entry on the compilation stack. A descend frame holds the node to be
	 * compiled in a given scope, whilst a combine frame holds the number of
	 * compiled operands to pop and how to combine them.
	 */
	private static final class Frame {
		private final Scope scope;
		private final Node node;
		private final int arity;
		private final Combiner combine;

		public Frame(Scope scope, Node node) {
			this.scope = scope;
			this.node = node;
			this.arity = 0;
			this.combine = null;
		}

		public Frame(Node node, int arity, Combiner combine) {
			this.scope = null;
			this.node = node;
			this.arity = arity;
			this.combine = combine;
		}
	}

	/**
	 * An immutable mapping from the names of quantified variables (including
	 * the leading <code>?</code>) to the variables themselves. Extending a scope
	 * produces a new scope which also sees the bindings of its parent.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Scope {
		public static final Scope EMPTY = new Scope(null, Collections.emptyMap());

		private final Scope parent;
		private final Map<String, Model.Variable> bindings;

		private Scope(Scope parent, Map<String, Model.Variable> bindings) {
			this.parent = parent;
			this.bindings = bindings;
		}

		/**
		 * Get the variable bound to a given name (e.g. <code>?x</code>), or
		 * <code>null</code> if there is none.
		 *
		 * @param name
		 * @return
		 */
		public Model.Variable get(String name) {
			String key = Syntax.canonical(name);
			for (Scope s = this; s != null; s = s.parent) {
				Model.Variable v = s.bindings.get(key);
				if (v != null) {
					return v;
				}
			}
			return null;
		}

		public Scope extend(List<Model.Variable> variables) {
			HashMap<String, Model.Variable> bindings = new HashMap<>();
			for (Model.Variable v : variables) {
				bindings.put("?" + Syntax.canonical(v.name()), v);
			}
			return new Scope(this, Collections.unmodifiableMap(bindings));
		}
	}
}
