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
package pddlfront.io;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import pddlfront.core.Syntax;
import pddlfront.core.Syntax.Group;
import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.Node;
import pddlfront.core.Syntax.TypedList;
import pddlfront.io.Lexer.LeftBrace;
import pddlfront.io.Lexer.RightBrace;
import pddlfront.io.Lexer.Token;
import pddlfront.util.SyntacticElement;
import pddlfront.util.SyntacticElement.Attribute;
import pddlfront.util.SyntaxError;

/**
 * Responsible for turning a sequence of tokens into the parse tree of a PDDL
 * domain or problem. This happens in two steps. First, the tokens are read into
 * a tree of nested {@link Group}s using an explicit stack, so that arbitrarily
 * deep formulas never exhaust the call stack. Second, the (shallow) top-level
 * structure of that tree is checked against the grammar of a domain or problem
 * to produce a {@link Syntax.Domain} or {@link Syntax.Problem}. Bodies such as
 * preconditions, effects and goals are left as raw nodes.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	public final static String UNBALANCED_BRACKET = "unbalanced ')'";
	public final static String MISSING_BRACKET = "unexpected end-of-file, missing ')'";
	public final static String EXPECTED_OPEN = "expecting '('";
	public final static String TRAILING_INPUT = "unexpected input after end of definition";
	public final static String EMPTY_INPUT = "empty input";
	public final static String SECTION_OUT_OF_ORDER = "section out of order";
	public final static String DUPLICATE_SECTION = "section declared more than once";
	public final static String MISSING_SECTION = "missing section";
	public final static String UNKNOWN_SECTION = "unknown section";
	public final static String UNKNOWN_REQUIREMENT = "unknown requirement";
	public final static String UNKNOWN_PROPERTY = "unknown property";
	public final static String DUPLICATE_PROPERTY = "property given more than once";
	public final static String MISSING_PROPERTY = "missing property";
	public final static String INVALID_NAME = "invalid name";
	public final static String INVALID_VARIABLE = "invalid variable";
	public final static String INVALID_TYPED_LIST = "type expected after '-'";
	public final static String INVALID_FUNCTION_TYPE = "only numeric functions are supported";

	/**
	 * The requirement flags which may be declared.
	 */
	public final static Set<String> REQUIREMENTS = Set.of(":strips", ":typing", ":negative-preconditions",
			":disjunctive-preconditions", ":equality", ":existential-preconditions", ":universal-preconditions",
			":quantified-preconditions", ":conditional-effects", ":fluents", ":numeric-fluents", ":adl",
			":durative-actions", ":duration-inequalities", ":timed-initial-literals", ":action-costs", ":hierarchy",
			":method-preconditions", ":constraints", ":contingent", ":preferences");

	private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_\\-]*");

	/**
	 * Rank of each domain section. Sections must appear in increasing rank, and
	 * only tasks, methods and actions may be repeated.
	 */
	private static final Map<String, Integer> DOMAIN_SECTIONS = Map.of(":requirements", 1, ":types", 2,
			":constants", 3, ":predicates", 4, ":functions", 5, ":task", 6, ":method", 7, ":action", 8,
			":durative-action", 8);

	private static final Map<String, Integer> PROBLEM_SECTIONS = Map.of(":domain", 1, ":requirements", 2,
			":objects", 3, ":htn", 4, ":init", 5, ":goal", 6, ":constraints", 7, ":metric", 8);

	private static final Map<String, String> ACTION_PROPERTIES = Map.of(":parameters", ":parameters",
			":precondition", ":precondition", ":effect", ":effect", ":observe", ":observe");

	private static final Map<String, String> DURATIVE_PROPERTIES = Map.of(":parameters", ":parameters",
			":duration", ":duration", ":condition", ":condition", ":effect", ":effect");

	private static final Map<String, String> TASK_PROPERTIES = Map.of(":parameters", ":parameters");

	private static final Map<String, String> METHOD_PROPERTIES = Map.of(":parameters", ":parameters", ":task",
			":task", ":precondition", ":precondition", ":ordered-subtasks", ":ordered-subtasks", ":ordered-tasks",
			":ordered-subtasks", ":subtasks", ":subtasks", ":tasks", ":subtasks", ":ordering", ":ordering",
			":constraints", ":constraints");

	private static final Map<String, String> NETWORK_PROPERTIES = Map.of(":parameters", ":parameters",
			":ordered-subtasks", ":ordered-subtasks", ":ordered-tasks", ":ordered-subtasks", ":subtasks",
			":subtasks", ":tasks", ":subtasks", ":ordering", ":ordering", ":constraints", ":constraints");

	private final String source;
	private final List<Token> tokens;

	/**
	 * Construct a parser for a given list of tokens.
	 *
	 * @param source
	 *            The text the tokens were scanned from (used for error
	 *            reporting).
	 * @param tokens
	 */
	public Parser(String source, List<Token> tokens) {
		this.source = source;
		this.tokens = new ArrayList<>(tokens);
	}

	// ==============================================================
	// Nested expressions
	// ==============================================================

	/**
	 * Read the entire token sequence as exactly one bracketed group. This uses an
	 * explicit stack of open groups rather than recursion, hence the depth of
	 * nesting is limited only by available memory.
	 *
	 * @return
	 */
	public Group read() {
		Deque<Open> stack = new ArrayDeque<>();
		Group result = null;
		for (int index = 0; index != tokens.size(); ++index) {
			Token t = tokens.get(index);
			if (result != null) {
				syntaxError(TRAILING_INPUT, t);
			} else if (t instanceof LeftBrace) {
				stack.push(new Open(t.start));
			} else if (t instanceof RightBrace) {
				if (stack.isEmpty()) {
					syntaxError(UNBALANCED_BRACKET, t);
				}
				Open open = stack.pop();
				Node[] children = open.children.toArray(new Node[open.children.size()]);
				Group g = new Group(children, new Attribute.Source(open.start, t.start));
				if (stack.isEmpty()) {
					result = g;
				} else {
					stack.peek().children.add(g);
				}
			} else if (stack.isEmpty()) {
				syntaxError(EXPECTED_OPEN, t);
			} else {
				stack.peek().children.add(new Leaf(t.text, new Attribute.Source(t.start, t.end())));
			}
		}
		if (!stack.isEmpty()) {
			int start = stack.peek().start;
			throw new SyntaxError(MISSING_BRACKET, source, start, start);
		} else if (result == null) {
			throw new SyntaxError(EMPTY_INPUT, source, 0, 0);
		}
		return result;
	}

	/**
	 * A group whose closing bracket has not yet been reached.
	 */
	private static final class Open {
		private final int start;
		private final ArrayList<Node> children = new ArrayList<>();

		public Open(int start) {
			this.start = start;
		}
	}

	// ==============================================================
	// Domains
	// ==============================================================

	/**
	 * Parse a domain definition of the form:
	 *
	 * <pre>
	 * Domain ::= '(' 'define' '(' 'domain' Name ')'
	 *                [Requirements] [Types] [Constants] [Predicates] [Functions]
	 *                Task* Method* (Action | DurativeAction)* ')'
	 * </pre>
	 *
	 * @return
	 */
	public Syntax.Domain parseDomain() {
		Group root = read();
		Leaf name = parseHeader(root, "domain");
		List<Leaf> requirements = new ArrayList<>();
		List<TypedList> types = new ArrayList<>();
		List<TypedList> constants = new ArrayList<>();
		List<Syntax.Signature> predicates = new ArrayList<>();
		List<Syntax.Signature> functions = new ArrayList<>();
		List<Syntax.TaskDecl> tasks = new ArrayList<>();
		List<Syntax.MethodDecl> methods = new ArrayList<>();
		List<Syntax.OperatorDecl> actions = new ArrayList<>();
		int rank = 0;
		for (int i = 2; i < root.size(); ++i) {
			Group section = matchGroup(root.get(i));
			Leaf keyword = matchKeyword(section);
			rank = checkOrder(DOMAIN_SECTIONS, keyword, rank, 6);
			switch (keyword.key()) {
			case ":requirements":
				requirements = parseRequirements(section);
				break;
			case ":types":
				types = parseTypedList(source, section, 1, false);
				break;
			case ":constants":
				constants = parseTypedList(source, section, 1, false);
				break;
			case ":predicates":
				for (int j = 1; j < section.size(); ++j) {
					predicates.add(parseSignature(matchGroup(section.get(j))));
				}
				break;
			case ":functions":
				functions = parseFunctions(section);
				break;
			case ":task":
				tasks.add(parseTask(section));
				break;
			case ":method":
				methods.add(parseMethod(section));
				break;
			case ":action":
				actions.add(parseAction(section));
				break;
			default:
				actions.add(parseDurativeAction(section));
			}
		}
		return new Syntax.Domain(name, requirements, types, constants, predicates, functions, tasks, methods, actions,
				root.source());
	}

	private List<Leaf> parseRequirements(Group section) {
		ArrayList<Leaf> requirements = new ArrayList<>();
		for (int i = 1; i < section.size(); ++i) {
			Leaf flag = matchLeaf(section.get(i));
			if (!REQUIREMENTS.contains(flag.key())) {
				syntaxError(UNKNOWN_REQUIREMENT + ": " + flag, flag);
			}
			requirements.add(flag);
		}
		return requirements;
	}

	/**
	 * Parse a predicate or function signature of the form:
	 *
	 * <pre>
	 * Signature ::= '(' Name TypedVariables ')'
	 * </pre>
	 *
	 * @param g
	 * @return
	 */
	private Syntax.Signature parseSignature(Group g) {
		Leaf name = matchName(child(g, 0));
		return new Syntax.Signature(name, parseTypedList(source, g, 1, true), g.source());
	}

	/**
	 * Parse the body of a functions section, where each signature may be
	 * followed by <code>- number</code>.
	 *
	 * @param section
	 * @return
	 */
	private List<Syntax.Signature> parseFunctions(Group section) {
		ArrayList<Syntax.Signature> functions = new ArrayList<>();
		for (int i = 1; i < section.size(); ++i) {
			Node n = section.get(i);
			if (n instanceof Leaf && ((Leaf) n).is("-") && !functions.isEmpty()) {
				Leaf type = matchLeaf(child(section, ++i));
				if (!type.is("number")) {
					syntaxError(INVALID_FUNCTION_TYPE, type);
				}
			} else {
				functions.add(parseSignature(matchGroup(n)));
			}
		}
		return functions;
	}

	private Syntax.TaskDecl parseTask(Group section) {
		Leaf name = matchName(child(section, 1));
		Map<String, Node> properties = parseProperties(section, 2, TASK_PROPERTIES);
		return new Syntax.TaskDecl(name, parseParameters(properties, section, true), section.source());
	}

	/**
	 * Parse an action of the form:
	 *
	 * <pre>
	 * Action ::= '(' ':action' Name ':parameters' '(' TypedVariables ')'
	 *                [':precondition' Expr] [':effect' Expr] [':observe' Expr] ')'
	 * </pre>
	 *
	 * @param section
	 * @return
	 */
	private Syntax.ActionDecl parseAction(Group section) {
		Leaf name = matchName(child(section, 1));
		Map<String, Node> properties = parseProperties(section, 2, ACTION_PROPERTIES);
		List<TypedList> parameters = parseParameters(properties, section, true);
		return new Syntax.ActionDecl(name, parameters, properties.get(":precondition"), properties.get(":effect"),
				properties.get(":observe"), section.source());
	}

	/**
	 * Parse a durative action of the form:
	 *
	 * <pre>
	 * DurativeAction ::= '(' ':durative-action' Name ':parameters' '(' TypedVariables ')'
	 *                        ':duration' Expr ':condition' Expr ':effect' Expr ')'
	 * </pre>
	 *
	 * @param section
	 * @return
	 */
	private Syntax.DurativeActionDecl parseDurativeAction(Group section) {
		Leaf name = matchName(child(section, 1));
		Map<String, Node> properties = parseProperties(section, 2, DURATIVE_PROPERTIES);
		List<TypedList> parameters = parseParameters(properties, section, true);
		Node duration = require(properties, ":duration", section);
		Node condition = require(properties, ":condition", section);
		Node effect = require(properties, ":effect", section);
		return new Syntax.DurativeActionDecl(name, parameters, duration, condition, effect, section.source());
	}

	/**
	 * Parse a method of the form:
	 *
	 * <pre>
	 * Method ::= '(' ':method' Name ':parameters' '(' TypedVariables ')' ':task' Expr
	 *                [':precondition' Expr] [':ordered-subtasks' Expr] [':subtasks' Expr]
	 *                [':ordering' Expr] [':constraints' Expr] ')'
	 * </pre>
	 *
	 * @param section
	 * @return
	 */
	private Syntax.MethodDecl parseMethod(Group section) {
		Leaf name = matchName(child(section, 1));
		Map<String, Node> properties = parseProperties(section, 2, METHOD_PROPERTIES);
		List<TypedList> parameters = parseParameters(properties, section, true);
		Group task = matchGroup(require(properties, ":task", section));
		Syntax.NetworkDecl network = new Syntax.NetworkDecl(parameters, properties.get(":ordered-subtasks"),
				properties.get(":subtasks"), properties.get(":ordering"), properties.get(":constraints"),
				section.source());
		return new Syntax.MethodDecl(name, parameters, task, properties.get(":precondition"), network,
				section.source());
	}

	// ==============================================================
	// Problems
	// ==============================================================

	/**
	 * Parse a problem definition of the form:
	 *
	 * <pre>
	 * Problem ::= '(' 'define' '(' 'problem' Name ')' '(' ':domain' Name ')'
	 *                 [Requirements] [Objects] [Htn] Init [Goal] [Constraints] [Metric] ')'
	 * </pre>
	 *
	 * @return
	 */
	public Syntax.Problem parseProblem() {
		Group root = read();
		Leaf name = parseHeader(root, "problem");
		Leaf domain = null;
		List<Leaf> requirements = new ArrayList<>();
		List<TypedList> objects = new ArrayList<>();
		Syntax.NetworkDecl network = null;
		List<Node> init = null;
		Node goal = null;
		Node constraints = null;
		Syntax.MetricDecl metric = null;
		int rank = 0;
		for (int i = 2; i < root.size(); ++i) {
			Group section = matchGroup(root.get(i));
			Leaf keyword = matchKeyword(section);
			rank = checkOrder(PROBLEM_SECTIONS, keyword, rank, Integer.MAX_VALUE);
			switch (keyword.key()) {
			case ":domain":
				checkSize(section, 2);
				domain = matchName(section.get(1));
				break;
			case ":requirements":
				requirements = parseRequirements(section);
				break;
			case ":objects":
				objects = parseTypedList(source, section, 1, false);
				break;
			case ":htn": {
				Map<String, Node> properties = parseProperties(section, 1, NETWORK_PROPERTIES);
				List<TypedList> parameters = parseParameters(properties, section, false);
				network = new Syntax.NetworkDecl(parameters, properties.get(":ordered-subtasks"),
						properties.get(":subtasks"), properties.get(":ordering"), properties.get(":constraints"),
						section.source());
				break;
			}
			case ":init":
				init = new ArrayList<>();
				for (int j = 1; j < section.size(); ++j) {
					init.add(matchGroup(section.get(j)));
				}
				break;
			case ":goal":
				checkSize(section, 2);
				goal = section.get(1);
				break;
			case ":constraints":
				checkSize(section, 2);
				constraints = section.get(1);
				break;
			default: {
				checkSize(section, 3);
				Leaf optimization = matchLeaf(section.get(1));
				if (!optimization.is("minimize") && !optimization.is("maximize")) {
					syntaxError("expecting 'minimize' or 'maximize', found '" + optimization + "'", optimization);
				}
				metric = new Syntax.MetricDecl(optimization, section.get(2), section.source());
			}
			}
		}
		if (domain == null) {
			syntaxError(MISSING_SECTION + ": (:domain ...)", root);
		} else if (init == null) {
			syntaxError(MISSING_SECTION + ": (:init ...)", root);
		}
		return new Syntax.Problem(name, domain, requirements, objects, network, init, goal, constraints, metric,
				root.source());
	}

	// ==============================================================
	// Typed lists
	// ==============================================================

	/**
	 * Interpret the children of a group (from a given index) as a typed list of
	 * the form:
	 *
	 * <pre>
	 * TypedList ::= (Name+ '-' Type)* Name*
	 * </pre>
	 *
	 * This is used for type, constant and object declarations, as well as for
	 * parameters and quantified variables (in which case each name must be a
	 * variable).
	 *
	 * @param source
	 *            Text of the document (for error reporting)
	 * @param g
	 *            Group holding the list
	 * @param from
	 *            Index of the first element of the list
	 * @param variables
	 *            Whether or not names must be variables
	 * @return
	 */
	public static List<TypedList> parseTypedList(String source, Group g, int from, boolean variables) {
		ArrayList<TypedList> result = new ArrayList<>();
		ArrayList<Leaf> names = new ArrayList<>();
		for (int i = from; i < g.size(); ++i) {
			Node n = g.get(i);
			if (!(n instanceof Leaf)) {
				throw error(source, "unexpected '(' in typed list", n);
			}
			Leaf l = (Leaf) n;
			if (l.is("-")) {
				if (names.isEmpty() || i + 1 >= g.size() || !(g.get(i + 1) instanceof Leaf)) {
					throw error(source, INVALID_TYPED_LIST, l);
				}
				Leaf type = (Leaf) g.get(++i);
				checkName(source, type);
				Attribute.Source span = names.get(0).source().union(type.source());
				result.add(new TypedList(names, type, span));
				names = new ArrayList<>();
			} else {
				if (variables) {
					checkVariable(source, l);
				} else {
					checkName(source, l);
				}
				names.add(l);
			}
		}
		if (!names.isEmpty()) {
			Attribute.Source span = names.get(0).source().union(names.get(names.size() - 1).source());
			result.add(new TypedList(names, null, span));
		}
		return result;
	}

	private static void checkName(String source, Leaf l) {
		if (!NAME.matcher(l.text()).matches()) {
			throw error(source, INVALID_NAME + ": " + l, l);
		}
	}

	private static void checkVariable(String source, Leaf l) {
		if (!l.isVariable() || !NAME.matcher(l.name()).matches()) {
			throw error(source, INVALID_VARIABLE + ": " + l, l);
		}
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Parse the <code>(define (unit name) ...</code> header, returning the name.
	 */
	private Leaf parseHeader(Group root, String unit) {
		if (root.size() < 2) {
			syntaxError("expecting '(define (" + unit + " ...) ...)'", root);
		}
		match(root.get(0), "define");
		Group header = matchGroup(root.get(1));
		checkSize(header, 2);
		match(header.get(0), unit);
		return matchName(header.get(1));
	}

	/**
	 * Parse the <code>:keyword value</code> pairs of a block, starting from a
	 * given index. Aliased keywords are stored under their canonical form.
	 */
	private Map<String, Node> parseProperties(Group g, int from, Map<String, String> allowed) {
		LinkedHashMap<String, Node> properties = new LinkedHashMap<>();
		for (int i = from; i < g.size(); i += 2) {
			Leaf keyword = matchLeaf(g.get(i));
			String canonical = allowed.get(keyword.key());
			if (canonical == null) {
				syntaxError(UNKNOWN_PROPERTY + ": " + keyword, keyword);
			} else if (properties.containsKey(canonical)) {
				syntaxError(DUPLICATE_PROPERTY + ": " + keyword, keyword);
			} else if (i + 1 >= g.size()) {
				syntaxError("missing value for " + keyword, keyword);
			}
			properties.put(canonical, g.get(i + 1));
		}
		return properties;
	}

	private List<TypedList> parseParameters(Map<String, Node> properties, Group section, boolean required) {
		Node parameters = properties.get(":parameters");
		if (parameters == null) {
			if (required) {
				syntaxError(MISSING_PROPERTY + ": :parameters", section);
			}
			return new ArrayList<>();
		}
		return parseTypedList(source, matchGroup(parameters), 0, true);
	}

	private Node require(Map<String, Node> properties, String keyword, Group section) {
		Node n = properties.get(keyword);
		if (n == null) {
			syntaxError(MISSING_PROPERTY + ": " + keyword, section);
		}
		return n;
	}

	/**
	 * Check that a section appears after all those of lower rank, and is not
	 * repeated unless its rank is at least <code>repeatable</code>.
	 */
	private int checkOrder(Map<String, Integer> ranks, Leaf keyword, int current, int repeatable) {
		Integer r = ranks.get(keyword.key());
		if (r == null) {
			syntaxError(UNKNOWN_SECTION + ": " + keyword, keyword);
		} else if (r < current) {
			syntaxError(SECTION_OUT_OF_ORDER + ": " + keyword, keyword);
		} else if (r == current && r < repeatable) {
			syntaxError(DUPLICATE_SECTION + ": " + keyword, keyword);
		}
		return r;
	}

	private Node child(Group g, int i) {
		if (i >= g.size()) {
			syntaxError("unexpected end of block", g);
		}
		return g.get(i);
	}

	private void checkSize(Group g, int size) {
		if (g.size() != size) {
			syntaxError("expecting " + (size - 1) + " element(s) after '" + g.get(0) + "'", g);
		}
	}

	private Group matchGroup(Node n) {
		if (!(n instanceof Group)) {
			syntaxError("expecting '(', found '" + n + "'", n);
		}
		return (Group) n;
	}

	private Leaf matchLeaf(Node n) {
		if (!(n instanceof Leaf)) {
			syntaxError("expecting word, found '('", n);
		}
		return (Leaf) n;
	}

	private Leaf matchKeyword(Group section) {
		Leaf keyword = matchLeaf(child(section, 0));
		if (!keyword.text().startsWith(":")) {
			syntaxError("expecting section keyword, found '" + keyword + "'", keyword);
		}
		return keyword;
	}

	private Leaf matchName(Node n) {
		Leaf l = matchLeaf(n);
		checkName(source, l);
		return l;
	}

	private Leaf match(Node n, String keyword) {
		Leaf l = matchLeaf(n);
		if (!l.is(keyword)) {
			syntaxError("expecting '" + keyword + "', found '" + l + "'", l);
		}
		return l;
	}

	private void syntaxError(String msg, SyntacticElement e) {
		throw error(source, msg, e);
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, source, t.start, t.end());
	}

	private static SyntaxError error(String source, String msg, SyntacticElement e) {
		Attribute.Source loc = e.source();
		return new SyntaxError(msg, source, loc.start, loc.end);
	}
}
