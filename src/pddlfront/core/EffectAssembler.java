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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import pddlfront.core.ExpressionCompiler.Scope;
import pddlfront.core.Model.Effect;
import pddlfront.core.Model.Timing;
import pddlfront.core.Syntax.Group;
import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.Node;
import pddlfront.extensions.Contingent;
import pddlfront.util.SyntacticElement;
import pddlfront.util.SyntaxError;

/**
 * Responsible for turning the effects, timed conditions, durations and
 * observations of actions into model elements. Effects are processed from a
 * work-list, so that nested <code>and</code> and <code>when</code> effects are
 * flattened without recursion. A universally quantified effect cannot be
 * expanded until every object is known, hence it is recorded as a
 * {@link ModelBuilder.PendingExpansion} and later given back to
 * {@link #expand(ModelBuilder.PendingExpansion)}.
 *
 * @author David J. Pearce
 *
 */
public class EffectAssembler {
	public final static String INVALID_EFFECT = "Not able to handle effect";
	public final static String INVALID_CONDITION = "Not able to handle durative condition";
	public final static String INVALID_DURATION = "Invalid duration constraint";
	public final static String EXPECTED_FLUENT = "Expecting fluent";

	private final ExpressionCompiler compiler;
	private final ExpressionManager em;
	private final Model.Problem problem;

	public EffectAssembler(ExpressionCompiler compiler, Model.Problem problem) {
		this.compiler = compiler;
		this.em = compiler.manager();
		this.problem = problem;
	}

	// ==============================================================
	// Effects
	// ==============================================================

	/**
	 * Add the effects described by a node to an action. Any universally
	 * quantified effects encountered are added to the pending list rather than
	 * being expanded.
	 *
	 * @param action
	 * @param node
	 * @param pending
	 */
	public void effects(Model.Action action, Node node, List<ModelBuilder.PendingExpansion> pending) {
		process(action, new Item(node, null, null, Collections.emptyMap()), pending);
	}

	/**
	 * Expand a universally quantified effect over the objects of the problem,
	 * adding the resulting effects to its action.
	 *
	 * @param expansion
	 */
	public void expand(ModelBuilder.PendingExpansion expansion) {
		Item item = new Item(expansion.node(), expansion.timing(), expansion.condition(), Collections.emptyMap());
		process(expansion.action(), item, null);
	}

	private void process(Model.Action action, Item first, List<ModelBuilder.PendingExpansion> pending) {
		boolean durative = action instanceof Model.DurativeAction;
		ArrayDeque<Item> worklist = new ArrayDeque<>();
		worklist.add(first);
		while (!worklist.isEmpty()) {
			Item item = worklist.poll();
			Group g = item.node instanceof Group ? (Group) item.node : null;
			if (g != null && g.isEmpty()) {
				continue;
			} else if (g != null && g.startsWith("and")) {
				for (int i = 1; i < g.size(); ++i) {
					worklist.add(item.with(g.get(i)));
				}
			} else if (g != null && g.startsWith("forall")) {
				if (pending != null) {
					pending.add(new ModelBuilder.PendingExpansion(action, g, item.timing, item.condition));
				} else {
					expand(item, g, worklist);
				}
			} else if (durative && item.timing == null) {
				Timing timing = timing(g);
				if (timing == null) {
					syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_EFFECT + ": " + item.node, item.node);
				}
				worklist.add(new Item(g.get(2), timing, item.condition, item.assignments));
			} else if (g != null && g.startsWith("when")) {
				checkSize(g, 3);
				Expr c = compiler.compile(action, Scope.EMPTY, g.get(1), item.assignments);
				c = em.simplify(item.condition == null ? c : and(item.condition, c, g));
				if (!c.isFalse()) {
					worklist.add(new Item(g.get(2), item.timing, c.isTrue() ? null : c, item.assignments));
				}
			} else {
				Effect e = effect(action, item);
				if (durative) {
					((Model.DurativeAction) action).addEffect(item.timing, e);
				} else {
					((Model.InstantaneousAction) action).addEffect(e);
				}
			}
		}
	}

	/**
	 * Expand a <code>forall</code> effect with the objects of the problem, by
	 * adding one item to the work-list for each combination of objects bound to
	 * its variables.
	 */
	private void expand(Item item, Group g, ArrayDeque<Item> worklist) {
		checkSize(g, 3);
		List<Model.Variable> variables = compiler.variables(g.get(1));
		ArrayList<List<Model.PlanningObject>> domains = new ArrayList<>();
		for (Model.Variable v : variables) {
			List<Model.PlanningObject> objects = problem.objects(v.type());
			if (objects.isEmpty()) {
				return;
			}
			domains.add(objects);
		}
		int[] index = new int[variables.size()];
		while (true) {
			HashMap<String, Model.PlanningObject> assignments = new HashMap<>(item.assignments);
			for (int i = 0; i != index.length; ++i) {
				assignments.put("?" + Syntax.canonical(variables.get(i).name()), domains.get(i).get(index[i]));
			}
			worklist.add(new Item(g.get(2), item.timing, item.condition, assignments));
			// advance to the next combination
			int k = index.length - 1;
			while (k >= 0 && ++index[k] == domains.get(k).size()) {
				index[k] = 0;
				k = k - 1;
			}
			if (k < 0) {
				return;
			}
		}
	}

	private Effect effect(Model.Action action, Item item) {
		Node n = item.node;
		Group g = n instanceof Group ? (Group) n : null;
		try {
			if (g != null && g.startsWith("not")) {
				checkSize(g, 2);
				return new Effect(Effect.Kind.ASSIGN, fluent(action, g.get(1), item), em.FALSE, item.condition);
			} else if (g != null && g.startsWith("assign")) {
				checkSize(g, 3);
				return new Effect(Effect.Kind.ASSIGN, fluent(action, g.get(1), item), value(action, g, item),
						item.condition);
			} else if (g != null && g.startsWith("increase")) {
				checkSize(g, 3);
				return new Effect(Effect.Kind.INCREASE, fluent(action, g.get(1), item), value(action, g, item),
						item.condition);
			} else if (g != null && g.startsWith("decrease")) {
				checkSize(g, 3);
				return new Effect(Effect.Kind.DECREASE, fluent(action, g.get(1), item), value(action, g, item),
						item.condition);
			}
			return new Effect(Effect.Kind.ASSIGN, fluent(action, n, item), em.TRUE, item.condition);
		} catch (IllegalArgumentException e) {
			syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_EFFECT + ": " + e.getMessage(), n, e);
			return null; // dead code
		}
	}

	private Expr value(Model.Action action, Group g, Item item) {
		return compiler.compile(action, Scope.EMPTY, g.get(2), item.assignments);
	}

	private Expr.FluentApp fluent(Model.Parameterised enclosing, Node n, Item item) {
		Expr e = compiler.compile(enclosing, Scope.EMPTY, n, item.assignments);
		if (!(e instanceof Expr.FluentApp)) {
			syntaxError(SyntaxError.Kind.RESOLUTION, EXPECTED_FLUENT + ": " + n, n);
		}
		return (Expr.FluentApp) e;
	}

	private Expr and(Expr lhs, Expr rhs, Node n) {
		try {
			return em.and(lhs, rhs);
		} catch (IllegalArgumentException e) {
			syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_EFFECT + ": " + e.getMessage(), n, e);
			return null; // dead code
		}
	}

	/**
	 * Determine the timing of <code>(at start ...)</code> or
	 * <code>(at end ...)</code>, or <code>null</code> if the node is neither.
	 */
	private static Timing timing(Group g) {
		if (g != null && g.size() == 3 && g.startsWith("at") && g.get(1) instanceof Leaf) {
			Leaf when = (Leaf) g.get(1);
			if (when.is("start")) {
				return Timing.START;
			} else if (when.is("end")) {
				return Timing.END;
			}
		}
		return null;
	}

	/**
	 * An effect still to be processed, along with the condition it is subject
	 * to (or <code>null</code>) and the objects bound by enclosing expanded
	 * <code>forall</code> effects.
	 */
	private static final class Item {
		private final Node node;
		private final Timing timing;
		private final Expr condition;
		private final Map<String, Model.PlanningObject> assignments;

		public Item(Node node, Timing timing, Expr condition, Map<String, Model.PlanningObject> assignments) {
			this.node = node;
			this.timing = timing;
			this.condition = condition;
			this.assignments = assignments;
		}

		public Item with(Node node) {
			return new Item(node, timing, condition, assignments);
		}
	}

	// ==============================================================
	// Durative actions
	// ==============================================================

	/**
	 * Add the timed conditions of a durative action. Each condition must be
	 * qualified by <code>at start</code>, <code>at end</code> or
	 * <code>over all</code>, though it may be nested within conjunctions and
	 * universal quantifiers.
	 *
	 * @param action
	 * @param node
	 */
	public void conditions(Model.DurativeAction action, Node node) {
		ArrayDeque<Condition> worklist = new ArrayDeque<>();
		worklist.add(new Condition(node, Scope.EMPTY, Collections.emptyList()));
		while (!worklist.isEmpty()) {
			Condition c = worklist.poll();
			if (!(c.node instanceof Group)) {
				syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_CONDITION + ": " + c.node, c.node);
			}
			Group g = (Group) c.node;
			Timing t = timing(g);
			if (g.isEmpty()) {
				continue;
			} else if (g.startsWith("and")) {
				for (int i = 1; i < g.size(); ++i) {
					worklist.add(new Condition(g.get(i), c.scope, c.quantifiers));
				}
			} else if (g.startsWith("forall")) {
				checkSize(g, 3);
				List<Model.Variable> variables = compiler.variables(g.get(1));
				ArrayList<List<Model.Variable>> quantifiers = new ArrayList<>(c.quantifiers);
				quantifiers.add(variables);
				worklist.add(new Condition(g.get(2), c.scope.extend(variables), quantifiers));
			} else if (t != null) {
				addCondition(action, Model.TimeInterval.at(t), c, g);
			} else if (g.size() == 3 && g.startsWith("over") && g.get(1) instanceof Leaf
					&& ((Leaf) g.get(1)).is("all")) {
				addCondition(action, Model.TimeInterval.closed(Timing.START, Timing.END), c, g);
			} else {
				syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_CONDITION + ": " + g, g);
			}
		}
	}

	private void addCondition(Model.DurativeAction action, Model.TimeInterval interval, Condition c, Group g) {
		Expr e = compiler.compile(action, c.scope, g.get(2));
		try {
			for (int i = c.quantifiers.size() - 1; i >= 0; --i) {
				e = em.forall(c.quantifiers.get(i), e);
			}
			action.addCondition(interval, e);
		} catch (IllegalArgumentException ex) {
			syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_CONDITION + ": " + ex.getMessage(), g, ex);
		}
	}

	/**
	 * A timed condition still to be processed, along with the variables of its
	 * enclosing universal quantifiers (outermost first).
	 */
	private static final class Condition {
		private final Node node;
		private final Scope scope;
		private final List<List<Model.Variable>> quantifiers;

		public Condition(Node node, Scope scope, List<List<Model.Variable>> quantifiers) {
			this.node = node;
			this.scope = scope;
			this.quantifiers = quantifiers;
		}
	}

	/**
	 * Compile the duration constraint of a durative action. This is either
	 * <code>(= ?duration E)</code> for a fixed duration or
	 * <code>(and (&gt;= ?duration L) (&lt;= ?duration U))</code> for a closed
	 * interval, where the two bounds may be given in either order.
	 *
	 * @param action
	 * @param node
	 * @return
	 */
	public Model.DurationInterval duration(Model.DurativeAction action, Node node) {
		Group g = node instanceof Group ? (Group) node : null;
		try {
			if (isBound(g, "=")) {
				return Model.DurationInterval.fixed(compiler.compile(action, Scope.EMPTY, g.get(2)));
			} else if (g != null && g.startsWith("and")) {
				Expr lower = null;
				Expr upper = null;
				for (int i = 1; i < g.size(); ++i) {
					Group b = g.get(i) instanceof Group ? (Group) g.get(i) : null;
					if (isBound(b, ">=") && lower == null) {
						lower = compiler.compile(action, Scope.EMPTY, b.get(2));
					} else if (isBound(b, "<=") && upper == null) {
						upper = compiler.compile(action, Scope.EMPTY, b.get(2));
					} else {
						syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_DURATION + ": " + g.get(i), g.get(i));
					}
				}
				if (lower != null && upper != null) {
					return Model.DurationInterval.closed(lower, upper);
				}
			}
		} catch (IllegalArgumentException e) {
			syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_DURATION + ": " + e.getMessage(), node, e);
		}
		syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_DURATION + ": " + node, node);
		return null; // dead code
	}

	/**
	 * Check whether a group has the form <code>(op ?duration E)</code>.
	 */
	private static boolean isBound(Group g, String op) {
		return g != null && g.size() == 3 && g.startsWith(op) && g.get(1) instanceof Leaf
				&& ((Leaf) g.get(1)).is("?duration");
	}

	// ==============================================================
	// Observations
	// ==============================================================

	/**
	 * Add the fluents observed by a sensing action, given either as a single
	 * fluent or as a conjunction of fluents.
	 *
	 * @param action
	 * @param node
	 */
	public void observations(Contingent.SensingAction action, Node node) {
		ArrayList<Node> items = new ArrayList<>();
		if (node instanceof Group && ((Group) node).startsWith("and")) {
			Group g = (Group) node;
			for (int i = 1; i < g.size(); ++i) {
				items.add(g.get(i));
			}
		} else {
			items.add(node);
		}
		for (Node n : items) {
			Expr e = compiler.compile(action, Scope.EMPTY, n);
			if (!(e instanceof Expr.FluentApp)) {
				syntaxError(SyntaxError.Kind.RESOLUTION, EXPECTED_FLUENT + ": " + n, n);
			}
			action.addObservedFluent((Expr.FluentApp) e);
		}
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private void checkSize(Group g, int size) {
		if (g.size() != size) {
			syntaxError(SyntaxError.Kind.STRUCTURAL, ExpressionCompiler.INVALID_ARITY + ": " + g, g);
		}
	}

	private void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e) {
		SyntaxError.syntaxError(kind, msg, compiler.source(), e);
	}

	private void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e, Throwable ex) {
		SyntaxError.syntaxError(kind, msg, compiler.source(), e, ex);
	}
}
