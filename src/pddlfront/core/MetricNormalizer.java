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

import java.util.LinkedHashMap;
import java.util.Map;

import pddlfront.util.Rational;

/**
 * Responsible for recognising common idioms of quality metrics and replacing
 * them with the canonical metric they stand for. The most common idiom is a
 * numeric fluent (typically <code>total-cost</code>) which starts at zero and
 * which every action increases by a constant:
 *
 * <pre>
 * (:action move ... :effect (and ... (increase (total-cost) 2)))
 * ...
 * (:metric minimize (total-cost))
 * </pre>
 *
 * Such a fluent is only a running sum of action costs, hence the metric is an
 * action cost table (or simply the plan length, when every cost is one) and
 * the fluent is removed from the problem.
 *
 * @author David J. Pearce
 *
 */
public class MetricNormalizer {
	private static final boolean DEBUG = false;

	private final ExpressionManager em;

	public MetricNormalizer(ExpressionManager em) {
		this.em = em;
	}

	/**
	 * Normalise the metric of a problem.
	 *
	 * @param problem
	 * @param expression
	 *            The compiled metric expression.
	 * @param minimize
	 *            Whether the expression is minimised or maximised.
	 * @return
	 */
	public Model.Metric normalize(Model.Problem problem, Expr expression, boolean minimize) {
		if (minimize && expression instanceof Expr.FluentApp && expression.children().isEmpty()) {
			Model.Fluent fluent = ((Expr.FluentApp) expression).fluent();
			Map<Model.Action, Expr> costs = costs(problem, (Expr.FluentApp) expression);
			if (costs != null) {
				if (DEBUG) {
					System.err.println("metric fluent " + fluent + " accumulates action costs " + costs);
				}
				boolean planLength = costs.size() == problem.actions().size();
				for (Map.Entry<Model.Action, Expr> e : costs.entrySet()) {
					boolean one = ((Expr.Constant) e.getValue()).rationalValue().equals(Rational.ONE);
					planLength &= one && !(e.getKey() instanceof Model.DurativeAction);
				}
				for (Model.Action a : problem.actions()) {
					a.removeEffectsOn(fluent);
				}
				problem.removeFluent(fluent);
				if (planLength) {
					return new Model.MinimizeSequentialPlanLength();
				}
				return new Model.MinimizeActionCosts(costs, em.integer(0));
			}
		}
		return minimize ? new Model.MinimizeExpressionOnFinalState(expression)
				: new Model.MaximizeExpressionOnFinalState(expression);
	}

	/**
	 * Determine the cost of each action, assuming the given fluent accumulates
	 * action costs. An action which does not change the fluent is absent from
	 * the result. This returns <code>null</code> if the fluent is not a pure
	 * accumulator, i.e. when it does not start at zero, when it is read anywhere
	 * (in a condition, a duration, an effect or outside of the actions) or when
	 * some action changes it other than through exactly one unconditional
	 * increase by a non-negative constant.
	 *
	 * @param problem
	 * @param metric
	 * @return
	 */
	private Map<Model.Action, Expr> costs(Model.Problem problem, Expr.FluentApp metric) {
		Model.Fluent fluent = metric.fluent();
		Expr initial = problem.initialValue(metric);
		if (initial == null || !initial.isConstant() || ((Expr.Constant) initial).rationalValue().signum() != 0) {
			return null;
		}
		for (Expr e : problem.expressions()) {
			if (e.mentions(fluent)) {
				return null;
			}
		}
		LinkedHashMap<Model.Action, Expr> costs = new LinkedHashMap<>();
		for (Model.Action a : problem.actions()) {
			if (!isEligible(a, fluent, costs)) {
				return null;
			}
		}
		return costs;
	}

	/**
	 * Check whether an action uses the given fluent only as an accumulator of
	 * its cost, recording that cost (if any).
	 */
	private static boolean isEligible(Model.Action action, Model.Fluent fluent, Map<Model.Action, Expr> costs) {
		for (Expr c : action.conditions()) {
			if (c.mentions(fluent)) {
				return false;
			}
		}
		if (action instanceof Model.DurativeAction) {
			Model.DurationInterval d = ((Model.DurativeAction) action).duration();
			if (d != null && (d.lower().mentions(fluent) || d.upper().mentions(fluent))) {
				return false;
			}
		}
		Expr cost = null;
		for (Model.Effect e : action.effects()) {
			boolean target = e.fluent().fluent() == fluent;
			if (!target) {
				if (e.mentions(fluent)) {
					return false;
				}
			} else if (cost != null || action instanceof Model.DurativeAction || e.isConditional()
					|| e.kind() != Model.Effect.Kind.INCREASE || !e.value().isConstant()
					|| ((Expr.Constant) e.value()).rationalValue().signum() < 0) {
				return false;
			} else {
				cost = e.value();
			}
		}
		if (cost != null) {
			costs.put(action, cost);
		}
		return true;
	}
}
