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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import pddlfront.util.Rational;

/**
 * The in-memory planning model populated by the front-end. This consists of
 * fluents, objects and actions (together with their parameters, conditions
 * and effects), the {@link Problem} which contains them and the quality
 * {@link Metric}s of a problem. Names are case-insensitive throughout.
 *
 * @author David J. Pearce
 *
 */
public class Model {

	/**
	 * Anything which declares parameters that expressions may refer to (e.g. an
	 * action, a task or a method).
	 */
	public interface Parameterised {
		public String name();

		public List<Parameter> parameters();

		/**
		 * Get the parameter with a given (case-insensitive) name, or
		 * <code>null</code> if there is none.
		 *
		 * @param name
		 * @return
		 */
		public default Parameter parameter(String name) {
			String key = Syntax.canonical(name);
			for (Parameter p : parameters()) {
				if (Syntax.canonical(p.name()).equals(key)) {
					return p;
				}
			}
			return null;
		}
	}

	/**
	 * Base class for parameters, quantified variables, objects and fluents.
	 * These are compared by identity.
	 */
	public static abstract class Named {
		private final String name;

		public Named(String name) {
			this.name = name;
		}

		public String name() {
			return name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static final class Parameter extends Named {
		private final Types.Type type;

		public Parameter(String name, Types.Type type) {
			super(name);
			this.type = type;
		}

		public Types.Type type() {
			return type;
		}
	}

	/**
	 * A variable bound by a quantifier (or by a universally quantified effect).
	 */
	public static final class Variable extends Named {
		private final Types.User type;

		public Variable(String name, Types.User type) {
			super(name);
			this.type = type;
		}

		public Types.User type() {
			return type;
		}
	}

	/**
	 * A constant of a domain or an object of a problem.
	 */
	public static final class PlanningObject extends Named {
		private final Types.User type;

		public PlanningObject(String name, Types.User type) {
			super(name);
			this.type = type;
		}

		public Types.User type() {
			return type;
		}
	}

	/**
	 * A predicate (boolean fluent) or function (numeric fluent) together with
	 * the types of its arguments.
	 */
	public static final class Fluent extends Named {
		private final Types.Type type;
		private final List<Parameter> signature;

		public Fluent(String name, Types.Type type, List<Parameter> signature) {
			super(name);
			this.type = type;
			this.signature = Collections.unmodifiableList(new ArrayList<>(signature));
		}

		public Types.Type type() {
			return type;
		}

		public List<Parameter> signature() {
			return signature;
		}

		public int arity() {
			return signature.size();
		}
	}

	// ==============================================================
	// Effects and timing
	// ==============================================================

	/**
	 * Assigns, increases or decreases the value of a fluent application,
	 * optionally under a condition.
	 */
	public static final class Effect {
		public enum Kind {
			ASSIGN, INCREASE, DECREASE
		}

		private final Kind kind;
		private final Expr.FluentApp fluent;
		private final Expr value;
		private final Expr condition;

		/**
		 * Construct an effect.
		 *
		 * @param kind
		 * @param fluent
		 *            The fluent application being changed.
		 * @param value
		 * @param condition
		 *            The condition under which the effect happens, or
		 *            <code>null</code> if unconditional.
		 * @throws IllegalArgumentException
		 *             if the value cannot be stored in the fluent.
		 */
		public Effect(Kind kind, Expr.FluentApp fluent, Expr value, Expr condition) {
			if (kind != Kind.ASSIGN && !fluent.type().isNumeric()) {
				throw new IllegalArgumentException("cannot " + kind.name().toLowerCase() + " non-numeric fluent " + fluent);
			} else if (!Types.isCompatible(fluent.type(), value.type())) {
				throw new IllegalArgumentException("cannot assign " + value + " to fluent " + fluent);
			} else if (condition != null && !condition.type().isBool()) {
				throw new IllegalArgumentException("effect condition must be boolean: " + condition);
			}
			this.kind = kind;
			this.fluent = fluent;
			this.value = value;
			this.condition = condition;
		}

		public Kind kind() {
			return kind;
		}

		public Expr.FluentApp fluent() {
			return fluent;
		}

		public Expr value() {
			return value;
		}

		public Expr condition() {
			return condition;
		}

		public boolean isConditional() {
			return condition != null;
		}

		/**
		 * Check whether a fluent is changed by, or read by, this effect.
		 *
		 * @param f
		 * @return
		 */
		public boolean mentions(Fluent f) {
			return fluent.mentions(f) || value.mentions(f) || (condition != null && condition.mentions(f));
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Effect) {
				Effect e = (Effect) o;
				return kind == e.kind && fluent.equals(e.fluent) && value.equals(e.value)
						&& Objects.equals(condition, e.condition);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, fluent, value, condition);
		}

		@Override
		public String toString() {
			String r = kind == Kind.ASSIGN ? fluent + " := " + value
					: fluent + (kind == Kind.INCREASE ? " += " : " -= ") + value;
			return condition == null ? r : "if " + condition + " then " + r;
		}
	}

	/**
	 * A point in time, relative to the start or end of a durative action or
	 * to the start of the plan (for timed initial effects).
	 */
	public static final class Timing {
		public enum Anchor {
			START, END, GLOBAL
		}

		public static final Timing START = new Timing(Anchor.START, Rational.ZERO);
		public static final Timing END = new Timing(Anchor.END, Rational.ZERO);

		private final Anchor anchor;
		private final Rational delay;

		private Timing(Anchor anchor, Rational delay) {
			this.anchor = anchor;
			this.delay = delay;
		}

		/**
		 * A point at a fixed offset from the start of the plan.
		 *
		 * @param delay
		 * @return
		 */
		public static Timing global(Rational delay) {
			return new Timing(Anchor.GLOBAL, delay);
		}

		public Anchor anchor() {
			return anchor;
		}

		public Rational delay() {
			return delay;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Timing) {
				Timing t = (Timing) o;
				return anchor == t.anchor && delay.equals(t.delay);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return anchor.hashCode() ^ delay.hashCode();
		}

		@Override
		public String toString() {
			if (anchor == Anchor.GLOBAL) {
				return delay.toString();
			}
			String r = anchor.name().toLowerCase();
			return delay.signum() == 0 ? r : r + "+" + delay;
		}
	}

	/**
	 * An interval between two timings, each end of which may be open or closed.
	 */
	public static final class TimeInterval {
		private final Timing lower;
		private final Timing upper;
		private final boolean leftOpen;
		private final boolean rightOpen;

		public TimeInterval(Timing lower, Timing upper, boolean leftOpen, boolean rightOpen) {
			this.lower = lower;
			this.upper = upper;
			this.leftOpen = leftOpen;
			this.rightOpen = rightOpen;
		}

		/**
		 * The interval containing exactly one point in time.
		 *
		 * @param t
		 * @return
		 */
		public static TimeInterval at(Timing t) {
			return new TimeInterval(t, t, false, false);
		}

		public static TimeInterval closed(Timing lower, Timing upper) {
			return new TimeInterval(lower, upper, false, false);
		}

		public Timing lower() {
			return lower;
		}

		public Timing upper() {
			return upper;
		}

		public boolean isLeftOpen() {
			return leftOpen;
		}

		public boolean isRightOpen() {
			return rightOpen;
		}

		public boolean isPoint() {
			return lower.equals(upper) && !leftOpen && !rightOpen;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof TimeInterval) {
				TimeInterval i = (TimeInterval) o;
				return lower.equals(i.lower) && upper.equals(i.upper) && leftOpen == i.leftOpen
						&& rightOpen == i.rightOpen;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return lower.hashCode() * 31 + upper.hashCode() + (leftOpen ? 1 : 0) + (rightOpen ? 2 : 0);
		}

		@Override
		public String toString() {
			if (isPoint()) {
				return "at " + lower;
			}
			return (leftOpen ? "(" : "[") + lower + ", " + upper + (rightOpen ? ")" : "]");
		}
	}

	/**
	 * The permitted durations of a durative action.
	 */
	public static final class DurationInterval {
		private final Expr lower;
		private final Expr upper;
		private final boolean leftOpen;
		private final boolean rightOpen;

		public DurationInterval(Expr lower, Expr upper, boolean leftOpen, boolean rightOpen) {
			if (!lower.type().isNumeric() || !upper.type().isNumeric()) {
				throw new IllegalArgumentException("duration bounds must be numeric");
			}
			this.lower = lower;
			this.upper = upper;
			this.leftOpen = leftOpen;
			this.rightOpen = rightOpen;
		}

		public static DurationInterval fixed(Expr duration) {
			return new DurationInterval(duration, duration, false, false);
		}

		public static DurationInterval closed(Expr lower, Expr upper) {
			return new DurationInterval(lower, upper, false, false);
		}

		public Expr lower() {
			return lower;
		}

		public Expr upper() {
			return upper;
		}

		public boolean isLeftOpen() {
			return leftOpen;
		}

		public boolean isRightOpen() {
			return rightOpen;
		}

		public boolean isFixed() {
			return lower.equals(upper) && !leftOpen && !rightOpen;
		}

		@Override
		public String toString() {
			return (leftOpen ? "(" : "[") + lower + ", " + upper + (rightOpen ? ")" : "]");
		}
	}

	// ==============================================================
	// Actions
	// ==============================================================

	public static abstract class Action implements Parameterised {
		private final String name;
		private final List<Parameter> parameters;

		/**
		 * Construct an action with a given name and parameters.
		 *
		 * @throws IllegalArgumentException
		 *             if two parameters share a name.
		 */
		public Action(String name, List<Parameter> parameters) {
			this.name = name;
			this.parameters = Collections.unmodifiableList(distinct(parameters));
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public List<Parameter> parameters() {
			return parameters;
		}

		/**
		 * Get all the effects of this action, regardless of their timing.
		 *
		 * @return
		 */
		public abstract List<Effect> effects();

		/**
		 * Get all the conditions of this action, regardless of their timing.
		 *
		 * @return
		 */
		public abstract List<Expr> conditions();

		/**
		 * Remove every effect which changes a given fluent.
		 *
		 * @param fluent
		 */
		public abstract void removeEffectsOn(Fluent fluent);

		@Override
		public String toString() {
			return name + parameters;
		}
	}

	public static class InstantaneousAction extends Action {
		private final ArrayList<Expr> preconditions = new ArrayList<>();
		private final ArrayList<Effect> effects = new ArrayList<>();

		public InstantaneousAction(String name, List<Parameter> parameters) {
			super(name, parameters);
		}

		public List<Expr> preconditions() {
			return Collections.unmodifiableList(preconditions);
		}

		/**
		 * Add a precondition to this action. Trivially true and repeated
		 * preconditions are dropped.
		 *
		 * @param precondition
		 */
		public void addPrecondition(Expr precondition) {
			if (!precondition.type().isBool()) {
				throw new IllegalArgumentException("precondition must be boolean: " + precondition);
			} else if (!precondition.isTrue() && !preconditions.contains(precondition)) {
				preconditions.add(precondition);
			}
		}

		public void addEffect(Effect effect) {
			effects.add(effect);
		}

		@Override
		public List<Effect> effects() {
			return Collections.unmodifiableList(effects);
		}

		@Override
		public List<Expr> conditions() {
			return preconditions();
		}

		@Override
		public void removeEffectsOn(Fluent fluent) {
			effects.removeIf(e -> e.fluent().fluent() == fluent);
		}
	}

	public static class DurativeAction extends Action {
		private DurationInterval duration;
		private final LinkedHashMap<TimeInterval, List<Expr>> conditions = new LinkedHashMap<>();
		private final LinkedHashMap<Timing, List<Effect>> effects = new LinkedHashMap<>();

		public DurativeAction(String name, List<Parameter> parameters) {
			super(name, parameters);
		}

		public DurationInterval duration() {
			return duration;
		}

		public void setDuration(DurationInterval duration) {
			this.duration = duration;
		}

		public Map<TimeInterval, List<Expr>> timedConditions() {
			return Collections.unmodifiableMap(conditions);
		}

		public Map<Timing, List<Effect>> timedEffects() {
			return Collections.unmodifiableMap(effects);
		}

		public void addCondition(TimeInterval interval, Expr condition) {
			if (!condition.type().isBool()) {
				throw new IllegalArgumentException("condition must be boolean: " + condition);
			}
			if (condition.isTrue()) {
				return;
			}
			List<Expr> cs = conditions.computeIfAbsent(interval, i -> new ArrayList<>());
			if (!cs.contains(condition)) {
				cs.add(condition);
			}
		}

		public void addEffect(Timing timing, Effect effect) {
			effects.computeIfAbsent(timing, t -> new ArrayList<>()).add(effect);
		}

		@Override
		public List<Effect> effects() {
			ArrayList<Effect> r = new ArrayList<>();
			for (List<Effect> es : effects.values()) {
				r.addAll(es);
			}
			return r;
		}

		@Override
		public List<Expr> conditions() {
			ArrayList<Expr> r = new ArrayList<>();
			for (List<Expr> cs : conditions.values()) {
				r.addAll(cs);
			}
			return r;
		}

		@Override
		public void removeEffectsOn(Fluent fluent) {
			Iterator<List<Effect>> i = effects.values().iterator();
			while (i.hasNext()) {
				List<Effect> es = i.next();
				es.removeIf(e -> e.fluent().fluent() == fluent);
				if (es.isEmpty()) {
					i.remove();
				}
			}
		}
	}

	// ==============================================================
	// Quality metrics
	// ==============================================================

	public static abstract class Metric {
	}

	public static final class MinimizeMakespan extends Metric {
		@Override
		public String toString() {
			return "minimize makespan";
		}
	}

	public static final class MinimizeSequentialPlanLength extends Metric {
		@Override
		public String toString() {
			return "minimize plan length";
		}
	}

	/**
	 * Minimise the sum of the costs of the actions in a plan. Actions missing
	 * from the table cost the default.
	 */
	public static final class MinimizeActionCosts extends Metric {
		private final Map<Action, Expr> costs;
		private final Expr defaultCost;

		public MinimizeActionCosts(Map<Action, Expr> costs, Expr defaultCost) {
			this.costs = Collections.unmodifiableMap(new LinkedHashMap<>(costs));
			this.defaultCost = defaultCost;
		}

		public Map<Action, Expr> costs() {
			return costs;
		}

		public Expr defaultCost() {
			return defaultCost;
		}

		public Expr cost(Action action) {
			Expr c = costs.get(action);
			return c == null ? defaultCost : c;
		}

		@Override
		public String toString() {
			return "minimize action costs " + costs;
		}
	}

	public static final class MinimizeExpressionOnFinalState extends Metric {
		private final Expr expression;

		public MinimizeExpressionOnFinalState(Expr expression) {
			this.expression = expression;
		}

		public Expr expression() {
			return expression;
		}

		@Override
		public String toString() {
			return "minimize " + expression;
		}
	}

	public static final class MaximizeExpressionOnFinalState extends Metric {
		private final Expr expression;

		public MaximizeExpressionOnFinalState(Expr expression) {
			this.expression = expression;
		}

		public Expr expression() {
			return expression;
		}

		@Override
		public String toString() {
			return "maximize " + expression;
		}
	}

	// ==============================================================
	// Problem
	// ==============================================================

	/**
	 * A planning problem. A problem built from a domain alone has no objects
	 * beyond the domain's constants, no initial state and no goals.
	 */
	public static class Problem {
		private String name;
		private final LinkedHashMap<String, Types.User> types = new LinkedHashMap<>();
		private final LinkedHashMap<String, Fluent> fluents = new LinkedHashMap<>();
		private final LinkedHashMap<Fluent, Expr> defaults = new LinkedHashMap<>();
		private final LinkedHashMap<String, PlanningObject> objects = new LinkedHashMap<>();
		private final LinkedHashMap<String, Action> actions = new LinkedHashMap<>();
		private final LinkedHashMap<Expr.FluentApp, Expr> initialValues = new LinkedHashMap<>();
		private final LinkedHashMap<Timing, List<Effect>> timedEffects = new LinkedHashMap<>();
		private final ArrayList<Expr> goals = new ArrayList<>();
		private final ArrayList<Expr> trajectoryConstraints = new ArrayList<>();
		private final ArrayList<Metric> metrics = new ArrayList<>();

		public Problem(String name) {
			this.name = name;
		}

		public String name() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		// Types

		public void addType(Types.User type) {
			String key = Syntax.canonical(type.name());
			if (types.containsKey(key)) {
				throw new IllegalArgumentException("type " + type + " already declared");
			}
			types.put(key, type);
		}

		public Collection<Types.User> userTypes() {
			return Collections.unmodifiableCollection(types.values());
		}

		public Types.User userType(String name) {
			return types.get(Syntax.canonical(name));
		}

		// Fluents

		/**
		 * Declare a fluent, with a default value for every application not given
		 * an initial value (or <code>null</code> if there is none).
		 *
		 * @param fluent
		 * @param defaultValue
		 */
		public void addFluent(Fluent fluent, Expr defaultValue) {
			String key = Syntax.canonical(fluent.name());
			if (fluents.containsKey(key)) {
				throw new IllegalArgumentException("fluent " + fluent + " already declared");
			}
			fluents.put(key, fluent);
			if (defaultValue != null) {
				defaults.put(fluent, defaultValue);
			}
		}

		public boolean hasFluent(String name) {
			return fluents.containsKey(Syntax.canonical(name));
		}

		public Fluent fluent(String name) {
			return fluents.get(Syntax.canonical(name));
		}

		public Collection<Fluent> fluents() {
			return Collections.unmodifiableCollection(fluents.values());
		}

		public Expr defaultValue(Fluent fluent) {
			return defaults.get(fluent);
		}

		/**
		 * Remove a fluent from this problem, along with any initial value given to
		 * it.
		 *
		 * @param fluent
		 */
		public void removeFluent(Fluent fluent) {
			fluents.remove(Syntax.canonical(fluent.name()));
			defaults.remove(fluent);
			initialValues.keySet().removeIf(f -> f.fluent() == fluent);
		}

		// Objects

		public void addObject(PlanningObject object) {
			String key = Syntax.canonical(object.name());
			if (objects.containsKey(key)) {
				throw new IllegalArgumentException("object " + object + " already declared");
			}
			objects.put(key, object);
		}

		public boolean hasObject(String name) {
			return objects.containsKey(Syntax.canonical(name));
		}

		public PlanningObject object(String name) {
			return objects.get(Syntax.canonical(name));
		}

		public Collection<PlanningObject> objects() {
			return Collections.unmodifiableCollection(objects.values());
		}

		/**
		 * Get the objects of a given type, including those of its subtypes.
		 *
		 * @param type
		 * @return
		 */
		public List<PlanningObject> objects(Types.User type) {
			ArrayList<PlanningObject> r = new ArrayList<>();
			for (PlanningObject o : objects.values()) {
				if (Types.isCompatible(type, o.type())) {
					r.add(o);
				}
			}
			return r;
		}

		// Actions

		public void addAction(Action action) {
			String key = Syntax.canonical(action.name());
			if (actions.containsKey(key)) {
				throw new IllegalArgumentException("action " + action.name() + " already declared");
			}
			actions.put(key, action);
		}

		public boolean hasAction(String name) {
			return actions.containsKey(Syntax.canonical(name));
		}

		public Action action(String name) {
			return actions.get(Syntax.canonical(name));
		}

		public Collection<Action> actions() {
			return Collections.unmodifiableCollection(actions.values());
		}

		// Initial state

		/**
		 * Give an initial value to a ground fluent application.
		 *
		 * @param fluent
		 * @param value
		 *            A constant or object of the fluent's type.
		 */
		public void setInitialValue(Expr.FluentApp fluent, Expr value) {
			if (!fluent.isGround()) {
				throw new IllegalArgumentException("initial value of non-ground fluent " + fluent);
			} else if (!value.isConstant() && value.kind() != Expr.Kind.OBJECT) {
				throw new IllegalArgumentException("initial value must be a constant: " + value);
			} else if (!Types.isCompatible(fluent.type(), value.type())) {
				throw new IllegalArgumentException("cannot assign " + value + " to fluent " + fluent);
			}
			initialValues.put(fluent, value);
		}

		/**
		 * The initial values explicitly given, in the order they were given.
		 *
		 * @return
		 */
		public Map<Expr.FluentApp, Expr> explicitInitialValues() {
			return Collections.unmodifiableMap(initialValues);
		}

		/**
		 * The initial value of a ground fluent application, falling back to the
		 * fluent's default. This is <code>null</code> when neither exists.
		 *
		 * @param fluent
		 * @return
		 */
		public Expr initialValue(Expr.FluentApp fluent) {
			Expr v = initialValues.get(fluent);
			return v != null ? v : defaults.get(fluent.fluent());
		}

		public void addTimedEffect(Timing timing, Effect effect) {
			timedEffects.computeIfAbsent(timing, t -> new ArrayList<>()).add(effect);
		}

		public Map<Timing, List<Effect>> timedEffects() {
			return Collections.unmodifiableMap(timedEffects);
		}

		// Goals, constraints and metrics

		public void addGoal(Expr goal) {
			if (!goal.type().isBool()) {
				throw new IllegalArgumentException("goal must be boolean: " + goal);
			} else if (!goal.isTrue()) {
				goals.add(goal);
			}
		}

		public List<Expr> goals() {
			return Collections.unmodifiableList(goals);
		}

		public void addTrajectoryConstraint(Expr constraint) {
			if (!constraint.type().isBool()) {
				throw new IllegalArgumentException("constraint must be boolean: " + constraint);
			}
			trajectoryConstraints.add(constraint);
		}

		public List<Expr> trajectoryConstraints() {
			return Collections.unmodifiableList(trajectoryConstraints);
		}

		public void addQualityMetric(Metric metric) {
			metrics.add(metric);
		}

		public List<Metric> qualityMetrics() {
			return Collections.unmodifiableList(metrics);
		}

		/**
		 * Get every expression held by this problem outside its actions (i.e.
		 * goals, trajectory constraints and timed effects). Subclasses extend
		 * this with their own expressions.
		 *
		 * @return
		 */
		public List<Expr> expressions() {
			ArrayList<Expr> r = new ArrayList<>(goals);
			r.addAll(trajectoryConstraints);
			for (List<Effect> es : timedEffects.values()) {
				for (Effect e : es) {
					r.add(e.fluent());
					r.add(e.value());
					if (e.condition() != null) {
						r.add(e.condition());
					}
				}
			}
			return r;
		}

		@Override
		public String toString() {
			return "problem " + name + " (" + fluents.size() + " fluents, " + objects.size() + " objects, "
					+ actions.size() + " actions)";
		}
	}

	/**
	 * Check that no two parameters share the same (case-insensitive) name.
	 *
	 * @param parameters
	 * @return A copy of the given parameters
	 * @throws IllegalArgumentException
	 *             if two parameters share a name.
	 */
	public static List<Parameter> distinct(List<Parameter> parameters) {
		ArrayList<String> names = new ArrayList<>();
		for (Parameter p : parameters) {
			String key = Syntax.canonical(p.name());
			if (names.contains(key)) {
				throw new IllegalArgumentException("parameter " + p.name() + " declared more than once");
			}
			names.add(key);
		}
		return new ArrayList<>(parameters);
	}
}
