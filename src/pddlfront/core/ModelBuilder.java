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
import java.util.List;

import pddlfront.core.ExpressionCompiler.Scope;
import pddlfront.core.Syntax.Group;
import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.Node;
import pddlfront.core.Syntax.TypedList;
import pddlfront.extensions.Contingent;
import pddlfront.extensions.Hierarchy;
import pddlfront.util.Rational;
import pddlfront.util.SyntacticElement;
import pddlfront.util.SyntaxError;
import pddlfront.util.UsageError;

/**
 * Responsible for building a planning model from a parsed domain and
 * (optionally) problem. This proceeds in a fixed order, where each step may
 * rely on those before it: types, fluents, constants, tasks, actions and
 * methods of the domain, followed by the objects, expanded universal effects,
 * task network, initial state, goals, constraints and metric of the problem.
 *
 * @author David J. Pearce
 *
 */
public class ModelBuilder {
	private static final boolean DEBUG = false;

	public final static String MISSING_GOAL = "Missing goal section in problem file.";
	public final static String UNEXPANDED_EFFECTS = "Domain contains universally quantified effects, which cannot be expanded without a problem.";
	public final static String DUPLICATE_DECLARATION = "Declared more than once";
	public final static String DUPLICATE_PARAMETER = "Parameter declared more than once";
	public final static String REQUIRES_HIERARCHY = "Tasks, methods and task networks require the :hierarchy requirement";
	public final static String REQUIRES_SENSING = "Observations require the :contingent requirement";
	public final static String INVALID_INITIAL_VALUE = "Invalid initial value";
	public final static String INVALID_METRIC = "Metric must be numeric";

	private final Types.Manager types;
	private final ExpressionManager em;

	public ModelBuilder(ExpressionManager em) {
		this.types = em.types();
		this.em = em;
	}

	/**
	 * Build the model of a domain on its own. Such a model has no initial state
	 * or goals, and the domain must not contain any universally quantified
	 * effects.
	 *
	 * @param source
	 * @param domain
	 * @return
	 */
	public Model.Problem build(String source, Syntax.Domain domain) {
		return build(source, domain, null, null);
	}

	/**
	 * Build the model of a domain and a problem.
	 *
	 * @param domainSource
	 *            Text of the domain (for error reporting)
	 * @param domain
	 * @param problemSource
	 *            Text of the problem (for error reporting), or <code>null</code>
	 * @param problem
	 *            The problem, or <code>null</code> if there is none
	 * @return
	 */
	public Model.Problem build(String domainSource, Syntax.Domain domain, String problemSource,
			Syntax.Problem problem) {
		Model.Problem p = create(domain);
		TypeResolver.Table table = new TypeResolver(types, domainSource).resolve(domain.types(),
				TypeResolver.isObjectTypeNeeded(domain));
		for (Types.User t : table.types()) {
			p.addType(t);
		}
		Context ctx = new Context(p, table, domainSource);
		declareFluents(ctx, domain);
		declareObjects(ctx, domain.constants());
		declareTasks(ctx, domain);
		ArrayList<PendingExpansion> pending = new ArrayList<>();
		for (Syntax.OperatorDecl decl : domain.actions()) {
			declareAction(ctx, decl, pending);
		}
		declareMethods(ctx, domain);
		if (problem == null) {
			if (!pending.isEmpty()) {
				throw new UsageError(UNEXPANDED_EFFECTS);
			}
			return p;
		}
		// Now, the problem
		p.setName(problem.name().text());
		Context pctx = new Context(p, table, problemSource);
		declareObjects(pctx, problem.objects());
		for (PendingExpansion e : pending) {
			if (DEBUG) {
				System.err.println("expanding " + e.node() + " of " + e.action().name());
			}
			ctx.assembler.expand(e);
		}
		declareTaskNetwork(pctx, problem.network());
		declareInit(pctx, problem.init());
		declareGoal(pctx, problem.goal());
		if (problem.constraints() != null) {
			Expr c = pctx.compiler.compile(null, Scope.EMPTY, problem.constraints());
			try {
				p.addTrajectoryConstraint(c);
			} catch (IllegalArgumentException e) {
				pctx.syntaxError(SyntaxError.Kind.RESOLUTION, e.getMessage(), problem.constraints(), e);
			}
		}
		declareMetric(pctx, problem.metric());
		if (DEBUG) {
			System.err.println("built " + p);
		}
		return p;
	}

	/**
	 * Create a problem of the class determined by the domain's requirements.
	 */
	private static Model.Problem create(Syntax.Domain domain) {
		String name = domain.name().text();
		if (domain.requires(":hierarchy")) {
			return new Hierarchy.HierarchicalProblem(name);
		} else if (domain.requires(":contingent")) {
			return new Contingent.ContingentProblem(name);
		}
		return new Model.Problem(name);
	}

	// ==============================================================
	// Domain
	// ==============================================================

	/**
	 * Declare predicates as boolean fluents (which default to false) and
	 * functions as real fluents.
	 */
	private void declareFluents(Context ctx, Syntax.Domain domain) {
		for (Syntax.Signature s : domain.predicates()) {
			Model.Fluent f = new Model.Fluent(s.name().text(), types.bool(), parameters(ctx, s.parameters()));
			declare(ctx, s.name(), () -> ctx.problem.addFluent(f, em.FALSE));
		}
		for (Syntax.Signature s : domain.functions()) {
			Model.Fluent f = new Model.Fluent(s.name().text(), types.real(), parameters(ctx, s.parameters()));
			declare(ctx, s.name(), () -> ctx.problem.addFluent(f, null));
		}
		if (DEBUG) {
			System.err.println("declared fluents " + ctx.problem.fluents());
		}
	}

	private void declareObjects(Context ctx, List<TypedList> objects) {
		for (TypedList tl : objects) {
			Types.User type = ctx.table.resolve(tl, ctx.source);
			for (Leaf name : tl.names()) {
				Model.PlanningObject o = new Model.PlanningObject(name.text(), type);
				declare(ctx, name, () -> ctx.problem.addObject(o));
			}
		}
	}

	private void declareTasks(Context ctx, Syntax.Domain domain) {
		for (Syntax.TaskDecl decl : domain.tasks()) {
			Hierarchy.HierarchicalProblem hp = hierarchical(ctx, decl);
			Hierarchy.Task t = new Hierarchy.Task(decl.name().text(), parameters(ctx, decl.parameters()));
			declare(ctx, decl.name(), () -> hp.addTask(t));
		}
	}

	/**
	 * Declare an action or durative action. The effects of the action may
	 * contain universal effects, which are added to the pending list.
	 */
	private void declareAction(Context ctx, Syntax.OperatorDecl decl, List<PendingExpansion> pending) {
		String name = decl.name().text();
		List<Model.Parameter> parameters = parameters(ctx, decl.parameters());
		Model.Action action;
		if (decl instanceof Syntax.DurativeActionDecl) {
			Syntax.DurativeActionDecl d = (Syntax.DurativeActionDecl) decl;
			Model.DurativeAction a = new Model.DurativeAction(name, parameters);
			a.setDuration(ctx.assembler.duration(a, d.duration()));
			ctx.assembler.conditions(a, d.condition());
			ctx.assembler.effects(a, d.effect(), pending);
			action = a;
		} else {
			Syntax.ActionDecl d = (Syntax.ActionDecl) decl;
			Model.InstantaneousAction a;
			if (d.observe() == null) {
				a = new Model.InstantaneousAction(name, parameters);
			} else if (ctx.problem instanceof Contingent.ContingentProblem) {
				a = new Contingent.SensingAction(name, parameters);
			} else {
				ctx.syntaxError(SyntaxError.Kind.STRUCTURAL, REQUIRES_SENSING, d.observe());
				return;
			}
			if (d.precondition() != null) {
				Expr pre = ctx.compiler.compile(a, Scope.EMPTY, d.precondition());
				try {
					a.addPrecondition(pre);
				} catch (IllegalArgumentException e) {
					ctx.syntaxError(SyntaxError.Kind.RESOLUTION, e.getMessage(), d.precondition(), e);
				}
			}
			if (d.effect() != null) {
				ctx.assembler.effects(a, d.effect(), pending);
			}
			if (d.observe() != null) {
				ctx.assembler.observations((Contingent.SensingAction) a, d.observe());
			}
			action = a;
		}
		declare(ctx, decl.name(), () -> ctx.problem.addAction(action));
		if (DEBUG) {
			System.err.println("declared action " + action + " with effects " + action.effects());
		}
	}

	private void declareMethods(Context ctx, Syntax.Domain domain) {
		for (Syntax.MethodDecl decl : domain.methods()) {
			Hierarchy.HierarchicalProblem hp = hierarchical(ctx, decl);
			new Hierarchy.Builder(hp, ctx.compiler).declareMethod(decl, parameters(ctx, decl.parameters()));
		}
	}

	// ==============================================================
	// Problem
	// ==============================================================

	private void declareTaskNetwork(Context ctx, Syntax.NetworkDecl decl) {
		if (decl != null) {
			Hierarchy.HierarchicalProblem hp = hierarchical(ctx, decl);
			new Hierarchy.Builder(hp, ctx.compiler).declareTaskNetwork(decl, parameters(ctx, decl.parameters()));
		}
	}

	/**
	 * Declare the initial state. Entries are either <code>(= f v)</code>, a
	 * timed literal <code>(at t l)</code>, a contingent constraint or a fluent
	 * which is initially true.
	 */
	private void declareInit(Context ctx, List<Node> init) {
		ArrayList<Node> entries = new ArrayList<>(init);
		if (entries.size() == 1 && ((Group) entries.get(0)).startsWith("and")) {
			Group g = (Group) entries.remove(0);
			for (int i = 1; i < g.size(); ++i) {
				entries.add(g.get(i));
			}
		}
		for (Node n : entries) {
			if (!(n instanceof Group)) {
				ctx.syntaxError(SyntaxError.Kind.STRUCTURAL, "expecting '(', found " + n, n);
			}
			Group g = (Group) n;
			try {
				if (g.size() == 3 && g.startsWith("=")) {
					Expr.FluentApp f = fluent(ctx, g.get(1));
					ctx.problem.setInitialValue(f, em.simplify(ctx.compiler.compile(null, Scope.EMPTY, g.get(2))));
				} else if (isTimedLiteral(g)) {
					Rational time = Rational.parse(((Leaf) g.get(1)).text());
					ctx.problem.addTimedEffect(Model.Timing.global(time), literal(ctx, g.get(2)));
				} else if (Contingent.isInitialConstraint(g)) {
					if (!(ctx.problem instanceof Contingent.ContingentProblem)) {
						throw new UsageError(Contingent.REQUIRES_CONTINGENT);
					}
					Contingent.addInitialConstraint((Contingent.ContingentProblem) ctx.problem, ctx.compiler, g);
				} else if (g.size() == 2 && g.startsWith("not")) {
					ctx.problem.setInitialValue(fluent(ctx, g.get(1)), em.FALSE);
				} else {
					ctx.problem.setInitialValue(fluent(ctx, g), em.TRUE);
				}
			} catch (IllegalArgumentException e) {
				ctx.syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_INITIAL_VALUE + ": " + e.getMessage(), g, e);
			}
		}
	}

	/**
	 * Check whether an initial state entry is <code>(at t l)</code> with a
	 * non-negative rational time. Otherwise, it could simply be an application
	 * of a fluent named <code>at</code>.
	 */
	private static boolean isTimedLiteral(Group g) {
		if (g.size() == 3 && g.startsWith("at") && g.get(1) instanceof Leaf && g.get(2) instanceof Group) {
			try {
				return Rational.parse(((Leaf) g.get(1)).text()).signum() >= 0;
			} catch (NumberFormatException e) {
				return false;
			}
		}
		return false;
	}

	/**
	 * Compile the literal of a timed initial literal into an effect, which is
	 * either a fluent, its negation or an equality.
	 */
	private Model.Effect literal(Context ctx, Node n) {
		Group g = (Group) n;
		if (g.size() == 2 && g.startsWith("not")) {
			return new Model.Effect(Model.Effect.Kind.ASSIGN, fluent(ctx, g.get(1)), em.FALSE, null);
		} else if (g.size() == 3 && g.startsWith("=")) {
			Expr v = ctx.compiler.compile(null, Scope.EMPTY, g.get(2));
			return new Model.Effect(Model.Effect.Kind.ASSIGN, fluent(ctx, g.get(1)), v, null);
		}
		return new Model.Effect(Model.Effect.Kind.ASSIGN, fluent(ctx, g), em.TRUE, null);
	}

	private void declareGoal(Context ctx, Node goal) {
		if (goal == null) {
			if (!(ctx.problem instanceof Hierarchy.HierarchicalProblem)) {
				throw new UsageError(MISSING_GOAL);
			}
			return;
		}
		Expr g = ctx.compiler.compile(null, Scope.EMPTY, goal);
		try {
			ctx.problem.addGoal(g);
		} catch (IllegalArgumentException e) {
			ctx.syntaxError(SyntaxError.Kind.RESOLUTION, e.getMessage(), goal, e);
		}
	}

	/**
	 * Declare the metric. Minimising <code>total-time</code> is the makespan,
	 * otherwise the compiled expression is normalised.
	 */
	private void declareMetric(Context ctx, Syntax.MetricDecl metric) {
		if (metric == null) {
			return;
		}
		Node e = metric.expression();
		if (metric.isMinimize() && isTotalTime(e)) {
			ctx.problem.addQualityMetric(new Model.MinimizeMakespan());
			return;
		}
		Expr x = ctx.compiler.compile(null, Scope.EMPTY, e);
		if (!x.type().isNumeric()) {
			ctx.syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_METRIC + ": " + e, e);
		}
		ctx.problem.addQualityMetric(new MetricNormalizer(em).normalize(ctx.problem, x, metric.isMinimize()));
	}

	private static boolean isTotalTime(Node n) {
		if (n instanceof Group && ((Group) n).size() == 1) {
			n = ((Group) n).get(0);
		}
		return n instanceof Leaf && ((Leaf) n).is("total-time");
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Construct the parameters declared by some typed lists, checking that no
	 * name is used twice.
	 */
	private List<Model.Parameter> parameters(Context ctx, List<TypedList> lists) {
		ArrayList<Model.Parameter> parameters = new ArrayList<>();
		ArrayList<String> names = new ArrayList<>();
		for (TypedList tl : lists) {
			Types.User type = ctx.table.resolve(tl, ctx.source);
			for (Leaf name : tl.names()) {
				if (names.contains(name.key())) {
					ctx.syntaxError(SyntaxError.Kind.DECLARATION, DUPLICATE_PARAMETER + ": " + name, name);
				}
				names.add(name.key());
				parameters.add(new Model.Parameter(name.name(), type));
			}
		}
		return parameters;
	}

	private Expr.FluentApp fluent(Context ctx, Node n) {
		Expr e = ctx.compiler.compile(null, Scope.EMPTY, n);
		if (!(e instanceof Expr.FluentApp)) {
			ctx.syntaxError(SyntaxError.Kind.RESOLUTION, EffectAssembler.EXPECTED_FLUENT + ": " + n, n);
		}
		return (Expr.FluentApp) e;
	}

	private static Hierarchy.HierarchicalProblem hierarchical(Context ctx, SyntacticElement decl) {
		if (!(ctx.problem instanceof Hierarchy.HierarchicalProblem)) {
			ctx.syntaxError(SyntaxError.Kind.STRUCTURAL, REQUIRES_HIERARCHY, decl);
		}
		return (Hierarchy.HierarchicalProblem) ctx.problem;
	}

	/**
	 * Run a declaration, reporting a name which is already taken against the
	 * given element.
	 */
	private static void declare(Context ctx, Leaf name, Runnable declaration) {
		try {
			declaration.run();
		} catch (IllegalArgumentException e) {
			ctx.syntaxError(SyntaxError.Kind.DECLARATION, DUPLICATE_DECLARATION + ": " + name, name, e);
		}
	}

	/**
	 * The state needed to build from one document, i.e. the domain or the
	 * problem.
	 */
	private final class Context {
		private final Model.Problem problem;
		private final TypeResolver.Table table;
		private final String source;
		private final ExpressionCompiler compiler;
		private final EffectAssembler assembler;

		public Context(Model.Problem problem, TypeResolver.Table table, String source) {
			this.problem = problem;
			this.table = table;
			this.source = source;
			this.compiler = new ExpressionCompiler(em, problem, table, source);
			this.assembler = new EffectAssembler(compiler, problem);
		}

		public void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e) {
			SyntaxError.syntaxError(kind, msg, source, e);
		}

		public void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e, Throwable ex) {
			SyntaxError.syntaxError(kind, msg, source, e, ex);
		}
	}

	/**
	 * A universally quantified effect of an action, which is expanded once the
	 * objects of the problem are known.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class PendingExpansion {
		private final Model.Action action;
		private final Group node;
		private final Model.Timing timing;
		private final Expr condition;

		public PendingExpansion(Model.Action action, Group node, Model.Timing timing, Expr condition) {
			this.action = action;
			this.node = node;
			this.timing = timing;
			this.condition = condition;
		}

		public Model.Action action() {
			return action;
		}

		/**
		 * The <code>(forall ...)</code> effect itself.
		 *
		 * @return
		 */
		public Group node() {
			return node;
		}

		/**
		 * The timing of the effect within a durative action, or
		 * <code>null</code> if it is not (yet) known.
		 *
		 * @return
		 */
		public Model.Timing timing() {
			return timing;
		}

		/**
		 * The condition of any enclosing conditional effects, or
		 * <code>null</code>.
		 *
		 * @return
		 */
		public Expr condition() {
			return condition;
		}
	}
}
