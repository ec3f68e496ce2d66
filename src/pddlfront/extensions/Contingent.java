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
package pddlfront.extensions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import pddlfront.core.Expr;
import pddlfront.core.ExpressionCompiler;
import pddlfront.core.Model;
import pddlfront.core.Syntax.Group;
import pddlfront.util.SyntaxError;

/**
 * Extensions to the core model for contingent planning, where the initial
 * state is only partially known and actions may observe fluents. Such problems
 * are declared with the <code>:contingent</code> requirement.
 *
 * @author David J. Pearce
 *
 */
public class Contingent {
	public final static String REQUIRES_CONTINGENT = "Initial state constraints require the :contingent requirement";

	/**
	 * An action which, in addition to its effects, observes the values of some
	 * fluents.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class SensingAction extends Model.InstantaneousAction {
		private final ArrayList<Expr.FluentApp> observed = new ArrayList<>();

		public SensingAction(String name, List<Model.Parameter> parameters) {
			super(name, parameters);
		}

		public void addObservedFluent(Expr.FluentApp fluent) {
			if (!observed.contains(fluent)) {
				observed.add(fluent);
			}
		}

		public List<Expr.FluentApp> observedFluents() {
			return Collections.unmodifiableList(observed);
		}
	}

	/**
	 * A problem whose initial state may be constrained, rather than given
	 * exactly. Exactly one of each <code>oneof</code> constraint holds, at least
	 * one of each <code>or</code> constraint holds and the value of each hidden
	 * fluent is unknown.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class ContingentProblem extends Model.Problem {
		private final ArrayList<List<Expr>> oneofs = new ArrayList<>();
		private final ArrayList<List<Expr>> ors = new ArrayList<>();
		private final ArrayList<Expr.FluentApp> hidden = new ArrayList<>();

		public ContingentProblem(String name) {
			super(name);
		}

		public void addOneofConstraint(List<Expr> alternatives) {
			oneofs.add(Collections.unmodifiableList(new ArrayList<>(alternatives)));
		}

		public void addOrConstraint(List<Expr> alternatives) {
			ors.add(Collections.unmodifiableList(new ArrayList<>(alternatives)));
		}

		public void addUnknownInitialConstraint(Expr.FluentApp fluent) {
			hidden.add(fluent);
		}

		public List<List<Expr>> oneofConstraints() {
			return Collections.unmodifiableList(oneofs);
		}

		public List<List<Expr>> orConstraints() {
			return Collections.unmodifiableList(ors);
		}

		public List<Expr.FluentApp> hiddenFluents() {
			return Collections.unmodifiableList(hidden);
		}

		@Override
		public List<Expr> expressions() {
			List<Expr> r = super.expressions();
			for (List<Expr> es : oneofs) {
				r.addAll(es);
			}
			for (List<Expr> es : ors) {
				r.addAll(es);
			}
			r.addAll(hidden);
			return r;
		}
	}

	/**
	 * Check whether an initial state entry is a contingent constraint, i.e.
	 * starts with <code>oneof</code>, <code>or</code> or <code>unknown</code>.
	 *
	 * @param g
	 * @return
	 */
	public static boolean isInitialConstraint(Group g) {
		return g.startsWith("oneof") || g.startsWith("or") || g.startsWith("unknown");
	}

	/**
	 * Add a contingent constraint of the initial state to a problem. For
	 * example:
	 *
	 * <pre>
	 * (oneof (at p1) (at p2))
	 * (or (safe p1) (safe p2))
	 * (unknown (at p1))
	 * </pre>
	 *
	 * @param problem
	 * @param compiler
	 *            Compiler for the problem document
	 * @param g
	 */
	public static void addInitialConstraint(ContingentProblem problem, ExpressionCompiler compiler, Group g) {
		ArrayList<Expr> items = new ArrayList<>();
		for (int i = 1; i < g.size(); ++i) {
			Expr e = compiler.compile(null, ExpressionCompiler.Scope.EMPTY, g.get(i));
			if (!e.type().isBool()) {
				SyntaxError.syntaxError(SyntaxError.Kind.RESOLUTION, "Expecting boolean expression: " + g.get(i),
						compiler.source(), g.get(i));
			}
			items.add(e);
		}
		if (g.startsWith("oneof")) {
			problem.addOneofConstraint(items);
		} else if (g.startsWith("or")) {
			problem.addOrConstraint(items);
		} else {
			for (int i = 0; i != items.size(); ++i) {
				if (!(items.get(i) instanceof Expr.FluentApp)) {
					SyntaxError.syntaxError(SyntaxError.Kind.RESOLUTION, "Expecting fluent: " + g.get(i + 1),
							compiler.source(), g.get(i + 1));
				}
				problem.addUnknownInitialConstraint((Expr.FluentApp) items.get(i));
			}
		}
	}
}
