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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import pddlfront.core.Expr;
import pddlfront.core.ExpressionCompiler;
import pddlfront.core.ExpressionCompiler.Scope;
import pddlfront.core.Model;
import pddlfront.core.Syntax;
import pddlfront.core.Syntax.Group;
import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.Node;
import pddlfront.core.Types;
import pddlfront.util.Pair;
import pddlfront.util.SyntacticElement;
import pddlfront.util.SyntaxError;

/**
 * Extensions to the core model for hierarchical task networks. Here, a plan
 * achieves a network of abstract tasks, each of which is decomposed by a
 * method into further subtasks until only primitive actions remain. Such
 * problems are declared with the <code>:hierarchy</code> requirement.
 *
 * @author David J. Pearce
 *
 */
public class Hierarchy {
	public final static String UNDEFINED_TASK = "Undefined task";
	public final static String UNDEFINED_SUBTASK = "Undefined subtask";
	public final static String INVALID_ORDERING = "Invalid ordering";
	public final static String INVALID_TASK = "Invalid task";

	/**
	 * An abstract task, such as <code>(deliver ?p - package)</code>.
	 */
	public static class Task implements Model.Parameterised {
		private final String name;
		private final List<Model.Parameter> parameters;

		public Task(String name, List<Model.Parameter> parameters) {
			this.name = name;
			this.parameters = Collections.unmodifiableList(Model.distinct(parameters));
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public List<Model.Parameter> parameters() {
			return parameters;
		}

		@Override
		public String toString() {
			return name + parameters;
		}
	}

	/**
	 * An occurrence of a task or action within a method or task network, applied
	 * to some arguments.
	 */
	public static class Subtask {
		private final String identifier;
		private final Model.Parameterised task;
		private final List<Expr> arguments;

		/**
		 * Construct a subtask.
		 *
		 * @param identifier
		 *            Identifier of this subtask, or <code>null</code> if it should
		 *            be assigned one by the network it is added to.
		 * @param task
		 *            A {@link Task} or {@link Model.Action}.
		 * @param arguments
		 */
		public Subtask(String identifier, Model.Parameterised task, List<Expr> arguments) {
			List<Model.Parameter> parameters = task.parameters();
			if (parameters.size() != arguments.size()) {
				throw new IllegalArgumentException(task.name() + " expects " + parameters.size()
						+ " argument(s), but " + arguments.size() + " given");
			}
			for (int i = 0; i != arguments.size(); ++i) {
				if (!Types.isCompatible(parameters.get(i).type(), arguments.get(i).type())) {
					throw new IllegalArgumentException("argument " + arguments.get(i) + " of " + task.name()
							+ " has type " + arguments.get(i).type() + ", expected " + parameters.get(i).type());
				}
			}
			this.identifier = identifier;
			this.task = task;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		}

		private Subtask(String identifier, Subtask s) {
			this.identifier = identifier;
			this.task = s.task;
			this.arguments = s.arguments;
		}

		public String identifier() {
			return identifier;
		}

		public Model.Parameterised task() {
			return task;
		}

		public boolean isPrimitive() {
			return task instanceof Model.Action;
		}

		public List<Expr> arguments() {
			return arguments;
		}

		@Override
		public String toString() {
			String r = identifier + ": (" + task.name();
			for (Expr e : arguments) {
				r += " " + e;
			}
			return r + ")";
		}
	}

	/**
	 * A set of subtasks, together with a strict partial order over them and
	 * some constraints. This is the common part of a method and of the initial
	 * task network of a problem.
	 */
	public static abstract class Network {
		private final LinkedHashMap<String, Subtask> subtasks = new LinkedHashMap<>();
		private final ArrayList<Pair<Subtask, Subtask>> precedences = new ArrayList<>();
		private final ArrayList<Expr> constraints = new ArrayList<>();

		/**
		 * Add a subtask to this network. A subtask without an identifier is
		 * assigned a fresh one.
		 *
		 * @param subtask
		 * @return The subtask as added
		 * @throws IllegalArgumentException
		 *             if the identifier is already taken.
		 */
		public Subtask addSubtask(Subtask subtask) {
			if (subtask.identifier() == null) {
				String id;
				int n = subtasks.size();
				do {
					id = "_t" + (n++);
				} while (subtasks.containsKey(id));
				subtask = new Subtask(id, subtask);
			}
			String key = Syntax.canonical(subtask.identifier());
			if (subtasks.containsKey(key)) {
				throw new IllegalArgumentException("subtask " + subtask.identifier() + " already declared");
			}
			subtasks.put(key, subtask);
			return subtask;
		}

		public Subtask subtask(String identifier) {
			return subtasks.get(Syntax.canonical(identifier));
		}

		public Collection<Subtask> subtasks() {
			return Collections.unmodifiableCollection(subtasks.values());
		}

		/**
		 * Require that one subtask precedes another.
		 *
		 * @param before
		 * @param after
		 * @throws IllegalArgumentException
		 *             if this would not leave a strict partial order.
		 */
		public void addPrecedence(Subtask before, Subtask after) {
			if (before == after) {
				throw new IllegalArgumentException("subtask " + before.identifier() + " cannot precede itself");
			} else if (precedes(after, before)) {
				throw new IllegalArgumentException(
						"ordering " + before.identifier() + " < " + after.identifier() + " forms a cycle");
			}
			Pair<Subtask, Subtask> p = new Pair<>(before, after);
			if (!precedences.contains(p)) {
				precedences.add(p);
			}
		}

		/**
		 * Totally order the given subtasks, each preceding the next.
		 *
		 * @param ordered
		 */
		public void setOrdered(List<Subtask> ordered) {
			for (int i = 1; i < ordered.size(); ++i) {
				addPrecedence(ordered.get(i - 1), ordered.get(i));
			}
		}

		/**
		 * Check whether one subtask is required (directly or transitively) to
		 * precede another.
		 *
		 * @param before
		 * @param after
		 * @return
		 */
		public boolean precedes(Subtask before, Subtask after) {
			ArrayDeque<Subtask> worklist = new ArrayDeque<>();
			ArrayList<Subtask> visited = new ArrayList<>();
			worklist.add(before);
			while (!worklist.isEmpty()) {
				Subtask s = worklist.poll();
				for (Pair<Subtask, Subtask> p : precedences) {
					if (p.first() == s && !visited.contains(p.second())) {
						if (p.second() == after) {
							return true;
						}
						visited.add(p.second());
						worklist.add(p.second());
					}
				}
			}
			return false;
		}

		/**
		 * The declared precedences, each as a (before, after) pair.
		 *
		 * @return
		 */
		public List<Pair<Subtask, Subtask>> precedences() {
			return Collections.unmodifiableList(precedences);
		}

		public void addConstraint(Expr constraint) {
			if (!constraint.type().isBool()) {
				throw new IllegalArgumentException("constraint must be boolean: " + constraint);
			} else if (!constraint.isTrue()) {
				constraints.add(constraint);
			}
		}

		public List<Expr> constraints() {
			return Collections.unmodifiableList(constraints);
		}

		/**
		 * Get every expression held by this network.
		 *
		 * @return
		 */
		public List<Expr> expressions() {
			ArrayList<Expr> r = new ArrayList<>(constraints);
			for (Subtask s : subtasks.values()) {
				r.addAll(s.arguments());
			}
			return r;
		}
	}

	/**
	 * A method, which decomposes a task into a network of subtasks when its
	 * preconditions hold.
	 */
	public static class Method extends Network implements Model.Parameterised {
		private final String name;
		private final List<Model.Parameter> parameters;
		private final Task task;
		private final List<Model.Parameter> arguments;
		private final ArrayList<Expr> preconditions = new ArrayList<>();

		/**
		 * Construct a method.
		 *
		 * @param name
		 * @param parameters
		 * @param task
		 *            The task achieved by this method
		 * @param arguments
		 *            The parameters of this method passed to the achieved task
		 */
		public Method(String name, List<Model.Parameter> parameters, Task task, List<Model.Parameter> arguments) {
			this.name = name;
			this.parameters = Collections.unmodifiableList(Model.distinct(parameters));
			if (arguments.size() != task.parameters().size()) {
				throw new IllegalArgumentException("task " + task.name() + " expects " + task.parameters().size()
						+ " argument(s), but " + arguments.size() + " given");
			}
			for (int i = 0; i != arguments.size(); ++i) {
				if (!Types.isCompatible(task.parameters().get(i).type(), arguments.get(i).type())) {
					throw new IllegalArgumentException("argument ?" + arguments.get(i) + " of task " + task.name()
							+ " has type " + arguments.get(i).type());
				}
			}
			this.task = task;
			this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		}

		@Override
		public String name() {
			return name;
		}

		@Override
		public List<Model.Parameter> parameters() {
			return parameters;
		}

		public Task achievedTask() {
			return task;
		}

		public List<Model.Parameter> taskArguments() {
			return arguments;
		}

		public void addPrecondition(Expr precondition) {
			if (!precondition.type().isBool()) {
				throw new IllegalArgumentException("precondition must be boolean: " + precondition);
			} else if (!precondition.isTrue() && !preconditions.contains(precondition)) {
				preconditions.add(precondition);
			}
		}

		public List<Expr> preconditions() {
			return Collections.unmodifiableList(preconditions);
		}

		@Override
		public List<Expr> expressions() {
			List<Expr> r = super.expressions();
			r.addAll(preconditions);
			return r;
		}

		@Override
		public String toString() {
			return name + parameters + " achieves " + task.name() + arguments;
		}
	}

	/**
	 * The initial network of tasks of a hierarchical problem. Its parameters are
	 * free variables which may be chosen by the planner.
	 */
	public static class TaskNetwork extends Network implements Model.Parameterised {
		private final ArrayList<Model.Parameter> parameters = new ArrayList<>();

		@Override
		public String name() {
			return "htn";
		}

		@Override
		public List<Model.Parameter> parameters() {
			return Collections.unmodifiableList(parameters);
		}

		public void setParameters(List<Model.Parameter> parameters) {
			this.parameters.clear();
			this.parameters.addAll(Model.distinct(parameters));
		}
	}

	/**
	 * A problem with tasks, methods and an initial task network. When solved
	 * through its task network, the goal of such a problem may be empty.
	 */
	public static class HierarchicalProblem extends Model.Problem {
		private final LinkedHashMap<String, Task> tasks = new LinkedHashMap<>();
		private final LinkedHashMap<String, Method> methods = new LinkedHashMap<>();
		private final TaskNetwork network = new TaskNetwork();

		public HierarchicalProblem(String name) {
			super(name);
		}

		public void addTask(Task task) {
			String key = Syntax.canonical(task.name());
			if (tasks.containsKey(key)) {
				throw new IllegalArgumentException("task " + task.name() + " already declared");
			}
			tasks.put(key, task);
		}

		public boolean hasTask(String name) {
			return tasks.containsKey(Syntax.canonical(name));
		}

		public Task task(String name) {
			return tasks.get(Syntax.canonical(name));
		}

		public Collection<Task> tasks() {
			return Collections.unmodifiableCollection(tasks.values());
		}

		public void addMethod(Method method) {
			String key = Syntax.canonical(method.name());
			if (methods.containsKey(key)) {
				throw new IllegalArgumentException("method " + method.name() + " already declared");
			}
			methods.put(key, method);
		}

		public Method method(String name) {
			return methods.get(Syntax.canonical(name));
		}

		public Collection<Method> methods() {
			return Collections.unmodifiableCollection(methods.values());
		}

		public TaskNetwork taskNetwork() {
			return network;
		}

		@Override
		public List<Expr> expressions() {
			List<Expr> r = super.expressions();
			for (Method m : methods.values()) {
				r.addAll(m.expressions());
			}
			r.addAll(network.expressions());
			return r;
		}
	}

	/**
	 * Responsible for turning the hierarchical declarations of a domain or
	 * problem into tasks, methods and the task network.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Builder {
		private final HierarchicalProblem problem;
		private final ExpressionCompiler compiler;

		public Builder(HierarchicalProblem problem, ExpressionCompiler compiler) {
			this.problem = problem;
			this.compiler = compiler;
		}

		/**
		 * Declare a method. The task it achieves is given as
		 * <code>(name ?arg1 ... ?argn)</code>, where every argument is a
		 * parameter of the method.
		 *
		 * @param decl
		 * @param parameters
		 */
		public void declareMethod(Syntax.MethodDecl decl, List<Model.Parameter> parameters) {
			Group t = decl.task();
			Leaf head = t.head();
			if (head == null || !problem.hasTask(head.key())) {
				syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_TASK + ": " + t, t);
			}
			Task task = problem.task(head.key());
			Method method = null;
			try {
				ArrayList<Model.Parameter> arguments = new ArrayList<>();
				for (int i = 1; i < t.size(); ++i) {
					Node arg = t.get(i);
					Model.Parameter p = null;
					if (arg instanceof Leaf && ((Leaf) arg).isVariable()) {
						p = parameter(parameters, ((Leaf) arg).name());
					}
					if (p == null) {
						syntaxError(SyntaxError.Kind.RESOLUTION, ExpressionCompiler.UNDEFINED_PARAMETER + ": " + arg,
								arg);
					}
					arguments.add(p);
				}
				method = new Method(decl.name().text(), parameters, task, arguments);
				problem.addMethod(method);
			} catch (IllegalArgumentException e) {
				syntaxError(SyntaxError.Kind.DECLARATION, INVALID_TASK + ": " + e.getMessage(), decl, e);
			}
			if (decl.precondition() != null) {
				Expr pre = compiler.compile(method, Scope.EMPTY, decl.precondition());
				try {
					method.addPrecondition(pre);
				} catch (IllegalArgumentException e) {
					syntaxError(SyntaxError.Kind.RESOLUTION, e.getMessage(), decl.precondition(), e);
				}
			}
			declareNetwork(method, method, decl.network());
		}

		/**
		 * Declare the initial task network of the problem.
		 *
		 * @param decl
		 * @param parameters
		 */
		public void declareTaskNetwork(Syntax.NetworkDecl decl, List<Model.Parameter> parameters) {
			TaskNetwork network = problem.taskNetwork();
			try {
				network.setParameters(parameters);
			} catch (IllegalArgumentException e) {
				syntaxError(SyntaxError.Kind.DECLARATION, e.getMessage(), decl, e);
			}
			declareNetwork(network, network, decl);
		}

		/**
		 * Populate a network from the ordered subtasks, subtasks, ordering and
		 * constraints of a declaration.
		 */
		private void declareNetwork(Network network, Model.Parameterised enclosing, Syntax.NetworkDecl decl) {
			if (decl.orderedSubtasks() != null) {
				ArrayList<Subtask> ordered = new ArrayList<>();
				for (Group g : items(decl.orderedSubtasks())) {
					ordered.add(addSubtask(network, enclosing, g));
				}
				network.setOrdered(ordered);
			}
			if (decl.subtasks() != null) {
				for (Group g : items(decl.subtasks())) {
					addSubtask(network, enclosing, g);
				}
			}
			if (decl.ordering() != null) {
				for (Group g : items(decl.ordering())) {
					addOrdering(network, g);
				}
			}
			if (decl.constraints() != null) {
				Expr c = compiler.compile(enclosing, Scope.EMPTY, decl.constraints());
				try {
					network.addConstraint(c);
				} catch (IllegalArgumentException e) {
					syntaxError(SyntaxError.Kind.RESOLUTION, e.getMessage(), decl.constraints(), e);
				}
			}
		}

		/**
		 * Add a subtask of the form <code>(name args...)</code> or
		 * <code>(id (name args...))</code>.
		 */
		private Subtask addSubtask(Network network, Model.Parameterised enclosing, Group g) {
			String identifier = null;
			Group call = g;
			if (g.size() == 2 && g.get(0) instanceof Leaf && g.get(1) instanceof Group) {
				identifier = ((Leaf) g.get(0)).text();
				call = (Group) g.get(1);
			}
			Leaf head = call.head();
			Model.Parameterised task = null;
			if (head != null && problem.hasTask(head.key())) {
				task = problem.task(head.key());
			} else if (head != null && problem.hasAction(head.key())) {
				task = problem.action(head.key());
			} else {
				syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_TASK + ": " + call, call);
			}
			ArrayList<Expr> arguments = new ArrayList<>();
			for (int i = 1; i < call.size(); ++i) {
				arguments.add(compiler.compile(enclosing, Scope.EMPTY, call.get(i)));
			}
			try {
				return network.addSubtask(new Subtask(identifier, task, arguments));
			} catch (IllegalArgumentException e) {
				syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_TASK + ": " + e.getMessage(), g, e);
				return null; // dead code
			}
		}

		/**
		 * Add an ordering of the form <code>(&lt; id1 id2)</code>.
		 */
		private void addOrdering(Network network, Group g) {
			if (g.size() != 3 || !g.startsWith("<") || !(g.get(1) instanceof Leaf) || !(g.get(2) instanceof Leaf)) {
				syntaxError(SyntaxError.Kind.STRUCTURAL, INVALID_ORDERING + ": " + g, g);
			}
			Subtask before = subtask(network, (Leaf) g.get(1));
			Subtask after = subtask(network, (Leaf) g.get(2));
			try {
				network.addPrecedence(before, after);
			} catch (IllegalArgumentException e) {
				syntaxError(SyntaxError.Kind.RESOLUTION, INVALID_ORDERING + ": " + e.getMessage(), g, e);
			}
		}

		private Subtask subtask(Network network, Leaf id) {
			Subtask s = network.subtask(id.text());
			if (s == null) {
				syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_SUBTASK + ": " + id, id);
			}
			return s;
		}

		/**
		 * Get the groups of a (possibly empty) conjunction, or the node itself
		 * if it is not a conjunction.
		 */
		private List<Group> items(Node n) {
			ArrayList<Group> items = new ArrayList<>();
			if (!(n instanceof Group)) {
				syntaxError(SyntaxError.Kind.STRUCTURAL, "expecting '(', found " + n, n);
			}
			Group g = (Group) n;
			if (g.startsWith("and")) {
				for (int i = 1; i < g.size(); ++i) {
					if (!(g.get(i) instanceof Group)) {
						syntaxError(SyntaxError.Kind.STRUCTURAL, "expecting '(', found " + g.get(i), g.get(i));
					}
					items.add((Group) g.get(i));
				}
			} else if (!g.isEmpty()) {
				items.add(g);
			}
			return items;
		}

		private static Model.Parameter parameter(List<Model.Parameter> parameters, String name) {
			for (Model.Parameter p : parameters) {
				if (Syntax.canonical(p.name()).equals(Syntax.canonical(name))) {
					return p;
				}
			}
			return null;
		}

		private void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e) {
			SyntaxError.syntaxError(kind, msg, compiler.source(), e);
		}

		private void syntaxError(SyntaxError.Kind kind, String msg, SyntacticElement e, Throwable ex) {
			SyntaxError.syntaxError(kind, msg, compiler.source(), e, ex);
		}
	}
}
