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

import java.util.Collections;
import java.util.List;
import java.util.Locale;

import pddlfront.util.SyntacticElement;

/**
 * The parse tree of a PDDL document. At the bottom are {@link Node}s, which
 * are either a {@link Leaf} (a single word) or a {@link Group} (a bracketed
 * sequence of nodes). Every node carries the source span it was read from.
 * Above these sit the structural units recognised by the grammar (e.g.
 * {@link Domain}, {@link ActionDecl}) whose bodies (preconditions, effects,
 * goals, etc) are left as raw nodes for the later stages to compile.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {

	/**
	 * Canonical form of an identifier. All PDDL identifiers are case-insensitive.
	 *
	 * @param name
	 * @return
	 */
	public static String canonical(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	// ==============================================================
	// Nodes
	// ==============================================================

	public interface Node extends SyntacticElement {
		/**
		 * Check whether this node is a single word or not.
		 *
		 * @return
		 */
		public boolean isLeaf();
	}

	/**
	 * A single word, such as <code>?x</code>, <code>truck</code> or
	 * <code>3/2</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Leaf extends SyntacticElement.Impl implements Node {
		private final String text;
		private final String key;

		public Leaf(String text, Attribute... attributes) {
			super(attributes);
			this.text = text;
			this.key = canonical(text);
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		/**
		 * The text exactly as written.
		 *
		 * @return
		 */
		public String text() {
			return text;
		}

		/**
		 * The case-insensitive form of this word, used for all lookups.
		 *
		 * @return
		 */
		public String key() {
			return key;
		}

		/**
		 * Check whether this word is a variable (i.e. starts with a
		 * <code>?</code>).
		 *
		 * @return
		 */
		public boolean isVariable() {
			return text.length() > 1 && text.charAt(0) == '?';
		}

		/**
		 * The name of this word with any variable sigil stripped.
		 *
		 * @return
		 */
		public String name() {
			return isVariable() ? text.substring(1) : text;
		}

		/**
		 * Check whether this word matches a given (lower case) keyword.
		 *
		 * @param keyword
		 * @return
		 */
		public boolean is(String keyword) {
			return key.equals(keyword);
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * A bracketed sequence of zero or more nodes, such as
	 * <code>(on ?x ?y)</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Group extends SyntacticElement.Impl implements Node {
		private final Node[] children;

		public Group(Node[] children, Attribute... attributes) {
			super(attributes);
			this.children = children;
		}

		@Override
		public boolean isLeaf() {
			return false;
		}

		public int size() {
			return children.length;
		}

		public boolean isEmpty() {
			return children.length == 0;
		}

		public Node get(int i) {
			return children[i];
		}

		/**
		 * Get the first child of this group, provided it is a word.
		 *
		 * @return The leading word, or null if there is none.
		 */
		public Leaf head() {
			if (children.length > 0 && children[0] instanceof Leaf) {
				return (Leaf) children[0];
			}
			return null;
		}

		/**
		 * Check whether this group starts with a given (lower case) word.
		 *
		 * @param keyword
		 * @return
		 */
		public boolean startsWith(String keyword) {
			Leaf h = head();
			return h != null && h.is(keyword);
		}

		@Override
		public String toString() {
			StringBuilder r = new StringBuilder("(");
			for (int i = 0; i != children.length; ++i) {
				if (i != 0) {
					r.append(' ');
				}
				r.append(children[i]);
			}
			return r.append(')').toString();
		}
	}

	// ==============================================================
	// Declarations
	// ==============================================================

	/**
	 * A list of names sharing an (optional) type, such as
	 * <code>?x ?y - block</code> or <code>truck1 truck2 - truck</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class TypedList extends SyntacticElement.Impl {
		private final List<Leaf> names;
		private final Leaf type;

		public TypedList(List<Leaf> names, Leaf type, Attribute... attributes) {
			super(attributes);
			this.names = Collections.unmodifiableList(names);
			this.type = type;
		}

		public List<Leaf> names() {
			return names;
		}

		/**
		 * The declared type, or <code>null</code> when none was given.
		 *
		 * @return
		 */
		public Leaf type() {
			return type;
		}

		/**
		 * Check whether this list is untyped or is explicitly typed as
		 * <code>object</code>.
		 *
		 * @return
		 */
		public boolean isObjectTyped() {
			return type == null || type.is(Types.OBJECT);
		}

		@Override
		public String toString() {
			String r = "";
			for (Leaf n : names) {
				r += n + " ";
			}
			return type == null ? r.trim() : r + "- " + type;
		}
	}

	/**
	 * A predicate or function signature, such as <code>(on ?x ?y - block)</code>.
	 */
	public static class Signature extends SyntacticElement.Impl {
		private final Leaf name;
		private final List<TypedList> parameters;

		public Signature(Leaf name, List<TypedList> parameters, Attribute... attributes) {
			super(attributes);
			this.name = name;
			this.parameters = Collections.unmodifiableList(parameters);
		}

		public Leaf name() {
			return name;
		}

		public List<TypedList> parameters() {
			return parameters;
		}
	}

	/**
	 * Common structure of everything declared with a name and a parameter list.
	 */
	public static abstract class OperatorDecl extends Signature {
		public OperatorDecl(Leaf name, List<TypedList> parameters, Attribute... attributes) {
			super(name, parameters, attributes);
		}
	}

	/**
	 * An <code>:action</code> block. Any of the precondition, effect and
	 * observation may be absent (i.e. <code>null</code>).
	 */
	public static class ActionDecl extends OperatorDecl {
		private final Node precondition;
		private final Node effect;
		private final Node observe;

		public ActionDecl(Leaf name, List<TypedList> parameters, Node precondition, Node effect, Node observe,
				Attribute... attributes) {
			super(name, parameters, attributes);
			this.precondition = precondition;
			this.effect = effect;
			this.observe = observe;
		}

		public Node precondition() {
			return precondition;
		}

		public Node effect() {
			return effect;
		}

		public Node observe() {
			return observe;
		}
	}

	/**
	 * A <code>:durative-action</code> block.
	 */
	public static class DurativeActionDecl extends OperatorDecl {
		private final Node duration;
		private final Node condition;
		private final Node effect;

		public DurativeActionDecl(Leaf name, List<TypedList> parameters, Node duration, Node condition, Node effect,
				Attribute... attributes) {
			super(name, parameters, attributes);
			this.duration = duration;
			this.condition = condition;
			this.effect = effect;
		}

		public Node duration() {
			return duration;
		}

		public Node condition() {
			return condition;
		}

		public Node effect() {
			return effect;
		}
	}

	/**
	 * A <code>:task</code> block (hierarchical domains only).
	 */
	public static class TaskDecl extends OperatorDecl {
		public TaskDecl(Leaf name, List<TypedList> parameters, Attribute... attributes) {
			super(name, parameters, attributes);
		}
	}

	/**
	 * The parts shared between a method and the initial task network of a
	 * problem: subtasks (ordered or not), an ordering relation and constraints.
	 */
	public static class NetworkDecl extends SyntacticElement.Impl {
		private final List<TypedList> parameters;
		private final Node orderedSubtasks;
		private final Node subtasks;
		private final Node ordering;
		private final Node constraints;

		public NetworkDecl(List<TypedList> parameters, Node orderedSubtasks, Node subtasks, Node ordering,
				Node constraints, Attribute... attributes) {
			super(attributes);
			this.parameters = Collections.unmodifiableList(parameters);
			this.orderedSubtasks = orderedSubtasks;
			this.subtasks = subtasks;
			this.ordering = ordering;
			this.constraints = constraints;
		}

		public List<TypedList> parameters() {
			return parameters;
		}

		public Node orderedSubtasks() {
			return orderedSubtasks;
		}

		public Node subtasks() {
			return subtasks;
		}

		public Node ordering() {
			return ordering;
		}

		public Node constraints() {
			return constraints;
		}
	}

	/**
	 * A <code>:method</code> block, which achieves a given task through a
	 * network of subtasks.
	 */
	public static class MethodDecl extends OperatorDecl {
		private final Group task;
		private final Node precondition;
		private final NetworkDecl network;

		public MethodDecl(Leaf name, List<TypedList> parameters, Group task, Node precondition, NetworkDecl network,
				Attribute... attributes) {
			super(name, parameters, attributes);
			this.task = task;
			this.precondition = precondition;
			this.network = network;
		}

		public Group task() {
			return task;
		}

		public Node precondition() {
			return precondition;
		}

		public NetworkDecl network() {
			return network;
		}
	}

	/**
	 * A <code>:metric</code> section, such as
	 * <code>(:metric minimize (total-cost))</code>.
	 */
	public static class MetricDecl extends SyntacticElement.Impl {
		private final Leaf optimization;
		private final Node expression;

		public MetricDecl(Leaf optimization, Node expression, Attribute... attributes) {
			super(attributes);
			this.optimization = optimization;
			this.expression = expression;
		}

		public boolean isMinimize() {
			return optimization.is("minimize");
		}

		public Leaf optimization() {
			return optimization;
		}

		public Node expression() {
			return expression;
		}
	}

	// ==============================================================
	// Units
	// ==============================================================

	/**
	 * A complete <code>(define (domain ...) ...)</code> form.
	 */
	public static class Domain extends SyntacticElement.Impl {
		private final Leaf name;
		private final List<Leaf> requirements;
		private final List<TypedList> types;
		private final List<TypedList> constants;
		private final List<Signature> predicates;
		private final List<Signature> functions;
		private final List<TaskDecl> tasks;
		private final List<MethodDecl> methods;
		private final List<OperatorDecl> actions;

		public Domain(Leaf name, List<Leaf> requirements, List<TypedList> types, List<TypedList> constants,
				List<Signature> predicates, List<Signature> functions, List<TaskDecl> tasks, List<MethodDecl> methods,
				List<OperatorDecl> actions, Attribute... attributes) {
			super(attributes);
			this.name = name;
			this.requirements = Collections.unmodifiableList(requirements);
			this.types = Collections.unmodifiableList(types);
			this.constants = Collections.unmodifiableList(constants);
			this.predicates = Collections.unmodifiableList(predicates);
			this.functions = Collections.unmodifiableList(functions);
			this.tasks = Collections.unmodifiableList(tasks);
			this.methods = Collections.unmodifiableList(methods);
			this.actions = Collections.unmodifiableList(actions);
		}

		public Leaf name() {
			return name;
		}

		public List<Leaf> requirements() {
			return requirements;
		}

		/**
		 * Check whether a given requirement flag (e.g. <code>:hierarchy</code>)
		 * was declared.
		 *
		 * @param flag
		 * @return
		 */
		public boolean requires(String flag) {
			for (Leaf r : requirements) {
				if (r.is(flag)) {
					return true;
				}
			}
			return false;
		}

		public List<TypedList> types() {
			return types;
		}

		public List<TypedList> constants() {
			return constants;
		}

		public List<Signature> predicates() {
			return predicates;
		}

		public List<Signature> functions() {
			return functions;
		}

		public List<TaskDecl> tasks() {
			return tasks;
		}

		public List<MethodDecl> methods() {
			return methods;
		}

		/**
		 * Get the actions and durative actions in declaration order.
		 *
		 * @return
		 */
		public List<OperatorDecl> actions() {
			return actions;
		}
	}

	/**
	 * A complete <code>(define (problem ...) ...)</code> form.
	 */
	public static class Problem extends SyntacticElement.Impl {
		private final Leaf name;
		private final Leaf domain;
		private final List<Leaf> requirements;
		private final List<TypedList> objects;
		private final NetworkDecl network;
		private final List<Node> init;
		private final Node goal;
		private final Node constraints;
		private final MetricDecl metric;

		public Problem(Leaf name, Leaf domain, List<Leaf> requirements, List<TypedList> objects, NetworkDecl network,
				List<Node> init, Node goal, Node constraints, MetricDecl metric, Attribute... attributes) {
			super(attributes);
			this.name = name;
			this.domain = domain;
			this.requirements = Collections.unmodifiableList(requirements);
			this.objects = Collections.unmodifiableList(objects);
			this.network = network;
			this.init = Collections.unmodifiableList(init);
			this.goal = goal;
			this.constraints = constraints;
			this.metric = metric;
		}

		public Leaf name() {
			return name;
		}

		public Leaf domain() {
			return domain;
		}

		public List<Leaf> requirements() {
			return requirements;
		}

		public List<TypedList> objects() {
			return objects;
		}

		/**
		 * The initial task network, or <code>null</code> if there is no
		 * <code>:htn</code> section.
		 *
		 * @return
		 */
		public NetworkDecl network() {
			return network;
		}

		public List<Node> init() {
			return init;
		}

		public Node goal() {
			return goal;
		}

		public Node constraints() {
			return constraints;
		}

		public MetricDecl metric() {
			return metric;
		}
	}
}
