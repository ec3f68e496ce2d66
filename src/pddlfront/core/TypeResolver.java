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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.TypedList;
import pddlfront.util.SyntaxError;

/**
 * Responsible for resolving the <code>:types</code> section of a domain into a
 * table of user types. Types may be declared in any order, since a type whose
 * father is not yet resolved simply resolves its father first. For example:
 *
 * <pre>
 * (:types truck - vehicle vehicle - object)
 * </pre>
 *
 * Here, <code>vehicle</code> is resolved before <code>truck</code> even though
 * it is declared after. The <code>object</code> type is only introduced when
 * something in the domain needs it, otherwise a father of <code>object</code>
 * is dropped.
 *
 * @author David J. Pearce
 *
 */
public class TypeResolver {
	public final static String DUPLICATE_TYPE = "Type declared more than once";
	public final static String CYCLIC_TYPE = "Type cannot be its own ancestor";
	public final static String UNDEFINED_TYPE = "Undefined type";

	private final Types.Manager types;
	private final String source;

	public TypeResolver(Types.Manager types, String source) {
		this.types = types;
		this.source = source;
	}

	/**
	 * Resolve a list of type declarations.
	 *
	 * @param declarations
	 *            The typed lists of a <code>:types</code> section.
	 * @param objectTypeNeeded
	 *            Whether or not an explicit <code>object</code> type is required.
	 * @return
	 */
	public Table resolve(List<TypedList> declarations, boolean objectTypeNeeded) {
		LinkedHashMap<String, Leaf> declared = new LinkedHashMap<>();
		HashMap<String, Leaf> fathers = new HashMap<>();
		for (TypedList tl : declarations) {
			for (Leaf name : tl.names()) {
				if (declared.containsKey(name.key())) {
					SyntaxError.syntaxError(SyntaxError.Kind.DECLARATION, DUPLICATE_TYPE + ": " + name, source, name);
				}
				declared.put(name.key(), name);
				fathers.put(name.key(), tl.type());
			}
		}
		LinkedHashMap<String, Types.User> resolved = new LinkedHashMap<>();
		for (String key : declared.keySet()) {
			resolve(key, declared, fathers, resolved, objectTypeNeeded);
		}
		if (objectTypeNeeded && !resolved.containsKey(Types.OBJECT)) {
			resolved.put(Types.OBJECT, types.user(Types.OBJECT, null));
		}
		return new Table(resolved);
	}

	/**
	 * Resolve a single type, by walking up the chain of its unresolved fathers
	 * and then resolving that chain from the top down.
	 */
	private void resolve(String key, Map<String, Leaf> declared, Map<String, Leaf> fathers,
			Map<String, Types.User> resolved, boolean objectTypeNeeded) {
		ArrayList<String> chain = new ArrayList<>();
		HashSet<String> visited = new HashSet<>();
		String current = key;
		while (current != null && !resolved.containsKey(current)) {
			if (!visited.add(current)) {
				SyntaxError.syntaxError(SyntaxError.Kind.DECLARATION, CYCLIC_TYPE + ": " + declared.get(current),
						source, declared.get(current));
			}
			chain.add(current);
			Leaf father = fathers.get(current);
			String next = father(current, father, objectTypeNeeded, declared.containsKey(Types.OBJECT));
			if (next != null && !declared.containsKey(next) && !resolved.containsKey(next)) {
				// an undeclared father becomes a root type
				resolved.put(next, types.user(next.equals(Types.OBJECT) ? Types.OBJECT : father.text(), null));
			}
			current = next;
		}
		for (int i = chain.size() - 1; i >= 0; --i) {
			String k = chain.get(i);
			String f = father(k, fathers.get(k), objectTypeNeeded, declared.containsKey(Types.OBJECT));
			Types.User parent = f == null ? null : resolved.get(f);
			try {
				resolved.put(k, types.user(declared.get(k).text(), parent));
			} catch (IllegalArgumentException e) {
				SyntaxError.syntaxError(SyntaxError.Kind.DECLARATION, CYCLIC_TYPE + ": " + declared.get(k), source,
						declared.get(k), e);
			}
		}
	}

	/**
	 * Determine the key of the father of a declared type, or <code>null</code>
	 * if it is a root. A father of <code>object</code> is only dropped when
	 * <code>object</code> is neither declared nor needed.
	 */
	private static String father(String key, Leaf father, boolean objectTypeNeeded, boolean objectDeclared) {
		if (key.equals(Types.OBJECT)) {
			return null;
		} else if (father == null) {
			return objectTypeNeeded ? Types.OBJECT : null;
		} else if (father.is(Types.OBJECT)) {
			return objectTypeNeeded || objectDeclared ? Types.OBJECT : null;
		}
		return father.key();
	}

	/**
	 * Determine whether a domain requires an explicit <code>object</code> type.
	 * This is the case when any parameter or constant is untyped or typed as
	 * <code>object</code>.
	 *
	 * @param domain
	 * @return
	 */
	public static boolean isObjectTypeNeeded(Syntax.Domain domain) {
		ArrayList<List<TypedList>> lists = new ArrayList<>();
		lists.add(domain.constants());
		for (Syntax.Signature s : domain.predicates()) {
			lists.add(s.parameters());
		}
		for (Syntax.Signature s : domain.functions()) {
			lists.add(s.parameters());
		}
		for (Syntax.Signature s : domain.tasks()) {
			lists.add(s.parameters());
		}
		for (Syntax.Signature s : domain.methods()) {
			lists.add(s.parameters());
		}
		for (Syntax.Signature s : domain.actions()) {
			lists.add(s.parameters());
		}
		for (List<TypedList> l : lists) {
			for (TypedList tl : l) {
				if (tl.isObjectTyped()) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * A case-insensitive mapping from type names to resolved types.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Table {
		private final Map<String, Types.User> types;

		private Table(Map<String, Types.User> types) {
			this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
		}

		/**
		 * Get the type with a given name, or <code>null</code> if there is none.
		 *
		 * @param name
		 * @return
		 */
		public Types.User get(String name) {
			return types.get(Syntax.canonical(name));
		}

		/**
		 * Resolve the type of the names in a typed list, where an untyped list has
		 * the <code>object</code> type.
		 *
		 * @param tl
		 * @param source
		 *            Text of the document holding the list (for error reporting).
		 * @return
		 */
		public Types.User resolve(TypedList tl, String source) {
			if (tl.type() == null) {
				Types.User t = types.get(Types.OBJECT);
				if (t == null) {
					SyntaxError.syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_TYPE + ": " + Types.OBJECT, source,
							tl);
				}
				return t;
			}
			Types.User t = get(tl.type().text());
			if (t == null) {
				SyntaxError.syntaxError(SyntaxError.Kind.RESOLUTION, UNDEFINED_TYPE + ": " + tl.type(), source,
						tl.type());
			}
			return t;
		}

		/**
		 * Get all types in the order they were resolved.
		 *
		 * @return
		 */
		public Collection<Types.User> types() {
			return types.values();
		}
	}
}
