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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import pddlfront.util.Pair;
import pddlfront.util.Rational;

/**
 * The types of a planning model. A type is either boolean, a (possibly
 * bounded) integer or real, or a user type. User types form a forest through
 * their (optional) father.
 *
 * @author David J. Pearce
 *
 */
public class Types {
	/**
	 * Name of the implicit root of all user types.
	 */
	public static final String OBJECT = "object";

	public interface Type {
		public default boolean isBool() {
			return false;
		}

		public default boolean isNumeric() {
			return false;
		}

		public default boolean isUser() {
			return false;
		}
	}

	public static final class Bool implements Type {
		private Bool() {
		}

		@Override
		public boolean isBool() {
			return true;
		}

		@Override
		public String toString() {
			return "bool";
		}
	}

	/**
	 * An integer type with optional lower and upper bounds (either of which may
	 * be <code>null</code>).
	 */
	public static final class Int implements Type {
		private final BigInteger lower;
		private final BigInteger upper;

		private Int(BigInteger lower, BigInteger upper) {
			this.lower = lower;
			this.upper = upper;
		}

		public BigInteger lower() {
			return lower;
		}

		public BigInteger upper() {
			return upper;
		}

		@Override
		public boolean isNumeric() {
			return true;
		}

		@Override
		public String toString() {
			return bounds("integer", lower, upper);
		}
	}

	/**
	 * A real type with optional lower and upper bounds.
	 */
	public static final class Real implements Type {
		private final Rational lower;
		private final Rational upper;

		private Real(Rational lower, Rational upper) {
			this.lower = lower;
			this.upper = upper;
		}

		public Rational lower() {
			return lower;
		}

		public Rational upper() {
			return upper;
		}

		@Override
		public boolean isNumeric() {
			return true;
		}

		@Override
		public String toString() {
			return bounds("real", lower, upper);
		}
	}

	/**
	 * A user type, such as <code>truck</code>, with an optional father.
	 */
	public static final class User implements Type {
		private final String name;
		private final User father;

		private User(String name, User father) {
			this.name = name;
			this.father = father;
		}

		public String name() {
			return name;
		}

		/**
		 * The father of this type, or <code>null</code> if it is a root.
		 *
		 * @return
		 */
		public User father() {
			return father;
		}

		@Override
		public boolean isUser() {
			return true;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private static String bounds(String name, Object lower, Object upper) {
		if (lower == null && upper == null) {
			return name;
		}
		return name + "[" + (lower == null ? "-inf" : lower) + ", " + (upper == null ? "inf" : upper) + "]";
	}

	/**
	 * Check whether a value of type <code>source</code> can be used where one
	 * of type <code>target</code> is expected. Integers may be used as reals,
	 * and a user type may be used wherever one of its ancestors is expected.
	 * Bounds are not checked.
	 *
	 * @param target
	 * @param source
	 * @return
	 */
	public static boolean isCompatible(Type target, Type source) {
		if (target == source) {
			return true;
		} else if (target instanceof Real) {
			return source.isNumeric();
		} else if (target instanceof Int) {
			return source instanceof Int;
		} else if (target instanceof User && source instanceof User) {
			for (User t = (User) source; t != null; t = t.father) {
				if (t == target) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Responsible for interning types. Structurally identical types requested
	 * from the same manager are the same instance, hence types can be compared
	 * by reference. A manager is not synchronised and should be owned by a
	 * single parse.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Manager {
		private final Bool bool = new Bool();
		private final HashMap<Pair<BigInteger, BigInteger>, Int> ints = new HashMap<>();
		private final HashMap<Pair<Rational, Rational>, Real> reals = new HashMap<>();
		private final HashMap<Pair<String, User>, User> users = new HashMap<>();

		public Bool bool() {
			return bool;
		}

		public Int integer() {
			return integer(null, null);
		}

		public Int integer(BigInteger lower, BigInteger upper) {
			return ints.computeIfAbsent(new Pair<>(lower, upper), p -> new Int(lower, upper));
		}

		public Real real() {
			return real(null, null);
		}

		public Real real(Rational lower, Rational upper) {
			return reals.computeIfAbsent(new Pair<>(lower, upper), p -> new Real(lower, upper));
		}

		/**
		 * Get the user type with the given name and father. Names are compared
		 * case-insensitively.
		 *
		 * @param name
		 * @param father
		 *            The father, or <code>null</code> for a root type.
		 * @return
		 * @throws IllegalArgumentException
		 *             if an ancestor of the type has the same name.
		 */
		public User user(String name, User father) {
			String key = Syntax.canonical(name);
			for (User t = father; t != null; t = t.father) {
				if (Syntax.canonical(t.name).equals(key)) {
					throw new IllegalArgumentException("type " + name + " cannot be its own ancestor");
				}
			}
			return users.computeIfAbsent(new Pair<>(key, father), p -> new User(name, father));
		}

		/**
		 * Get the ancestors of a user type, starting with the type itself and
		 * finishing at its root.
		 *
		 * @param type
		 * @return
		 */
		public List<User> ancestors(User type) {
			ArrayList<User> result = new ArrayList<>();
			for (User t = type; t != null; t = t.father) {
				result.add(t);
			}
			return result;
		}
	}
}
