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

package pddlfront.util;

/**
 * A Syntactic Element represents any part of a PDDL document which is relevant
 * to its syntactic structure, and in particular parts we may need to report
 * errors against after the fact (e.g. the span of an undeclared fluent).
 *
 * @author David Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type. This is useful short-hand.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	/**
	 * Get the source span of this element, or <code>null</code> if it was not
	 * produced from source text.
	 *
	 * @return
	 */
	public default Attribute.Source source() {
		return attribute(Attribute.Source.class);
	}

	public class Impl implements SyntacticElement {

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 *
	 * @author djp
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies a span of source text by the offsets of its first and last
		 * characters (both inclusive).
		 */
		public static class Source implements Attribute {

			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			/**
			 * Construct the smallest span covering both this and another span.
			 *
			 * @param other
			 * @return
			 */
			public Source union(Source other) {
				if (other == null) {
					return this;
				}
				return new Source(Math.min(start, other.start), Math.max(end, other.end));
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Source) {
					Source s = (Source) o;
					return start == s.start && end == s.end;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return start ^ (end << 16);
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}
