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
 * This exception is thrown when a PDDL domain or problem is syntactically fine
 * but cannot be used in the way requested. For example, a domain containing
 * universally quantified effects cannot be turned into a model without an
 * accompanying problem, since the quantified objects are not yet known.
 *
 * @author David J. Pearce
 *
 */
public class UsageError extends RuntimeException {

	public UsageError(String msg) {
		super(msg);
	}

	public static final long serialVersionUID = 1l;
}
