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
package pddlfront.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import pddlfront.core.Syntax;
import pddlfront.core.TypeResolver;
import pddlfront.core.Types;
import pddlfront.io.Lexer;
import pddlfront.io.Parser;
import pddlfront.util.SyntaxError;

public class TypeTests {

	// ==============================================================
	// Interning
	// ==============================================================

	@Test
	public void test_01() {
		Types.Manager tm = new Types.Manager();
		assertSame(tm.bool(), tm.bool());
		assertSame(tm.integer(), tm.integer());
		assertSame(tm.real(), tm.real());
		Types.Int bounded = tm.integer(BigInteger.ZERO, BigInteger.TEN);
		assertSame(bounded, tm.integer(BigInteger.ZERO, BigInteger.TEN));
		assertTrue(bounded != tm.integer());
	}

	@Test
	public void test_02() {
		Types.Manager tm = new Types.Manager();
		Types.User vehicle = tm.user("Vehicle", null);
		// names are case-insensitive, the first spelling is kept
		assertSame(vehicle, tm.user("vehicle", null));
		assertEquals("Vehicle", vehicle.name());
		Types.User truck = tm.user("truck", vehicle);
		assertSame(truck, tm.user("truck", vehicle));
		assertTrue(truck != tm.user("truck", null));
	}

	@Test
	public void test_03() {
		Types.Manager tm = new Types.Manager();
		Types.User a = tm.user("a", null);
		Types.User b = tm.user("b", a);
		Types.User c = tm.user("c", b);
		List<Types.User> ancestors = tm.ancestors(c);
		assertEquals(List.of(c, b, a), ancestors);
		assertEquals(List.of(a), tm.ancestors(a));
	}

	@Test
	public void test_04() {
		Types.Manager tm = new Types.Manager();
		Types.User a = tm.user("a", null);
		Types.User b = tm.user("b", a);
		assertThrows(IllegalArgumentException.class, () -> tm.user("A", b));
	}

	@Test
	public void test_05() {
		Types.Manager tm = new Types.Manager();
		Types.User vehicle = tm.user("vehicle", null);
		Types.User truck = tm.user("truck", vehicle);
		assertTrue(Types.isCompatible(vehicle, truck));
		assertFalse(Types.isCompatible(truck, vehicle));
		assertTrue(Types.isCompatible(tm.real(), tm.integer()));
		assertFalse(Types.isCompatible(tm.integer(), tm.real()));
		assertFalse(Types.isCompatible(tm.bool(), tm.integer()));
	}

	// ==============================================================
	// Resolution
	// ==============================================================

	@Test
	public void test_06() throws IOException {
		// fathers may be declared after their children
		TypeResolver.Table table = resolve("(:types truck - vehicle vehicle - object)", false);
		Types.User truck = table.get("truck");
		Types.User vehicle = table.get("VEHICLE");
		assertSame(vehicle, truck.father());
		assertNull(vehicle.father());
		assertNull(table.get(Types.OBJECT));
		assertEquals(2, table.types().size());
	}

	@Test
	public void test_07() throws IOException {
		TypeResolver.Table table = resolve("(:types truck - vehicle vehicle - object)", true);
		Types.User object = table.get(Types.OBJECT);
		assertNotNull(object);
		assertSame(object, table.get("vehicle").father());
		assertEquals(3, table.types().size());
	}

	@Test
	public void test_08() throws IOException {
		TypeResolver.Table table = resolve("(:types place)", true);
		assertSame(table.get(Types.OBJECT), table.get("place").father());
	}

	@Test
	public void test_09() throws IOException {
		// an undeclared father becomes a root
		TypeResolver.Table table = resolve("(:types car - machine)", false);
		Types.User machine = table.get("machine");
		assertNotNull(machine);
		assertNull(machine.father());
		assertSame(machine, table.get("car").father());
	}

	@Test
	public void test_10() throws IOException {
		checkInvalid("(:types truck - vehicle Truck)", TypeResolver.DUPLICATE_TYPE);
	}

	@Test
	public void test_11() throws IOException {
		checkInvalid("(:types a - b b - c c - a)", TypeResolver.CYCLIC_TYPE);
	}

	@Test
	public void test_12() throws IOException {
		checkInvalid("(:types a - a)", TypeResolver.CYCLIC_TYPE);
	}

	@Test
	public void test_13() throws IOException {
		String input = "(:objects x - nowhere)";
		TypeResolver.Table table = resolve("(:types place)", false);
		Syntax.TypedList tl = Parser.parseTypedList(input, read(input), 1, false).get(0);
		try {
			table.resolve(tl, input);
			fail("type should be undefined");
		} catch (SyntaxError e) {
			assertEquals(SyntaxError.Kind.RESOLUTION, e.kind());
			assertTrue(e.msg().startsWith(TypeResolver.UNDEFINED_TYPE));
		}
	}

	@Test
	public void test_14() throws IOException {
		String input = "(define (domain d) (:types block) (:predicates (on ?x ?y - block) (held ?x)))";
		assertTrue(TypeResolver.isObjectTypeNeeded(parseDomain(input)));
		input = "(define (domain d) (:types block) (:predicates (on ?x ?y - block)))";
		assertFalse(TypeResolver.isObjectTypeNeeded(parseDomain(input)));
		input = "(define (domain d) (:types block) (:constants a - object))";
		assertTrue(TypeResolver.isObjectTypeNeeded(parseDomain(input)));
	}

	@Test
	public void test_15() throws IOException {
		// a declared object keeps its children, even when nothing else needs it
		TypeResolver.Table table = resolve("(:types object vehicle - object truck - vehicle)", false);
		Types.User object = table.get(Types.OBJECT);
		assertNotNull(object);
		assertNull(object.father());
		assertSame(object, table.get("vehicle").father());
		assertSame(table.get("vehicle"), table.get("truck").father());
		assertTrue(Types.isCompatible(object, table.get("truck")));
	}

	@Test
	public void test_16() throws IOException {
		// an undeclared object father is dropped when not needed
		TypeResolver.Table table = resolve("(:types vehicle - object)", false);
		assertNull(table.get(Types.OBJECT));
		assertNull(table.get("vehicle").father());
	}

	@Test
	public void test_17() throws IOException {
		checkInvalid("(:types a - b a - b)", TypeResolver.DUPLICATE_TYPE);
	}

	@Test
	public void test_18() throws IOException {
		checkInvalid("(:types a a)", TypeResolver.DUPLICATE_TYPE);
	}

	@Test
	public void test_19() throws IOException {
		checkInvalid("(:types a b - c d A - c)", TypeResolver.DUPLICATE_TYPE);
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Syntax.Group read(String input) throws IOException {
		return new Parser(input, new Lexer(new StringReader(input)).scan()).read();
	}

	private static Syntax.Domain parseDomain(String input) throws IOException {
		return new Parser(input, new Lexer(new StringReader(input)).scan()).parseDomain();
	}

	private static TypeResolver.Table resolve(String input, boolean objectTypeNeeded) throws IOException {
		List<Syntax.TypedList> declarations = Parser.parseTypedList(input, read(input), 1, false);
		try {
			return new TypeResolver(new Types.Manager(), input).resolve(declarations, objectTypeNeeded);
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail(e.getMessage());
			return null;
		}
	}

	private static void checkInvalid(String input, String message) throws IOException {
		List<Syntax.TypedList> declarations = Parser.parseTypedList(input, read(input), 1, false);
		try {
			new TypeResolver(new Types.Manager(), input).resolve(declarations, false);
			fail("types should not have resolved");
		} catch (SyntaxError e) {
			e.outputSourceError(System.out);
			assertEquals(SyntaxError.Kind.DECLARATION, e.kind());
			assertTrue(e.msg().startsWith(message), "unexpected message: " + e.msg());
		}
	}
}
