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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;

import pddlfront.core.Syntax;
import pddlfront.core.Syntax.Group;
import pddlfront.core.Syntax.Leaf;
import pddlfront.core.Syntax.Node;
import pddlfront.core.Syntax.TypedList;
import pddlfront.io.Lexer;
import pddlfront.io.Parser;
import pddlfront.util.SyntaxError;

/**
 * Tests for the lexer, the nested expression reader and the grammar of
 * domains and problems.
 *
 * @author David J. Pearce
 *
 */
public class SyntaxTests {

	// ==============================================================
	// Lexer
	// ==============================================================

	@Test
	public void test_01() throws IOException {
		List<Lexer.Token> tokens = scan("(define (domain d))");
		assertEquals(7, tokens.size());
		assertTrue(tokens.get(0) instanceof Lexer.LeftBrace);
		assertEquals("define", tokens.get(1).text);
		assertTrue(tokens.get(6) instanceof Lexer.RightBrace);
	}

	@Test
	public void test_02() throws IOException {
		// comments run to the end of the line
		List<Lexer.Token> tokens = scan("; header\n(a ; (b c\n d)");
		assertEquals(4, tokens.size());
		assertEquals("a", tokens.get(1).text);
		assertEquals("d", tokens.get(2).text);
	}

	@Test
	public void test_03() throws IOException {
		List<Lexer.Token> tokens = scan(":action ?x 1.5 >=");
		assertTrue(tokens.get(0) instanceof Lexer.Keyword);
		assertTrue(tokens.get(1) instanceof Lexer.Variable);
		assertTrue(tokens.get(2) instanceof Lexer.Word);
		assertEquals(">=", tokens.get(3).text);
		assertEquals(15, tokens.get(3).start);
		assertEquals(16, tokens.get(3).end());
	}

	// ==============================================================
	// Reader
	// ==============================================================

	@Test
	public void test_04() throws IOException {
		Group g = read("(on ?x (f ?y))");
		assertEquals(3, g.size());
		assertTrue(g.startsWith("on"));
		assertTrue(g.get(1).isLeaf());
		assertEquals("(f ?y)", g.get(2).toString());
		assertEquals(0, g.source().start);
		assertEquals(13, g.source().end);
		assertEquals(7, g.get(2).source().start);
	}

	@Test
	public void test_05() throws IOException {
		// nesting is limited only by memory
		int depth = 20000;
		StringBuilder input = new StringBuilder();
		for (int i = 0; i != depth; ++i) {
			input.append("(a ");
		}
		for (int i = 0; i != depth; ++i) {
			input.append(")");
		}
		Node n = read(input.toString());
		int count = 0;
		while (n instanceof Group && ((Group) n).size() > 1) {
			n = ((Group) n).get(1);
			count++;
		}
		assertEquals(depth - 1, count);
	}

	@Test
	public void test_06() throws IOException {
		checkInvalid(") (a b)", Parser.UNBALANCED_BRACKET);
		checkInvalid("(a b))", Parser.TRAILING_INPUT);
	}

	@Test
	public void test_07() throws IOException {
		checkInvalid("(a (b c)", Parser.MISSING_BRACKET);
	}

	@Test
	public void test_08() throws IOException {
		checkInvalid("(a) (b)", Parser.TRAILING_INPUT);
	}

	@Test
	public void test_09() throws IOException {
		checkInvalid("; nothing here", Parser.EMPTY_INPUT);
	}

	@Test
	public void test_10() throws IOException {
		checkInvalid("a (b)", Parser.EXPECTED_OPEN);
	}

	// ==============================================================
	// Typed lists
	// ==============================================================

	@Test
	public void test_11() throws IOException {
		String input = "(a b - t c)";
		List<TypedList> lists = Parser.parseTypedList(input, read(input), 0, false);
		assertEquals(2, lists.size());
		assertEquals(2, lists.get(0).names().size());
		assertEquals("t", lists.get(0).type().text());
		assertNull(lists.get(1).type());
		assertTrue(lists.get(1).isObjectTyped());
	}

	@Test
	public void test_12() throws IOException {
		String input = "(?x - )";
		try {
			Parser.parseTypedList(input, read(input), 0, true);
			fail("typed list should be invalid");
		} catch (SyntaxError e) {
			assertEquals(Parser.INVALID_TYPED_LIST, e.msg());
		}
	}

	@Test
	public void test_13() throws IOException {
		String input = "(?x y - t)";
		try {
			Parser.parseTypedList(input, read(input), 0, true);
			fail("expected variables only");
		} catch (SyntaxError e) {
			assertTrue(e.msg().startsWith(Parser.INVALID_VARIABLE));
		}
	}

	// ==============================================================
	// Domains
	// ==============================================================

	@Test
	public void test_14() throws IOException {
		String input = "(define (domain Blocks)\n" //
				+ " (:requirements :strips :typing)\n" //
				+ " (:types block)\n" //
				+ " (:predicates (on ?x ?y - block) (clear ?x - block))\n" //
				+ " (:functions (weight ?b - block) - number (total-cost))\n" //
				+ " (:action pick :parameters (?b - block) :precondition (clear ?b) :effect (not (clear ?b))))";
		Syntax.Domain d = parseDomain(input);
		assertEquals("Blocks", d.name().text());
		assertTrue(d.requires(":typing"));
		assertEquals(2, d.predicates().size());
		assertEquals(2, d.functions().size());
		assertEquals(1, d.actions().size());
		Syntax.ActionDecl a = (Syntax.ActionDecl) d.actions().get(0);
		assertEquals("pick", a.name().text());
		assertNotNull(a.precondition());
		assertNull(a.observe());
	}

	@Test
	public void test_15() throws IOException {
		// keywords are case-insensitive
		String input = "(DEFINE (DOMAIN d) (:PREDICATES (p)) (:ACTION a :PARAMETERS () :EFFECT (p)))";
		Syntax.Domain d = parseDomain(input);
		assertEquals(1, d.actions().size());
	}

	@Test
	public void test_16() throws IOException {
		checkInvalidDomain("(define (domain d) (:predicates (p)) (:types t))", Parser.SECTION_OUT_OF_ORDER);
	}

	@Test
	public void test_17() throws IOException {
		checkInvalidDomain("(define (domain d) (:requirements :teleportation))", Parser.UNKNOWN_REQUIREMENT);
	}

	@Test
	public void test_18() throws IOException {
		checkInvalidDomain("(define (domain d) (:types a) (:types b))", Parser.DUPLICATE_SECTION);
	}

	@Test
	public void test_19() throws IOException {
		checkInvalidDomain("(define (domain d) (:action a :parameters () :duration (= ?duration 1)))",
				Parser.UNKNOWN_PROPERTY);
	}

	@Test
	public void test_20() throws IOException {
		checkInvalidDomain("(define (domain d) (:durative-action a :parameters () :condition (and) :effect (and)))",
				Parser.MISSING_PROPERTY);
	}

	@Test
	public void test_21() throws IOException {
		checkInvalidDomain("(define (domain d) (:action a :effect (and)))", Parser.MISSING_PROPERTY);
	}

	@Test
	public void test_22() throws IOException {
		checkInvalidDomain("(define (domain d) (:functions (f) - object))", Parser.INVALID_FUNCTION_TYPE);
	}

	@Test
	public void test_23() throws IOException {
		// tasks and actions may be interleaved only in the order task, method, action
		String input = "(define (domain d) (:requirements :hierarchy) (:task t :parameters ())\n"
				+ " (:method m :parameters () :task (t) :ordered-tasks (and (a)) :tasks (and))\n"
				+ " (:action a :parameters ()) (:action b :parameters ()))";
		Syntax.Domain d = parseDomain(input);
		assertEquals(1, d.tasks().size());
		assertEquals(1, d.methods().size());
		assertEquals(2, d.actions().size());
		Syntax.NetworkDecl n = d.methods().get(0).network();
		assertNotNull(n.orderedSubtasks());
		assertNotNull(n.subtasks());
		assertNull(n.ordering());
		checkInvalidDomain("(define (domain d) (:action a :parameters ()) (:task t :parameters ()))",
				Parser.SECTION_OUT_OF_ORDER);
	}

	// ==============================================================
	// Problems
	// ==============================================================

	@Test
	public void test_24() throws IOException {
		String input = "(define (problem p1) (:domain d)\n" //
				+ " (:objects a b - block c)\n" //
				+ " (:init (clear a) (= (fuel) 3))\n" //
				+ " (:goal (clear b))\n" //
				+ " (:metric minimize (total-cost)))";
		Syntax.Problem p = parseProblem(input);
		assertEquals("p1", p.name().text());
		assertEquals("d", p.domain().text());
		assertEquals(2, p.objects().size());
		assertEquals(2, p.init().size());
		assertNotNull(p.goal());
		assertTrue(p.metric().isMinimize());
		assertNull(p.network());
	}

	@Test
	public void test_25() throws IOException {
		checkInvalidProblem("(define (problem p) (:domain d) (:goal (p)))", Parser.MISSING_SECTION);
	}

	@Test
	public void test_26() throws IOException {
		checkInvalidProblem("(define (problem p) (:init))", Parser.MISSING_SECTION);
		checkInvalidProblem("(define (problem p) (:init) (:domain d))", Parser.SECTION_OUT_OF_ORDER);
	}

	@Test
	public void test_27() throws IOException {
		checkInvalidProblem("(define (problem p) (:domain d) (:init) (:metric reduce (cost)))", "expecting");
	}

	@Test
	public void test_28() throws IOException {
		String input = "(define (problem p) (:domain d) (:htn :parameters (?x) :ordered-subtasks (and (t ?x))) (:init))";
		Syntax.Problem p = parseProblem(input);
		assertNotNull(p.network());
		assertEquals(1, p.network().parameters().size());
		assertNotNull(p.network().orderedSubtasks());
		assertNull(p.goal());
	}

	@Test
	public void test_29() throws IOException {
		// spans of leaves cover exactly their text
		String input = "(define (problem p)\n  (:domain dom) (:init))";
		Syntax.Problem p = parseProblem(input);
		Leaf d = p.domain();
		assertEquals(input.indexOf("dom"), d.source().start);
		assertEquals(input.indexOf("dom") + 2, d.source().end);
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static List<Lexer.Token> scan(String input) throws IOException {
		return new Lexer(new StringReader(input)).scan();
	}

	private static Group read(String input) throws IOException {
		return new Parser(input, scan(input)).read();
	}

	private static Syntax.Domain parseDomain(String input) throws IOException {
		try {
			return new Parser(input, scan(input)).parseDomain();
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail(e.getMessage());
			return null;
		}
	}

	private static Syntax.Problem parseProblem(String input) throws IOException {
		try {
			return new Parser(input, scan(input)).parseProblem();
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail(e.getMessage());
			return null;
		}
	}

	private static void checkInvalid(String input, String message) throws IOException {
		try {
			read(input);
			fail("input should not have been read");
		} catch (SyntaxError e) {
			check(e, message);
		}
	}

	private static void checkInvalidDomain(String input, String message) throws IOException {
		try {
			new Parser(input, scan(input)).parseDomain();
			fail("domain should not have parsed");
		} catch (SyntaxError e) {
			check(e, message);
		}
	}

	private static void checkInvalidProblem(String input, String message) throws IOException {
		try {
			new Parser(input, scan(input)).parseProblem();
			fail("problem should not have parsed");
		} catch (SyntaxError e) {
			check(e, message);
		}
	}

	private static void check(SyntaxError e, String message) {
		e.outputSourceError(System.out);
		assertEquals(SyntaxError.Kind.STRUCTURAL, e.kind());
		assertTrue(e.msg().startsWith(message), "unexpected message: " + e.msg());
	}
}
