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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import pddlfront.core.EffectAssembler;
import pddlfront.core.Expr;
import pddlfront.core.ExpressionCompiler;
import pddlfront.core.ExpressionManager;
import pddlfront.core.Model;
import pddlfront.core.ModelBuilder;
import pddlfront.core.TypeResolver;
import pddlfront.core.Types;
import pddlfront.extensions.Contingent;
import pddlfront.io.PddlReader;
import pddlfront.util.Rational;
import pddlfront.util.SyntaxError;
import pddlfront.util.UsageError;

/**
 * Tests for building planning models from domains and problems, covering
 * fluents, actions, effects, durative actions and the initial state.
 *
 * @author David J. Pearce
 *
 */
public class DomainTests {

	// ==============================================================
	// Domains
	// ==============================================================

	private static final String SIMPLE = "(define (domain simple)\n" //
			+ " (:requirements :strips)\n" //
			+ " (:predicates (done))\n" //
			+ " (:action finish :parameters () :precondition (and) :effect (done)))";

	@Test
	public void test_01() {
		Model.Problem p = check(SIMPLE);
		assertEquals("simple", p.name());
		assertEquals(1, p.fluents().size());
		Model.Fluent done = p.fluent("done");
		assertTrue(done.type().isBool());
		assertTrue(p.defaultValue(done).isFalse());
		assertEquals(1, p.actions().size());
		Model.InstantaneousAction a = (Model.InstantaneousAction) p.action("finish");
		assertTrue(a.preconditions().isEmpty());
		assertEquals(1, a.effects().size());
		Model.Effect e = a.effects().get(0);
		assertEquals(Model.Effect.Kind.ASSIGN, e.kind());
		assertSame(done, e.fluent().fluent());
		assertTrue(e.value().isTrue());
		assertFalse(e.isConditional());
		assertTrue(p.userTypes().isEmpty());
	}

	@Test
	public void test_02() {
		String domain = "(define (domain d) (:requirements :typing :numeric-fluents)\n" //
				+ " (:types place)\n" //
				+ " (:predicates (at ?x - place))\n" //
				+ " (:functions (fuel) (distance ?x ?y - place) - number))";
		Model.Problem p = check(domain);
		Model.Fluent distance = p.fluent("distance");
		assertTrue(distance.type() instanceof Types.Real);
		assertEquals(2, distance.arity());
		assertNull(p.defaultValue(distance));
		assertEquals(1, p.userTypes().size());
	}

	@Test
	public void test_03() {
		// untyped parameters introduce the object type
		String domain = "(define (domain d) (:predicates (at ?x ?y)) (:action go :parameters (?a ?b) :effect (at ?a ?b)))";
		Model.Problem p = check(domain);
		Types.User object = p.userType(Types.OBJECT);
		assertSame(object, p.action("go").parameters().get(0).type());
	}

	@Test
	public void test_04() {
		checkInvalid("(define (domain d) (:predicates (p) (P)))", SyntaxError.Kind.DECLARATION,
				ModelBuilder.DUPLICATE_DECLARATION);
	}

	@Test
	public void test_05() {
		checkInvalid("(define (domain d) (:types place) (:functions (dist ?a - place ?a - place)))",
				SyntaxError.Kind.DECLARATION, ModelBuilder.DUPLICATE_PARAMETER);
	}

	@Test
	public void test_06() {
		checkInvalid("(define (domain d) (:predicates (p ?x)) (:action a :parameters (?x ?X) :effect (p ?x)))",
				SyntaxError.Kind.DECLARATION, ModelBuilder.DUPLICATE_PARAMETER);
	}

	@Test
	public void test_07() {
		checkInvalid(
				"(define (domain d) (:predicates (p)) (:action a :parameters ()) (:action A :parameters ()))",
				SyntaxError.Kind.DECLARATION, ModelBuilder.DUPLICATE_DECLARATION);
	}

	@Test
	public void test_08() {
		checkInvalid("(define (domain d) (:types place) (:predicates (at ?x - location)))",
				SyntaxError.Kind.RESOLUTION, TypeResolver.UNDEFINED_TYPE);
	}

	@Test
	public void test_09() {
		checkInvalid("(define (domain d) (:predicates (p)) (:action a :parameters () :observe (p)))",
				SyntaxError.Kind.STRUCTURAL, ModelBuilder.REQUIRES_SENSING);
	}

	@Test
	public void test_10() {
		checkInvalid("(define (domain d) (:predicates (p)) (:action a :parameters () :precondition (q)))",
				SyntaxError.Kind.RESOLUTION, ExpressionCompiler.UNDEFINED_NAME);
	}

	@Test
	public void test_11() {
		checkInvalid("(define (domain d) (:predicates (p)) (:action a :parameters () :precondition (+ 1 2)))",
				SyntaxError.Kind.RESOLUTION, "precondition");
	}

	// ==============================================================
	// Effects
	// ==============================================================

	private static final String EFFECTS = "(define (domain effects)\n" //
			+ " (:requirements :strips :typing :conditional-effects :numeric-fluents)\n" //
			+ " (:types block)\n" //
			+ " (:constants a b - block)\n" //
			+ " (:predicates (clear ?x - block) (done))\n" //
			+ " (:functions (fuel))\n" //
			+ " (:action skip :parameters () :effect (when (= a b) (done)))\n" //
			+ " (:action keep :parameters () :effect (when (= a a) (done)))\n" //
			+ " (:action nested :parameters () :effect (when (clear a) (when (clear b) (and (done) (not (clear a))))))\n" //
			+ " (:action refuel :parameters () :effect (and (increase (fuel) 2) (decrease (fuel) 1) (assign (fuel) 5.5))))";

	@Test
	public void test_12() {
		// an effect whose condition is false never happens
		Model.Problem p = check(EFFECTS);
		assertTrue(p.action("skip").effects().isEmpty());
	}

	@Test
	public void test_13() {
		// an effect whose condition is true always happens
		Model.Problem p = check(EFFECTS);
		List<Model.Effect> effects = p.action("keep").effects();
		assertEquals(1, effects.size());
		assertFalse(effects.get(0).isConditional());
	}

	@Test
	public void test_14() {
		// nested conditions are conjoined
		Model.Problem p = check(EFFECTS);
		List<Model.Effect> effects = p.action("nested").effects();
		assertEquals(2, effects.size());
		for (Model.Effect e : effects) {
			assertEquals(Expr.Kind.AND, e.condition().kind());
			assertEquals(2, e.condition().children().size());
		}
		assertTrue(effects.get(0).value().isTrue());
		assertTrue(effects.get(1).value().isFalse());
	}

	@Test
	public void test_15() {
		Model.Problem p = check(EFFECTS);
		List<Model.Effect> effects = p.action("refuel").effects();
		assertEquals(3, effects.size());
		assertEquals(Model.Effect.Kind.INCREASE, effects.get(0).kind());
		assertEquals(Model.Effect.Kind.DECREASE, effects.get(1).kind());
		assertEquals(Model.Effect.Kind.ASSIGN, effects.get(2).kind());
		assertEquals(Expr.Kind.REAL_CONSTANT, effects.get(2).value().kind());
	}

	@Test
	public void test_16() {
		checkInvalid(
				"(define (domain d) (:predicates (p)) (:action a :parameters () :effect (increase (p) 1)))",
				SyntaxError.Kind.RESOLUTION, EffectAssembler.INVALID_EFFECT);
	}

	@Test
	public void test_17() {
		checkInvalid("(define (domain d) (:predicates (p)) (:action a :parameters () :effect (and (p) (+ 1 2))))",
				SyntaxError.Kind.RESOLUTION, EffectAssembler.EXPECTED_FLUENT);
	}

	// ==============================================================
	// Universal effects
	// ==============================================================

	private static final String SWEEP = "(define (domain sweep)\n" //
			+ " (:requirements :adl)\n" //
			+ " (:types heavy - block block)\n" //
			+ " (:predicates (clear ?x - block) (on ?x ?y - block))\n" //
			+ " (:action clear-all :parameters () :effect (forall (?x - block) (clear ?x)))\n" //
			+ " (:action pile :parameters () :effect (forall (?x ?y - block) (when (clear ?x) (on ?x ?y)))))";

	private static final String SWEEP_PROBLEM = "(define (problem p) (:domain sweep)\n" //
			+ " (:objects b1 b2 - block h1 - heavy)\n" //
			+ " (:init (clear b1))\n" //
			+ " (:goal (on b1 b2)))";

	@Test
	public void test_18() {
		// objects of subtypes are included
		Model.Problem p = check(SWEEP, SWEEP_PROBLEM);
		List<Model.Effect> effects = p.action("clear-all").effects();
		assertEquals(3, effects.size());
		for (Model.Effect e : effects) {
			assertTrue(e.fluent().isGround());
		}
	}

	@Test
	public void test_19() {
		Model.Problem p = check(SWEEP, SWEEP_PROBLEM);
		List<Model.Effect> effects = p.action("pile").effects();
		assertEquals(9, effects.size());
		for (Model.Effect e : effects) {
			assertTrue(e.isConditional());
			assertEquals(Expr.Kind.FLUENT, e.condition().kind());
		}
	}

	@Test
	public void test_20() {
		checkUnusable(SWEEP, ModelBuilder.UNEXPANDED_EFFECTS);
	}

	@Test
	public void test_21() {
		String problem = "(define (problem p) (:domain sweep) (:init) (:goal (and)))";
		Model.Problem p = check(SWEEP, problem);
		assertTrue(p.action("clear-all").effects().isEmpty());
		assertTrue(p.goals().isEmpty());
	}

	// ==============================================================
	// Durative actions
	// ==============================================================

	private static final String TIMED = "(define (domain timed)\n" //
			+ " (:requirements :strips :typing :durative-actions)\n" //
			+ " (:types rover)\n" //
			+ " (:predicates (ready ?r - rover) (busy ?r - rover) (done ?r - rover))\n" //
			+ " (:durative-action work\n" //
			+ "  :parameters (?r - rover)\n" //
			+ "  :duration (and (>= ?duration 5) (<= ?duration 10))\n" //
			+ "  :condition (and (at start (ready ?r)) (over all (busy ?r)) (at end (busy ?r)))\n" //
			+ "  :effect (and (at start (busy ?r)) (at start (not (ready ?r))) (at end (done ?r)) (at end (not (busy ?r)))))\n" //
			+ " (:durative-action rest\n" //
			+ "  :parameters (?r - rover)\n" //
			+ "  :duration (= ?duration 7)\n" //
			+ "  :condition (forall (?o - rover) (at start (ready ?o)))\n" //
			+ "  :effect (at end (ready ?r))))";

	@Test
	public void test_22() {
		Model.Problem p = check(TIMED);
		Model.DurativeAction work = (Model.DurativeAction) p.action("work");
		Model.DurationInterval d = work.duration();
		assertFalse(d.isFixed());
		assertEquals(BigInteger.valueOf(5), ((Expr.Constant) d.lower()).value());
		assertEquals(BigInteger.valueOf(10), ((Expr.Constant) d.upper()).value());
	}

	@Test
	public void test_23() {
		Model.Problem p = check(TIMED);
		Model.DurativeAction work = (Model.DurativeAction) p.action("work");
		Map<Model.TimeInterval, List<Expr>> conditions = work.timedConditions();
		assertEquals(3, conditions.size());
		assertEquals(1, conditions.get(Model.TimeInterval.at(Model.Timing.START)).size());
		assertEquals(1, conditions.get(Model.TimeInterval.at(Model.Timing.END)).size());
		Model.TimeInterval overall = Model.TimeInterval.closed(Model.Timing.START, Model.Timing.END);
		assertEquals(1, conditions.get(overall).size());
		assertFalse(overall.isPoint());
		assertEquals(2, work.timedEffects().get(Model.Timing.START).size());
		assertEquals(2, work.timedEffects().get(Model.Timing.END).size());
		assertEquals(4, work.effects().size());
	}

	@Test
	public void test_24() {
		Model.Problem p = check(TIMED);
		Model.DurativeAction rest = (Model.DurativeAction) p.action("rest");
		assertTrue(rest.duration().isFixed());
		assertEquals(BigInteger.valueOf(7), ((Expr.Constant) rest.duration().lower()).value());
		List<Expr> start = rest.timedConditions().get(Model.TimeInterval.at(Model.Timing.START));
		assertEquals(1, start.size());
		assertEquals(Expr.Kind.FORALL, start.get(0).kind());
		assertEquals(1, rest.timedEffects().get(Model.Timing.END).size());
	}

	@Test
	public void test_25() {
		checkInvalid(durative("(<= ?duration 5)", "(at start (ready ?r))", "(at end (done ?r))"),
				SyntaxError.Kind.STRUCTURAL, EffectAssembler.INVALID_DURATION);
		checkInvalid(durative("(and (>= ?duration 1))", "(at start (ready ?r))", "(at end (done ?r))"),
				SyntaxError.Kind.STRUCTURAL, EffectAssembler.INVALID_DURATION);
		checkInvalid(durative("(and (>= ?duration 1) (>= ?duration 2))", "(and)", "(and)"),
				SyntaxError.Kind.STRUCTURAL, EffectAssembler.INVALID_DURATION);
	}

	@Test
	public void test_26() {
		// every effect of a durative action needs a timing
		checkInvalid(durative("(= ?duration 1)", "(at start (ready ?r))", "(done ?r)"),
				SyntaxError.Kind.STRUCTURAL, EffectAssembler.INVALID_EFFECT);
		checkInvalid(durative("(= ?duration 1)", "(and)", "(when (ready ?r) (at end (done ?r)))"),
				SyntaxError.Kind.STRUCTURAL, EffectAssembler.INVALID_EFFECT);
	}

	@Test
	public void test_27() {
		checkInvalid(durative("(= ?duration 1)", "(ready ?r)", "(at end (done ?r))"), SyntaxError.Kind.STRUCTURAL,
				EffectAssembler.INVALID_CONDITION);
	}

	@Test
	public void test_28() {
		Model.Problem p = check(durative("(= ?duration 1)", "(and)", "(at start (when (ready ?r) (done ?r)))"));
		Model.DurativeAction a = (Model.DurativeAction) p.action("a");
		Model.Effect e = a.timedEffects().get(Model.Timing.START).get(0);
		assertTrue(e.isConditional());
	}

	private static String durative(String duration, String condition, String effect) {
		return "(define (domain d) (:types rover) (:predicates (ready ?r - rover) (done ?r - rover))\n"
				+ " (:durative-action a :parameters (?r - rover) :duration " + duration + " :condition " + condition
				+ " :effect " + effect + "))";
	}

	// ==============================================================
	// Problems
	// ==============================================================

	private static final String WORLD = "(define (domain world)\n" //
			+ " (:requirements :strips :typing :numeric-fluents :timed-initial-literals :constraints)\n" //
			+ " (:types place)\n" //
			+ " (:predicates (at ?x ?y - place) (open ?x - place))\n" //
			+ " (:functions (fuel) (distance ?x ?y - place))\n" //
			+ " (:action go :parameters (?x ?y - place)\n" //
			+ "  :precondition (and (at ?x ?y) (open ?y))\n" //
			+ "  :effect (and (not (at ?x ?y)) (decrease (fuel) (distance ?x ?y)))))";

	private static final String TRIP = "(define (problem trip) (:domain world)\n" //
			+ " (:objects home work - place)\n" //
			+ " (:init (at home work) (open home) (= (fuel) 10) (= (distance home work) 2.5)\n" //
			+ "  (at 10 (not (open home))) (at 5.5 (open work)))\n" //
			+ " (:goal (and (open work) (> (fuel) 0)))\n" //
			+ " (:constraints (always (open home)))\n" //
			+ " (:metric minimize (total-time)))";

	@Test
	public void test_29() {
		Model.Problem p = check(WORLD, TRIP);
		assertEquals("trip", p.name());
		assertEquals(2, p.objects().size());
		ExpressionManager em = new ExpressionManager(new Types.Manager());
		Model.PlanningObject home = p.object("home");
		Model.PlanningObject work = p.object("work");
		Expr.FluentApp at = em.fluent(p.fluent("at"), List.of(em.object(home), em.object(work)));
		assertTrue(p.initialValue(at).isTrue());
		Expr.FluentApp openWork = em.fluent(p.fluent("open"), List.of(em.object(work)));
		assertTrue(p.initialValue(openWork).isFalse());
		assertFalse(p.explicitInitialValues().containsKey(openWork));
		Expr.FluentApp fuel = em.fluent(p.fluent("fuel"), List.of());
		assertEquals(BigInteger.TEN, ((Expr.Constant) p.initialValue(fuel)).value());
		Expr.FluentApp distance = em.fluent(p.fluent("distance"), List.of(em.object(home), em.object(work)));
		assertEquals(Expr.Kind.REAL_CONSTANT, p.initialValue(distance).kind());
		assertEquals(4, p.explicitInitialValues().size());
	}

	@Test
	public void test_30() {
		Model.Problem p = check(WORLD, TRIP);
		Map<Model.Timing, List<Model.Effect>> timed = p.timedEffects();
		assertEquals(2, timed.size());
		List<Model.Effect> at10 = timed.get(Model.Timing.global(Rational.valueOf(10)));
		assertEquals(1, at10.size());
		assertTrue(at10.get(0).value().isFalse());
		List<Model.Effect> at55 = timed.get(Model.Timing.global(Rational.parse("11/2")));
		assertTrue(at55.get(0).value().isTrue());
	}

	@Test
	public void test_31() {
		Model.Problem p = check(WORLD, TRIP);
		assertEquals(1, p.goals().size());
		assertEquals(Expr.Kind.AND, p.goals().get(0).kind());
		assertEquals(1, p.trajectoryConstraints().size());
		assertEquals(Expr.Kind.ALWAYS, p.trajectoryConstraints().get(0).kind());
		assertEquals(1, p.qualityMetrics().size());
		assertTrue(p.qualityMetrics().get(0) instanceof Model.MinimizeMakespan);
	}

	@Test
	public void test_32() {
		// the initial state may be wrapped in a conjunction
		String problem = "(define (problem p) (:domain world) (:objects home - place)\n"
				+ " (:init (and (open home) (not (at home home)))) (:goal (open home)))";
		Model.Problem p = check(WORLD, problem);
		assertEquals(2, p.explicitInitialValues().size());
	}

	@Test
	public void test_33() {
		checkUnusable(WORLD, "(define (problem p) (:domain world) (:objects home - place) (:init (open home)))",
				ModelBuilder.MISSING_GOAL);
	}

	@Test
	public void test_34() {
		checkUnusable(WORLD,
				"(define (problem p) (:domain world) (:objects a b - place) (:init (oneof (open a) (open b))) (:goal (open a)))",
				Contingent.REQUIRES_CONTINGENT);
	}

	@Test
	public void test_35() {
		checkInvalid(WORLD,
				"(define (problem p) (:domain world) (:objects home work - place) (:init (= (fuel) (distance home work))) (:goal (open home)))",
				SyntaxError.Kind.RESOLUTION, ModelBuilder.INVALID_INITIAL_VALUE);
	}

	@Test
	public void test_36() {
		checkInvalid(WORLD, "(define (problem p) (:domain world) (:init) (:goal (open office)))",
				SyntaxError.Kind.RESOLUTION, ExpressionCompiler.UNDEFINED_NAME);
	}

	@Test
	public void test_37() {
		checkInvalid(WORLD, "(define (problem p) (:domain world) (:objects home Home - place) (:init) (:goal (and)))",
				SyntaxError.Kind.DECLARATION, ModelBuilder.DUPLICATE_DECLARATION);
	}

	@Test
	public void test_38() {
		checkInvalid(WORLD,
				"(define (problem p) (:domain world) (:objects home - place) (:init (open home)) (:goal (fuel)))",
				SyntaxError.Kind.RESOLUTION, "goal");
	}

	@Test
	public void test_39() {
		checkInvalid(WORLD,
				"(define (problem p) (:domain world) (:objects home - place) (:init) (:goal (open home)) (:metric minimize (open home)))",
				SyntaxError.Kind.RESOLUTION, ModelBuilder.INVALID_METRIC);
	}

	// ==============================================================
	// Reader
	// ==============================================================

	@Test
	public void test_40(@TempDir Path dir) throws IOException {
		Path domain = dir.resolve("domain.pddl");
		Path problem = dir.resolve("p01.pddl");
		Files.writeString(domain, WORLD);
		Files.writeString(problem, TRIP);
		Model.Problem p = new PddlReader().parseProblem(domain.toString(), problem.toString());
		assertEquals("trip", p.name());
		assertEquals(1, p.actions().size());
		assertEquals("world", new PddlReader().parseProblem(domain.toString()).name());
	}

	@Test
	public void test_41() {
		// a shared manager builds every model with the same types
		ExpressionManager em = new ExpressionManager(new Types.Manager());
		PddlReader reader = new PddlReader(em);
		Model.Problem p1 = reader.parseProblemString(SIMPLE);
		Model.Problem p2 = reader.parseProblemString(WORLD, TRIP);
		assertSame(em.types().bool(), p1.fluent("done").type());
		assertSame(p1.fluent("done").type(), p2.fluent("open").type());
	}

	@Test
	public void test_42() {
		String domain = "(define (domain fleet)\n" //
				+ " (:requirements :typing :existential-preconditions :equality)\n" //
				+ " (:types object vehicle - object truck - vehicle)\n" //
				+ " (:predicates (at ?t - truck))\n" //
				+ " (:action go :parameters (?t - truck)\n" //
				+ "  :precondition (exists (?o - object) (= ?o ?t))\n" //
				+ "  :effect (at ?t)))";
		Model.Problem p = check(domain);
		assertSame(p.userType("object"), p.userType("vehicle").father());
		assertEquals(1, ((Model.InstantaneousAction) p.action("go")).preconditions().size());
	}

	@Test
	public void test_43() {
		// a trivially true condition leaves no entry behind
		Model.Problem p = check(durative("(= ?duration 2)", "(and (at start (and)) (at end (ready ?r)))",
				"(at end (done ?r))"));
		Model.DurativeAction a = (Model.DurativeAction) p.action("a");
		assertEquals(1, a.timedConditions().size());
		assertFalse(a.timedConditions().containsKey(Model.TimeInterval.at(Model.Timing.START)));
		assertEquals(1, a.conditions().size());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	public static Model.Problem check(String domain) {
		try {
			return new PddlReader().parseProblemString(domain);
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail(e.getMessage());
			return null;
		}
	}

	public static Model.Problem check(String domain, String problem) {
		try {
			return new PddlReader().parseProblemString(domain, problem);
		} catch (SyntaxError e) {
			e.outputSourceError(System.err);
			fail(e.getMessage());
			return null;
		}
	}

	public static void checkInvalid(String domain, SyntaxError.Kind kind, String message) {
		try {
			new PddlReader().parseProblemString(domain);
			fail("domain should not have been accepted");
		} catch (SyntaxError e) {
			check(e, kind, message);
		}
	}

	public static void checkInvalid(String domain, String problem, SyntaxError.Kind kind, String message) {
		try {
			new PddlReader().parseProblemString(domain, problem);
			fail("problem should not have been accepted");
		} catch (SyntaxError e) {
			check(e, kind, message);
		}
	}

	public static void checkUnusable(String domain, String message) {
		try {
			new PddlReader().parseProblemString(domain);
			fail("domain should not be usable on its own");
		} catch (UsageError e) {
			assertEquals(message, e.getMessage());
		}
	}

	public static void checkUnusable(String domain, String problem, String message) {
		try {
			new PddlReader().parseProblemString(domain, problem);
			fail("problem should not be usable");
		} catch (UsageError e) {
			assertEquals(message, e.getMessage());
		}
	}

	private static void check(SyntaxError e, SyntaxError.Kind kind, String message) {
		e.outputSourceError(System.out);
		assertEquals(kind, e.kind(), "unexpected kind of error: " + e.getMessage());
		assertTrue(e.msg().startsWith(message), "unexpected message: " + e.msg());
	}
}
