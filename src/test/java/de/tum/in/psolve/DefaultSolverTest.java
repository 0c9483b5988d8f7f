/*
 * This file is part of PSolve.
 * Copyright (c) 2024 The PSolve authors.
 *
 * PSolve is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PSolve is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PSolve. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.psolve;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.psolve.Solver.PredicateWithInfo;
import de.tum.in.psolve.Solver.SolveResultAll;
import de.tum.in.psolve.Solver.SolveResultAny;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DefaultSolverTest {
    private static DefaultSolver solver() {
        return SolverFactory.buildDefaultSolver(ImmutableSolverConfiguration.builder().build());
    }

    private static SimplifyResult simplify(DefaultSolver solver, Graph graph) {
        return solver.phase1SimplifyAnalytically(List.of(graph), new ReprContext());
    }

    @Test
    public void testInequalitiesBoundParameter() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(3));
        graph.assertExpression(Operator.LESS_OR_EQUAL, x, NumericSet.singleton(10));

        assertThat(solver().inspectGetKnownSupersets(x), is(NumericSet.interval(3, 10)));
    }

    @Test
    public void testSimplificationIsIdempotent() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        Parameter y = graph.parameter("y", Domain.numbers(false, false));
        graph.assertExpression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(3));
        graph.assertExpression(Operator.LESS_OR_EQUAL, x, NumericSet.singleton(10));
        graph.assertExpression(Operator.GREATER_OR_EQUAL, y, x);

        DefaultSolver solver = solver();
        SimplifyResult first = simplify(solver, graph);
        assertThat(first.isDirty(), is(true));
        assertThat(first.graphs().size(), is(1));

        SimplifyResult second = solver.phase1SimplifyAnalytically(first.graphs(), first.context());
        assertThat(second.isDirty(), is(false));
        assertThat(second.iterations(), is(1));
        assertThat(second.graphs().get(0).size(), is(first.graphs().get(0).size()));
    }

    @Test
    public void testInputGraphIsNotModified() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        Expression inequality = graph.assertExpression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(3));

        SimplifyResult result = simplify(solver(), graph);
        assertThat(graph.size(), is(2));
        assertThat(inequality.operator(), is(Operator.GREATER_OR_EQUAL));
        Expression image = (Expression) result.reprMap().map(inequality);
        assertThat(image.operator(), is(Operator.IS_SUBSET));
        assertThat(image.operand(1), is(NumericSet.atLeast(3)));
    }

    @Test
    public void testEmptySubsetIsContradiction() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.interval(0, 10));
        graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.empty());

        DefaultSolver solver = solver();
        assertThrows(Contradiction.class, () -> simplify(solver, graph));
        assertThrows(Contradiction.class, () -> solver.inspectGetKnownSupersets(p));
    }

    @Test
    public void testTrivialDisjunctionIsDiscarded() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.booleans());
        Expression disjunction = graph.assertExpression(Operator.OR, x, BooleanSet.TRUE);

        SimplifyResult result = simplify(solver(), graph);
        assertThat(result.reprMap().map(disjunction), is(BooleanSet.TRUE));
        assertThat(result.graphs(), is(empty()));
    }

    @Test
    public void testDisjunctionOverFreeParametersIsDiscarded() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.booleans());
        Parameter y = graph.parameter("y", Domain.booleans());
        Expression disjunction = graph.assertExpression(Operator.OR, x, y);

        SimplifyResult result = simplify(solver(), graph);
        assertThat(result.reprMap().map(disjunction), is(nullValue()));
        assertThat(result.graphs(), is(empty()));
    }

    @Test
    public void testCongruentSumsAreMerged() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression first = graph.expression(Operator.ADD, a, b);
        Expression second = graph.expression(Operator.ADD, b, a);
        graph.assertExpression(Operator.GREATER_OR_EQUAL, first, second);

        SimplifyResult result = simplify(solver(), graph);
        // a + b >= b + a is reflexive once both sums are merged
        assertThat(result.graphs(), is(empty()));
    }

    @Test
    public void testAliasedParametersShareBounds() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        graph.assertExpression(Operator.IS, a, b);
        graph.assertExpression(Operator.IS_SUBSET, a, NumericSet.interval(0, 5));
        graph.assertExpression(Operator.IS_SUBSET, b, NumericSet.interval(3, 10));

        DefaultSolver solver = solver();
        SimplifyResult result = simplify(solver, graph);
        assertThat(result.reprMap().map(a), is(result.reprMap().map(b)));
        assertThat(solver.inspectGetKnownSupersets(b), is(NumericSet.interval(3, 5)));
    }

    @Test
    public void testSingletonAliasIsSubstituted() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        graph.assertExpression(Operator.IS, a, NumericSet.singleton(4));
        Expression sum = graph.expression(Operator.ADD, a, NumericSet.singleton(1));
        graph.assertExpression(Operator.IS, b, sum);

        DefaultSolver solver = solver();
        assertThat(solver.inspectGetKnownSupersets(a), is(NumericSet.singleton(4)));
        assertThat(solver.inspectGetKnownSupersets(b), is(NumericSet.singleton(5)));
    }

    @Test
    public void testTransitiveSubset() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, a, b);
        graph.assertExpression(Operator.IS_SUBSET, b, NumericSet.interval(0, 5));

        assertThat(solver().inspectGetKnownSupersets(a), is(NumericSet.interval(0, 5)));
    }

    @Test
    public void testUpperEstimationDetectsContradiction() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, a, NumericSet.interval(1, 2));
        graph.assertExpression(Operator.IS_SUBSET, b, NumericSet.interval(3, 4));
        Expression sum = graph.expression(Operator.ADD, a, b);
        graph.assertExpression(Operator.GREATER_OR_EQUAL, sum, NumericSet.singleton(10));

        assertThrows(ContradictionByLiteral.class, () -> simplify(solver(), graph));
    }

    @Test
    public void testDomainAndWithinBounds() {
        Unit ohm = Unit.of("Ω");
        Unit kiloOhm = ohm.scaled("kΩ", 1000);
        Graph graph = new Graph();
        Parameter count = graph.parameter("count", Domain.numbers(false, true));
        Parameter resistance = graph.parameter("r", Domain.numbers(), kiloOhm, NumericSet.interval(1, 2, kiloOhm));

        DefaultSolver solver = solver();
        assertThat(solver.inspectGetKnownSupersets(count), is(NumericSet.nonNegative()));
        Literal superset = solver.inspectGetKnownSupersets(resistance);
        assertThat(superset, is(NumericSet.interval(1000, 2000, ohm)));
        assertThat(superset.toString(), is("[1000, 2000] Ω"));
    }

    @Test
    public void testUnconstrainedParameterFallsBackToDomain() {
        Graph graph = new Graph();
        Parameter flag = graph.parameter("flag", Domain.booleans());
        Parameter color = graph.parameter("color", Domain.enumeration("Color", "red", "green", "blue"));

        DefaultSolver solver = solver();
        assertThat(solver.inspectGetKnownSupersets(flag), is(BooleanSet.BOTH));
        assertThat(solver.inspectGetKnownSupersets(color), is(DiscreteSet.of("Color", "red", "green", "blue")));
    }

    @Test
    public void testSupersetCache() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        Parameter y = graph.parameter("y", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(0, 10));
        graph.assertExpression(Operator.IS_SUBSET, y, NumericSet.interval(1, 2));

        DefaultSolver solver = solver();
        assertThat(solver.inspectGetKnownSupersets(x), is(NumericSet.interval(0, 10)));
        assertThat(solver.supersetCache().size(), is(2));
        assertThat(solver.inspectGetKnownSupersets(y), is(NumericSet.interval(1, 2)));
        assertThat(solver.supersetCache().hits(), is(1));

        graph.assertExpression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(5));
        assertThat(solver.inspectGetKnownSupersets(x), is(NumericSet.interval(5, 10)));
        assertThat(solver.supersetCache().hits(), is(1));
        assertThat(solver.inspectGetKnownSupersets(x, true), is(NumericSet.interval(5, 10)));
    }

    @Test
    public void testPredicateShortCircuit() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(3, 10));
        PredicateWithInfo<String> first = new PredicateWithInfo<>(
                graph.expression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(20)), "first");
        PredicateWithInfo<String> second = new PredicateWithInfo<>(
                graph.expression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(0)), "second");
        PredicateWithInfo<String> third = new PredicateWithInfo<>(
                graph.expression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(1)), "third");

        SolveResultAny<String> result = solver().assertAnyPredicate(List.of(first, second, third), false);
        assertThat(result.truePredicates(), contains(second));
        assertThat(result.falsePredicates(), contains(first));
        assertThat(result.unknownPredicates(), contains(third));
        assertThat(result.timedOut(), is(false));

        assertThat(first.predicate().isConstrained(), is(false));
        assertThat(second.predicate().isConstrained(), is(false));
    }

    @Test
    public void testPredicateAddingInformationIsUnknown() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(3, 10));
        PredicateWithInfo<Integer> narrowing = new PredicateWithInfo<>(
                graph.expression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(5)), 1);

        SolveResultAny<Integer> result = solver().assertAnyPredicate(List.of(narrowing), false);
        assertThat(result.truePredicates(), is(empty()));
        assertThat(result.falsePredicates(), is(empty()));
        assertThat(result.unknownPredicates(), contains(narrowing));
    }

    @Test
    public void testPredicateLock() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(3, 10));
        Expression predicate = graph.expression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(1));

        SolveResultAny<String> result = solver().assertAnyPredicate(
                List.of(new PredicateWithInfo<>(predicate, "lock")), true);
        assertThat(result.truePredicates().size(), is(1));
        assertThat(predicate.isConstrained(), is(true));
    }

    @Test
    public void testGetAnySingle() {
        Graph graph = new Graph();
        Parameter count = graph.parameter("count", Domain.numbers(false, true));
        graph.assertExpression(Operator.IS_SUBSET, count, NumericSet.interval(2.5, 10));
        Parameter flag = graph.parameter("flag", Domain.booleans());
        Parameter color = graph.parameter("color", Domain.enumeration("Color", "red", "green", "blue"));
        Parameter level = graph.parameter("level", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, level, NumericSet.atMost(-2));

        DefaultSolver solver = solver();
        assertThat(solver.getAnySingle(count, false), is(NumericSet.singleton(3)));
        assertThat(solver.getAnySingle(flag, false), is(BooleanSet.FALSE));
        assertThat(solver.getAnySingle(color, false), is(DiscreteSet.of("Color", "blue")));
        assertThat(solver.getAnySingle(level, false), is(NumericSet.singleton(-2)));
    }

    @Test
    public void testGetAnySingleLocks() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(3, 10));

        DefaultSolver solver = solver();
        Literal value = solver.getAnySingle(x, true);
        assertThat(value, is(NumericSet.singleton(3)));
        assertThat(solver.inspectGetKnownSupersets(x), is(NumericSet.singleton(3)));
    }

    @Test
    public void testGetAnySingleWithoutIntegerMember() {
        Graph graph = new Graph();
        Parameter count = graph.parameter("count", Domain.numbers(true, true));
        graph.assertExpression(Operator.IS_SUBSET, count, NumericSet.interval(2.2, 2.8));

        assertThrows(ContradictionByLiteral.class, () -> solver().getAnySingle(count, false));
    }

    @Test
    public void testUnsupportedArguments() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        Expression predicate = graph.expression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(1));

        DefaultSolver solver = solver();
        assertThrows(UnsupportedOperationException.class, () -> solver.getAnySingle(x, false, predicate, null));
        assertThrows(UnsupportedOperationException.class, () -> solver.getAnySingle(x, false, null, x));
        assertThrows(UnsupportedOperationException.class,
                () -> solver.assertAnyPredicate(List.of(new PredicateWithInfo<>(predicate, 0)), false, predicate, null));
    }

    @Test
    public void testFindAndLockSolution() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        Parameter y = graph.parameter("y", Domain.numbers(false, true));
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(3, 10));
        graph.assertExpression(Operator.GREATER_OR_EQUAL, y, x);

        DefaultSolver solver = solver();
        SolveResultAll result = solver.findAndLockSolution(graph);
        assertThat(result.hasSolution(), is(true));
        assertThat(result.timedOut(), is(false));
        assertThat(solver.inspectGetKnownSupersets(x), is(NumericSet.singleton(3)));
        assertThat(solver.inspectGetKnownSupersets(y), is(NumericSet.singleton(3)));
    }

    @Test
    public void testFindAndLockSolutionOnUnsatisfiableGraph() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(0, 1));
        graph.assertExpression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(5));

        SolveResultAll result = solver().findAndLockSolution(graph);
        assertThat(result.hasSolution(), is(false));
        assertThat(result.timedOut(), is(false));
    }

    @Test
    public void testIterationLimit() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.GREATER_OR_EQUAL, x, NumericSet.singleton(3));

        DefaultSolver solver = SolverFactory.buildDefaultSolver(
                ImmutableSolverConfiguration.builder().maxIterations(1).build());
        IterationLimitExceededException exception =
                assertThrows(IterationLimitExceededException.class, () -> simplify(solver, graph));
        assertThat(exception.iterations(), is(1));
    }

    @Test
    public void testFactoryConfiguration() {
        assertThat(SolverFactory.buildSolver(), instanceOf(DefaultSolver.class));
        Solver checked = SolverFactory.buildSolver(
                ImmutableSolverConfiguration.builder().threadSafetyCheck(true).build());
        assertThat(checked, instanceOf(CheckedSolver.class));
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableSolverConfiguration.builder().maxIterations(0).build());
    }

    @Test
    public void testForcedUpdateBypassesCache() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.parameter("y", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(0, 10));

        DefaultSolver solver = solver();
        solver.inspectGetKnownSupersets(x);
        assertThat(solver.supersetCache().misses(), is(1));
        assertThat(solver.inspectGetKnownSupersets(x, true), is(NumericSet.interval(0, 10)));
        assertThat(solver.supersetCache().misses(), is(1));
        assertThat(solver.supersetCache().hits(), is(0));
        assertThat(solver.supersetCache().size(), is(2));
        solver.inspectGetKnownSupersets(x);
        assertThat(solver.supersetCache().hits(), is(1));
    }

    @Test
    public void testAliasedValueIsReportedInBaseUnit() {
        Unit ohm = Unit.of("Ω");
        Unit kiloOhm = ohm.scaled("kΩ", 1000);
        Graph graph = new Graph();
        Parameter resistance = graph.parameter("r", Domain.numbers(), kiloOhm, null);
        graph.assertExpression(Operator.IS, resistance, NumericSet.singleton(2, kiloOhm));

        Literal value = solver().inspectGetKnownSupersets(resistance);
        assertThat(value, is(NumericSet.singleton(2000, ohm)));
        assertThat(value.toString(), is("2000 Ω"));
    }

    @Test
    public void testTimeoutDuringTrialIsUnknown() {
        Graph graph = new Graph();
        Parameter previous = graph.parameter("p0", Domain.numbers());
        for (int i = 1; i < 300; i++) {
            Parameter next = graph.parameter("p" + i, Domain.numbers());
            graph.assertExpression(Operator.IS, next, graph.expression(Operator.ADD, previous, NumericSet.singleton(1)));
            previous = next;
        }
        Expression candidate = graph.expression(Operator.GREATER_OR_EQUAL, previous, NumericSet.singleton(0));
        PredicateWithInfo<String> predicate = new PredicateWithInfo<>(candidate, "last");

        DefaultSolver solver = SolverFactory.buildDefaultSolver(
                ImmutableSolverConfiguration.builder().timeoutMillis(1).maxIterations(1000).build());
        SolveResultAny<String> result = solver.assertAnyPredicate(List.of(predicate), true);
        assertThat(result.timedOut(), is(true));
        assertThat(result.unknownPredicates(), contains(predicate));
        assertThat(result.truePredicates(), is(empty()));
        assertThat(result.falsePredicates(), is(empty()));
        assertThat(candidate.isConstrained(), is(false));
    }

    @Test
    public void testIsolateLoneParameterOfSum() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        graph.assertExpression(Operator.IS, graph.expression(Operator.ADD, a, b), NumericSet.singleton(10));
        graph.assertExpression(Operator.IS, b, NumericSet.singleton(3));

        assertThat(solver().inspectGetKnownSupersets(a), is(NumericSet.singleton(7)));
    }

    @Test
    public void testIsolateLoneParameterOfQuotient() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        graph.assertExpression(Operator.IS,
                graph.expression(Operator.DIVIDE, a, NumericSet.singleton(4)), NumericSet.singleton(2));

        assertThat(solver().inspectGetKnownSupersets(a), is(NumericSet.singleton(8)));
    }

    @Test
    public void testSeveralFreeParametersAreNotIsolated() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        graph.assertExpression(Operator.IS, graph.expression(Operator.ADD, a, b), NumericSet.singleton(10));

        assertThat(solver().inspectGetKnownSupersets(a), is(NumericSet.reals()));
    }

    @Test
    public void testStrictComparisonBoundsOperand() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(0, 10));
        graph.assertExpression(Operator.GREATER_THAN, x, NumericSet.singleton(3));

        assertThat(solver().inspectGetKnownSupersets(x), is(NumericSet.interval(3, 10)));
    }

    @Test
    public void testStrictComparisonPredicates() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(5, 10));
        PredicateWithInfo<String> aboveMax = new PredicateWithInfo<>(
                graph.expression(Operator.GREATER_THAN, x, NumericSet.singleton(10)), "x > 10");
        PredicateWithInfo<String> aboveMin = new PredicateWithInfo<>(
                graph.expression(Operator.GREATER_THAN, x, NumericSet.singleton(3)), "x > 3");
        PredicateWithInfo<String> below = new PredicateWithInfo<>(
                graph.expression(Operator.LESS_THAN, x, NumericSet.singleton(20)), "x < 20");

        SolveResultAny<String> result = solver().assertAnyPredicate(List.of(aboveMax, aboveMin, below), false);
        assertThat(result.falsePredicates(), contains(aboveMax));
        assertThat(result.truePredicates(), contains(aboveMin));
        assertThat(result.unknownPredicates(), contains(below));
    }

    @Test
    public void testExclusiveOr() {
        Graph graph = new Graph();
        Parameter first = graph.parameter("first", Domain.booleans());
        Parameter second = graph.parameter("second", Domain.booleans());
        graph.assertExpression(Operator.XOR, first, second);
        graph.assertExpression(Operator.IS, first, BooleanSet.TRUE);
        graph.assertExpression(Operator.IS, second, BooleanSet.FALSE);

        Graph both = new Graph();
        Parameter third = both.parameter("third", Domain.booleans());
        Parameter fourth = both.parameter("fourth", Domain.booleans());
        both.assertExpression(Operator.XOR, third, fourth);
        both.assertExpression(Operator.IS, third, BooleanSet.TRUE);
        both.assertExpression(Operator.IS, fourth, BooleanSet.TRUE);

        DefaultSolver solver = solver();
        simplify(solver, graph);
        assertThrows(Contradiction.class, () -> simplify(solver, both));
    }

    @Test
    public void testCosineOfKnownValue() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS, x, NumericSet.singleton(0));
        graph.assertExpression(Operator.GREATER_OR_EQUAL, graph.expression(Operator.COS, x), NumericSet.singleton(1));
        simplify(solver(), graph);

        Graph impossible = new Graph();
        Parameter y = impossible.parameter("y", Domain.numbers());
        impossible.assertExpression(Operator.IS, y, NumericSet.singleton(0));
        impossible.assertExpression(
                Operator.GREATER_OR_EQUAL, impossible.expression(Operator.COS, y), NumericSet.singleton(2));
        assertThrows(ContradictionByLiteral.class, () -> simplify(solver(), impossible));
    }

    @Test
    public void testAbsoluteValueEstimation() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, x, NumericSet.interval(-5, 2));
        graph.assertExpression(Operator.GREATER_OR_EQUAL, graph.expression(Operator.ABS, x), NumericSet.singleton(6));

        assertThrows(Contradiction.class, () -> simplify(solver(), graph));
    }
}
