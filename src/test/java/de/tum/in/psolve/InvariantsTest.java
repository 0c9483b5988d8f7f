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
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class InvariantsTest {
    @Test
    public void testCommutativeExpressionsAreCongruent() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression first = graph.expression(Operator.ADD, a, b);
        Expression second = graph.expression(Operator.ADD, b, a);

        Mutator mutator = new Mutator(graph, "test");
        assertThat(mutator.getCopy(second), sameInstance(mutator.getCopy(first)));

        Mutator.Result result = mutator.close();
        assertThat(result.graph().size(), is(3));
        assertThat(result.reprMap().map(first), sameInstance(result.reprMap().map(second)));
        assertThat(result.isDirty(), is(true));
    }

    @Test
    public void testNonCommutativeOperandOrderMatters() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression first = graph.expression(Operator.POWER, a, b);
        Expression second = graph.expression(Operator.POWER, b, a);

        Mutator mutator = new Mutator(graph, "test");
        assertThat(mutator.getCopy(second), not(sameInstance(mutator.getCopy(first))));
    }

    @Test
    public void testUncorrelatedLiteralsAreNotCongruent() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Expression firstRange = graph.expression(Operator.ADD, a, NumericSet.interval(0, 1));
        Expression secondRange = graph.expression(Operator.ADD, a, NumericSet.interval(0, 1));
        Expression firstValue = graph.expression(Operator.ADD, a, NumericSet.singleton(1));
        Expression secondValue = graph.expression(Operator.ADD, a, NumericSet.singleton(1));

        Mutator mutator = new Mutator(graph, "test");
        assertThat(mutator.getCopy(secondRange), not(sameInstance(mutator.getCopy(firstRange))));
        assertThat(mutator.getCopy(secondValue), sameInstance(mutator.getCopy(firstValue)));
    }

    @Test
    public void testCongruenceConstrainsExistingExpression() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression comparison = graph.expression(Operator.GREATER_OR_EQUAL, a, b);

        Mutator mutator = new Mutator(graph, "test");
        Expression copy = (Expression) mutator.getCopy(comparison);
        assertThat(copy.isConstrained(), is(false));
        Operand asserted = mutator.create(ExpressionBuilder.asserted(Operator.GREATER_OR_EQUAL, a, b));
        assertThat(asserted, sameInstance(copy));
        assertThat(copy.isConstrained(), is(true));
    }

    @Test
    public void testEmptySupersetIsContradiction() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        Mutator mutator = new Mutator(graph, "test");
        ContradictionByLiteral contradiction = assertThrows(ContradictionByLiteral.class,
                () -> mutator.create(ExpressionBuilder.asserted(Operator.IS_SUBSET, p, NumericSet.empty())));
        assertThat(contradiction.literals().contains(NumericSet.empty()), is(true));
    }

    @Test
    public void testEmptySupersetIsContradictionDespiteOtherBounds() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.interval(0, 10));
        graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.empty());
        Mutator mutator = new Mutator(graph, "test");
        assertThrows(Contradiction.class, mutator::close);
    }

    @Test
    public void testSupersetsIntersect() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        Expression first = graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.interval(0, 10));
        Expression second = graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.interval(5, 20));

        Mutator.Result result = new Mutator(graph, "test").close();
        Expression merged = (Expression) result.reprMap().map(first);
        assertThat(result.reprMap().map(second), sameInstance(merged));
        assertThat(merged.operator(), is(Operator.IS_SUBSET));
        assertThat(merged.operand(1), is(NumericSet.interval(5, 10)));
        assertThat(result.graph().size(), is(2));
        assertThat(result.reprMap().tryGetLiteral(p, true), is(NumericSet.interval(5, 10)));
    }

    @Test
    public void testDisjointSupersetsAreContradiction() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.interval(0, 1));
        graph.assertExpression(Operator.IS_SUBSET, p, NumericSet.interval(5, 6));
        assertThrows(ContradictionByLiteral.class, () -> new Mutator(graph, "test").close());
    }

    @Test
    public void testSubsetsUnite() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        Expression first = graph.assertExpression(Operator.IS_SUBSET, NumericSet.interval(0, 1), p);
        Expression second = graph.assertExpression(Operator.IS_SUBSET, NumericSet.interval(5, 6), p);

        Mutator.Result result = new Mutator(graph, "test").close();
        Expression merged = (Expression) result.reprMap().map(first);
        assertThat(result.reprMap().map(second), sameInstance(merged));
        assertThat(merged.operand(0), is(NumericSet.interval(0, 1).union(NumericSet.interval(5, 6))));
    }

    @Test
    public void testSingletonSupersetBecomesAlias() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        Mutator mutator = new Mutator(graph, "test");
        Expression fact = (Expression) mutator.create(
                ExpressionBuilder.asserted(Operator.IS_SUBSET, p, NumericSet.singleton(5)));
        assertThat(fact.operator(), is(Operator.IS));

        Expression range = (Expression) mutator.create(
                ExpressionBuilder.asserted(Operator.IS, NumericSet.interval(0, 3), graph.parameter("q", Domain.numbers())));
        assertThat(range.operator(), is(Operator.IS_SUBSET));
        assertThat(range.operand(1), is(NumericSet.interval(0, 3)));
    }

    @Test
    public void testLiteralExpressionsFold() {
        Graph graph = new Graph();
        Mutator mutator = new Mutator(graph, "test");
        assertThat(mutator.create(ExpressionBuilder.of(Operator.ADD, NumericSet.singleton(1), NumericSet.singleton(2))),
                is(NumericSet.singleton(3)));
        assertThat(mutator.create(
                        ExpressionBuilder.asserted(Operator.IS, NumericSet.singleton(1), NumericSet.singleton(1))),
                is(BooleanSet.TRUE));
        assertThrows(ContradictionByLiteral.class, () -> mutator.create(
                ExpressionBuilder.asserted(Operator.IS, NumericSet.singleton(1), NumericSet.singleton(2))));
    }

    @Test
    public void testReflexivePredicateIsTrue() {
        Graph graph = new Graph();
        Parameter p = graph.parameter("p", Domain.numbers());
        Mutator mutator = new Mutator(graph, "test");
        assertThat(mutator.create(ExpressionBuilder.of(Operator.GREATER_OR_EQUAL, p, p)), is(BooleanSet.TRUE));
    }

    @Test
    public void testAssertedDisjunctionWithTrue() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.booleans());
        Mutator mutator = new Mutator(graph, "test");
        assertThat(mutator.create(ExpressionBuilder.asserted(Operator.OR, x, BooleanSet.TRUE)), is(BooleanSet.TRUE));

        Expression reduced = (Expression) mutator.create(
                ExpressionBuilder.asserted(Operator.OR, x, BooleanSet.FALSE, graph.parameter("y", Domain.booleans())));
        assertThat(reduced.operands().size(), is(2));
        assertThrows(ContradictionByLiteral.class,
                () -> mutator.create(ExpressionBuilder.asserted(Operator.OR, BooleanSet.FALSE, BooleanSet.FALSE)));
    }

    @Test
    public void testWeakerDisjunctionIsSubsumed() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.booleans());
        Parameter y = graph.parameter("y", Domain.booleans());
        Parameter z = graph.parameter("z", Domain.booleans());
        Expression strong = graph.assertExpression(Operator.OR, x, y);
        Expression weak = graph.assertExpression(Operator.OR, x, y, z);

        Mutator.Result result = new Mutator(graph, "test").close();
        Operand image = result.reprMap().map(strong);
        assertThat(image, instanceOf(Expression.class));
        assertThat(result.reprMap().map(weak), sameInstance(image));
        assertThat(((Expression) image).operands().size(), is(2));
    }

    @Test
    public void testIdempotentOperandsAreDeduplicated() {
        Graph graph = new Graph();
        Parameter x = graph.parameter("x", Domain.booleans());
        Parameter y = graph.parameter("y", Domain.booleans());
        Mutator mutator = new Mutator(graph, "test");
        Expression disjunction = (Expression) mutator.create(ExpressionBuilder.of(Operator.OR, x, y, x));
        assertThat(disjunction.operands().size(), is(2));
    }
}
