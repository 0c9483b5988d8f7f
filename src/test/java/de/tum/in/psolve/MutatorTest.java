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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

public class MutatorTest {
    @Test
    public void testUntouchedGraphIsClean() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression comparison = graph.assertExpression(Operator.GREATER_OR_EQUAL, a, b);

        Mutator.Result result = new Mutator(graph, "test").close();
        assertThat(result.isDirty(), is(false));
        assertThat(result.graph().size(), is(3));

        Expression copy = (Expression) result.reprMap().map(comparison);
        assertThat(copy.isConstrained(), is(true));
        assertThat(copy.operand(0), sameInstance(result.reprMap().map(a)));
        assertThat(copy.operand(1), sameInstance(result.reprMap().map(b)));
        assertThat(graph.size(), is(3));
    }

    @Test
    public void testReplaceByLiteralFoldsDependents() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Expression sum = graph.expression(Operator.ADD, a, NumericSet.singleton(1));
        Expression comparison = graph.assertExpression(Operator.GREATER_OR_EQUAL, sum, NumericSet.singleton(2));

        Mutator mutator = new Mutator(graph, "test");
        mutator.replace(a, NumericSet.singleton(2));
        Mutator.Result result = mutator.close();

        assertThat(result.isDirty(), is(true));
        assertThat(result.reprMap().map(a), is(NumericSet.singleton(2)));
        assertThat(result.reprMap().map(sum), is(NumericSet.singleton(3)));
        assertThat(result.reprMap().map(comparison), is(BooleanSet.TRUE));
        assertThat(result.graph().isEmpty(), is(true));
    }

    @Test
    public void testReplaceLeadingToFalseIsContradiction() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        graph.assertExpression(Operator.GREATER_OR_EQUAL, a, NumericSet.singleton(5));

        Mutator mutator = new Mutator(graph, "test");
        mutator.replace(a, NumericSet.singleton(2));
        assertThrows(ContradictionByLiteral.class, mutator::close);
    }

    @Test
    public void testRemovalCascades() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression sum = graph.expression(Operator.ADD, a, b);

        Mutator mutator = new Mutator(graph, "test");
        mutator.remove(a);
        Mutator.Result result = mutator.close();

        assertThat(result.reprMap().isRemoved(a), is(true));
        assertThat(result.reprMap().isRemoved(sum), is(true));
        assertThat(result.reprMap().map(sum), is(nullValue()));
        assertThat(result.graph().size(), is(1));
        assertThat(result.isDirty(), is(true));
    }

    @Test
    public void testAliasedParametersCollapse() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression alias = graph.assertExpression(Operator.IS, a, b);

        Mutator mutator = new Mutator(graph, "test");
        Parameter representative = mutator.createParameter(a);
        mutator.replace(a, representative);
        mutator.replace(b, representative);
        Mutator.Result result = mutator.close();

        assertThat(result.reprMap().map(a), sameInstance(result.reprMap().map(b)));
        assertThat(result.reprMap().map(alias), is(BooleanSet.TRUE));
        assertThat(result.graph().size(), is(1));
        assertThat(((Parameter) result.reprMap().map(a)).name(), is("a"));
    }

    @Test
    public void testConcatenation() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Parameter b = graph.parameter("b", Domain.numbers());
        Expression sum = graph.expression(Operator.ADD, a, b);

        Mutator first = new Mutator(graph, "first");
        first.replace(b, NumericSet.singleton(1));
        Mutator.Result firstResult = first.close();

        Graph intermediate = firstResult.graph();
        Mutator second = new Mutator(intermediate, "second");
        second.remove((Parameter) firstResult.reprMap().map(a));
        Mutator.Result secondResult = second.close();

        ReprMap total = ReprMap.concat(
                ReprMap.identity(List.of(graph)), firstResult.reprMap(), secondResult.reprMap());
        assertThat(total.map(b), is(NumericSet.singleton(1)));
        assertThat(total.map(a), is(nullValue()));
        assertThat(total.isRemoved(a), is(true));
        assertThat(total.isRemoved(sum), is(true));
        assertThat(total.contains(sum), is(true));
        assertThat(secondResult.graph().isEmpty(), is(true));
    }

    @Test
    public void testClosedMutatorRejectsChanges() {
        Graph graph = new Graph();
        Parameter a = graph.parameter("a", Domain.numbers());
        Mutator mutator = new Mutator(graph, "test");
        mutator.close();
        assertThrows(IllegalStateException.class, () -> mutator.getCopy(a));
        assertThrows(IllegalStateException.class, mutator::close);
    }

    @Test
    public void testForeignOperandsAreRejected() {
        Graph graph = new Graph();
        Graph other = new Graph();
        Parameter foreign = other.parameter("foreign", Domain.numbers());
        Mutator mutator = new Mutator(graph, "test");
        assertThrows(IllegalArgumentException.class, () -> mutator.getCopy(foreign));
        assertThrows(IllegalArgumentException.class,
                () -> graph.expression(Operator.ADD, graph.parameter("a", Domain.numbers()), foreign));
    }
}
