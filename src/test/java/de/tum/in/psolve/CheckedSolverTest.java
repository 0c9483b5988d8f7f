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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import javax.annotation.Nullable;
import org.junit.jupiter.api.Test;

public class CheckedSolverTest {
    /**
     * Calls back into the checked solver while it is being used.
     */
    private static final class ReentrantSolver implements Solver {
        private Solver outer;

        @Override
        public SimplifyResult phase1SimplifyAnalytically(List<Graph> graphs, ReprContext context) {
            return outer.phase1SimplifyAnalytically(graphs, context);
        }

        @Override
        public Literal inspectGetKnownSupersets(Parameter parameter, boolean forceUpdate) {
            return parameter.domain().domainSet();
        }

        @Override
        public <T> SolveResultAny<T> assertAnyPredicate(
                List<PredicateWithInfo<T>> predicates,
                boolean lock,
                @Nullable Expression supposeConstraint,
                @Nullable Operand minimize) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Literal getAnySingle(
                Parameter parameter, boolean lock, @Nullable Expression supposeConstraint, @Nullable Operand minimize) {
            return outer.inspectGetKnownSupersets(parameter);
        }

        @Override
        public SolveResultAll findAndLockSolution(Graph graph) {
            return new SolveResultAll(false, true);
        }
    }

    @Test
    public void testSequentialAccess() {
        ReentrantSolver delegate = new ReentrantSolver();
        CheckedSolver solver = new CheckedSolver(delegate);
        delegate.outer = solver;

        Graph graph = new Graph();
        Parameter flag = graph.parameter("flag", Domain.booleans());
        assertThat(solver.inspectGetKnownSupersets(flag), is(BooleanSet.BOTH));
        assertThat(solver.inspectGetKnownSupersets(flag), is(BooleanSet.BOTH));
        assertThat(solver.findAndLockSolution(graph).hasSolution(), is(true));
    }

    @Test
    public void testConcurrentAccessIsDetected() {
        ReentrantSolver delegate = new ReentrantSolver();
        CheckedSolver solver = new CheckedSolver(delegate);
        delegate.outer = solver;

        Graph graph = new Graph();
        Parameter flag = graph.parameter("flag", Domain.booleans());
        IllegalStateException exception =
                assertThrows(IllegalStateException.class, () -> solver.getAnySingle(flag, false));
        assertThat(exception.getMessage(), containsString("inspectGetKnownSupersets"));
    }

    @Test
    public void testFailureReleasesSolver() {
        ReentrantSolver delegate = new ReentrantSolver();
        CheckedSolver solver = new CheckedSolver(delegate);
        delegate.outer = solver;

        assertThrows(UnsupportedOperationException.class, () -> solver.assertAnyPredicate(List.of(), false));
        assertThat(solver.findAndLockSolution(new Graph()).hasSolution(), is(true));
    }
}
