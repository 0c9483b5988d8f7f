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

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Symbolic simplification and predicate evaluation over parameter graphs.
 *
 * <p>Graphs are never rewritten in place. Each simplification produces new graphs together with
 * a {@link ReprMap} from the nodes of the input to their images. The only in-place changes a
 * solver performs on its input are the constraints added by {@code lock} requests.</p>
 */
public interface Solver {
    /**
     * Simplifies the given graphs until no rewrite pass changes them any more.
     *
     * @param graphs The graphs to simplify. They are not modified.
     * @param context Naming context for diagnostic output. It is carried over to the result.
     * @return The final graphs and the map from the given graphs to them.
     * @throws Contradiction If the constraints of a graph cannot be satisfied.
     * @throws SolverTimeoutException If the configured time budget is exceeded.
     * @throws IterationLimitExceededException If no fixpoint is reached within the iteration cap.
     */
    SimplifyResult phase1SimplifyAnalytically(List<Graph> graphs, ReprContext context);

    /**
     * Returns the tightest known set of values of the parameter.
     *
     * @param parameter The parameter.
     * @param forceUpdate Whether to ignore cached results.
     * @return A literal containing every value the parameter may take.
     * @throws Contradiction If the graph of the parameter is unsatisfiable.
     */
    Literal inspectGetKnownSupersets(Parameter parameter, boolean forceUpdate);

    default Literal inspectGetKnownSupersets(Parameter parameter) {
        return inspectGetKnownSupersets(parameter, false);
    }

    /**
     * Tries the given predicates in order until one of them is deduced to be true. Predicates
     * which lead to a contradiction are false, predicates which could not be decided or were not
     * tried are unknown.
     *
     * @param predicates The candidates, each with caller data.
     * @param lock Whether to permanently constrain the first true predicate.
     * @param supposeConstraint Not supported, must be {@code null}.
     * @param minimize Not supported, must be {@code null}.
     */
    <T> SolveResultAny<T> assertAnyPredicate(
            List<PredicateWithInfo<T>> predicates,
            boolean lock,
            @Nullable Expression supposeConstraint,
            @Nullable Operand minimize);

    default <T> SolveResultAny<T> assertAnyPredicate(List<PredicateWithInfo<T>> predicates, boolean lock) {
        return assertAnyPredicate(predicates, lock, null, null);
    }

    /**
     * Picks some value of the parameter from its known superset.
     *
     * @param parameter The parameter.
     * @param lock Whether to constrain the parameter to the picked value.
     * @param supposeConstraint Not supported, must be {@code null}.
     * @param minimize Not supported, must be {@code null}.
     * @return The picked value as a singleton literal.
     * @throws ContradictionByLiteral If the known superset contains no suitable value.
     */
    Literal getAnySingle(
            Parameter parameter, boolean lock, @Nullable Expression supposeConstraint, @Nullable Operand minimize);

    default Literal getAnySingle(Parameter parameter, boolean lock) {
        return getAnySingle(parameter, lock, null, null);
    }

    /**
     * Greedily assigns and locks a value for every parameter of the graph.
     */
    SolveResultAll findAndLockSolution(Graph graph);

    final class PredicateWithInfo<T> {
        private final Expression predicate;
        private final T info;

        public PredicateWithInfo(Expression predicate, T info) {
            Util.checkArgument(predicate.isPredicate(), "%s is not a predicate", predicate);
            this.predicate = predicate;
            this.info = info;
        }

        public Expression predicate() {
            return predicate;
        }

        public T info() {
            return info;
        }

        @Override
        public String toString() {
            return predicate + " (" + info + ")";
        }
    }

    final class SolveResultAny<T> {
        private final boolean timedOut;
        private final List<PredicateWithInfo<T>> truePredicates;
        private final List<PredicateWithInfo<T>> falsePredicates;
        private final List<PredicateWithInfo<T>> unknownPredicates;

        SolveResultAny(
                boolean timedOut,
                List<PredicateWithInfo<T>> truePredicates,
                List<PredicateWithInfo<T>> falsePredicates,
                List<PredicateWithInfo<T>> unknownPredicates) {
            this.timedOut = timedOut;
            this.truePredicates = ImmutableList.copyOf(truePredicates);
            this.falsePredicates = ImmutableList.copyOf(falsePredicates);
            this.unknownPredicates = ImmutableList.copyOf(unknownPredicates);
        }

        public boolean timedOut() {
            return timedOut;
        }

        public List<PredicateWithInfo<T>> truePredicates() {
            return truePredicates;
        }

        public List<PredicateWithInfo<T>> falsePredicates() {
            return falsePredicates;
        }

        public List<PredicateWithInfo<T>> unknownPredicates() {
            return unknownPredicates;
        }

        @Override
        public String toString() {
            return String.format("true: %s, false: %s, unknown: %s%s",
                    truePredicates, falsePredicates, unknownPredicates, timedOut ? " (timed out)" : "");
        }
    }

    final class SolveResultAll {
        private final boolean timedOut;
        private final boolean hasSolution;

        SolveResultAll(boolean timedOut, boolean hasSolution) {
            this.timedOut = timedOut;
            this.hasSolution = hasSolution;
        }

        public boolean timedOut() {
            return timedOut;
        }

        public boolean hasSolution() {
            return hasSolution;
        }

        @Override
        public String toString() {
            return timedOut ? "timed out" : hasSolution ? "solution" : "no solution";
        }
    }
}
