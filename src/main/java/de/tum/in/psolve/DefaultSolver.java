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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Runs the rewrite passes in a fixpoint loop and answers queries from the simplified graphs.
 */
final class DefaultSolver implements Solver {
    private static final Logger logger = Logger.getLogger(DefaultSolver.class.getName());

    static final List<SolverAlgorithm> PRE_ALGORITHMS = ImmutableList.of(
            CanonicalAlgorithms.CONSTRAIN_WITHIN_AND_DOMAIN,
            CanonicalAlgorithms.CANONICAL_LITERAL_FORM,
            CanonicalAlgorithms.CANONICAL_EXPRESSION_FORM);

    // Order matters: alias resolution has to happen before subsets are merged
    static final List<SolverAlgorithm> ITERATIVE_ALGORITHMS = ImmutableList.of(
            StructuralAlgorithms.REMOVE_UNCONSTRAINED,
            StructuralAlgorithms.CONVERT_ALIASED_SINGLETON_TO_LITERAL,
            StructuralAlgorithms.REMOVE_CONGRUENT_EXPRESSIONS,
            StructuralAlgorithms.RESOLVE_ALIAS_CLASSES,
            ExpressionWiseAlgorithms.CONVERT_INEQUALITY_TO_SUBSET,
            ExpressionWiseAlgorithms.COMPRESS_ASSOCIATIVE,
            ExpressionWiseAlgorithms.FOLD_LITERALS,
            StructuralAlgorithms.ISOLATE_LONE_PARAMETERS,
            StructuralAlgorithms.MERGE_INTERSECTING_SUBSETS,
            StructuralAlgorithms.PREDICATE_LITERAL_DEDUCE,
            StructuralAlgorithms.PREDICATE_UNCONSTRAINED_OPERANDS_DEDUCE,
            StructuralAlgorithms.EMPTY_SET_CONTRADICTION,
            StructuralAlgorithms.TRANSITIVE_SUBSET,
            StructuralAlgorithms.REMOVE_EMPTY_GRAPHS);

    static final List<SolverAlgorithm> SUBSET_DIRTY_ALGORITHMS =
            ImmutableList.of(StructuralAlgorithms.UPPER_ESTIMATION);

    private final SolverConfiguration configuration;
    private final SupersetCache supersetCache = new SupersetCache();

    DefaultSolver(SolverConfiguration configuration) {
        this.configuration = configuration;
    }

    SolverConfiguration configuration() {
        return configuration;
    }

    SupersetCache supersetCache() {
        return supersetCache;
    }

    @Override
    public SimplifyResult phase1SimplifyAnalytically(List<Graph> graphs, ReprContext context) {
        Deadline deadline = Deadline.afterMillis(configuration.timeoutMillis());
        ReprMap total = ReprMap.identity(graphs);
        List<Graph> current = ImmutableList.copyOf(graphs);
        SubsetTracker tracker = new SubsetTracker(graphs);
        boolean anyDirty = false;
        int iteration = 0;

        while (true) {
            deadline.check("iteration " + iteration);
            List<SolverAlgorithm> algorithms = iteration == 0 ? PRE_ALGORITHMS : ITERATIVE_ALGORITHMS;
            boolean dirty = false;
            for (SolverAlgorithm algorithm : algorithms) {
                if (current.isEmpty()) {
                    break;
                }
                Mutators.Result result = runAlgorithm(algorithm, current, context);
                total = Mutators.createConcatReprMap(total, result.reprMap());
                current = result.graphs();
                dirty |= result.isDirty();
            }

            boolean subsetDirty = tracker.update(total);
            if (iteration > 0 && (iteration == 1 || subsetDirty)) {
                for (SolverAlgorithm algorithm : SUBSET_DIRTY_ALGORITHMS) {
                    if (current.isEmpty()) {
                        break;
                    }
                    Mutators.Result result = runAlgorithm(algorithm, current, context);
                    total = Mutators.createConcatReprMap(total, result.reprMap());
                    current = result.graphs();
                    dirty |= result.isDirty();
                }
                tracker.update(total);
            }

            anyDirty |= dirty;
            logger.log(Level.FINE, "Iteration {0}: {1} graph(s), dirty: {2}",
                    new Object[] {iteration, current.size(), dirty});
            if (current.isEmpty() || (iteration > 0 && !dirty)) {
                break;
            }
            if (iteration >= configuration.maxIterations()) {
                throw new IterationLimitExceededException(iteration);
            }
            iteration += 1;
        }
        return new SimplifyResult(total, context, current, anyDirty, iteration);
    }

    private Mutators.Result runAlgorithm(SolverAlgorithm algorithm, List<Graph> graphs, ReprContext context) {
        Mutators mutators = new Mutators(graphs, context, configuration.verboseSymbolicLogging());
        mutators.run(algorithm);
        Mutators.Result result = mutators.close();
        if (result.isDirty()) {
            logger.log(Level.FINER, "{0} changed the graphs", algorithm.name());
        }
        return result;
    }

    @Override
    public Literal inspectGetKnownSupersets(Parameter parameter, boolean forceUpdate) {
        Graph graph = parameter.graph();
        for (Expression parent : graph.operations(parameter)) {
            Literal value = Graph.factLiteral(parent, parameter, false);
            if (value != null) {
                return inBaseUnit(parameter, value);
            }
        }

        int fingerprint = SupersetCache.fingerprint(graph);
        if (configuration.useSupersetCache()) {
            if (forceUpdate) {
                supersetCache.invalidate(parameter);
            } else {
                Literal cached = supersetCache.get(parameter, fingerprint);
                if (cached != null) {
                    return cached;
                }
            }
        }

        SimplifyResult result = phase1SimplifyAnalytically(ImmutableList.of(graph), new ReprContext());
        Literal superset = null;
        for (Parameter sibling : graph.parameters()) {
            Literal known = knownSuperset(result.reprMap(), sibling);
            if (configuration.useSupersetCache()) {
                supersetCache.put(sibling, fingerprint, known);
            }
            if (sibling == parameter) {
                superset = known;
            }
        }
        assert superset != null;
        return superset;
    }

    private static Literal knownSuperset(ReprMap reprMap, Parameter parameter) {
        Literal known = reprMap.tryGetLiteral(parameter, true);
        return inBaseUnit(parameter, known == null ? parameter.domain().domainSet() : known);
    }

    private static Literal inBaseUnit(Parameter parameter, Literal superset) {
        if (superset instanceof NumericSet) {
            return ((NumericSet) superset).withUnit(parameter.unit().base());
        }
        return superset;
    }

    @Override
    public <T> SolveResultAny<T> assertAnyPredicate(
            List<PredicateWithInfo<T>> predicates,
            boolean lock,
            @Nullable Expression supposeConstraint,
            @Nullable Operand minimize) {
        checkSupported(supposeConstraint, minimize);

        List<PredicateWithInfo<T>> truePredicates = new ArrayList<>();
        List<PredicateWithInfo<T>> falsePredicates = new ArrayList<>();
        List<PredicateWithInfo<T>> unknownPredicates = new ArrayList<>();
        Map<Graph, Map<Parameter, Literal>> baselines = new HashMap<>();
        boolean timedOut = false;

        int index = 0;
        while (index < predicates.size() && truePredicates.isEmpty()) {
            PredicateWithInfo<T> candidate = predicates.get(index);
            index += 1;
            BooleanSet verdict;
            try {
                verdict = tryPredicate(candidate.predicate(), baselines);
            } catch (SolverTimeoutException e) {
                logger.log(traceLevel(), "Timed out on {0}: {1}", new Object[] {candidate, e.getMessage()});
                timedOut = true;
                verdict = BooleanSet.BOTH;
            }
            logger.log(traceLevel(), "Predicate {0} is {1}", new Object[] {candidate, verdict});
            if (verdict == BooleanSet.TRUE) {
                truePredicates.add(candidate);
            } else if (verdict == BooleanSet.FALSE) {
                falsePredicates.add(candidate);
            } else {
                unknownPredicates.add(candidate);
            }
        }

        if (index < predicates.size()) {
            logger.log(Level.WARNING, "Stopped at the first true predicate, {0} candidate(s) were not tried",
                    predicates.size() - index);
            unknownPredicates.addAll(predicates.subList(index, predicates.size()));
        }
        if (lock && !truePredicates.isEmpty()) {
            truePredicates.get(0).predicate().constrain();
        }
        return new SolveResultAny<>(timedOut, truePredicates, falsePredicates, unknownPredicates);
    }

    /**
     * Simplifies the graph of the predicate with the predicate constrained. Returns {@code TRUE}
     * if it was deduced, {@code FALSE} on contradiction and {@code BOTH} otherwise.
     */
    private BooleanSet tryPredicate(Expression predicate, Map<Graph, Map<Parameter, Literal>> baselines) {
        Graph graph = predicate.graph();
        List<Expression> known = new ArrayList<>();
        for (Expression expression : graph.expressions()) {
            if (expression != predicate && expression.isConstrained()) {
                known.add(expression);
            }
        }

        boolean wasConstrained = predicate.isConstrained();
        SimplifyResult result;
        predicate.constrain();
        try {
            result = phase1SimplifyAnalytically(ImmutableList.of(graph), new ReprContext());
        } catch (Contradiction e) {
            logger.log(Level.FINE, "Contradiction for {0}: {1}", new Object[] {predicate, e.getMessage()});
            return BooleanSet.FALSE;
        } finally {
            if (!wasConstrained) {
                predicate.unconstrain();
            }
        }

        ReprMap reprMap = result.reprMap();
        Operand image = reprMap.map(predicate);
        if (image == BooleanSet.TRUE) {
            return BooleanSet.TRUE;
        }
        if (!(image instanceof Expression)) {
            return BooleanSet.BOTH;
        }
        boolean merged = false;
        for (Expression expression : known) {
            if (reprMap.map(expression) == image) {
                merged = true;
                break;
            }
        }
        if (!merged) {
            return BooleanSet.BOTH;
        }

        Map<Parameter, Literal> baseline;
        if (baselines.containsKey(graph)) {
            baseline = baselines.get(graph);
        } else {
            baseline = baseline(graph);
            baselines.put(graph, baseline);
        }
        if (baseline == null) {
            return BooleanSet.BOTH;
        }
        for (Parameter parameter : graph.parameters()) {
            if (!Objects.equals(reprMap.tryGetLiteral(parameter, true), baseline.get(parameter))) {
                return BooleanSet.BOTH;
            }
        }
        return BooleanSet.TRUE;
    }

    @Nullable
    private Map<Parameter, Literal> baseline(Graph graph) {
        SimplifyResult result;
        try {
            result = phase1SimplifyAnalytically(ImmutableList.of(graph), new ReprContext());
        } catch (Contradiction e) {
            logger.log(Level.FINE, "Graph {0} is unsatisfiable on its own", graph);
            return null;
        }
        Map<Parameter, Literal> supersets = new HashMap<>();
        for (Parameter parameter : graph.parameters()) {
            supersets.put(parameter, result.reprMap().tryGetLiteral(parameter, true));
        }
        return supersets;
    }

    @Override
    public Literal getAnySingle(
            Parameter parameter, boolean lock, @Nullable Expression supposeConstraint, @Nullable Operand minimize) {
        checkSupported(supposeConstraint, minimize);
        Literal value = pick(parameter, inspectGetKnownSupersets(parameter));
        if (lock) {
            parameter.graph().assertExpression(Operator.IS, parameter, value);
        }
        logger.log(traceLevel(), "Picked {0} for {1}{2}", new Object[] {value, parameter, lock ? " (locked)" : ""});
        return value;
    }

    @Override
    public SolveResultAll findAndLockSolution(Graph graph) {
        try {
            phase1SimplifyAnalytically(ImmutableList.of(graph), new ReprContext());
        } catch (Contradiction e) {
            logger.log(traceLevel(), "No solution: {0}", e.getMessage());
            return new SolveResultAll(false, false);
        } catch (SolverTimeoutException e) {
            return new SolveResultAll(true, false);
        }

        for (Parameter parameter : ImmutableList.copyOf(graph.parameters())) {
            Expression lock;
            try {
                Literal value = pick(parameter, inspectGetKnownSupersets(parameter));
                lock = graph.assertExpression(Operator.IS, parameter, value);
            } catch (Contradiction e) {
                logger.log(traceLevel(), "No value for {0}: {1}", new Object[] {parameter, e.getMessage()});
                return new SolveResultAll(false, false);
            } catch (SolverTimeoutException e) {
                return new SolveResultAll(true, false);
            }
            logger.log(traceLevel(), "Locked {0}", lock);

            try {
                phase1SimplifyAnalytically(ImmutableList.of(graph), new ReprContext());
            } catch (Contradiction e) {
                logger.log(traceLevel(), "Lock {0} is inconsistent: {1}", new Object[] {lock, e.getMessage()});
                lock.unconstrain();
                return new SolveResultAll(false, false);
            } catch (SolverTimeoutException e) {
                lock.unconstrain();
                return new SolveResultAll(true, false);
            }
        }
        return new SolveResultAll(false, true);
    }

    /**
     * Picks a member of the superset: the smallest finite one (rounded up for integer domains),
     * otherwise the largest finite one, otherwise zero.
     */
    static Literal pick(Parameter parameter, Literal superset) {
        if (superset.isEmpty()) {
            throw new ContradictionByLiteral(
                    String.format("Empty superset for %s", parameter),
                    ImmutableList.of(parameter),
                    ImmutableList.of(superset));
        }
        if (superset instanceof BooleanSet) {
            return BooleanSet.of(((BooleanSet) superset).anyElement());
        }
        if (superset instanceof DiscreteSet) {
            DiscreteSet set = (DiscreteSet) superset;
            return DiscreteSet.of(set.domainName(), set.anyElement());
        }
        NumericSet set = (NumericSet) superset;
        boolean integer = parameter.domain().isInteger();
        for (int i = 0; i < set.intervalCount(); i++) {
            double lower = set.lower(i);
            if (Double.isInfinite(lower)) {
                continue;
            }
            double value = integer ? Math.ceil(lower) : lower;
            if (value <= set.upper(i)) {
                return NumericSet.singleton(value).withUnit(set.unit());
            }
        }
        for (int i = set.intervalCount() - 1; i >= 0; i--) {
            double upper = set.upper(i);
            if (Double.isInfinite(upper)) {
                continue;
            }
            double value = integer ? Math.floor(upper) : upper;
            if (value >= set.lower(i)) {
                return NumericSet.singleton(value).withUnit(set.unit());
            }
        }
        if (set.contains(0.0d)) {
            return NumericSet.singleton(0.0d).withUnit(set.unit());
        }
        throw new ContradictionByLiteral(
                String.format("No %s value in %s for %s", integer ? "integer" : "finite", set, parameter),
                ImmutableList.of(parameter),
                ImmutableList.of(superset));
    }

    private Level traceLevel() {
        return configuration.tracePickAndSolve() ? Level.INFO : Level.FINE;
    }

    private static void checkSupported(@Nullable Expression supposeConstraint, @Nullable Operand minimize) {
        if (supposeConstraint != null) {
            throw new UnsupportedOperationException("supposeConstraint is not supported");
        }
        if (minimize != null) {
            throw new UnsupportedOperationException("minimize is not supported");
        }
    }
}
