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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * The gate every new expression passes through. It folds literal-only expressions, reuses
 * congruent expressions, merges subsumed predicates and rejects empty supersets, so that a graph
 * built only through this gate never holds two congruent expressions or two literal bounds of
 * the same node.
 */
final class Invariants {
    private static final Logger logger = Logger.getLogger(Invariants.class.getName());

    private Invariants() {}

    static final class InsertResult {
        private final Operand operand;
        private final boolean isNew;

        InsertResult(Operand operand, boolean isNew) {
            this.operand = operand;
            this.isNew = isNew;
        }

        /**
         * The node or literal representing the proposed expression.
         */
        Operand operand() {
            return operand;
        }

        boolean isNew() {
            return isNew;
        }

        @Override
        public String toString() {
            return (isNew ? "new " : "existing ") + operand;
        }
    }

    static InsertResult insertExpression(Mutator mutator, ExpressionBuilder proposed) {
        ExpressionBuilder builder = normalize(resolveOperands(mutator, proposed));

        // Pure literal fold
        if (builder.hasOnlyLiteralOperands()) {
            return foldLiterals(builder);
        }
        if (isReflexive(builder)) {
            return new InsertResult(BooleanSet.TRUE, false);
        }
        if (builder.isAsserted() && builder.operator() == Operator.OR) {
            ExpressionBuilder filtered = filterAssertedOr(builder);
            if (filtered == null) {
                return new InsertResult(BooleanSet.TRUE, false);
            }
            builder = filtered;
        }

        Expression congruent = findCongruentExpression(mutator, builder);
        if (congruent != null) {
            if (builder.isAsserted()) {
                congruent.constrain();
                if (builder.isTerminated()) {
                    congruent.terminate();
                }
            }
            return new InsertResult(congruent, false);
        }

        if (builder.isAsserted()) {
            InsertResult subsumed = checkSubsumption(mutator, builder);
            if (subsumed != null) {
                return subsumed;
            }
        }

        checkNoEmptySuperset(builder);

        Expression created = mutator.staging()
                .addExpression(builder.operator(), builder.operands(), builder.isAsserted(), builder.isTerminated());
        if (logger.isLoggable(Level.FINEST)) {
            logger.log(Level.FINEST, "{0}: created {1}", new Object[] {mutator.algorithm(), created});
        }
        return new InsertResult(created, true);
    }

    private static ExpressionBuilder resolveOperands(Mutator mutator, ExpressionBuilder builder) {
        List<Operand> operands = new ArrayList<>(builder.operands().size());
        for (Operand operand : builder.operands()) {
            Operand resolved = mutator.resolve(operand);
            if (resolved instanceof ParameterOperatable) {
                Util.checkArgument(
                        ((ParameterOperatable) resolved).graph() == mutator.staging(),
                        "Operand %s is not part of the output graph",
                        resolved);
            }
            operands.add(resolved);
        }
        return builder.withOperands(operands);
    }

    private static ExpressionBuilder normalize(ExpressionBuilder builder) {
        ExpressionBuilder result = builder;
        if (result.operator().isIdempotent()) {
            Set<Operand> unique = new LinkedHashSet<>(result.operands());
            if (unique.size() < result.operands().size()) {
                result = result.withOperands(ImmutableList.copyOf(unique));
            }
        }
        if (result.operator() == Operator.IS_SUBSET
                && result.isAsserted()
                && !result.operand(0).isLiteral()
                && result.operand(1) instanceof Literal
                && ((Literal) result.operand(1)).isSingleton()) {
            result = result.withOperator(Operator.IS);
        }
        if (result.operator() == Operator.IS) {
            if (result.operand(0).isLiteral() && !result.operand(1).isLiteral()) {
                result = result.withOperands(result.operand(1), result.operand(0));
            }
            if (result.isAsserted()
                    && result.operand(1) instanceof Literal
                    && !result.operand(0).isLiteral()
                    && !((Literal) result.operand(1)).isSingleton()) {
                result = result.withOperator(Operator.IS_SUBSET);
            }
        }
        return result;
    }

    private static InsertResult foldLiterals(ExpressionBuilder builder) {
        List<Literal> literals = new ArrayList<>(builder.operands().size());
        for (Operand operand : builder.operands()) {
            literals.add((Literal) operand);
        }
        Literal value = builder.operator().fold(literals);
        if (!builder.isAsserted()) {
            return new InsertResult(value, false);
        }
        if (!((BooleanSet) value).containsTrue()) {
            throw new ContradictionByLiteral(
                    String.format("%s%s evaluates to %s", builder.operator(), literals, value),
                    ImmutableList.of(),
                    literals);
        }
        return new InsertResult(BooleanSet.TRUE, false);
    }

    private static boolean isReflexive(ExpressionBuilder builder) {
        switch (builder.operator()) {
            case IS:
            case IS_SUBSET:
            case GREATER_OR_EQUAL:
                return !builder.operand(0).isLiteral() && builder.operand(0) == builder.operand(1);
            default:
                return false;
        }
    }

    /**
     * Drops {@code false} from an asserted disjunction. Returns {@code null} if a disjunct is
     * literally {@code true}.
     */
    @Nullable
    private static ExpressionBuilder filterAssertedOr(ExpressionBuilder builder) {
        List<Operand> operands = new ArrayList<>(builder.operands().size());
        for (Operand operand : builder.operands()) {
            if (operand == BooleanSet.TRUE) {
                return null;
            }
            if (operand != BooleanSet.FALSE) {
                operands.add(operand);
            }
        }
        if (operands.size() == builder.operands().size()) {
            return builder;
        }
        if (operands.isEmpty()) {
            throw new ContradictionByLiteral(
                    "Asserted disjunction of false", ImmutableList.of(), ImmutableList.of(BooleanSet.FALSE));
        }
        return builder.withOperands(operands);
    }

    @Nullable
    private static Expression findCongruentExpression(Mutator mutator, ExpressionBuilder builder) {
        ParameterOperatable anchor = firstNode(builder.operands());
        for (Expression candidate : mutator.candidates(builder.operator(), anchor)) {
            if (isCongruent(candidate, builder)) {
                return candidate;
            }
        }
        return null;
    }

    static boolean isCongruent(Expression candidate, ExpressionBuilder builder) {
        Operator operator = builder.operator();
        if (candidate.operator() != operator || candidate.operands().size() != builder.operands().size()) {
            return false;
        }
        // Two literal sets stand for the same unknown member only when they are compared as sets
        boolean allowUncorrelated = operator.isSetic() || (builder.isAsserted() && candidate.isConstrained());
        List<Operand> operands = builder.operands();
        if (!operator.isCommutative()) {
            for (int i = 0; i < operands.size(); i++) {
                if (!operandsMatch(candidate.operand(i), operands.get(i), allowUncorrelated)) {
                    return false;
                }
            }
            return true;
        }
        boolean[] used = new boolean[operands.size()];
        for (Operand operand : candidate.operands()) {
            boolean found = false;
            for (int i = 0; i < operands.size(); i++) {
                if (!used[i] && operandsMatch(operand, operands.get(i), allowUncorrelated)) {
                    used[i] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    private static boolean operandsMatch(Operand first, Operand second, boolean allowUncorrelated) {
        if (first instanceof Literal && second instanceof Literal) {
            return first.equals(second) && (allowUncorrelated || ((Literal) first).isSingleton());
        }
        return first == second;
    }

    @Nullable
    private static InsertResult checkSubsumption(Mutator mutator, ExpressionBuilder builder) {
        switch (builder.operator()) {
            case IS:
            case IS_SUBSET:
                if (isSupersetFact(builder)) {
                    return mergeSupersets(mutator, builder);
                }
                if (isSubsetFact(builder)) {
                    return mergeSubsets(mutator, builder);
                }
                return null;
            case OR:
                return subsumeDisjunction(mutator, builder);
            default:
                return null;
        }
    }

    private static boolean isSupersetFact(ExpressionBuilder builder) {
        if (builder.operand(0).isLiteral() || !builder.operand(1).isLiteral()) {
            return false;
        }
        return builder.operator() == Operator.IS_SUBSET || ((Literal) builder.operand(1)).isSingleton();
    }

    private static boolean isSubsetFact(ExpressionBuilder builder) {
        return builder.operator() == Operator.IS_SUBSET
                && builder.operand(0).isLiteral()
                && !builder.operand(1).isLiteral();
    }

    /**
     * Intersects the bound with the existing bounds of the same node. Either the tightest
     * existing fact is reused, or all existing facts are forwarded to a new merged fact.
     */
    @Nullable
    private static InsertResult mergeSupersets(Mutator mutator, ExpressionBuilder builder) {
        ParameterOperatable subject = (ParameterOperatable) builder.operand(0);
        // Copying pending input facts may merge earlier candidates, hence the liveness check
        List<Expression> candidates = new ArrayList<>(mutator.candidates(Operator.IS_SUBSET, subject));
        candidates.addAll(mutator.candidates(Operator.IS, subject));
        List<Expression> facts = new ArrayList<>();
        for (Expression candidate : candidates) {
            if (mutator.isLive(candidate)
                    && candidate.isConstrained()
                    && candidate.operand(0) == subject
                    && candidate.operand(1) instanceof Literal
                    && (candidate.operator() == Operator.IS_SUBSET
                            || ((Literal) candidate.operand(1)).isSingleton())) {
                facts.add(candidate);
            }
        }
        if (facts.isEmpty()) {
            return null;
        }

        List<Literal> literals = new ArrayList<>();
        Literal merged = (Literal) builder.operand(1);
        literals.add(merged);
        for (Expression fact : facts) {
            Literal literal = (Literal) fact.operand(1);
            literals.add(literal);
            merged = merged.intersect(literal);
        }
        if (merged.isEmpty()) {
            throw new ContradictionByLiteral(
                    String.format("Empty superset for %s", subject), ImmutableList.of(subject), literals);
        }
        return reuseOrMerge(mutator, builder, subject, merged, facts, true);
    }

    @Nullable
    private static InsertResult mergeSubsets(Mutator mutator, ExpressionBuilder builder) {
        ParameterOperatable subject = (ParameterOperatable) builder.operand(1);
        List<Expression> facts = new ArrayList<>();
        for (Expression candidate : mutator.candidates(Operator.IS_SUBSET, subject)) {
            if (candidate.isConstrained() && candidate.operand(1) == subject && candidate.operand(0).isLiteral()) {
                facts.add(candidate);
            }
        }
        if (facts.isEmpty()) {
            return null;
        }
        Literal merged = (Literal) builder.operand(0);
        for (Expression fact : facts) {
            merged = merged.union((Literal) fact.operand(0));
        }
        return reuseOrMerge(mutator, builder, subject, merged, facts, false);
    }

    private static InsertResult reuseOrMerge(
            Mutator mutator,
            ExpressionBuilder builder,
            ParameterOperatable subject,
            Literal merged,
            List<Expression> facts,
            boolean superset) {
        Operator mergedOperator = superset && merged.isSingleton() ? Operator.IS : Operator.IS_SUBSET;
        Expression tightest = null;
        boolean allTerminated = builder.isTerminated();
        for (Expression fact : facts) {
            Literal literal = (Literal) fact.operand(superset ? 1 : 0);
            if (tightest == null && fact.operator() == mergedOperator && literal.equals(merged)) {
                tightest = fact;
            }
            allTerminated &= fact.isTerminated();
        }
        if (tightest != null) {
            for (Expression fact : facts) {
                if (fact != tightest) {
                    mutator.forward(fact, tightest);
                }
            }
            return new InsertResult(tightest, false);
        }

        List<Operand> operands = superset
                ? ImmutableList.<Operand>of(subject, merged)
                : ImmutableList.<Operand>of(merged, subject);
        Expression created = mutator.staging().addExpression(mergedOperator, operands, true, allTerminated);
        for (Expression fact : facts) {
            mutator.forward(fact, created);
        }
        logger.log(Level.FINER, "{0}: merged {1} bounds of {2} into {3}",
                new Object[] {mutator.algorithm(), facts.size() + 1, subject, merged});
        return new InsertResult(created, true);
    }

    /**
     * An asserted disjunction is implied by any asserted disjunction over a subset of its
     * operands and implies those over a superset.
     */
    @Nullable
    private static InsertResult subsumeDisjunction(Mutator mutator, ExpressionBuilder builder) {
        Set<Operand> operands = new LinkedHashSet<>(builder.operands());
        Set<Expression> existing = new LinkedHashSet<>();
        for (Operand operand : operands) {
            if (operand instanceof ParameterOperatable) {
                for (Expression candidate : mutator.candidates(Operator.OR, (ParameterOperatable) operand)) {
                    if (candidate.isConstrained()) {
                        existing.add(candidate);
                    }
                }
            }
        }
        List<Expression> implied = new ArrayList<>();
        for (Expression candidate : existing) {
            Set<Operand> candidateOperands = new LinkedHashSet<>(candidate.operands());
            if (operands.containsAll(candidateOperands)) {
                return new InsertResult(candidate, false);
            }
            if (candidateOperands.containsAll(operands)) {
                implied.add(candidate);
            }
        }
        if (implied.isEmpty()) {
            return null;
        }
        Expression created = mutator.staging()
                .addExpression(Operator.OR, builder.operands(), true, builder.isTerminated());
        for (Expression candidate : implied) {
            mutator.forward(candidate, created);
        }
        return new InsertResult(created, true);
    }

    private static void checkNoEmptySuperset(ExpressionBuilder builder) {
        if (builder.isAsserted() && builder.operator() == Operator.IS_SUBSET && isSupersetFact(builder)) {
            Literal superset = (Literal) builder.operand(1);
            if (superset.isEmpty()) {
                throw new ContradictionByLiteral(
                        String.format("Empty superset for %s", builder.operand(0)),
                        ImmutableList.of(builder.operand(0)),
                        ImmutableList.of(superset));
            }
        }
    }

    private static ParameterOperatable firstNode(List<Operand> operands) {
        for (Operand operand : operands) {
            if (operand instanceof ParameterOperatable) {
                return (ParameterOperatable) operand;
            }
        }
        throw new IllegalArgumentException("No node among " + operands);
    }
}
