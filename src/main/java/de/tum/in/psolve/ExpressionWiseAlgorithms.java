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
import java.util.List;
import javax.annotation.Nullable;

/**
 * Passes which rewrite each expression on its own, looking only at its direct operands.
 */
final class ExpressionWiseAlgorithms {
    static final SolverAlgorithm CONVERT_INEQUALITY_TO_SUBSET =
            SolverAlgorithm.of("Convert inequality with literal to subset", ExpressionWiseAlgorithms::convertInequalityToSubset);
    static final SolverAlgorithm COMPRESS_ASSOCIATIVE =
            SolverAlgorithm.of("Compress associative expressions", ExpressionWiseAlgorithms::compressAssociative);
    static final SolverAlgorithm FOLD_LITERALS =
            SolverAlgorithm.of("Fold literals", ExpressionWiseAlgorithms::foldLiterals);

    private static final NumericSet ZERO = NumericSet.singleton(0.0d);
    private static final NumericSet ONE = NumericSet.singleton(1.0d);

    private ExpressionWiseAlgorithms() {}

    /**
     * {@code x ≥! lit} becomes {@code x ⊆! [max(lit), ∞)} and {@code lit ≥! x} becomes
     * {@code x ⊆! (-∞, min(lit)]}.
     */
    static void convertInequalityToSubset(Mutator mutator) {
        for (Expression expression : mutator.input().expressions()) {
            if (expression.operator() != Operator.GREATER_OR_EQUAL
                    || !expression.isConstrained()
                    || expression.isTerminated()) {
                continue;
            }
            Operand left = expression.operand(0);
            Operand right = expression.operand(1);
            ExpressionBuilder builder = ExpressionBuilder.from(expression);
            if (!left.isLiteral() && right instanceof NumericSet) {
                NumericSet bound = checkBound(expression, (NumericSet) right);
                double lower = bound.max();
                if (lower == Double.POSITIVE_INFINITY) {
                    throw contradiction(expression, bound);
                }
                mutator.mutate(expression, builder.with(Operator.IS_SUBSET, left, NumericSet.atLeast(lower)));
            } else if (left instanceof NumericSet && !right.isLiteral()) {
                NumericSet bound = checkBound(expression, (NumericSet) left);
                double upper = bound.min();
                if (upper == Double.NEGATIVE_INFINITY) {
                    throw contradiction(expression, bound);
                }
                mutator.mutate(expression, builder.with(Operator.IS_SUBSET, right, NumericSet.atMost(upper)));
            }
        }
    }

    private static NumericSet checkBound(Expression expression, NumericSet bound) {
        if (bound.isEmpty()) {
            throw contradiction(expression, bound);
        }
        return bound;
    }

    private static ContradictionByLiteral contradiction(Expression expression, NumericSet bound) {
        return new ContradictionByLiteral(
                String.format("Unsatisfiable inequality %s", expression),
                ImmutableList.of(expression),
                ImmutableList.of(bound));
    }

    /**
     * Flattens unconstrained nested applications of the same associative operator and unpacks
     * unary ones.
     */
    static void compressAssociative(Mutator mutator) {
        for (Expression expression : mutator.input().expressions()) {
            Operator operator = expression.operator();
            if (!operator.isAssociative()) {
                continue;
            }
            if (expression.operands().size() == 1 && !expression.isConstrained()) {
                mutator.replace(expression, expression.operand(0));
                continue;
            }
            List<Operand> flattened = new ArrayList<>();
            if (flatten(expression, operator, flattened)) {
                mutator.mutate(expression, ExpressionBuilder.from(expression).withOperands(flattened));
            }
        }
    }

    private static boolean flatten(Expression expression, Operator operator, List<Operand> flattened) {
        boolean changed = false;
        for (Operand operand : expression.operands()) {
            if (operand instanceof Expression
                    && ((Expression) operand).operator() == operator
                    && !((Expression) operand).isConstrained()) {
                flatten((Expression) operand, operator, flattened);
                changed = true;
            } else {
                flattened.add(operand);
            }
        }
        return changed;
    }

    /**
     * Combines the literal operands of an expression and removes neutral ones.
     */
    static void foldLiterals(Mutator mutator) {
        for (Expression expression : mutator.input().expressions()) {
            if (!expression.hasLiteralOperand() || expression.hasOnlyLiteralOperands()) {
                continue;
            }
            switch (expression.operator()) {
                case ADD:
                    foldVariadic(mutator, expression, ZERO, null);
                    break;
                case MULTIPLY:
                    foldVariadic(mutator, expression, ONE, ZERO);
                    break;
                case OR:
                    foldVariadic(mutator, expression, BooleanSet.FALSE, BooleanSet.TRUE);
                    break;
                case INTERSECTION:
                case UNION:
                    foldVariadic(mutator, expression, null, null);
                    break;
                case POWER:
                    foldPower(mutator, expression);
                    break;
                default:
                    break;
            }
        }
    }

    private static void foldVariadic(
            Mutator mutator, Expression expression, @Nullable Literal identity, @Nullable Literal absorbing) {
        Operator operator = expression.operator();
        List<Operand> operands = new ArrayList<>(expression.operands().size());
        Literal combined = null;
        int literalCount = 0;
        for (Operand operand : expression.operands()) {
            if (operand instanceof Literal) {
                combined = combined == null
                        ? (Literal) operand
                        : operator.fold(ImmutableList.of(combined, (Literal) operand));
                literalCount += 1;
            } else {
                operands.add(operand);
            }
        }
        assert combined != null;
        if (combined.equals(absorbing)) {
            mutator.replace(expression, absorbing);
            return;
        }
        boolean neutral = combined.equals(identity);
        if (literalCount == 1 && !neutral) {
            return;
        }
        if (!neutral) {
            operands.add(combined);
        }
        if (operands.size() == 1 && !expression.isConstrained()) {
            mutator.replace(expression, operands.get(0));
        } else {
            mutator.mutate(expression, ExpressionBuilder.from(expression).withOperands(operands));
        }
    }

    private static void foldPower(Mutator mutator, Expression expression) {
        Operand base = expression.operand(0);
        Operand exponent = expression.operand(1);
        if (exponent instanceof NumericSet && exponent.equals(ONE)) {
            mutator.replace(expression, base);
        } else if (exponent instanceof NumericSet && exponent.equals(ZERO)) {
            mutator.replace(expression, ONE);
        } else if (base instanceof NumericSet && base.equals(ONE)) {
            mutator.replace(expression, ONE);
        }
    }
}
