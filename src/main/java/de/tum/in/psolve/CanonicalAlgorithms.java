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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Passes of the first iteration. Afterwards, literals are dimensionless, every parameter carries
 * its declared bounds as facts and only canonical operators remain.
 */
final class CanonicalAlgorithms {
    private static final Logger logger = Logger.getLogger(CanonicalAlgorithms.class.getName());

    static final SolverAlgorithm CONSTRAIN_WITHIN_AND_DOMAIN =
            SolverAlgorithm.of("Constrain within and domain", CanonicalAlgorithms::constrainWithinAndDomain);
    static final SolverAlgorithm CANONICAL_LITERAL_FORM =
            SolverAlgorithm.of("Canonical literal form", CanonicalAlgorithms::canonicalLiteralForm);
    static final SolverAlgorithm CANONICAL_EXPRESSION_FORM =
            SolverAlgorithm.of("Canonical expression form", CanonicalAlgorithms::canonicalExpressionForm);

    private static final NumericSet MINUS_ONE = NumericSet.singleton(-1.0d);
    private static final NumericSet ONE_HALF = NumericSet.singleton(0.5d);
    private static final NumericSet HALF_PI = NumericSet.singleton(Math.PI / 2);

    private CanonicalAlgorithms() {}

    static Literal stripUnit(Literal literal) {
        return literal instanceof NumericSet ? ((NumericSet) literal).stripUnit() : literal;
    }

    static void constrainWithinAndDomain(Mutator mutator) {
        for (Parameter parameter : mutator.input().parameters()) {
            Literal within = parameter.within();
            if (within != null) {
                mutator.create(ExpressionBuilder.asserted(Operator.IS_SUBSET, parameter, stripUnit(within)));
            }
            Domain domain = parameter.domain();
            if (domain.kind() == Domain.Kind.NUMBERS && !domain.allowsNegative()) {
                mutator.create(ExpressionBuilder.asserted(Operator.IS_SUBSET, parameter, NumericSet.nonNegative()));
            }
        }
    }

    static void canonicalLiteralForm(Mutator mutator) {
        for (Expression expression : mutator.input().expressions()) {
            boolean changed = false;
            List<Operand> operands = new ArrayList<>(expression.operands().size());
            for (Operand operand : expression.operands()) {
                if (operand instanceof NumericSet && !((NumericSet) operand).unit().isDimensionless()) {
                    operands.add(((NumericSet) operand).stripUnit());
                    changed = true;
                } else {
                    operands.add(operand);
                }
            }
            if (changed) {
                mutator.mutate(expression, ExpressionBuilder.from(expression).withOperands(operands));
            }
        }
    }

    /**
     * Rewrites {@code A - B} to {@code A + (-1 * B)}, {@code A / B} to {@code A * B^-1},
     * {@code sqrt(A)} to {@code A^0.5}, {@code A <= B} to {@code B >= A}, {@code A ⊇ B} to
     * {@code B ⊆ A}, {@code A and B} to {@code not(not A or not B)}, {@code A implies B} to
     * {@code not A or B} and {@code not not A} to {@code A}.
     *
     * <p>{@code A > B} becomes {@code not(B >= A)} and {@code A < B} becomes
     * {@code not(A >= B)}. A constrained strict comparison additionally asserts its non-strict
     * relaxation, which bounds the operands.
     * {@code cos(A)} becomes {@code sin(A + pi/2)} and {@code A xor B} becomes
     * {@code not(not(A or B) or not(not A or not B))}.</p>
     */
    static void canonicalExpressionForm(Mutator mutator) {
        for (Expression expression : mutator.input().expressions()) {
            Operator operator = expression.operator();
            if (operator.isCanonical() && operator != Operator.NOT) {
                continue;
            }
            ExpressionBuilder builder = ExpressionBuilder.from(expression);
            List<Operand> operands = expression.operands();
            switch (operator) {
                case SUBTRACT: {
                    List<Operand> summands = new ArrayList<>(operands.size());
                    summands.add(operands.get(0));
                    for (Operand operand : operands.subList(1, operands.size())) {
                        summands.add(mutator.create(ExpressionBuilder.of(Operator.MULTIPLY, MINUS_ONE, operand)));
                    }
                    mutator.mutate(expression, builder.with(Operator.ADD, summands));
                    break;
                }
                case DIVIDE: {
                    List<Operand> factors = new ArrayList<>(operands.size());
                    factors.add(operands.get(0));
                    for (Operand operand : operands.subList(1, operands.size())) {
                        factors.add(mutator.create(ExpressionBuilder.of(Operator.POWER, operand, MINUS_ONE)));
                    }
                    mutator.mutate(expression, builder.with(Operator.MULTIPLY, factors));
                    break;
                }
                case SQRT:
                    mutator.mutate(expression, builder.with(Operator.POWER, operands.get(0), ONE_HALF));
                    break;
                case LESS_OR_EQUAL:
                    mutator.mutate(expression, builder.with(Operator.GREATER_OR_EQUAL, operands.get(1), operands.get(0)));
                    break;
                case IS_SUPERSET:
                    mutator.mutate(expression, builder.with(Operator.IS_SUBSET, operands.get(1), operands.get(0)));
                    break;
                case AND: {
                    List<Operand> negated = new ArrayList<>(operands.size());
                    for (Operand operand : operands) {
                        negated.add(negate(mutator, operand));
                    }
                    Operand disjunction = mutator.create(ExpressionBuilder.of(Operator.OR, negated));
                    mutator.mutate(expression, builder.with(Operator.NOT, disjunction));
                    break;
                }
                case IMPLIES:
                    mutator.mutate(
                            expression,
                            builder.with(Operator.OR, negate(mutator, operands.get(0)), operands.get(1)));
                    break;
                case GREATER_THAN:
                    strictComparison(mutator, expression, operands.get(0), operands.get(1));
                    break;
                case LESS_THAN:
                    strictComparison(mutator, expression, operands.get(1), operands.get(0));
                    break;
                case COS: {
                    Operand shifted = mutator.create(ExpressionBuilder.of(Operator.ADD, operands.get(0), HALF_PI));
                    mutator.mutate(expression, builder.with(Operator.SIN, shifted));
                    break;
                }
                case XOR: {
                    List<Operand> negated = new ArrayList<>(operands.size());
                    for (Operand operand : operands) {
                        negated.add(negate(mutator, operand));
                    }
                    Operand anyTrue = mutator.create(ExpressionBuilder.of(Operator.OR, operands));
                    Operand anyFalse = mutator.create(ExpressionBuilder.of(Operator.OR, negated));
                    Operand neither = mutator.create(ExpressionBuilder.of(
                            Operator.OR, negate(mutator, anyTrue), negate(mutator, anyFalse)));
                    mutator.mutate(expression, builder.with(Operator.NOT, neither));
                    break;
                }
                case NOT:
                    removeDoubleNegation(mutator, expression);
                    break;
                default:
                    throw new AssertionError(operator);
            }
        }
    }

    private static void strictComparison(Mutator mutator, Expression expression, Operand greater, Operand smaller) {
        if (expression.isConstrained()) {
            mutator.create(ExpressionBuilder.asserted(Operator.GREATER_OR_EQUAL, greater, smaller));
        }
        Operand reversed = mutator.create(ExpressionBuilder.of(Operator.GREATER_OR_EQUAL, smaller, greater));
        mutator.mutate(expression, ExpressionBuilder.from(expression).with(Operator.NOT, reversed));
    }

    private static Operand negate(Mutator mutator, Operand operand) {
        Operand copy = mutator.getCopy(operand);
        if (copy instanceof Expression && ((Expression) copy).operator() == Operator.NOT) {
            return ((Expression) copy).operand(0);
        }
        if (copy instanceof BooleanSet) {
            return ((BooleanSet) copy).not();
        }
        return mutator.create(ExpressionBuilder.of(Operator.NOT, copy));
    }

    private static void removeDoubleNegation(Mutator mutator, Expression expression) {
        Operand inner = mutator.getCopy(expression.operand(0));
        if (!(inner instanceof Expression) || ((Expression) inner).operator() != Operator.NOT) {
            return;
        }
        Operand operand = ((Expression) inner).operand(0);
        if (!expression.isConstrained()) {
            mutator.replace(expression, operand);
            return;
        }
        Operand asserted;
        if (operand instanceof Expression) {
            asserted = mutator.create(ExpressionBuilder.from((Expression) operand).withAsserted(true));
        } else {
            asserted = mutator.create(ExpressionBuilder.asserted(Operator.IS, operand, BooleanSet.TRUE));
        }
        logger.log(Level.FINER, "Removed double negation around {0}", operand);
        mutator.replace(expression, asserted);
    }
}
