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
import java.util.Arrays;
import java.util.List;

/**
 * A proposed expression which has not been inserted into a graph yet.
 */
final class ExpressionBuilder {
    private final Operator operator;
    private final ImmutableList<Operand> operands;
    private final boolean asserted;
    private final boolean terminated;

    private ExpressionBuilder(Operator operator, List<? extends Operand> operands, boolean asserted, boolean terminated) {
        operator.checkArity(operands.size());
        Util.checkArgument(!asserted || operator.isPredicate(), "Cannot assert %s expression", operator);
        this.operator = operator;
        this.operands = ImmutableList.copyOf(operands);
        this.asserted = asserted;
        this.terminated = terminated;
    }

    static ExpressionBuilder of(Operator operator, Operand... operands) {
        return new ExpressionBuilder(operator, Arrays.asList(operands), false, false);
    }

    static ExpressionBuilder of(Operator operator, List<? extends Operand> operands) {
        return new ExpressionBuilder(operator, operands, false, false);
    }

    static ExpressionBuilder asserted(Operator operator, Operand... operands) {
        return new ExpressionBuilder(operator, Arrays.asList(operands), true, false);
    }

    /**
     * A builder with the operator, operands and flags of the given expression.
     */
    static ExpressionBuilder from(Expression expression) {
        return new ExpressionBuilder(
                expression.operator(), expression.operands(), expression.isConstrained(), expression.isTerminated());
    }

    Operator operator() {
        return operator;
    }

    ImmutableList<Operand> operands() {
        return operands;
    }

    Operand operand(int index) {
        return operands.get(index);
    }

    boolean isAsserted() {
        return asserted;
    }

    boolean isTerminated() {
        return terminated;
    }

    /**
     * Keeps the flags, replaces operator and operands.
     */
    ExpressionBuilder with(Operator newOperator, List<? extends Operand> newOperands) {
        return new ExpressionBuilder(newOperator, newOperands, asserted, terminated);
    }

    ExpressionBuilder with(Operator newOperator, Operand... newOperands) {
        return with(newOperator, Arrays.asList(newOperands));
    }

    ExpressionBuilder withOperator(Operator newOperator) {
        return new ExpressionBuilder(newOperator, operands, asserted, terminated);
    }

    ExpressionBuilder withOperands(List<? extends Operand> newOperands) {
        return new ExpressionBuilder(operator, newOperands, asserted, terminated);
    }

    ExpressionBuilder withOperands(Operand... newOperands) {
        return withOperands(Arrays.asList(newOperands));
    }

    ExpressionBuilder withAsserted(boolean newAsserted) {
        return new ExpressionBuilder(operator, operands, newAsserted, terminated);
    }

    ExpressionBuilder withTerminated(boolean newTerminated) {
        return new ExpressionBuilder(operator, operands, asserted, newTerminated);
    }

    boolean hasOnlyLiteralOperands() {
        for (Operand operand : operands) {
            if (!operand.isLiteral()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return operator + (terminated ? "!!" : asserted ? "!" : "") + operands;
    }
}
