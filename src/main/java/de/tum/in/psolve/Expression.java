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
import java.util.stream.Collectors;

/**
 * An operator applied to an ordered list of operands. Boolean-valued expressions may be
 * constrained, i.e. asserted to hold.
 */
public final class Expression extends ParameterOperatable {
    private final Operator operator;
    private final ImmutableList<Operand> operands;
    private final int depth;
    private boolean constrained;
    private boolean terminated;

    Expression(Graph graph, int id, Operator operator, ImmutableList<Operand> operands) {
        super(graph, id);
        this.operator = operator;
        this.operands = operands;
        int maxDepth = 0;
        for (Operand operand : operands) {
            maxDepth = Math.max(maxDepth, operand.depth());
        }
        this.depth = maxDepth + 1;
    }

    public Operator operator() {
        return operator;
    }

    public ImmutableList<Operand> operands() {
        return operands;
    }

    public Operand operand(int index) {
        return operands.get(index);
    }

    public boolean isPredicate() {
        return operator.isPredicate();
    }

    public boolean isConstrained() {
        return constrained;
    }

    /**
     * Whether solving has settled this predicate and no further work on it is needed.
     */
    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Asserts this predicate.
     */
    public void constrain() {
        Util.checkArgument(operator.isPredicate(), "Cannot constrain %s expression", operator);
        constrained = true;
    }

    void unconstrain() {
        constrained = false;
    }

    void terminate() {
        terminated = true;
    }

    boolean hasLiteralOperand() {
        for (Operand operand : operands) {
            if (operand.isLiteral()) {
                return true;
            }
        }
        return false;
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
    public int depth() {
        return depth;
    }

    @Override
    public String toString() {
        String suffix = terminated ? "!!" : constrained ? "!" : "";
        return operator.name() + suffix
                + operands.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
