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

import java.util.List;

/**
 * The closed set of expression operators. Only the {@link #isCanonical() canonical} operators
 * survive the first simplification iteration.
 */
public enum Operator {
    ADD("+", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.ASSOCIATIVE | Flags.CANONICAL),
    SUBTRACT("-", Flags.VARIADIC, 0),
    MULTIPLY("*", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.ASSOCIATIVE | Flags.CANONICAL),
    DIVIDE("/", Flags.VARIADIC, 0),
    POWER("^", 2, Flags.CANONICAL),
    SQRT("√", 1, 0),
    ABS("abs", 1, Flags.CANONICAL),
    ROUND("round", 1, Flags.CANONICAL),
    FLOOR("floor", 1, Flags.CANONICAL),
    CEIL("ceil", 1, Flags.CANONICAL),
    SIN("sin", 1, Flags.CANONICAL),
    COS("cos", 1, 0),
    LOG("log", 1, Flags.CANONICAL),
    OR("∨", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.ASSOCIATIVE | Flags.IDEMPOTENT | Flags.BOOLEAN | Flags.CANONICAL),
    AND("∧", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.ASSOCIATIVE | Flags.IDEMPOTENT | Flags.BOOLEAN),
    NOT("¬", 1, Flags.BOOLEAN | Flags.CANONICAL),
    IMPLIES("→", 2, Flags.BOOLEAN),
    XOR("⊕", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.BOOLEAN),
    INTERSECTION("∩", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.ASSOCIATIVE | Flags.IDEMPOTENT | Flags.SETIC | Flags.CANONICAL),
    UNION("∪", Flags.VARIADIC, Flags.COMMUTATIVE | Flags.ASSOCIATIVE | Flags.IDEMPOTENT | Flags.SETIC | Flags.CANONICAL),
    IS("is", 2, Flags.COMMUTATIVE | Flags.BOOLEAN | Flags.CANONICAL),
    IS_SUBSET("⊆", 2, Flags.BOOLEAN | Flags.SETIC | Flags.CANONICAL),
    IS_SUPERSET("⊇", 2, Flags.BOOLEAN | Flags.SETIC),
    GREATER_OR_EQUAL("≥", 2, Flags.BOOLEAN | Flags.CANONICAL),
    LESS_OR_EQUAL("≤", 2, Flags.BOOLEAN),
    GREATER_THAN(">", 2, Flags.BOOLEAN),
    LESS_THAN("<", 2, Flags.BOOLEAN);

    public static final int VARIADIC = Flags.VARIADIC;

    private final String symbol;
    private final int arity;
    private final int flags;

    Operator(String symbol, int arity, int flags) {
        this.symbol = symbol;
        this.arity = arity;
        this.flags = flags;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Number of operands, or {@link #VARIADIC}.
     */
    public int arity() {
        return arity;
    }

    public boolean isCommutative() {
        return (flags & Flags.COMMUTATIVE) != 0;
    }

    public boolean isAssociative() {
        return (flags & Flags.ASSOCIATIVE) != 0;
    }

    /**
     * {@code op(a, a, b) = op(a, b)}.
     */
    public boolean isIdempotent() {
        return (flags & Flags.IDEMPOTENT) != 0;
    }

    /**
     * Whether the operator yields a truth value. Only such expressions can be constrained.
     */
    public boolean isPredicate() {
        return (flags & Flags.BOOLEAN) != 0;
    }

    /**
     * Whether literal operands are compared as whole sets rather than as unknown members.
     */
    public boolean isSetic() {
        return (flags & Flags.SETIC) != 0;
    }

    public boolean isCanonical() {
        return (flags & Flags.CANONICAL) != 0;
    }

    void checkArity(int operandCount) {
        if (arity == VARIADIC) {
            Util.checkArgument(operandCount >= 1, "%s needs at least one operand", this);
        } else {
            Util.checkArgument(operandCount == arity, "%s needs %d operands, got %d", this, arity, operandCount);
        }
    }

    /**
     * Evaluates this operator on exact literal operands.
     */
    public Literal fold(List<? extends Literal> operands) {
        checkArity(operands.size());
        switch (this) {
            case ADD:
                return reduceNumeric(operands, NumericSet::add);
            case SUBTRACT: {
                NumericSet result = numeric(operands.get(0));
                for (int i = 1; i < operands.size(); i++) {
                    result = result.add(numeric(operands.get(i)).negate());
                }
                return result;
            }
            case MULTIPLY:
                return reduceNumeric(operands, NumericSet::multiply);
            case DIVIDE: {
                NumericSet result = numeric(operands.get(0));
                for (int i = 1; i < operands.size(); i++) {
                    result = result.multiply(numeric(operands.get(i)).reciprocal());
                }
                return result;
            }
            case POWER:
                return numeric(operands.get(0)).power(numeric(operands.get(1)));
            case SQRT:
                return numeric(operands.get(0)).power(NumericSet.singleton(0.5d));
            case ABS:
                return numeric(operands.get(0)).abs();
            case ROUND:
                return numeric(operands.get(0)).round();
            case FLOOR:
                return numeric(operands.get(0)).floor();
            case CEIL:
                return numeric(operands.get(0)).ceil();
            case SIN:
                return numeric(operands.get(0)).sin();
            case COS:
                return numeric(operands.get(0)).add(NumericSet.singleton(Math.PI / 2)).sin();
            case LOG:
                return numeric(operands.get(0)).log();
            case OR: {
                BooleanSet result = BooleanSet.FALSE;
                for (Literal operand : operands) {
                    result = result.or(bool(operand));
                }
                return result;
            }
            case AND: {
                BooleanSet result = BooleanSet.TRUE;
                for (Literal operand : operands) {
                    result = result.and(bool(operand));
                }
                return result;
            }
            case NOT:
                return bool(operands.get(0)).not();
            case IMPLIES:
                return bool(operands.get(0)).not().or(bool(operands.get(1)));
            case XOR: {
                // Some operand is true and some operand is false
                BooleanSet anyTrue = BooleanSet.FALSE;
                BooleanSet anyFalse = BooleanSet.FALSE;
                for (Literal operand : operands) {
                    anyTrue = anyTrue.or(bool(operand));
                    anyFalse = anyFalse.or(bool(operand).not());
                }
                return anyTrue.and(anyFalse);
            }
            case INTERSECTION: {
                Literal result = operands.get(0);
                for (int i = 1; i < operands.size(); i++) {
                    result = result.intersect(operands.get(i));
                }
                return result;
            }
            case UNION: {
                Literal result = operands.get(0);
                for (int i = 1; i < operands.size(); i++) {
                    result = result.union(operands.get(i));
                }
                return result;
            }
            case IS:
                return is(operands.get(0), operands.get(1));
            case IS_SUBSET:
                return BooleanSet.of(operands.get(0).isSubsetOf(operands.get(1)));
            case IS_SUPERSET:
                return BooleanSet.of(operands.get(1).isSubsetOf(operands.get(0)));
            case GREATER_OR_EQUAL:
                return numeric(operands.get(0)).greaterOrEqual(numeric(operands.get(1)));
            case LESS_OR_EQUAL:
                return numeric(operands.get(1)).greaterOrEqual(numeric(operands.get(0)));
            case GREATER_THAN:
                return numeric(operands.get(0)).greaterThan(numeric(operands.get(1)));
            case LESS_THAN:
                return numeric(operands.get(1)).greaterThan(numeric(operands.get(0)));
            default:
                throw new AssertionError();
        }
    }

    /**
     * Over-approximates the truth value of this predicate, given supersets of the operand values.
     * The second operand of a subset test has to be exact.
     */
    public BooleanSet estimate(List<? extends Literal> supersets) {
        Util.checkState(isPredicate(), "%s is not a predicate", this);
        checkArity(supersets.size());
        switch (this) {
            case IS_SUBSET:
                return subset(supersets.get(0), supersets.get(1));
            case IS_SUPERSET:
                return subset(supersets.get(1), supersets.get(0));
            case OR:
            case AND:
            case NOT:
            case IMPLIES:
            case XOR:
            case IS:
            case GREATER_OR_EQUAL:
            case LESS_OR_EQUAL:
            case GREATER_THAN:
            case LESS_THAN:
                return (BooleanSet) fold(supersets);
            default:
                throw new AssertionError();
        }
    }

    private static BooleanSet subset(Literal subset, Literal superset) {
        if (subset.isSubsetOf(superset)) {
            return BooleanSet.TRUE;
        }
        return subset.isDisjointFrom(superset) && !subset.isEmpty() ? BooleanSet.FALSE : BooleanSet.BOTH;
    }

    private static BooleanSet is(Literal first, Literal second) {
        Literal.checkSameKind(first, second);
        if (first.isEmpty() || second.isEmpty()) {
            return BooleanSet.EMPTY;
        }
        if (first.isSingleton() && second.isSingleton()) {
            return BooleanSet.of(first.equals(second));
        }
        return first.isDisjointFrom(second) ? BooleanSet.FALSE : BooleanSet.BOTH;
    }

    private interface NumericOperation {
        NumericSet apply(NumericSet first, NumericSet second);
    }

    private static NumericSet reduceNumeric(List<? extends Literal> operands, NumericOperation operation) {
        NumericSet result = numeric(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            result = operation.apply(result, numeric(operands.get(i)));
        }
        return result;
    }

    private static NumericSet numeric(Literal literal) {
        if (!(literal instanceof NumericSet)) {
            throw new IllegalArgumentException("Expected a numeric literal, got " + literal);
        }
        return (NumericSet) literal;
    }

    private static BooleanSet bool(Literal literal) {
        if (!(literal instanceof BooleanSet)) {
            throw new IllegalArgumentException("Expected a boolean literal, got " + literal);
        }
        return (BooleanSet) literal;
    }

    private static final class Flags {
        static final int VARIADIC = -1;
        static final int COMMUTATIVE = 1;
        static final int ASSOCIATIVE = 1 << 1;
        static final int IDEMPOTENT = 1 << 2;
        static final int BOOLEAN = 1 << 3;
        static final int SETIC = 1 << 4;
        static final int CANONICAL = 1 << 5;

        private Flags() {}
    }
}
