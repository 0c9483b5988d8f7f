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

/**
 * An immutable value-set. Two literals are equal iff their value-sets are equal. The hierarchy is
 * closed: {@link NumericSet}, {@link BooleanSet} and {@link DiscreteSet} are the only
 * implementations.
 */
public abstract class Literal implements Operand {
    public enum Kind {
        NUMERIC,
        BOOLEAN,
        DISCRETE
    }

    Literal() {}

    public abstract Kind kind();

    public abstract boolean isEmpty();

    public abstract boolean isSingleton();

    public abstract boolean isSubsetOf(Literal other);

    public abstract Literal intersect(Literal other);

    public abstract Literal union(Literal other);

    /**
     * Returns some member of this set.
     *
     * @throws java.util.NoSuchElementException if the set is empty.
     */
    public abstract Object anyElement();

    public boolean isDisjointFrom(Literal other) {
        return intersect(other).isEmpty();
    }

    public boolean isSingleton(Object value) {
        return isSingleton() && anyElement().equals(value);
    }

    @Override
    public final boolean isLiteral() {
        return true;
    }

    @Override
    public final int depth() {
        return 0;
    }

    static void checkSameKind(Literal first, Literal second) {
        if (first.kind() != second.kind()) {
            throw new IllegalArgumentException(
                    String.format("Incompatible literals %s (%s) and %s (%s)", first, first.kind(), second, second.kind()));
        }
    }
}
