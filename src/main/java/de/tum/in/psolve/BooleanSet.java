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

import java.util.NoSuchElementException;

/**
 * A subset of {@code {true, false}}. There are exactly four instances.
 */
public final class BooleanSet extends Literal {
    public static final BooleanSet EMPTY = new BooleanSet(false, false);
    public static final BooleanSet TRUE = new BooleanSet(true, false);
    public static final BooleanSet FALSE = new BooleanSet(false, true);
    public static final BooleanSet BOTH = new BooleanSet(true, true);

    private final boolean containsTrue;
    private final boolean containsFalse;

    private BooleanSet(boolean containsTrue, boolean containsFalse) {
        this.containsTrue = containsTrue;
        this.containsFalse = containsFalse;
    }

    public static BooleanSet of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static BooleanSet of(boolean containsTrue, boolean containsFalse) {
        if (containsTrue) {
            return containsFalse ? BOTH : TRUE;
        }
        return containsFalse ? FALSE : EMPTY;
    }

    @Override
    public Kind kind() {
        return Kind.BOOLEAN;
    }

    public boolean containsTrue() {
        return containsTrue;
    }

    public boolean containsFalse() {
        return containsFalse;
    }

    public BooleanSet or(BooleanSet other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        return of(containsTrue || other.containsTrue, containsFalse && other.containsFalse);
    }

    public BooleanSet and(BooleanSet other) {
        if (isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        return of(containsTrue && other.containsTrue, containsFalse || other.containsFalse);
    }

    public BooleanSet not() {
        return of(containsFalse, containsTrue);
    }

    @Override
    public boolean isEmpty() {
        return !containsTrue && !containsFalse;
    }

    @Override
    public boolean isSingleton() {
        return containsTrue != containsFalse;
    }

    @Override
    public boolean isSubsetOf(Literal other) {
        BooleanSet set = cast(other);
        return (!containsTrue || set.containsTrue) && (!containsFalse || set.containsFalse);
    }

    @Override
    public BooleanSet intersect(Literal other) {
        BooleanSet set = cast(other);
        return of(containsTrue && set.containsTrue, containsFalse && set.containsFalse);
    }

    @Override
    public BooleanSet union(Literal other) {
        BooleanSet set = cast(other);
        return of(containsTrue || set.containsTrue, containsFalse || set.containsFalse);
    }

    private static BooleanSet cast(Literal other) {
        checkSameKind(EMPTY, other);
        return (BooleanSet) other;
    }

    /**
     * Returns {@code false} whenever possible.
     */
    @Override
    public Boolean anyElement() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty set");
        }
        return !containsFalse;
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return (containsTrue ? 2 : 0) + (containsFalse ? 1 : 0);
    }

    @Override
    public String toString() {
        if (this == BOTH) {
            return "{true, false}";
        }
        if (this == EMPTY) {
            return "∅";
        }
        return containsTrue ? "true" : "false";
    }
}
