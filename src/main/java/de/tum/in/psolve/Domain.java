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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * The value domain of a {@link Parameter}.
 */
public final class Domain {
    public enum Kind {
        NUMBERS,
        BOOLEANS,
        ENUMERATION
    }

    private static final Domain BOOLEANS = new Domain(Kind.BOOLEANS, true, false, null, ImmutableSortedSet.of());
    private static final Domain REALS = new Domain(Kind.NUMBERS, true, false, null, ImmutableSortedSet.of());

    private final Kind kind;
    private final boolean negative;
    private final boolean integer;
    @Nullable
    private final String enumName;

    private final ImmutableSortedSet<String> values;

    private Domain(
            Kind kind, boolean negative, boolean integer, @Nullable String enumName, ImmutableSortedSet<String> values) {
        this.kind = kind;
        this.negative = negative;
        this.integer = integer;
        this.enumName = enumName;
        this.values = values;
    }

    public static Domain numbers() {
        return REALS;
    }

    public static Domain numbers(boolean negative, boolean integer) {
        return negative && !integer ? REALS : new Domain(Kind.NUMBERS, negative, integer, null, ImmutableSortedSet.of());
    }

    public static Domain booleans() {
        return BOOLEANS;
    }

    public static Domain enumeration(String name, String... values) {
        Util.checkArgument(values.length > 0, "Empty enumeration %s", name);
        return new Domain(Kind.ENUMERATION, true, false, name, ImmutableSortedSet.copyOf(values));
    }

    public Kind kind() {
        return kind;
    }

    public boolean allowsNegative() {
        return negative;
    }

    public boolean isInteger() {
        return integer;
    }

    /**
     * Returns true if any value of the literal kind of this domain is admissible.
     */
    public boolean isUnrestricted() {
        return kind != Kind.NUMBERS || (negative && !integer);
    }

    /**
     * The set of all values admitted by this domain.
     */
    public Literal domainSet() {
        switch (kind) {
            case NUMBERS:
                return negative ? NumericSet.reals() : NumericSet.nonNegative();
            case BOOLEANS:
                return BooleanSet.BOTH;
            case ENUMERATION:
                return DiscreteSet.of(Objects.requireNonNull(enumName), values);
            default:
                throw new AssertionError();
        }
    }

    /**
     * The set of all values of the literal kind of this domain, ignoring sign and integrality.
     */
    Literal universe() {
        return kind == Kind.NUMBERS ? NumericSet.reals() : domainSet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Domain)) {
            return false;
        }
        Domain domain = (Domain) o;
        return kind == domain.kind
                && negative == domain.negative
                && integer == domain.integer
                && Objects.equals(enumName, domain.enumName)
                && values.equals(domain.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, negative, integer, enumName, values);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBERS:
                return (integer ? "integers" : "reals") + (negative ? "" : "≥0");
            case BOOLEANS:
                return "booleans";
            case ENUMERATION:
                return enumName + values;
            default:
                throw new AssertionError();
        }
    }
}
