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
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A finite set of enumeration or string values, tagged with the name of its domain. Sets of
 * different domains are incomparable.
 */
public final class DiscreteSet extends Literal {
    private final String domainName;
    private final ImmutableSortedSet<String> values;

    private DiscreteSet(String domainName, ImmutableSortedSet<String> values) {
        this.domainName = domainName;
        this.values = values;
    }

    public static DiscreteSet of(String domainName, Collection<String> values) {
        return new DiscreteSet(domainName, ImmutableSortedSet.copyOf(values));
    }

    public static DiscreteSet of(String domainName, String... values) {
        return new DiscreteSet(domainName, ImmutableSortedSet.copyOf(values));
    }

    @Override
    public Kind kind() {
        return Kind.DISCRETE;
    }

    public String domainName() {
        return domainName;
    }

    public ImmutableSortedSet<String> values() {
        return values;
    }

    @Override
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean isSingleton() {
        return values.size() == 1;
    }

    @Override
    public boolean isSubsetOf(Literal other) {
        return cast(other).values.containsAll(values);
    }

    @Override
    public DiscreteSet intersect(Literal other) {
        DiscreteSet set = cast(other);
        return new DiscreteSet(domainName, ImmutableSortedSet.copyOf(Sets.intersection(values, set.values)));
    }

    @Override
    public DiscreteSet union(Literal other) {
        DiscreteSet set = cast(other);
        return new DiscreteSet(domainName, ImmutableSortedSet.copyOf(Sets.union(values, set.values)));
    }

    private DiscreteSet cast(Literal other) {
        checkSameKind(this, other);
        DiscreteSet set = (DiscreteSet) other;
        if (!domainName.equals(set.domainName)) {
            throw new IllegalArgumentException(
                    String.format("Incompatible domains %s and %s", domainName, set.domainName));
        }
        return set;
    }

    @Override
    public String anyElement() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty set");
        }
        return values.first();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiscreteSet)) {
            return false;
        }
        DiscreteSet other = (DiscreteSet) o;
        return domainName.equals(other.domainName) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domainName, values);
    }

    @Override
    public String toString() {
        return domainName + values;
    }
}
