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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Union-find over arbitrary elements, with path halving.
 */
final class EquivalenceClasses<T> {
    private final Map<T, T> parents = new LinkedHashMap<>();

    void add(T element) {
        parents.putIfAbsent(element, element);
    }

    T find(T element) {
        add(element);
        T current = element;
        T parent = parents.get(current);
        while (!parent.equals(current)) {
            T grandParent = parents.get(parent);
            parents.put(current, grandParent);
            current = grandParent;
            parent = parents.get(current);
        }
        return current;
    }

    void union(T first, T second) {
        T firstRoot = find(first);
        T secondRoot = find(second);
        if (!firstRoot.equals(secondRoot)) {
            parents.put(secondRoot, firstRoot);
        }
    }

    boolean isEquivalent(T first, T second) {
        return find(first).equals(find(second));
    }

    /**
     * All classes in order of their first element.
     */
    List<Set<T>> classes() {
        Map<T, Set<T>> classes = new LinkedHashMap<>();
        for (T element : new ArrayList<>(parents.keySet())) {
            classes.computeIfAbsent(find(element), root -> new LinkedHashSet<>()).add(element);
        }
        return new ArrayList<>(classes.values());
    }
}
