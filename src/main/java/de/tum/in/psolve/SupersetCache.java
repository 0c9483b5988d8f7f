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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Known supersets of parameters, valid as long as the graph of the parameter keeps the same
 * nodes and flags.
 */
final class SupersetCache {
    private final Map<Parameter, Entry> entries = new HashMap<>();
    private int hits = 0;
    private int misses = 0;

    /**
     * Hashes the structure of the graph: its generation, the handles of all nodes and the flags
     * of all expressions.
     */
    static int fingerprint(Graph graph) {
        int hash = HashUtil.fnv1aHash(HashUtil.OFFSET_BASIS, Long.hashCode(graph.generation()));
        List<ParameterOperatable> nodes = graph.nodes();
        for (ParameterOperatable node : nodes) {
            int flags = 0;
            if (node instanceof Expression) {
                Expression expression = (Expression) node;
                flags = (expression.isConstrained() ? 2 : 0) | (expression.isTerminated() ? 1 : 0);
            }
            hash = HashUtil.fnv1aHash(hash, node.id() * 4 + flags);
        }
        return HashUtil.fnv1aHash(hash, nodes.size());
    }

    @Nullable
    Literal get(Parameter parameter, int fingerprint) {
        Entry entry = entries.get(parameter);
        if (entry == null || entry.fingerprint != fingerprint) {
            misses += 1;
            return null;
        }
        hits += 1;
        return entry.superset;
    }

    void put(Parameter parameter, int fingerprint, Literal superset) {
        entries.put(parameter, new Entry(fingerprint, superset));
    }

    void invalidate(Parameter parameter) {
        entries.remove(parameter);
    }

    int size() {
        return entries.size();
    }

    int hits() {
        return hits;
    }

    int misses() {
        return misses;
    }

    private static final class Entry {
        final int fingerprint;
        final Literal superset;

        Entry(int fingerprint, Literal superset) {
            this.fingerprint = fingerprint;
            this.superset = superset;
        }
    }
}
