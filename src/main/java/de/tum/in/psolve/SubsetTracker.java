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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Remembers the best known superset of every node of the original graphs, to detect when the
 * literal bounds tightened between two iterations.
 */
final class SubsetTracker {
    private final List<ParameterOperatable> nodes = new ArrayList<>();
    private final Map<ParameterOperatable, Literal> supersets = new HashMap<>();

    SubsetTracker(List<Graph> graphs) {
        for (Graph graph : graphs) {
            nodes.addAll(graph.nodes());
        }
    }

    /**
     * Records the supersets known through the given map.
     *
     * @return Whether any of them differs from the previous record.
     */
    boolean update(ReprMap reprMap) {
        boolean changed = false;
        for (ParameterOperatable node : nodes) {
            Literal superset = reprMap.tryGetLiteral(node, true);
            Literal previous = superset == null ? supersets.remove(node) : supersets.put(node, superset);
            if (!Objects.equals(previous, superset)) {
                changed = true;
            }
        }
        return changed;
    }
}
