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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Maps every node of one graph generation to its counterpart in a later generation: a node, the
 * literal it was folded into, or nothing if it was removed.
 */
public final class ReprMap {
    private final Map<ParameterOperatable, Operand> images;
    private final Set<ParameterOperatable> removed;

    ReprMap(Map<ParameterOperatable, Operand> images, Set<ParameterOperatable> removed) {
        this.images = ImmutableMap.copyOf(images);
        this.removed = ImmutableSet.copyOf(removed);
    }

    static ReprMap identity(Collection<Graph> graphs) {
        Map<ParameterOperatable, Operand> images = new HashMap<>();
        for (Graph graph : graphs) {
            for (ParameterOperatable node : graph.nodes()) {
                images.put(node, node);
            }
        }
        return new ReprMap(images, ImmutableSet.of());
    }

    /**
     * Merges maps with disjoint domains, e.g. the results of one pass over several graphs.
     */
    static ReprMap union(List<ReprMap> maps) {
        Map<ParameterOperatable, Operand> images = new HashMap<>();
        Set<ParameterOperatable> removed = new HashSet<>();
        for (ReprMap map : maps) {
            images.putAll(map.images);
            removed.addAll(map.removed);
        }
        return new ReprMap(images, removed);
    }

    /**
     * Composes maps of consecutive generations into one map from the first to the last.
     */
    public static ReprMap concat(ReprMap... maps) {
        Util.checkArgument(maps.length > 0, "Nothing to concatenate");
        ReprMap result = maps[0];
        for (int i = 1; i < maps.length; i++) {
            result = result.andThen(maps[i]);
        }
        return result;
    }

    private ReprMap andThen(ReprMap next) {
        Map<ParameterOperatable, Operand> composed = new HashMap<>();
        Set<ParameterOperatable> composedRemoved = new HashSet<>(removed);
        for (Map.Entry<ParameterOperatable, Operand> entry : images.entrySet()) {
            Operand image = entry.getValue();
            if (image instanceof Literal) {
                composed.put(entry.getKey(), image);
                continue;
            }
            Operand nextImage = next.images.get((ParameterOperatable) image);
            if (nextImage == null) {
                composedRemoved.add(entry.getKey());
            } else {
                composed.put(entry.getKey(), nextImage);
            }
        }
        return new ReprMap(composed, composedRemoved);
    }

    public boolean contains(ParameterOperatable node) {
        return images.containsKey(node) || removed.contains(node);
    }

    public boolean isRemoved(ParameterOperatable node) {
        return removed.contains(node);
    }

    /**
     * The image of the operand; literals map to themselves. Returns {@code null} for removed or
     * unknown nodes.
     */
    @Nullable
    public Operand map(Operand operand) {
        if (operand instanceof Literal) {
            return operand;
        }
        return images.get((ParameterOperatable) operand);
    }

    /**
     * Returns the literal value of the operand if it is known, or, with {@code allowSubset}, the
     * tightest known superset of its value.
     */
    @Nullable
    public Literal tryGetLiteral(Operand operand, boolean allowSubset) {
        Operand image = map(operand);
        if (image == null) {
            return null;
        }
        if (image instanceof Literal) {
            return (Literal) image;
        }
        ParameterOperatable node = (ParameterOperatable) image;
        return node.graph().knownSuperset(node, allowSubset);
    }

    /**
     * The nodes of the source generation which were not removed.
     */
    public Set<ParameterOperatable> domain() {
        return images.keySet();
    }

    @Override
    public String toString() {
        return "ReprMap(" + images.size() + " mapped, " + removed.size() + " removed)";
    }
}
