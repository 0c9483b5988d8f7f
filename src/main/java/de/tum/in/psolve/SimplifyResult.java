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
import java.util.List;

/**
 * Outcome of {@link Solver#phase1SimplifyAnalytically(List, ReprContext)}.
 */
public final class SimplifyResult {
    private final ReprMap reprMap;
    private final ReprContext context;
    private final List<Graph> graphs;
    private final boolean dirty;
    private final int iterations;

    SimplifyResult(ReprMap reprMap, ReprContext context, List<Graph> graphs, boolean dirty, int iterations) {
        this.reprMap = reprMap;
        this.context = context;
        this.graphs = ImmutableList.copyOf(graphs);
        this.dirty = dirty;
        this.iterations = iterations;
    }

    /**
     * Maps the nodes of the input graphs to their images in {@link #graphs()}.
     */
    public ReprMap reprMap() {
        return reprMap;
    }

    public ReprContext context() {
        return context;
    }

    /**
     * The simplified graphs. Graphs without remaining nodes are dropped.
     */
    public List<Graph> graphs() {
        return graphs;
    }

    /**
     * Whether any pass changed anything.
     */
    public boolean isDirty() {
        return dirty;
    }

    public int iterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return String.format("SimplifyResult(%d graphs, %d iterations%s)",
                graphs.size(), iterations, dirty ? ", dirty" : "");
    }
}
