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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A rewrite transaction over several graphs, one {@link Mutator} each. Graphs which end up
 * without any node are dropped.
 */
final class Mutators {
    private static final Logger logger = Logger.getLogger(Mutators.class.getName());

    private final List<Graph> graphs;
    private final ReprContext context;
    private final boolean verbose;
    private final List<Mutator> mutators = new ArrayList<>();
    private String algorithm = "none";

    Mutators(List<Graph> graphs, ReprContext context, boolean verbose) {
        this.graphs = ImmutableList.copyOf(graphs);
        this.context = context;
        this.verbose = verbose;
    }

    void run(SolverAlgorithm algorithm) {
        Util.checkState(mutators.isEmpty(), "Already ran %s", this.algorithm);
        this.algorithm = algorithm.name();
        for (Graph graph : graphs) {
            Mutator mutator = new Mutator(graph, algorithm.name());
            mutators.add(mutator);
            algorithm.run(mutator);
        }
    }

    Result close() {
        Util.checkState(!mutators.isEmpty() || graphs.isEmpty(), "No algorithm ran");
        List<ReprMap> reprMaps = new ArrayList<>(mutators.size());
        List<Graph> outputs = new ArrayList<>(mutators.size());
        boolean dirty = false;
        for (Mutator mutator : mutators) {
            Mutator.Result result = mutator.close();
            reprMaps.add(result.reprMap());
            if (!result.graph().isEmpty()) {
                outputs.add(result.graph());
            }
            dirty |= result.isDirty();
        }
        ReprMap reprMap = ReprMap.union(reprMaps);
        context.carryOver(reprMap);
        if (dirty && verbose && logger.isLoggable(Level.INFO)) {
            StringBuilder builder = new StringBuilder();
            for (Graph graph : outputs) {
                builder.append('\n').append(context.print(graph));
            }
            logger.log(Level.INFO, "{0} changed {1} graph(s):{2}", new Object[] {algorithm, graphs.size(), builder});
        }
        return new Result(reprMap, outputs, dirty);
    }

    static ReprMap createConcatReprMap(ReprMap... reprMaps) {
        return ReprMap.concat(reprMaps);
    }

    static final class Result {
        private final ReprMap reprMap;
        private final List<Graph> graphs;
        private final boolean dirty;

        Result(ReprMap reprMap, List<Graph> graphs, boolean dirty) {
            this.reprMap = reprMap;
            this.graphs = ImmutableList.copyOf(graphs);
            this.dirty = dirty;
        }

        ReprMap reprMap() {
            return reprMap;
        }

        List<Graph> graphs() {
            return graphs;
        }

        boolean isDirty() {
            return dirty;
        }
    }
}
