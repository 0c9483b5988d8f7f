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
 * A node of a {@link Graph}: either a {@link Parameter} or an {@link Expression}. Nodes are
 * identified by their graph and their stable index inside it; equality is identity.
 */
public abstract class ParameterOperatable implements Operand {
    private final Graph graph;
    private final int id;

    ParameterOperatable(Graph graph, int id) {
        this.graph = graph;
        this.id = id;
    }

    public Graph graph() {
        return graph;
    }

    /**
     * The index of this node in its graph. Operands always have a smaller index than the
     * expressions using them.
     */
    public int id() {
        return id;
    }

    @Override
    public final boolean isLiteral() {
        return false;
    }
}
