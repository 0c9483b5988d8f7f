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

import javax.annotation.Nullable;

public final class Parameter extends ParameterOperatable {
    @Nullable
    private final String name;

    private final Domain domain;
    private final Unit unit;

    @Nullable
    private final Literal within;

    Parameter(Graph graph, int id, @Nullable String name, Domain domain, Unit unit, @Nullable Literal within) {
        super(graph, id);
        this.name = name;
        this.domain = domain;
        this.unit = unit;
        this.within = within;
    }

    @Nullable
    public String name() {
        return name;
    }

    public Domain domain() {
        return domain;
    }

    /**
     * The unit values of this parameter are displayed in.
     */
    public Unit unit() {
        return unit;
    }

    /**
     * The declared bound of this parameter, if any.
     */
    @Nullable
    public Literal within() {
        return within;
    }

    @Override
    public int depth() {
        return 0;
    }

    @Override
    public String toString() {
        return name == null ? "p" + id() : name;
    }
}
