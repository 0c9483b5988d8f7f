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
 * Signals a logically impossible state of a constraint graph.
 */
public class Contradiction extends RuntimeException {
    private static final long serialVersionUID = 3712209861843329447L;

    private final transient ImmutableList<Operand> involved;

    public Contradiction(String message, List<? extends Operand> involved) {
        super(message);
        this.involved = ImmutableList.copyOf(involved);
    }

    public List<Operand> involved() {
        return involved;
    }
}
