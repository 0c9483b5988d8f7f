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
 * A contradiction witnessed by literals, e.g. an empty superset or an {@code Is} between
 * different singletons.
 */
public class ContradictionByLiteral extends Contradiction {
    private static final long serialVersionUID = -1874471150243710163L;

    private final transient ImmutableList<Literal> literals;

    public ContradictionByLiteral(String message, List<? extends Operand> involved, List<? extends Literal> literals) {
        super(message, involved);
        this.literals = ImmutableList.copyOf(literals);
    }

    public List<Literal> literals() {
        return literals;
    }
}
