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
 * Anything that may appear as an operand of an {@link Expression}: a {@link Literal}, a
 * {@link Parameter} or another {@link Expression}.
 */
public interface Operand {
    boolean isLiteral();

    /**
     * Depth in the operand DAG. Literals and parameters are leaves with depth zero.
     */
    int depth();
}
