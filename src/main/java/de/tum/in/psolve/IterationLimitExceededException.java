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
 * The simplification loop did not reach a fixpoint within the configured number of iterations.
 * This indicates a rewrite rule which keeps changing the graph and is not a solver verdict.
 */
public class IterationLimitExceededException extends RuntimeException {
    private static final long serialVersionUID = -2294120381773904519L;

    private final int iterations;

    public IterationLimitExceededException(int iterations) {
        super(String.format("No fixpoint after %d iterations", iterations));
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }
}
