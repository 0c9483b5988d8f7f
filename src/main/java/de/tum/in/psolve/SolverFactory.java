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

public final class SolverFactory {
    private SolverFactory() {}

    public static Solver buildSolver() {
        return buildSolver(ImmutableSolverConfiguration.builder().build());
    }

    public static Solver buildSolver(SolverConfiguration configuration) {
        Solver solver = buildDefaultSolver(configuration);
        return configuration.threadSafetyCheck() ? new CheckedSolver(solver) : solver;
    }

    static DefaultSolver buildDefaultSolver(SolverConfiguration configuration) {
        return new DefaultSolver(configuration);
    }
}
