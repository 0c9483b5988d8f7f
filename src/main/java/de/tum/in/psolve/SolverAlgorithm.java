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

import java.util.function.Consumer;

/**
 * A named rewrite pass. A pass reads the input graph of the mutator and records its rewrites
 * there; whether it changed anything is decided when the mutator is closed.
 */
interface SolverAlgorithm {
    String name();

    void run(Mutator mutator);

    static SolverAlgorithm of(String name, Consumer<Mutator> body) {
        return new SolverAlgorithm() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void run(Mutator mutator) {
                body.accept(mutator);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
