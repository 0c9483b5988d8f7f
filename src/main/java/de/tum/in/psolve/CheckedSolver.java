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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fails fast when two threads use the same solver at once.
 */
public final class CheckedSolver extends DelegatingSolver {
    private final AtomicBoolean access;

    public CheckedSolver(Solver delegate) {
        super(delegate);
        access = new AtomicBoolean(false);
    }

    @Override
    protected void onEnter(String name) {
        if (!access.compareAndSet(false, true)) {
            throw new IllegalStateException("Concurrent access to " + name);
        }
    }

    @Override
    protected void onExit() {
        if (!access.getAndSet(false)) {
            throw new IllegalStateException("Concurrently accessed");
        }
    }
}
