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
 * A wall-clock budget, checked explicitly at iteration boundaries.
 */
final class Deadline {
    static final Deadline NONE = new Deadline(0L, 0L);

    private final long startNanos;
    private final long budgetNanos;

    private Deadline(long startNanos, long budgetNanos) {
        this.startNanos = startNanos;
        this.budgetNanos = budgetNanos;
    }

    /**
     * Returns a deadline expiring after the given time, or {@link #NONE} for non-positive values.
     */
    static Deadline afterMillis(long millis) {
        return millis <= 0L ? NONE : new Deadline(System.nanoTime(), millis * 1_000_000L);
    }

    boolean isExpired() {
        return this != NONE && System.nanoTime() - startNanos >= budgetNanos;
    }

    void check(String stage) {
        if (isExpired()) {
            throw new SolverTimeoutException(
                    String.format("Timed out after %d ms in %s", budgetNanos / 1_000_000L, stage));
        }
    }
}
