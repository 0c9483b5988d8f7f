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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class SolverConfiguration {
    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final long DEFAULT_TIMEOUT_MILLIS = 120_000L;

    /**
     * Number of iterations after which the fixpoint loop gives up with an
     * {@link IterationLimitExceededException}.
     */
    @Value.Default
    public int maxIterations() {
        return DEFAULT_MAX_ITERATIONS;
    }

    /**
     * Wall-clock budget of one simplification run. Non-positive values disable the limit.
     */
    @Value.Default
    public long timeoutMillis() {
        return DEFAULT_TIMEOUT_MILLIS;
    }

    @Value.Default
    public boolean verboseSymbolicLogging() {
        return false;
    }

    @Value.Default
    public boolean tracePickAndSolve() {
        return false;
    }

    @Value.Default
    public boolean useSupersetCache() {
        return true;
    }

    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(maxIterations() > 0, "maxIterations must be positive, got %s", maxIterations());
    }
}
