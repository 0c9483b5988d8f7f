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

import java.util.List;
import javax.annotation.Nullable;

/**
 * Forwards every call to a delegate, with hooks around each call.
 */
public class DelegatingSolver implements Solver {
    private final Solver delegate;

    public DelegatingSolver(Solver delegate) {
        this.delegate = delegate;
    }

    protected void onEnter(String name) {
        // Empty
    }

    protected void onExit() {
        // Empty
    }

    private <V> V onExit(V value) {
        onExit();
        return value;
    }

    @Override
    public SimplifyResult phase1SimplifyAnalytically(List<Graph> graphs, ReprContext context) {
        onEnter("phase1SimplifyAnalytically");
        try {
            return onExit(delegate.phase1SimplifyAnalytically(graphs, context));
        } catch (RuntimeException e) {
            onExit();
            throw e;
        }
    }

    @Override
    public Literal inspectGetKnownSupersets(Parameter parameter, boolean forceUpdate) {
        onEnter("inspectGetKnownSupersets");
        try {
            return onExit(delegate.inspectGetKnownSupersets(parameter, forceUpdate));
        } catch (RuntimeException e) {
            onExit();
            throw e;
        }
    }

    @Override
    public <T> SolveResultAny<T> assertAnyPredicate(
            List<PredicateWithInfo<T>> predicates,
            boolean lock,
            @Nullable Expression supposeConstraint,
            @Nullable Operand minimize) {
        onEnter("assertAnyPredicate");
        try {
            return onExit(delegate.assertAnyPredicate(predicates, lock, supposeConstraint, minimize));
        } catch (RuntimeException e) {
            onExit();
            throw e;
        }
    }

    @Override
    public Literal getAnySingle(
            Parameter parameter, boolean lock, @Nullable Expression supposeConstraint, @Nullable Operand minimize) {
        onEnter("getAnySingle");
        try {
            return onExit(delegate.getAnySingle(parameter, lock, supposeConstraint, minimize));
        } catch (RuntimeException e) {
            onExit();
            throw e;
        }
    }

    @Override
    public SolveResultAll findAndLockSolution(Graph graph) {
        onEnter("findAndLockSolution");
        try {
            return onExit(delegate.findAndLockSolution(graph));
        } catch (RuntimeException e) {
            onExit();
            throw e;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + delegate + ")";
    }
}
