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

import java.util.Objects;

/**
 * A physical unit, described by its own symbol, the symbol of its base unit and the factor which
 * converts values of this unit into the base unit.
 */
public final class Unit {
    public static final Unit DIMENSIONLESS = new Unit("", "", 1.0d);

    private final String symbol;
    private final String baseSymbol;
    private final double multiplier;

    private Unit(String symbol, String baseSymbol, double multiplier) {
        this.symbol = symbol;
        this.baseSymbol = baseSymbol;
        this.multiplier = multiplier;
    }

    /**
     * Creates a base unit, e.g. {@code Unit.of("V")}.
     */
    public static Unit of(String symbol) {
        Util.checkArgument(!symbol.isEmpty(), "Use DIMENSIONLESS instead of an empty symbol");
        return new Unit(symbol, symbol, 1.0d);
    }

    /**
     * Derives a scaled unit from this one, e.g. {@code Unit.of("Ω").scaled("kΩ", 1000)}.
     */
    public Unit scaled(String scaledSymbol, double factor) {
        Util.checkArgument(factor > 0.0d && Double.isFinite(factor), "Invalid factor %s", factor);
        return new Unit(scaledSymbol, baseSymbol, multiplier * factor);
    }

    public String symbol() {
        return symbol;
    }

    public double multiplier() {
        return multiplier;
    }

    public boolean isBase() {
        return multiplier == 1.0d;
    }

    public boolean isDimensionless() {
        return baseSymbol.isEmpty();
    }

    public Unit base() {
        return isBase() && symbol.equals(baseSymbol)
                ? this
                : isDimensionless() ? DIMENSIONLESS : new Unit(baseSymbol, baseSymbol, 1.0d);
    }

    /**
     * Two units are commensurable if they share the base unit. Dimensionless values are
     * commensurable with everything, since literals lose their unit during canonicalization.
     */
    public boolean isCommensurableWith(Unit other) {
        return isDimensionless() || other.isDimensionless() || baseSymbol.equals(other.baseSymbol);
    }

    String baseSymbol() {
        return baseSymbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Unit)) {
            return false;
        }
        Unit unit = (Unit) o;
        return Double.compare(unit.multiplier, multiplier) == 0
                && symbol.equals(unit.symbol)
                && baseSymbol.equals(unit.baseSymbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, baseSymbol, multiplier);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
