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

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import javax.annotation.Nullable;

/**
 * A disjoint union of closed intervals over the extended reals. Discrete numeric sets are unions
 * of singleton intervals.
 *
 * <p>Values are always stored in base units; the {@link Unit} tag only determines how the set is
 * printed and which other sets it may be combined with. All arithmetic is interval arithmetic and
 * over-approximates the exact image.</p>
 */
public final class NumericSet extends Literal {
    private static final double[] EMPTY_BOUNDS = new double[0];
    private static final NumericSet EMPTY = new NumericSet(EMPTY_BOUNDS, Unit.DIMENSIONLESS);
    private static final NumericSet REALS =
            new NumericSet(new double[] {Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY}, Unit.DIMENSIONLESS);

    /* Pairs of lower and upper bounds, sorted, pairwise disjoint and non-touching */
    private final double[] bounds;
    private final Unit unit;

    private NumericSet(double[] bounds, Unit unit) {
        this.bounds = bounds;
        this.unit = unit;
    }

    public static NumericSet empty() {
        return EMPTY;
    }

    public static NumericSet reals() {
        return REALS;
    }

    public static NumericSet nonNegative() {
        return atLeast(0.0d);
    }

    public static NumericSet atLeast(double lower) {
        return interval(lower, Double.POSITIVE_INFINITY);
    }

    public static NumericSet atMost(double upper) {
        return interval(Double.NEGATIVE_INFINITY, upper);
    }

    public static NumericSet singleton(double value) {
        return interval(value, value);
    }

    public static NumericSet singleton(double value, Unit unit) {
        return interval(value, value, unit);
    }

    public static NumericSet interval(double lower, double upper) {
        return interval(lower, upper, Unit.DIMENSIONLESS);
    }

    /**
     * Creates the interval {@code [lower, upper]} given in the (possibly scaled) {@code unit}.
     */
    public static NumericSet interval(double lower, double upper, Unit unit) {
        Util.checkArgument(!Double.isNaN(lower) && !Double.isNaN(upper), "NaN bound");
        if (lower > upper) {
            return unit.isDimensionless() ? EMPTY : new NumericSet(EMPTY_BOUNDS, unit);
        }
        double factor = unit.multiplier();
        return new NumericSet(new double[] {normalize(lower * factor), normalize(upper * factor)}, unit);
    }

    /**
     * Creates the discrete set of the given values.
     */
    public static NumericSet discrete(double... values) {
        double[] raw = new double[2 * values.length];
        for (int i = 0; i < values.length; i++) {
            Util.checkArgument(!Double.isNaN(values[i]), "NaN value");
            raw[2 * i] = normalize(values[i]);
            raw[2 * i + 1] = normalize(values[i]);
        }
        return fromUnsorted(raw, Unit.DIMENSIONLESS);
    }

    private static double normalize(double value) {
        // Folds -0.0 into 0.0
        return value + 0.0d;
    }

    private static NumericSet fromUnsorted(double[] raw, Unit unit) {
        int count = raw.length / 2;
        if (count == 0) {
            return new NumericSet(EMPTY_BOUNDS, unit);
        }
        Integer[] order = new Integer[count];
        for (int i = 0; i < count; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(raw[2 * a], raw[2 * b]));

        double[] merged = new double[raw.length];
        int size = 0;
        for (int index : order) {
            double lower = raw[2 * index];
            double upper = raw[2 * index + 1];
            if (lower > upper) {
                continue;
            }
            if (size > 0 && lower <= merged[size - 1]) {
                merged[size - 1] = Math.max(merged[size - 1], upper);
            } else {
                merged[size] = lower;
                merged[size + 1] = upper;
                size += 2;
            }
        }
        return new NumericSet(Arrays.copyOf(merged, size), unit);
    }

    @Override
    public Kind kind() {
        return Kind.NUMERIC;
    }

    public Unit unit() {
        return unit;
    }

    public int intervalCount() {
        return bounds.length / 2;
    }

    public double lower(int interval) {
        return bounds[2 * interval];
    }

    public double upper(int interval) {
        return bounds[2 * interval + 1];
    }

    /**
     * Smallest member of this set, in base units.
     */
    public double min() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty set has no minimum");
        }
        return bounds[0];
    }

    /**
     * Largest member of this set, in base units.
     */
    public double max() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty set has no maximum");
        }
        return bounds[bounds.length - 1];
    }

    public boolean contains(double value) {
        for (int i = 0; i < bounds.length; i += 2) {
            if (bounds[i] <= value && value <= bounds[i + 1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Re-tags the set with another unit. The stored base values are unchanged.
     */
    public NumericSet withUnit(Unit newUnit) {
        return newUnit.equals(unit) ? this : new NumericSet(bounds, newUnit);
    }

    public NumericSet stripUnit() {
        return withUnit(Unit.DIMENSIONLESS);
    }

    @Override
    public boolean isEmpty() {
        return bounds.length == 0;
    }

    @Override
    public boolean isSingleton() {
        return bounds.length == 2 && bounds[0] == bounds[1];
    }

    @Override
    public boolean isSubsetOf(Literal other) {
        NumericSet set = cast(other);
        return Arrays.equals(intersectBounds(bounds, set.bounds), bounds);
    }

    @Override
    public NumericSet intersect(Literal other) {
        NumericSet set = cast(other);
        return new NumericSet(intersectBounds(bounds, set.bounds), combinedUnit(set));
    }

    @Override
    public NumericSet union(Literal other) {
        NumericSet set = cast(other);
        double[] raw = new double[bounds.length + set.bounds.length];
        System.arraycopy(bounds, 0, raw, 0, bounds.length);
        System.arraycopy(set.bounds, 0, raw, bounds.length, set.bounds.length);
        return fromUnsorted(raw, combinedUnit(set));
    }

    private static double[] intersectBounds(double[] first, double[] second) {
        double[] result = new double[first.length + second.length];
        int size = 0;
        int i = 0;
        int j = 0;
        while (i < first.length && j < second.length) {
            double lower = Math.max(first[i], second[j]);
            double upper = Math.min(first[i + 1], second[j + 1]);
            if (lower <= upper) {
                result[size] = lower;
                result[size + 1] = upper;
                size += 2;
            }
            if (first[i + 1] < second[j + 1]) {
                i += 2;
            } else {
                j += 2;
            }
        }
        return Arrays.copyOf(result, size);
    }

    // Arithmetic

    public NumericSet add(NumericSet other) {
        checkCommensurable(other);
        return combine(other, combinedUnit(other), (a, b) -> a + b, true);
    }

    public NumericSet negate() {
        double[] raw = new double[bounds.length];
        for (int i = 0; i < bounds.length; i += 2) {
            raw[i] = normalize(-bounds[i + 1]);
            raw[i + 1] = normalize(-bounds[i]);
        }
        return fromUnsorted(raw, unit);
    }

    public NumericSet multiply(NumericSet other) {
        Unit resultUnit = unit.isDimensionless()
                ? other.unit.base()
                : other.unit.isDimensionless() ? unit.base() : Unit.DIMENSIONLESS;
        return combine(other, resultUnit, NumericSet::multiplyBound, false);
    }

    private static double multiplyBound(double a, double b) {
        // 0 * inf is treated as 0, the limit from the finite side
        if (a == 0.0d || b == 0.0d) {
            return 0.0d;
        }
        return a * b;
    }

    /**
     * Pointwise {@code 1 / x}. Intervals containing zero in their interior split into two
     * unbounded parts, the singleton zero maps to nothing.
     */
    public NumericSet reciprocal() {
        double[] raw = new double[2 * bounds.length];
        int size = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            double lower = bounds[i];
            double upper = bounds[i + 1];
            if (lower > 0.0d || upper < 0.0d) {
                raw[size++] = normalize(1.0d / upper);
                raw[size++] = normalize(1.0d / lower);
            } else if (lower == 0.0d && upper == 0.0d) {
                continue;
            } else if (lower == 0.0d) {
                raw[size++] = normalize(1.0d / upper);
                raw[size++] = Double.POSITIVE_INFINITY;
            } else if (upper == 0.0d) {
                raw[size++] = Double.NEGATIVE_INFINITY;
                raw[size++] = normalize(1.0d / lower);
            } else {
                raw[size++] = Double.NEGATIVE_INFINITY;
                raw[size++] = normalize(1.0d / lower);
                raw[size++] = normalize(1.0d / upper);
                raw[size++] = Double.POSITIVE_INFINITY;
            }
        }
        return fromUnsorted(Arrays.copyOf(raw, size), Unit.DIMENSIONLESS);
    }

    public NumericSet power(NumericSet exponent) {
        if (isEmpty() || exponent.isEmpty()) {
            return EMPTY;
        }
        if (exponent.isSingleton()) {
            return power(exponent.min());
        }
        if (min() < 0.0d) {
            return REALS;
        }
        double[] raw = new double[bounds.length * exponent.bounds.length];
        int size = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            for (int j = 0; j < exponent.bounds.length; j += 2) {
                double low = Double.POSITIVE_INFINITY;
                double high = Double.NEGATIVE_INFINITY;
                for (int a = 0; a < 2; a++) {
                    for (int b = 0; b < 2; b++) {
                        double value = Math.pow(bounds[i + a], exponent.bounds[j + b]);
                        if (Double.isNaN(value)) {
                            return REALS;
                        }
                        low = Math.min(low, value);
                        high = Math.max(high, value);
                    }
                }
                raw[size++] = normalize(low);
                raw[size++] = normalize(high);
            }
        }
        return fromUnsorted(Arrays.copyOf(raw, size), Unit.DIMENSIONLESS);
    }

    private NumericSet power(double exponent) {
        if (exponent == 1.0d) {
            return this;
        }
        if (exponent == 0.0d) {
            return singleton(1.0d);
        }
        boolean integer = Double.isFinite(exponent) && Math.rint(exponent) == exponent;
        if (integer && exponent < 0.0d) {
            return power(-exponent).reciprocal();
        }

        double[] raw = new double[bounds.length];
        int size = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            double lower = bounds[i];
            double upper = bounds[i + 1];
            if (integer) {
                double lowerPower = Math.pow(lower, exponent);
                double upperPower = Math.pow(upper, exponent);
                boolean even = Math.rint(exponent / 2.0d) == exponent / 2.0d;
                if (!even || lower >= 0.0d) {
                    raw[size++] = normalize(lowerPower);
                    raw[size++] = normalize(upperPower);
                } else if (upper <= 0.0d) {
                    raw[size++] = normalize(upperPower);
                    raw[size++] = normalize(lowerPower);
                } else {
                    raw[size++] = 0.0d;
                    raw[size++] = Math.max(lowerPower, upperPower);
                }
            } else {
                // Real exponents are only defined on the non-negative part of the base
                if (upper < 0.0d) {
                    continue;
                }
                double clamped = Math.max(lower, 0.0d);
                double lowerPower = Math.pow(clamped, exponent);
                double upperPower = Math.pow(upper, exponent);
                raw[size++] = normalize(Math.min(lowerPower, upperPower));
                raw[size++] = normalize(Math.max(lowerPower, upperPower));
            }
        }
        return fromUnsorted(Arrays.copyOf(raw, size), Unit.DIMENSIONLESS);
    }

    public NumericSet abs() {
        return map(bounds -> {
            double lower = bounds[0];
            double upper = bounds[1];
            if (lower >= 0.0d) {
                return bounds;
            }
            if (upper <= 0.0d) {
                return new double[] {-upper, -lower};
            }
            return new double[] {0.0d, Math.max(-lower, upper)};
        }, unit);
    }

    /**
     * Rounds half to even, like {@link Math#rint(double)}.
     */
    public NumericSet round() {
        return map(bounds -> new double[] {Math.rint(bounds[0]), Math.rint(bounds[1])}, unit);
    }

    public NumericSet floor() {
        return map(bounds -> new double[] {Math.floor(bounds[0]), Math.floor(bounds[1])}, unit);
    }

    public NumericSet ceil() {
        return map(bounds -> new double[] {Math.ceil(bounds[0]), Math.ceil(bounds[1])}, unit);
    }

    public NumericSet sin() {
        return map(bounds -> {
            double lower = bounds[0];
            double upper = bounds[1];
            if (Double.isInfinite(lower) || Double.isInfinite(upper) || upper - lower >= 2 * Math.PI) {
                return new double[] {-1.0d, 1.0d};
            }
            double low = Math.min(Math.sin(lower), Math.sin(upper));
            double high = Math.max(Math.sin(lower), Math.sin(upper));
            // Turning points pi/2 + k pi inside the interval
            for (double k = Math.ceil((lower - Math.PI / 2) / Math.PI); Math.PI / 2 + k * Math.PI <= upper; k++) {
                double value = Math.sin(Math.PI / 2 + k * Math.PI);
                low = Math.min(low, value);
                high = Math.max(high, value);
            }
            return new double[] {Math.max(low, -1.0d), Math.min(high, 1.0d)};
        }, Unit.DIMENSIONLESS);
    }

    /**
     * Natural logarithm of the positive members.
     */
    public NumericSet log() {
        return map(bounds -> {
            if (bounds[1] <= 0.0d) {
                return null;
            }
            double lower = bounds[0] <= 0.0d ? Double.NEGATIVE_INFINITY : Math.log(bounds[0]);
            return new double[] {lower, Math.log(bounds[1])};
        }, Unit.DIMENSIONLESS);
    }

    private interface IntervalFunction {
        /* Image of the closed interval, or null if it is empty */
        @Nullable
        double[] apply(double[] interval);
    }

    private NumericSet map(IntervalFunction function, Unit resultUnit) {
        double[] raw = new double[bounds.length];
        int size = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            double[] image = function.apply(new double[] {bounds[i], bounds[i + 1]});
            if (image != null) {
                raw[size++] = normalize(image[0]);
                raw[size++] = normalize(image[1]);
            }
        }
        return fromUnsorted(Arrays.copyOf(raw, size), resultUnit);
    }

    /**
     * Outcomes of {@code this > other} over every pair of members.
     */
    public BooleanSet greaterThan(NumericSet other) {
        checkCommensurable(other);
        if (isEmpty() || other.isEmpty()) {
            return BooleanSet.EMPTY;
        }
        if (min() > other.max()) {
            return BooleanSet.TRUE;
        }
        if (max() <= other.min()) {
            return BooleanSet.FALSE;
        }
        return BooleanSet.BOTH;
    }

    /**
     * Compares every pair of members and collects the possible outcomes of {@code this >= other}.
     */
    public BooleanSet greaterOrEqual(NumericSet other) {
        checkCommensurable(other);
        if (isEmpty() || other.isEmpty()) {
            return BooleanSet.EMPTY;
        }
        if (min() >= other.max()) {
            return BooleanSet.TRUE;
        }
        if (max() < other.min()) {
            return BooleanSet.FALSE;
        }
        return BooleanSet.BOTH;
    }

    private NumericSet combine(NumericSet other, Unit resultUnit, DoubleBinaryOperator operator, boolean monotone) {
        if (isEmpty() || other.isEmpty()) {
            return new NumericSet(EMPTY_BOUNDS, resultUnit);
        }
        double[] raw = new double[bounds.length * other.bounds.length];
        int size = 0;
        for (int i = 0; i < bounds.length; i += 2) {
            for (int j = 0; j < other.bounds.length; j += 2) {
                double low;
                double high;
                if (monotone) {
                    low = operator.applyAsDouble(bounds[i], other.bounds[j]);
                    high = operator.applyAsDouble(bounds[i + 1], other.bounds[j + 1]);
                } else {
                    double first = operator.applyAsDouble(bounds[i], other.bounds[j]);
                    double second = operator.applyAsDouble(bounds[i], other.bounds[j + 1]);
                    double third = operator.applyAsDouble(bounds[i + 1], other.bounds[j]);
                    double fourth = operator.applyAsDouble(bounds[i + 1], other.bounds[j + 1]);
                    low = Math.min(Math.min(first, second), Math.min(third, fourth));
                    high = Math.max(Math.max(first, second), Math.max(third, fourth));
                }
                // -inf + inf
                raw[size++] = Double.isNaN(low) ? Double.NEGATIVE_INFINITY : normalize(low);
                raw[size++] = Double.isNaN(high) ? Double.POSITIVE_INFINITY : normalize(high);
            }
        }
        return fromUnsorted(Arrays.copyOf(raw, size), resultUnit);
    }

    private void checkCommensurable(NumericSet other) {
        if (!unit.isCommensurableWith(other.unit)) {
            throw new IllegalArgumentException(
                    String.format("Incompatible units %s and %s", unit.base(), other.unit.base()));
        }
    }

    private Unit combinedUnit(NumericSet other) {
        checkCommensurable(other);
        return unit.isDimensionless() ? other.unit : unit;
    }

    private static NumericSet cast(Literal other) {
        checkSameKind(EMPTY, other);
        return (NumericSet) other;
    }

    @Override
    public Double anyElement() {
        if (isEmpty()) {
            throw new NoSuchElementException("Empty set");
        }
        for (int i = 0; i < bounds.length; i += 2) {
            if (Double.isFinite(bounds[i])) {
                return bounds[i];
            }
            if (Double.isFinite(bounds[i + 1])) {
                return bounds[i + 1];
            }
        }
        return 0.0d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericSet)) {
            return false;
        }
        NumericSet other = (NumericSet) o;
        return Arrays.equals(bounds, other.bounds) && unit.baseSymbol().equals(other.unit.baseSymbol());
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(bounds), unit.baseSymbol());
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "∅";
        }
        StringBuilder builder = new StringBuilder();
        double factor = unit.multiplier();
        for (int i = 0; i < bounds.length; i += 2) {
            if (i > 0) {
                builder.append(" ∪ ");
            }
            if (bounds[i] == bounds[i + 1]) {
                builder.append(format(bounds[i] / factor));
            } else {
                builder.append('[')
                        .append(format(bounds[i] / factor))
                        .append(", ")
                        .append(format(bounds[i + 1] / factor))
                        .append(']');
            }
        }
        if (!unit.isDimensionless()) {
            builder.append(' ').append(unit.symbol());
        }
        return builder.toString();
    }

    private static String format(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "∞" : "-∞";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
