/*
 * Copyright (c) 2026 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.refrain.geometry;

import java.util.OptionalDouble;

/**
 * Immutable 2D point with double coordinates whose x component is compared after rounding to
 * {@link #PRECISION} fractional steps. Onsets of tuplets (thirds, fifths...) are not exactly representable as doubles;
 * rounding lets translated copies of them compare equal.
 * <p>
 * The raw x value is carried along and used for arithmetic so that rounding errors do not accumulate over chains of
 * additions.
 *
 * @author hal.hildebrand
 */
public final class RoundedPoint2d implements Point<RoundedPoint2d> {

    /** Rounding resolution of the x component */
    public static final double PRECISION = 100000.0;

    /** Rounded x coordinate, used for comparison and hashing */
    public final double roundedX;

    /** Y coordinate */
    public final double y;

    private final double rawX;

    /**
     * Create a new rounded 2D point.
     *
     * @param x raw X coordinate
     * @param y Y coordinate
     */
    public RoundedPoint2d(double x, double y) {
        this.rawX = x;
        this.roundedX = round(x);
        this.y = y;
    }

    private static double round(double value) {
        return Math.round(value * PRECISION) / PRECISION;
    }

    /**
     * @return the unrounded x coordinate
     */
    public double rawX() {
        return rawX;
    }

    @Override
    public RoundedPoint2d add(RoundedPoint2d other) {
        return new RoundedPoint2d(rawX + other.rawX, y + other.y);
    }

    @Override
    public RoundedPoint2d subtract(RoundedPoint2d other) {
        return new RoundedPoint2d(rawX - other.rawX, y - other.y);
    }

    @Override
    public RoundedPoint2d multiply(double scalar) {
        return new RoundedPoint2d(rawX * scalar, y * scalar);
    }

    @Override
    public boolean isZero() {
        return roundedX == 0.0 && y == 0.0;
    }

    @Override
    public OptionalDouble component(int index) {
        return switch (index) {
            case 0 -> OptionalDouble.of(roundedX);
            case 1 -> OptionalDouble.of(y);
            default -> OptionalDouble.empty();
        };
    }

    @Override
    public int dimensionality() {
        return 2;
    }

    @Override
    public int compareTo(RoundedPoint2d other) {
        if (roundedX < other.roundedX) return -1;
        if (roundedX > other.roundedX) return 1;
        if (y < other.y) return -1;
        if (y > other.y) return 1;
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RoundedPoint2d other)) return false;
        return roundedX == other.roundedX && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(roundedX + 0.0) + Double.hashCode(y + 0.0);
    }

    @Override
    public String toString() {
        return "(" + roundedX + ", " + y + ")";
    }
}
