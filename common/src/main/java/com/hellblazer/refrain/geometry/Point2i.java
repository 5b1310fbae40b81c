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
 * Immutable 2D point with integer coordinates. Used for data quantized onto a grid (ticks, MIDI pitches).
 *
 * @author hal.hildebrand
 */
public final class Point2i implements Point<Point2i> {

    /** X coordinate */
    public final long x;

    /** Y coordinate */
    public final long y;

    /**
     * Create a new 2D integer point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     */
    public Point2i(long x, long y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public Point2i add(Point2i other) {
        return new Point2i(x + other.x, y + other.y);
    }

    @Override
    public Point2i subtract(Point2i other) {
        return new Point2i(x - other.x, y - other.y);
    }

    /**
     * Multiply this point by a scalar. The scalar is truncated to an integer first.
     *
     * @param scalar Scalar multiplier
     * @return New point with scaled coordinates
     */
    @Override
    public Point2i multiply(double scalar) {
        long factor = (long) scalar;
        return new Point2i(x * factor, y * factor);
    }

    @Override
    public boolean isZero() {
        return x == 0 && y == 0;
    }

    @Override
    public OptionalDouble component(int index) {
        return switch (index) {
            case 0 -> OptionalDouble.of(x);
            case 1 -> OptionalDouble.of(y);
            default -> OptionalDouble.empty();
        };
    }

    @Override
    public int dimensionality() {
        return 2;
    }

    @Override
    public int compareTo(Point2i other) {
        int result = Long.compare(x, other.x);
        return result != 0 ? result : Long.compare(y, other.y);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point2i other)) return false;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(x) + Long.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d)", x, y);
    }
}
