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
 * Immutable 2D point with double coordinates. Comparisons are exact, so values that are not exactly representable
 * (tuplet onsets, for example) may fail to match. Use {@link RoundedPoint2d} for such data.
 *
 * @author hal.hildebrand
 */
public final class Point2d implements Point<Point2d> {

    /** X coordinate, the onset for musical data */
    public final double x;

    /** Y coordinate, the pitch for musical data */
    public final double y;

    /**
     * Create a new 2D point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     */
    public Point2d(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Create a point at the origin (0, 0).
     *
     * @return Point at origin
     */
    public static Point2d origin() {
        return new Point2d(0.0, 0.0);
    }

    @Override
    public Point2d add(Point2d other) {
        return new Point2d(x + other.x, y + other.y);
    }

    @Override
    public Point2d subtract(Point2d other) {
        return new Point2d(x - other.x, y - other.y);
    }

    @Override
    public Point2d multiply(double scalar) {
        return new Point2d(x * scalar, y * scalar);
    }

    @Override
    public boolean isZero() {
        return x == 0.0 && y == 0.0;
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
    public int compareTo(Point2d other) {
        if (x < other.x) return -1;
        if (x > other.x) return 1;
        if (y < other.y) return -1;
        if (y > other.y) return 1;
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point2d other)) return false;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        // + 0.0 folds -0.0 onto 0.0 so equal points hash equally
        return 31 * Double.hashCode(x + 0.0) + Double.hashCode(y + 0.0);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
