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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered sequence of points. Patterns are <b>not</b> sorted: the order is the order the points were given in, and
 * algorithms rely on it (occurrence order, source index order). Patterns own a copy of their points; the caller's
 * collection may be modified afterwards without affecting the pattern.
 * <p>
 * Patterns are ordered lexicographically over their points. When one pattern is a prefix of the other, the shorter one
 * is smaller.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public final class Pattern<P extends Point<P>> implements Comparable<Pattern<P>>, Iterable<P> {

    private final List<P> points;

    /**
     * Create a pattern from the given points, copied in iteration order.
     *
     * @param points the points of the pattern
     */
    public Pattern(Collection<? extends P> points) {
        this.points = List.copyOf(points);
    }

    /**
     * @return the empty pattern
     */
    public static <P extends Point<P>> Pattern<P> empty() {
        return new Pattern<P>(List.<P>of());
    }

    @SafeVarargs
    public static <P extends Point<P>> Pattern<P> of(P... points) {
        return new Pattern<P>(List.of(points));
    }

    /**
     * Answer the point at the given position
     *
     * @param index position in the pattern
     * @return the point
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public P get(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public P first() {
        return points.get(0);
    }

    public P last() {
        return points.get(points.size() - 1);
    }

    /**
     * Answer the vectorized representation of this pattern: the differences between adjacent points. Two patterns are
     * translationally equivalent if, and only if, their vectorized representations are equal.
     *
     * @return a pattern of size - 1 difference vectors, empty for patterns of fewer than two points
     */
    public Pattern<P> vectorize() {
        int length = points.size();
        if (length < 2) {
            return empty();
        }
        var diffs = new ArrayList<P>(length - 1);
        for (int i = 0; i < length - 1; i++) {
            diffs.add(points.get(i + 1).subtract(points.get(i)));
        }
        return new Pattern<>(diffs);
    }

    /**
     * Answer a copy of this pattern with every point translated by the given vector. Order is preserved.
     *
     * @param translator the translation vector
     * @return the translated pattern
     */
    public Pattern<P> translate(P translator) {
        var translated = new ArrayList<P>(points.size());
        for (var point : points) {
            translated.add(point.add(translator));
        }
        return new Pattern<>(translated);
    }

    /**
     * @return an unmodifiable view of the points, in pattern order
     */
    public List<P> points() {
        return points;
    }

    @Override
    public Iterator<P> iterator() {
        return points.iterator();
    }

    @Override
    public int compareTo(Pattern<P> other) {
        int shorter = Math.min(size(), other.size());
        for (int i = 0; i < shorter; i++) {
            int result = points.get(i).compareTo(other.points.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(size(), other.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Pattern<?> other)) return false;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return points.toString();
    }
}
