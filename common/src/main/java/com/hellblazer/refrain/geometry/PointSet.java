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

import com.hellblazer.refrain.common.IntArrayList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A sorted set of points. Points are kept in ascending lexicographic order without duplicates, so
 * {@code get(i) < get(i + 1)} holds for every valid index. Point sets are immutable; all set operations answer new sets
 * and run as merges over the sorted sequences without re-sorting.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public final class PointSet<P extends Point<P>> implements Iterable<P> {

    private final List<P> points;

    // The list must already be sorted and free of duplicates
    private PointSet(List<P> sortedDistinct) {
        this.points = Collections.unmodifiableList(sortedDistinct);
    }

    /**
     * Create a point set from points in any order. The points are sorted and duplicates removed.
     *
     * @param points the points
     * @return the point set
     */
    public static <P extends Point<P>> PointSet<P> from(Collection<? extends P> points) {
        var sorted = new ArrayList<P>(points);
        Collections.sort(sorted);
        var distinct = new ArrayList<P>(sorted.size());
        for (var point : sorted) {
            if (distinct.isEmpty() || !distinct.get(distinct.size() - 1).equals(point)) {
                distinct.add(point);
            }
        }
        return new PointSet<>(distinct);
    }

    @SafeVarargs
    public static <P extends Point<P>> PointSet<P> of(P... points) {
        return from(List.of(points));
    }

    public static <P extends Point<P>> PointSet<P> empty() {
        return new PointSet<>(new ArrayList<P>());
    }

    public P get(int index) {
        return points.get(index);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return an unmodifiable view of the sorted points
     */
    public List<P> points() {
        return points;
    }

    /**
     * Answer the pattern formed by the points at the given indices, in the order the indices are given. The order need
     * not match the order of the set.
     *
     * @param indices indices into this set
     * @return the pattern
     */
    public Pattern<P> getPattern(IntArrayList indices) {
        var selected = new ArrayList<P>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            selected.add(points.get(indices.getInt(i)));
        }
        return new Pattern<>(selected);
    }

    /**
     * @see #getPattern(IntArrayList)
     */
    public Pattern<P> getPattern(int... indices) {
        return getPattern(IntArrayList.of(indices));
    }

    /**
     * @return the points of this set as a pattern, in sorted order
     */
    public Pattern<P> toPattern() {
        return new Pattern<>(points);
    }

    /**
     * Find the position of a point by binary search.
     *
     * @param point the point to find
     * @return the index of the point if present, otherwise {@code (-(insertion point) - 1)}
     */
    public int findIndex(P point) {
        return Collections.binarySearch(points, point);
    }

    public boolean contains(P point) {
        return findIndex(point) >= 0;
    }

    /**
     * Answer this set translated by the given vector. Adding the same vector to every point preserves the
     * lexicographic order of exact points. Points that compare on a rounded component may reorder or collapse, in which
     * case the translated points are sorted again.
     *
     * @param translator the translation vector
     * @return the translated set
     */
    public PointSet<P> translate(P translator) {
        var translated = new ArrayList<P>(points.size());
        boolean ascending = true;
        for (var point : points) {
            var moved = point.add(translator);
            if (ascending && !translated.isEmpty() && translated.get(translated.size() - 1).compareTo(moved) >= 0) {
                ascending = false;
            }
            translated.add(moved);
        }
        return ascending ? new PointSet<>(translated) : from(translated);
    }

    /**
     * @param other the set to intersect with
     * @return the points present in both sets
     */
    public PointSet<P> intersect(PointSet<P> other) {
        var common = new ArrayList<P>();
        int i = 0;
        int j = 0;
        while (i < size() && j < other.size()) {
            var a = points.get(i);
            var b = other.points.get(j);
            int order = a.compareTo(b);
            if (order == 0) {
                common.add(a);
                i++;
                j++;
            } else if (order > 0) {
                j++;
            } else {
                i++;
            }
        }
        return new PointSet<>(common);
    }

    /**
     * @param other the set whose points are removed
     * @return the points of this set that are not present in the other set
     */
    public PointSet<P> difference(PointSet<P> other) {
        var diff = new ArrayList<P>();
        int i = 0;
        int j = 0;
        while (i < size() && j < other.size()) {
            var a = points.get(i);
            var b = other.points.get(j);
            int order = a.compareTo(b);
            if (order == 0) {
                i++;
                j++;
            } else if (order > 0) {
                j++;
            } else {
                diff.add(a);
                i++;
            }
        }
        while (i < size()) {
            diff.add(points.get(i++));
        }
        return new PointSet<>(diff);
    }

    /**
     * @param other the set to merge with
     * @return the points present in either set
     */
    public PointSet<P> union(PointSet<P> other) {
        var merged = new ArrayList<P>(size() + other.size());
        int i = 0;
        int j = 0;
        while (i < size() && j < other.size()) {
            var a = points.get(i);
            var b = other.points.get(j);
            int order = a.compareTo(b);
            if (order == 0) {
                merged.add(a);
                i++;
                j++;
            } else if (order > 0) {
                merged.add(b);
                j++;
            } else {
                merged.add(a);
                i++;
            }
        }
        while (i < size()) {
            merged.add(points.get(i++));
        }
        while (j < other.size()) {
            merged.add(other.points.get(j++));
        }
        return new PointSet<>(merged);
    }

    @Override
    public Iterator<P> iterator() {
        return points.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PointSet<?> other)) return false;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "PointSet" + points;
    }
}
