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

package com.hellblazer.refrain.discovery;

import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookup of the point index pairs whose forward difference equals a given vector. Only differences whose onset
 * component is within the maximum inter-onset interval are indexed.
 *
 * @param <P> the point type
 * @author hal.hildebrand
 */
public interface DifferenceIndex<P extends Point<P>> {

    /**
     * Index the bounded forward differences in a list sorted by difference, searched with binary search.
     */
    static <P extends Point<P>> DifferenceIndex<P> sorted(PointSet<P> pointSet, double maxIoi) {
        return new SortedDifferenceIndex<>(boundedDifferences(pointSet, maxIoi));
    }

    /**
     * Index the bounded forward differences in a hash table keyed by difference.
     */
    static <P extends Point<P>> DifferenceIndex<P> hashed(PointSet<P> pointSet, double maxIoi) {
        return new HashedDifferenceIndex<>(boundedDifferences(pointSet, maxIoi));
    }

    /**
     * Answer the index pairs producing the difference.
     *
     * @param difference the difference vector
     * @return the pairs, in ascending source order
     * @throws DiscoveryException if the difference is not indexed
     */
    IndexPairs find(P difference);

    /**
     * @return the number of distinct differences indexed
     */
    int size();

    /**
     * The forward differences from each point to the following points whose onset is at most maxIoi later, in
     * ascending source then target order.
     */
    private static <P extends Point<P>> List<IndexedDifference<P>> boundedDifferences(PointSet<P> pointSet,
                                                                                      double maxIoi) {
        int n = pointSet.size();
        var differences = new ArrayList<IndexedDifference<P>>();
        for (int i = 0; i < n - 1; i++) {
            var from = pointSet.get(i);
            double onset = Differences.onset(from);
            for (int j = i + 1; j < n; j++) {
                var to = pointSet.get(j);
                // Rounded onsets may order points differently than their differences do
                if (Differences.onset(to) - onset > 2 * maxIoi) {
                    break;
                }
                var difference = IndexedDifference.between(from, i, to, j);
                if (Differences.onset(difference.difference()) <= maxIoi) {
                    differences.add(difference);
                }
            }
        }
        return differences;
    }
}
