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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Difference index over a hash table keyed by the difference vector.
 *
 * @author hal.hildebrand
 */
final class HashedDifferenceIndex<P extends Point<P>> implements DifferenceIndex<P> {
    private final Map<P, IndexPairs> index = new HashMap<>();

    /**
     * @param forwardDifferences differences in ascending source order
     */
    HashedDifferenceIndex(List<IndexedDifference<P>> forwardDifferences) {
        for (var difference : forwardDifferences) {
            index.computeIfAbsent(difference.difference(), d -> new IndexPairs())
                 .add(difference.source(), difference.target());
        }
    }

    @Override
    public IndexPairs find(P difference) {
        var pairs = index.get(difference);
        if (pairs == null) {
            throw new DiscoveryException("No exact match for difference " + difference + " in the difference index");
        }
        return pairs;
    }

    @Override
    public int size() {
        return index.size();
    }
}
