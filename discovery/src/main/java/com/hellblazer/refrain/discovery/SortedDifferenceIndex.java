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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Difference index over a sorted list of distinct differences, looked up with binary search.
 *
 * @author hal.hildebrand
 */
final class SortedDifferenceIndex<P extends Point<P>> implements DifferenceIndex<P> {
    private final List<P>          differences = new ArrayList<>();
    private final List<IndexPairs> pairs       = new ArrayList<>();

    SortedDifferenceIndex(List<IndexedDifference<P>> forwardDifferences) {
        Differences.partition(forwardDifferences, (difference, sources, targets) -> {
            var run = new IndexPairs();
            for (int k = 0; k < sources.size(); k++) {
                run.add(sources.getInt(k), targets.getInt(k));
            }
            differences.add(difference);
            pairs.add(run);
        });
    }

    @Override
    public IndexPairs find(P difference) {
        int index = Collections.binarySearch(differences, difference);
        if (index < 0) {
            throw new DiscoveryException("No exact match for difference " + difference + " in the difference index");
        }
        return pairs.get(index);
    }

    @Override
    public int size() {
        return differences.size();
    }
}
