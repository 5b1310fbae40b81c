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

import com.hellblazer.refrain.common.IntArrayList;
import com.hellblazer.refrain.geometry.Point;

import java.util.Collections;
import java.util.List;

/**
 * Partitioning of sorted difference lists into runs of equal difference vectors.
 *
 * @author hal.hildebrand
 */
final class Differences {

    private Differences() {
    }

    /**
     * Receives one run of equal differences.
     */
    @FunctionalInterface
    interface RunConsumer<P extends Point<P>> {
        /**
         * @param difference the difference shared by the run
         * @param sources    the source indices of the run, ascending
         * @param targets    the target indices, paired with the sources
         */
        void accept(P difference, IntArrayList sources, IntArrayList targets);
    }

    /**
     * Sort the differences and hand every maximal run of equal difference vectors to the consumer, in ascending order
     * of difference.
     */
    static <P extends Point<P>> void partition(List<IndexedDifference<P>> differences, RunConsumer<P> runs) {
        Collections.sort(differences);
        int m = differences.size();
        int i = 0;
        while (i < m) {
            var difference = differences.get(i).difference();
            var sources = new IntArrayList();
            var targets = new IntArrayList();

            int j = i;
            while (j < m && difference.equals(differences.get(j).difference())) {
                sources.addInt(differences.get(j).source());
                targets.addInt(differences.get(j).target());
                j++;
            }
            i = j;
            runs.accept(difference, sources, targets);
        }
    }

    /**
     * Initial list capacity for the given number of differences, clamped to what an array can hold.
     */
    static int capacity(long differences) {
        return (int) Math.min(differences, Integer.MAX_VALUE - 8);
    }

    /**
     * Answer the onset, component 0, of the point.
     *
     * @throws DiscoveryException if the point has no component 0
     */
    static double onset(Point<?> point) {
        var onset = point.component(0);
        if (onset.isEmpty()) {
            throw new DiscoveryException("Cannot compute with points with no onset component 0: " + point);
        }
        return onset.getAsDouble();
    }
}
