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


package com.hellblazer.refrain.search;

import com.hellblazer.refrain.common.IntArrayList;
import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.function.Consumer;

/**
 * Finds the partial translated occurrences of a query pattern: every translation that maps at least
 * {@code minMatchSize} query points onto points of the set. All differences from query points to set points are
 * sorted; each run of equal differences is one translation and the set indices in the run are its matched points.
 *
 * @author hal.hildebrand
 */
public class PartialMatcher implements PatternMatcher {

    private final int minMatchSize;

    /**
     * @param minMatchSize the least number of matched points reported as an occurrence
     */
    public PartialMatcher(int minMatchSize) {
        if (minMatchSize < 1) {
            throw new IllegalArgumentException("Minimum match size must be positive: " + minMatchSize);
        }
        this.minMatchSize = minMatchSize;
    }

    public int getMinMatchSize() {
        return minMatchSize;
    }

    @Override
    public <P extends Point<P>> void findIndices(Pattern<P> query, PointSet<P> pointSet,
                                                 Consumer<IntArrayList> output) {
        long pairs = (long) query.size() * pointSet.size();
        var translations = new ArrayList<Translation<P>>((int) Math.min(pairs, Integer.MAX_VALUE - 8));
        for (var queryPoint : query) {
            for (int j = 0; j < pointSet.size(); j++) {
                translations.add(new Translation<>(pointSet.get(j).subtract(queryPoint), j));
            }
        }
        Collections.sort(translations);

        int m = translations.size();
        int i = 0;
        while (i < m) {
            var translator = translations.get(i).translator();
            var indices = new IntArrayList();
            int j = i;
            while (j < m && translator.equals(translations.get(j).translator())) {
                indices.addInt(translations.get(j).index());
                j++;
            }
            i = j;
            if (indices.size() >= minMatchSize) {
                output.accept(indices);
            }
        }
    }

    /**
     * A translation of a query point onto the set point at index.
     */
    private record Translation<P extends Point<P>>(P translator, int index) implements Comparable<Translation<P>> {
        @Override
        public int compareTo(Translation<P> other) {
            int order = translator.compareTo(other.translator);
            return order != 0 ? order : Integer.compare(index, other.index);
        }
    }
}
