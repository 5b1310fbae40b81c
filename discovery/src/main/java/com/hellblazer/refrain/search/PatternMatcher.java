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
import java.util.List;
import java.util.function.Consumer;

/**
 * Finds the occurrences of a query pattern in a point set.
 *
 * @author hal.hildebrand
 */
public interface PatternMatcher {

    /**
     * Find the occurrences of the query, handing the point set indices of each occurrence to the consumer.
     *
     * @param query    the query pattern
     * @param pointSet the point set searched
     * @param output   receives the ascending indices of every occurrence
     * @param <P>      the point type
     */
    <P extends Point<P>> void findIndices(Pattern<P> query, PointSet<P> pointSet, Consumer<IntArrayList> output);

    default <P extends Point<P>> List<IntArrayList> findIndices(Pattern<P> query, PointSet<P> pointSet) {
        var occurrences = new ArrayList<IntArrayList>();
        findIndices(query, pointSet, occurrences::add);
        return occurrences;
    }

    /**
     * Find the occurrences of the query, handing each occurrence to the consumer as a pattern of the point set's
     * points.
     */
    default <P extends Point<P>> void findOccurrences(Pattern<P> query, PointSet<P> pointSet,
                                                      Consumer<? super Pattern<P>> output) {
        findIndices(query, pointSet, indices -> output.accept(pointSet.getPattern(indices)));
    }

    default <P extends Point<P>> List<Pattern<P>> findOccurrences(Pattern<P> query, PointSet<P> pointSet) {
        var occurrences = new ArrayList<Pattern<P>>();
        findOccurrences(query, pointSet, occurrences::add);
        return occurrences;
    }
}
