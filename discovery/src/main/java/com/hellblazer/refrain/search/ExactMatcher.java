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

import java.util.function.Consumer;

/**
 * Finds every exact translated occurrence of a query pattern. The query is matched in ascending point order; each
 * point of the set is tried as the image of the first query point and the set is scanned forward up to the image of
 * the last query point.
 *
 * @author hal.hildebrand
 */
public class ExactMatcher implements PatternMatcher {

    @Override
    public <P extends Point<P>> void findIndices(Pattern<P> query, PointSet<P> pointSet,
                                                 Consumer<IntArrayList> output) {
        var sorted = PointSet.from(query.points());
        int q = sorted.size();
        int n = pointSet.size();
        if (q == 0) {
            return;
        }
        for (int i = 0; i <= n - q; i++) {
            var translator = pointSet.get(i).subtract(sorted.get(0));
            var cutoff = sorted.get(q - 1).add(translator);
            var candidate = new IntArrayList(q);

            int scan = i;
            int queryIndex = 0;
            while (scan < n && queryIndex < q && pointSet.get(scan).compareTo(cutoff) <= 0) {
                var translated = sorted.get(queryIndex).add(translator);
                var point = pointSet.get(scan);
                if (point.equals(translated)) {
                    candidate.addInt(scan);
                }
                if (translated.compareTo(point) <= 0) {
                    queryIndex++;
                }
                scan++;
            }

            if (candidate.size() == q) {
                output.accept(candidate);
            }
        }
    }
}
