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

package com.hellblazer.refrain.discovery.compress;

import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Heuristic scores of a TEC against the point set it was found in.
 *
 * @param tec              the scored TEC
 * @param compressionRatio the number of covered points per point and translator needed to encode the TEC
 * @param compactness      the best, over all occurrences, ratio of pattern points to point set points inside the
 *                         occurrence's bounding box
 * @param coveredSet       the points covered by the TEC
 * @param patternWidth     the extent of the pattern's bounding box along component 0
 * @param patternArea      the area of the pattern's bounding box over components 0 and 1
 * @param <P>              the point type
 * @author hal.hildebrand
 */
public record TecStats<P extends Point<P>>(Tec<P> tec, double compressionRatio, double compactness,
                                           PointSet<P> coveredSet, double patternWidth, double patternArea) {

    public TecStats {
        Objects.requireNonNull(tec, "tec cannot be null");
        Objects.requireNonNull(coveredSet, "coveredSet cannot be null");
    }

    /**
     * Score the TEC against the point set.
     *
     * @param tec      the TEC
     * @param pointSet the point set the TEC occurs in
     * @param <P>      the point type
     * @return the scores
     */
    public static <P extends Point<P>> TecStats<P> of(Tec<P> tec, PointSet<P> pointSet) {
        var coveredSet = tec.coveredSet();
        double compressionRatio = (double) coveredSet.size() / tec.encodingSize();
        var box = BoundingBox.of(tec.pattern());
        return new TecStats<>(tec, compressionRatio, compactness(tec, pointSet), coveredSet, box.extent(0),
                              box.area());
    }

    /**
     * Answer whether this TEC should replace the other as the best found so far. The criteria are tried in order:
     * higher compression ratio, higher compactness, more covered points, longer pattern, narrower pattern, smaller
     * pattern area. The first criterion this TEC strictly wins decides.
     * <p>
     * This is not a consistent ordering: two TECs may each be better than the other.
     *
     * @param other the incumbent
     * @return true if this TEC wins any criterion
     */
    public boolean isBetterThan(TecStats<P> other) {
        if (compressionRatio > other.compressionRatio) {
            return true;
        }
        if (compactness > other.compactness) {
            return true;
        }
        if (coveredSet.size() > other.coveredSet.size()) {
            return true;
        }
        if (tec.pattern().size() > other.tec.pattern().size()) {
            return true;
        }
        if (patternWidth < other.patternWidth) {
            return true;
        }
        return patternArea < other.patternArea;
    }

    private static <P extends Point<P>> double compactness(Tec<P> tec, PointSet<P> pointSet) {
        double best = 0.0;
        double patternSize = tec.pattern().size();
        for (var occurrence : tec.expand()) {
            var box = BoundingBox.of(occurrence);
            int contained = 0;
            for (var point : pointSet) {
                if (box.contains(point)) {
                    contained++;
                }
            }
            if (contained > 0) {
                best = Math.max(best, patternSize / contained);
            }
        }
        return best;
    }

    /**
     * Axis aligned bounding box over every component of a pattern's points.
     */
    private static final class BoundingBox {
        private final double[] lower;
        private final double[] upper;

        private BoundingBox(int dimensions) {
            lower = new double[dimensions];
            upper = new double[dimensions];
            Arrays.fill(lower, Double.POSITIVE_INFINITY);
            Arrays.fill(upper, Double.NEGATIVE_INFINITY);
        }

        static <P extends Point<P>> BoundingBox of(Pattern<P> pattern) {
            var box = new BoundingBox(pattern.isEmpty() ? 0 : pattern.first().dimensionality());
            for (var point : pattern) {
                for (int d = 0; d < box.lower.length; d++) {
                    double value = point.component(d).orElse(0.0);
                    box.lower[d] = Math.min(box.lower[d], value);
                    box.upper[d] = Math.max(box.upper[d], value);
                }
            }
            return box;
        }

        boolean contains(Point<?> point) {
            for (int d = 0; d < lower.length; d++) {
                double value = point.component(d).orElse(0.0);
                if (value < lower[d] || value > upper[d]) {
                    return false;
                }
            }
            return true;
        }

        double extent(int dimension) {
            return dimension < lower.length ? upper[dimension] - lower[dimension] : 0.0;
        }

        double area() {
            return lower.length < 2 ? extent(0) : extent(0) * extent(1);
        }
    }
}
