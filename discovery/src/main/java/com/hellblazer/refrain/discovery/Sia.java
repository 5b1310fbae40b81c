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

import com.hellblazer.refrain.geometry.Mtp;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * SIA: computes every maximal translatable pattern of a point set. All forward differences between the points are
 * sorted; each run of equal differences is one MTP whose pattern is formed by the run's source points.
 * <p>
 * Quadratic in the number of points, both in time and in the memory used by the difference list.
 *
 * @author hal.hildebrand
 */
public class Sia implements MtpAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(Sia.class);

    @Override
    public <P extends Point<P>> void computeMtps(PointSet<P> pointSet, Consumer<? super Mtp<P>> output) {
        var differences = forwardDifferences(pointSet);
        log.debug("SIA: {} points, {} forward differences", pointSet.size(), differences.size());

        var count = new int[1];
        Differences.partition(differences, (translator, sources, targets) -> {
            output.accept(new Mtp<>(translator, pointSet.getPattern(sources)));
            count[0]++;
        });
        log.debug("SIA: {} MTPs", count[0]);
    }

    private static <P extends Point<P>> List<IndexedDifference<P>> forwardDifferences(PointSet<P> pointSet) {
        int n = pointSet.size();
        int capacity = n < 2 ? 0 : Differences.capacity((long) n * (n - 1) / 2);
        var differences = new ArrayList<IndexedDifference<P>>(capacity);
        for (int i = 0; i < n - 1; i++) {
            var from = pointSet.get(i);
            for (int j = i + 1; j < n; j++) {
                differences.add(IndexedDifference.between(from, i, pointSet.get(j), j));
            }
        }
        return differences;
    }
}
