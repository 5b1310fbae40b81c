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

import com.hellblazer.refrain.discovery.TecAlgorithm;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * SIATEC-Compress: covering of a point set in a single pass over ranked TECs. All TECs of the underlying algorithm and
 * their conjugates are scored against the point set and ranked by {@link TecStats#isBetterThan}. Walking the ranking,
 * a TEC is accepted when the number of points it adds to the cover exceeds the size of its own encoding. Points left
 * uncovered at the end are emitted as one TEC of a single point translated onto each of the others.
 *
 * @author hal.hildebrand
 */
public class SiatecCompress implements TecAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(SiatecCompress.class);

    private final TecAlgorithm tecAlgorithm;

    /**
     * @param tecAlgorithm the algorithm producing the TECs to rank
     */
    public SiatecCompress(TecAlgorithm tecAlgorithm) {
        this.tecAlgorithm = Objects.requireNonNull(tecAlgorithm, "tecAlgorithm cannot be null");
    }

    @Override
    public <P extends Point<P>> void computeTecs(PointSet<P> pointSet, Consumer<? super Tec<P>> output) {
        var tecs = tecAlgorithm.computeTecs(pointSet);
        var ranked = new ArrayList<TecStats<P>>(tecs.size() * 2);
        for (var tec : tecs) {
            ranked.add(TecStats.of(tec.removeRedundantTranslators(), pointSet));
        }
        for (var tec : tecs) {
            ranked.add(TecStats.of(tec.conjugate().removeRedundantTranslators(), pointSet));
        }
        rank(ranked);

        var cover = PointSet.<P>empty();
        int accepted = 0;
        for (var stats : ranked) {
            if (cover.size() == pointSet.size()) {
                break;
            }
            var newPoints = stats.coveredSet().difference(cover);
            if (newPoints.size() > stats.tec().encodingSize()) {
                output.accept(stats.tec());
                accepted++;
                cover = cover.union(stats.coveredSet());
            }
        }

        var residual = pointSet.difference(cover);
        if (!residual.isEmpty()) {
            output.accept(Residuals.asTec(residual));
        }
        log.debug("SIATEC-Compress: {} candidates, {} accepted, {} points left to the residual TEC", ranked.size(),
                  accepted, residual.size());
    }

    /**
     * Stable merge sort putting better TECs first. A TEC from the right half is placed before one from the left half
     * only if it is better than it. Unlike {@link List#sort}, this accepts the inconsistent ordering of
     * {@link TecStats#isBetterThan}.
     */
    static <P extends Point<P>> void rank(List<TecStats<P>> stats) {
        if (stats.size() < 2) {
            return;
        }
        int middle = stats.size() / 2;
        var left = new ArrayList<>(stats.subList(0, middle));
        var right = new ArrayList<>(stats.subList(middle, stats.size()));
        rank(left);
        rank(right);

        int i = 0;
        int j = 0;
        int k = 0;
        while (i < left.size() && j < right.size()) {
            if (right.get(j).isBetterThan(left.get(i))) {
                stats.set(k++, right.get(j++));
            } else {
                stats.set(k++, left.get(i++));
            }
        }
        while (i < left.size()) {
            stats.set(k++, left.get(i++));
        }
        while (j < right.size()) {
            stats.set(k++, right.get(j++));
        }
    }
}
