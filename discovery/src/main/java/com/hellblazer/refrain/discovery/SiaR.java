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
import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * SIAR: approximates the MTPs of a point set using only differences within a sliding window of r points. The windowed
 * differences are partitioned into candidate patterns as in SIA; the differences between the points inside each
 * candidate are then counted, and every distinct internal difference, most frequent first, is resolved to its exact
 * MTP by intersecting the point set with its own translation.
 * <p>
 * MTPs whose defining point pairs never fall inside one window are not found.
 *
 * @author hal.hildebrand
 */
public class SiaR implements MtpAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(SiaR.class);

    private final int r;

    /**
     * @param r the number of following points each point is compared with
     */
    public SiaR(int r) {
        if (r < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + r);
        }
        this.r = r;
    }

    public int getR() {
        return r;
    }

    @Override
    public <P extends Point<P>> void computeMtps(PointSet<P> pointSet, Consumer<? super Mtp<P>> output) {
        var differences = windowedDifferences(pointSet);

        var candidates = new ArrayList<Pattern<P>>();
        Differences.partition(differences,
                              (translator, sources, targets) -> candidates.add(pointSet.getPattern(sources)));

        var frequencies = frequencies(intraPatternDifferences(candidates));
        log.debug("SIAR(r={}): {} points, {} windowed differences, {} candidate translators", r, pointSet.size(),
                  differences.size(), frequencies.size());

        for (var frequency : frequencies) {
            var translator = frequency.difference();
            var pattern = pointSet.intersect(pointSet.translate(translator.negate())).toPattern();
            output.accept(new Mtp<>(translator, pattern));
        }
    }

    private <P extends Point<P>> List<IndexedDifference<P>> windowedDifferences(PointSet<P> pointSet) {
        int n = pointSet.size();
        if (n < 2) {
            return new ArrayList<>();
        }
        // A window wider than the set compares every pair
        int window = Math.min(r, n - 1);
        var differences = new ArrayList<IndexedDifference<P>>(Differences.capacity((long) n * window));
        for (int i = 0; i < n - 1; i++) {
            var from = pointSet.get(i);
            int end = Math.min(n, i + window + 1);
            for (int j = i + 1; j < end; j++) {
                differences.add(IndexedDifference.between(from, i, pointSet.get(j), j));
            }
        }
        return differences;
    }

    private static <P extends Point<P>> List<P> intraPatternDifferences(List<Pattern<P>> patterns) {
        var differences = new ArrayList<P>();
        for (var pattern : patterns) {
            int p = pattern.size();
            for (int i = 0; i < p - 1; i++) {
                var from = pattern.get(i);
                for (int j = i + 1; j < p; j++) {
                    differences.add(pattern.get(j).subtract(from));
                }
            }
        }
        Collections.sort(differences);
        return differences;
    }

    /**
     * Count the sorted differences, most frequent first. Equally frequent differences keep ascending order.
     */
    private static <P extends Point<P>> List<Frequency<P>> frequencies(List<P> sorted) {
        var frequencies = new ArrayList<Frequency<P>>();
        int i = 0;
        while (i < sorted.size()) {
            var current = sorted.get(i);
            int j = i;
            while (j < sorted.size() && current.equals(sorted.get(j))) {
                j++;
            }
            frequencies.add(new Frequency<>(current, j - i));
            i = j;
        }
        frequencies.sort(Comparator.comparingInt(Frequency<P>::count).reversed());
        return frequencies;
    }

    private record Frequency<P>(P difference, int count) {
    }
}
