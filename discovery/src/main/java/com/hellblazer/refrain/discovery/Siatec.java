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
import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * SIATEC: computes the translational equivalence class of every MTP of a point set.
 * <p>
 * The full table of differences between all points is built first; row i holds the differences from point i to every
 * point, which are ascending because the point set is sorted. The MTPs are found exactly as in {@link Sia}. The
 * translators of an MTP are the vectors that appear in every column selected by the MTP's point indices; these are
 * found with one scan over the columns in lock step, each column keeping a row pointer that only moves forward.
 * <p>
 * When duplicate removal is enabled, MTPs with the same vectorized form are only expanded once, since they share their
 * TEC.
 *
 * @author hal.hildebrand
 */
public class Siatec implements TecAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(Siatec.class);

    private final boolean removeDuplicates;

    public Siatec() {
        this(true);
    }

    /**
     * @param removeDuplicates true to compute one TEC per translationally distinct MTP
     */
    public Siatec(boolean removeDuplicates) {
        this.removeDuplicates = removeDuplicates;
    }

    public boolean isRemoveDuplicates() {
        return removeDuplicates;
    }

    @Override
    public <P extends Point<P>> void computeTecs(PointSet<P> pointSet, Consumer<? super Tec<P>> output) {
        int n = pointSet.size();
        if (n < 2) {
            return;
        }
        var table = differenceTable(pointSet);

        var differences = new ArrayList<IndexedDifference<P>>(Differences.capacity((long) n * (n - 1) / 2));
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                differences.add(new IndexedDifference<>(table.get(i).get(j), i, j));
            }
        }

        var candidates = new ArrayList<Candidate<P>>();
        Differences.partition(differences, (translator, sources, targets) -> {
            var pattern = pointSet.getPattern(sources);
            candidates.add(new Candidate<>(pattern, pattern.vectorize(), sources));
        });

        var mtps = removeDuplicates ? distinct(candidates) : candidates;
        log.debug("SIATEC: {} points, {} MTPs, {} expanded", n, candidates.size(), mtps.size());

        for (var mtp : mtps) {
            output.accept(new Tec<>(mtp.pattern(), findTranslators(n, mtp.indices(), table)));
        }
    }

    /**
     * Row i holds the differences from point i to every point j, in ascending order.
     */
    private static <P extends Point<P>> List<List<P>> differenceTable(PointSet<P> pointSet) {
        int n = pointSet.size();
        var table = new ArrayList<List<P>>(n);
        for (int i = 0; i < n; i++) {
            var from = pointSet.get(i);
            var row = new ArrayList<P>(n);
            for (int j = 0; j < n; j++) {
                row.add(pointSet.get(j).subtract(from));
            }
            table.add(row);
        }
        return table;
    }

    /**
     * Keep the first candidate of each group sharing a vectorized form, ordered by vectorized length then
     * lexicographically.
     */
    private static <P extends Point<P>> List<Candidate<P>> distinct(List<Candidate<P>> candidates) {
        var sorted = new ArrayList<>(candidates);
        // List.sort is stable, so the first of each group stays first
        sorted.sort(Comparator.<Candidate<P>>comparingInt(c -> c.vectorized().size())
                              .thenComparing(c -> c.vectorized()));

        var distinct = new ArrayList<Candidate<P>>();
        Pattern<P> previous = null;
        for (var candidate : sorted) {
            if (!candidate.vectorized().equals(previous)) {
                distinct.add(candidate);
                previous = candidate.vectorized();
            }
        }
        return distinct;
    }

    private static <P extends Point<P>> List<P> findTranslators(int n, IntArrayList columns, List<List<P>> table) {
        int patternLength = columns.size();
        var rows = new int[patternLength];
        var translators = new ArrayList<P>();
        var first = table.get(columns.getInt(0));

        for (int row = 0; row <= n - patternLength; row++) {
            var vector = first.get(row);
            boolean found = false;

            for (int col = 1; col < patternLength; col++) {
                // The match in column col is at least col rows below the match in column 0
                rows[col] = Math.max(rows[col], row + col);
                var column = table.get(columns.getInt(col));
                while (rows[col] < n && column.get(rows[col]).compareTo(vector) < 0) {
                    rows[col]++;
                }
                if (rows[col] >= n || !vector.equals(column.get(rows[col]))) {
                    break;
                }
                if (col == patternLength - 1) {
                    found = true;
                }
            }

            if ((found || patternLength == 1) && !vector.isZero()) {
                translators.add(vector);
            }
        }
        return translators;
    }

    private record Candidate<P extends Point<P>>(Pattern<P> pattern, Pattern<P> vectorized, IntArrayList indices) {
    }
}
