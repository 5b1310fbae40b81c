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
import java.util.List;
import java.util.function.Consumer;

/**
 * TEC discovery restricted by a maximum inter-onset interval (IOI), the difference of component 0 between two points
 * compared directly.
 * <p>
 * Every point keeps a target pointer and an onset bound. Each pass computes, for every point whose window is still
 * open, the differences to the following points up to the bound, then moves the pointer past the bound and raises the
 * bound by the maximum IOI. Differences of the same size are therefore computed in the same pass. The differences of
 * one pass are partitioned into MTPs as in {@link Sia}; every MTP is split wherever two consecutive points are more
 * than the maximum IOI apart, and the translators of each split pattern with more than one point are resolved by
 * chaining its vectorized form through a {@link DifferenceIndex}.
 * <p>
 * When pruning by cover is enabled, a split pattern is only resolved if its length exceeds the cover of one of its
 * source or target points, and the points of every occurrence reached through the chain have their cover raised to
 * the pattern length.
 *
 * @author hal.hildebrand
 */
public abstract class IoiWindowedSiatec implements TecAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(IoiWindowedSiatec.class);

    protected final double  maxIoi;
    private final   boolean pruneByCover;

    protected IoiWindowedSiatec(double maxIoi, boolean pruneByCover) {
        if (!(maxIoi > 0.0) || Double.isInfinite(maxIoi)) {
            throw new IllegalArgumentException("Maximum IOI must be positive and finite: " + maxIoi);
        }
        this.maxIoi = maxIoi;
        this.pruneByCover = pruneByCover;
    }

    public double getMaxIoi() {
        return maxIoi;
    }

    @Override
    public <P extends Point<P>> void computeTecs(PointSet<P> pointSet, Consumer<? super Tec<P>> output) {
        int n = pointSet.size();
        if (n < 2) {
            return;
        }
        var onsets = new double[n];
        for (int i = 0; i < n; i++) {
            onsets[i] = Differences.onset(pointSet.get(i));
        }
        var index = indexDifferences(pointSet);

        var targets = new int[n];
        var bounds = new double[n];
        for (int i = 0; i < n; i++) {
            targets[i] = i;
            bounds[i] = onsets[i] + maxIoi;
        }
        var cover = pruneByCover ? new CoverTracker(n) : null;

        int passes = 0;
        int emitted = 0;
        int pruned = 0;
        while (anyWindowOpen(targets)) {
            passes++;
            var runs = new ArrayList<Run>();
            Differences.partition(windowDifferences(pointSet, onsets, targets, bounds),
                                  (translator, sources, runTargets) -> runs.add(new Run(sources, runTargets)));

            for (var run : runs) {
                for (var split : splitOnIoiGaps(run, pointSet)) {
                    int length = split.sources().size();
                    if (length < 2) {
                        continue;
                    }
                    if (cover != null && !cover.improves(split.sources(), split.targets(), length)) {
                        pruned++;
                        continue;
                    }
                    var pattern = pointSet.getPattern(split.sources());
                    output.accept(new Tec<>(pattern, findTranslators(pattern, index, pointSet, cover)));
                    emitted++;
                }
            }
        }
        log.debug("{}(maxIoi={}): {} points, {} indexed differences, {} passes, {} TECs, {} pruned",
                  getClass().getSimpleName(), maxIoi, n, index.size(), passes, emitted, pruned);
    }

    /**
     * Build the index used to resolve translators.
     */
    protected abstract <P extends Point<P>> DifferenceIndex<P> indexDifferences(PointSet<P> pointSet);

    private static boolean anyWindowOpen(int[] targets) {
        int n = targets.length;
        for (int i = 0; i < n - 1; i++) {
            if (targets[i] < n) {
                return true;
            }
        }
        return false;
    }

    /**
     * The differences from every point with an open window to the points inside that window. Advances the target
     * pointers and bounds of the windows.
     */
    private <P extends Point<P>> List<IndexedDifference<P>> windowDifferences(PointSet<P> pointSet, double[] onsets,
                                                                              int[] targets, double[] bounds) {
        int n = pointSet.size();
        var differences = new ArrayList<IndexedDifference<P>>();
        for (int i = 0; i < n - 1; i++) {
            if (targets[i] >= n) {
                continue;
            }
            var from = pointSet.get(i);
            boolean exhausted = true;
            for (int j = targets[i]; j < n; j++) {
                if (j == i) {
                    continue;
                }
                if (onsets[j] > bounds[i]) {
                    targets[i] = j;
                    bounds[i] += maxIoi;
                    exhausted = false;
                    break;
                }
                differences.add(IndexedDifference.between(from, i, pointSet.get(j), j));
            }
            // The window reaches past the last point, nothing is left to compare from i
            if (exhausted) {
                targets[i] = n;
            }
        }
        return differences;
    }

    /**
     * Split a run wherever the onset of the difference between consecutive sources exceeds the maximum IOI, the same
     * bound the difference index is built with.
     */
    private <P extends Point<P>> List<Run> splitOnIoiGaps(Run run, PointSet<P> pointSet) {
        var splits = new ArrayList<Run>();
        var sources = run.sources();
        int start = 0;
        for (int k = 1; k < sources.size(); k++) {
            var step = pointSet.get(sources.getInt(k)).subtract(pointSet.get(sources.getInt(k - 1)));
            if (Differences.onset(step) > maxIoi) {
                splits.add(run.slice(start, k));
                start = k;
            }
        }
        splits.add(start == 0 ? run : run.slice(start, sources.size()));
        return splits;
    }

    private static <P extends Point<P>> List<P> findTranslators(Pattern<P> pattern, DifferenceIndex<P> index,
                                                                PointSet<P> pointSet, CoverTracker cover) {
        var vectorized = pattern.vectorize();

        var reached = index.find(vectorized.get(0)).targets();
        for (int k = 1; k < vectorized.size(); k++) {
            reached = index.find(vectorized.get(k)).forward(reached);
        }

        var translators = new ArrayList<P>(reached.size());
        var last = pattern.last();
        for (int k = 0; k < reached.size(); k++) {
            var translator = pointSet.get(reached.getInt(k)).subtract(last);
            if (!translator.isZero()) {
                translators.add(translator);
            }
        }

        if (cover != null) {
            updateCover(cover, index, vectorized, reached, pattern.size());
        }
        return translators;
    }

    /**
     * Walk the vectorized chain backward from the last points of the occurrences, raising the cover of every point
     * reached.
     */
    private static <P extends Point<P>> void updateCover(CoverTracker cover, DifferenceIndex<P> index,
                                                         Pattern<P> vectorized, IntArrayList lastPoints,
                                                         int length) {
        var indices = lastPoints;
        for (int k = vectorized.size() - 1; k >= 0; k--) {
            indices = index.find(vectorized.get(k)).backward(indices);
            for (int c = 0; c < indices.size(); c++) {
                cover.raise(indices.getInt(c), length);
            }
        }
    }

    /**
     * Source indices of an MTP with the target indices they translate to.
     */
    private record Run(IntArrayList sources, IntArrayList targets) {
        Run slice(int from, int to) {
            return new Run(sources.subList(from, to), targets.subList(from, to));
        }
    }
}
