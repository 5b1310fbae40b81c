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

import java.util.Objects;
import java.util.function.Consumer;

/**
 * COSIATEC: greedy covering of a point set by TECs. Each iteration runs the underlying TEC algorithm over the points
 * not yet covered, picks the best of the TECs found and their conjugates by {@link TecStats#isBetterThan}, emits it and
 * removes its covered points.
 * <p>
 * The number of iterations is bounded by the size of the point set. If the underlying algorithm finds nothing in the
 * remaining points, they are emitted as one TEC of a single point translated onto each of the others.
 *
 * @author hal.hildebrand
 */
public class Cosiatec implements TecAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(Cosiatec.class);

    private final TecAlgorithm tecAlgorithm;

    /**
     * @param tecAlgorithm the algorithm producing candidate TECs in every iteration
     */
    public Cosiatec(TecAlgorithm tecAlgorithm) {
        this.tecAlgorithm = Objects.requireNonNull(tecAlgorithm, "tecAlgorithm cannot be null");
    }

    @Override
    public <P extends Point<P>> void computeTecs(PointSet<P> pointSet, Consumer<? super Tec<P>> output) {
        var residual = pointSet;
        int iterations = 0;
        while (!residual.isEmpty() && iterations < pointSet.size()) {
            iterations++;
            var best = bestTec(residual);
            if (best == null) {
                log.debug("COSIATEC: no TEC in {} remaining points, emitting them as one TEC", residual.size());
                output.accept(Residuals.asTec(residual));
                return;
            }
            residual = residual.difference(best.coveredSet());
            output.accept(best.tec());
            log.debug("COSIATEC: iteration {}, compression ratio {}, {} points remaining", iterations,
                      best.compressionRatio(), residual.size());
        }
        if (!residual.isEmpty()) {
            log.warn("COSIATEC stopped after {} iterations with {} points uncovered", iterations, residual.size());
        }
    }

    private <P extends Point<P>> TecStats<P> bestTec(PointSet<P> residual) {
        var best = new Best<P>();
        tecAlgorithm.computeTecs(residual, tec -> {
            best.offer(TecStats.of(tec.removeRedundantTranslators(), residual));
            best.offer(TecStats.of(tec.conjugate().removeRedundantTranslators(), residual));
        });
        return best.stats;
    }

    private static final class Best<P extends Point<P>> {
        private TecStats<P> stats;

        void offer(TecStats<P> candidate) {
            if (stats == null || candidate.isBetterThan(stats)) {
                stats = candidate;
            }
        }
    }
}
