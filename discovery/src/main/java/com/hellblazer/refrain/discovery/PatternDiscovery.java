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

import com.hellblazer.refrain.discovery.DiscoveryConfiguration.Covering;
import com.hellblazer.refrain.discovery.compress.Cosiatec;
import com.hellblazer.refrain.discovery.compress.SiatecCompress;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs the algorithm selected by a {@link DiscoveryConfiguration} over point sets. Results are reported as TECs; the
 * MTPs of SIA and SIAR are reported with their single translator.
 *
 * @author hal.hildebrand
 */
public class PatternDiscovery {
    private static final Logger log = LoggerFactory.getLogger(PatternDiscovery.class);

    private final DiscoveryConfiguration configuration;
    private final MtpAlgorithm           mtpAlgorithm;
    private final TecAlgorithm           tecAlgorithm;

    public PatternDiscovery(DiscoveryConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.mtpAlgorithm = switch (configuration.getAlgorithm()) {
            case SIA -> new Sia();
            case SIAR -> new SiaR(configuration.getR());
            default -> null;
        };
        this.tecAlgorithm = mtpAlgorithm == null ? cover(baseTecAlgorithm(configuration), configuration.getCovering())
                                                 : null;
    }

    private static TecAlgorithm baseTecAlgorithm(DiscoveryConfiguration configuration) {
        return switch (configuration.getAlgorithm()) {
            case SIATEC -> new Siatec(configuration.isRemoveDuplicates());
            case SIATEC_C -> new SiatecC(configuration.getMaxIoi());
            case SIATEC_CH -> new SiatecCH(configuration.getMaxIoi());
            default -> throw new IllegalArgumentException(
            configuration.getAlgorithm().getAlgorithmName() + " does not compute TECs");
        };
    }

    private static TecAlgorithm cover(TecAlgorithm algorithm, Covering covering) {
        return switch (covering) {
            case NONE -> algorithm;
            case COSIATEC -> new Cosiatec(algorithm);
            case SIATEC_COMPRESS -> new SiatecCompress(algorithm);
        };
    }

    public DiscoveryConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return the configured MTP algorithm, empty when the configuration selects a TEC algorithm
     */
    public Optional<MtpAlgorithm> getMtpAlgorithm() {
        return Optional.ofNullable(mtpAlgorithm);
    }

    /**
     * @return the configured TEC algorithm including any covering, empty when the configuration selects an MTP
     * algorithm
     */
    public Optional<TecAlgorithm> getTecAlgorithm() {
        return Optional.ofNullable(tecAlgorithm);
    }

    /**
     * Run the configured algorithm over the point set, handing each result to the consumer.
     *
     * @param pointSet the point set
     * @param output   receives every result
     * @param <P>      the point type
     */
    public <P extends Point<P>> void discover(PointSet<P> pointSet, Consumer<? super Tec<P>> output) {
        Objects.requireNonNull(pointSet, "pointSet cannot be null");
        Objects.requireNonNull(output, "output cannot be null");
        var count = new int[1];
        var start = System.nanoTime();
        if (mtpAlgorithm != null) {
            mtpAlgorithm.computeMtps(pointSet, mtp -> {
                count[0]++;
                output.accept(mtp.toTec());
            });
        } else {
            tecAlgorithm.computeTecs(pointSet, tec -> {
                count[0]++;
                output.accept(tec);
            });
        }
        log.info("{}: {} results over {} points in {} ms", configuration.getAlgorithm().getAlgorithmName(), count[0],
                 pointSet.size(), (System.nanoTime() - start) / 1_000_000);
    }

    public <P extends Point<P>> List<Tec<P>> discover(PointSet<P> pointSet) {
        var results = new ArrayList<Tec<P>>();
        discover(pointSet, results::add);
        return results;
    }
}
