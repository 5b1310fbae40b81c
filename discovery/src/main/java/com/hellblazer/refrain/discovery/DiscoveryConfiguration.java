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

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable configuration selecting a discovery algorithm, its parameters and an optional covering of the point set.
 *
 * @author hal.hildebrand
 */
public class DiscoveryConfiguration {

    /**
     * The discovery algorithms, by their conventional names
     */
    public enum Algorithm {
        SIA("SIA", false),
        SIAR("SIAR", false),
        SIATEC("SIATEC", true),
        SIATEC_C("SIATEC-C", true),
        SIATEC_CH("SIATEC-CH", true);

        private final String  algorithmName;
        private final boolean producesTecs;

        Algorithm(String algorithmName, boolean producesTecs) {
            this.algorithmName = algorithmName;
            this.producesTecs = producesTecs;
        }

        /**
         * Parse an algorithm name, ignoring case.
         *
         * @param name the name, such as "siatec-c"
         * @return the algorithm
         * @throws IllegalArgumentException if no algorithm has the name
         */
        public static Algorithm fromName(String name) {
            Objects.requireNonNull(name, "name cannot be null");
            var normalized = name.trim().toUpperCase(Locale.ROOT);
            for (var algorithm : values()) {
                if (algorithm.algorithmName.equals(normalized)) {
                    return algorithm;
                }
            }
            throw new IllegalArgumentException("Unknown algorithm: " + name);
        }

        public String getAlgorithmName() {
            return algorithmName;
        }

        /**
         * @return true if the algorithm computes TECs rather than MTPs
         */
        public boolean producesTecs() {
            return producesTecs;
        }
    }

    /**
     * Greedy coverings built on a TEC algorithm
     */
    public enum Covering {
        /** Report the TECs of the algorithm as they are */
        NONE,
        /** Iterative covering of the remaining points */
        COSIATEC,
        /** Single pass covering over ranked TECs */
        SIATEC_COMPRESS
    }

    private final Algorithm algorithm;
    private final int       r;
    private final boolean   removeDuplicates;
    private final double    maxIoi;
    private final Covering  covering;

    private DiscoveryConfiguration(Builder builder) {
        this.algorithm = builder.algorithm;
        this.r = builder.r;
        this.removeDuplicates = builder.removeDuplicates;
        this.maxIoi = builder.maxIoi;
        this.covering = builder.covering;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * SIATEC with duplicate removal, no covering
     */
    public static DiscoveryConfiguration defaultConfig() {
        return builder().build();
    }

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * @return the SIAR window size
     */
    public int getR() {
        return r;
    }

    /**
     * @return whether SIATEC computes one TEC per translationally distinct MTP
     */
    public boolean isRemoveDuplicates() {
        return removeDuplicates;
    }

    /**
     * @return the maximum inter-onset interval of SIATEC-C and SIATEC-CH
     */
    public double getMaxIoi() {
        return maxIoi;
    }

    public Covering getCovering() {
        return covering;
    }

    public Builder toBuilder() {
        return builder().withAlgorithm(algorithm)
                        .withR(r)
                        .withRemoveDuplicates(removeDuplicates)
                        .withMaxIoi(maxIoi)
                        .withCovering(covering);
    }

    @Override
    public String toString() {
        return String.format("DiscoveryConfiguration[algorithm=%s, r=%d, removeDuplicates=%s, maxIoi=%.3f, covering=%s]",
                             algorithm.getAlgorithmName(), r, removeDuplicates, maxIoi, covering);
    }

    public static class Builder {
        private Algorithm algorithm        = Algorithm.SIATEC;
        private int       r                = 3;
        private boolean   removeDuplicates = true;
        private double    maxIoi           = 4.0;
        private Covering  covering         = Covering.NONE;

        private Builder() {
        }

        public Builder withAlgorithm(Algorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
            return this;
        }

        /**
         * @param name an algorithm name, case insensitive
         */
        public Builder withAlgorithm(String name) {
            return withAlgorithm(Algorithm.fromName(name));
        }

        public Builder withR(int r) {
            if (r < 1) {
                throw new IllegalArgumentException("Window size r must be positive: " + r);
            }
            this.r = r;
            return this;
        }

        public Builder withRemoveDuplicates(boolean removeDuplicates) {
            this.removeDuplicates = removeDuplicates;
            return this;
        }

        public Builder withMaxIoi(double maxIoi) {
            if (!(maxIoi > 0.0) || Double.isInfinite(maxIoi)) {
                throw new IllegalArgumentException("Maximum IOI must be positive and finite: " + maxIoi);
            }
            this.maxIoi = maxIoi;
            return this;
        }

        public Builder withCovering(Covering covering) {
            this.covering = Objects.requireNonNull(covering, "covering cannot be null");
            return this;
        }

        /**
         * @throws IllegalStateException if a covering is combined with an algorithm that does not produce TECs
         */
        public DiscoveryConfiguration build() {
            if (covering != Covering.NONE && !algorithm.producesTecs()) {
                throw new IllegalStateException(
                "Covering " + covering + " requires a TEC algorithm, not " + algorithm.getAlgorithmName());
            }
            return new DiscoveryConfiguration(this);
        }
    }
}
