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

import com.hellblazer.refrain.discovery.DiscoveryConfiguration.Algorithm;
import com.hellblazer.refrain.discovery.DiscoveryConfiguration.Covering;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DiscoveryConfigurationTest {

    @Test
    public void testDefaults() {
        var config = DiscoveryConfiguration.defaultConfig();
        assertEquals(Algorithm.SIATEC, config.getAlgorithm());
        assertEquals(3, config.getR());
        assertTrue(config.isRemoveDuplicates());
        assertEquals(4.0, config.getMaxIoi());
        assertEquals(Covering.NONE, config.getCovering());
    }

    @ParameterizedTest
    @CsvSource({ "sia, SIA", "SIAR, SIAR", "Siatec, SIATEC", "siatec-c, SIATEC_C", " SIATEC-CH , SIATEC_CH" })
    public void testAlgorithmNames(String name, Algorithm expected) {
        assertEquals(expected, Algorithm.fromName(name));
        assertEquals(expected, DiscoveryConfiguration.builder().withAlgorithm(name).build().getAlgorithm());
    }

    @Test
    public void testUnknownAlgorithm() {
        assertThrows(IllegalArgumentException.class, () -> Algorithm.fromName("SIATEC_C"));
        assertThrows(IllegalArgumentException.class, () -> Algorithm.fromName("cosiatec"));
    }

    @Test
    public void testParameterValidation() {
        var builder = DiscoveryConfiguration.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.withR(0));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaxIoi(0.0));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaxIoi(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> builder.withMaxIoi(Double.POSITIVE_INFINITY));
        assertThrows(NullPointerException.class, () -> builder.withCovering(null));
    }

    @Test
    public void testCoveringRequiresTecAlgorithm() {
        var builder = DiscoveryConfiguration.builder().withAlgorithm(Algorithm.SIAR).withCovering(Covering.COSIATEC);
        assertThrows(IllegalStateException.class, builder::build);

        var config = builder.withAlgorithm(Algorithm.SIATEC_CH).build();
        assertEquals(Covering.COSIATEC, config.getCovering());
    }

    @Test
    public void testToBuilder() {
        var config = DiscoveryConfiguration.builder()
                                           .withAlgorithm(Algorithm.SIATEC_C)
                                           .withMaxIoi(2.5)
                                           .withCovering(Covering.SIATEC_COMPRESS)
                                           .build();
        var copy = config.toBuilder().build();

        assertEquals(config.getAlgorithm(), copy.getAlgorithm());
        assertEquals(config.getMaxIoi(), copy.getMaxIoi());
        assertEquals(config.getCovering(), copy.getCovering());
        assertEquals(config.toString(), copy.toString());
    }
}
