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
import com.hellblazer.refrain.geometry.Point2i;
import com.hellblazer.refrain.geometry.PointSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DifferenceIndexTest {

    private final PointSet<Point2i> pointSet = PointSet.of(new Point2i(0, 0), new Point2i(1, 0), new Point2i(2, 0),
                                                           new Point2i(3, 0), new Point2i(10, 0));

    @Test
    public void testBackendsAgree() {
        var sorted = DifferenceIndex.sorted(pointSet, 2.0);
        var hashed = DifferenceIndex.hashed(pointSet, 2.0);

        // (1,0), (2,0) from the first four points; (10,0) is beyond the window of every other point
        assertEquals(2, sorted.size());
        assertEquals(2, hashed.size());

        for (var difference : new Point2i[] { new Point2i(1, 0), new Point2i(2, 0) }) {
            var s = sorted.find(difference);
            var h = hashed.find(difference);
            assertEquals(s.size(), h.size());
            for (int k = 0; k < s.size(); k++) {
                assertEquals(s.source(k), h.source(k));
                assertEquals(s.target(k), h.target(k));
            }
        }

        var unit = sorted.find(new Point2i(1, 0));
        assertEquals(IntArrayList.of(1, 2, 3), unit.targets());
        assertEquals(0, unit.source(0));
    }

    @Test
    public void testMissIsFatal() {
        assertThrows(DiscoveryException.class, () -> DifferenceIndex.sorted(pointSet, 2.0).find(new Point2i(7, 0)));
        assertThrows(DiscoveryException.class, () -> DifferenceIndex.hashed(pointSet, 2.0).find(new Point2i(7, 0)));
    }

    @Test
    public void testChainMatching() {
        var unit = DifferenceIndex.sorted(pointSet, 2.0).find(new Point2i(1, 0));

        assertEquals(IntArrayList.of(2, 3), unit.forward(IntArrayList.of(1, 2, 10)));
        assertEquals(IntArrayList.of(0, 2), unit.backward(IntArrayList.of(1, 3)));
        assertTrue(unit.forward(IntArrayList.of(4)).isEmpty());
    }
}
