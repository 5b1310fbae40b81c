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

import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point2d;
import com.hellblazer.refrain.geometry.Point2i;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SiatecTest {

    private final Point2d a = new Point2d(1.0, 1.0);
    private final Point2d b = new Point2d(2.0, 1.0);
    private final Point2d c = new Point2d(3.0, 1.0);
    private final Point2d d = new Point2d(4.0, 1.0);

    @Test
    @DisplayName("Collinear points yield one TEC per MTP")
    public void testMinimalNumberOfMtps() {
        var tecs = new ArrayList<>(new Siatec(true).computeTecs(PointSet.of(a, b, c, d)));
        tecs.sort(Comparator.comparingInt(tec -> tec.pattern().size()));

        assertEquals(3, tecs.size());
        assertEquals(new Tec<>(Pattern.of(a),
                               List.of(new Point2d(1.0, 0.0), new Point2d(2.0, 0.0), new Point2d(3.0, 0.0))),
                     tecs.get(0));
        assertEquals(new Tec<>(Pattern.of(a, b), List.of(new Point2d(1.0, 0.0), new Point2d(2.0, 0.0))),
                     tecs.get(1));
        assertEquals(new Tec<>(Pattern.of(a, b, c), List.of(new Point2d(1.0, 0.0))), tecs.get(2));
    }

    @Test
    public void testDuplicateRemoval() {
        // [(0,0)] and [(1,0)] are both single point MTPs
        var pointSet = PointSet.of(new Point2i(0, 0), new Point2i(1, 0), new Point2i(10, 0), new Point2i(11, 0));

        var distinct = new Siatec(true).computeTecs(pointSet);
        var all = new Siatec(false).computeTecs(pointSet);

        assertEquals(4, all.size());
        assertEquals(3, distinct.size());
        assertEquals(new Tec<>(Pattern.of(new Point2i(1, 0)),
                               List.of(new Point2i(-1, 0), new Point2i(9, 0), new Point2i(10, 0))),
                     distinct.get(0));
        assertEquals(new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(1, 0)), List.of(new Point2i(10, 0))),
                     distinct.get(1));
        assertEquals(new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(10, 0)), List.of(new Point2i(1, 0))),
                     distinct.get(2));
    }

    @Test
    public void testEveryOccurrenceIsInPointSet() {
        var pointSet = PointSet.of(new Point2i(0, 60), new Point2i(1, 62), new Point2i(2, 64), new Point2i(4, 60),
                                   new Point2i(5, 62), new Point2i(6, 64), new Point2i(7, 50));
        for (var tec : new Siatec().computeTecs(pointSet)) {
            for (var occurrence : tec.expand()) {
                for (var point : occurrence) {
                    assertTrue(pointSet.contains(point), () -> tec + " leaves the point set");
                }
            }
        }
    }

    @Test
    public void testDegenerateInput() {
        assertTrue(new Siatec().computeTecs(PointSet.<Point2d>empty()).isEmpty());
        assertTrue(new Siatec().computeTecs(PointSet.of(a)).isEmpty());
    }
}
