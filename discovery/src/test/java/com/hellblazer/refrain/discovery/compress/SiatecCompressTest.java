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

import com.hellblazer.refrain.discovery.Siatec;
import com.hellblazer.refrain.discovery.SiatecCH;
import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point2i;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SiatecCompressTest {

    private final PointSet<Point2i> line = PointSet.of(new Point2i(0, 0), new Point2i(1, 0), new Point2i(2, 0),
                                                       new Point2i(3, 0));

    @Test
    public void testEvenlySpacedPoints() {
        var tecs = new SiatecCompress(new Siatec()).computeTecs(line);

        assertEquals(List.of(new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(1, 0)), List.of(new Point2i(2, 0)))),
                     tecs);
    }

    @Test
    public void testResidualPointsAreCovered() {
        var pointSet = PointSet.of(new Point2i(0, 60), new Point2i(1, 62), new Point2i(2, 64), new Point2i(4, 60),
                                   new Point2i(5, 62), new Point2i(6, 64), new Point2i(7, 50), new Point2i(9, 51));

        var tecs = new SiatecCompress(new SiatecCH(3.0)).computeTecs(pointSet);

        var covered = PointSet.<Point2i>empty();
        for (var tec : tecs) {
            covered = covered.union(tec.coveredSet());
        }
        assertEquals(pointSet, covered);
    }

    @Test
    public void testNothingToCompress() {
        var pointSet = PointSet.of(new Point2i(0, 0), new Point2i(3, 7));

        var tecs = new SiatecCompress(new Siatec()).computeTecs(pointSet);

        assertEquals(List.of(new Tec<>(Pattern.of(new Point2i(0, 0)), List.of(new Point2i(3, 7)))), tecs);
    }

    @Test
    public void testRankingPutsBetterFirst() {
        var pair = TecStats.of(new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(1, 0)),
                                         List.of(new Point2i(2, 0))), line);
        var single = TecStats.of(new Tec<>(Pattern.of(new Point2i(0, 0)),
                                           List.of(new Point2i(1, 0), new Point2i(2, 0), new Point2i(3, 0))), line);
        var partial = TecStats.of(new Tec<>(Pattern.of(new Point2i(0, 0)), List.of(new Point2i(1, 0))), line);

        var ranked = new ArrayList<>(List.of(partial, single, pair));
        SiatecCompress.rank(ranked);

        assertSame(pair, ranked.get(0));
        assertEquals(3, ranked.size());
    }
}
