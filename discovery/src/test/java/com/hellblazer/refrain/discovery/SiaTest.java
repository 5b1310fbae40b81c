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
import com.hellblazer.refrain.geometry.Point2d;
import com.hellblazer.refrain.geometry.PointSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SiaTest {

    private final Point2d a = new Point2d(1.0, 1.0);
    private final Point2d b = new Point2d(2.0, 1.0);
    private final Point2d c = new Point2d(3.0, 1.0);
    private final Point2d d = new Point2d(4.0, 1.0);

    @Test
    @DisplayName("Collinear points yield the minimal number of MTPs")
    public void testMinimalNumberOfMtps() {
        var mtps = new Sia().computeMtps(PointSet.of(a, b, c, d));

        assertEquals(List.of(new Mtp<>(new Point2d(1.0, 0.0), Pattern.of(a, b, c)),
                             new Mtp<>(new Point2d(2.0, 0.0), Pattern.of(a, b)),
                             new Mtp<>(new Point2d(3.0, 0.0), Pattern.of(a))), mtps);
    }

    @Test
    @DisplayName("Points in general position yield one MTP per point pair")
    public void testMaximalNumberOfMtps() {
        var pointSet = PointSet.of(new Point2d(1.0, 1.0), new Point2d(2.0, 2.0), new Point2d(3.0, 4.0),
                                   new Point2d(4.0, 8.0));

        var mtps = new Sia().computeMtps(pointSet);
        assertEquals(6, mtps.size());
        for (var mtp : mtps) {
            assertEquals(1, mtp.pattern().size());
        }
    }

    @Test
    public void testStreamingMatchesEager() {
        var pointSet = PointSet.of(a, b, c, d, new Point2d(2.5, 3.0));
        var streamed = new ArrayList<Mtp<Point2d>>();
        new Sia().computeMtps(pointSet, streamed::add);
        assertEquals(new Sia().computeMtps(pointSet), streamed);
    }

    @Test
    public void testPatternsTranslateIntoPointSet() {
        var pointSet = PointSet.of(a, b, d, new Point2d(2.0, 3.0), new Point2d(3.0, 3.0));
        for (var mtp : new Sia().computeMtps(pointSet)) {
            for (var point : mtp.pattern().translate(mtp.translator())) {
                assertTrue(pointSet.contains(point), () -> mtp + " leaves the point set");
            }
        }
    }

    @Test
    public void testDegenerateInput() {
        assertTrue(new Sia().computeMtps(PointSet.<Point2d>empty()).isEmpty());
        assertTrue(new Sia().computeMtps(PointSet.of(a)).isEmpty());
    }
}
