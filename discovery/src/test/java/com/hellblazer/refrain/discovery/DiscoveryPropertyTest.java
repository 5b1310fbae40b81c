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

import com.hellblazer.refrain.geometry.Point2i;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;
import net.jqwik.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property tests for the discovery algorithms over random small point sets.
 *
 * @author hal.hildebrand
 */
class DiscoveryPropertyTest {

    @Property(tries = 200)
    @Label("Every SIA pattern translated by its translator stays in the point set")
    void siaPatternsAreTranslatable(@ForAll("pointSets") PointSet<Point2i> pointSet) {
        for (var mtp : new Sia().computeMtps(pointSet)) {
            for (var point : mtp.pattern().translate(mtp.translator())) {
                assertTrue(pointSet.contains(point));
            }
        }
    }

    @Property(tries = 200)
    @Label("Every SIA MTP is maximal")
    void siaPatternsAreMaximal(@ForAll("pointSets") PointSet<Point2i> pointSet) {
        for (var mtp : new Sia().computeMtps(pointSet)) {
            var maximal = pointSet.intersect(pointSet.translate(mtp.translator().negate()));
            assertEquals(maximal.toPattern(), mtp.pattern());
        }
    }

    @Property(tries = 100)
    @Label("Every SIATEC occurrence lies in the point set")
    void siatecOccurrencesAreInPointSet(@ForAll("pointSets") PointSet<Point2i> pointSet) {
        assertOccurrencesInPointSet(new Siatec().computeTecs(pointSet), pointSet);
    }

    @Property(tries = 100)
    @Label("Every windowed TEC occurrence lies in the point set and pruning only drops TECs")
    void windowedTecsAreConsistent(@ForAll("pointSets") PointSet<Point2i> pointSet) {
        var unpruned = new SiatecC(2.0).computeTecs(pointSet);
        var pruned = new SiatecCH(2.0).computeTecs(pointSet);

        assertOccurrencesInPointSet(unpruned, pointSet);
        assertTrue(unpruned.containsAll(pruned));
    }

    @Property(tries = 100)
    @Label("Duplicate removal keeps every shape of the exhaustive TECs")
    void duplicateRemovalKeepsShapes(@ForAll("pointSets") PointSet<Point2i> pointSet) {
        var distinct = new Siatec(true).computeTecs(pointSet);
        var all = new Siatec(false).computeTecs(pointSet);

        assertEquals(TranslationalDuplicates.remove(all).size(), distinct.size());
    }

    private static void assertOccurrencesInPointSet(List<Tec<Point2i>> tecs, PointSet<Point2i> pointSet) {
        for (var tec : tecs) {
            for (var occurrence : tec.expand()) {
                for (var point : occurrence) {
                    assertTrue(pointSet.contains(point), () -> tec + " leaves the point set");
                }
            }
        }
    }

    @Provide
    Arbitrary<PointSet<Point2i>> pointSets() {
        var onsets = Arbitraries.longs().between(0, 12);
        var pitches = Arbitraries.longs().between(0, 4);
        return Combinators.combine(onsets, pitches).as(Point2i::new).list().ofMaxSize(14).map(PointSet::from);
    }
}
