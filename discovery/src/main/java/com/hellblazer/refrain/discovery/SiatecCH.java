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

import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;

/**
 * SIATEC-CH: IOI-windowed TEC discovery resolving translators through a hashed difference index, skipping candidate
 * patterns whose points are already covered by patterns at least as long.
 *
 * @author hal.hildebrand
 */
public class SiatecCH extends IoiWindowedSiatec {

    /**
     * @param maxIoi the maximum inter-onset interval between successive points of a pattern
     */
    public SiatecCH(double maxIoi) {
        super(maxIoi, true);
    }

    @Override
    protected <P extends Point<P>> DifferenceIndex<P> indexDifferences(PointSet<P> pointSet) {
        return DifferenceIndex.hashed(pointSet, maxIoi);
    }
}
