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
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * An algorithm computing maximal translatable patterns of a point set.
 *
 * @author hal.hildebrand
 */
public interface MtpAlgorithm {

    /**
     * Compute the MTPs of the point set, handing each to the consumer as soon as it is known. The consumer is called
     * synchronously on the calling thread and must not re-enter this algorithm.
     *
     * @param pointSet the point set
     * @param output   receives every MTP
     * @param <P>      the point type
     */
    <P extends Point<P>> void computeMtps(PointSet<P> pointSet, Consumer<? super Mtp<P>> output);

    /**
     * Compute all MTPs of the point set.
     *
     * @param pointSet the point set
     * @param <P>      the point type
     * @return the MTPs, in the order the algorithm produces them
     */
    default <P extends Point<P>> List<Mtp<P>> computeMtps(PointSet<P> pointSet) {
        var mtps = new ArrayList<Mtp<P>>();
        computeMtps(pointSet, mtps::add);
        return mtps;
    }
}
