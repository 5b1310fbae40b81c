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
import com.hellblazer.refrain.geometry.Tec;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * An algorithm computing translational equivalence classes of a point set.
 *
 * @author hal.hildebrand
 */
public interface TecAlgorithm {

    /**
     * Compute the TECs of the point set, handing each to the consumer as soon as it is known. The consumer is called
     * synchronously on the calling thread and must not re-enter this algorithm.
     *
     * @param pointSet the point set
     * @param output   receives every TEC
     * @param <P>      the point type
     */
    <P extends Point<P>> void computeTecs(PointSet<P> pointSet, Consumer<? super Tec<P>> output);

    /**
     * Compute all TECs of the point set.
     *
     * @param pointSet the point set
     * @param <P>      the point type
     * @return the TECs, in the order the algorithm produces them
     */
    default <P extends Point<P>> List<Tec<P>> computeTecs(PointSet<P> pointSet) {
        var tecs = new ArrayList<Tec<P>>();
        computeTecs(pointSet, tecs::add);
        return tecs;
    }
}
