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
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.Tec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Removal of TECs whose patterns are translations of each other.
 *
 * @author hal.hildebrand
 */
public final class TranslationalDuplicates {

    private TranslationalDuplicates() {
    }

    /**
     * Keep one TEC per vectorized pattern. Of each group of translationally equivalent TECs the first in the given
     * order is kept. The result is ordered by vectorized length, then lexicographically by vectorized form.
     *
     * @param tecs the TECs
     * @param <P>  the point type
     * @return the translationally distinct TECs
     */
    public static <P extends Point<P>> List<Tec<P>> remove(List<Tec<P>> tecs) {
        var keyed = new ArrayList<Keyed<P>>(tecs.size());
        for (var tec : tecs) {
            keyed.add(new Keyed<>(tec.pattern().vectorize(), tec));
        }
        keyed.sort(Comparator.<Keyed<P>>comparingInt(k -> k.vectorized().size()).thenComparing(k -> k.vectorized()));

        var distinct = new ArrayList<Tec<P>>();
        Pattern<P> previous = null;
        for (var entry : keyed) {
            if (!entry.vectorized().equals(previous)) {
                distinct.add(entry.tec());
                previous = entry.vectorized();
            }
        }
        return distinct;
    }

    private record Keyed<P extends Point<P>>(Pattern<P> vectorized, Tec<P> tec) {
    }
}
