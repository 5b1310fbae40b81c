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

/**
 * The difference vector from the point at the source index to the point at the target index. Ordered by difference,
 * then by source index.
 *
 * @author hal.hildebrand
 */
record IndexedDifference<P extends Point<P>>(P difference, int source, int target)
implements Comparable<IndexedDifference<P>> {

    static <P extends Point<P>> IndexedDifference<P> between(P from, int source, P to, int target) {
        return new IndexedDifference<>(to.subtract(from), source, target);
    }

    @Override
    public int compareTo(IndexedDifference<P> other) {
        int ordering = difference.compareTo(other.difference);
        return ordering != 0 ? ordering : Integer.compare(source, other.source);
    }
}
