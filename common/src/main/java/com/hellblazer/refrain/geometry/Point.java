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

package com.hellblazer.refrain.geometry;

import java.util.OptionalDouble;

/**
 * Base interface for all point types.
 *
 * Points behave as vectors: they can be added, subtracted and scaled. The natural ordering is lexicographic over the
 * components (component 0 first, then component 1, ...). Implementations must be immutable and must keep
 * {@code equals}, {@code hashCode} and {@code compareTo} consistent with each other.
 *
 * @param <P> The concrete point type (self-referential for type safety)
 * @author hal.hildebrand
 */
public interface Point<P extends Point<P>> extends Comparable<P> {

    /**
     * Add another point to this point.
     *
     * @param other Point to add
     * @return New point with summed components
     */
    P add(P other);

    /**
     * Subtract another point from this point.
     *
     * @param other Point to subtract
     * @return New point with subtracted components
     */
    P subtract(P other);

    /**
     * Multiply this point by a scalar.
     *
     * @param scalar Scalar multiplier
     * @return New point with scaled components
     */
    P multiply(double scalar);

    /**
     * @return true if every component of this point is zero
     */
    boolean isZero();

    /**
     * Answer the component at the given index as a double.
     *
     * @param index index of the component
     * @return the component, or empty if the index is out of range
     */
    OptionalDouble component(int index);

    /**
     * @return the number of components of this point
     */
    int dimensionality();

    /**
     * Answer the negation of this point, the translator that undoes a translation by this point.
     *
     * @return this point scaled by -1
     */
    default P negate() {
        return multiply(-1.0);
    }
}
