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

import java.util.OptionalDouble;

/**
 * A point with no numeric components, ordered by an integer label.
 *
 * @author hal.hildebrand
 */
final class LabelPoint implements Point<LabelPoint> {
    private final long label;

    LabelPoint(long label) {
        this.label = label;
    }

    @Override
    public LabelPoint add(LabelPoint other) {
        return new LabelPoint(label + other.label);
    }

    @Override
    public LabelPoint subtract(LabelPoint other) {
        return new LabelPoint(label - other.label);
    }

    @Override
    public LabelPoint multiply(double scalar) {
        return new LabelPoint((long) (label * scalar));
    }

    @Override
    public boolean isZero() {
        return label == 0;
    }

    @Override
    public OptionalDouble component(int index) {
        return OptionalDouble.empty();
    }

    @Override
    public int dimensionality() {
        return 0;
    }

    @Override
    public int compareTo(LabelPoint other) {
        return Long.compare(label, other.label);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LabelPoint other && label == other.label;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(label);
    }

    @Override
    public String toString() {
        return "LabelPoint{" + label + "}";
    }
}
