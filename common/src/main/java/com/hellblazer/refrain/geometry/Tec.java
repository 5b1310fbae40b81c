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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A translational equivalence class: a pattern and the translators that map it onto its other occurrences in a point
 * set. The translators never contain the zero vector; the pattern itself is the implicit zero-translated occurrence.
 *
 * @param pattern     the pattern
 * @param translators the non-zero translators of the pattern
 * @param <P>         the point type
 * @author hal.hildebrand
 */
public record Tec<P extends Point<P>>(Pattern<P> pattern, List<P> translators) {

    public Tec {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        translators = List.copyOf(translators);
        for (var translator : translators) {
            if (translator.isZero()) {
                throw new IllegalArgumentException("Translators cannot contain the zero vector: " + translators);
            }
        }
    }

    /**
     * Answer every occurrence of the pattern. The first occurrence is the pattern itself, followed by one translated
     * copy per translator.
     *
     * @return the occurrences
     */
    public List<Pattern<P>> expand() {
        var occurrences = new ArrayList<Pattern<P>>(translators.size() + 1);
        occurrences.add(pattern);
        for (var translator : translators) {
            occurrences.add(pattern.translate(translator));
        }
        return occurrences;
    }

    /**
     * @return the set of all points in all occurrences of the pattern
     */
    public PointSet<P> coveredSet() {
        return coveredSet(pattern, translators);
    }

    /**
     * Answer the conjugate of this TEC. The conjugate covers the same points with the roles of pattern structure and
     * translation exchanged: its pattern is the first point of this pattern together with that point translated by each
     * translator, and its translators are the offsets of the remaining pattern points from the first point.
     *
     * @return the conjugate TEC
     */
    public Tec<P> conjugate() {
        if (pattern.isEmpty()) {
            return this;
        }
        var first = pattern.first();

        var conjugatePoints = new ArrayList<P>(translators.size() + 1);
        conjugatePoints.add(first);
        for (var translator : translators) {
            conjugatePoints.add(first.add(translator));
        }

        var conjugateTranslators = new ArrayList<P>(pattern.size() - 1);
        for (int i = 1; i < pattern.size(); i++) {
            conjugateTranslators.add(pattern.get(i).subtract(first));
        }

        return new Tec<>(new Pattern<>(conjugatePoints), conjugateTranslators);
    }

    /**
     * Answer this TEC without the translators that are implied by the others. A translator is dropped when removing
     * it leaves the covered set unchanged. Duplicate translators are always dropped.
     *
     * @return the TEC with only the translators needed to cover the same points
     */
    public Tec<P> removeRedundantTranslators() {
        var distinct = new ArrayList<>(new LinkedHashSet<>(translators));
        var covered = coveredSet(pattern, distinct);

        var kept = distinct;
        for (var translator : distinct) {
            var candidate = new ArrayList<>(kept);
            candidate.remove(translator);
            if (coveredSet(pattern, candidate).equals(covered)) {
                kept = candidate;
            }
        }
        return new Tec<>(pattern, kept);
    }

    /**
     * @return the number of points and vectors needed to represent this TEC
     */
    public int encodingSize() {
        return pattern.size() + translators.size();
    }

    private static <P extends Point<P>> PointSet<P> coveredSet(Pattern<P> pattern, List<P> translators) {
        var points = new ArrayList<P>(pattern.size() * (translators.size() + 1));
        pattern.forEach(points::add);
        for (var translator : translators) {
            for (var point : pattern) {
                points.add(point.add(translator));
            }
        }
        return PointSet.from(points);
    }
}
