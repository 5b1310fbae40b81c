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

import java.util.List;
import java.util.Objects;

/**
 * A maximal translatable pattern: the largest subset of a point set that, translated by the translator, is still
 * contained in the point set.
 *
 * @param translator the translation vector
 * @param pattern    the points that can be translated by the translator
 * @param <P>        the point type
 * @author hal.hildebrand
 */
public record Mtp<P extends Point<P>>(P translator, Pattern<P> pattern) {

    public Mtp {
        Objects.requireNonNull(translator, "translator cannot be null");
        Objects.requireNonNull(pattern, "pattern cannot be null");
    }

    /**
     * @return this MTP as a TEC with the single translator
     */
    public Tec<P> toTec() {
        return new Tec<>(pattern, List.of(translator));
    }
}
