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

package com.hellblazer.refrain.discovery.compress;

import com.hellblazer.refrain.geometry.Pattern;
import com.hellblazer.refrain.geometry.Point;
import com.hellblazer.refrain.geometry.PointSet;
import com.hellblazer.refrain.geometry.Tec;

import java.util.ArrayList;

/**
 * @author hal.hildebrand
 */
final class Residuals {

    private Residuals() {
    }

    /**
     * The TEC of the first point of a non-empty point set, translated onto each of the other points.
     */
    static <P extends Point<P>> Tec<P> asTec(PointSet<P> residual) {
        var first = residual.get(0);
        var translators = new ArrayList<P>(residual.size() - 1);
        for (int i = 1; i < residual.size(); i++) {
            translators.add(residual.get(i).subtract(first));
        }
        return new Tec<>(Pattern.of(first), translators);
    }
}
