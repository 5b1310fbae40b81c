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

import com.hellblazer.refrain.common.IntArrayList;

/**
 * Per point, the length of the longest accepted pattern known to include the point. Values only ever increase.
 *
 * @author hal.hildebrand
 */
final class CoverTracker {
    private final int[] cover;

    CoverTracker(int size) {
        cover = new int[size];
    }

    int get(int index) {
        return cover[index];
    }

    /**
     * @return true if a pattern of the given length would raise the cover of any of the source or target indices
     */
    boolean improves(IntArrayList sources, IntArrayList targets, int length) {
        for (int i = 0; i < sources.size(); i++) {
            if (cover[sources.getInt(i)] < length || cover[targets.getInt(i)] < length) {
                return true;
            }
        }
        return false;
    }

    void raise(int index, int length) {
        if (cover[index] < length) {
            cover[index] = length;
        }
    }
}
