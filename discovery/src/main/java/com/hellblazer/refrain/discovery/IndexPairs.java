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
 * The (source, target) point index pairs sharing one difference vector, in ascending source order. Because a fixed
 * difference maps each source to exactly one target and the point set is sorted, the targets are ascending as well.
 *
 * @author hal.hildebrand
 */
public final class IndexPairs {
    private final IntArrayList sources = new IntArrayList();
    private final IntArrayList targets = new IntArrayList();

    void add(int source, int target) {
        sources.addInt(source);
        targets.addInt(target);
    }

    public int size() {
        return sources.size();
    }

    public int source(int index) {
        return sources.getInt(index);
    }

    public int target(int index) {
        return targets.getInt(index);
    }

    /**
     * @return a copy of the target indices
     */
    public IntArrayList targets() {
        return targets.subList(0, targets.size());
    }

    /**
     * Follow this difference forward from the given indices.
     *
     * @param from ascending point indices
     * @return the targets of the pairs whose source is one of the indices, ascending
     */
    public IntArrayList forward(IntArrayList from) {
        return match(from, sources, targets);
    }

    /**
     * Follow this difference backward from the given indices.
     *
     * @param to ascending point indices
     * @return the sources of the pairs whose target is one of the indices, ascending
     */
    public IntArrayList backward(IntArrayList to) {
        return match(to, targets, sources);
    }

    private static IntArrayList match(IntArrayList indices, IntArrayList keys, IntArrayList values) {
        var matched = new IntArrayList();
        int j = 0;
        int k = 0;
        while (j < indices.size() && k < keys.size()) {
            int index = indices.getInt(j);
            int key = keys.getInt(k);
            if (index == key) {
                matched.addInt(values.getInt(k));
                j++;
                k++;
            } else if (index < key) {
                j++;
            } else {
                k++;
            }
        }
        return matched;
    }

    @Override
    public String toString() {
        return "IndexPairs[sources=" + sources + ", targets=" + targets + "]";
    }
}
