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

package com.hellblazer.refrain.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class IntArrayListTest {

    @Test
    public void testGrowth() {
        var list = new IntArrayList(1);
        for (int i = 0; i < 100; i++) {
            list.addInt(i);
        }
        assertEquals(100, list.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i, list.getInt(i));
        }
    }

    @Test
    public void testOutOfRange() {
        var list = IntArrayList.of(1, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> list.getInt(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> list.subList(1, 3));
    }

    @Test
    public void testSubListIsCopy() {
        var list = IntArrayList.of(4, 5, 6, 7);
        var sub = list.subList(1, 3);
        assertEquals(IntArrayList.of(5, 6), sub);
        sub.addInt(9);
        assertEquals(4, list.size());
        assertEquals(6, list.getInt(2));
    }

    @Test
    public void testEquality() {
        var list = new IntArrayList();
        assertTrue(list.isEmpty());
        assertArrayEquals(new int[0], list.toArray());
        assertEquals(IntArrayList.of(), list);
        list.addInt(3);
        assertEquals(IntArrayList.of(3), list);
        assertEquals(IntArrayList.of(3).hashCode(), list.hashCode());
        assertEquals("[3]", list.toString());
        assertNotEquals(IntArrayList.of(), list);
    }
}
