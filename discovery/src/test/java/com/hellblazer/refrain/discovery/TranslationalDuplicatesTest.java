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
import com.hellblazer.refrain.geometry.Point2i;
import com.hellblazer.refrain.geometry.Tec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TranslationalDuplicatesTest {

    @Test
    public void testFirstOfEachShapeIsKept() {
        var first = new Tec<>(Pattern.of(new Point2i(5, 0), new Point2i(6, 0)), List.of(new Point2i(1, 0)));
        var translated = new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(1, 0)), List.of(new Point2i(7, 0)));
        var longer = new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(1, 0), new Point2i(2, 0)),
                               List.of(new Point2i(1, 0)));
        var single = new Tec<>(Pattern.of(new Point2i(3, 3)), List.of(new Point2i(1, 0)));
        var other = new Tec<>(Pattern.of(new Point2i(0, 0), new Point2i(0, 1)), List.of(new Point2i(4, 0)));

        var distinct = TranslationalDuplicates.remove(List.of(longer, first, other, translated, single));

        assertEquals(List.of(single, other, first, longer), distinct);
    }

    @Test
    public void testEmpty() {
        assertTrue(TranslationalDuplicates.remove(List.<Tec<Point2i>>of()).isEmpty());
    }
}
