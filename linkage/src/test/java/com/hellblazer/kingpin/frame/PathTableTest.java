/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kingpin.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kingpin.frame;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Path Table Tests")
public class PathTableTest {

    //       0
    //     /   \
    //    1     2
    //   / \     \
    //  3   4     5
    private static final int[] PARENTS = { Frame.NO_PARENT, 0, 0, 1, 1, 2 };

    @Test
    @DisplayName("Next hops walk up to the common ancestor, then down")
    void testNextHops() {
        var table = PathTable.fromParents(PARENTS);
        assertEquals(6, table.size());
        assertEquals(PathTable.ARRIVED, table.next(3, 3));
        assertEquals(1, table.next(3, 4));
        assertEquals(1, table.next(3, 5));
        assertEquals(0, table.next(1, 5));
        assertEquals(2, table.next(0, 5));
        assertEquals(5, table.next(2, 5));
        assertEquals(3, table.next(1, 3));
    }

    @Test
    @DisplayName("Paths include both ends")
    void testPaths() {
        var table = PathTable.fromParents(PARENTS);
        assertEquals(List.of(3, 1, 0, 2, 5), table.path(3, 5));
        assertEquals(List.of(5, 2, 0, 1, 4), table.path(5, 4));
        assertEquals(List.of(4), table.path(4, 4));
        assertEquals(List.of(0, 1, 3), table.path(0, 3));
    }

    @Test
    @DisplayName("Every pair is connected")
    void testCompleteness() {
        var table = PathTable.fromParents(PARENTS);
        for (int s = 0; s < PARENTS.length; s++) {
            for (int t = 0; t < PARENTS.length; t++) {
                var path = table.path(s, t);
                assertEquals(s, path.get(0));
                assertEquals(t, path.get(path.size() - 1));
                assertTrue(path.size() <= 5);
            }
        }
    }
}
