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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Next hop table over a frame tree. For every ordered pair of frames {@code (source, target)} it holds the neighbor of
 * {@code source} on the unique tree path to {@code target}, or {@link #ARRIVED} when the two coincide.
 *
 * <p>Since the topology is a tree the table is computed directly from parent pointers: if {@code source} is an
 * ancestor of {@code target} the next hop is the child of {@code source} on the way down, otherwise it is the parent of
 * {@code source}.
 *
 * @author hal.hildebrand
 */
public final class PathTable {

    /** Sentinel next hop meaning source and target coincide */
    public static final int ARRIVED = -1;

    private final int[][] next;

    private PathTable(int[][] next) {
        this.next = next;
    }

    /**
     * Build the table from a parent array, {@link Frame#NO_PARENT} marking the root. The parent array must describe a
     * tree.
     *
     * @param parents parent index per frame
     * @return the next hop table
     */
    public static PathTable fromParents(int[] parents) {
        var n = parents.length;
        var next = new int[n][n];
        var towardTarget = new int[n];
        for (int target = 0; target < n; target++) {
            Arrays.fill(towardTarget, ARRIVED);
            for (int node = target; parents[node] != Frame.NO_PARENT; node = parents[node]) {
                towardTarget[parents[node]] = node;
            }
            for (int source = 0; source < n; source++) {
                if (source == target) {
                    next[source][target] = ARRIVED;
                } else if (towardTarget[source] != ARRIVED) {
                    next[source][target] = towardTarget[source];
                } else {
                    next[source][target] = parents[source];
                }
            }
        }
        return new PathTable(next);
    }

    /**
     * @return the next frame from {@code source} toward {@code target}, or {@link #ARRIVED}
     */
    public int next(int source, int target) {
        return next[source][target];
    }

    /**
     * @return the frames visited from {@code source} to {@code target}, both inclusive
     */
    public List<Integer> path(int source, int target) {
        var path = new ArrayList<Integer>();
        path.add(source);
        for (int current = source; current != target; ) {
            current = next[current][target];
            path.add(current);
        }
        return path;
    }

    public int size() {
        return next.length;
    }
}
