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
package com.hellblazer.kingpin.geometry;

import javax.vecmath.Matrix4d;

/**
 * Principal axes of a right handed frame, each able to produce its homogeneous elementary rotation.
 *
 * @author hal.hildebrand
 */
public enum Axis {
    /**
     * Rotation around the X axis from Y axis towards Z axis
     */
    X {
        @Override
        public Matrix4d rotation(double angle) {
            var c = Math.cos(angle);
            var s = Math.sin(angle);
            return new Matrix4d(1, 0, 0, 0,
                                0, c, -s, 0,
                                0, s, c, 0,
                                0, 0, 0, 1);
        }
    },
    /**
     * Rotation around the Y axis from Z axis towards X axis
     */
    Y {
        @Override
        public Matrix4d rotation(double angle) {
            var c = Math.cos(angle);
            var s = Math.sin(angle);
            return new Matrix4d(c, 0, s, 0,
                                0, 1, 0, 0,
                                -s, 0, c, 0,
                                0, 0, 0, 1);
        }
    },
    /**
     * Rotation around the Z axis from X axis towards Y axis
     */
    Z {
        @Override
        public Matrix4d rotation(double angle) {
            var c = Math.cos(angle);
            var s = Math.sin(angle);
            return new Matrix4d(c, -s, 0, 0,
                                s, c, 0, 0,
                                0, 0, 1, 0,
                                0, 0, 0, 1);
        }
    };

    /**
     * @param angle rotation angle in radians
     * @return the 4x4 homogeneous rotation about this axis
     */
    public abstract Matrix4d rotation(double angle);
}
