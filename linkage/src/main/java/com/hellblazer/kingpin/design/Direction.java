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
package com.hellblazer.kingpin.design;

import javax.vecmath.Tuple3d;

/**
 * The three axes of the vehicle reference convention.
 *
 * @author hal.hildebrand
 */
public enum Direction {
    LONGITUDINAL, LATERAL, VERTICAL;

    public double of(Tuple3d t) {
        return switch (this) {
            case LONGITUDINAL -> t.x;
            case LATERAL -> t.y;
            case VERTICAL -> t.z;
        };
    }

    public void set(Tuple3d t, double value) {
        switch (this) {
            case LONGITUDINAL -> t.x = value;
            case LATERAL -> t.y = value;
            case VERTICAL -> t.z = value;
        }
    }

    public String label() {
        return switch (this) {
            case LONGITUDINAL -> "Longitudinal";
            case LATERAL -> "Lateral";
            case VERTICAL -> "Vertical";
        };
    }
}
