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

/**
 * The six spatial freedoms a frame may represent relative to its parent. Documentary only; the solver does not
 * evaluate them.
 *
 * @author hal.hildebrand
 */
public enum DegreeOfFreedom {
    /** translation along x */
    SURGE,
    /** translation along y */
    SWAY,
    /** translation along z */
    HEAVE,
    /** rotation about x */
    ROLL,
    /** rotation about y */
    PITCH,
    /** rotation about z */
    YAW
}
