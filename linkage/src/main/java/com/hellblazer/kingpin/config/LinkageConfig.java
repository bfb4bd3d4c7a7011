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
package com.hellblazer.kingpin.config;

import com.hellblazer.kingpin.design.DesignBounds;
import com.hellblazer.kingpin.linkage.LinkageSystem;
import com.hellblazer.kingpin.linkage.SuspensionKinematics;
import com.hellblazer.kingpin.linkage.Target;

/**
 * A loaded linkage configuration in internal units.
 *
 * @param name   system name
 * @param target design targets
 * @param bounds design bounds, pickups and auxiliary labels
 * @author hal.hildebrand
 */
public record LinkageConfig(String name, Target target, DesignBounds bounds) {

    /**
     * @return an unsolved system for this configuration
     */
    public LinkageSystem toSystem() {
        return SuspensionKinematics.build(name, target, bounds);
    }
}
