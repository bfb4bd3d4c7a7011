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
package com.hellblazer.kingpin.linkage;

/**
 * The axle a suspension corner belongs to.
 *
 * @author hal.hildebrand
 */
public enum Axle {
    FRONT {
        @Override
        public double longitudinalOffset(double wheelbase, double frontWeightDistribution) {
            return wheelbase * (1 - frontWeightDistribution);
        }
    },
    REAR {
        @Override
        public double longitudinalOffset(double wheelbase, double frontWeightDistribution) {
            return -wheelbase * frontWeightDistribution;
        }
    };

    /**
     * Longitudinal position of this axle relative to the center of gravity.
     *
     * @param wheelbase               wheelbase
     * @param frontWeightDistribution static front weight fraction in [0, 1]
     */
    public abstract double longitudinalOffset(double wheelbase, double frontWeightDistribution);
}
