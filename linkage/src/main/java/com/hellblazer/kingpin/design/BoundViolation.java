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

/**
 * A position written outside its design bound on one axis. Violations are reported, never thrown; the write they
 * describe still takes place.
 *
 * @param point  label of the point
 * @param frame  frame the value is expressed in
 * @param axis   offending axis
 * @param min    bound minimum
 * @param max    bound maximum
 * @param actual value written
 * @author hal.hildebrand
 */
public record BoundViolation(String point, String frame, Direction axis, double min, double max, double actual) {

    public String message() {
        return String.format("%s exceeds %s bounds in frame %s, min: %.3g, max: %.3g, current: %.3g", point,
                             axis.label(), frame, min, max, actual);
    }
}
