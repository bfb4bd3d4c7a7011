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
 * Closed form instant center placement. The instant center lies on the jacking line from the contact patch through
 * the target roll (or pitch) center, at swing arm length {@code L} from the wheel center.
 *
 * @author hal.hildebrand
 */
public final class InstantCenter {

    /** Stand in for the infinite swing arm of a zero gain, in millimetres */
    public static final double INFINITE_SWING_ARM = 1e6;

    private static final double TOLERANCE = 1e-12;

    private InstantCenter() {
        // Prevent instantiation
    }

    /**
     * Swing arm length for an angular gain: {@code 1 / atan(|gain|)}. A zero gain yields positive infinity.
     *
     * @param gain camber or caster gain, radians per millimetre
     */
    public static double swingArmLength(double gain) {
        return 1.0 / Math.atan(Math.abs(gain));
    }

    /**
     * Solve the instant center in the view plane of the swing arm.
     *
     * @param x0           horizontal contact patch coordinate (lateral in front view, longitudinal in side view)
     * @param centerHeight height of the target roll or pitch center above the ground
     * @param swingArm     swing arm length, may be infinite
     * @param loadedRadius tire loaded radius
     * @return {horizontal, vertical} coordinates of the instant center
     * @throws IllegalArgumentException when the jacking line misses the swing arm circle
     */
    public static double[] solve(double x0, double centerHeight, double swingArm, double loadedRadius) {
        var length = Double.isInfinite(swingArm) ? INFINITE_SWING_ARM : swingArm;
        double vertical;
        if (centerHeight == 0.0) {
            vertical = 0.0;
        } else {
            var ratio = x0 / centerHeight;
            var a = 1 + ratio * ratio;
            var b = -2 * loadedRadius;
            var c = loadedRadius * loadedRadius - length * length;
            var discriminant = b * b - 4 * a * c;
            if (discriminant < 0) {
                throw noIntersection(x0, centerHeight, length, loadedRadius);
            }
            vertical = (-b + Math.signum(centerHeight) * Math.sqrt(discriminant)) / (2 * a);
        }
        var rise = vertical - loadedRadius;
        var run = length * length - rise * rise;
        // a tangent jacking line leaves a tiny negative residue
        if (run < -TOLERANCE * length * length) {
            throw noIntersection(x0, centerHeight, length, loadedRadius);
        }
        var horizontal = x0 - Math.signum(x0) * Math.sqrt(Math.max(0.0, run));
        return new double[] { horizontal, vertical };
    }

    private static IllegalArgumentException noIntersection(double x0, double centerHeight, double swingArm,
                                                           double loadedRadius) {
        return new IllegalArgumentException(
        String.format("Jacking line misses the swing arm circle: x0=%s, hc=%s, L=%s, rl=%s", x0, centerHeight,
                      swingArm, loadedRadius));
    }
}
