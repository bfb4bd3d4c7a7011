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

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Design space bound of one labeled point: a (min, max) pair per {@link Direction}. An axis whose pair is NaN is a fixed
 * design parameter that is not drawn from a range.
 *
 * @author hal.hildebrand
 */
public final class DesignBound {

    private final double[] min;
    private final double[] max;

    private DesignBound(double[] min, double[] max) {
        this.min = min;
        this.max = max;
        for (var axis : Direction.values()) {
            var lo = min[axis.ordinal()];
            var hi = max[axis.ordinal()];
            if (Double.isNaN(lo) != Double.isNaN(hi)) {
                throw new IllegalArgumentException(
                axis.label() + " bound must be fully fixed (NaN) or fully ranged: [" + lo + ", " + hi + "]");
            }
            if (lo > hi) {
                throw new IllegalArgumentException(axis.label() + " bound min exceeds max: [" + lo + ", " + hi + "]");
            }
        }
    }

    /**
     * @param rows one {min, max} row per axis, longitudinal first
     * @throws IllegalArgumentException if the table is not 3x2 or a min exceeds its max
     */
    public static DesignBound of(double[][] rows) {
        if (rows.length != 3) {
            throw new IllegalArgumentException("Design bound requires 3 axis rows, got " + rows.length);
        }
        var min = new double[3];
        var max = new double[3];
        for (int i = 0; i < 3; i++) {
            if (rows[i].length != 2) {
                throw new IllegalArgumentException("Design bound row " + i + " requires {min, max}");
            }
            min[i] = rows[i][0];
            max[i] = rows[i][1];
        }
        return new DesignBound(min, max);
    }

    /**
     * Convenience form taking min/max pairs in axis order.
     */
    public static DesignBound of(double longMin, double longMax, double latMin, double latMax, double vertMin,
                                 double vertMax) {
        return of(new double[][] { { longMin, longMax }, { latMin, latMax }, { vertMin, vertMax } });
    }

    public double min(Direction axis) {
        return min[axis.ordinal()];
    }

    public double max(Direction axis) {
        return max[axis.ordinal()];
    }

    public double width(Direction axis) {
        return max[axis.ordinal()] - min[axis.ordinal()];
    }

    /**
     * @return true if the axis is a fixed design parameter
     */
    public boolean isFixed(Direction axis) {
        return Double.isNaN(min[axis.ordinal()]);
    }

    /**
     * @return true if the axis has zero width; sampling it is meaningless
     */
    public boolean isDegenerate(Direction axis) {
        return width(axis) == 0.0;
    }

    /**
     * @return true if both ends of the axis are zero, the marker for an axis range inherited from a sibling point
     */
    public boolean isUnset(Direction axis) {
        return min[axis.ordinal()] == 0.0 && max[axis.ordinal()] == 0.0;
    }

    public boolean contains(Direction axis, double value) {
        return isFixed(axis) || (min[axis.ordinal()] <= value && value <= max[axis.ordinal()]);
    }

    /**
     * @return a copy of this bound with one axis range replaced by the donor's
     */
    public DesignBound inherit(Direction axis, DesignBound donor) {
        var lo = Arrays.copyOf(min, 3);
        var hi = Arrays.copyOf(max, 3);
        lo[axis.ordinal()] = donor.min(axis);
        hi[axis.ordinal()] = donor.max(axis);
        return new DesignBound(lo, hi);
    }

    /**
     * @return a copy of this bound with every end multiplied by {@code factor}
     */
    public DesignBound scale(double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("Scale factor must be positive: " + factor);
        }
        var lo = Arrays.copyOf(min, 3);
        var hi = Arrays.copyOf(max, 3);
        for (int i = 0; i < 3; i++) {
            lo[i] *= factor;
            hi[i] *= factor;
        }
        return new DesignBound(lo, hi);
    }

    /**
     * Check a position against every ranged axis.
     *
     * @param point    label of the point being checked
     * @param frame    frame the position is expressed in
     * @param position the position
     * @return one violation per axis out of range, empty if within bounds
     */
    public List<BoundViolation> check(String point, String frame, Point3d position) {
        var violations = new ArrayList<BoundViolation>();
        for (var axis : Direction.values()) {
            var value = axis.of(position);
            if (!contains(axis, value)) {
                violations.add(new BoundViolation(point, frame, axis, min(axis), max(axis), value));
            }
        }
        return violations;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("DesignBound[");
        for (var axis : Direction.values()) {
            if (axis.ordinal() > 0) {
                sb.append("; ");
            }
            sb.append(min(axis)).append(", ").append(max(axis));
        }
        return sb.append(']').toString();
    }
}
