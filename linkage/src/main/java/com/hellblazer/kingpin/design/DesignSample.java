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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Normalized position of each sampled point inside its design bound: one fraction in [0, 1] per axis. Axes that are
 * auto calculated by the solver, fixed, or of zero width are not sampled and hold 0.
 *
 * @author hal.hildebrand
 */
public final class DesignSample {

    /** Fraction assigned to every sampled axis of a fresh sample: the middle of the bound */
    public static final double DEFAULT_FRACTION = 0.5;

    private final Map<String, double[]>  fractions = new LinkedHashMap<>();
    private final Map<String, boolean[]> sampled   = new LinkedHashMap<>();

    private DesignSample() {
    }

    /**
     * Create a sample for the given points. An axis is sampled when the mask requests it and the bound gives it a
     * range of non zero width.
     *
     * @param bounds design bounds, before any inheritance normalization
     * @param masks  per label, the axes the design rules draw from the bound
     * @return sample with {@link #DEFAULT_FRACTION} on every sampled axis
     */
    public static DesignSample initial(DesignBounds bounds, Map<String, boolean[]> masks) {
        var sample = new DesignSample();
        masks.forEach((label, mask) -> {
            var bound = bounds.get(label);
            var axes = new boolean[3];
            var values = new double[3];
            for (var axis : Direction.values()) {
                var i = axis.ordinal();
                axes[i] = mask[i] && !bound.isFixed(axis) && !bound.isDegenerate(axis);
                values[i] = axes[i] ? DEFAULT_FRACTION : 0.0;
            }
            sample.sampled.put(label, axes);
            sample.fractions.put(label, values);
        });
        return sample;
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(fractions.keySet());
    }

    public boolean isSampled(String label, Direction axis) {
        return mask(label)[axis.ordinal()];
    }

    public double get(String label, Direction axis) {
        return values(label)[axis.ordinal()];
    }

    /**
     * @return a copy of the label's fractions in axis order
     */
    public double[] get(String label) {
        return Arrays.copyOf(values(label), 3);
    }

    /**
     * Overwrite one sampled fraction.
     *
     * @throws IllegalArgumentException if the fraction is outside [0, 1] or the axis is not sampled
     */
    public DesignSample set(String label, Direction axis, double fraction) {
        if (!(fraction >= 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("Sample fraction must lie in [0, 1]: " + fraction);
        }
        if (!isSampled(label, axis)) {
            throw new IllegalArgumentException(label + " " + axis.label() + " is not a sampled axis");
        }
        values(label)[axis.ordinal()] = fraction;
        return this;
    }

    /**
     * Assign the same fraction to every sampled axis of every point.
     */
    public DesignSample fill(double fraction) {
        for (var label : fractions.keySet()) {
            for (var axis : Direction.values()) {
                if (isSampled(label, axis)) {
                    set(label, axis, fraction);
                }
            }
        }
        return this;
    }

    private double[] values(String label) {
        var values = fractions.get(label);
        if (values == null) {
            throw new IllegalArgumentException("No sample entry for " + label);
        }
        return values;
    }

    private boolean[] mask(String label) {
        var mask = sampled.get(label);
        if (mask == null) {
            throw new IllegalArgumentException("No sample entry for " + label);
        }
        return mask;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("DesignSample{");
        fractions.forEach((label, values) -> sb.append(label).append('=').append(Arrays.toString(values)).append(' '));
        return sb.append('}').toString();
    }
}
