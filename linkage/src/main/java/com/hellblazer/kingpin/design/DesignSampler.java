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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps normalized design samples onto absolute coordinates inside their bounds, after applying the bound inheritance
 * rules.
 *
 * @author hal.hildebrand
 */
public final class DesignSampler {
    private static final Logger log = LoggerFactory.getLogger(DesignSampler.class);

    private DesignSampler() {
        // Prevent instantiation
    }

    /**
     * @return {@code min + fraction·(max - min)}
     */
    public static double sample(double min, double max, double fraction) {
        return min + fraction * (max - min);
    }

    /**
     * Sample every axis of a bound. Fixed (NaN) axes resolve to 0.
     *
     * @param bound     design bound
     * @param fractions one fraction per axis
     * @return the absolute position
     */
    public static Point3d sample(DesignBound bound, double[] fractions) {
        var p = new Point3d();
        for (var axis : Direction.values()) {
            var value = bound.isFixed(axis) ? 0.0
                                            : sample(bound.min(axis), bound.max(axis), fractions[axis.ordinal()]);
            axis.set(p, value);
        }
        return p;
    }

    /**
     * @return the rules that apply to these raw bounds, those whose recipient axis is unset
     */
    public static List<BoundInheritance> applicable(DesignBounds raw, List<BoundInheritance> rules) {
        var applied = new ArrayList<BoundInheritance>();
        for (var rule : rules) {
            var recipient = raw.find(rule.recipient());
            if (recipient.isPresent() && raw.contains(rule.donor()) && recipient.get().isUnset(rule.axis())) {
                applied.add(rule);
            }
        }
        return applied;
    }

    /**
     * Copy donor axis ranges onto recipients. Rules are applied in order, so a recipient may donate to a later rule.
     *
     * @param raw   bounds as configured
     * @param rules applicable inheritance rules
     * @return normalized bounds
     */
    public static DesignBounds normalize(DesignBounds raw, List<BoundInheritance> rules) {
        var normalized = raw;
        for (var rule : rules) {
            var inherited = normalized.get(rule.recipient()).inherit(rule.axis(), normalized.get(rule.donor()));
            log.debug("{} inherits {} bound from {}", rule.recipient(), rule.axis().label(), rule.donor());
            normalized = normalized.with(rule.recipient(), inherited);
        }
        return normalized;
    }

    /**
     * Resolve absolute positions for the given labels in order. A label affected by an inheritance rule takes the
     * donor's resolved coordinate on the inherited axis, so the two coincide exactly on that axis. Donors must precede
     * their recipients in {@code order}.
     *
     * @param bounds normalized bounds
     * @param sample design sample
     * @param order  labels to resolve
     * @param rules  applicable inheritance rules
     * @return label to absolute position, in {@code order}
     */
    public static Map<String, Point3d> resolve(DesignBounds bounds, DesignSample sample, List<String> order,
                                               List<BoundInheritance> rules) {
        var resolved = new LinkedHashMap<String, Point3d>();
        for (var label : order) {
            var p = sample(bounds.get(label), sample.get(label));
            for (var rule : rules) {
                if (rule.recipient().equals(label)) {
                    var donor = resolved.get(rule.donor());
                    if (donor == null) {
                        throw new IllegalStateException(
                        "Inheritance donor " + rule.donor() + " must be resolved before " + label);
                    }
                    rule.axis().set(p, rule.axis().of(donor));
                }
            }
            resolved.put(label, p);
        }
        return resolved;
    }
}
