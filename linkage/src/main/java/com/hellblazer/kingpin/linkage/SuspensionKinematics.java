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

import com.hellblazer.kingpin.design.BoundViolation;
import com.hellblazer.kingpin.design.DesignBounds;
import com.hellblazer.kingpin.design.DesignSample;
import com.hellblazer.kingpin.design.DesignSampler;
import com.hellblazer.kingpin.design.Direction;
import com.hellblazer.kingpin.exceptions.UnsupportedLinkageException;
import com.hellblazer.kingpin.frame.FrameGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.List;

/**
 * Entry point for suspension kinematics design: build a system from targets and bounds, optionally adjust its design
 * sample, solve it, then query or override points in any frame.
 *
 * <pre>{@code
 * var system = SuspensionKinematics.build("FSAE front", target, bounds);
 * system.getSample().set("LAF", Direction.LONGITUDINAL, 0.25);
 * SuspensionKinematics.generateLinkage(system);
 * var contact = SuspensionKinematics.evaluatePoint(system, "O", "T", "I");
 * }</pre>
 *
 * @author hal.hildebrand
 */
public final class SuspensionKinematics {
    private static final Logger log = LoggerFactory.getLogger(SuspensionKinematics.class);

    private SuspensionKinematics() {
        // Prevent instantiation
    }

    public static LinkageSystem build(Target target, DesignBounds bounds) {
        return build(target.linkage() == null ? "Unnamed" : target.linkage().getTitle(), target, bounds);
    }

    /**
     * Build an unsolved system. The design sample starts at the middle of every sampled bound.
     *
     * @param name   system name
     * @param target design targets
     * @param bounds design bounds; must cover every {@link Pickup}, may carry further labels
     * @return the system, frames at their parents' origins
     * @throws UnsupportedLinkageException if the target names a linkage other than double wishbone
     * @throws IllegalArgumentException    if a pickup has no bound or a pickup bound has a fixed axis
     */
    public static LinkageSystem build(String name, Target target, DesignBounds bounds) {
        if (target.linkage() != LinkageType.DOUBLE_WISHBONE) {
            throw new UnsupportedLinkageException(
            "Linkage type not supported: " + (target.linkage() == null ? "none" : target.linkage().getTitle()));
        }
        for (var pickup : Pickup.values()) {
            var bound = bounds.find(pickup.name())
                              .orElseThrow(() -> new IllegalArgumentException("No design bound for " + pickup));
            for (var axis : Direction.values()) {
                if (bound.isFixed(axis)) {
                    throw new IllegalArgumentException(pickup + " " + axis.label() + " bound must be a range");
                }
            }
        }
        var inheritance = DesignSampler.applicable(bounds, Pickup.INHERITANCE);
        var normalized = DesignSampler.normalize(bounds, inheritance);
        var sample = DesignSample.initial(bounds, Pickup.masks());
        var graph = FrameGraph.build(DoubleWishbone.frames());
        var system = new LinkageSystem(name, target, bounds, inheritance, normalized, sample, graph);
        log.info("Built {} {} system {} with {} frames", target.axle(), target.linkage().getTitle(), name,
                 graph.size());
        return system;
    }

    /**
     * Solve the system for its current design sample. May be run again after the sample changes.
     *
     * @return the solved system
     * @throws com.hellblazer.kingpin.exceptions.NotImplementedException for a rear axle corner
     */
    public static LinkageSystem generateLinkage(LinkageSystem system) {
        return DoubleWishboneSolver.design(system);
    }

    public static Point3d evaluatePoint(LinkageSystem system, String pointName, String source, String target) {
        return system.evaluatePoint(pointName, source, target);
    }

    public static Point3d evaluatePoint(LinkageSystem system, Point3d point, String source, String target) {
        return system.evaluatePoint(point, source, target);
    }

    public static List<BoundViolation> setPoint(LinkageSystem system, String pointName, String frame, Point3d value) {
        return system.setPoint(pointName, frame, value);
    }

    public static List<BoundViolation> setPoint(LinkageSystem system, String pointName, String frame, Point3d value,
                                                String source) {
        return system.setPoint(pointName, frame, value, source);
    }
}
