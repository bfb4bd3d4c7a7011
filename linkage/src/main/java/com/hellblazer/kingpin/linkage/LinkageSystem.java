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

import com.hellblazer.kingpin.design.BoundInheritance;
import com.hellblazer.kingpin.design.BoundViolation;
import com.hellblazer.kingpin.design.DesignBounds;
import com.hellblazer.kingpin.design.DesignSample;
import com.hellblazer.kingpin.frame.Frame;
import com.hellblazer.kingpin.frame.FrameGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The state of one suspension design: targets, design bounds and sample, and the frame graph the solver populates.
 * Obtain instances from {@link SuspensionKinematics#build}.
 *
 * <p>Not thread safe. The frame graph is mutated in place by the solver and by {@link #setPoint}.
 *
 * @author hal.hildebrand
 */
public final class LinkageSystem {
    private static final Logger log = LoggerFactory.getLogger(LinkageSystem.class);

    private final String                 name;
    private final Instant                created;
    private final Target                 target;
    private final DesignBounds           rawBounds;
    private final DesignBounds           bounds;
    private final List<BoundInheritance> inheritance;
    private final DesignSample           sample;
    private final FrameGraph             graph;
    private final List<BoundViolation>   violations = new ArrayList<>();
    private       double                 frontViewSwingArm = Double.NaN;
    private       double                 sideViewSwingArm  = Double.NaN;

    LinkageSystem(String name, Target target, DesignBounds rawBounds, List<BoundInheritance> inheritance,
                  DesignBounds bounds, DesignSample sample, FrameGraph graph) {
        this.name = name;
        this.created = Instant.now();
        this.target = target;
        this.rawBounds = rawBounds;
        this.inheritance = List.copyOf(inheritance);
        this.bounds = bounds;
        this.sample = sample;
        this.graph = graph;
    }

    public String getName() {
        return name;
    }

    public Instant getCreated() {
        return created;
    }

    public Target getTarget() {
        return target;
    }

    public LinkageType getLinkage() {
        return target.linkage();
    }

    /**
     * @return bounds as configured, before inheritance
     */
    public DesignBounds getRawBounds() {
        return rawBounds;
    }

    /**
     * @return bounds after inheritance; the ones writes are checked against
     */
    public DesignBounds getBounds() {
        return bounds;
    }

    /**
     * @return the inheritance rules that applied to the configured bounds
     */
    public List<BoundInheritance> getInheritance() {
        return inheritance;
    }

    /**
     * @return the live design sample; callers may overwrite entries before solving
     */
    public DesignSample getSample() {
        return sample;
    }

    public FrameGraph getGraph() {
        return graph;
    }

    public List<String> getFrameNames() {
        var names = new ArrayList<String>(graph.size());
        for (var frame : graph.getFrames()) {
            names.add(frame.getName());
        }
        return names;
    }

    /**
     * @throws com.hellblazer.kingpin.exceptions.FrameNotFoundException if the frame does not exist
     */
    public List<String> getPointNames(String frame) {
        return graph.getFrame(frame).getPointNames();
    }

    /**
     * @throws com.hellblazer.kingpin.exceptions.FrameNotFoundException if the frame does not exist
     */
    public Frame getFrame(String frame) {
        return graph.getFrame(frame);
    }

    /**
     * @return front view swing arm length of the last solve, NaN before the first
     */
    public double getFrontViewSwingArm() {
        return frontViewSwingArm;
    }

    /**
     * @return side view swing arm length of the last solve, NaN before the first
     */
    public double getSideViewSwingArm() {
        return sideViewSwingArm;
    }

    void setSwingArms(double frontView, double sideView) {
        this.frontViewSwingArm = frontView;
        this.sideViewSwingArm = sideView;
    }

    /**
     * @return bound violations reported by the latest solve and any writes since, in order
     */
    public List<BoundViolation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    public void clearViolations() {
        violations.clear();
    }

    public Point3d evaluatePoint(String pointName, String source, String target) {
        return graph.evaluatePoint(pointName, source, target);
    }

    public Point3d evaluatePoint(Point3d point, String source, String target) {
        return graph.evaluatePoint(point, source, target);
    }

    public List<Point3d> evaluatePoints(List<Point3d> points, String source, String target) {
        return graph.evaluatePoints(points, source, target);
    }

    /**
     * Overwrite a point with a value expressed in the point's own frame.
     *
     * @see #setPoint(String, String, Point3d, String)
     */
    public List<BoundViolation> setPoint(String pointName, String frame, Point3d value) {
        return setPoint(pointName, frame, value, frame);
    }

    /**
     * Convert {@code value} from {@code source} into {@code frame} coordinates and overwrite the named point. If the
     * point has a design bound expressed in {@code frame} the written value is checked against it; violations are
     * logged and recorded but never block the write. Linkage pickups are checked only in their home frame; other
     * bounded labels are checked in whatever frame they are written.
     *
     * @return the violations this write produced, empty if none
     * @throws com.hellblazer.kingpin.exceptions.FrameNotFoundException if either frame does not exist
     * @throws com.hellblazer.kingpin.exceptions.PointNotFoundException if the point is absent from {@code frame}
     */
    public List<BoundViolation> setPoint(String pointName, String frame, Point3d value, String source) {
        var local = graph.setPoint(pointName, frame, value, source);
        var bound = bounds.find(pointName);
        if (bound.isEmpty()) {
            return List.of();
        }
        var home = Pickup.find(pointName).map(Pickup::getFrame);
        if (home.isPresent() && !home.get().equals(frame)) {
            return List.of();
        }
        var found = bound.get().check(pointName, frame, local);
        for (var violation : found) {
            log.warn("Bound violation on {}: {}", name, violation.message());
        }
        violations.addAll(found);
        return found;
    }

    @Override
    public String toString() {
        return "LinkageSystem{" + name + ", " + target.linkage().getTitle() + ", " + target.axle() + ", created="
        + created + '}';
    }
}
