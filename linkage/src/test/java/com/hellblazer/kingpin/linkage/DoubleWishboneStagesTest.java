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

import com.hellblazer.kingpin.geometry.Plane3D;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;

import static com.hellblazer.kingpin.linkage.DoubleWishbone.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Solver stages run one at a time against the reference corner.
 *
 * @author hal.hildebrand
 */
@DisplayName("Double Wishbone Stage Tests")
public class DoubleWishboneStagesTest {

    private static final double EPSILON = 1e-6;

    private static LinkageSystem runThrough(LinkageSystem system, int stages) {
        var current = system;
        for (var stage : DoubleWishboneSolver.STAGES.subList(0, stages)) {
            current = stage.apply(current);
        }
        return current;
    }

    @Property
    @Label("Upper ball joint placement reproduces the kingpin inclination")
    void kingpinInclination(@ForAll @DoubleRange(min = -10, max = 15) double kpiDegrees,
                            @ForAll @DoubleRange(min = -30, max = 30) double lowerLateral,
                            @ForAll @DoubleRange(min = -90, max = -50) double lowerVertical,
                            @ForAll @DoubleRange(min = 60, max = 100) double upperVertical) {
        var target = ReferenceDesign.target().kpi(Math.toRadians(kpiDegrees)).build();
        var system = runThrough(SuspensionKinematics.build(target, ReferenceDesign.bounds()), 3);
        system.getFrame(WHEEL).setPoint("LB", new Point3d(0, lowerLateral, lowerVertical));
        system.getFrame(WHEEL).setPoint("UB", new Point3d(0, 0, upperVertical));

        DoubleWishboneSolver.placeOutboardPickups(system);

        var lb = system.evaluatePoint("LB", WHEEL, WHEEL);
        var ub = system.evaluatePoint("UB", WHEEL, WHEEL);
        assertEquals(Math.toRadians(kpiDegrees), Math.atan2(lb.y - ub.y, ub.z - lb.z), 1e-9);
        assertEquals(upperVertical, ub.z, 0.0);
    }

    @Test
    @DisplayName("Inboard pickups lie in the planes through the instant centers")
    void testInboardPlanes() {
        var system = runThrough(ReferenceDesign.system(), 6);
        var fc = system.evaluatePoint(FRONT_INSTANT_CENTER, INTERMEDIATE, AXLE);
        var sc = system.evaluatePoint(SIDE_INSTANT_CENTER, INTERMEDIATE, AXLE);

        var tieRod = Plane3D.fromThreePoints(system.evaluatePoint("TB", WHEEL, AXLE), fc, sc);
        assertEquals(0.0, tieRod.distanceToPoint(system.evaluatePoint("TA", AXLE, AXLE)), EPSILON);

        var lower = Plane3D.fromThreePoints(system.evaluatePoint("LB", WHEEL, AXLE), fc, sc);
        assertEquals(0.0, lower.distanceToPoint(system.evaluatePoint("LAF", AXLE, AXLE)), EPSILON);
        assertEquals(0.0, lower.distanceToPoint(system.evaluatePoint("LAR", AXLE, AXLE)), EPSILON);

        var upper = Plane3D.fromThreePoints(system.evaluatePoint("UB", WHEEL, AXLE), fc, sc);
        var inboard = Plane3D.fromThreePoints(system.evaluatePoint("TA", AXLE, AXLE),
                                              system.evaluatePoint("LAF", AXLE, AXLE),
                                              system.evaluatePoint("LAR", AXLE, AXLE));
        for (var label : new String[] { "UAF", "UAR" }) {
            var p = system.evaluatePoint(label, AXLE, AXLE);
            assertEquals(0.0, upper.distanceToPoint(p), EPSILON, label);
            assertEquals(0.0, inboard.distanceToPoint(p), EPSILON, label);
        }
    }

    @Test
    @DisplayName("Upper inboard pickups keep their sampled longitudinal positions")
    void testUpperLongitudinal() {
        var system = runThrough(ReferenceDesign.system(), 5);
        var uaf = system.evaluatePoint("UAF", AXLE, AXLE);
        var uar = system.evaluatePoint("UAR", AXLE, AXLE);
        DoubleWishboneSolver.placeUpperInboardPickups(system);
        assertEquals(uaf.x, system.evaluatePoint("UAF", AXLE, AXLE).x, 1e-9);
        assertEquals(uar.x, system.evaluatePoint("UAR", AXLE, AXLE).x, 1e-9);
    }

    @Test
    @DisplayName("Arm frame origin is the foot of the ball joint on the pivot line")
    void testArmApex() {
        var system = runThrough(ReferenceDesign.system(), 7);
        var pivot = DoubleWishboneSolver.pivotLine(system, Pickup.LB);
        var apex = new Point3d(system.getFrame(LOWER_ARM).getPosition());
        assertEquals(0.0, pivot.distanceToPoint(apex), EPSILON);
        assertEquals(system.evaluatePoint("LB", WHEEL, AXLE).distance(apex),
                     system.getFrame(LOWER_ARM).getPoint("LB").getPosition().y, EPSILON);
    }

    @Test
    @DisplayName("Static frames follow the targets")
    void testStaticFrames() {
        var system = runThrough(ReferenceDesign.system(), 1);
        var target = system.getTarget();
        assertEquals(target.cg().z, system.getFrame(BODY).getPosition().z, 0.0);
        assertEquals(target.track() / 2, system.getFrame(TIRE).getPosition().y, 0.0);
        assertEquals(-target.camber(), system.getFrame(TIRE).getRotation().x, 0.0);
        assertEquals(target.toe(), system.getFrame(TIRE).getRotation().z, 0.0);
        assertEquals(-target.caster(), system.getFrame(WHEEL).getRotation().y, 0.0);
        assertEquals(target.rideHeight() - target.cg().z, system.getFrame(AXLE).getPosition().z, 0.0);
        // axle sits at ride height above the ground plane
        assertEquals(target.rideHeight(), system.evaluatePoint("O", AXLE, INTERMEDIATE).z, 1e-9);
    }
}
