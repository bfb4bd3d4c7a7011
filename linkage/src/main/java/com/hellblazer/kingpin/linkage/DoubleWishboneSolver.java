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

import com.hellblazer.kingpin.design.DesignSampler;
import com.hellblazer.kingpin.exceptions.NotImplementedException;
import com.hellblazer.kingpin.geometry.Line3D;
import com.hellblazer.kingpin.geometry.Plane3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.List;
import java.util.function.UnaryOperator;

import static com.hellblazer.kingpin.linkage.DoubleWishbone.*;

/**
 * Populates a double wishbone frame graph from the design targets and the current design sample. The stages run
 * strictly in order, each reading points placed by the ones before it; each takes and returns the system so they can
 * be exercised one at a time.
 *
 * @author hal.hildebrand
 */
public final class DoubleWishboneSolver {
    private static final Logger log = LoggerFactory.getLogger(DoubleWishboneSolver.class);

    /**
     * The solve, in order
     */
    public static final List<UnaryOperator<LinkageSystem>> STAGES = List.of(DoubleWishboneSolver::placeStaticFrames,
                                                                           DoubleWishboneSolver::placeSampledPoints,
                                                                           DoubleWishboneSolver::placeInstantCenters,
                                                                           DoubleWishboneSolver::placeOutboardPickups,
                                                                           DoubleWishboneSolver::placeInboardHeights,
                                                                           DoubleWishboneSolver::placeUpperInboardPickups,
                                                                           DoubleWishboneSolver::placeArmFrames,
                                                                           DoubleWishboneSolver::placeTieRodFrame,
                                                                           DoubleWishboneSolver::removeAxleCopies);

    /**
     * Inboard pickups whose canonical value moves into an arm or tie rod frame once those frames are placed
     */
    private static final List<Pickup> AXLE_COPIES = List.of(Pickup.LAF, Pickup.LAR, Pickup.UAF, Pickup.UAR,
                                                            Pickup.TA);

    private DoubleWishboneSolver() {
        // Prevent instantiation
    }

    /**
     * Run every stage against the system.
     *
     * @return the solved system
     * @throws NotImplementedException for a rear axle corner
     * @throws IllegalArgumentException when a jacking line misses its swing arm circle
     */
    public static LinkageSystem design(LinkageSystem system) {
        system.clearViolations();
        var current = system;
        for (var stage : STAGES) {
            current = stage.apply(current);
        }
        log.info("Solved {}: FVSA {} mm, SVSA {} mm, {} bound violation(s)", current.getName(),
                 current.getFrontViewSwingArm(), current.getSideViewSwingArm(), current.getViolations().size());
        return current;
    }

    /**
     * Body, tire, wheel and axle frame transforms that follow directly from the targets.
     */
    public static LinkageSystem placeStaticFrames(LinkageSystem system) {
        var target = system.getTarget();
        var cg = target.cg();

        var body = system.getFrame(BODY);
        body.setPosition(new Vector3d(0, 0, cg.z));
        body.setRotation(new Vector3d(0, target.rake(), 0));

        var tire = system.getFrame(TIRE);
        tire.setPosition(new Vector3d(cg.x, target.track() / 2, 0));
        tire.setRotation(new Vector3d(-target.camber(), 0, target.toe()));

        var wheel = system.getFrame(WHEEL);
        wheel.setPosition(new Vector3d(0, 0, target.loadedRadius() / Math.sin(Math.PI / 2 - target.camber())));
        wheel.setRotation(new Vector3d(0, -target.caster(), 0));

        var axle = system.getFrame(AXLE);
        axle.setPosition(new Vector3d(cg.x, 0, target.rideHeight() - cg.z));
        axle.setRotation(new Vector3d());

        log.debug("Placed static frames of {}", system.getName());
        return system;
    }

    /**
     * Map the design sample onto the pickup bounds and write the results, unchecked, into their home frames.
     */
    public static LinkageSystem placeSampledPoints(LinkageSystem system) {
        var resolved = DesignSampler.resolve(system.getBounds(), system.getSample(), Pickup.labels(),
                                             system.getInheritance());
        for (var pickup : Pickup.values()) {
            var frame = system.getFrame(pickup.getFrame());
            frame.definePoint(pickup.name(), pickup.getTitle(), "ks");
            frame.setPoint(pickup.name(), resolved.get(pickup.name()));
            log.debug("Sampled {} in {}: {}", pickup, pickup.getFrame(), resolved.get(pickup.name()));
        }
        return system;
    }

    /**
     * Roll and pitch centers from their target heights, and the front and side view instant centers on the jacking
     * lines through them.
     */
    public static LinkageSystem placeInstantCenters(LinkageSystem system) {
        var target = system.getTarget();
        var cgHeight = target.cg().z;
        var rl = target.loadedRadius();
        var tire = system.getFrame(TIRE).getPosition();
        var fvsa = InstantCenter.swingArmLength(target.camberGain());
        var svsa = InstantCenter.swingArmLength(target.casterGain());
        system.setSwingArms(fvsa, svsa);

        var intermediate = system.getFrame(INTERMEDIATE);

        // centers are passed as heights above ground, not as the bare percentage of CG height
        var rollCenter = cgHeight * target.rollCenter() / 100;
        intermediate.setPoint(ROLL_CENTER, new Point3d(tire.x, 0, rollCenter));
        var front = InstantCenter.solve(tire.y, rollCenter, fvsa, rl);
        intermediate.setPoint(FRONT_INSTANT_CENTER, new Point3d(tire.x, front[0], front[1]));

        var pitchCenter = cgHeight * target.pitchCenter() / 100;
        intermediate.setPoint(PITCH_CENTER, new Point3d(0, tire.y, pitchCenter));
        var side = InstantCenter.solve(tire.x, pitchCenter, svsa, rl);
        intermediate.setPoint(SIDE_INSTANT_CENTER, new Point3d(side[0], tire.y, side[1]));

        log.debug("Instant centers of {}: front {}, side {}", system.getName(),
                  intermediate.getPoint(FRONT_INSTANT_CENTER).getPosition(),
                  intermediate.getPoint(SIDE_INSTANT_CENTER).getPosition());
        return system;
    }

    /**
     * Move the upper ball joint laterally so the steering axis takes the kingpin inclination target. The steering axis
     * is taken in the wheel frame, ignoring the longitudinal shift static toe and camber would add.
     *
     * @throws NotImplementedException for a rear axle corner, which would be placed from the scrub target
     */
    public static LinkageSystem placeOutboardPickups(LinkageSystem system) {
        if (!(system.getFrame(AXLE).getPosition().x > 0)) {
            throw new NotImplementedException(
            "Rear axle upper ball joint placement from the mechanical scrub target is not implemented");
        }
        var lb = system.evaluatePoint(Pickup.LB.name(), WHEEL, WHEEL);
        var ub = system.evaluatePoint(Pickup.UB.name(), WHEEL, WHEEL);
        ub.y = lb.y - (ub.z - lb.z) * Math.tan(system.getTarget().kpi());
        system.setPoint(Pickup.UB.name(), WHEEL, ub);
        return system;
    }

    /**
     * Drop the tie rod and lower arm inboard pickups onto the planes through their outboard joints and both instant
     * centers.
     */
    public static LinkageSystem placeInboardHeights(LinkageSystem system) {
        var fc = system.evaluatePoint(FRONT_INSTANT_CENTER, INTERMEDIATE, AXLE);
        var sc = system.evaluatePoint(SIDE_INSTANT_CENTER, INTERMEDIATE, AXLE);

        var tb = system.evaluatePoint(Pickup.TB.name(), WHEEL, AXLE);
        var tieRod = Plane3D.fromThreePoints(tb, fc, sc);
        var ta = system.evaluatePoint(Pickup.TA.name(), AXLE, AXLE);
        ta.z = tieRod.heightAt(ta.x, ta.y);
        system.setPoint(Pickup.TA.name(), AXLE, ta);

        var lb = system.evaluatePoint(Pickup.LB.name(), WHEEL, AXLE);
        var lower = Plane3D.fromThreePoints(lb, fc, sc);
        for (var pickup : List.of(Pickup.LAF, Pickup.LAR)) {
            var p = system.evaluatePoint(pickup.name(), AXLE, AXLE);
            p.z = lower.heightAt(p.x, p.y);
            system.setPoint(pickup.name(), AXLE, p);
        }
        return system;
    }

    /**
     * Place the upper arm inboard pickups on the upper arm pivot line, at their sampled longitudinal positions.
     */
    public static LinkageSystem placeUpperInboardPickups(LinkageSystem system) {
        var pivot = pivotLine(system, Pickup.UB);
        for (var pickup : List.of(Pickup.UAF, Pickup.UAR)) {
            var p = system.evaluatePoint(pickup.name(), AXLE, AXLE);
            system.setPoint(pickup.name(), AXLE, pivot.at(p.x));
        }
        return system;
    }

    /**
     * Place the lower and upper arm frames: origin at the ball joint's foot on the pivot line, x along the pivot
     * toward the front pickup, y toward the ball joint.
     */
    public static LinkageSystem placeArmFrames(LinkageSystem system) {
        for (var arm : Arm.values()) {
            placeArmFrame(system, arm);
        }
        return system;
    }

    /**
     * Place the tie rod frame at the inboard pickup with its y axis through the outboard ball joint.
     */
    public static LinkageSystem placeTieRodFrame(LinkageSystem system) {
        var frame = system.getFrame(TIE_ROD);
        frame.setRotation(new Vector3d());
        frame.setPosition(system.evaluatePoint(Pickup.TA.name(), AXLE, AXLE));

        var rotation = new Vector3d();
        var tb = system.evaluatePoint(Pickup.TB.name(), WHEEL, TIE_ROD);
        rotation.z = -Math.atan2(tb.x, tb.y);
        frame.setRotation(rotation);

        tb = system.evaluatePoint(Pickup.TB.name(), WHEEL, TIE_ROD);
        rotation.x = Math.atan2(tb.z, tb.y);
        frame.setRotation(rotation);

        frame.setPoint(Pickup.TB.name(), system.evaluatePoint(Pickup.TB.name(), WHEEL, TIE_ROD));
        return system;
    }

    /**
     * Drop the axle frame copies of the inboard pickups; their values now live in the arm and tie rod frames.
     */
    public static LinkageSystem removeAxleCopies(LinkageSystem system) {
        var axle = system.getFrame(AXLE);
        for (var pickup : AXLE_COPIES) {
            axle.removePoint(pickup.name());
        }
        return system;
    }

    private static void placeArmFrame(LinkageSystem system, Arm arm) {
        var frame = system.getFrame(arm.frame);
        var ball = system.evaluatePoint(arm.ball.name(), WHEEL, AXLE);
        frame.setRotation(new Vector3d());
        frame.setPosition(pivotLine(system, arm.ball).project(ball));

        var rotation = new Vector3d();
        var front = system.evaluatePoint(arm.front.name(), AXLE, arm.frame);
        rotation.z = Math.atan2(front.y, front.x);
        frame.setRotation(rotation);

        front = system.evaluatePoint(arm.front.name(), AXLE, arm.frame);
        rotation.y = -Math.atan2(front.z, front.x);
        frame.setRotation(rotation);

        var local = system.evaluatePoint(arm.ball.name(), WHEEL, arm.frame);
        rotation.x = Math.atan2(local.z, local.y);
        frame.setRotation(rotation);

        frame.setPoint(arm.front.name(), system.evaluatePoint(arm.front.name(), AXLE, arm.frame));
        frame.setPoint(arm.rear.name(), system.evaluatePoint(arm.rear.name(), AXLE, arm.frame));
        frame.setPoint(arm.ball.name(), system.evaluatePoint(arm.ball.name(), WHEEL, arm.frame));
        log.debug("Placed {} frame: position {}, rotation {}", arm.frame, frame.getPosition(), frame.getRotation());
    }

    /**
     * Intersection of the inboard pickup plane (tie rod inboard, lower front, lower rear) with the plane through the
     * ball joint and both instant centers, in axle coordinates.
     */
    static Line3D pivotLine(LinkageSystem system, Pickup ball) {
        var fc = system.evaluatePoint(FRONT_INSTANT_CENTER, INTERMEDIATE, AXLE);
        var sc = system.evaluatePoint(SIDE_INSTANT_CENTER, INTERMEDIATE, AXLE);
        var inboard = Plane3D.fromThreePoints(system.evaluatePoint(Pickup.TA.name(), AXLE, AXLE),
                                              system.evaluatePoint(Pickup.LAF.name(), AXLE, AXLE),
                                              system.evaluatePoint(Pickup.LAR.name(), AXLE, AXLE));
        var outboard = Plane3D.fromThreePoints(system.evaluatePoint(ball.name(), WHEEL, AXLE), fc, sc);
        return inboard.intersect(outboard);
    }

    private enum Arm {
        LOWER(LOWER_ARM, Pickup.LAF, Pickup.LAR, Pickup.LB), UPPER(UPPER_ARM, Pickup.UAF, Pickup.UAR, Pickup.UB);

        private final String frame;
        private final Pickup front;
        private final Pickup rear;
        private final Pickup ball;

        Arm(String frame, Pickup front, Pickup rear, Pickup ball) {
            this.frame = frame;
            this.front = front;
            this.rear = rear;
            this.ball = ball;
        }
    }
}
