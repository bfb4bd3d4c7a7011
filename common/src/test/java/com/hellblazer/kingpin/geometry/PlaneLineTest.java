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
package com.hellblazer.kingpin.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Plane and Line Tests")
public class PlaneLineTest {

    private static final double EPSILON = 1e-10;

    @Test
    @DisplayName("Three point plane normal and height function")
    void testFromThreePoints() {
        var a = new Point3d(0, 0, 1);
        var b = new Point3d(1, 0, 2);
        var c = new Point3d(0, 1, 1);
        var plane = Plane3D.fromThreePoints(a, b, c);

        // z = 1 + x
        assertEquals(1.0, plane.heightAt(0, 5), EPSILON);
        assertEquals(3.0, plane.heightAt(2, -7), EPSILON);
        assertEquals(1.0, plane.normal().length(), EPSILON);
        assertEquals(0.0, plane.distanceToPoint(b), EPSILON);
        assertEquals(0.0, plane.distanceToPoint(c), EPSILON);
    }

    @Test
    @DisplayName("Normal follows (a - b) x (a - c)")
    void testNormalOrientation() {
        var plane = Plane3D.fromThreePoints(new Point3d(0, 0, 0), new Point3d(1, 0, 0), new Point3d(0, 1, 0));
        assertEquals(new Vector3d(0, 0, 1), plane.normal());
    }

    @Test
    @DisplayName("Collinear points are rejected")
    void testCollinear() {
        assertThrows(IllegalArgumentException.class,
                     () -> Plane3D.fromThreePoints(new Point3d(0, 0, 0), new Point3d(1, 1, 1),
                                                   new Point3d(2, 2, 2)));
    }

    @Test
    @DisplayName("Vertical planes have no height function")
    void testVerticalHeight() {
        var plane = new Plane3D(new Point3d(), new Vector3d(1, 0, 0));
        assertThrows(IllegalStateException.class, () -> plane.heightAt(0, 0));
    }

    @Test
    @DisplayName("Plane intersection is parametrized by x")
    void testIntersection() {
        // z = 0 and y = 2 meet in the line (x, 2, 0)
        var ground = new Plane3D(new Point3d(5, 5, 0), new Vector3d(0, 0, 1));
        var wall = new Plane3D(new Point3d(-3, 2, 9), new Vector3d(0, 1, 0));
        var line = ground.intersect(wall);

        var p = line.at(7.5);
        assertEquals(7.5, p.x, EPSILON);
        assertEquals(2.0, p.y, EPSILON);
        assertEquals(0.0, p.z, EPSILON);
        assertEquals(1.0, line.direction().x, EPSILON);
        assertEquals(0.0, line.origin().x, EPSILON);
    }

    @Test
    @DisplayName("Inclined plane intersection")
    void testInclinedIntersection() {
        var p1 = Plane3D.fromThreePoints(new Point3d(0, 0, 0), new Point3d(1, 0, 1), new Point3d(0, 1, 0));
        var p2 = Plane3D.fromThreePoints(new Point3d(0, 0, 0), new Point3d(1, 1, 0), new Point3d(0, 0, 1));
        var line = p1.intersect(p2);
        for (double x : new double[] { -10, 0, 3.25, 100 }) {
            var q = line.at(x);
            assertEquals(x, q.x, EPSILON);
            assertEquals(0.0, p1.distanceToPoint(q), 1e-9);
            assertEquals(0.0, p2.distanceToPoint(q), 1e-9);
        }
    }

    @Test
    @DisplayName("Parallel planes do not intersect")
    void testParallel() {
        var p1 = new Plane3D(new Point3d(0, 0, 0), new Vector3d(0, 0, 1));
        var p2 = new Plane3D(new Point3d(0, 0, 5), new Vector3d(0, 0, -2));
        assertThrows(IllegalArgumentException.class, () -> p1.intersect(p2));
    }

    @Test
    @DisplayName("Intersection normal to x cannot be parametrized by x")
    void testIntersectionAcrossX() {
        var p1 = new Plane3D(new Point3d(0, 0, 0), new Vector3d(1, 0, 0));
        var p2 = new Plane3D(new Point3d(0, 0, 0), new Vector3d(0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> p1.intersect(p2));
    }

    @Test
    @DisplayName("Orthogonal projection onto a line")
    void testProjection() {
        var line = Line3D.through(new Point3d(0, 0, 0), new Point3d(2, 0, 0));
        var foot = line.project(new Point3d(5, 3, -4));
        assertEquals(5.0, foot.x, EPSILON);
        assertEquals(0.0, foot.y, EPSILON);
        assertEquals(0.0, foot.z, EPSILON);
        assertEquals(5.0, line.distanceToPoint(new Point3d(5, 3, -4)), EPSILON);
    }

    @Test
    @DisplayName("Projection residual is orthogonal to the line")
    void testProjectionResidual() {
        var line = new Line3D(new Point3d(1, 2, 3), new Vector3d(1, -0.5, 0.25));
        var p = new Point3d(-7, 4, 11);
        var foot = line.project(p);
        var residual = new Vector3d();
        residual.sub(p, foot);
        assertEquals(0.0, residual.dot(line.direction()), 1e-9);
    }

    @Test
    @DisplayName("Zero direction is rejected")
    void testZeroDirection() {
        assertThrows(IllegalArgumentException.class, () -> new Line3D(new Point3d(), new Vector3d()));
    }
}
