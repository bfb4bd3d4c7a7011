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

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property based checks of the transform primitives and plane fitting.
 *
 * @author hal.hildebrand
 */
class GeometryPropertyTest {

    @Property
    @Label("Reverse transform undoes forward transform")
    void reverseUndoesForward(@ForAll("points") Point3d p, @ForAll("angles") Vector3d rotation,
                              @ForAll("points") Point3d origin) {
        var offset = new Vector3d(origin);
        var back = Transforms.reverseTransform(Transforms.forwardTransform(p, rotation, offset), rotation, offset);
        assertEquals(0.0, back.distance(p), 1e-8);
    }

    @Property
    @Label("Forward transform undoes reverse transform")
    void forwardUndoesReverse(@ForAll("points") Point3d p, @ForAll("angles") Vector3d rotation,
                              @ForAll("points") Point3d origin) {
        var offset = new Vector3d(origin);
        var back = Transforms.forwardTransform(Transforms.reverseTransform(p, rotation, offset), rotation, offset);
        assertEquals(0.0, back.distance(p), 1e-8);
    }

    @Property
    @Label("Transforms preserve distances")
    void transformsAreIsometric(@ForAll("points") Point3d a, @ForAll("points") Point3d b,
                                @ForAll("angles") Vector3d rotation, @ForAll("points") Point3d origin) {
        var offset = new Vector3d(origin);
        var ta = Transforms.forwardTransform(a, rotation, offset);
        var tb = Transforms.forwardTransform(b, rotation, offset);
        assertEquals(a.distance(b), ta.distance(tb), 1e-8);
    }

    @Property
    @Label("Plane height function reproduces its defining points")
    void planeFitIsExact(@ForAll("points") Point3d a, @ForAll("points") Point3d b, @ForAll("points") Point3d c) {
        var ab = new Vector3d();
        ab.sub(a, b);
        var ac = new Vector3d();
        ac.sub(a, c);
        var cross = new Vector3d();
        cross.cross(ab, ac);
        Assume.that(cross.length() > 1e-3 * ab.length() * ac.length());

        Plane3D plane;
        try {
            plane = Plane3D.fromThreePoints(a, b, c);
        } catch (IllegalArgumentException collinear) {
            return;
        }
        Assume.that(Math.abs(plane.normal().z) > 1e-2);

        assertEquals(a.z, plane.heightAt(a.x, a.y), 0.0);
        assertEquals(b.z, plane.heightAt(b.x, b.y), 1e-6 * scale(b));
        assertEquals(c.z, plane.heightAt(c.x, c.y), 1e-6 * scale(c));
    }

    @Property
    @Label("Plane intersection lies in both planes")
    void intersectionLiesInBothPlanes(@ForAll("points") Point3d a, @ForAll("angles") Vector3d n1,
                                      @ForAll("points") Point3d b, @ForAll("angles") Vector3d n2,
                                      @ForAll @DoubleRange(min = -500, max = 500) double x) {
        Assume.that(n1.length() > 0.1 && n2.length() > 0.1);
        var p1 = new Plane3D(a, n1);
        var p2 = new Plane3D(b, n2);
        var dot = Math.abs(p1.normal().dot(p2.normal()));
        Assume.that(dot < 0.99);

        var direction = new Vector3d();
        direction.cross(p1.normal(), p2.normal());
        Assume.that(Math.abs(direction.x) > 0.1);

        var line = p1.intersect(p2);
        var q = line.at(x);
        assertEquals(x, q.x, 1e-9 * Math.max(1, Math.abs(x)));
        assertEquals(0.0, p1.distanceToPoint(q), 1e-6);
        assertEquals(0.0, p2.distanceToPoint(q), 1e-6);
    }

    private static double scale(Point3d p) {
        return Math.max(1.0, Math.abs(p.x) + Math.abs(p.y) + Math.abs(p.z));
    }

    @Provide
    Arbitrary<Point3d> points() {
        var coordinate = Arbitraries.doubles().between(-1000, 1000);
        return Combinators.combine(coordinate, coordinate, coordinate).as(Point3d::new);
    }

    @Provide
    Arbitrary<Vector3d> angles() {
        var angle = Arbitraries.doubles().between(-3.14159, 3.14159).ofScale(5);
        return Combinators.combine(angle, angle, angle).as(Vector3d::new);
    }
}
