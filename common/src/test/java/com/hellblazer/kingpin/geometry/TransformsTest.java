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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Transform Primitive Tests")
public class TransformsTest {

    private static final double EPSILON = 1e-10;

    private static void assertPoint(double x, double y, double z, Point3d actual) {
        assertEquals(x, actual.x, EPSILON, "x");
        assertEquals(y, actual.y, EPSILON, "y");
        assertEquals(z, actual.z, EPSILON, "z");
    }

    @Test
    @DisplayName("Translation moves the origin")
    void testTranslation() {
        var matrix = Transforms.translation(new Vector3d(1, 2, 3));
        var p = new Point3d();
        matrix.transform(p);
        assertPoint(1, 2, 3, p);
    }

    @Test
    @DisplayName("Rotation sequence is left multiplied")
    void testRotationOrder() {
        // Rx(90) then Rz(90): y -> z, then z stays z
        var matrix = Transforms.rotation(new double[] { Math.PI / 2, 0, Math.PI / 2 }, Transforms.XYZ);
        var p = new Point3d(0, 1, 0);
        matrix.transform(p);
        assertPoint(0, 0, 1, p);

        // Rz(90) then Rx(90): y -> -x, then -x stays -x
        matrix = Transforms.rotation(new double[] { Math.PI / 2, 0, Math.PI / 2 }, Axis.Z, Axis.Y, Axis.X);
        p = new Point3d(0, 1, 0);
        matrix.transform(p);
        assertPoint(-1, 0, 0, p);
    }

    @Test
    @DisplayName("Mismatched angle and axis counts are rejected")
    void testRotationArity() {
        assertThrows(IllegalArgumentException.class, () -> Transforms.rotation(new double[] { 1, 2 }, Transforms.XYZ));
    }

    @Test
    @DisplayName("Forward transform expresses a parent point in the child frame")
    void testForwardTransform() {
        // Child frame at (10, 0, 0), yawed 90 degrees: its x axis points along parent y
        var rotation = new Vector3d(0, 0, Math.PI / 2);
        var origin = new Vector3d(10, 0, 0);

        assertPoint(0, 0, 0, Transforms.forwardTransform(new Point3d(10, 0, 0), rotation, origin));
        assertPoint(5, 0, 0, Transforms.forwardTransform(new Point3d(10, 5, 0), rotation, origin));
        assertPoint(0, -2, 0, Transforms.forwardTransform(new Point3d(12, 0, 0), rotation, origin));
    }

    @Test
    @DisplayName("Reverse transform expresses a child point in the parent frame")
    void testReverseTransform() {
        var rotation = new Vector3d(0, 0, Math.PI / 2);
        var origin = new Vector3d(10, 0, 0);

        assertPoint(10, 0, 0, Transforms.reverseTransform(new Point3d(), rotation, origin));
        assertPoint(10, 5, 0, Transforms.reverseTransform(new Point3d(5, 0, 0), rotation, origin));
    }

    @Test
    @DisplayName("Compound rotation round trip")
    void testRoundTrip() {
        var rotation = new Vector3d(0.3, -0.7, 1.1);
        var origin = new Vector3d(-4, 25, 300);
        var p = new Point3d(12.5, -3, 8);

        var child = Transforms.forwardTransform(p, rotation, origin);
        var back = Transforms.reverseTransform(child, rotation, origin);
        assertPoint(p.x, p.y, p.z, back);
    }

    @Test
    @DisplayName("Batch transforms match single point transforms")
    void testBatch() {
        var rotation = new Vector3d(0.1, 0.2, 0.3);
        var origin = new Vector3d(1, 2, 3);
        var points = List.of(new Point3d(1, 0, 0), new Point3d(0, 1, 0), new Point3d(4, 5, 6));

        var forward = Transforms.forwardTransform(points, rotation, origin);
        assertEquals(points.size(), forward.size());
        for (int i = 0; i < points.size(); i++) {
            var expected = Transforms.forwardTransform(points.get(i), rotation, origin);
            assertPoint(expected.x, expected.y, expected.z, forward.get(i));
        }

        var reverse = Transforms.reverseTransform(forward, rotation, origin);
        for (int i = 0; i < points.size(); i++) {
            assertPoint(points.get(i).x, points.get(i).y, points.get(i).z, reverse.get(i));
        }
    }

    @Test
    @DisplayName("Inputs are not mutated")
    void testInputsUntouched() {
        var rotation = new Vector3d(0.1, 0.2, 0.3);
        var origin = new Vector3d(1, 2, 3);
        var p = new Point3d(7, 8, 9);
        Transforms.forwardTransform(p, rotation, origin);
        assertPoint(7, 8, 9, p);
        assertEquals(new Vector3d(1, 2, 3), origin);
        assertEquals(new Vector3d(0.1, 0.2, 0.3), rotation);
    }
}
