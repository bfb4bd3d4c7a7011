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

import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import java.util.ArrayList;
import java.util.List;

/**
 * Homogeneous rigid body transform primitives used to chain points through a tree of coordinate frames.
 *
 * <p>A frame is described relative to its parent by a rotation {@code (θx, θy, θz)} and the position of its origin in
 * parent coordinates. {@link #forwardTransform} takes parent coordinates into the child frame, {@link #reverseTransform}
 * takes child coordinates back into the parent. The two are exact inverses of each other.
 *
 * <p><b>Thread Safety:</b> All methods are stateless and thread-safe.
 *
 * @author hal.hildebrand
 */
public final class Transforms {

    /**
     * Rotation sequence used when leaving a child frame (x, then y, then z)
     */
    public static final Axis[] XYZ = { Axis.X, Axis.Y, Axis.Z };

    /**
     * Rotation sequence used when entering a child frame (z, then y, then x)
     */
    public static final Axis[] ZYX = { Axis.Z, Axis.Y, Axis.X };

    private Transforms() {
        // Prevent instantiation
    }

    /**
     * Create a homogeneous translation.
     *
     * @param offset translation offset
     * @return translation matrix
     */
    public static Matrix4d translation(Tuple3d offset) {
        var matrix = new Matrix4d();
        matrix.setIdentity();
        matrix.m03 = offset.x;
        matrix.m13 = offset.y;
        matrix.m23 = offset.z;
        return matrix;
    }

    /**
     * Create a homogeneous rotation from a sequence of elementary rotations. Each successive rotation is left
     * multiplied, so {@code rotation({a, b, c}, X, Y, Z)} is {@code Rz(c)·Ry(b)·Rx(a)}.
     *
     * @param angles angle in radians for each entry of the sequence
     * @param order  axis sequence
     * @return rotation matrix
     * @throws IllegalArgumentException if the angle and axis counts differ
     */
    public static Matrix4d rotation(double[] angles, Axis... order) {
        if (angles.length != order.length) {
            throw new IllegalArgumentException(
            "Angle count " + angles.length + " does not match axis sequence length " + order.length);
        }
        var matrix = new Matrix4d();
        matrix.setIdentity();
        for (int k = 0; k < order.length; k++) {
            var step = order[k].rotation(angles[k]);
            step.mul(matrix);
            matrix = step;
        }
        return matrix;
    }

    /**
     * The matrix taking parent coordinates into a child frame with the given rotation and origin.
     */
    public static Matrix4d forwardMatrix(Tuple3d rotation, Tuple3d translation) {
        var matrix = rotation(new double[] { -rotation.z, -rotation.y, -rotation.x }, ZYX);
        var offset = new Point3d(translation);
        offset.negate();
        matrix.mul(translation(offset));
        return matrix;
    }

    /**
     * The matrix taking child frame coordinates back into the parent frame.
     */
    public static Matrix4d reverseMatrix(Tuple3d rotation, Tuple3d translation) {
        var matrix = translation(translation);
        matrix.mul(rotation(new double[] { rotation.x, rotation.y, rotation.z }, XYZ));
        return matrix;
    }

    /**
     * Map a point expressed in a parent frame into the child frame described by {@code rotation} and
     * {@code translation}.
     *
     * @param point       point in parent coordinates
     * @param rotation    child frame rotation (θx, θy, θz) relative to the parent
     * @param translation child frame origin in parent coordinates
     * @return the point in child coordinates
     */
    public static Point3d forwardTransform(Point3d point, Tuple3d rotation, Tuple3d translation) {
        return apply(forwardMatrix(rotation, translation), point);
    }

    /**
     * Map a point expressed in a child frame back into its parent frame. Inverse of
     * {@link #forwardTransform(Point3d, Tuple3d, Tuple3d)}.
     *
     * @param point       point in child coordinates
     * @param rotation    child frame rotation (θx, θy, θz) relative to the parent
     * @param translation child frame origin in parent coordinates
     * @return the point in parent coordinates
     */
    public static Point3d reverseTransform(Point3d point, Tuple3d rotation, Tuple3d translation) {
        return apply(reverseMatrix(rotation, translation), point);
    }

    /**
     * Batch form of {@link #forwardTransform(Point3d, Tuple3d, Tuple3d)}; the matrix is built once.
     */
    public static List<Point3d> forwardTransform(List<Point3d> points, Tuple3d rotation, Tuple3d translation) {
        return apply(forwardMatrix(rotation, translation), points);
    }

    /**
     * Batch form of {@link #reverseTransform(Point3d, Tuple3d, Tuple3d)}; the matrix is built once.
     */
    public static List<Point3d> reverseTransform(List<Point3d> points, Tuple3d rotation, Tuple3d translation) {
        return apply(reverseMatrix(rotation, translation), points);
    }

    private static Point3d apply(Matrix4d matrix, Point3d point) {
        var result = new Point3d();
        matrix.transform(point, result);
        return result;
    }

    private static List<Point3d> apply(Matrix4d matrix, List<Point3d> points) {
        var result = new ArrayList<Point3d>(points.size());
        for (var point : points) {
            result.add(apply(matrix, point));
        }
        return result;
    }
}
