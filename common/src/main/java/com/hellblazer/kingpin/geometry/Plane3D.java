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

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;

/**
 * A plane through {@code point} with unit {@code normal}, satisfying {@code normal · (p - point) = 0}.
 *
 * @author hal.hildebrand
 */
public record Plane3D(Point3d point, Vector3d normal) {

    private static final double EPSILON = 1e-12;

    public Plane3D {
        point = new Point3d(point);
        normal = new Vector3d(normal);
        if (normal.lengthSquared() < EPSILON) {
            throw new IllegalArgumentException("Plane normal cannot be zero vector");
        }
        normal.normalize();
    }

    /**
     * Create a plane from three points. The normal is {@code normalize((a - b) × (a - c))} and the plane is anchored at
     * {@code a}.
     *
     * @param a first point, used as the plane anchor
     * @param b second point
     * @param c third point
     * @return the plane containing the three points
     * @throws IllegalArgumentException if the points are collinear
     */
    public static Plane3D fromThreePoints(Point3d a, Point3d b, Point3d c) {
        var ab = new Vector3d();
        ab.sub(a, b);
        var ac = new Vector3d();
        ac.sub(a, c);

        var normal = new Vector3d();
        normal.cross(ab, ac);

        if (normal.length() < EPSILON * Math.max(1.0, ab.length() * ac.length())) {
            throw new IllegalArgumentException(
            "Points are collinear, cannot define a unique plane: " + a + ", " + b + ", " + c);
        }
        return new Plane3D(a, normal);
    }

    /**
     * @return the plane offset {@code d} in {@code normal · p = d}
     */
    public double offset() {
        return normal.dot(new Vector3d(point));
    }

    /**
     * Solve the plane for its vertical coordinate at {@code (x, y)}.
     *
     * @throws IllegalStateException if the plane is vertical
     */
    public double heightAt(double x, double y) {
        if (Math.abs(normal.z) < EPSILON) {
            throw new IllegalStateException("Vertical plane has no height function: " + this);
        }
        return point.z - (normal.x * (x - point.x) + normal.y * (y - point.y)) / normal.z;
    }

    /**
     * Signed distance from a point, positive on the side the normal points to.
     */
    public double distanceToPoint(Point3d p) {
        return normal.x * (p.x - point.x) + normal.y * (p.y - point.y) + normal.z * (p.z - point.z);
    }

    /**
     * Intersect two planes. The returned line is parametrized by its first coordinate: its direction has a unit x
     * component and its origin sits at {@code x = 0}, so {@code line.at(x)} is the point of the line whose first
     * coordinate is {@code x}.
     *
     * @param other the intersecting plane
     * @return intersection line
     * @throws IllegalArgumentException if the planes are parallel or the line is normal to the x axis
     */
    public Line3D intersect(Plane3D other) {
        var n1 = normal;
        var n2 = other.normal;
        var d1 = offset();
        var d2 = other.offset();
        var n12 = n1.dot(n2);
        var det = 1.0 - n12 * n12;
        if (det < EPSILON) {
            throw new IllegalArgumentException("Planes are parallel, no unique intersection: " + this + ", " + other);
        }

        var direction = new Vector3d();
        direction.cross(n1, n2);
        if (Math.abs(direction.x) < EPSILON) {
            throw new IllegalArgumentException("Intersection line does not advance along x: " + direction);
        }
        direction.scale(1.0 / direction.x);

        var origin = new Point3d();
        origin.scaleAdd((d1 - d2 * n12) / det, n1, origin);
        origin.scaleAdd((d2 - d1 * n12) / det, n2, origin);
        origin.scaleAdd(-origin.x, direction, origin);

        return new Line3D(origin, direction);
    }

    @Override
    public String toString() {
        return String.format("Plane3D[%.4fx + %.4fy + %.4fz = %.4f]", normal.x, normal.y, normal.z, offset());
    }
}
