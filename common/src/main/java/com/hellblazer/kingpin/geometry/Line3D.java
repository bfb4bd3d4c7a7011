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
 * A line {@code origin + t·direction}. The direction is not normalized; lines produced by
 * {@link Plane3D#intersect(Plane3D)} advance one unit of x per unit of {@code t}.
 *
 * @author hal.hildebrand
 */
public record Line3D(Point3d origin, Vector3d direction) {

    public Line3D {
        origin = new Point3d(origin);
        direction = new Vector3d(direction);
        if (direction.lengthSquared() == 0) {
            throw new IllegalArgumentException("Line direction cannot be zero vector");
        }
    }

    /**
     * Create the line through two distinct points, with {@code at(0) == a} and {@code at(1) == b}.
     */
    public static Line3D through(Point3d a, Point3d b) {
        var direction = new Vector3d();
        direction.sub(b, a);
        return new Line3D(a, direction);
    }

    /**
     * @param t line parameter
     * @return {@code origin + t·direction}
     */
    public Point3d at(double t) {
        var p = new Point3d();
        p.scaleAdd(t, direction, origin);
        return p;
    }

    /**
     * Orthogonal projection of a point onto the line.
     *
     * @param p point of interest
     * @return the closest point of the line to {@code p}
     */
    public Point3d project(Point3d p) {
        var v = new Vector3d();
        v.sub(p, origin);
        return at(direction.dot(v) / direction.dot(direction));
    }

    /**
     * Distance from a point to the line.
     */
    public double distanceToPoint(Point3d p) {
        return project(p).distance(p);
    }
}
