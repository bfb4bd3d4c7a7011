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
package com.hellblazer.kingpin.frame;

import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative description of a frame used to construct a {@link FrameGraph}.
 *
 * @param name     unique frame name
 * @param title    human readable title
 * @param parent   parent frame name, or null for the root
 * @param position frame origin in parent coordinates
 * @param rotation frame rotation (θx, θy, θz) relative to the parent
 * @param freedoms documentary degrees of freedom relative to the parent
 * @param points   seed points of interest, in declaration order
 * @author hal.hildebrand
 */
public record FrameDescriptor(String name, String title, String parent, Vector3d position, Vector3d rotation,
                              Set<DegreeOfFreedom> freedoms, List<PointOfInterest> points) {

    /**
     * Axis marker length used for the default E1, E2, E3 points
     */
    public static final double AXIS_LENGTH = 25.0;

    public FrameDescriptor {
        position = new Vector3d(position);
        rotation = new Vector3d(rotation);
        freedoms = freedoms.isEmpty() ? EnumSet.noneOf(DegreeOfFreedom.class) : EnumSet.copyOf(freedoms);
        points = List.copyOf(points);
    }

    /**
     * A frame at its parent's origin carrying the default origin and axis marker points.
     *
     * @param name     frame name
     * @param title    frame title
     * @param parent   parent frame name, null for the root
     * @param freedoms documentary degrees of freedom
     */
    public static FrameDescriptor of(String name, String title, String parent, DegreeOfFreedom... freedoms) {
        var dof = EnumSet.noneOf(DegreeOfFreedom.class);
        dof.addAll(List.of(freedoms));
        return new FrameDescriptor(name, title, parent, new Vector3d(), new Vector3d(), dof, defaultPoints());
    }

    /**
     * @return the origin "O" and the axis markers "E1", "E2", "E3"
     */
    public static List<PointOfInterest> defaultPoints() {
        return List.of(new PointOfInterest("O", "Origin", "k."),
                       new PointOfInterest("E1", "x-Axis", "k.", new Point3d(AXIS_LENGTH, 0, 0)),
                       new PointOfInterest("E2", "y-Axis", "k.", new Point3d(0, AXIS_LENGTH, 0)),
                       new PointOfInterest("E3", "z-Axis", "k.", new Point3d(0, 0, AXIS_LENGTH)));
    }

    /**
     * @return a copy of this descriptor with an additional zero positioned point of interest
     */
    public FrameDescriptor withPoint(String pointName, String pointTitle, String style) {
        var extended = new ArrayList<>(points);
        extended.add(new PointOfInterest(pointName, pointTitle, style));
        return new FrameDescriptor(name, title, parent, position, rotation, freedoms, extended);
    }

    public boolean isRoot() {
        return parent == null || parent.isEmpty();
    }
}
