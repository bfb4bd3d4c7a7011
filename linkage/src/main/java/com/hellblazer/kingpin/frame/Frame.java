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

import com.hellblazer.kingpin.exceptions.PointNotFoundException;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A rigid coordinate frame in a {@link FrameGraph}: a local transform relative to its parent and an ordered table of
 * points of interest expressed in local coordinates.
 *
 * @author hal.hildebrand
 */
public final class Frame {

    /** Parent index of the root frame */
    public static final int NO_PARENT = -1;

    private final int                          index;
    private final String                       name;
    private final String                       title;
    private final int                          parent;
    private final List<Integer>                children = new ArrayList<>();
    private final Vector3d                     position;
    private final Vector3d                     rotation;
    private final Set<DegreeOfFreedom>         freedoms;
    private final Map<String, PointOfInterest> points   = new LinkedHashMap<>();

    Frame(int index, FrameDescriptor descriptor, int parent) {
        this.index = index;
        this.name = descriptor.name();
        this.title = descriptor.title();
        this.parent = parent;
        this.position = new Vector3d(descriptor.position());
        this.rotation = new Vector3d(descriptor.rotation());
        this.freedoms = descriptor.freedoms().isEmpty() ? EnumSet.noneOf(DegreeOfFreedom.class)
                                                        : EnumSet.copyOf(descriptor.freedoms());
        for (var point : descriptor.points()) {
            points.put(point.getName(), point.copy());
        }
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return the parent frame index, or {@link #NO_PARENT} for the root
     */
    public int getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == NO_PARENT;
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(int child) {
        children.add(child);
    }

    /**
     * @return a copy of the origin position in parent coordinates
     */
    public Vector3d getPosition() {
        return new Vector3d(position);
    }

    public void setPosition(Tuple3d value) {
        position.set(value);
    }

    /**
     * @return a copy of the rotation (θx, θy, θz) relative to the parent
     */
    public Vector3d getRotation() {
        return new Vector3d(rotation);
    }

    public void setRotation(Tuple3d value) {
        rotation.set(value);
    }

    public Set<DegreeOfFreedom> getFreedoms() {
        return Collections.unmodifiableSet(freedoms);
    }

    /**
     * @return point names in declaration order
     */
    public List<String> getPointNames() {
        return List.copyOf(points.keySet());
    }

    public boolean hasPoint(String pointName) {
        return points.containsKey(pointName);
    }

    /**
     * @throws PointNotFoundException if the point is absent from this frame
     */
    public PointOfInterest getPoint(String pointName) {
        var point = points.get(pointName);
        if (point == null) {
            throw new PointNotFoundException("Point " + pointName + " does not exist in frame " + name);
        }
        return point;
    }

    /**
     * Add a zero positioned point of interest if absent.
     *
     * @return the existing or newly added point
     */
    public PointOfInterest definePoint(String pointName, String pointTitle, String style) {
        return points.computeIfAbsent(pointName, k -> new PointOfInterest(k, pointTitle, style));
    }

    /**
     * Overwrite the local position of an existing point.
     *
     * @throws PointNotFoundException if the point is absent from this frame
     */
    public void setPoint(String pointName, Point3d localPosition) {
        getPoint(pointName).setPosition(localPosition);
    }

    /**
     * @return true if the point was present
     */
    public boolean removePoint(String pointName) {
        return points.remove(pointName) != null;
    }

    @Override
    public String toString() {
        return "Frame{" + name + " (" + title + "), position=" + position + ", rotation=" + rotation + ", points="
        + points.keySet() + '}';
    }
}
