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
import java.util.Objects;

/**
 * A named point attached to a frame, positioned in that frame's local coordinates. The position is mutated in place as
 * the solver resolves the point.
 *
 * @author hal.hildebrand
 */
public final class PointOfInterest {

    private final String  name;
    private final String  title;
    private final String  style;
    private final Point3d position;

    public PointOfInterest(String name, String title, String style, Point3d position) {
        this.name = Objects.requireNonNull(name, "name");
        this.title = title == null ? name : title;
        this.style = style == null ? "" : style;
        this.position = new Point3d(Objects.requireNonNull(position, "position"));
    }

    /**
     * A point of interest at the local origin.
     */
    public PointOfInterest(String name, String title, String style) {
        this(name, title, style, new Point3d());
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return display style hint for plotting collaborators
     */
    public String getStyle() {
        return style;
    }

    /**
     * @return a copy of the local position
     */
    public Point3d getPosition() {
        return new Point3d(position);
    }

    public void setPosition(Point3d value) {
        position.set(value);
    }

    PointOfInterest copy() {
        return new PointOfInterest(name, title, style, position);
    }

    @Override
    public String toString() {
        return name + " (" + title + ") " + position;
    }
}
