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

import com.hellblazer.kingpin.design.BoundInheritance;
import com.hellblazer.kingpin.design.Direction;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The sampled attachment points of a double wishbone corner. Each pickup knows its home frame, the frame its design
 * bound is expressed in, and which axes are drawn from that bound; the remaining axes are placed by the solver.
 *
 * @author hal.hildebrand
 */
public enum Pickup {
    LAF(DoubleWishbone.AXLE, "Lower A-Arm Front Pickup", true, true, false),
    LAR(DoubleWishbone.AXLE, "Lower A-Arm Rear Pickup", true, true, false),
    UAF(DoubleWishbone.AXLE, "Upper A-Arm Front Pickup", true, false, false),
    UAR(DoubleWishbone.AXLE, "Upper A-Arm Rear Pickup", true, false, false),
    TA(DoubleWishbone.AXLE, "Tie Rod Inboard Pickup", true, true, false),
    LB(DoubleWishbone.WHEEL, "Lower Ball Joint", true, true, true),
    UB(DoubleWishbone.WHEEL, "Upper Ball Joint", true, false, true),
    TB(DoubleWishbone.WHEEL, "Tie Rod Ball Joint", true, true, true);

    /**
     * Bound inheritance between sibling pickups, in application order. Donors precede recipients.
     */
    public static final List<BoundInheritance> INHERITANCE = List.of(
    new BoundInheritance(LAR.name(), Direction.LATERAL, LAF.name()),
    new BoundInheritance(UAF.name(), Direction.LONGITUDINAL, LAF.name()),
    new BoundInheritance(UAR.name(), Direction.LONGITUDINAL, LAR.name()),
    new BoundInheritance(UAR.name(), Direction.LATERAL, UAF.name()));

    private final String    frame;
    private final String    title;
    private final boolean[] mask;

    Pickup(String frame, String title, boolean longitudinal, boolean lateral, boolean vertical) {
        this.frame = frame;
        this.title = title;
        this.mask = new boolean[] { longitudinal, lateral, vertical };
    }

    public static Optional<Pickup> find(String label) {
        for (var pickup : values()) {
            if (pickup.name().equals(label)) {
                return Optional.of(pickup);
            }
        }
        return Optional.empty();
    }

    /**
     * @return label to sampled axis mask, for every pickup in declaration order
     */
    public static Map<String, boolean[]> masks() {
        var masks = new LinkedHashMap<String, boolean[]>();
        for (var pickup : values()) {
            masks.put(pickup.name(), pickup.mask());
        }
        return masks;
    }

    /**
     * @return every pickup label in declaration order, which is also a valid resolution order
     */
    public static List<String> labels() {
        return Arrays.stream(values()).map(Pickup::name).toList();
    }

    /**
     * @return name of the frame the pickup's bound and sampled position are expressed in
     */
    public String getFrame() {
        return frame;
    }

    public String getTitle() {
        return title;
    }

    public boolean isSampled(Direction axis) {
        return mask[axis.ordinal()];
    }

    /**
     * @return a copy of the sampled axis mask
     */
    public boolean[] mask() {
        return Arrays.copyOf(mask, 3);
    }
}
