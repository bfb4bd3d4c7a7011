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

import com.hellblazer.kingpin.frame.FrameDescriptor;

import java.util.List;

import static com.hellblazer.kingpin.frame.DegreeOfFreedom.*;

/**
 * Frame topology of a double wishbone corner.
 *
 * <pre>
 * I ─┬─ B ── X ─┬─ LA
 *    │          ├─ UA
 *    │          └─ TR
 *    └─ T ── W
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class DoubleWishbone {

    public static final String INTERMEDIATE = "I";
    public static final String BODY         = "B";
    public static final String TIRE         = "T";
    public static final String WHEEL        = "W";
    public static final String AXLE         = "X";
    public static final String LOWER_ARM    = "LA";
    public static final String UPPER_ARM    = "UA";
    public static final String TIE_ROD      = "TR";

    public static final String ROLL_CENTER          = "RC";
    public static final String FRONT_INSTANT_CENTER = "FC";
    public static final String PITCH_CENTER         = "PC";
    public static final String SIDE_INSTANT_CENTER  = "SC";

    private DoubleWishbone() {
        // Prevent instantiation
    }

    /**
     * @return fresh frame descriptors, every frame at its parent's origin
     */
    public static List<FrameDescriptor> frames() {
        var intermediate = FrameDescriptor.of(INTERMEDIATE, "Intermediate", null)
                                          .withPoint(ROLL_CENTER, "Roll Center", "kx")
                                          .withPoint(FRONT_INSTANT_CENTER, "Front Instant Center", "k*")
                                          .withPoint(PITCH_CENTER, "Pitch Center", "kx")
                                          .withPoint(SIDE_INSTANT_CENTER, "Side Instant Center", "k*");
        var body = FrameDescriptor.of(BODY, "Body", INTERMEDIATE, HEAVE, ROLL, PITCH);
        var tire = FrameDescriptor.of(TIRE, "Tire", INTERMEDIATE, SURGE, SWAY, ROLL, YAW);
        var wheel = FrameDescriptor.of(WHEEL, "Wheel", TIRE, PITCH)
                                   .withPoint(Pickup.LB.name(), "Lower Pickup", "ks")
                                   .withPoint(Pickup.UB.name(), "Upper Pickup", "ks")
                                   .withPoint(Pickup.TB.name(), "Tie Rod Pickup", "ks");
        var axle = FrameDescriptor.of(AXLE, "Axle", BODY);
        for (var pickup : Pickup.values()) {
            if (AXLE.equals(pickup.getFrame())) {
                axle = axle.withPoint(pickup.name(), pickup.getTitle(), "ks");
            }
        }
        var lower = FrameDescriptor.of(LOWER_ARM, "Lower A-Arm", AXLE, ROLL)
                                   .withPoint(Pickup.LB.name(), "Apex", "ko")
                                   .withPoint(Pickup.LAF.name(), "Front Pickup", "ko")
                                   .withPoint(Pickup.LAR.name(), "Rear Pickup", "ko");
        var upper = FrameDescriptor.of(UPPER_ARM, "Upper A-Arm", AXLE, ROLL)
                                   .withPoint(Pickup.UB.name(), "Apex", "ko")
                                   .withPoint(Pickup.UAF.name(), "Front Pickup", "ko")
                                   .withPoint(Pickup.UAR.name(), "Rear Pickup", "ko");
        var tieRod = FrameDescriptor.of(TIE_ROD, "Tie Rod", AXLE, ROLL, YAW)
                                    .withPoint(Pickup.TB.name(), "Outer Pickup", "ko");
        return List.of(intermediate, body, tire, wheel, axle, lower, upper, tieRod);
    }
}
