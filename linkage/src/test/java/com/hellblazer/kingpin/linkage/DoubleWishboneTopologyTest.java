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

import com.hellblazer.kingpin.design.Direction;
import com.hellblazer.kingpin.frame.FrameGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Double Wishbone Topology Tests")
public class DoubleWishboneTopologyTest {

    @Test
    @DisplayName("Frames, parents and points")
    void testFrames() {
        var graph = FrameGraph.build(DoubleWishbone.frames());
        assertEquals(8, graph.size());
        assertEquals(List.of("B", "X", "LA"), graph.path("B", "LA"));
        assertEquals(List.of("W", "T", "I", "B", "X", "TR"), graph.path("W", "TR"));
        assertEquals(List.of("O", "E1", "E2", "E3", "RC", "FC", "PC", "SC"), graph.getFrame("I").getPointNames());
        assertEquals(List.of("O", "E1", "E2", "E3", "LAF", "LAR", "UAF", "UAR", "TA"),
                     graph.getFrame("X").getPointNames());
        assertEquals("Apex", graph.getFrame("UA").getPoint("UB").getTitle());
        assertEquals("Tie Rod", graph.getFrame("TR").getTitle());
        assertEquals("Side Instant Center", graph.getFrame("I").getPoint("SC").getTitle());
    }

    @Test
    @DisplayName("Pickup table")
    void testPickups() {
        assertEquals(List.of("LAF", "LAR", "UAF", "UAR", "TA", "LB", "UB", "TB"), Pickup.labels());
        assertEquals(DoubleWishbone.WHEEL, Pickup.TB.getFrame());
        assertEquals(DoubleWishbone.AXLE, Pickup.UAR.getFrame());
        assertFalse(Pickup.UB.isSampled(Direction.LATERAL));
        assertTrue(Pickup.UB.isSampled(Direction.VERTICAL));
        assertTrue(Pickup.find("RA").isEmpty());
        assertEquals(Pickup.TA, Pickup.find("TA").orElseThrow());

        // every donor precedes its recipient
        for (var rule : Pickup.INHERITANCE) {
            assertTrue(Pickup.valueOf(rule.donor()).ordinal() < Pickup.valueOf(rule.recipient()).ordinal());
        }
    }

    @Test
    @DisplayName("Target derives the CG from the axle")
    void testTargetCg() {
        var front = ReferenceDesign.target().frontWeightDistribution(0.4).build();
        assertEquals(1525 * 0.6, front.cg().x, 1e-9);
        var rear = ReferenceDesign.target().axle(Axle.REAR).frontWeightDistribution(0.4).build();
        assertEquals(-1525 * 0.4, rear.cg().x, 1e-9);
        var explicit = ReferenceDesign.target().cg(10, 20, 30).build();
        assertEquals(10.0, explicit.cg().x, 0.0);

        front.cg().x = 0;
        assertEquals(1525 * 0.6, front.cg().x, 1e-9);
    }

    @Test
    @DisplayName("Target rejects impossible geometry")
    void testTargetValidation() {
        assertThrows(IllegalArgumentException.class, () -> ReferenceDesign.target().track(0).build());
        assertThrows(IllegalArgumentException.class, () -> ReferenceDesign.target().loadedRadius(-1).build());
        assertThrows(IllegalArgumentException.class,
                     () -> ReferenceDesign.target().frontWeightDistribution(1.5).build());
        assertEquals(LinkageType.MULTILINK, LinkageType.fromTitle("multilink"));
        assertThrows(IllegalArgumentException.class, () -> LinkageType.fromTitle("Trailing Arm"));
    }
}
