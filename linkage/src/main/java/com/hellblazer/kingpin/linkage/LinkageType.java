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

/**
 * Suspension linkage topologies.
 *
 * @author hal.hildebrand
 */
public enum LinkageType {
    DOUBLE_WISHBONE("Double Wishbone"), MULTILINK("Multilink");

    private final String title;

    LinkageType(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @throws IllegalArgumentException if the title matches no linkage type
     */
    public static LinkageType fromTitle(String title) {
        for (var type : values()) {
            if (type.title.equalsIgnoreCase(title) || type.name().equalsIgnoreCase(title)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Linkage type not recognized: " + title);
    }
}
