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
package com.hellblazer.kingpin.design;

/**
 * A load time bound normalization rule: when the recipient's range on {@code axis} is unset (both ends zero) it takes
 * the donor's range on that axis, and the sampled recipient takes the donor's resolved coordinate on that axis.
 *
 * @param recipient label inheriting the range
 * @param axis      inherited axis
 * @param donor     label supplying the range
 * @author hal.hildebrand
 */
public record BoundInheritance(String recipient, Direction axis, String donor) {
}
