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
package com.hellblazer.kingpin.exceptions;

/**
 * Base sealed class for the structural failures of a kinematic solve. All of these are fatal to the current solve and
 * propagate to the caller; bound violations are not exceptions and are reported separately.
 *
 * @author hal.hildebrand
 */
public sealed class KinematicsException extends RuntimeException
permits GraphConstructionException, FrameNotFoundException, PointNotFoundException, UnsupportedLinkageException,
        NotImplementedException {

    public KinematicsException(String message) {
        super(message);
    }

    public KinematicsException(String message, Throwable cause) {
        super(message, cause);
    }
}
