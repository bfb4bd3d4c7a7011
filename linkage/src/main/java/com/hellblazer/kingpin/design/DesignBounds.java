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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of design bounds keyed by point label, in insertion order.
 *
 * @author hal.hildebrand
 */
public final class DesignBounds {

    private final Map<String, DesignBound> bounds;

    private DesignBounds(Map<String, DesignBound> bounds) {
        this.bounds = Collections.unmodifiableMap(bounds);
    }

    public static DesignBounds of(Map<String, DesignBound> bounds) {
        return new DesignBounds(new LinkedHashMap<>(bounds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<DesignBound> find(String label) {
        return Optional.ofNullable(bounds.get(label));
    }

    /**
     * @throws IllegalArgumentException if no bound is defined for the label
     */
    public DesignBound get(String label) {
        var bound = bounds.get(label);
        if (bound == null) {
            throw new IllegalArgumentException("No design bound for " + label);
        }
        return bound;
    }

    public boolean contains(String label) {
        return bounds.containsKey(label);
    }

    public Set<String> labels() {
        return bounds.keySet();
    }

    public Map<String, DesignBound> asMap() {
        return bounds;
    }

    /**
     * @return a copy with the label's bound replaced
     */
    public DesignBounds with(String label, DesignBound bound) {
        var copy = new LinkedHashMap<>(bounds);
        copy.put(label, bound);
        return new DesignBounds(copy);
    }

    @Override
    public String toString() {
        return "DesignBounds" + bounds;
    }

    public static final class Builder {
        private final Map<String, DesignBound> bounds = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder bound(String label, DesignBound bound) {
            bounds.put(label, bound);
            return this;
        }

        public Builder bound(String label, double[][] rows) {
            return bound(label, DesignBound.of(rows));
        }

        public DesignBounds build() {
            return new DesignBounds(new LinkedHashMap<>(bounds));
        }
    }
}
