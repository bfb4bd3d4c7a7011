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
package com.hellblazer.kingpin.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.kingpin.design.DesignBound;
import com.hellblazer.kingpin.design.DesignBounds;
import com.hellblazer.kingpin.linkage.Axle;
import com.hellblazer.kingpin.linkage.LinkageType;
import com.hellblazer.kingpin.linkage.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads linkage configurations from JSON.
 *
 * <pre>{@code
 * {
 *   "name": "Front",
 *   "target": { "linkage": "Double Wishbone", "axle": "FRONT", "wheelbase": 1525, "cgHeight": 215.9, ... },
 *   "bounds": { "LAF": [[127, 127], [203.2, 220.98], [12.7, 38.1]], "PA": [[null, null], [50.8, 101.6], [null, null]] }
 * }
 * }</pre>
 * <p>
 * Lengths are millimetres, angles degrees, camber and caster gains degrees per millimetre, roll and pitch center heights
 * percent of CG height. A {@code null} bound end marks a fixed axis.
 *
 * @author hal.hildebrand
 */
public class LinkageConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(LinkageConfigLoader.class);

    /** Classpath resource of the reference double wishbone corner */
    public static final String DEFAULT_RESOURCE = "/double-wishbone-default.json";

    private final ObjectMapper objectMapper;

    public LinkageConfigLoader() {
        this(new ObjectMapper());
    }

    public LinkageConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the bundled reference configuration
     */
    public LinkageConfig loadDefault() throws ConfigurationException {
        return loadResource(DEFAULT_RESOURCE);
    }

    public LinkageConfig loadResource(String resource) throws ConfigurationException {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource " + resource, e);
        }
    }

    public LinkageConfig load(Path path) throws ConfigurationException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
    }

    public LinkageConfig load(InputStream is) throws ConfigurationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(is);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        var name = root.path("name").asText("Unnamed");
        var target = parseTarget(section(root, "target"));
        var bounds = parseBounds(section(root, "bounds"));
        log.info("Loaded configuration {}: {} {}, {} bounds", name, target.axle(), target.linkage().getTitle(),
                 bounds.labels().size());
        return new LinkageConfig(name, target, bounds);
    }

    Target parseTarget(JsonNode node) throws ConfigurationException {
        var builder = Target.builder();
        try {
            builder.linkage(LinkageType.fromTitle(node.path("linkage").asText(LinkageType.DOUBLE_WISHBONE.getTitle())));
            builder.axle(Axle.valueOf(node.path("axle").asText(Axle.FRONT.name()).toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        builder.wheelbase(required(node, "wheelbase"))
               .frontWeightDistribution(optional(node, "frontWeightDistribution", 0.5))
               .sprungMass(optional(node, "sprungMass", 0))
               .rideHeight(required(node, "rideHeight"))
               .rake(Math.toRadians(optional(node, "rake", 0)))
               .loadedRadius(required(node, "loadedRadius"))
               .track(required(node, "track"))
               .toe(Math.toRadians(optional(node, "toe", 0)))
               .caster(Math.toRadians(optional(node, "caster", 0)))
               .casterGain(Math.toRadians(optional(node, "casterGain", 0)))
               .pitchCenter(optional(node, "pitchCenter", 0))
               .camber(Math.toRadians(optional(node, "camber", 0)))
               .camberGain(Math.toRadians(optional(node, "camberGain", 0)))
               .rollCenter(optional(node, "rollCenter", 0))
               .scrub(optional(node, "scrub", 0))
               .kpi(Math.toRadians(optional(node, "kpi", 0)))
               .rideRatio(optional(node, "rideRatio", 1))
               .arbRatio(optional(node, "arbRatio", 1));

        var cg = node.get("cg");
        if (cg != null) {
            if (!cg.isArray() || cg.size() != 3) {
                throw new ConfigurationException("Target cg must be [longitudinal, lateral, height]");
            }
            builder.cg(number(cg.get(0), "cg"), number(cg.get(1), "cg"), number(cg.get(2), "cg"));
        } else {
            builder.cgHeight(required(node, "cgHeight"));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid target: " + e.getMessage(), e);
        }
    }

    DesignBounds parseBounds(JsonNode node) throws ConfigurationException {
        var builder = DesignBounds.builder();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var label = entry.getKey();
            var rows = entry.getValue();
            if (!rows.isArray() || rows.size() != 3) {
                throw new ConfigurationException("Bound " + label + " must hold 3 [min, max] rows");
            }
            var table = new double[3][2];
            for (int i = 0; i < 3; i++) {
                var row = rows.get(i);
                if (!row.isArray() || row.size() != 2) {
                    throw new ConfigurationException("Bound " + label + " row " + i + " must be [min, max]");
                }
                table[i][0] = boundEnd(row.get(0), label);
                table[i][1] = boundEnd(row.get(1), label);
            }
            try {
                builder.bound(label, table);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid bound " + label + ": " + e.getMessage(), e);
            }
            log.debug("Bound {}: {}", label, rows);
        }
        return builder.build();
    }

    private static JsonNode section(JsonNode root, String field) throws ConfigurationException {
        var node = root.get(field);
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Configuration requires a \"" + field + "\" object");
        }
        return node;
    }

    private static double required(JsonNode node, String field) throws ConfigurationException {
        var value = node.get(field);
        if (value == null) {
            throw new ConfigurationException("Target requires \"" + field + "\"");
        }
        return number(value, field);
    }

    private static double optional(JsonNode node, String field, double defaultValue) throws ConfigurationException {
        var value = node.get(field);
        return value == null ? defaultValue : number(value, field);
    }

    private static double number(JsonNode value, String field) throws ConfigurationException {
        if (!value.isNumber()) {
            throw new ConfigurationException("\"" + field + "\" must be a number, got " + value);
        }
        return value.asDouble();
    }

    private static double boundEnd(JsonNode value, String label) throws ConfigurationException {
        return value.isNull() ? Double.NaN : number(value, label);
    }
}
