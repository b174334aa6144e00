/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Girth.
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
package com.hellblazer.girth.section.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.girth.section.MeasurementKey;
import com.hellblazer.girth.section.component.CenterReference;
import com.hellblazer.girth.section.component.TieBreak;
import com.hellblazer.girth.section.select.PolicyTable;
import com.hellblazer.girth.section.select.SelectionStatistic;

/**
 * Loads {@link SectionConfig} from JSON. A document is an object whose fields override the defaults, e.g.
 *
 * <pre>
 * {
 *   "candidateCount": 30,
 *   "connectivityDistance": 0.012,
 *   "alphaKChoices": [3, 5, 7],
 *   "perimeterBounds": { "small": 0.1, "large": 3.0 },
 *   "policies": { "WAIST": { "start": 0.45, "end": 0.65 } }
 * }
 * </pre>
 *
 * The bundled {@value #PROFILE_RESOURCE} holds named profiles under a top level {@code "profiles"} object. Unknown
 * fields are rejected rather than ignored.
 *
 * @author hal.hildebrand
 */
public class SectionConfigLoader {
    public static final String  PROFILE_RESOURCE = "/section-profiles.json";
    private static final Logger log              = LoggerFactory.getLogger(SectionConfigLoader.class);

    private final ObjectMapper objectMapper;

    public SectionConfigLoader() {
        this(new ObjectMapper());
    }

    public SectionConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse a configuration document, applying its fields over the defaults
     */
    public SectionConfig fromJson(String json) throws ConfigurationException {
        try {
            return apply(objectMapper.readTree(json), SectionConfig.defaults());
        } catch (IOException e) {
            throw new ConfigurationException("Unable to parse section configuration", e);
        }
    }

    public SectionConfig load(Path path) throws SectionException {
        if (!Files.isRegularFile(path)) {
            throw new ProfileNotFoundException("No configuration file: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            var config = apply(objectMapper.readTree(in), SectionConfig.defaults());
            log.info("Loaded section configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read section configuration " + path, e);
        }
    }

    /**
     * Load every named profile in the bundled profile resource
     *
     * @return profile name to configuration, sorted by name
     */
    public Map<String, SectionConfig> loadProfiles() throws SectionException {
        try (InputStream in = getClass().getResourceAsStream(PROFILE_RESOURCE)) {
            if (in == null) {
                throw new ProfileNotFoundException("Profile resource not found: " + PROFILE_RESOURCE);
            }
            var root = objectMapper.readTree(in);
            var profiles = root.get("profiles");
            if (profiles == null || !profiles.isObject()) {
                throw new ConfigurationException(PROFILE_RESOURCE + " has no \"profiles\" object");
            }
            var result = new TreeMap<String, SectionConfig>();
            var names = profiles.fieldNames();
            while (names.hasNext()) {
                var name = names.next();
                result.put(name, apply(profiles.get(name), SectionConfig.defaults()));
                log.debug("Loaded section profile: {}", name);
            }
            log.info("Loaded {} section profiles", result.size());
            return result;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + PROFILE_RESOURCE, e);
        }
    }

    /**
     * @param name the profile name, case insensitive
     */
    public SectionConfig profile(String name) throws SectionException {
        var profiles = loadProfiles();
        var config = profiles.get(name.toLowerCase(Locale.ROOT));
        if (config == null) {
            throw new ProfileNotFoundException("No section profile named " + name + ", known: " + profiles.keySet());
        }
        return config;
    }

    SectionConfig apply(JsonNode node, SectionConfig config) throws ConfigurationException {
        if (node == null || !node.isObject()) {
            throw new ConfigurationException("Section configuration must be a JSON object");
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            try {
                applyField(field.getKey(), field.getValue(), config);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid value for " + field.getKey() + ": " + e.getMessage(), e);
            }
        }
        return config;
    }

    private void applyField(String name, JsonNode value, SectionConfig config) throws ConfigurationException {
        switch (name) {
        case "alphaBoundaryRatio" -> config.withAlphaBoundaryRatio(number(name, value));
        case "alphaKChoices" -> config.withAlphaKChoices(ints(name, value));
        case "ambiguityEpsilon" -> config.withAmbiguityEpsilon(number(name, value));
        case "candidateCount" -> config.withCandidateCount(integer(name, value));
        case "centerReference" -> config.withCenterReference(CenterReference.valueOf(text(name, value)));
        case "clusterEpsFactor" -> config.withClusterEpsFactor(number(name, value));
        case "clusterMinSamples" -> config.withClusterMinSamples(integer(name, value));
        case "connectivityDensity" -> config.withConnectivityDensity(
        number("factor", member(name, value, "factor", config.getConnectivityDensityFactor())),
        number("max", member(name, value, "max", config.getMaxConnectivityDistance())));
        case "connectivityDistance" -> config.withConnectivityDistance(number(name, value));
        case "dedupeEpsilon" -> config.withDedupeEpsilon(number(name, value));
        case "defaultAlphaK" -> config.withDefaultAlphaK(integer(name, value));
        case "extentTolerance" -> config.withExtentTolerance(
        number("fraction", member(name, value, "fraction", config.getExtentToleranceFraction())),
        number("minimum", member(name, value, "minimum", config.getExtentMinTolerance())),
        number("maxFraction", member(name, value, "maxFraction", config.getExtentMaxToleranceFraction())));
        case "fragmentation" -> config.withFragmentation(
        number("share", member(name, value, "share", config.getFragmentShare())),
        number("gap", member(name, value, "gap", config.getFragmentGap())));
        case "heightBounds" -> config.withHeightBounds(
        number("small", member(name, value, "small", config.getHeightSmall())),
        number("large", member(name, value, "large", config.getHeightLarge())));
        case "maxAngularGap" -> config.withMaxAngularGap(number(name, value));
        case "maxSlicePoints" -> config.withMaxSlicePoints(integer(name, value));
        case "minAxisExtent" -> config.withMinAxisExtent(number(name, value));
        case "minBoundaryPoints" -> config.withMinBoundaryPoints(integer(name, value));
        case "minComponentPoints" -> config.withMinComponentPoints(integer(name, value));
        case "minHullCoverage" -> config.withMinHullCoverage(number(name, value));
        case "minSlicePoints" -> config.withMinSlicePoints(integer(name, value));
        case "nearestPlaneSearch" -> config.withNearestPlaneSearch(
        number("window", member(name, value, "window", config.getNearestPlaneWindow())),
        number("step", member(name, value, "step", config.getNearestPlaneStep())));
        case "perimeterBounds" -> config.withPerimeterBounds(
        number("small", member(name, value, "small", config.getPerimeterSmall())),
        number("large", member(name, value, "large", config.getPerimeterLarge())));
        case "policies" -> config.withPolicyTable(policies(value, config.getPolicyTable()));
        case "relaxedAlphaK" -> config.withRelaxedAlphaK(integer(name, value));
        case "secondaryK" -> config.withSecondaryK(integer(name, value));
        case "secondaryPercentile" -> config.withSecondaryPercentile(number(name, value));
        case "tieBreakOrder" -> config.withTieBreakOrder(tieBreaks(name, value));
        case "tieEpsilon" -> config.withTieEpsilon(number(name, value));
        case "toleranceFactor" -> config.withToleranceFactor(number(name, value));
        case "unitMaxAbs" -> config.withUnitMaxAbs(number(name, value));
        default -> throw new ConfigurationException("Unknown section configuration field: " + name);
        }
    }

    private int integer(String name, JsonNode value) throws ConfigurationException {
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigurationException(name + " must be an integer: " + value);
        }
        return value.intValue();
    }

    private int[] ints(String name, JsonNode value) throws ConfigurationException {
        if (value == null || !value.isArray()) {
            throw new ConfigurationException(name + " must be an array of integers: " + value);
        }
        var result = new int[value.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = integer(name, value.get(i));
        }
        return result;
    }

    private JsonNode member(String name, JsonNode value, String member, double current) throws ConfigurationException {
        if (value == null || !value.isObject()) {
            throw new ConfigurationException(name + " must be an object: " + value);
        }
        var fields = value.fieldNames();
        while (fields.hasNext()) {
            var field = fields.next();
            if (!isMember(name, field)) {
                throw new ConfigurationException("Unknown field " + name + "." + field);
            }
        }
        var node = value.get(member);
        return node == null ? objectMapper.getNodeFactory().numberNode(current) : node;
    }

    private boolean isMember(String name, String field) {
        return switch (name) {
        case "connectivityDensity" -> field.equals("factor") || field.equals("max");
        case "extentTolerance" -> field.equals("fraction") || field.equals("minimum") || field.equals("maxFraction");
        case "fragmentation" -> field.equals("share") || field.equals("gap");
        case "nearestPlaneSearch" -> field.equals("window") || field.equals("step");
        case "heightBounds", "perimeterBounds" -> field.equals("small") || field.equals("large");
        default -> false;
        };
    }

    private double number(String name, JsonNode value) throws ConfigurationException {
        if (value == null || !value.isNumber()) {
            throw new ConfigurationException(name + " must be a number: " + value);
        }
        return value.doubleValue();
    }

    private PolicyTable policies(JsonNode value, PolicyTable table) throws ConfigurationException {
        if (value == null || !value.isObject()) {
            throw new ConfigurationException("policies must be an object keyed by measurement: " + value);
        }
        var result = table;
        var fields = value.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var key = MeasurementKey.fromToken(entry.getKey());
            var override = entry.getValue();
            if (!override.isObject()) {
                throw new ConfigurationException("Policy for " + key + " must be an object");
            }
            var policy = result.policy(key);
            var start = policy.startFraction();
            var end = policy.endFraction();
            var names = override.fieldNames();
            while (names.hasNext()) {
                var field = names.next();
                var fieldValue = override.get(field);
                switch (field) {
                case "start" -> start = number(key + ".start", fieldValue);
                case "end" -> end = number(key + ".end", fieldValue);
                case "statistic" -> policy = policy.withStatistic(
                SelectionStatistic.valueOf(text(key + ".statistic", fieldValue).toUpperCase(Locale.ROOT)));
                case "separationExpected" -> {
                    if (!fieldValue.isBoolean()) {
                        throw new ConfigurationException(key + ".separationExpected must be a boolean");
                    }
                    policy = policy.withSeparationExpected(fieldValue.booleanValue());
                }
                default -> throw new ConfigurationException("Unknown policy field " + key + "." + field);
                }
            }
            result = result.with(key, policy.withRange(start, end));
        }
        return result;
    }

    private List<TieBreak> tieBreaks(String name, JsonNode value) throws ConfigurationException {
        if (value == null || !value.isArray()) {
            throw new ConfigurationException(name + " must be an array of criteria: " + value);
        }
        var order = new ArrayList<TieBreak>();
        for (var element : value) {
            order.add(TieBreak.valueOf(text(name, element).toUpperCase(Locale.ROOT)));
        }
        return order;
    }

    private String text(String name, JsonNode value) throws ConfigurationException {
        if (value == null || !value.isTextual()) {
            throw new ConfigurationException(name + " must be a string: " + value);
        }
        return value.textValue();
    }
}
