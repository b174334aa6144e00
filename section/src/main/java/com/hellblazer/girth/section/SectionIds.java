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
package com.hellblazer.girth.section;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Encodes the parameters that identify a cross section (axis, plane value, tolerance, candidate index, selection
 * criteria) as compact JSON with keys in sorted order, so equal sections always produce byte identical ids.
 *
 * @author hal.hildebrand
 */
public final class SectionIds {
    private static final ObjectMapper MAPPER = new ObjectMapper().configure(
    SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static Map<String, Object> decode(String sectionId) {
        try {
            return MAPPER.readValue(sectionId, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a section id: " + sectionId, e);
        }
    }

    public static String encode(Map<String, ?> fields) {
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode section id " + fields, e);
        }
    }

    private SectionIds() {
    }
}
