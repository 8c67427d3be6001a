/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Atelier.
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
package com.hellblazer.atelier.parameters;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Canonical cache key for a parameter set.
 * <p>
 * The key is the compact JSON form of the parameters with properties sorted alphabetically, map entries sorted by key
 * and absent optionals omitted, so structurally equal parameter sets always produce the same key regardless of how
 * they were assembled. List order is significant.
 *
 * @author hal.hildebrand
 */
public final class CanonicalKey {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
                                                         .addModule(new Jdk8Module())
                                                         .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                                                         .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                                                         .disable(SerializationFeature.INDENT_OUTPUT)
                                                         .serializationInclusion(JsonInclude.Include.NON_ABSENT)
                                                         .build();

    private CanonicalKey() {
    }

    public static String of(ParametricParameters parameters) {
        try {
            return MAPPER.writeValueAsString(parameters);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to canonicalize parameters: " + parameters, e);
        }
    }
}
