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
package com.hellblazer.atelier.cultural;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.atelier.cultural.CulturalProfile.Aesthetics;
import com.hellblazer.atelier.cultural.CulturalProfile.Ergonomics;
import com.hellblazer.atelier.cultural.CulturalProfile.GroupOrientation;
import com.hellblazer.atelier.cultural.CulturalProfile.Materials;
import com.hellblazer.atelier.cultural.CulturalProfile.Proportions;
import com.hellblazer.atelier.parameters.FurnitureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static lookup of cultural profiles, keyed by lower case culture tag.
 *
 * <p>The bundled profiles are loaded from {@value #PROFILE_RESOURCE}. Lookups for an unknown culture either return
 * empty ({@link #find(String)}) or degrade to the hard coded {@link #DEFAULT_PROFILE}
 * ({@link #getOrDefault(String)}), so callers that must not fail always have a profile to work with.
 *
 * <p>Immutable and thread-safe after construction.
 *
 * @author hal.hildebrand
 */
public final class CulturalProfileStore {
    public static final String PROFILE_RESOURCE = "/cultural-profiles.json";

    /** Neutral profile used when a culture is unknown */
    public static final CulturalProfile DEFAULT_PROFILE = new CulturalProfile("Default",
                                                                              new Proportions(0.45, 0.75, 0.68, 15,
                                                                                              0.07, 0.04),
                                                                              new Materials(List.of("wood-oak"),
                                                                                            List.of("wood-oak"),
                                                                                            List.of(), Map.of()),
                                                                              new Aesthetics(List.of("#8B4513"),
                                                                                             List.of("clean-lines"),
                                                                                             List.of("natural-oil"),
                                                                                             List.of("mortise-tenon"),
                                                                                             Map.of()),
                                                                              new Ergonomics(false, false,
                                                                                             GroupOrientation.LINEAR,
                                                                                             0.6));

    private static final Logger log = LoggerFactory.getLogger(CulturalProfileStore.class);

    private final Map<String, CulturalProfile> profiles;

    /**
     * Create a store from explicit profiles, keyed by culture tag
     */
    public CulturalProfileStore(Map<String, CulturalProfile> profiles) {
        var normalized = new LinkedHashMap<String, CulturalProfile>();
        profiles.forEach((culture, profile) -> normalized.put(normalize(culture), profile));
        this.profiles = Collections.unmodifiableMap(normalized);
    }

    /**
     * Load the bundled profiles from the classpath
     *
     * @throws IllegalStateException if the resource is missing
     * @throws UncheckedIOException  if the resource cannot be parsed
     */
    public static CulturalProfileStore loadDefault() {
        try (var in = CulturalProfileStore.class.getResourceAsStream(PROFILE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Cultural profile resource not found: " + PROFILE_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + PROFILE_RESOURCE, e);
        }
    }

    /**
     * Load profiles from a JSON object whose fields are culture tags
     */
    public static CulturalProfileStore load(InputStream in) throws IOException {
        var mapper = new ObjectMapper();
        Map<String, CulturalProfile> loaded = mapper.readValue(in, new TypeReference<LinkedHashMap<String, CulturalProfile>>() {
        });
        log.info("Loaded {} cultural profiles: {}", loaded.size(), loaded.keySet());
        return new CulturalProfileStore(loaded);
    }

    private static String normalize(String culture) {
        return culture == null ? "" : culture.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<CulturalProfile> find(String culture) {
        return Optional.ofNullable(profiles.get(normalize(culture)));
    }

    public CulturalProfile getOrDefault(String culture) {
        var profile = profiles.get(normalize(culture));
        if (profile == null) {
            log.debug("Unknown culture '{}', using default profile", culture);
            return DEFAULT_PROFILE;
        }
        return profile;
    }

    public boolean isKnown(String culture) {
        return profiles.containsKey(normalize(culture));
    }

    /**
     * @return the supported culture tags, in load order
     */
    public Set<String> cultures() {
        return profiles.keySet();
    }

    /**
     * Proportions for a culture adapted to a furniture type: coffee tables sit at 60% and side tables at 80% of the
     * dining height, benches slightly below chair height. Unknown cultures use the default profile.
     */
    public Proportions proportionsFor(String culture, String furnitureType) {
        return adaptProportions(getOrDefault(culture).proportions(), furnitureType);
    }

    /**
     * Adapt a profile's base proportions to a furniture type
     */
    public static Proportions adaptProportions(Proportions base, String furnitureType) {
        return FurnitureType.fromTag(furnitureType).map(type -> switch (type) {
            case COFFEE_TABLE -> base.withTableHeight(base.tableHeight() * 0.6);
            case SIDE_TABLE -> base.withTableHeight(base.tableHeight() * 0.8);
            case BENCH -> base.withSeatHeight(base.seatHeight() * 0.95);
            default -> base;
        }).orElse(base);
    }

    /**
     * A material is appropriate unless the culture explicitly avoids it; unknown cultures accept everything.
     */
    public boolean isMaterialAppropriate(String material, String culture) {
        return find(culture).map(p -> !p.materials().avoids(material)).orElse(true);
    }

    public List<String> recommendations(String culture) {
        return find(culture).map(profile -> {
            var aesthetics = profile.aesthetics();
            var symbol = aesthetics.symbolism().isEmpty() ? "traditional elements"
                                                          : aesthetics.symbolism().keySet().stream().sorted()
                                                                      .findFirst().orElseThrow();
            return List.of(String.format("Use %s for authentic materials", joinFirst(profile.materials().preferred(), 3)),
                           String.format("Incorporate %s for cultural accuracy",
                                         joinFirst(aesthetics.decorativeElements(), 3)),
                           String.format("Consider %s for deeper meaning", symbol),
                           String.format("Apply %s finish for authentic appearance",
                                         aesthetics.surfaceFinishes().isEmpty() ? "a natural"
                                                                                : aesthetics.surfaceFinishes()
                                                                                            .get(0)));
        }).orElse(List.of());
    }

    private static String joinFirst(List<String> values, int count) {
        return String.join(", ", values.subList(0, Math.min(count, values.size())));
    }
}
