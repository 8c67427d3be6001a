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

import com.hellblazer.atelier.parameters.FormalityLevel;

import java.util.Locale;
import java.util.Map;

/**
 * Culture specific decorative intensity tables.
 * <p>
 * {@link #expected} is the intensity the authenticity check compares against. {@link #forFormality} is the starting
 * point chosen when the formality of a piece changes.
 *
 * @author hal.hildebrand
 */
public final class DecorativeIntensity {

    private static final Map<String, Double> EXPECTED_BASE = Map.of("japanese", 0.3, "scandinavian", 0.2,
                                                                    "italian", 0.8, "french", 0.6, "modern", 0.1);
    private static final double              DEFAULT_BASE  = 0.5;

    private static final Map<String, Double> CULTURE_MULTIPLIER = Map.of("japanese", 0.8, "scandinavian", 0.6,
                                                                         "italian", 1.2, "french", 1.0, "modern",
                                                                         0.4);

    private DecorativeIntensity() {
    }

    /**
     * Intensity a culture expects at a formality level, capped at 1
     */
    public static double expected(String culture, FormalityLevel formality) {
        var base = EXPECTED_BASE.getOrDefault(normalize(culture), DEFAULT_BASE);
        return Math.min(1.0, base * formality.intensityMultiplier());
    }

    /**
     * Intensity assigned when the formality of a piece is changed, capped at 1
     */
    public static double forFormality(FormalityLevel formality, String culture) {
        return Math.min(1.0, formality.baseIntensity() * CULTURE_MULTIPLIER.getOrDefault(normalize(culture), 1.0));
    }

    private static String normalize(String culture) {
        return culture == null ? "" : culture.trim().toLowerCase(Locale.ROOT);
    }
}
