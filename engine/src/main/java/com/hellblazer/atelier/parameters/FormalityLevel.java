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

import java.util.Arrays;
import java.util.Optional;

/**
 * Formality of the occasion a piece is generated for.
 * <p>
 * Each level carries the multiplier applied to a culture's base decorative intensity when scoring, and the base
 * intensity used when formality is adjusted interactively.
 *
 * @author hal.hildebrand
 */
public enum FormalityLevel {
    CASUAL("casual", 0.8, 0.3),
    SEMI_FORMAL("semi-formal", 1.0, 0.5),
    FORMAL("formal", 1.2, 0.7),
    CEREMONIAL("ceremonial", 1.5, 0.9);

    private final String tag;
    private final double intensityMultiplier;
    private final double baseIntensity;

    FormalityLevel(String tag, double intensityMultiplier, double baseIntensity) {
        this.tag = tag;
        this.intensityMultiplier = intensityMultiplier;
        this.baseIntensity = baseIntensity;
    }

    public static Optional<FormalityLevel> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.tag.equalsIgnoreCase(tag.trim())).findFirst();
    }

    public String tag() {
        return tag;
    }

    /**
     * Multiplier applied to a culture's base decorative intensity
     */
    public double intensityMultiplier() {
        return intensityMultiplier;
    }

    /**
     * Decorative intensity a piece starts from when this formality is selected
     */
    public double baseIntensity() {
        return baseIntensity;
    }

    public boolean isFormal() {
        return this == FORMAL || this == CEREMONIAL;
    }
}
