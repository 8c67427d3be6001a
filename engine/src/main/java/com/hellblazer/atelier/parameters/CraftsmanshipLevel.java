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
 * Level of craftsmanship requested for a piece.
 */
public enum CraftsmanshipLevel {
    SIMPLE("simple", 1.0),
    REFINED("refined", 1.5),
    MASTERWORK("masterwork", 2.5);

    private final String tag;
    private final double costMultiplier;

    CraftsmanshipLevel(String tag, double costMultiplier) {
        this.tag = tag;
        this.costMultiplier = costMultiplier;
    }

    public static Optional<CraftsmanshipLevel> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.tag.equalsIgnoreCase(tag.trim())).findFirst();
    }

    public String tag() {
        return tag;
    }

    /**
     * Multiplier applied to the base cost of a piece
     */
    public double costMultiplier() {
        return costMultiplier;
    }
}
