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
package com.hellblazer.atelier.material;

import java.util.Locale;

/**
 * Physical family of a material tag, e.g. "wood-oak" is {@link #WOOD}. Carries the default surface response of the
 * family.
 *
 * @author hal.hildebrand
 */
public enum MaterialFamily {
    WOOD(0.7, 0.0),
    FABRIC(0.8, 0.0),
    METAL(0.3, 0.8),
    LEATHER(0.8, 0.0),
    CERAMIC(0.1, 0.0),
    GLASS(0.0, 0.0),
    STONE(0.9, 0.0),
    OTHER(0.5, 0.0);

    private final double roughness;
    private final double metalness;

    MaterialFamily(double roughness, double metalness) {
        this.roughness = roughness;
        this.metalness = metalness;
    }

    public static MaterialFamily of(String material) {
        var tag = material.trim().toLowerCase(Locale.ROOT);
        if (tag.startsWith("wood")) {
            return WOOD;
        }
        if (tag.startsWith("fabric")) {
            return FABRIC;
        }
        if (tag.startsWith("metal") || tag.startsWith("bronze")) {
            return METAL;
        }
        if (tag.startsWith("leather")) {
            return LEATHER;
        }
        if (tag.equals("ceramic")) {
            return CERAMIC;
        }
        if (tag.equals("glass")) {
            return GLASS;
        }
        if (tag.equals("stone") || tag.equals("marble")) {
            return STONE;
        }
        return OTHER;
    }

    public double roughness() {
        return roughness;
    }

    public double metalness() {
        return metalness;
    }
}
