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

import java.util.Objects;
import java.util.Optional;

/**
 * Physically based surface description of one material.
 *
 * @param name      material tag, e.g. "wood-oak"
 * @param color     hex color, e.g. "#8B4513"
 * @param roughness 0 (mirror) to 1 (matte)
 * @param metalness 0 (dielectric) to 1 (metal)
 * @param finish    surface finish, e.g. "natural-oil"
 * @author hal.hildebrand
 */
public record Material(String name, MaterialFamily family, String color, double roughness, double metalness,
                       String finish, Optional<TextureSet> textures) {

    public Material {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(family, "family cannot be null");
        Objects.requireNonNull(color, "color cannot be null");
        Objects.requireNonNull(finish, "finish cannot be null");
        Objects.requireNonNull(textures, "textures cannot be null");
        if (roughness < 0 || roughness > 1) {
            throw new IllegalArgumentException("roughness must be in [0, 1]: " + roughness);
        }
        if (metalness < 0 || metalness > 1) {
            throw new IllegalArgumentException("metalness must be in [0, 1]: " + metalness);
        }
    }

    public Material withTextures(TextureSet textures) {
        return new Material(name, family, color, roughness, metalness, finish, Optional.of(textures));
    }

    public boolean isTextured() {
        return textures.isPresent();
    }
}
