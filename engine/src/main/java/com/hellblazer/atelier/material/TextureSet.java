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
 * Texture maps for a material, by resource location.
 *
 * @author hal.hildebrand
 */
public record TextureSet(String colorMap, Optional<String> normalMap, Optional<String> roughnessMap,
                         Optional<String> metalnessMap) {

    public TextureSet {
        Objects.requireNonNull(colorMap, "colorMap cannot be null");
        Objects.requireNonNull(normalMap, "normalMap cannot be null");
        Objects.requireNonNull(roughnessMap, "roughnessMap cannot be null");
        Objects.requireNonNull(metalnessMap, "metalnessMap cannot be null");
    }
}
