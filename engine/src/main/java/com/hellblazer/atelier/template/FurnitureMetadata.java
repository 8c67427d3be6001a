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
package com.hellblazer.atelier.template;

import java.util.List;
import java.util.Objects;

/**
 * Descriptive metadata of a generated piece.
 *
 * @param id            deterministic for a given parameter set
 * @param estimatedCost whole USD
 * @author hal.hildebrand
 */
public record FurnitureMetadata(String id, String name, String description, String culturalSignificance,
                                List<String> usageGuidelines, List<String> maintenanceInstructions,
                                long estimatedCost) {

    public FurnitureMetadata {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        Objects.requireNonNull(culturalSignificance, "culturalSignificance cannot be null");
        usageGuidelines = List.copyOf(usageGuidelines);
        maintenanceInstructions = List.copyOf(maintenanceInstructions);
        if (estimatedCost < 0) {
            throw new IllegalArgumentException("estimatedCost must be non-negative: " + estimatedCost);
        }
    }
}
