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
package com.hellblazer.atelier.analysis;

import com.hellblazer.atelier.parameters.ParametricParameters;

import java.util.Objects;

/**
 * One line of an analysis: generate {@code quantity} copies of {@code parameters}.
 *
 * @author hal.hildebrand
 */
public record FurniturePiece(String type, int quantity, Priority priority, ParametricParameters parameters,
                             String culturalReasoning, String functionalReasoning) {

    public FurniturePiece {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Objects.requireNonNull(culturalReasoning, "culturalReasoning cannot be null");
        Objects.requireNonNull(functionalReasoning, "functionalReasoning cannot be null");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
    }
}
