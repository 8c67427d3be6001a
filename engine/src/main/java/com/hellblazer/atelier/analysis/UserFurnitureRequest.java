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

import com.hellblazer.atelier.parameters.BudgetRange;
import com.hellblazer.atelier.parameters.FormalityLevel;

import java.util.Objects;

/**
 * Free form event request from a user, before analysis.
 *
 * @param eventType           e.g. "intimate-dinner", "wedding"
 * @param culture             culture tag
 * @param guestCount          strictly positive
 * @param specialRequirements free text, possibly empty
 * @author hal.hildebrand
 */
public record UserFurnitureRequest(String eventType, String culture, int guestCount,
                                   SpaceDimensions spaceDimensions, BudgetRange budgetRange,
                                   FormalityLevel formalityLevel, String specialRequirements) {

    public UserFurnitureRequest {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(culture, "culture cannot be null");
        Objects.requireNonNull(spaceDimensions, "spaceDimensions cannot be null");
        Objects.requireNonNull(budgetRange, "budgetRange cannot be null");
        Objects.requireNonNull(formalityLevel, "formalityLevel cannot be null");
        if (guestCount <= 0) {
            throw new IllegalArgumentException("guestCount must be positive: " + guestCount);
        }
        specialRequirements = specialRequirements == null ? "" : specialRequirements;
    }
}
