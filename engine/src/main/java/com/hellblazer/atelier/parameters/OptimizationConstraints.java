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

import java.util.Objects;

/**
 * Constraints applied by rule based parameter optimization.
 *
 * @param spaceLimited true when the venue is small; caps footprint
 * @param budget       budget band of the event
 * @author hal.hildebrand
 */
public record OptimizationConstraints(boolean spaceLimited, BudgetRange budget) {

    /** Small venue threshold in square meters */
    public static final double SMALL_SPACE_AREA = 20.0;

    public OptimizationConstraints {
        Objects.requireNonNull(budget, "budget cannot be null");
    }

    public static OptimizationConstraints none() {
        return new OptimizationConstraints(false, BudgetRange.MEDIUM);
    }

    /**
     * Derive constraints from a floor plan and budget
     */
    public static OptimizationConstraints forSpace(double width, double depth, BudgetRange budget) {
        return new OptimizationConstraints(width * depth < SMALL_SPACE_AREA, budget);
    }
}
