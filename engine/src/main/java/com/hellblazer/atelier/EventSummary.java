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
package com.hellblazer.atelier;

import java.util.List;

/**
 * Totals over the pieces of an event setup.
 *
 * @author hal.hildebrand
 */
public record EventSummary(int totalPieces, int totalComponents, long totalCost, double generationTimeMs,
                           String culturalTheme) {

    static EventSummary of(List<GenerationResult> pieces, String culturalTheme) {
        var components = 0;
        var cost = 0L;
        var time = 0.0;
        for (var piece : pieces) {
            components += piece.geometry().componentCount();
            cost += piece.metadata().estimatedCost();
            time += piece.performanceMetrics().generationTimeMs();
        }
        return new EventSummary(pieces.size(), components, cost, time, culturalTheme);
    }
}
