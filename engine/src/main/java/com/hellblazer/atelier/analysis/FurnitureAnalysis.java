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

import java.util.List;
import java.util.Objects;

/**
 * Structured result of analyzing a request. Pieces are generated in list order.
 *
 * @author hal.hildebrand
 */
public record FurnitureAnalysis(List<FurniturePiece> pieces, String overallTheme) {

    public FurnitureAnalysis {
        pieces = List.copyOf(pieces);
        Objects.requireNonNull(overallTheme, "overallTheme cannot be null");
    }

    public int totalQuantity() {
        return pieces.stream().mapToInt(FurniturePiece::quantity).sum();
    }
}
