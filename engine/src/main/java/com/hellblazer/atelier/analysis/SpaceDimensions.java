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

/**
 * Venue dimensions in meters.
 *
 * @author hal.hildebrand
 */
public record SpaceDimensions(double width, double height, double depth) {

    public SpaceDimensions {
        if (!(width > 0) || !(height > 0) || !(depth > 0)) {
            throw new IllegalArgumentException(
            "Space dimensions must be positive: " + width + " x " + height + " x " + depth);
        }
    }

    /**
     * @return floor area in square meters
     */
    public double area() {
        return width * depth;
    }
}
