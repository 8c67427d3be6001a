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
package com.hellblazer.atelier.metrics;

import java.time.Instant;
import java.util.Objects;

/**
 * Cost of generating one piece.
 *
 * @param generationTimeMs wall clock milliseconds
 * @param polygonCount     triangles in the generated geometry
 * @param memoryBytes      estimated geometry buffer size
 * @author hal.hildebrand
 */
public record PerformanceSample(double generationTimeMs, int polygonCount, long memoryBytes, Instant timestamp) {

    public PerformanceSample {
        if (generationTimeMs < 0 || Double.isNaN(generationTimeMs)) {
            throw new IllegalArgumentException("generationTimeMs must be non-negative: " + generationTimeMs);
        }
        if (polygonCount < 0) {
            throw new IllegalArgumentException("polygonCount must be non-negative: " + polygonCount);
        }
        if (memoryBytes < 0) {
            throw new IllegalArgumentException("memoryBytes must be non-negative: " + memoryBytes);
        }
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
    }

    public static PerformanceSample of(double generationTimeMs, int polygonCount, long memoryBytes) {
        return new PerformanceSample(generationTimeMs, polygonCount, memoryBytes, Instant.now());
    }
}
