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

/**
 * Per-piece performance budget.
 *
 * @author hal.hildebrand
 */
public record PerformanceThresholds(double maxGenerationTimeMs, int maxPolygonCount, long maxMemoryBytes) {

    public static final double DEFAULT_MAX_GENERATION_TIME_MS = 1000.0;
    public static final int    DEFAULT_MAX_POLYGON_COUNT      = 50_000;
    public static final long   DEFAULT_MAX_MEMORY_BYTES       = 10L * 1024 * 1024;

    public static final PerformanceThresholds DEFAULT = new PerformanceThresholds(DEFAULT_MAX_GENERATION_TIME_MS,
                                                                                  DEFAULT_MAX_POLYGON_COUNT,
                                                                                  DEFAULT_MAX_MEMORY_BYTES);

    public PerformanceThresholds {
        if (!(maxGenerationTimeMs > 0)) {
            throw new IllegalArgumentException("maxGenerationTimeMs must be positive: " + maxGenerationTimeMs);
        }
        if (maxPolygonCount <= 0) {
            throw new IllegalArgumentException("maxPolygonCount must be positive: " + maxPolygonCount);
        }
        if (maxMemoryBytes <= 0) {
            throw new IllegalArgumentException("maxMemoryBytes must be positive: " + maxMemoryBytes);
        }
    }

    /**
     * Largest of the time, polygon and memory usage ratios
     */
    public double usage(PerformanceSample sample) {
        return Math.max(sample.generationTimeMs() / maxGenerationTimeMs,
                        Math.max((double) sample.polygonCount() / maxPolygonCount,
                                 (double) sample.memoryBytes() / maxMemoryBytes));
    }

    public PerformanceStatus status(PerformanceSample sample) {
        return PerformanceStatus.classify(usage(sample));
    }
}
