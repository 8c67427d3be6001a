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

import com.hellblazer.atelier.metrics.PerformanceThresholds;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Tuning knobs of the {@link GenerationEngine}.
 *
 * @param cacheCapacity         maximum number of cached generation results
 * @param cacheTtl              optional time-to-live of cached results
 * @param metricsWindow         samples retained per type-culture key
 * @param authenticityThreshold overall score below which parameters are corrected, in [0, 1]
 * @param maxCorrectionPasses   bound on correct-and-rescore iterations
 * @param analyzerTimeout       how long a batch waits for the requirement analyzer
 * @param fallbackPieceLimit    maximum number of chairs produced by the fallback
 * @param thresholds            performance thresholds used to classify samples
 *
 * @author hal.hildebrand
 */
public record EngineConfiguration(int cacheCapacity, Optional<Duration> cacheTtl, int metricsWindow,
                                  double authenticityThreshold, int maxCorrectionPasses, Duration analyzerTimeout,
                                  int fallbackPieceLimit, PerformanceThresholds thresholds) {

    public EngineConfiguration {
        Objects.requireNonNull(cacheTtl, "cacheTtl cannot be null");
        Objects.requireNonNull(analyzerTimeout, "analyzerTimeout cannot be null");
        Objects.requireNonNull(thresholds, "thresholds cannot be null");
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be positive: " + cacheCapacity);
        }
        cacheTtl.ifPresent(ttl -> {
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalArgumentException("cacheTtl must be positive: " + ttl);
            }
        });
        if (metricsWindow <= 0) {
            throw new IllegalArgumentException("metricsWindow must be positive: " + metricsWindow);
        }
        if (!(authenticityThreshold >= 0.0 && authenticityThreshold <= 1.0)) {
            throw new IllegalArgumentException("authenticityThreshold must be in [0, 1]: " + authenticityThreshold);
        }
        if (maxCorrectionPasses < 0) {
            throw new IllegalArgumentException("maxCorrectionPasses cannot be negative: " + maxCorrectionPasses);
        }
        if (analyzerTimeout.isNegative() || analyzerTimeout.isZero()) {
            throw new IllegalArgumentException("analyzerTimeout must be positive: " + analyzerTimeout);
        }
        if (fallbackPieceLimit <= 0) {
            throw new IllegalArgumentException("fallbackPieceLimit must be positive: " + fallbackPieceLimit);
        }
    }

    public static EngineConfiguration defaultConfig() {
        return new EngineConfiguration(256, Optional.empty(), 100, 0.7, 2, Duration.ofSeconds(10), 8,
                                       PerformanceThresholds.DEFAULT);
    }

    public EngineConfiguration withCacheCapacity(int cacheCapacity) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withCacheTtl(Duration ttl) {
        return new EngineConfiguration(cacheCapacity, Optional.of(ttl), metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withMetricsWindow(int metricsWindow) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withAuthenticityThreshold(double authenticityThreshold) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withMaxCorrectionPasses(int maxCorrectionPasses) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withAnalyzerTimeout(Duration analyzerTimeout) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withFallbackPieceLimit(int fallbackPieceLimit) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }

    public EngineConfiguration withThresholds(PerformanceThresholds thresholds) {
        return new EngineConfiguration(cacheCapacity, cacheTtl, metricsWindow, authenticityThreshold,
                                       maxCorrectionPasses, analyzerTimeout, fallbackPieceLimit, thresholds);
    }
}
