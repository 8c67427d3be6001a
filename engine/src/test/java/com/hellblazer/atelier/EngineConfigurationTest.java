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

import com.hellblazer.atelier.analysis.SpaceDimensions;
import com.hellblazer.atelier.analysis.UserFurnitureRequest;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.BudgetRange;
import com.hellblazer.atelier.parameters.FormalityLevel;
import com.hellblazer.atelier.parameters.ParameterValidator;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.template.TemplateRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class EngineConfigurationTest {

    @Test
    public void defaults() {
        var config = EngineConfiguration.defaultConfig();
        assertEquals(256, config.cacheCapacity());
        assertEquals(Optional.empty(), config.cacheTtl());
        assertEquals(100, config.metricsWindow());
        assertEquals(0.7, config.authenticityThreshold());
        assertEquals(2, config.maxCorrectionPasses());
        assertEquals(Duration.ofSeconds(10), config.analyzerTimeout());
        assertEquals(8, config.fallbackPieceLimit());
    }

    @Test
    public void rejectsInvalidValues() {
        var config = EngineConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class, () -> config.withCacheCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> config.withCacheTtl(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.withMetricsWindow(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withAuthenticityThreshold(1.5));
        assertThrows(IllegalArgumentException.class, () -> config.withAuthenticityThreshold(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxCorrectionPasses(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withAnalyzerTimeout(Duration.ofMillis(-5)));
        assertThrows(IllegalArgumentException.class, () -> config.withFallbackPieceLimit(0));
        assertThrows(NullPointerException.class, () -> config.withThresholds(null));
    }

    @Test
    public void withersReplaceOneField() {
        var config = EngineConfiguration.defaultConfig().withCacheTtl(Duration.ofMinutes(5)).withCacheCapacity(4);
        assertEquals(Optional.of(Duration.ofMinutes(5)), config.cacheTtl());
        assertEquals(4, config.cacheCapacity());
        assertEquals(EngineConfiguration.defaultConfig().metricsWindow(), config.metricsWindow());
    }

    @Test
    public void engineHonorsCapacityAndFallbackLimit() {
        var profiles = CulturalProfileStore.loadDefault();
        var config = EngineConfiguration.defaultConfig().withCacheCapacity(1).withFallbackPieceLimit(3);
        var engine = new GenerationEngine(config, profiles,
                                          TemplateRegistry.withDefaults(profiles, new ParameterValidator()),
                                          request -> CompletableFuture.failedFuture(new IllegalStateException()));

        engine.generateSinglePiece(ParametricParameters.builder().culture("modern").build());
        engine.generateSinglePiece(ParametricParameters.builder().culture("french").build());
        assertEquals(1, engine.getCacheSize());
        assertEquals(1, engine.cacheStats().evictions());

        var request = new UserFurnitureRequest("reception", "modern", 50, new SpaceDimensions(20, 4, 20),
                                               BudgetRange.HIGH, FormalityLevel.FORMAL, null);
        assertEquals(3, engine.generateFurniture(request).size());
    }
}
