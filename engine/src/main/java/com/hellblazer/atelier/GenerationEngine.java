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

import com.hellblazer.atelier.analysis.FurnitureAnalysis;
import com.hellblazer.atelier.analysis.RequirementAnalyzer;
import com.hellblazer.atelier.analysis.RuleBasedRequirementAnalyzer;
import com.hellblazer.atelier.analysis.UserFurnitureRequest;
import com.hellblazer.atelier.cache.GenerationCache;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.material.MaterialSystem;
import com.hellblazer.atelier.metrics.PerformanceMetricsCollector;
import com.hellblazer.atelier.metrics.PerformanceSample;
import com.hellblazer.atelier.parameters.CanonicalKey;
import com.hellblazer.atelier.parameters.OptimizationConstraints;
import com.hellblazer.atelier.parameters.ParameterAdjuster;
import com.hellblazer.atelier.parameters.ParameterValidator;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.scoring.AdaptiveCorrector;
import com.hellblazer.atelier.scoring.AuthenticityScorer;
import com.hellblazer.atelier.template.ParametricTemplate;
import com.hellblazer.atelier.template.TemplateRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Orchestrates generation of culturally authentic furniture.
 * <p>
 * A single piece flows through parameter validation, authenticity scoring, bounded adaptive correction, template
 * geometry, material application and metadata. Results are cached under the canonical key of the requested parameters
 * and concurrent requests for the same key share one computation. Batches are planned by a
 * {@link RequirementAnalyzer}; when analysis fails or times out the {@link FallbackGenerator} plan is used instead.
 * <p>
 * Thread-safe.
 *
 * @author hal.hildebrand
 */
public class GenerationEngine {
    private static final Logger log = LoggerFactory.getLogger(GenerationEngine.class);

    private final EngineConfiguration                       configuration;
    private final CulturalProfileStore                      profiles;
    private final TemplateRegistry                          templates;
    private final RequirementAnalyzer                       analyzer;
    private final ParameterValidator                        validator;
    private final ParameterAdjuster                         adjuster;
    private final AuthenticityScorer                        scorer;
    private final AdaptiveCorrector                         corrector;
    private final MaterialSystem                            materials;
    private final FallbackGenerator                         fallback;
    private final GenerationCache<String, GenerationResult> cache;
    private final PerformanceMetricsCollector               metrics;

    public GenerationEngine() {
        this(EngineConfiguration.defaultConfig(), CulturalProfileStore.loadDefault());
    }

    public GenerationEngine(EngineConfiguration configuration, CulturalProfileStore profiles) {
        this(configuration, profiles, TemplateRegistry.withDefaults(profiles, new ParameterValidator()),
             new RuleBasedRequirementAnalyzer(profiles));
    }

    public GenerationEngine(EngineConfiguration configuration, CulturalProfileStore profiles,
                            TemplateRegistry templates, RequirementAnalyzer analyzer) {
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
        this.templates = Objects.requireNonNull(templates, "templates cannot be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer cannot be null");
        this.validator = new ParameterValidator();
        this.adjuster = new ParameterAdjuster(profiles);
        this.scorer = new AuthenticityScorer(profiles);
        this.corrector = new AdaptiveCorrector(profiles, configuration.authenticityThreshold());
        this.materials = new MaterialSystem(profiles);
        this.fallback = new FallbackGenerator(profiles, configuration.fallbackPieceLimit());
        this.cache = new GenerationCache<>(configuration.cacheCapacity(), configuration.cacheTtl(),
                                           Clock.systemUTC());
        this.metrics = new PerformanceMetricsCollector(configuration.metricsWindow(), configuration.thresholds());
    }

    /**
     * Generate one piece.
     *
     * @throws UnknownTemplateTypeException if no template is registered for the parameters' type
     */
    public GenerationResult generateSinglePiece(ParametricParameters parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        var template = templates.resolve(parameters.type());
        return cache.getOrCompute(CanonicalKey.of(parameters), () -> generate(template, parameters));
    }

    /**
     * Generate every piece of the analyzed plan, each repeated by its quantity, in plan order. A failure generating
     * any piece aborts the batch.
     */
    public List<GenerationResult> generateFurniture(UserFurnitureRequest request) {
        return generateAll(plan(request));
    }

    public EventSetup generateEventSetup(UserFurnitureRequest request) {
        var analysis = plan(request);
        var pieces = generateAll(analysis);
        var summary = EventSummary.of(pieces, analysis.overallTheme());
        log.info("Event setup for {} {}: {} pieces, {} components, estimated cost {}", request.culture(),
                 request.eventType(), summary.totalPieces(), summary.totalComponents(), summary.totalCost());
        return new EventSetup(pieces, summary);
    }

    /**
     * Apply space and budget constraints to edited parameters, then clamp them back into the valid envelope.
     */
    public ParametricParameters optimizeParameters(ParametricParameters parameters,
                                                   OptimizationConstraints constraints) {
        return validator.adjustInvalidParameters(adjuster.optimize(parameters, constraints));
    }

    public int getCacheSize() {
        return cache.size();
    }

    public int getMaterialCacheSize() {
        return materials.cachedMaterialCount();
    }

    public void clearCache() {
        cache.clear();
        materials.clearCache();
        log.debug("Generation cache cleared");
    }

    public Map<String, PerformanceMetricsCollector.Summary> getPerformanceReport() {
        return metrics.report();
    }

    public List<String> getSupportedFurnitureTypes() {
        return templates.supportedTypes();
    }

    public Set<String> getSupportedCultures() {
        return profiles.cultures();
    }

    /**
     * Drop cached results and collected metrics.
     */
    public void reset() {
        clearCache();
        metrics.clear();
    }

    public ParameterAdjuster adjuster() {
        return adjuster;
    }

    public GenerationCache.CacheStats cacheStats() {
        return cache.getStats();
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public PerformanceMetricsCollector metrics() {
        return metrics;
    }

    private GenerationResult generate(ParametricTemplate template, ParametricParameters requested) {
        var start = System.nanoTime();
        var parameters = requested;
        if (!template.validateParameters(parameters)) {
            log.warn("Invalid parameters for {} {}, adjusting", parameters.culture(), parameters.type());
            parameters = validator.adjustInvalidParameters(parameters);
        }

        var score = scorer.score(parameters);
        var passes = 0;
        while (passes < configuration.maxCorrectionPasses() && corrector.needsCorrection(score)) {
            var corrected = corrector.correct(parameters, score);
            if (corrected.equals(parameters)) {
                break;
            }
            parameters = validator.adjustInvalidParameters(corrected);
            score = scorer.score(parameters);
            passes++;
            log.debug("Correction pass {} for {} {}: overall {}", passes, parameters.culture(), parameters.type(),
                      score.overall());
        }
        if (!score.meets(configuration.authenticityThreshold())) {
            log.warn("Cultural authenticity of {} {} remains below threshold after {} passes: {}",
                     parameters.culture(), parameters.type(), passes, score.format());
        }

        var palette = materials.generateMaterials(parameters);
        var geometry = MaterialSystem.applyMaterials(template.generateGeometry(parameters), palette);
        var metadata = template.generateMetadata(parameters);
        var elapsed = (System.nanoTime() - start) / 1_000_000.0;
        var sample = PerformanceSample.of(elapsed, geometry.polygonCount(), geometry.memoryBytes());
        metrics.record(parameters.type(), parameters.culture(), sample);

        log.debug("Generated {} {} in {} ms, {} polygons, authenticity {}", parameters.culture(),
                  parameters.type(), String.format("%.2f", elapsed), sample.polygonCount(), score.format());
        return new GenerationResult(geometry, palette, metadata, score, sample, passes);
    }

    private List<GenerationResult> generateAll(FurnitureAnalysis analysis) {
        var results = new ArrayList<GenerationResult>(analysis.totalQuantity());
        for (var piece : analysis.pieces()) {
            log.debug("Generating {} x{}", piece.type(), piece.quantity());
            for (var i = 0; i < piece.quantity(); i++) {
                results.add(generateSinglePiece(piece.parameters()));
            }
        }
        return results;
    }

    private FurnitureAnalysis plan(UserFurnitureRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        var timeout = configuration.analyzerTimeout();
        CompletableFuture<FurnitureAnalysis> future = null;
        try {
            future = analyzer.analyze(request);
            var analysis = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (analysis != null) {
                return analysis;
            }
            log.warn("Requirement analysis returned nothing for {} {}, using fallback", request.culture(),
                     request.eventType());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted awaiting requirement analysis, using fallback");
        } catch (ExecutionException e) {
            log.warn("Requirement analysis failed, using fallback", e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Requirement analysis timed out after {}, using fallback", timeout);
        } catch (RuntimeException e) {
            log.warn("Requirement analyzer threw, using fallback", e);
        }
        return fallback.analysis(request);
    }
}
