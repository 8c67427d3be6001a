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

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.cultural.DecorativeIntensity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Interactive, single field edits of a parameter set. Every edit returns a new parameter set whose edited field is
 * already constrained, so the result can be fed straight back to the engine.
 *
 * @author hal.hildebrand
 */
public class ParameterAdjuster {
    /** Footprint cap applied when space is limited */
    public static final double MAX_LIMITED_FOOTPRINT = 0.8;
    /** Intensity cap applied on a low budget */
    public static final double MAX_LOW_BUDGET_INTENSITY = 0.5;

    private static final Logger log = LoggerFactory.getLogger(ParameterAdjuster.class);

    private final CulturalProfileStore profiles;

    public ParameterAdjuster(CulturalProfileStore profiles) {
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
    }

    public ParametricParameters withHeight(ParametricParameters parameters, double height) {
        var range = ParameterValidator.boundsFor(parameters.type()).height();
        return parameters.toBuilder().height(range.clamp(height)).build();
    }

    public ParametricParameters withWidth(ParametricParameters parameters, double width) {
        var range = ParameterValidator.boundsFor(parameters.type()).width();
        return parameters.toBuilder().width(range.clamp(width)).build();
    }

    public ParametricParameters withDepth(ParametricParameters parameters, double depth) {
        var range = ParameterValidator.boundsFor(parameters.type()).depth();
        return parameters.toBuilder().depth(range.clamp(depth)).build();
    }

    /**
     * Change formality; decorative intensity follows the new formality for the piece's culture.
     */
    public ParametricParameters withFormality(ParametricParameters parameters, FormalityLevel formality) {
        Objects.requireNonNull(formality, "formality cannot be null");
        return parameters.toBuilder()
                         .formality(formality)
                         .decorativeIntensity(DecorativeIntensity.forFormality(formality, parameters.culture()))
                         .build();
    }

    /**
     * Change the primary material. Materials the culture avoids are accepted but logged.
     */
    public ParametricParameters withPrimaryMaterial(ParametricParameters parameters, String material) {
        Objects.requireNonNull(material, "material cannot be null");
        if (!profiles.isMaterialAppropriate(material, parameters.culture())) {
            log.warn("Material {} may not be culturally appropriate for {}", material, parameters.culture());
        }
        return parameters.toBuilder().primaryMaterial(material).build();
    }

    public ParametricParameters withDecorativeIntensity(ParametricParameters parameters, double intensity) {
        var clamped = Double.isNaN(intensity) ? ParameterValidator.DEFAULT_INTENSITY
                                              : ParameterValidator.INTENSITY_RANGE.clamp(intensity);
        return parameters.toBuilder().decorativeIntensity(clamped).build();
    }

    public ParametricParameters withCraftsmanship(ParametricParameters parameters, CraftsmanshipLevel level) {
        Objects.requireNonNull(level, "level cannot be null");
        return parameters.toBuilder().craftsmanshipLevel(level).build();
    }

    /**
     * Rule based optimization: limited space caps width and depth, a low budget forces simple craftsmanship and caps
     * the decorative intensity.
     */
    public ParametricParameters optimize(ParametricParameters parameters, OptimizationConstraints constraints) {
        var builder = parameters.toBuilder();
        if (constraints.spaceLimited()) {
            builder.width(Math.min(parameters.width(), MAX_LIMITED_FOOTPRINT))
                   .depth(Math.min(parameters.depth(), MAX_LIMITED_FOOTPRINT));
        }
        if (constraints.budget() == BudgetRange.LOW) {
            builder.craftsmanshipLevel(CraftsmanshipLevel.SIMPLE)
                   .decorativeIntensity(Math.min(parameters.decorativeIntensity(), MAX_LOW_BUDGET_INTENSITY));
        }
        return builder.build();
    }
}
