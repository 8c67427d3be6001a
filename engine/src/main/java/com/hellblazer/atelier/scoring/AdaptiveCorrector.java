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
package com.hellblazer.atelier.scoring;

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.ParametricParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Nudges low scoring parameters toward what their culture prefers: the preferred material, the expected height and the
 * culture's own decorative elements. Each weak sub-score is corrected independently.
 *
 * @author hal.hildebrand
 */
public class AdaptiveCorrector {
    public static final double DEFAULT_THRESHOLD = 0.7;
    static final int           INJECTED_ELEMENTS = 3;

    private static final Logger log = LoggerFactory.getLogger(AdaptiveCorrector.class);

    private final CulturalProfileStore profiles;
    private final double               threshold;

    public AdaptiveCorrector(CulturalProfileStore profiles) {
        this(profiles, DEFAULT_THRESHOLD);
    }

    public AdaptiveCorrector(CulturalProfileStore profiles, double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1]: " + threshold);
        }
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    public boolean needsCorrection(AuthenticityScore score) {
        return !score.meets(threshold);
    }

    /**
     * @return corrected parameters, or the same instance when the score already meets the threshold or the culture
     * is unknown
     */
    public ParametricParameters correct(ParametricParameters parameters, AuthenticityScore score) {
        if (!needsCorrection(score)) {
            return parameters;
        }
        var found = profiles.find(parameters.culture());
        if (found.isEmpty()) {
            return parameters;
        }
        var profile = found.get();
        var builder = parameters.toBuilder();
        if (score.materials() < threshold && !profile.materials().preferred().isEmpty()) {
            var preferred = profile.materials().preferred().get(0);
            log.debug("Correcting {} material {} -> {}", parameters.culture(), parameters.primaryMaterial(),
                      preferred);
            builder.primaryMaterial(preferred);
        }
        if (score.proportions() < threshold) {
            var height = AuthenticityScorer.expectedHeight(profile.proportions(), parameters.type());
            log.debug("Correcting {} {} height {} -> {}", parameters.culture(), parameters.type(),
                      parameters.height(), height);
            builder.height(height);
        }
        if (score.culturalElements() < threshold) {
            var elements = profile.aesthetics().decorativeElements();
            builder.culturalElements(elements.subList(0, Math.min(INJECTED_ELEMENTS, elements.size())));
        }
        return builder.build();
    }
}
