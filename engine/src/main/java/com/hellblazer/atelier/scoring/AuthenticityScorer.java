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

import com.hellblazer.atelier.cultural.CulturalProfile;
import com.hellblazer.atelier.cultural.CulturalProfile.Proportions;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.cultural.DecorativeIntensity;
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParametricParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Scores a parameter set against a cultural profile.
 * <p>
 * Each sub-score is accumulated in points on a 0-100 scale, clamped, then reported on [0, 1]. Scoring is a pure
 * function of the parameters and the profile data.
 *
 * @author hal.hildebrand
 */
public class AuthenticityScorer {

    static final double HEIGHT_TOLERANCE     = 0.10;
    static final double MIN_FOOTPRINT_RATIO  = 0.5;
    static final double MAX_FOOTPRINT_RATIO  = 2.0;
    static final double INTENSITY_TOLERANCE  = 0.2;
    static final double EMPTY_ELEMENTS_SCORE = 30;

    private static final Logger log = LoggerFactory.getLogger(AuthenticityScorer.class);

    private final CulturalProfileStore profiles;

    public AuthenticityScorer(CulturalProfileStore profiles) {
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
    }

    /**
     * Height a culture expects for a type: seat height for seating, the type adapted table height otherwise
     */
    public static double expectedHeight(Proportions proportions, String type) {
        var adapted = CulturalProfileStore.adaptProportions(proportions, type);
        return FurnitureType.categoryOf(type) == FurnitureType.Category.SEATING ? adapted.seatHeight()
                                                                                : adapted.tableHeight();
    }

    /**
     * Score against the profile registered for the parameters' culture; unknown cultures score {@link
     * AuthenticityScore#ZERO}.
     */
    public AuthenticityScore score(ParametricParameters parameters) {
        return profiles.find(parameters.culture()).map(profile -> score(parameters, profile)).orElseGet(() -> {
            log.debug("No cultural profile for '{}', scoring zero", parameters.culture());
            return AuthenticityScore.ZERO;
        });
    }

    public AuthenticityScore score(ParametricParameters parameters, CulturalProfile profile) {
        var score = AuthenticityScore.of(proportions(parameters, profile) / 100.0,
                                         materials(parameters, profile) / 100.0,
                                         aesthetics(parameters, profile) / 100.0,
                                         culturalElements(parameters, profile) / 100.0,
                                         construction(parameters) / 100.0);
        if (log.isTraceEnabled()) {
            log.trace("{} {}: {}", parameters.culture(), parameters.type(), score.format());
        }
        return score;
    }

    double proportions(ParametricParameters parameters, CulturalProfile profile) {
        double points = 100;
        var expected = expectedHeight(profile.proportions(), parameters.type());
        if (Math.abs(parameters.height() - expected) / expected > HEIGHT_TOLERANCE) {
            points -= 20;
        }
        var ratio = parameters.width() / parameters.depth();
        if (!(ratio >= MIN_FOOTPRINT_RATIO && ratio <= MAX_FOOTPRINT_RATIO)) {
            points -= 10;
        }
        return clamp(points);
    }

    double materials(ParametricParameters parameters, CulturalProfile profile) {
        var materials = profile.materials();
        double points;
        var primary = parameters.primaryMaterial();
        if (materials.prefers(primary)) {
            points = 50;
        } else if (materials.isTraditional(primary)) {
            points = 40;
        } else if (materials.avoids(primary)) {
            points = -20;
        } else {
            points = 20;
        }
        points += parameters.secondaryMaterial().map(secondary -> {
            if (materials.prefers(secondary)) {
                return 25.0;
            }
            return materials.isTraditional(secondary) ? 20.0 : 0.0;
        }).orElse(25.0);
        return clamp(points);
    }

    double aesthetics(ParametricParameters parameters, CulturalProfile profile) {
        double points = 50;
        var palette = profile.aesthetics().colorPalette();
        if (parameters.colorPalette().stream().anyMatch(palette::contains)) {
            points += 25;
        }
        var expected = DecorativeIntensity.expected(parameters.culture(), parameters.formality());
        if (Math.abs(parameters.decorativeIntensity() - expected) < INTENSITY_TOLERANCE) {
            points += 25;
        }
        return clamp(points);
    }

    double culturalElements(ParametricParameters parameters, CulturalProfile profile) {
        var requested = parameters.culturalElements();
        if (requested.isEmpty()) {
            return EMPTY_ELEMENTS_SCORE;
        }
        var known = profile.aesthetics().decorativeElements();
        var matching = requested.stream().filter(known::contains).count();
        return clamp(100.0 * matching / requested.size());
    }

    double construction(ParametricParameters parameters) {
        double points = 70;
        var culture = parameters.culture().trim().toLowerCase(Locale.ROOT);
        var level = parameters.craftsmanshipLevel();
        if (level == CraftsmanshipLevel.MASTERWORK && culture.equals("japanese")) {
            points += 30;
        } else if (level == CraftsmanshipLevel.REFINED && culture.equals("french")) {
            points += 25;
        } else if (level == CraftsmanshipLevel.SIMPLE && culture.equals("modern")) {
            points += 20;
        }
        return clamp(points);
    }

    private static double clamp(double points) {
        return Math.max(0, Math.min(100, points));
    }
}
