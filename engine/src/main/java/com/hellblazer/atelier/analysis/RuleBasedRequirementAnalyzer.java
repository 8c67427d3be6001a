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

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.ErgonomicProfile;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.parameters.StyleVariant;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Local analyzer: seating for every guest (up to {@value #MAX_CHAIRS} chairs) and, for dinners, one dining table per
 * {@value #GUESTS_PER_TABLE} guests. Never fails.
 *
 * @author hal.hildebrand
 */
public class RuleBasedRequirementAnalyzer implements RequirementAnalyzer {
    static final int    MAX_CHAIRS       = 12;
    static final int    GUESTS_PER_TABLE = 6;
    static final int    MAX_TABLES       = 20;
    static final double TABLE_WIDTH      = 1.8;
    static final double TABLE_DEPTH      = 0.9;

    private final CulturalProfileStore profiles;

    public RuleBasedRequirementAnalyzer(CulturalProfileStore profiles) {
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
    }

    @Override
    public CompletableFuture<FurnitureAnalysis> analyze(UserFurnitureRequest request) {
        return CompletableFuture.completedFuture(analyzeNow(request));
    }

    public FurnitureAnalysis analyzeNow(UserFurnitureRequest request) {
        var profile = profiles.getOrDefault(request.culture());
        var elements = profile.aesthetics().decorativeElements();
        var chair = ParametricParameters.builder()
                                        .type(FurnitureType.CHAIR.tag())
                                        .culture(request.culture())
                                        .width(0.5)
                                        .height(profile.proportions().seatHeight())
                                        .depth(0.5)
                                        .style(StyleVariant.TRADITIONAL)
                                        .formality(request.formalityLevel())
                                        .primaryMaterial(profile.materials().preferred().get(0))
                                        .culturalElements(elements.subList(0, Math.min(3, elements.size())))
                                        .ergonomicProfile(ErgonomicProfile.AVERAGE)
                                        .colorPalette(profile.aesthetics().colorPalette())
                                        .decorativeIntensity(0.5)
                                        .craftsmanshipLevel(CraftsmanshipLevel.REFINED)
                                        .build();
        var pieces = new ArrayList<FurniturePiece>();
        pieces.add(new FurniturePiece(FurnitureType.CHAIR.tag(), Math.min(request.guestCount(), MAX_CHAIRS),
                                      Priority.ESSENTIAL, chair, "Basic cultural guidelines applied",
                                      "Standard seating requirements met"));
        if (request.eventType().toLowerCase(Locale.ROOT).contains("dinner")) {
            var tables = Math.min(MAX_TABLES, (request.guestCount() + GUESTS_PER_TABLE - 1) / GUESTS_PER_TABLE);
            var table = chair.toBuilder()
                             .type(FurnitureType.DINING_TABLE.tag())
                             .width(TABLE_WIDTH)
                             .depth(TABLE_DEPTH)
                             .height(profile.proportions().tableHeight())
                             .capacity(GUESTS_PER_TABLE)
                             .build();
            pieces.add(new FurniturePiece(FurnitureType.DINING_TABLE.tag(), tables, Priority.ESSENTIAL, table,
                                          "Traditional dining height for the culture",
                                          "One table per " + GUESTS_PER_TABLE + " guests"));
        }
        return new FurnitureAnalysis(pieces, request.culture() + " traditional design");
    }
}
