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
import com.hellblazer.atelier.analysis.FurniturePiece;
import com.hellblazer.atelier.analysis.Priority;
import com.hellblazer.atelier.analysis.UserFurnitureRequest;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.ErgonomicProfile;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.parameters.StyleVariant;

import java.util.List;
import java.util.Objects;

/**
 * Minimal plan used when requirement analysis is unavailable: a row of traditional chairs for the request's culture.
 * Cultures without a profile are served from {@link CulturalProfileStore#DEFAULT_PROFILE}.
 *
 * @author hal.hildebrand
 */
public class FallbackGenerator {
    private static final int FALLBACK_ELEMENTS = 2;

    private final CulturalProfileStore profiles;
    private final int                  pieceLimit;

    public FallbackGenerator(CulturalProfileStore profiles, int pieceLimit) {
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
        if (pieceLimit <= 0) {
            throw new IllegalArgumentException("pieceLimit must be positive: " + pieceLimit);
        }
        this.pieceLimit = pieceLimit;
    }

    public ParametricParameters chairParameters(UserFurnitureRequest request) {
        var profile = profiles.getOrDefault(request.culture());
        var elements = profile.aesthetics().decorativeElements();
        return ParametricParameters.builder()
                                   .type(FurnitureType.CHAIR.tag())
                                   .culture(request.culture())
                                   .width(0.5)
                                   .height(profile.proportions().seatHeight())
                                   .depth(0.5)
                                   .style(StyleVariant.TRADITIONAL)
                                   .formality(request.formalityLevel())
                                   .primaryMaterial(profile.materials().preferred().get(0))
                                   .culturalElements(elements.subList(0, Math.min(FALLBACK_ELEMENTS, elements.size())))
                                   .ergonomicProfile(ErgonomicProfile.AVERAGE)
                                   .colorPalette(profile.aesthetics().colorPalette())
                                   .decorativeIntensity(0.5)
                                   .craftsmanshipLevel(CraftsmanshipLevel.REFINED)
                                   .build();
    }

    public FurnitureAnalysis analysis(UserFurnitureRequest request) {
        var piece = new FurniturePiece(FurnitureType.CHAIR.tag(), pieceCount(request), Priority.ESSENTIAL,
                                       chairParameters(request), "Fallback traditional seating",
                                       "Seating for the expected guests");
        return new FurnitureAnalysis(List.of(piece), request.culture() + " traditional design");
    }

    public int pieceCount(UserFurnitureRequest request) {
        return Math.min(request.guestCount(), pieceLimit);
    }

    public int pieceLimit() {
        return pieceLimit;
    }
}
