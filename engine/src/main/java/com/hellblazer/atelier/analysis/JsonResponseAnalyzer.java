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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Analyzer backed by a text completion service that answers in JSON. The response is parsed and sanitized by an
 * {@link AnalysisResponseParser}; transport and parse failures complete the future exceptionally.
 *
 * @author hal.hildebrand
 */
public class JsonResponseAnalyzer implements RequirementAnalyzer {
    static final String SYSTEM_PROMPT = "You are an expert furniture designer and cultural anthropologist. "
    + "Answer with a single JSON object containing furniture_pieces and overall_theme.";

    private static final Logger log = LoggerFactory.getLogger(JsonResponseAnalyzer.class);

    private final CompletionSource       source;
    private final AnalysisResponseParser parser;
    private final CulturalProfileStore   profiles;

    public JsonResponseAnalyzer(CompletionSource source, AnalysisResponseParser parser,
                                CulturalProfileStore profiles) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
    }

    @Override
    public CompletableFuture<FurnitureAnalysis> analyze(UserFurnitureRequest request) {
        var prompt = prompt(request);
        log.debug("Requesting analysis for {} {} ({} guests)", request.culture(), request.eventType(),
                  request.guestCount());
        return source.complete(SYSTEM_PROMPT, prompt).thenApply(json -> {
            try {
                return parser.parse(json, request);
            } catch (AnalysisException e) {
                throw new CompletionException(e);
            }
        });
    }

    String prompt(UserFurnitureRequest request) {
        var builder = new StringBuilder();
        builder.append("FURNITURE DESIGN ANALYSIS REQUEST\n\n");
        builder.append("Event Type: ").append(request.eventType()).append('\n');
        builder.append("Culture: ").append(request.culture()).append('\n');
        builder.append("Guest Count: ").append(request.guestCount()).append('\n');
        var space = request.spaceDimensions();
        builder.append(String.format("Space Dimensions: %.2fm x %.2fm x %.2fm%n", space.width(), space.depth(),
                                     space.height()));
        builder.append("Budget Range: ").append(request.budgetRange().tag()).append('\n');
        builder.append("Formality Level: ").append(request.formalityLevel().tag()).append('\n');
        builder.append("Special Requirements: ").append(request.specialRequirements()).append('\n');
        profiles.find(request.culture()).ifPresentOrElse(profile -> {
            builder.append("\nCultural Context (").append(request.culture()).append("):\n");
            builder.append("- Preferred Materials: ")
                   .append(String.join(", ", profile.materials().preferred()))
                   .append('\n');
            builder.append("- Aesthetic Elements: ")
                   .append(String.join(", ", profile.aesthetics().decorativeElements()))
                   .append('\n');
        }, () -> builder.append("\nCultural context not available.\n"));
        builder.append("\nRespond with furniture_pieces: [{type, quantity, priority, parameters, ")
               .append("cultural_reasoning, functional_reasoning}] and overall_theme.\n");
        return builder.toString();
    }
}
