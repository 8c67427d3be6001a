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
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.FormalityLevel;
import com.hellblazer.atelier.parameters.ParametricParameters;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Authenticity scorer")
public class AuthenticityScorerTest {

    private static CulturalProfileStore profiles;
    private static AuthenticityScorer   scorer;

    @BeforeAll
    public static void setup() {
        profiles = CulturalProfileStore.loadDefault();
        scorer = new AuthenticityScorer(profiles);
    }

    /** Japanese chair too tall, in an avoided material, with a foreign palette and no elements */
    static ParametricParameters poorJapaneseChair() {
        return ParametricParameters.builder()
                                   .type("chair")
                                   .culture("japanese")
                                   .width(0.5)
                                   .height(0.8)
                                   .depth(0.5)
                                   .primaryMaterial("metal-steel")
                                   .decorativeIntensity(0.9)
                                   .colorPalette(List.of("#000000"))
                                   .craftsmanshipLevel(CraftsmanshipLevel.REFINED)
                                   .build();
    }

    @Test
    @DisplayName("Sub-scores of a poor Japanese chair")
    void poorChair() {
        var score = scorer.score(poorJapaneseChair());
        assertEquals(0.80, score.proportions(), 1e-9);
        assertEquals(0.05, score.materials(), 1e-9);
        assertEquals(0.50, score.aesthetics(), 1e-9);
        assertEquals(0.30, score.culturalElements(), 1e-9);
        assertEquals(0.70, score.construction(), 1e-9);
        assertEquals(0.47, score.overall(), 1e-9);
        assertFalse(score.meets(0.7));
    }

    @Test
    void unknownCultureScoresZero() {
        var params = poorJapaneseChair().toBuilder().culture("atlantean").build();
        assertEquals(AuthenticityScore.ZERO, scorer.score(params));
    }

    @Nested
    @DisplayName("Proportions")
    class Proportions {

        @Test
        void heightWithinTenPercent() {
            var japanese = profiles.find("japanese").orElseThrow();
            var params = poorJapaneseChair().toBuilder().height(0.43).build();
            assertEquals(100, scorer.proportions(params, japanese));
        }

        @Test
        @DisplayName("Footprint ratio outside [0.5, 2] costs ten points")
        void footprintRatio() {
            var japanese = profiles.find("japanese").orElseThrow();
            var wide = poorJapaneseChair().toBuilder().height(0.4).width(1.0).depth(0.4).build();
            assertEquals(90, scorer.proportions(wide, japanese));
            var both = wide.toBuilder().height(1.0).build();
            assertEquals(70, scorer.proportions(both, japanese));
        }

        @Test
        @DisplayName("Tables are measured against the type adapted table height")
        void tables() {
            assertEquals(0.72 * 0.6, AuthenticityScorer.expectedHeight(
            profiles.find("japanese").orElseThrow().proportions(), "coffee-table"), 1e-9);
            var italian = profiles.find("italian").orElseThrow();
            var table = ParametricParameters.builder()
                                            .type("dining-table")
                                            .culture("italian")
                                            .width(1.8)
                                            .height(0.76)
                                            .depth(1.0)
                                            .build();
            assertEquals(100, scorer.proportions(table, italian));
        }
    }

    @Nested
    @DisplayName("Materials")
    class Materials {

        @Test
        void preferredWithoutSecondary() {
            var french = profiles.find("french").orElseThrow();
            var params = ParametricParameters.builder().type("chair").culture("french").primaryMaterial(
            "wood-walnut").build();
            assertEquals(75, scorer.materials(params, french));
        }

        @Test
        void traditionalPrimaryWithTraditionalSecondary() {
            var japanese = profiles.find("japanese").orElseThrow();
            var params = ParametricParameters.builder()
                                             .type("chair")
                                             .culture("japanese")
                                             .primaryMaterial("wood-pine")
                                             .secondaryMaterial("wood-pine")
                                             .build();
            assertEquals(60, scorer.materials(params, japanese));
        }

        @Test
        void avoidedWithUnrelatedSecondaryClampsAtZero() {
            var japanese = profiles.find("japanese").orElseThrow();
            var params = ParametricParameters.builder()
                                             .type("chair")
                                             .culture("japanese")
                                             .primaryMaterial("glass")
                                             .secondaryMaterial("metal-brass")
                                             .build();
            assertEquals(0, scorer.materials(params, japanese));
        }
    }

    @Test
    @DisplayName("Matching palette and intensity earn full aesthetics")
    void aesthetics() {
        var japanese = profiles.find("japanese").orElseThrow();
        var params = poorJapaneseChair().toBuilder()
                                        .colorPalette(List.of("#FFFFFF", "#8B4513"))
                                        .decorativeIntensity(0.3)
                                        .formality(FormalityLevel.SEMI_FORMAL)
                                        .build();
        assertEquals(100, scorer.aesthetics(params, japanese));
    }

    @Test
    void culturalElementsAreTheMatchingFraction() {
        var italian = profiles.find("italian").orElseThrow();
        var params = ParametricParameters.builder()
                                         .type("chair")
                                         .culture("italian")
                                         .culturalElements(List.of("ornate-carvings", "gold-accents", "paper-panels",
                                                                   "bamboo-accents"))
                                         .build();
        assertEquals(50, scorer.culturalElements(params, italian), 1e-9);
    }

    @Test
    void constructionBonuses() {
        var base = ParametricParameters.builder().type("chair");
        assertEquals(100, scorer.construction(
        base.culture("japanese").craftsmanshipLevel(CraftsmanshipLevel.MASTERWORK).build()));
        assertEquals(95, scorer.construction(
        base.culture("french").craftsmanshipLevel(CraftsmanshipLevel.REFINED).build()));
        assertEquals(90, scorer.construction(
        base.culture("modern").craftsmanshipLevel(CraftsmanshipLevel.SIMPLE).build()));
        assertEquals(70, scorer.construction(
        base.culture("italian").craftsmanshipLevel(CraftsmanshipLevel.MASTERWORK).build()));
    }
}
