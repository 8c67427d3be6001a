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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Adaptive corrector")
public class AdaptiveCorrectorTest {

    private CulturalProfileStore profiles;
    private AuthenticityScorer   scorer;
    private AdaptiveCorrector    corrector;

    @BeforeEach
    public void setup() {
        profiles = CulturalProfileStore.loadDefault();
        scorer = new AuthenticityScorer(profiles);
        corrector = new AdaptiveCorrector(profiles);
    }

    @Test
    @DisplayName("Low material and element scores swap the material and inject elements")
    void correctsMaterialAndElements() {
        var params = AuthenticityScorerTest.poorJapaneseChair();
        var score = scorer.score(params);
        assertTrue(corrector.needsCorrection(score));

        var corrected = corrector.correct(params, score);
        assertEquals("wood-oak", corrected.primaryMaterial());
        assertEquals(List.of("sashimono-joinery", "subtle-curves", "natural-grain"), corrected.culturalElements());
        assertEquals(0.8, corrected.height(), "proportions scored above threshold and are kept");

        var rescored = scorer.score(corrected);
        assertEquals(0.75, rescored.materials(), 1e-9);
        assertEquals(1.0, rescored.culturalElements(), 1e-9);
        assertEquals(0.75, rescored.overall(), 1e-9);
    }

    @Test
    @DisplayName("Low proportions snap the height to the culture's expectation")
    void correctsHeight() {
        var params = ParametricParameters.builder()
                                         .type("bench")
                                         .culture("scandinavian")
                                         .width(1.0)
                                         .height(1.1)
                                         .depth(0.4)
                                         .build();
        var score = scorer.score(params);
        assertEquals(0.7, score.proportions(), 1e-9);

        var strict = new AdaptiveCorrector(profiles, 0.95);
        var corrected = strict.correct(params, score);
        assertEquals(0.45 * 0.95, corrected.height(), 1e-9);
    }

    @Test
    @DisplayName("At the default threshold the worst proportions score keeps the height")
    void heightKeptAtDefaultThreshold() {
        var params = ParametricParameters.builder()
                                         .type("bench")
                                         .culture("scandinavian")
                                         .width(1.0)
                                         .height(1.1)
                                         .depth(0.4)
                                         .primaryMaterial("metal-steel")
                                         .build();
        var score = AuthenticityScore.of(0.7, 0.2, 0.5, 0.3, 0.7);
        assertTrue(corrector.needsCorrection(score));
        var corrected = corrector.correct(params, score);
        assertEquals(1.1, corrected.height());
        assertNotEquals(params.primaryMaterial(), corrected.primaryMaterial());
    }

    @Test
    void passingScoresAreLeftAlone() {
        var params = AuthenticityScorerTest.poorJapaneseChair();
        var passing = AuthenticityScore.of(0.8, 0.8, 0.8, 0.8, 0.8);
        assertFalse(corrector.needsCorrection(passing));
        assertSame(params, corrector.correct(params, passing));
    }

    @Test
    void unknownCultureIsNotCorrected() {
        var params = AuthenticityScorerTest.poorJapaneseChair().toBuilder().culture("atlantean").build();
        assertSame(params, corrector.correct(params, AuthenticityScore.ZERO));
    }

    @Test
    void thresholdMustBeUnit() {
        assertThrows(IllegalArgumentException.class, () -> new AdaptiveCorrector(profiles, 1.5));
        assertEquals(AdaptiveCorrector.DEFAULT_THRESHOLD, corrector.threshold());
    }
}
