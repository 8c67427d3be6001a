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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Real-time parameter adjustment")
public class ParameterAdjusterTest {

    private final ParameterAdjuster    adjuster = new ParameterAdjuster(CulturalProfileStore.loadDefault());
    private final ParametricParameters chair    = ParametricParameters.builder()
                                                                      .type("chair")
                                                                      .culture("italian")
                                                                      .width(0.9)
                                                                      .depth(0.9)
                                                                      .decorativeIntensity(0.9)
                                                                      .craftsmanshipLevel(
                                                                      CraftsmanshipLevel.MASTERWORK)
                                                                      .build();

    @Nested
    class Edits {

        @Test
        void dimensionsClampToTypeBand() {
            assertEquals(1.2, adjuster.withHeight(chair, 4.0).height());
            assertEquals(0.3, adjuster.withWidth(chair, 0.01).width());
            assertEquals(0.75, adjuster.withDepth(chair, 0.75).depth());
        }

        @Test
        @DisplayName("Formality drives decorative intensity")
        void formality() {
            var formal = adjuster.withFormality(chair, FormalityLevel.FORMAL);
            assertEquals(FormalityLevel.FORMAL, formal.formality());
            assertEquals(0.7 * 1.2, formal.decorativeIntensity(), 1e-9);
            var casual = adjuster.withFormality(chair, FormalityLevel.CASUAL);
            assertEquals(0.3 * 1.2, casual.decorativeIntensity(), 1e-9);
        }

        @Test
        @DisplayName("Avoided materials are accepted")
        void avoidedMaterial() {
            var pine = adjuster.withPrimaryMaterial(chair, "wood-pine");
            assertEquals("wood-pine", pine.primaryMaterial());
        }

        @Test
        void intensityAndCraftsmanship() {
            assertEquals(1.0, adjuster.withDecorativeIntensity(chair, 7).decorativeIntensity());
            assertEquals(0.5, adjuster.withDecorativeIntensity(chair, Double.NaN).decorativeIntensity());
            assertEquals(CraftsmanshipLevel.SIMPLE,
                         adjuster.withCraftsmanship(chair, CraftsmanshipLevel.SIMPLE).craftsmanshipLevel());
        }
    }

    @Nested
    @DisplayName("Constraint optimization")
    class Optimization {

        @Test
        void noConstraintsChangeNothing() {
            assertEquals(chair, adjuster.optimize(chair, OptimizationConstraints.none()));
        }

        @Test
        void limitedSpaceCapsFootprint() {
            var constraints = OptimizationConstraints.forSpace(4, 4, BudgetRange.HIGH);
            assertTrue(constraints.spaceLimited());
            var optimized = adjuster.optimize(chair, constraints);
            assertEquals(0.8, optimized.width());
            assertEquals(0.8, optimized.depth());
            assertEquals(CraftsmanshipLevel.MASTERWORK, optimized.craftsmanshipLevel());
        }

        @Test
        void lowBudgetSimplifies() {
            var constraints = OptimizationConstraints.forSpace(10, 10, BudgetRange.LOW);
            assertFalse(constraints.spaceLimited());
            var optimized = adjuster.optimize(chair, constraints);
            assertEquals(0.9, optimized.width());
            assertEquals(CraftsmanshipLevel.SIMPLE, optimized.craftsmanshipLevel());
            assertEquals(0.5, optimized.decorativeIntensity());
        }
    }
}
