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

/**
 * Cultural authenticity of a parameter set. All values are on the [0, 1] scale and {@code overall} is the mean of the
 * five sub-scores.
 *
 * @author hal.hildebrand
 */
public record AuthenticityScore(double proportions, double materials, double aesthetics, double culturalElements,
                                double construction, double overall) {

    public static final AuthenticityScore ZERO = of(0, 0, 0, 0, 0);

    public AuthenticityScore {
        requireUnit(proportions, "proportions");
        requireUnit(materials, "materials");
        requireUnit(aesthetics, "aesthetics");
        requireUnit(culturalElements, "culturalElements");
        requireUnit(construction, "construction");
        requireUnit(overall, "overall");
    }

    /**
     * Clamp each sub-score into [0, 1] and derive the overall score
     */
    public static AuthenticityScore of(double proportions, double materials, double aesthetics,
                                       double culturalElements, double construction) {
        var p = clamp(proportions);
        var m = clamp(materials);
        var a = clamp(aesthetics);
        var e = clamp(culturalElements);
        var c = clamp(construction);
        return new AuthenticityScore(p, m, a, e, c, (p + m + a + e + c) / 5.0);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }

    private static void requireUnit(double value, String field) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(field + " must be in [0, 1]: " + value);
        }
    }

    public boolean meets(double threshold) {
        return overall >= threshold;
    }

    public String format() {
        return String.format("overall=%.2f [proportions=%.2f, materials=%.2f, aesthetics=%.2f, elements=%.2f, "
                             + "construction=%.2f]", overall, proportions, materials, aesthetics, culturalElements,
                             construction);
    }
}
