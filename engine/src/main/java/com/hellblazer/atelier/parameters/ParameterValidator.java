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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dimensional and intensity bounds for parameter sets. Bounds depend only on the furniture type, never on the culture,
 * and are inclusive at both ends.
 * <p>
 * {@link #adjustInvalidParameters(ParametricParameters)} is total: whatever it returns passes
 * {@link #validate(ParametricParameters)}.
 *
 * @author hal.hildebrand
 */
public class ParameterValidator {

    public static final DimensionBounds SEATING_BOUNDS      = new DimensionBounds(new Range(0.3, 1.0),
                                                                                  new Range(0.3, 1.2),
                                                                                  new Range(0.3, 1.0));
    public static final DimensionBounds COFFEE_TABLE_BOUNDS = new DimensionBounds(new Range(0.6, 3.0),
                                                                                  new Range(0.35, 0.50),
                                                                                  new Range(0.5, 2.0));
    public static final DimensionBounds TABLE_BOUNDS        = new DimensionBounds(new Range(0.5, 3.0),
                                                                                  new Range(0.3, 1.0),
                                                                                  new Range(0.5, 2.0));
    public static final DimensionBounds GENERIC_BOUNDS      = new DimensionBounds(new Range(0.3, 3.0),
                                                                                  new Range(0.3, 2.0),
                                                                                  new Range(0.3, 2.0));
    public static final Range           INTENSITY_RANGE     = new Range(0.0, 1.0);
    public static final double          DEFAULT_INTENSITY   = 0.5;

    private static final Logger log = LoggerFactory.getLogger(ParameterValidator.class);

    public static DimensionBounds boundsFor(String type) {
        if (FurnitureType.fromTag(type).filter(t -> t == FurnitureType.COFFEE_TABLE).isPresent()) {
            return COFFEE_TABLE_BOUNDS;
        }
        return switch (FurnitureType.categoryOf(type)) {
            case SEATING -> SEATING_BOUNDS;
            case TABLE -> TABLE_BOUNDS;
            default -> GENERIC_BOUNDS;
        };
    }

    public boolean validate(ParametricParameters parameters) {
        var bounds = boundsFor(parameters.type());
        return bounds.width().contains(parameters.width()) && bounds.height().contains(parameters.height())
        && bounds.depth().contains(parameters.depth()) && INTENSITY_RANGE.contains(
        parameters.decorativeIntensity());
    }

    /**
     * Clamp every dimension into its band and the decorative intensity into [0, 1]. NaN dimensions become the lower
     * bound, a NaN intensity becomes {@value #DEFAULT_INTENSITY}. Valid parameters are returned unchanged.
     */
    public ParametricParameters adjustInvalidParameters(ParametricParameters parameters) {
        if (validate(parameters)) {
            return parameters;
        }
        var bounds = boundsFor(parameters.type());
        var intensity = Double.isNaN(parameters.decorativeIntensity()) ? DEFAULT_INTENSITY
                                                                        : INTENSITY_RANGE.clamp(
                                                                        parameters.decorativeIntensity());
        var adjusted = parameters.toBuilder()
                                 .width(bounds.width().clamp(parameters.width()))
                                 .height(bounds.height().clamp(parameters.height()))
                                 .depth(bounds.depth().clamp(parameters.depth()))
                                 .decorativeIntensity(intensity)
                                 .build();
        log.debug("Adjusted {} {}: {}x{}x{} -> {}x{}x{}", parameters.culture(), parameters.type(),
                  parameters.width(), parameters.height(), parameters.depth(), adjusted.width(), adjusted.height(),
                  adjusted.depth());
        return adjusted;
    }

    /**
     * Inclusive interval
     */
    public record Range(double min, double max) {
        public Range {
            if (min > max) {
                throw new IllegalArgumentException("min > max: " + min + " > " + max);
            }
        }

        public boolean contains(double value) {
            return value >= min && value <= max;
        }

        /**
         * Clamp into the interval; NaN maps to the lower bound
         */
        public double clamp(double value) {
            if (Double.isNaN(value)) {
                return min;
            }
            return Math.min(Math.max(value, min), max);
        }
    }

    public record DimensionBounds(Range width, Range height, Range depth) {
    }
}
