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
package com.hellblazer.atelier.cultural;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of what a culture expects from a piece of furniture: proportions, material preferences,
 * aesthetics and ergonomics. Profiles are created once when the {@link CulturalProfileStore} is built and are shared
 * by every generation.
 *
 * @author hal.hildebrand
 */
public record CulturalProfile(String name, Proportions proportions, Materials materials, Aesthetics aesthetics,
                              Ergonomics ergonomics) {

    public CulturalProfile {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(proportions, "proportions cannot be null");
        Objects.requireNonNull(materials, "materials cannot be null");
        Objects.requireNonNull(aesthetics, "aesthetics cannot be null");
        Objects.requireNonNull(ergonomics, "ergonomics cannot be null");
    }

    /**
     * How a culture arranges seated guests.
     */
    public enum GroupOrientation {
        CIRCULAR, LINEAR, CLUSTERED, CONVERSATIONAL
    }

    /**
     * Expected dimensions, in meters (angles in degrees).
     */
    public record Proportions(double seatHeight, double tableHeight, double armrestHeight, double backrestAngle,
                              double legThickness, double surfaceThickness) {

        public Proportions {
            requirePositive(seatHeight, "seatHeight");
            requirePositive(tableHeight, "tableHeight");
            requirePositive(armrestHeight, "armrestHeight");
            requirePositive(backrestAngle, "backrestAngle");
            requirePositive(legThickness, "legThickness");
            requirePositive(surfaceThickness, "surfaceThickness");
        }

        public Proportions withSeatHeight(double seatHeight) {
            return new Proportions(seatHeight, tableHeight, armrestHeight, backrestAngle, legThickness,
                                   surfaceThickness);
        }

        public Proportions withTableHeight(double tableHeight) {
            return new Proportions(seatHeight, tableHeight, armrestHeight, backrestAngle, legThickness,
                                   surfaceThickness);
        }

        private static void requirePositive(double value, String field) {
            if (!(value > 0.0)) {
                throw new IllegalArgumentException(field + " must be positive: " + value);
            }
        }
    }

    public record Materials(List<String> preferred, List<String> traditional, List<String> avoided,
                            Map<Season, List<String>> seasonal) {

        public Materials {
            preferred = List.copyOf(preferred);
            traditional = List.copyOf(traditional);
            avoided = List.copyOf(avoided);
            seasonal = Map.copyOf(seasonal);
        }

        public boolean prefers(String material) {
            return preferred.contains(material);
        }

        public boolean isTraditional(String material) {
            return traditional.contains(material);
        }

        public boolean avoids(String material) {
            return avoided.contains(material);
        }
    }

    public record Aesthetics(List<String> colorPalette, List<String> decorativeElements, List<String> surfaceFinishes,
                             List<String> joiningMethods, Map<String, String> symbolism) {

        public Aesthetics {
            colorPalette = List.copyOf(colorPalette);
            decorativeElements = List.copyOf(decorativeElements);
            surfaceFinishes = List.copyOf(surfaceFinishes);
            joiningMethods = List.copyOf(joiningMethods);
            symbolism = Map.copyOf(symbolism);
        }
    }

    public record Ergonomics(boolean floorSeating, boolean formalPosture, GroupOrientation groupOrientation,
                             double personalSpace) {

        public Ergonomics {
            Objects.requireNonNull(groupOrientation, "groupOrientation cannot be null");
        }
    }
}
