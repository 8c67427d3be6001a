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

import com.hellblazer.atelier.cultural.Season;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The unit of work for the generation engine: everything a template needs to build one piece. Structural value type,
 * also the source of the cache key (see {@link CanonicalKey}).
 * <p>
 * Out of range dimensions are accepted here; the {@link ParameterValidator} decides validity and clamps.
 *
 * @param type                furniture type tag, e.g. "chair" or "coffee-table"
 * @param culture             culture tag, e.g. "japanese"
 * @param width               meters
 * @param height              meters
 * @param depth               meters
 * @param decorativeIntensity 0 (plain) to 1 (ornate)
 * @author hal.hildebrand
 */
public record ParametricParameters(String type, String culture, double width, double height, double depth,
                                   StyleVariant style, FormalityLevel formality, String primaryMaterial,
                                   Optional<String> secondaryMaterial, List<String> culturalElements,
                                   Optional<Season> seasonalAdaptation, Optional<Integer> capacity,
                                   ErgonomicProfile ergonomicProfile, List<String> colorPalette,
                                   double decorativeIntensity, CraftsmanshipLevel craftsmanshipLevel) {

    public ParametricParameters {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(culture, "culture cannot be null");
        Objects.requireNonNull(style, "style cannot be null");
        Objects.requireNonNull(formality, "formality cannot be null");
        Objects.requireNonNull(primaryMaterial, "primaryMaterial cannot be null");
        Objects.requireNonNull(secondaryMaterial, "secondaryMaterial cannot be null");
        Objects.requireNonNull(seasonalAdaptation, "seasonalAdaptation cannot be null");
        Objects.requireNonNull(capacity, "capacity cannot be null");
        Objects.requireNonNull(ergonomicProfile, "ergonomicProfile cannot be null");
        Objects.requireNonNull(craftsmanshipLevel, "craftsmanshipLevel cannot be null");
        type = FurnitureType.fromTag(type).map(FurnitureType::tag).orElse(type);
        culturalElements = List.copyOf(culturalElements);
        colorPalette = List.copyOf(colorPalette);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().type(type)
                            .culture(culture)
                            .width(width)
                            .height(height)
                            .depth(depth)
                            .style(style)
                            .formality(formality)
                            .primaryMaterial(primaryMaterial)
                            .secondaryMaterial(secondaryMaterial.orElse(null))
                            .culturalElements(culturalElements)
                            .seasonalAdaptation(seasonalAdaptation.orElse(null))
                            .capacity(capacity.orElse(null))
                            .ergonomicProfile(ergonomicProfile)
                            .colorPalette(colorPalette)
                            .decorativeIntensity(decorativeIntensity)
                            .craftsmanshipLevel(craftsmanshipLevel);
    }

    public FurnitureType.Category category() {
        return FurnitureType.categoryOf(type);
    }

    /**
     * Builder defaults describe a traditional, semi-formal, refined oak piece of average ergonomics and medium
     * decorative intensity.
     */
    public static final class Builder {
        private String             type;
        private String             culture;
        private double             width               = 0.5;
        private double             height              = 0.45;
        private double             depth               = 0.5;
        private StyleVariant       style               = StyleVariant.TRADITIONAL;
        private FormalityLevel     formality           = FormalityLevel.SEMI_FORMAL;
        private String             primaryMaterial     = "wood-oak";
        private String             secondaryMaterial;
        private List<String>       culturalElements    = List.of();
        private Season             seasonalAdaptation;
        private Integer            capacity;
        private ErgonomicProfile   ergonomicProfile    = ErgonomicProfile.AVERAGE;
        private List<String>       colorPalette        = List.of();
        private double             decorativeIntensity = 0.5;
        private CraftsmanshipLevel craftsmanshipLevel  = CraftsmanshipLevel.REFINED;

        private Builder() {
        }

        public ParametricParameters build() {
            return new ParametricParameters(type, culture, width, height, depth, style, formality, primaryMaterial,
                                            Optional.ofNullable(secondaryMaterial), culturalElements,
                                            Optional.ofNullable(seasonalAdaptation), Optional.ofNullable(capacity),
                                            ergonomicProfile, colorPalette, decorativeIntensity,
                                            craftsmanshipLevel);
        }

        public Builder capacity(Integer capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder colorPalette(List<String> colorPalette) {
            this.colorPalette = colorPalette;
            return this;
        }

        public Builder craftsmanshipLevel(CraftsmanshipLevel craftsmanshipLevel) {
            this.craftsmanshipLevel = craftsmanshipLevel;
            return this;
        }

        public Builder culturalElements(List<String> culturalElements) {
            this.culturalElements = culturalElements;
            return this;
        }

        public Builder culture(String culture) {
            this.culture = culture;
            return this;
        }

        public Builder decorativeIntensity(double decorativeIntensity) {
            this.decorativeIntensity = decorativeIntensity;
            return this;
        }

        public Builder depth(double depth) {
            this.depth = depth;
            return this;
        }

        public Builder ergonomicProfile(ErgonomicProfile ergonomicProfile) {
            this.ergonomicProfile = ergonomicProfile;
            return this;
        }

        public Builder formality(FormalityLevel formality) {
            this.formality = formality;
            return this;
        }

        public Builder height(double height) {
            this.height = height;
            return this;
        }

        public Builder primaryMaterial(String primaryMaterial) {
            this.primaryMaterial = primaryMaterial;
            return this;
        }

        public Builder seasonalAdaptation(Season seasonalAdaptation) {
            this.seasonalAdaptation = seasonalAdaptation;
            return this;
        }

        public Builder secondaryMaterial(String secondaryMaterial) {
            this.secondaryMaterial = secondaryMaterial;
            return this;
        }

        public Builder style(StyleVariant style) {
            this.style = style;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder width(double width) {
            this.width = width;
            return this;
        }
    }
}
