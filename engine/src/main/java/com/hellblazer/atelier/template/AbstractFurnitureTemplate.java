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
package com.hellblazer.atelier.template;

import com.hellblazer.atelier.cultural.CulturalProfile.Proportions;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.CanonicalKey;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParameterValidator;
import com.hellblazer.atelier.parameters.ParametricParameters;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Shared plumbing for the bundled templates: profile access, validation and the metadata skeleton. Subclasses provide
 * geometry and the culture specific wording and pricing.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractFurnitureTemplate implements ParametricTemplate {

    protected final CulturalProfileStore profiles;
    protected final ParameterValidator   validator;
    private final   Set<FurnitureType>   supportedTypes;

    protected AbstractFurnitureTemplate(CulturalProfileStore profiles, ParameterValidator validator,
                                        Set<FurnitureType> supportedTypes) {
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
        this.validator = Objects.requireNonNull(validator, "validator cannot be null");
        this.supportedTypes = Set.copyOf(supportedTypes);
    }

    protected static String culture(ParametricParameters parameters) {
        return parameters.culture().trim().toLowerCase(Locale.ROOT);
    }

    protected static String typeName(ParametricParameters parameters) {
        return FurnitureType.fromTag(parameters.type()).map(FurnitureType::displayName).orElse(parameters.type());
    }

    @Override
    public FurnitureMetadata generateMetadata(ParametricParameters parameters) {
        var culturalName = profiles.find(parameters.culture()).map(p -> p.name()).orElse(parameters.culture());
        var name = culturalName + " " + typeName(parameters);
        var description = String.format("Authentic %s with %s styling and %s craftsmanship in %s", name,
                                        parameters.style().tag(), parameters.craftsmanshipLevel().tag(),
                                        parameters.primaryMaterial());
        return new FurnitureMetadata(metadataId(parameters), name, description, culturalSignificance(parameters),
                                     usageGuidelines(parameters), maintenanceInstructions(parameters),
                                     estimateCost(parameters));
    }

    @Override
    public boolean validateParameters(ParametricParameters parameters) {
        return FurnitureType.fromTag(parameters.type()).filter(supportedTypes::contains).isPresent()
        && validator.validate(parameters);
    }

    @Override
    public Proportions getCulturalProportions(String culture) {
        return profiles.proportionsFor(culture, proportionsType().tag());
    }

    @Override
    public Set<FurnitureType> supportedTypes() {
        return supportedTypes;
    }

    /**
     * Base cost times material, craftsmanship and culture multipliers, rounded to whole dollars
     */
    protected long estimateCost(ParametricParameters parameters) {
        var cost = baseCost(parameters);
        cost *= materialCostMultipliers().getOrDefault(parameters.primaryMaterial(), 1.0);
        cost *= parameters.craftsmanshipLevel().costMultiplier();
        cost *= cultureCostMultipliers().getOrDefault(culture(parameters), 1.0);
        return Math.round(cost);
    }

    /**
     * Stable across processes for equal parameter sets
     */
    protected String metadataId(ParametricParameters parameters) {
        return String.format("%s-%s-%08x", parameters.type(), parameters.culture(),
                             CanonicalKey.of(parameters).hashCode());
    }

    protected abstract FurnitureType proportionsType();

    protected abstract double baseCost(ParametricParameters parameters);

    protected abstract Map<String, Double> materialCostMultipliers();

    protected abstract Map<String, Double> cultureCostMultipliers();

    protected abstract String culturalSignificance(ParametricParameters parameters);

    protected abstract List<String> usageGuidelines(ParametricParameters parameters);

    protected abstract List<String> maintenanceInstructions(ParametricParameters parameters);
}
