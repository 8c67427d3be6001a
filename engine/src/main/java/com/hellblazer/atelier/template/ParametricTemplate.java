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
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParametricParameters;

import java.util.Set;

/**
 * Generator capability for a family of furniture types. Implementations must be stateless with respect to a single
 * generation so they can be shared by concurrent callers.
 *
 * @author hal.hildebrand
 */
public interface ParametricTemplate {

    /**
     * Build the geometry of one piece. Meshes carry component tags used for material assignment.
     */
    SceneNode generateGeometry(ParametricParameters parameters);

    FurnitureMetadata generateMetadata(ParametricParameters parameters);

    boolean validateParameters(ParametricParameters parameters);

    /**
     * Proportions of a culture as this template interprets them
     */
    Proportions getCulturalProportions(String culture);

    /**
     * The furniture types this template can build
     */
    Set<FurnitureType> supportedTypes();
}
