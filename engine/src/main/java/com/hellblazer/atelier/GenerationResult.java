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
package com.hellblazer.atelier;

import com.hellblazer.atelier.material.Material;
import com.hellblazer.atelier.metrics.PerformanceSample;
import com.hellblazer.atelier.scoring.AuthenticityScore;
import com.hellblazer.atelier.template.FurnitureMetadata;
import com.hellblazer.atelier.template.SceneNode;

import java.util.List;
import java.util.Objects;

/**
 * One generated piece. Every component is immutable, so a result may be shared between callers through the cache.
 *
 * @param correctionPasses number of correct-and-rescore iterations applied before geometry was built
 *
 * @author hal.hildebrand
 */
public record GenerationResult(SceneNode geometry, List<Material> materials, FurnitureMetadata metadata,
                               AuthenticityScore culturalAuthenticity, PerformanceSample performanceMetrics,
                               int correctionPasses) {

    public GenerationResult {
        Objects.requireNonNull(geometry, "geometry cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        Objects.requireNonNull(culturalAuthenticity, "culturalAuthenticity cannot be null");
        Objects.requireNonNull(performanceMetrics, "performanceMetrics cannot be null");
        materials = List.copyOf(materials);
        if (correctionPasses < 0) {
            throw new IllegalArgumentException("correctionPasses cannot be negative: " + correctionPasses);
        }
    }
}
