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

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParameterValidator;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.parameters.StyleVariant;
import com.hellblazer.atelier.template.Shape.Box;
import com.hellblazer.atelier.template.Shape.Cylinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dining, coffee and side tables. The top surface sits at the requested height; leg style follows the culture.
 *
 * @author hal.hildebrand
 */
public class TableTemplate extends AbstractFurnitureTemplate {
    static final float LEG_INSET        = 0.1f;
    static final float FRAME_THICKNESS  = 0.04f;
    static final float APRON_HEIGHT     = 0.08f;
    static final float APRON_THICKNESS  = 0.02f;
    static final double FRAME_MIN_WIDTH = 1.5;
    static final double FRAME_MIN_DEPTH = 1.0;

    private static final Map<String, Double> MATERIAL_COST = Map.of("wood-bamboo", 1.2, "wood-cherry", 1.8,
                                                                    "wood-oak", 1.5, "wood-pine", 1.0,
                                                                    "wood-walnut", 1.6, "glass", 1.4, "stone", 2.0);
    private static final Map<String, Double> CULTURE_COST  = Map.of("japanese", 1.4, "italian", 1.5, "french", 1.3,
                                                                    "scandinavian", 1.2, "modern", 1.0);
    private static final Map<String, String> SIGNIFICANCE  = Map.of("japanese",
                                                                    "Central to Japanese dining culture, promoting mindful eating and family gathering",
                                                                    "scandinavian",
                                                                    "Embodies hygge lifestyle, encouraging togetherness and comfort",
                                                                    "italian",
                                                                    "Reflects Italian emphasis on family meals and social gathering",
                                                                    "french",
                                                                    "Represents French culinary tradition and elegant entertaining",
                                                                    "modern",
                                                                    "Symbolizes contemporary living and functional design");

    public TableTemplate(CulturalProfileStore profiles, ParameterValidator validator) {
        super(profiles, validator, Set.of(FurnitureType.DINING_TABLE, FurnitureType.COFFEE_TABLE,
                                          FurnitureType.SIDE_TABLE));
    }

    enum LegStyle {
        STRAIGHT, TAPERED, CYLINDRICAL, TURNED, PEDESTAL
    }

    static LegStyle legStyle(ParametricParameters parameters) {
        return switch (culture(parameters)) {
            case "japanese" -> FurnitureType.COFFEE_TABLE.tag().equals(parameters.type()) ? LegStyle.TAPERED
                                                                                          : LegStyle.STRAIGHT;
            case "scandinavian" -> LegStyle.CYLINDRICAL;
            case "italian" -> parameters.style() == StyleVariant.ELEGANT && parameters.width() > FRAME_MIN_WIDTH
                              ? LegStyle.PEDESTAL : LegStyle.TURNED;
            case "french" -> LegStyle.TURNED;
            default -> LegStyle.STRAIGHT;
        };
    }

    @Override
    public SceneNode generateGeometry(ParametricParameters parameters) {
        var proportions = getCulturalProportions(parameters.culture());
        var width = (float) parameters.width();
        var depth = (float) parameters.depth();
        var height = (float) parameters.height();
        var topThickness = (float) Math.min(proportions.surfaceThickness(), height / 4);
        var legThickness = (float) proportions.legThickness();
        var legHeight = height - topThickness;

        var parts = new ArrayList<SceneNode>();
        parts.add(SceneNode.mesh("top", "top", new Box(width, topThickness, depth), 0, height - topThickness / 2,
                                 0));
        parts.addAll(legs(legStyle(parameters), legThickness, legHeight, width, depth));
        if (parameters.width() > FRAME_MIN_WIDTH || parameters.depth() > FRAME_MIN_DEPTH) {
            parts.add(SceneNode.mesh("cross-support", "frame", new Box(width * 0.8f, FRAME_THICKNESS,
                                                                       FRAME_THICKNESS), 0, height * 0.3f, 0));
        }
        if (parameters.formality().isFormal()) {
            var apron = new Box(width - 2 * LEG_INSET, APRON_HEIGHT, APRON_THICKNESS);
            var y = legHeight - APRON_HEIGHT / 2;
            var z = depth / 2 - LEG_INSET;
            parts.add(SceneNode.mesh("apron-front", "apron", apron, 0, y, z));
            parts.add(SceneNode.mesh("apron-back", "apron", apron, 0, y, -z));
        }
        parts.addAll(culturalDetails(parameters, width, depth, height));
        return SceneNode.group("ParametricTable", parts);
    }

    private List<SceneNode> legs(LegStyle style, float thickness, float height, float width, float depth) {
        if (style == LegStyle.PEDESTAL) {
            return List.of(SceneNode.mesh("pedestal", "leg", new Cylinder(thickness / 2, thickness * 2, height, 16),
                                          0, height / 2, 0));
        }
        Shape leg = switch (style) {
            case TAPERED -> new Cylinder(thickness / 2, thickness / 3, height, 8);
            case CYLINDRICAL -> Cylinder.uniform(thickness / 2, height, 12);
            case TURNED -> Cylinder.uniform(thickness / 2, height, 16);
            default -> new Box(thickness, height, thickness);
        };
        var corners = corners(width, depth, thickness);
        var legs = new ArrayList<SceneNode>(corners.length);
        for (int i = 0; i < corners.length; i++) {
            legs.add(SceneNode.mesh("leg-" + i, "leg", leg, corners[i][0], height / 2, corners[i][1]));
        }
        return legs;
    }

    private static float[][] corners(float width, float depth, float thickness) {
        var halfWidth = Math.max(width / 2 - LEG_INSET, thickness / 2);
        var halfDepth = Math.max(depth / 2 - LEG_INSET, thickness / 2);
        return new float[][] { { -halfWidth, -halfDepth }, { halfWidth, -halfDepth }, { -halfWidth, halfDepth },
                               { halfWidth, halfDepth } };
    }

    private List<SceneNode> culturalDetails(ParametricParameters parameters, float width, float depth,
                                            float height) {
        var elements = parameters.culturalElements();
        var details = new ArrayList<SceneNode>();
        switch (culture(parameters)) {
            case "japanese" -> {
                if (elements.contains("natural-grain")) {
                    details.add(SceneNode.mesh("grain", "cultural-accent",
                                               new Box(width * 0.8f, 0.001f, depth * 0.8f), 0, height + 0.001f, 0));
                }
            }
            case "scandinavian" -> {
                if (elements.contains("clean-lines")) {
                    details.add(SceneNode.mesh("edge", "cultural-accent", new Box(width, 0.005f, 0.01f), 0, height,
                                               depth / 2));
                }
            }
            case "italian" -> {
                if (elements.contains("ornate-carvings")) {
                    var ornament = Cylinder.uniform(0.03f, 0.03f, 8);
                    var corners = corners(width, depth, 0);
                    for (int i = 0; i < corners.length; i++) {
                        details.add(SceneNode.mesh("corner-" + i, "ornate-detail", ornament, corners[i][0],
                                                   height + 0.01f, corners[i][1]));
                    }
                }
            }
            case "french" -> {
                if (elements.contains("refined-curves")) {
                    details.add(SceneNode.mesh("molding", "cultural-accent", new Box(width, 0.01f, 0.02f), 0, height,
                                               depth / 2));
                }
            }
            default -> {
            }
        }
        return details;
    }

    @Override
    protected FurnitureType proportionsType() {
        return FurnitureType.DINING_TABLE;
    }

    /**
     * Type base price scaled by the footprint, normalized to 1.5 square meters
     */
    @Override
    protected double baseCost(ParametricParameters parameters) {
        var base = switch (parameters.type()) {
            case "coffee-table" -> 200.0;
            case "side-table" -> 150.0;
            default -> 300.0;
        };
        return base * (parameters.width() * parameters.depth()) / 1.5;
    }

    @Override
    protected Map<String, Double> materialCostMultipliers() {
        return MATERIAL_COST;
    }

    @Override
    protected Map<String, Double> cultureCostMultipliers() {
        return CULTURE_COST;
    }

    @Override
    protected String culturalSignificance(ParametricParameters parameters) {
        var significance = SIGNIFICANCE.getOrDefault(culture(parameters), "Represents cultural dining traditions");
        return switch (parameters.type()) {
            case "coffee-table" -> significance + ", serving as a focal point for casual social interaction";
            case "side-table" -> significance + ", providing functional support for daily activities";
            default -> significance;
        };
    }

    @Override
    protected List<String> usageGuidelines(ParametricParameters parameters) {
        var guidelines = new ArrayList<>(List.of("Suitable for indoor use in controlled environments",
                                                 "Designed for " + parameters.formality().tag() + " occasions",
                                                 "Use appropriate table linens and protection for surface",
                                                 "Maintain proper clearance around table for comfortable seating"));
        if (FurnitureType.DINING_TABLE.tag().equals(parameters.type())) {
            guidelines.add("Allow 60cm per person for comfortable dining");
        }
        parameters.capacity().ifPresent(c -> guidelines.add("Comfortably seats " + c + " people"));
        return guidelines;
    }

    @Override
    protected List<String> maintenanceInstructions(ParametricParameters parameters) {
        var instructions = new ArrayList<>(List.of("Clean spills immediately to prevent staining",
                                                   "Use coasters and placemats to protect surface",
                                                   "Dust regularly with soft, dry cloth",
                                                   "Avoid direct sunlight and extreme temperatures"));
        if (parameters.primaryMaterial().startsWith("wood")) {
            instructions.add("Apply wood conditioner and polish quarterly");
            instructions.add("Sand lightly and refinish annually for heavy use");
        }
        if (parameters.primaryMaterial().equals("glass")) {
            instructions.add("Clean with glass cleaner and soft cloth");
        }
        return instructions;
    }
}
