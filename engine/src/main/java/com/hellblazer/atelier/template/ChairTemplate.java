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
import com.hellblazer.atelier.parameters.FormalityLevel;
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
 * Chairs and benches. The seat sits at the requested height; the footprint is scaled by the ergonomic profile.
 * Benches have neither backrest nor armrests.
 *
 * @author hal.hildebrand
 */
public class ChairTemplate extends AbstractFurnitureTemplate {
    static final float SEAT_THICKNESS      = 0.05f;
    static final float BACKREST_HEIGHT     = 0.35f;
    static final float BACKREST_THICKNESS  = 0.03f;
    static final float ARMREST_WIDTH       = 0.08f;
    static final float ARMREST_THICKNESS   = 0.04f;
    static final float LEG_INSET           = 0.05f;

    private static final Map<String, Double> MATERIAL_COST = Map.of("wood-bamboo", 1.2, "wood-cherry", 1.8,
                                                                    "wood-oak", 1.5, "wood-pine", 1.0,
                                                                    "wood-walnut", 2.0, "fabric-silk", 2.0,
                                                                    "fabric-linen", 1.3, "leather", 2.5);
    private static final Map<String, Double> CULTURE_COST  = Map.of("japanese", 1.3, "italian", 1.4, "french", 1.2,
                                                                    "scandinavian", 1.1, "modern", 1.0);
    private static final Map<String, String> SIGNIFICANCE  = Map.of("japanese",
                                                                    "Represents harmony with nature and mindful living, embodying the principles of wabi-sabi",
                                                                    "scandinavian",
                                                                    "Embodies hygge philosophy of comfort and well-being, prioritizing function and coziness",
                                                                    "italian",
                                                                    "Reflects Renaissance ideals of beauty and craftsmanship, showcasing artistic excellence",
                                                                    "french",
                                                                    "Embodies French savoir-vivre, combining comfort with elegance for long conversations at table",
                                                                    "modern",
                                                                    "Embodies form-follows-function philosophy and contemporary design principles");

    public ChairTemplate(CulturalProfileStore profiles, ParameterValidator validator) {
        super(profiles, validator, Set.of(FurnitureType.CHAIR, FurnitureType.BENCH));
    }

    @Override
    public SceneNode generateGeometry(ParametricParameters parameters) {
        var bench = FurnitureType.BENCH.tag().equals(parameters.type());
        var proportions = profiles.proportionsFor(parameters.culture(), parameters.type());
        var multiplier = (float) parameters.ergonomicProfile().sizeMultiplier();
        var seatWidth = (float) parameters.width() * multiplier;
        var seatDepth = (float) parameters.depth() * multiplier;
        var seatHeight = (float) parameters.height();

        var parts = new ArrayList<SceneNode>();
        var thickness = SEAT_THICKNESS * (parameters.formality() == FormalityLevel.CASUAL ? 1.2f : 1.0f);
        parts.add(SceneNode.mesh("seat", "seat", new Box(seatWidth, thickness, seatDepth), 0, seatHeight, 0));
        if (!bench) {
            var backHeight = BACKREST_HEIGHT * backrestMultiplier(parameters.formality());
            parts.add(SceneNode.mesh("backrest", "backrest",
                                     new Box(seatWidth * 0.9f, backHeight, BACKREST_THICKNESS), 0,
                                     seatHeight + backHeight / 2, -seatDepth / 2));
        }
        parts.addAll(legs(parameters, (float) proportions.legThickness(), seatHeight, seatWidth, seatDepth));
        if (!bench && parameters.style() != StyleVariant.MINIMALIST
        && parameters.formality() != FormalityLevel.CASUAL) {
            var armHeight = (float) proportions.armrestHeight();
            var arm = new Box(ARMREST_WIDTH, ARMREST_THICKNESS, seatDepth * 0.8f);
            var offset = seatWidth / 2 + ARMREST_WIDTH / 2;
            parts.add(SceneNode.mesh("armrest-left", "armrest", arm, -offset, armHeight, 0));
            parts.add(SceneNode.mesh("armrest-right", "armrest", arm, offset, armHeight, 0));
        }
        parts.addAll(culturalDetails(parameters, seatHeight, seatDepth));
        return SceneNode.group(bench ? "ParametricBench" : "ParametricChair", parts);
    }

    private static float backrestMultiplier(FormalityLevel formality) {
        return switch (formality) {
            case CASUAL -> 0.8f;
            case SEMI_FORMAL -> 1.0f;
            case FORMAL -> 1.2f;
            case CEREMONIAL -> 1.4f;
        };
    }

    private List<SceneNode> legs(ParametricParameters parameters, float legThickness, float legHeight,
                                 float seatWidth, float seatDepth) {
        Shape leg = switch (culture(parameters)) {
            case "scandinavian" -> Cylinder.uniform(legThickness / 2, legHeight, 8);
            case "italian" -> new Cylinder(legThickness / 2, legThickness / 3, legHeight, 16);
            case "french" -> new Cylinder(legThickness / 2, legThickness / 2.5f, legHeight, 16);
            default -> new Box(legThickness, legHeight, legThickness);
        };
        var halfWidth = Math.max(seatWidth / 2 - LEG_INSET, legThickness / 2);
        var halfDepth = Math.max(seatDepth / 2 - LEG_INSET, legThickness / 2);
        var y = legHeight / 2;
        return List.of(SceneNode.mesh("leg-0", "leg", leg, -halfWidth, y, -halfDepth),
                       SceneNode.mesh("leg-1", "leg", leg, halfWidth, y, -halfDepth),
                       SceneNode.mesh("leg-2", "leg", leg, -halfWidth, y, halfDepth),
                       SceneNode.mesh("leg-3", "leg", leg, halfWidth, y, halfDepth));
    }

    private List<SceneNode> culturalDetails(ParametricParameters parameters, float seatHeight, float seatDepth) {
        var elements = parameters.culturalElements();
        var details = new ArrayList<SceneNode>();
        var back = -seatDepth / 2 + 0.01f;
        switch (culture(parameters)) {
            case "japanese" -> {
                if (elements.contains("bamboo-accents")) {
                    details.add(SceneNode.mesh("bamboo-accent", "cultural-accent", Cylinder.uniform(0.01f, 0.1f, 8),
                                               0, seatHeight - 0.1f, back));
                }
                if (elements.contains("sashimono-joinery")) {
                    details.add(SceneNode.mesh("joinery", "cultural-accent", new Box(0.02f, 0.02f, 0.02f), 0.2f,
                                               seatHeight, back));
                }
            }
            case "scandinavian" -> {
                if (elements.contains("cozy-textures")) {
                    details.add(SceneNode.mesh("cushion", "cultural-accent", new Box(0.4f, 0.05f, 0.4f), 0,
                                               seatHeight + 0.03f, 0));
                }
            }
            case "italian" -> {
                if (elements.contains("ornate-carvings")) {
                    details.add(SceneNode.mesh("ornament", "ornate-detail", Cylinder.uniform(0.02f, 0.02f, 8), 0,
                                               seatHeight + 0.2f, back));
                }
            }
            case "french" -> {
                if (elements.contains("refined-curves")) {
                    details.add(SceneNode.mesh("molding", "cultural-accent", new Box(0.02f, 0.3f, 0.01f), 0,
                                               seatHeight + 0.1f, back));
                }
                if (elements.contains("button-tufting")) {
                    var button = Cylinder.uniform(0.01f, 0.005f, 8);
                    details.add(SceneNode.mesh("button-0", "cultural-accent", button, -0.08f, seatHeight + 0.1f,
                                               back));
                    details.add(SceneNode.mesh("button-1", "cultural-accent", button, 0.08f, seatHeight + 0.1f,
                                               back));
                    details.add(SceneNode.mesh("button-2", "cultural-accent", button, 0, seatHeight, back));
                }
                if (elements.contains("bronze-hardware")) {
                    var nail = Cylinder.uniform(0.008f, 0.005f, 8);
                    for (int i = 0; i < 12; i++) {
                        var angle = i / 12.0 * Math.PI * 2;
                        details.add(SceneNode.mesh("nail-" + i, "ornate-detail", nail,
                                                   (float) (Math.cos(angle) * 0.22), seatHeight,
                                                   (float) (Math.sin(angle) * 0.22)));
                    }
                }
                if (elements.contains("louis-xvi-influences")) {
                    details.add(SceneNode.mesh("medallion", "ornate-detail", Cylinder.uniform(0.04f, 0.008f, 16),
                                               0, seatHeight + 0.15f, back));
                }
            }
            default -> {
            }
        }
        return details;
    }

    @Override
    protected FurnitureType proportionsType() {
        return FurnitureType.CHAIR;
    }

    @Override
    protected double baseCost(ParametricParameters parameters) {
        return FurnitureType.BENCH.tag().equals(parameters.type()) ? 260 : 200;
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
        return SIGNIFICANCE.getOrDefault(culture(parameters), "Represents cultural design traditions and values");
    }

    @Override
    protected List<String> usageGuidelines(ParametricParameters parameters) {
        var guidelines = new ArrayList<>(List.of("Suitable for indoor use in controlled environments",
                                                 "Designed for " + parameters.formality().tag() + " occasions",
                                                 "Accommodates " + parameters.ergonomicProfile().tag()
                                                 + " body types", "Use appropriate cushioning for extended sitting"));
        switch (culture(parameters)) {
            case "japanese" -> guidelines.add("Remove shoes before use in traditional settings");
            case "french" -> {
                guidelines.add("Designed to promote proper posture for extended conversation and dining");
                if (parameters.formality().isFormal()) {
                    guidelines.add("Supports traditional French dining etiquette and social customs");
                }
            }
            default -> {
            }
        }
        return guidelines;
    }

    @Override
    protected List<String> maintenanceInstructions(ParametricParameters parameters) {
        var instructions = new ArrayList<>(List.of("Dust regularly with soft, dry cloth",
                                                   "Avoid direct sunlight and extreme temperatures",
                                                   "Clean spills immediately with appropriate cleaner"));
        if (parameters.primaryMaterial().startsWith("wood")) {
            instructions.add("Apply wood conditioner quarterly");
        }
        if (parameters.primaryMaterial().startsWith("fabric")) {
            instructions.add("Vacuum upholstery regularly");
        }
        return instructions;
    }
}
