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
package com.hellblazer.atelier.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.ErgonomicProfile;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.parameters.StyleVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Parses and sanitizes the JSON document produced by an external analyzer.
 * <p>
 * The document is untrusted: unknown enumerations fall back to defaults, dimensions and counts are clamped, lists
 * are truncated. Only a document that is not JSON, or that lacks the {@code furniture_pieces} array, is rejected.
 *
 * @author hal.hildebrand
 */
public class AnalysisResponseParser {
    public static final Set<String> KNOWN_MATERIALS = Set.of("wood-oak", "wood-pine", "wood-cherry", "wood-bamboo",
                                                             "fabric-cotton", "fabric-linen", "fabric-silk",
                                                             "fabric-wool", "metal-brass", "metal-steel",
                                                             "metal-copper", "leather", "ceramic", "glass", "stone");
    static final int    MAX_QUANTITY       = 20;
    static final int    MAX_CAPACITY       = 20;
    static final int    MAX_ELEMENTS       = 5;
    static final int    MAX_COLORS         = 4;
    static final String DEFAULT_MATERIAL   = "wood-oak";
    static final String DEFAULT_THEME      = "Culturally authentic design";

    private static final Logger log = LoggerFactory.getLogger(AnalysisResponseParser.class);

    private final ObjectMapper         mapper = new ObjectMapper();
    private final CulturalProfileStore profiles;

    public AnalysisResponseParser(CulturalProfileStore profiles) {
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
    }

    public FurnitureAnalysis parse(String json, UserFurnitureRequest request) throws AnalysisException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Analysis response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new AnalysisException("Analysis response is not a JSON object");
        }
        var piecesNode = root.get("furniture_pieces");
        if (piecesNode == null || !piecesNode.isArray()) {
            throw new AnalysisException("Analysis response has no furniture_pieces array");
        }
        var pieces = new ArrayList<FurniturePiece>(piecesNode.size());
        for (var pieceNode : piecesNode) {
            if (!pieceNode.isObject()) {
                throw new AnalysisException("Furniture piece is not a JSON object: " + pieceNode);
            }
            pieces.add(piece(pieceNode, request));
        }
        var theme = text(root, "overall_theme", DEFAULT_THEME);
        log.debug("Parsed {} pieces for {} {}", pieces.size(), request.culture(), request.eventType());
        return new FurnitureAnalysis(pieces, theme);
    }

    private FurniturePiece piece(JsonNode node, UserFurnitureRequest request) {
        var type = furnitureType(node.get("type"));
        var quantity = (int) clamp(number(node.get("quantity")).orElse(1), 1, MAX_QUANTITY);
        var priority = Priority.fromTag(textOrNull(node.get("priority"))).orElse(Priority.IMPORTANT);
        var params = node.path("parameters");
        return new FurniturePiece(type, quantity, priority, parameters(type, params, request),
                                  text(node, "cultural_reasoning", "AI analysis provided"),
                                  text(node, "functional_reasoning", "Functional requirements met"));
    }

    private ParametricParameters parameters(String type, JsonNode node, UserFurnitureRequest request) {
        var builder = ParametricParameters.builder()
                                          .type(type)
                                          .culture(request.culture())
                                          .formality(request.formalityLevel())
                                          .width(dimension(node.get("width"), 0.3, 3.0))
                                          .height(dimension(node.get("height"), 0.3, 2.0))
                                          .depth(dimension(node.get("depth"), 0.3, 2.0))
                                          .style(StyleVariant.fromTag(textOrNull(node.get("style")))
                                                             .orElse(StyleVariant.TRADITIONAL))
                                          .primaryMaterial(material(node.get("primaryMaterial")))
                                          .culturalElements(strings(node.get("culturalElements"), MAX_ELEMENTS))
                                          .ergonomicProfile(ErgonomicProfile.fromTag(
                                          textOrNull(node.get("ergonomicProfile"))).orElse(ErgonomicProfile.AVERAGE))
                                          .decorativeIntensity(
                                          clamp(number(node.get("decorativeIntensity")).orElse(0.5), 0.0, 1.0))
                                          .craftsmanshipLevel(CraftsmanshipLevel.fromTag(
                                          textOrNull(node.get("craftsmanshipLevel"))).orElse(
                                          CraftsmanshipLevel.REFINED));
        var secondary = node.get("secondaryMaterial");
        if (secondary != null && !secondary.isNull() && !secondary.asText().isBlank()) {
            builder.secondaryMaterial(material(secondary));
        }
        var capacity = number(node.get("capacity"));
        if (capacity.isPresent() && capacity.getAsDouble() != 0) {
            builder.capacity((int) clamp(capacity.getAsDouble(), 1, MAX_CAPACITY));
        }
        var palette = node.get("colorPalette");
        if (palette != null && palette.isArray()) {
            builder.colorPalette(strings(palette, MAX_COLORS));
        } else {
            builder.colorPalette(profiles.getOrDefault(request.culture()).aesthetics().colorPalette());
        }
        return builder.build();
    }

    private static String furnitureType(JsonNode node) {
        return FurnitureType.fromTag(textOrNull(node)).map(FurnitureType::tag).orElse(FurnitureType.CHAIR.tag());
    }

    private static String material(JsonNode node) {
        var material = textOrNull(node);
        return material != null && KNOWN_MATERIALS.contains(material) ? material : DEFAULT_MATERIAL;
    }

    /**
     * Lower bound when missing or not a number
     */
    private static double dimension(JsonNode node, double min, double max) {
        return clamp(number(node).orElse(min), min, max);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static OptionalDouble number(JsonNode node) {
        if (node == null || node.isNull()) {
            return OptionalDouble.empty();
        }
        if (node.isNumber()) {
            return OptionalDouble.of(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                var value = Double.parseDouble(node.asText().trim());
                return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
            } catch (NumberFormatException e) {
                log.trace("Not a number: {}", node.asText());
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    private static List<String> strings(JsonNode node, int limit) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        var values = new ArrayList<String>();
        for (var element : node) {
            if (values.size() == limit) {
                break;
            }
            if (element.isTextual()) {
                values.add(element.asText());
            }
        }
        return values;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || !node.isTextual() ? null : node.asText();
    }

    private static String text(JsonNode parent, String field, String defaultValue) {
        var value = textOrNull(parent.get(field));
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
