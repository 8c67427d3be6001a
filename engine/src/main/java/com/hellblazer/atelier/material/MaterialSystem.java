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
package com.hellblazer.atelier.material;

import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.CraftsmanshipLevel;
import com.hellblazer.atelier.parameters.ParametricParameters;
import com.hellblazer.atelier.template.SceneNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Procedural materials for generated pieces, and their binding to scene meshes by component tag.
 * <p>
 * Materials are immutable and memoized per (material, culture, color, craftsmanship) in a bounded LRU. Texture maps
 * are optional and
 * attached asynchronously by {@link #prepareMaterials(ParametricParameters, TextureSource)}; a texture failure never
 * fails a generation.
 *
 * @author hal.hildebrand
 */
public class MaterialSystem {
    private static final Logger log = LoggerFactory.getLogger(MaterialSystem.class);

    private static final Map<String, Double> WOOD_ROUGHNESS   = Map.of("oak", 0.8, "pine", 0.7, "cherry", 0.6,
                                                                       "bamboo", 0.5);
    private static final Map<String, Double> FABRIC_ROUGHNESS = Map.of("cotton", 0.9, "linen", 0.8, "silk", 0.3,
                                                                       "wool", 1.0);
    private static final Map<String, Double> METAL_ROUGHNESS  = Map.of("brass", 0.3, "steel", 0.2, "copper", 0.4);
    private static final Map<String, Double> METALNESS        = Map.of("brass", 0.9, "steel", 1.0, "copper", 0.8);
    private static final Map<String, Double> METAL_FINISH     = Map.of("japanese", 1.2, "scandinavian", 1.1,
                                                                       "italian", 0.8, "french", 0.9, "modern", 0.7);

    public static final int DEFAULT_CAPACITY = 128;

    private final CulturalProfileStore  profiles;
    private final Map<String, Material> cache;
    private final ReentrantLock         lock = new ReentrantLock();

    public MaterialSystem(CulturalProfileStore profiles) {
        this(profiles, DEFAULT_CAPACITY);
    }

    public MaterialSystem(CulturalProfileStore profiles, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.profiles = Objects.requireNonNull(profiles, "profiles cannot be null");
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Material> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Bind materials to meshes in traversal order: seat, backrest and top take the primary material; legs and frames
     * take the material at the running mesh index, capped at the last; cultural accents and ornate details take the
     * last material; anything else cycles through the list.
     */
    public static SceneNode applyMaterials(SceneNode geometry, List<Material> materials) {
        if (materials.isEmpty()) {
            return geometry;
        }
        var index = new int[] { 0 };
        var last = materials.size() - 1;
        return geometry.mapMeshes(mesh -> {
            var component = mesh.component().orElse("");
            var i = index[0]++;
            var material = switch (component) {
                case "seat", "backrest", "top" -> materials.get(0);
                case "leg", "frame" -> materials.get(Math.min(i, last));
                case "cultural-accent", "ornate-detail" -> materials.get(last);
                default -> materials.get(i % materials.size());
            };
            return mesh.withMaterial(material.name());
        });
    }

    private static String variant(String material) {
        var dash = material.indexOf('-');
        return dash < 0 ? material : material.substring(dash + 1);
    }

    private static double craftsmanshipFactor(CraftsmanshipLevel level) {
        return switch (level) {
            case SIMPLE -> 1.2;
            case REFINED -> 1.0;
            case MASTERWORK -> 0.8;
        };
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Primary material, then the secondary material when present
     */
    public List<Material> generateMaterials(ParametricParameters parameters) {
        var materials = new ArrayList<Material>(2);
        materials.add(getMaterial(parameters.primaryMaterial(), parameters));
        parameters.secondaryMaterial().ifPresent(secondary -> materials.add(getMaterial(secondary, parameters)));
        return List.copyOf(materials);
    }

    public Material getMaterial(String material, ParametricParameters parameters) {
        var color = baseColor(parameters);
        var key = String.join("|", material, parameters.culture(), color, parameters.craftsmanshipLevel().tag());
        lock.lock();
        try {
            return cache.computeIfAbsent(key, k -> createMaterial(material, color, parameters));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Generate materials and attach texture sets from the source. A material whose textures fail to load keeps its
     * procedural surface.
     */
    public CompletableFuture<List<Material>> prepareMaterials(ParametricParameters parameters, TextureSource source) {
        var futures = generateMaterials(parameters).stream().map(material -> {
            CompletableFuture<TextureSet> loading;
            try {
                loading = source.load(material.name());
            } catch (RuntimeException e) {
                loading = CompletableFuture.failedFuture(e);
            }
            return loading.thenApply(material::withTextures).exceptionally(t -> {
                log.warn("Texture load failed for {}, using procedural surface: {}", material.name(), t.toString());
                return material;
            });
        }).collect(Collectors.toList());
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                                .thenApply(v -> futures.stream().map(CompletableFuture::join)
                                                       .collect(Collectors.toUnmodifiableList()));
    }

    public int cachedMaterialCount() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    public void clearCache() {
        lock.lock();
        try {
            cache.clear();
        } finally {
            lock.unlock();
        }
    }

    private String baseColor(ParametricParameters parameters) {
        if (!parameters.colorPalette().isEmpty()) {
            return parameters.colorPalette().get(0);
        }
        var palette = profiles.getOrDefault(parameters.culture()).aesthetics().colorPalette();
        return palette.isEmpty() ? "#808080" : palette.get(0);
    }

    private Material createMaterial(String material, String color, ParametricParameters parameters) {
        var family = MaterialFamily.of(material);
        var variant = variant(material);
        var culture = parameters.culture().trim().toLowerCase(Locale.ROOT);
        double roughness = family.roughness();
        double metalness = family.metalness();
        switch (family) {
            case WOOD -> roughness = WOOD_ROUGHNESS.getOrDefault(variant, family.roughness())
            * craftsmanshipFactor(parameters.craftsmanshipLevel());
            case FABRIC -> roughness = FABRIC_ROUGHNESS.getOrDefault(variant, family.roughness());
            case METAL -> {
                roughness = METAL_ROUGHNESS.getOrDefault(variant, family.roughness()) * METAL_FINISH.getOrDefault(
                culture, 1.0);
                metalness = METALNESS.getOrDefault(variant, family.metalness());
            }
            default -> {
            }
        }
        if (family != MaterialFamily.METAL && family != MaterialFamily.GLASS) {
            roughness = culturalFinish(culture, roughness);
        }
        var finishes = profiles.getOrDefault(parameters.culture()).aesthetics().surfaceFinishes();
        var finish = finishes.isEmpty() ? "natural" : finishes.get(0);
        log.debug("Created material {} for {}: roughness={} metalness={}", material, culture, roughness, metalness);
        return new Material(material, family, color, clampUnit(roughness), clampUnit(metalness), finish,
                            Optional.empty());
    }

    private static double culturalFinish(String culture, double roughness) {
        return switch (culture) {
            case "japanese" -> Math.min(1.0, roughness * 1.2);
            case "scandinavian" -> Math.min(1.0, roughness * 1.1);
            case "italian" -> Math.max(0.1, roughness * 0.8);
            case "french" -> Math.max(0.2, roughness * 0.9);
            case "modern" -> Math.max(0.1, roughness * 0.7);
            default -> roughness;
        };
    }
}
