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

import com.hellblazer.atelier.UnknownTemplateTypeException;
import com.hellblazer.atelier.cultural.CulturalProfileStore;
import com.hellblazer.atelier.parameters.FurnitureType;
import com.hellblazer.atelier.parameters.ParameterValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Maps the closed set of {@link FurnitureType}s to generator templates. Resolution of a tag that is not a known type,
 * or that has no template, fails with {@link UnknownTemplateTypeException}.
 *
 * @author hal.hildebrand
 */
public class TemplateRegistry {
    private static final Logger log = LoggerFactory.getLogger(TemplateRegistry.class);

    private final Map<FurnitureType, ParametricTemplate> templates = new ConcurrentHashMap<>();

    /**
     * Registry holding the bundled chair and table templates
     */
    public static TemplateRegistry withDefaults(CulturalProfileStore profiles, ParameterValidator validator) {
        var registry = new TemplateRegistry();
        registry.registerAll(new ChairTemplate(profiles, validator));
        registry.registerAll(new TableTemplate(profiles, validator));
        return registry;
    }

    public void register(FurnitureType type, ParametricTemplate template) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(template, "template cannot be null");
        var previous = templates.put(type, template);
        if (previous != null && previous != template) {
            log.info("Replaced template for {}: {} -> {}", type.tag(), previous.getClass().getSimpleName(),
                     template.getClass().getSimpleName());
        }
    }

    /**
     * Register a template for every type it supports
     */
    public void registerAll(ParametricTemplate template) {
        template.supportedTypes().forEach(type -> register(type, template));
    }

    public Optional<ParametricTemplate> find(String tag) {
        return FurnitureType.fromTag(tag).map(templates::get);
    }

    /**
     * @throws UnknownTemplateTypeException if the tag is unknown or unregistered
     */
    public ParametricTemplate resolve(String tag) {
        return find(tag).orElseThrow(() -> new UnknownTemplateTypeException(tag));
    }

    public boolean supports(String tag) {
        return find(tag).isPresent();
    }

    /**
     * @return registered type tags in declaration order
     */
    public List<String> supportedTypes() {
        return Arrays.stream(FurnitureType.values())
                     .filter(templates::containsKey)
                     .map(FurnitureType::tag)
                     .collect(Collectors.toList());
    }
}
