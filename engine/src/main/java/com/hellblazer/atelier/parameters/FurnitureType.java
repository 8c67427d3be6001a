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

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of furniture type tags the engine knows about. Whether a template is registered for a type is a separate
 * question answered by the template registry.
 *
 * @author hal.hildebrand
 */
public enum FurnitureType {
    CHAIR("chair", Category.SEATING),
    SOFA("sofa", Category.SEATING),
    BENCH("bench", Category.SEATING),
    DINING_TABLE("dining-table", Category.TABLE),
    COFFEE_TABLE("coffee-table", Category.TABLE),
    SIDE_TABLE("side-table", Category.TABLE),
    CABINET("cabinet", Category.STORAGE),
    SHELF("shelf", Category.STORAGE),
    CHEST("chest", Category.STORAGE);

    /**
     * Coarse grouping used for dimensional bounds and proportion checks
     */
    public enum Category {
        SEATING, TABLE, STORAGE, OTHER
    }

    private final String tag;
    private final Category category;

    FurnitureType(String tag, Category category) {
        this.tag = tag;
        this.category = category;
    }

    public static Optional<FurnitureType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.tag.equals(tag.trim().toLowerCase(Locale.ROOT))).findFirst();
    }

    /**
     * Category of an arbitrary tag. Unregistered tags containing "table" are still treated as tables.
     */
    public static Category categoryOf(String tag) {
        return fromTag(tag).map(FurnitureType::category).orElseGet(() -> {
            if (tag != null && tag.contains("table")) {
                return Category.TABLE;
            }
            return Category.OTHER;
        });
    }

    public String tag() {
        return tag;
    }

    public Category category() {
        return category;
    }

    /**
     * Title cased name, e.g. "Coffee Table"
     */
    public String displayName() {
        var words = tag.split("-");
        var builder = new StringBuilder();
        for (var word : words) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return builder.toString();
    }
}
