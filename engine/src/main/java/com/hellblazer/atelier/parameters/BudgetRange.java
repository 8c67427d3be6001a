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
import java.util.Optional;

/**
 * Budget band of an event request.
 */
public enum BudgetRange {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    LUXURY("luxury");

    private final String tag;

    BudgetRange(String tag) {
        this.tag = tag;
    }

    public static Optional<BudgetRange> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.tag.equalsIgnoreCase(tag.trim())).findFirst();
    }

    public String tag() {
        return tag;
    }
}
