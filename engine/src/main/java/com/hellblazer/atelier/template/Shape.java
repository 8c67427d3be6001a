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

/**
 * Primitive mesh shape. Dimensions are in meters. Vertex and triangle counts follow the usual indexed-mesh layout
 * (separate vertices per face for boxes, a shared seam plus capped ends for cylinders).
 *
 * @author hal.hildebrand
 */
public sealed interface Shape permits Shape.Box, Shape.Cylinder {

    /** position + normal + uv, as floats */
    int BYTES_PER_VERTEX = 32;
    /** 16 bit indices */
    int BYTES_PER_INDEX  = 2;

    int vertexCount();

    int triangleCount();

    default long memoryBytes() {
        return (long) vertexCount() * BYTES_PER_VERTEX + (long) triangleCount() * 3 * BYTES_PER_INDEX;
    }

    record Box(float width, float height, float depth) implements Shape {
        public Box {
            requirePositive(width, "width");
            requirePositive(height, "height");
            requirePositive(depth, "depth");
        }

        @Override
        public int vertexCount() {
            return 24;
        }

        @Override
        public int triangleCount() {
            return 12;
        }
    }

    record Cylinder(float radiusTop, float radiusBottom, float height, int segments) implements Shape {
        public Cylinder {
            requirePositive(radiusTop, "radiusTop");
            requirePositive(radiusBottom, "radiusBottom");
            requirePositive(height, "height");
            if (segments < 3) {
                throw new IllegalArgumentException("segments must be >= 3: " + segments);
            }
        }

        public static Cylinder uniform(float radius, float height, int segments) {
            return new Cylinder(radius, radius, height, segments);
        }

        @Override
        public int vertexCount() {
            // side rings plus one center and one ring per cap
            return 2 * (segments + 1) + 2 * (segments + 1) + 2;
        }

        @Override
        public int triangleCount() {
            return 4 * segments;
        }
    }

    private static void requirePositive(float value, String field) {
        if (!(value > 0f)) {
            throw new IllegalArgumentException(field + " must be positive: " + value);
        }
    }
}
