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

import com.hellblazer.atelier.template.Shape.Box;
import com.hellblazer.atelier.template.Shape.Cylinder;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SceneNodeTest {

    @Test
    void shapeCounts() {
        var box = new Box(1, 1, 1);
        assertEquals(24, box.vertexCount());
        assertEquals(12, box.triangleCount());
        assertEquals(24 * 32 + 12 * 6, box.memoryBytes());

        var cylinder = Cylinder.uniform(0.1f, 1, 8);
        assertEquals(4 * 9 + 2, cylinder.vertexCount());
        assertEquals(32, cylinder.triangleCount());
        assertThrows(IllegalArgumentException.class, () -> Cylinder.uniform(0.1f, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> new Box(0, 1, 1));
    }

    @Test
    void traversalAndMapping() {
        var inner = SceneNode.group("inner", List.of(SceneNode.mesh("b", "leg", new Box(1, 1, 1), 0, 0, 0)));
        var root = SceneNode.group("root", List.of(SceneNode.mesh("a", "seat", new Box(1, 1, 1), 0, 1, 0), inner,
                                                   SceneNode.mesh("c", "leg", Cylinder.uniform(1, 1, 8), 0, 0, 0)));
        assertEquals(List.of("a", "b", "c"), root.meshes().stream().map(SceneNode::name).toList());
        assertEquals(3, root.componentCount());
        assertEquals(12 + 12 + 32, root.polygonCount());

        var painted = root.mapMeshes(mesh -> mesh.withMaterial(mesh.name() + "-paint"));
        assertEquals(List.of("a-paint", "b-paint", "c-paint"),
                     painted.meshes().stream().map(m -> m.material().orElseThrow()).toList());
        assertTrue(root.meshes().stream().allMatch(m -> m.material().isEmpty()));
    }

    @Test
    void positionIsNotShared() {
        var mesh = SceneNode.mesh("a", "seat", new Box(1, 1, 1), 1, 2, 3);
        mesh.position().set(9, 9, 9);
        assertEquals(2f, mesh.position().y);
    }

    @Test
    void meshesCannotHaveChildren() {
        var child = SceneNode.mesh("a", "seat", new Box(1, 1, 1), 0, 0, 0);
        assertThrows(IllegalArgumentException.class,
                     () -> new SceneNode("bad", Optional.of("seat"), Optional.of(new Box(1, 1, 1)), new Point3f(),
                                         Optional.empty(), List.of(child)));
    }
}
