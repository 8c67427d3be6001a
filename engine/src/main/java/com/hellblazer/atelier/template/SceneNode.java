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

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Immutable scene graph node. A node is either a group (no shape, any number of children) or a mesh (a shape tagged
 * with a {@code component} such as "seat", "leg" or "cultural-accent"). Materials are bound to meshes by name.
 * <p>
 * Instances are safely shared between threads and between cached results; every "modification" returns a new tree.
 *
 * @author hal.hildebrand
 */
public record SceneNode(String name, Optional<String> component, Optional<Shape> shape, Point3f position,
                        Optional<String> material, List<SceneNode> children) {

    public SceneNode {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(component, "component cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
        Objects.requireNonNull(material, "material cannot be null");
        position = new Point3f(Objects.requireNonNull(position, "position cannot be null"));
        children = List.copyOf(children);
        if (shape.isPresent() && !children.isEmpty()) {
            throw new IllegalArgumentException("Mesh node cannot have children: " + name);
        }
    }

    public static SceneNode group(String name, List<SceneNode> children) {
        return new SceneNode(name, Optional.empty(), Optional.empty(), new Point3f(), Optional.empty(), children);
    }

    public static SceneNode mesh(String name, String component, Shape shape, float x, float y, float z) {
        return new SceneNode(name, Optional.of(component), Optional.of(shape), new Point3f(x, y, z),
                             Optional.empty(), List.of());
    }

    /**
     * @return a copy; the node's own position is never exposed
     */
    @Override
    public Point3f position() {
        return new Point3f(position);
    }

    public boolean isMesh() {
        return shape.isPresent();
    }

    /**
     * Depth first, pre-order traversal
     */
    public void visit(Consumer<SceneNode> visitor) {
        visitor.accept(this);
        children.forEach(child -> child.visit(visitor));
    }

    /**
     * @return every mesh in traversal order
     */
    public List<SceneNode> meshes() {
        var meshes = new ArrayList<SceneNode>();
        visit(node -> {
            if (node.isMesh()) {
                meshes.add(node);
            }
        });
        return meshes;
    }

    /**
     * Rebuild the tree, replacing each mesh with {@code f(mesh)}. Meshes are presented in traversal order.
     */
    public SceneNode mapMeshes(UnaryOperator<SceneNode> f) {
        if (isMesh()) {
            return f.apply(this);
        }
        var mapped = new ArrayList<SceneNode>(children.size());
        for (var child : children) {
            mapped.add(child.mapMeshes(f));
        }
        return new SceneNode(name, component, shape, position, material, mapped);
    }

    public SceneNode withMaterial(String material) {
        return new SceneNode(name, component, shape, position, Optional.of(material), children);
    }

    public boolean hasComponent(String tag) {
        return component.filter(tag::equals).isPresent();
    }

    public int polygonCount() {
        return meshes().stream().mapToInt(m -> m.shape().orElseThrow().triangleCount()).sum();
    }

    public long memoryBytes() {
        return meshes().stream().mapToLong(m -> m.shape().orElseThrow().memoryBytes()).sum();
    }

    /**
     * @return the number of meshes in the tree
     */
    public int componentCount() {
        return meshes().size();
    }
}
