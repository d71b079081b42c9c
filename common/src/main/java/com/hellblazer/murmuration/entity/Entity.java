/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Murmuration.
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
package com.hellblazer.murmuration.entity;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import java.util.Objects;

/**
 * Immutable entity value: an identity, arbitrary content and a position. Movement produces a new entity with the same
 * id and content, so a population can be advanced one step and re-indexed while readers still hold the previous
 * snapshot.
 *
 * @param <ID>      The type of EntityID used
 * @param <Content> The type of content carried
 * @author hal.hildebrand
 */
public final class Entity<ID extends EntityID, Content> implements Positioned {
    private final ID      id;
    private final Content content;
    private final Point3f position;

    public Entity(ID id, Content content, Tuple3f position) {
        this.id = Objects.requireNonNull(id, "Entity ID cannot be null");
        this.content = content;
        this.position = new Point3f(Objects.requireNonNull(position, "Position cannot be null"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity<?, ?> that)) return false;
        return id.equals(that.id) && Objects.equals(content, that.content) && position.equals(that.position);
    }

    public Content getContent() {
        return content;
    }

    public ID getId() {
        return id;
    }

    /**
     * @return a copy of the entity's position
     */
    @Override
    public Point3f getPosition() {
        return new Point3f(position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, content, position);
    }

    /**
     * @return a new entity with the same id and content, located at the given position
     */
    public Entity<ID, Content> moveTo(Tuple3f newPosition) {
        return new Entity<>(id, content, newPosition);
    }

    @Override
    public String toString() {
        return id.toDebugString() + "@" + position + (content == null ? "" : " " + content);
    }

    /**
     * @return a new entity with the same id and content, displaced by the given delta
     */
    public Entity<ID, Content> translate(Tuple3f delta) {
        var moved = new Point3f(position);
        moved.add(delta);
        return new Entity<>(id, content, moved);
    }

    /**
     * @return a new entity with the same id and position, carrying the given content
     */
    public <C> Entity<ID, C> withContent(C newContent) {
        return new Entity<>(id, newContent, position);
    }
}
