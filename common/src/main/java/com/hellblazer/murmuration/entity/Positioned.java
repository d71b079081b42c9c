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

/**
 * Anything that occupies a position in space. This is the only view a spatial index has of the entities it stores:
 * the index reads the position and never touches anything else.
 * <p>
 * Implementations must return a stable position for the lifetime of the instance. An entity that moves is modeled as
 * a new instance, and the index is rebuilt from the moved population.
 *
 * @author hal.hildebrand
 */
public interface Positioned {

    /**
     * @return the position of this entity. Callers must not mutate the returned point
     */
    Point3f getPosition();
}
