/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Girth.
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
package com.hellblazer.girth.section.component;

import java.util.List;

/**
 * The components of one slice, ordered by their smallest slice index, i.e. by canonical slice order.
 *
 * @param singleComponentOnly the region expected several components (torso and limbs) but the slice held one
 * @param connectivity        the connectivity distance the slice was split with
 * @author hal.hildebrand
 */
public record SeparationResult(List<Component> components, boolean singleComponentOnly, double connectivity) {

    public SeparationResult {
        components = List.copyOf(components);
    }

    public int count() {
        return components.size();
    }
}
