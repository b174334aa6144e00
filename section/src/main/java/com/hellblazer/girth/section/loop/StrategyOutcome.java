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
package com.hellblazer.girth.section.loop;

import java.util.Map;
import java.util.TreeMap;

import com.hellblazer.girth.section.failure.FailureReason;
import com.hellblazer.girth.section.geometry.Loop;

/**
 * The tagged result of one boundary strategy attempt
 *
 * @author hal.hildebrand
 */
public sealed interface StrategyOutcome permits StrategyOutcome.Built, StrategyOutcome.Failed {

    /**
     * A closed loop, plus strategy specific facts (e.g. the alpha neighborhood actually used) for the section id
     */
    record Built(Loop loop, Map<String, Object> facts) implements StrategyOutcome {
        public Built {
            facts = new TreeMap<>(facts);
        }

        public Built(Loop loop) {
            this(loop, Map.of());
        }
    }

    record Failed(FailureReason reason) implements StrategyOutcome {
    }

    static StrategyOutcome failed(FailureReason reason) {
        return new Failed(reason);
    }
}
