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
package com.hellblazer.girth.section.failure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only, ordered warning accumulator. Nothing is ever removed; {@link #snapshot()} hands out an immutable copy.
 *
 * @author hal.hildebrand
 */
public final class WarningLog {
    private final List<String> codes = new ArrayList<>();

    public WarningLog add(WarningCode code) {
        codes.add(code.code());
        return this;
    }

    public WarningLog add(WarningCode code, FailureReason reason) {
        codes.add(code.code(reason));
        return this;
    }

    public WarningLog addAll(WarningLog other) {
        codes.addAll(other.codes);
        return this;
    }

    public boolean contains(String code) {
        return codes.contains(code);
    }

    public boolean contains(WarningCode code) {
        for (var c : codes) {
            if (WarningCode.family(c).equals(code.name())) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return codes.isEmpty();
    }

    public int size() {
        return codes.size();
    }

    public List<String> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(codes));
    }

    @Override
    public String toString() {
        return codes.toString();
    }
}
