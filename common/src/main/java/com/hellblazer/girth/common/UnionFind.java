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
package com.hellblazer.girth.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Disjoint sets over the arena ids {@code 0..size-1}, with union by size and path halving.
 *
 * @author hal.hildebrand
 */
public final class UnionFind {
    private final int[] parent;
    private final int[] setSize;
    private int         sets;

    public UnionFind(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Size must be non-negative: " + size);
        }
        parent = new int[size];
        setSize = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
            setSize[i] = 1;
        }
        sets = size;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int find(int id) {
        while (parent[id] != id) {
            parent[id] = parent[parent[id]];
            id = parent[id];
        }
        return id;
    }

    /**
     * The disjoint sets as member lists. Each list is ascending and the lists are ordered by their smallest member, so
     * the partition reads the same no matter which unions produced it.
     */
    public List<IntArrayList> sets() {
        var byRoot = new int[parent.length];
        Arrays.fill(byRoot, -1);
        var result = new ArrayList<IntArrayList>();
        for (int i = 0; i < parent.length; i++) {
            int root = find(i);
            if (byRoot[root] < 0) {
                byRoot[root] = result.size();
                result.add(new IntArrayList());
            }
            result.get(byRoot[root]).add(i);
        }
        return result;
    }

    public int setCount() {
        return sets;
    }

    public int setSize(int id) {
        return setSize[find(id)];
    }

    public int size() {
        return parent.length;
    }

    /**
     * Merge the sets containing a and b
     *
     * @return true if the sets were distinct
     */
    public boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return false;
        }
        if (setSize[ra] < setSize[rb] || (setSize[ra] == setSize[rb] && rb < ra)) {
            int t = ra;
            ra = rb;
            rb = t;
        }
        parent[rb] = ra;
        setSize[ra] += setSize[rb];
        sets--;
        return true;
    }
}
