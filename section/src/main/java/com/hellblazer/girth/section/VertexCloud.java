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
package com.hellblazer.girth.section;

import java.util.List;

import javax.vecmath.Tuple3f;

/**
 * An immutable, ordered 3D point cloud in meters. Coordinates are stored interleaved as {@code x0 y0 z0 x1 ...}. The
 * unit is a caller contract and is never verified or corrected here.
 *
 * @author hal.hildebrand
 */
public final class VertexCloud {

    /**
     * @param vertices an (N,3) array; N may be zero
     * @throws IllegalArgumentException on a null or short row or a non finite coordinate
     */
    public static VertexCloud of(float[][] vertices) {
        if (vertices == null) {
            throw new IllegalArgumentException("Vertices are required");
        }
        var xyz = new float[vertices.length * 3];
        for (int i = 0; i < vertices.length; i++) {
            var row = vertices[i];
            if (row == null || row.length != 3) {
                throw new IllegalArgumentException(
                "Vertex " + i + " must have exactly 3 coordinates: " + (row == null ? "null" : row.length));
            }
            set(xyz, i, row[0], row[1], row[2]);
        }
        return new VertexCloud(xyz);
    }

    public static VertexCloud of(List<? extends Tuple3f> vertices) {
        if (vertices == null) {
            throw new IllegalArgumentException("Vertices are required");
        }
        var xyz = new float[vertices.size() * 3];
        int i = 0;
        for (var p : vertices) {
            if (p == null) {
                throw new IllegalArgumentException("Vertex " + i + " is null");
            }
            set(xyz, i++, p.x, p.y, p.z);
        }
        return new VertexCloud(xyz);
    }

    private static void set(float[] xyz, int i, float x, float y, float z) {
        if (!Float.isFinite(x) || !Float.isFinite(y) || !Float.isFinite(z)) {
            throw new IllegalArgumentException("Vertex " + i + " has a non finite coordinate: " + x + ", " + y + ", " + z);
        }
        xyz[i * 3] = x;
        xyz[i * 3 + 1] = y;
        xyz[i * 3 + 2] = z;
    }

    private final float[] xyz;

    private VertexCloud(float[] xyz) {
        this.xyz = xyz;
    }

    /**
     * @param axis 0, 1 or 2
     */
    public float coordinate(int i, int axis) {
        return xyz[i * 3 + axis];
    }

    public boolean isEmpty() {
        return xyz.length == 0;
    }

    /**
     * Largest absolute coordinate over all vertices, 0 for an empty cloud
     */
    public double maxAbs() {
        double max = 0.0;
        for (var c : xyz) {
            max = Math.max(max, Math.abs(c));
        }
        return max;
    }

    public int size() {
        return xyz.length / 3;
    }

    @Override
    public String toString() {
        return "VertexCloud[" + size() + "]";
    }
}
