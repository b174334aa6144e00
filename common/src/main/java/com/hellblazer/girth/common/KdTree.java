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
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import javax.vecmath.Point2d;
import javax.vecmath.Tuple2d;

/**
 * A planar kd-tree over arena indexed points. Construction and queries are fully deterministic: the median split uses a
 * total order (coordinate, then id) and neighbor ties are resolved by id, so identical point sets always yield
 * identical neighborhoods regardless of the order in which the points were supplied.
 *
 * @author hal.hildebrand
 */
public class KdTree {

    /**
     * A query answer: the arena id of a neighbor and its Euclidean distance from the query point
     */
    public record Neighbor(int id, double distance) {
    }

    public static class Node {
        private final Point2d coords_;
        private final int     id_;
        private Node          left_  = null;
        private Node          right_ = null;

        public Node(int id, Tuple2d p) {
            id_ = id;
            coords_ = new Point2d(p);
        }

        public Point2d coords() {
            return new Point2d(coords_);
        }

        public int id() {
            return id_;
        }

        @Override
        public String toString() {
            return id_ + ":" + coords_;
        }

        double distanceSquared(Tuple2d p) {
            double dx = coords_.x - p.x;
            double dy = coords_.y - p.y;
            return dx * dx + dy * dy;
        }

        double get(int index) {
            return switch (index) {
            case 0:
                yield coords_.x;
            case 1:
                yield coords_.y;
            default:
                throw new IllegalArgumentException("Unexpected index: " + index);
            };
        }
    }

    //
    // Quickselect with a median-of-three pivot. No randomness, so the tree shape is a pure function of the input.
    // See https://en.wikipedia.org/wiki/Quickselect
    //
    public static class QuickSelect {

        public static <T> T select(List<T> list, int n, Comparator<? super T> cmp) {
            return select(list, 0, list.size() - 1, n, cmp);
        }

        public static <T> T select(List<T> list, int left, int right, int n, Comparator<? super T> cmp) {
            for (;;) {
                if (left == right)
                    return list.get(left);
                int pivot = pivotIndex(list, left, right, cmp);
                pivot = partition(list, left, right, pivot, cmp);
                if (n == pivot)
                    return list.get(n);
                else if (n < pivot)
                    right = pivot - 1;
                else
                    left = pivot + 1;
            }
        }

        private static <T> int partition(List<T> list, int left, int right, int pivot, Comparator<? super T> cmp) {
            T pivotValue = list.get(pivot);
            swap(list, pivot, right);
            int store = left;
            for (int i = left; i < right; ++i) {
                if (cmp.compare(list.get(i), pivotValue) < 0) {
                    swap(list, store, i);
                    ++store;
                }
            }
            swap(list, right, store);
            return store;
        }

        private static <T> int pivotIndex(List<T> list, int left, int right, Comparator<? super T> cmp) {
            int mid = left + (right - left) / 2;
            T a = list.get(left);
            T b = list.get(mid);
            T c = list.get(right);
            if (cmp.compare(a, b) < 0) {
                if (cmp.compare(b, c) < 0)
                    return mid;
                return cmp.compare(a, c) < 0 ? right : left;
            }
            if (cmp.compare(a, c) < 0)
                return left;
            return cmp.compare(b, c) < 0 ? right : mid;
        }

        private static <T> void swap(List<T> list, int i, int j) {
            T value = list.get(i);
            list.set(i, list.get(j));
            list.set(j, value);
        }
    }

    private static class NodeComparator implements Comparator<Node> {
        private final int index_;

        private NodeComparator(int index) {
            index_ = index;
        }

        @Override
        public int compare(Node n1, Node n2) {
            int c = Double.compare(n1.get(index_), n2.get(index_));
            return c != 0 ? c : Integer.compare(n1.id_, n2.id_);
        }
    }

    private static final int DIMENSIONS = 2;

    private static final Comparator<Neighbor> NEAREST_FIRST = Comparator.comparingDouble(Neighbor::distance)
                                                                        .thenComparingInt(Neighbor::id);

    /**
     * Build a tree over the first {@code size} points of the parallel coordinate arrays; the array index is the id.
     */
    public static KdTree of(double[] u, double[] v, int size) {
        if (u.length < size || v.length < size) {
            throw new IllegalArgumentException("Coordinate arrays shorter than size: " + size);
        }
        var nodes = new ArrayList<Node>(size);
        for (int i = 0; i < size; i++) {
            nodes.add(new Node(i, new Point2d(u[i], v[i])));
        }
        return new KdTree(nodes);
    }

    private final Node root_;
    private final int  size_;

    public KdTree(List<Node> nodes) {
        var working = new ArrayList<>(nodes);
        size_ = working.size();
        root_ = makeTree(working, 0, working.size(), 0);
    }

    /**
     * Answer the k nearest neighbors of the target, nearest first, ties ordered by id.
     *
     * @param target    the query point
     * @param k         the number of neighbors requested
     * @param excludeId an id to skip (typically the query point itself), or -1
     */
    public List<Neighbor> nearest(Tuple2d target, int k, int excludeId) {
        if (root_ == null)
            throw new IllegalStateException("Tree is empty!");
        if (k <= 0) {
            return List.of();
        }
        var best = new PriorityQueue<Neighbor>(k + 1, NEAREST_FIRST.reversed());
        nearest(root_, target, k, excludeId, 0, best);
        var result = new ArrayList<>(best);
        result.sort(NEAREST_FIRST);
        return result;
    }

    public int size() {
        return size_;
    }

    /**
     * Answer the ids of every point within the radius of the target, the boundary included, in ascending id order
     */
    public IntArrayList within(Tuple2d target, double radius) {
        var result = new IntArrayList();
        within(root_, target, radius * radius, 0, result);
        result.sort();
        return result;
    }

    private Node makeTree(List<Node> nodes, int begin, int end, int index) {
        if (end <= begin)
            return null;
        int n = begin + (end - begin) / 2;
        Node node = QuickSelect.select(nodes, begin, end - 1, n, new NodeComparator(index));
        index = (index + 1) % DIMENSIONS;
        node.left_ = makeTree(nodes, begin, n, index);
        node.right_ = makeTree(nodes, n + 1, end, index);
        return node;
    }

    private void nearest(Node root, Tuple2d target, int k, int excludeId, int index, PriorityQueue<Neighbor> best) {
        if (root == null)
            return;
        if (root.id_ != excludeId) {
            var candidate = new Neighbor(root.id_, Math.sqrt(root.distanceSquared(target)));
            if (best.size() < k) {
                best.add(candidate);
            } else if (NEAREST_FIRST.compare(candidate, best.peek()) < 0) {
                best.poll();
                best.add(candidate);
            }
        }
        double dx = root.get(index) - (index == 0 ? target.x : target.y);
        int next = (index + 1) % DIMENSIONS;
        nearest(dx > 0 ? root.left_ : root.right_, target, k, excludeId, next, best);
        if (best.size() == k) {
            double worst = best.peek().distance();
            if (dx * dx > worst * worst)
                return;
        }
        nearest(dx > 0 ? root.right_ : root.left_, target, k, excludeId, next, best);
    }

    private void within(Node root, Tuple2d target, double radius2, int index, IntArrayList result) {
        if (root == null)
            return;
        if (root.distanceSquared(target) <= radius2) {
            result.add(root.id_);
        }
        double dx = root.get(index) - (index == 0 ? target.x : target.y);
        int next = (index + 1) % DIMENSIONS;
        if (dx >= 0 || dx * dx <= radius2) {
            within(root.left_, target, radius2, next, result);
        }
        if (dx <= 0 || dx * dx <= radius2) {
            within(root.right_, target, radius2, next, result);
        }
    }
}
