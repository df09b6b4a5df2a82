/*
 * Copyright 2026 Velora Contributors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.velora.ensemble.tree;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.Random;

/**
 * A randomized space-partitioning tree grown on a sample of points. Every
 * internal node cuts a randomly chosen feature, among the features that still
 * vary inside the node, at a uniformly random position between their minimum
 * and maximum. Growth stops at the depth limit or when a node holds a single
 * point or only identical points. Once grown the tree is immutable.
 */
public class IsolationTree {

    /**
     * the Euler-Mascheroni constant
     */
    static final double EULER_CONSTANT = 0.5772156649015329;

    private final Node root;

    private final int maxDepth;

    private final int sampleSize;

    private IsolationTree(Node root, int maxDepth, int sampleSize) {
        this.root = root;
        this.maxDepth = maxDepth;
        this.sampleSize = sampleSize;
    }

    /**
     * Grows a tree.
     *
     * @param sample   the points the tree is grown on; they are read, not kept
     * @param maxDepth the depth at which every node becomes a leaf
     * @param rng      the source of randomness for features and cut positions
     * @return the grown tree
     */
    public static IsolationTree grow(double[][] sample, int maxDepth, Random rng) {
        checkNotNull(sample, "sample must not be null");
        checkNotNull(rng, "rng must not be null");
        checkArgument(sample.length > 0, "sample must not be empty");
        checkArgument(maxDepth >= 0, "maxDepth must be non-negative");
        int[] positions = new int[sample.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        Node root = new Builder(sample, positions, maxDepth, rng).grow(0, positions.length, 0);
        return new IsolationTree(root, maxDepth, sample.length);
    }

    /**
     * The path length of a point: the number of cuts traversed to reach its leaf,
     * plus the expected number of further cuts needed to single it out among the
     * sample points that share the leaf.
     *
     * @param point the query point
     * @return the adjusted path length
     */
    public double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (node.cut != null) {
            node = Cut.isLeftOf(point, node.cut) ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.mass);
    }

    /**
     * The average path length of an unsuccessful search in a binary search tree
     * of {@code n} points, used to normalize path lengths.
     *
     * @param n number of points
     * @return 0 for n at most 1, 1 for n equal to 2, otherwise
     *         {@code 2 H(n - 1) - 2 (n - 1) / n}
     */
    public static double averagePathLength(double n) {
        if (n <= 1) {
            return 0;
        }
        if (n <= 2) {
            return 1;
        }
        return 2.0 * (Math.log(n - 1) + EULER_CONSTANT) - 2.0 * (n - 1) / n;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    /**
     * @return the number of nodes, internal and leaves
     */
    public int size() {
        return count(root);
    }

    private static int count(Node node) {
        return (node.cut == null) ? 1 : 1 + count(node.left) + count(node.right);
    }

    static class Node {
        final Cut cut;
        final Node left;
        final Node right;
        final int mass;

        Node(Cut cut, Node left, Node right, int mass) {
            this.cut = cut;
            this.left = left;
            this.right = right;
            this.mass = mass;
        }

        static Node leaf(int mass) {
            return new Node(null, null, null, mass);
        }
    }

    private static class Builder {
        private final double[][] points;
        private final int[] positions;
        private final int maxDepth;
        private final Random rng;
        private final int dimensions;

        Builder(double[][] points, int[] positions, int maxDepth, Random rng) {
            this.points = points;
            this.positions = positions;
            this.maxDepth = maxDepth;
            this.rng = rng;
            this.dimensions = points[0].length;
        }

        // grows the node holding positions[from, to)
        Node grow(int from, int to, int depth) {
            int mass = to - from;
            if (depth >= maxDepth || mass <= 1) {
                return Node.leaf(mass);
            }
            double[] min = new double[dimensions];
            double[] max = new double[dimensions];
            int[] candidates = new int[dimensions];
            int numberOfCandidates = 0;
            for (int f = 0; f < dimensions; f++) {
                min[f] = Double.POSITIVE_INFINITY;
                max[f] = Double.NEGATIVE_INFINITY;
                for (int i = from; i < to; i++) {
                    double value = points[positions[i]][f];
                    min[f] = Math.min(min[f], value);
                    max[f] = Math.max(max[f], value);
                }
                if (max[f] > min[f]) {
                    candidates[numberOfCandidates++] = f;
                }
            }
            if (numberOfCandidates == 0) {
                return Node.leaf(mass);
            }
            int feature = candidates[rng.nextInt(numberOfCandidates)];
            double value = min[feature] + rng.nextDouble() * (max[feature] - min[feature]);
            Cut cut = new Cut(feature, value);

            // in-place partition: points left of the cut first
            int boundary = from;
            for (int i = from; i < to; i++) {
                if (Cut.isLeftOf(points[positions[i]], cut)) {
                    int swap = positions[boundary];
                    positions[boundary] = positions[i];
                    positions[i] = swap;
                    boundary++;
                }
            }
            if (boundary == from || boundary == to) {
                // the cut rounded onto an extreme value
                return Node.leaf(mass);
            }
            Node left = grow(from, boundary, depth + 1);
            Node right = grow(boundary, to, depth + 1);
            return new Node(cut, left, right, mass);
        }
    }
}
