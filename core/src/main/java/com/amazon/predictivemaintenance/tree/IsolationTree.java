/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
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

package com.amazon.predictivemaintenance.tree;

import static com.amazon.predictivemaintenance.CommonUtils.averagePathLength;
import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Random;

/**
 * A single isolation tree. Each internal node cuts a uniformly chosen
 * dimension (among the dimensions that still vary within the node) at a
 * uniformly chosen value between the node's minimum and maximum. Points
 * {@code x} with {@code x[dim] <= cut} go left. Growth stops at the height
 * limit or when a node holds a single distinct point.
 */
public class IsolationTree {

    private final NodeStore nodeStore;

    public IsolationTree(NodeStore nodeStore) {
        this.nodeStore = checkNotNull(nodeStore, "nodeStore must not be null");
        checkArgument(nodeStore.getValueWidth() == 0, "isolation trees carry no leaf values");
    }

    /**
     * grows a tree over a subsample
     *
     * @param points        all training points, rows of equal length
     * @param sampleIndices rows used by this tree; reordered in place
     * @param heightLimit   maximum depth of a leaf
     * @param random        source of randomness for this tree
     * @return the tree
     */
    public static IsolationTree grow(double[][] points, int[] sampleIndices, int heightLimit, Random random) {
        checkArgument(sampleIndices.length > 0, "a tree needs at least one point");
        checkArgument(heightLimit >= 0, "heightLimit cannot be negative");
        NodeStoreWriter writer = new NodeStoreWriter(2 * sampleIndices.length - 1, 0);
        Grower grower = new Grower(points, sampleIndices, heightLimit, random, writer);
        grower.grow(writer.allocate(), 0, sampleIndices.length, 0);
        return new IsolationTree(writer.toNodeStore());
    }

    /**
     * the isolation depth of a point: the number of edges to the leaf it reaches,
     * plus the expected remaining depth for the training points sharing that leaf
     *
     * @param point a point of the training dimension
     * @return the adjusted path length
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (!nodeStore.isLeaf(node)) {
            node = nodeStore.leftOf(node, point) ? nodeStore.getLeftIndex(node) : nodeStore.getRightIndex(node);
            ++depth;
        }
        return depth + averagePathLength(nodeStore.getMass(node));
    }

    public NodeStore getNodeStore() {
        return nodeStore;
    }

    public int getMass() {
        return nodeStore.getMass(0);
    }

    private static class Grower {
        private final double[][] points;
        private final int[] indices;
        private final int heightLimit;
        private final Random random;
        private final NodeStoreWriter writer;
        private final int dimensions;
        private final double[] low;
        private final double[] high;
        private final int[] candidates;

        Grower(double[][] points, int[] indices, int heightLimit, Random random, NodeStoreWriter writer) {
            this.points = points;
            this.indices = indices;
            this.heightLimit = heightLimit;
            this.random = random;
            this.writer = writer;
            this.dimensions = points[indices[0]].length;
            this.low = new double[dimensions];
            this.high = new double[dimensions];
            this.candidates = new int[dimensions];
        }

        void grow(int node, int from, int to, int depth) {
            int mass = to - from;
            if (depth >= heightLimit || mass <= 1) {
                writer.setLeaf(node, mass, null);
                return;
            }
            int varying = boundingBox(from, to);
            if (varying == 0) {
                writer.setLeaf(node, mass, null);
                return;
            }
            int dimension = candidates[random.nextInt(varying)];
            double min = low[dimension];
            double max = high[dimension];
            double cut = min + random.nextDouble() * (max - min);
            if (cut >= max) {
                cut = min;
            }
            int split = partition(from, to, dimension, cut);
            int left = writer.allocate();
            int right = writer.allocate();
            writer.setInternal(node, mass, dimension, cut, left, right);
            grow(left, from, split, depth + 1);
            grow(right, split, to, depth + 1);
        }

        // fills low/high and the list of dimensions with spread, returns its length
        int boundingBox(int from, int to) {
            double[] first = points[indices[from]];
            System.arraycopy(first, 0, low, 0, dimensions);
            System.arraycopy(first, 0, high, 0, dimensions);
            for (int i = from + 1; i < to; i++) {
                double[] point = points[indices[i]];
                for (int d = 0; d < dimensions; d++) {
                    low[d] = Math.min(low[d], point[d]);
                    high[d] = Math.max(high[d], point[d]);
                }
            }
            int count = 0;
            for (int d = 0; d < dimensions; d++) {
                if (high[d] > low[d]) {
                    candidates[count++] = d;
                }
            }
            return count;
        }

        int partition(int from, int to, int dimension, double cut) {
            int i = from;
            int j = to - 1;
            while (i <= j) {
                if (points[indices[i]][dimension] <= cut) {
                    ++i;
                } else {
                    int temp = indices[i];
                    indices[i] = indices[j];
                    indices[j--] = temp;
                }
            }
            return i;
        }
    }
}
