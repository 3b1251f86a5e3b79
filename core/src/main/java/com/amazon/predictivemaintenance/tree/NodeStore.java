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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * A fixed-size buffer holding the nodes of one decision tree. A node is defined
 * by its children, its cut (dimension and value), the number of training points
 * that reached it, and, for leaves, a vector of leaf values. The NodeStore class
 * uses one array per field; an index in the store looks up the field values of
 * a particular node. The root is always at index 0.
 *
 * If we think of an array of Node objects as being row-oriented (where each row
 * is a Node), then this class is analogous to a column-oriented database of
 * Nodes. This layout is also the serialized layout of a tree.
 *
 * Leaves are marked by {@link #NULL} in the cut dimension and child arrays.
 * Leaf values occupy {@code valueWidth} consecutive slots per node; isolation
 * trees use a width of zero.
 */
public class NodeStore {

    public static final int NULL = -1;

    private final int size;

    private final int valueWidth;

    private final int[] leftIndex;

    private final int[] rightIndex;

    private final int[] cutDimension;

    private final double[] cutValue;

    private final int[] mass;

    private final double[] leafValues;

    protected NodeStore(Builder<?> builder) {
        checkArgument(builder.leftIndex != null, "leftIndex must be provided");
        size = builder.leftIndex.length;
        checkArgument(size > 0, "a tree has at least one node");
        checkArgument(builder.rightIndex != null && builder.rightIndex.length == size,
                " incorrect length of right indices");
        checkArgument(builder.cutDimension != null && builder.cutDimension.length == size,
                " incorrect length of cut dimensions");
        checkArgument(builder.cutValues != null && builder.cutValues.length == size, "incorrect length of cut values");
        checkArgument(builder.mass != null && builder.mass.length == size, "incorrect length of mass");
        checkArgument(builder.valueWidth >= 0, "valueWidth cannot be negative");
        double[] values = (builder.leafValues == null) ? new double[0] : builder.leafValues;
        checkArgument(values.length == size * builder.valueWidth, "incorrect length of leaf values");
        for (int i = 0; i < size; i++) {
            int left = builder.leftIndex[i];
            int right = builder.rightIndex[i];
            if (builder.cutDimension[i] == NULL) {
                checkArgument(left == NULL && right == NULL, "leaf " + i + " cannot have children");
            } else {
                // children always follow their parent, which rules out cycles
                checkArgument(left > i && left < size && right > i && right < size,
                        "incorrect children of node " + i);
            }
        }
        this.valueWidth = builder.valueWidth;
        this.leftIndex = builder.leftIndex;
        this.rightIndex = builder.rightIndex;
        this.cutDimension = builder.cutDimension;
        this.cutValue = builder.cutValues;
        this.mass = builder.mass;
        this.leafValues = values;
    }

    public boolean isLeaf(int index) {
        return cutDimension[index] == NULL;
    }

    public int getLeftIndex(int index) {
        return leftIndex[index];
    }

    public int getRightIndex(int index) {
        return rightIndex[index];
    }

    public int getCutDimension(int index) {
        return cutDimension[index];
    }

    public double getCutValue(int index) {
        return cutValue[index];
    }

    public int getMass(int index) {
        return mass[index];
    }

    public boolean leftOf(int index, double[] point) {
        return point[cutDimension[index]] <= cutValue[index];
    }

    /**
     * follows the cuts from the root down to a leaf
     *
     * @param point a point of the tree's dimension
     * @return index of the leaf reached by the point
     */
    public int findLeaf(double[] point) {
        int node = 0;
        while (!isLeaf(node)) {
            node = leftOf(node, point) ? leftIndex[node] : rightIndex[node];
        }
        return node;
    }

    /**
     * @param point a point of the tree's dimension
     * @return the number of edges from the root to the leaf reached by the point
     */
    public int depthOf(double[] point) {
        int node = 0;
        int depth = 0;
        while (!isLeaf(node)) {
            node = leftOf(node, point) ? leftIndex[node] : rightIndex[node];
            ++depth;
        }
        return depth;
    }

    public double getLeafValue(int index, int position) {
        checkArgument(position >= 0 && position < valueWidth, "incorrect leaf value position");
        return leafValues[index * valueWidth + position];
    }

    /**
     * adds the leaf values of a node into an accumulator
     *
     * @param index       a leaf
     * @param accumulator array of length valueWidth
     */
    public void addLeafValues(int index, double[] accumulator) {
        int offset = index * valueWidth;
        for (int i = 0; i < valueWidth; i++) {
            accumulator[i] += leafValues[offset + i];
        }
    }

    public int size() {
        return size;
    }

    public int getValueWidth() {
        return valueWidth;
    }

    public int[] getLeftIndex() {
        return Arrays.copyOf(leftIndex, size);
    }

    public int[] getRightIndex() {
        return Arrays.copyOf(rightIndex, size);
    }

    public int[] getCutDimension() {
        return Arrays.copyOf(cutDimension, size);
    }

    public double[] getCutValues() {
        return Arrays.copyOf(cutValue, size);
    }

    public int[] getMass() {
        return Arrays.copyOf(mass, size);
    }

    public double[] getLeafValues() {
        return Arrays.copyOf(leafValues, leafValues.length);
    }

    /**
     * a builder
     */

    public static class Builder<T extends Builder<T>> {
        protected int[] leftIndex;
        protected int[] rightIndex;
        protected int[] cutDimension;
        protected double[] cutValues;
        protected int[] mass;
        protected double[] leafValues;
        protected int valueWidth;

        public T leftIndex(int[] leftIndex) {
            this.leftIndex = leftIndex;
            return (T) this;
        }

        public T rightIndex(int[] rightIndex) {
            this.rightIndex = rightIndex;
            return (T) this;
        }

        public T cutDimension(int[] cutDimension) {
            this.cutDimension = cutDimension;
            return (T) this;
        }

        public T cutValues(double[] cutValues) {
            this.cutValues = cutValues;
            return (T) this;
        }

        public T mass(int[] mass) {
            this.mass = mass;
            return (T) this;
        }

        public T leafValues(double[] leafValues) {
            this.leafValues = leafValues;
            return (T) this;
        }

        public T valueWidth(int valueWidth) {
            this.valueWidth = valueWidth;
            return (T) this;
        }

        public NodeStore build() {
            return new NodeStore(this);
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }
}
