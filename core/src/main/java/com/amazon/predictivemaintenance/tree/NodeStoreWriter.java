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

import static com.amazon.predictivemaintenance.tree.NodeStore.NULL;

import java.util.Arrays;

/**
 * Growable columns used while a tree is being built. Nodes are allocated in
 * creation order, so a child always has a larger index than its parent.
 */
class NodeStoreWriter {

    private int[] leftIndex;
    private int[] rightIndex;
    private int[] cutDimension;
    private double[] cutValue;
    private int[] mass;
    private double[] leafValues;
    private final int valueWidth;
    private int size;

    NodeStoreWriter(int initialCapacity, int valueWidth) {
        int capacity = Math.max(1, initialCapacity);
        this.valueWidth = valueWidth;
        leftIndex = new int[capacity];
        rightIndex = new int[capacity];
        cutDimension = new int[capacity];
        cutValue = new double[capacity];
        mass = new int[capacity];
        leafValues = new double[capacity * valueWidth];
    }

    int allocate() {
        if (size == leftIndex.length) {
            int capacity = 2 * size;
            leftIndex = Arrays.copyOf(leftIndex, capacity);
            rightIndex = Arrays.copyOf(rightIndex, capacity);
            cutDimension = Arrays.copyOf(cutDimension, capacity);
            cutValue = Arrays.copyOf(cutValue, capacity);
            mass = Arrays.copyOf(mass, capacity);
            leafValues = Arrays.copyOf(leafValues, capacity * valueWidth);
        }
        leftIndex[size] = NULL;
        rightIndex[size] = NULL;
        cutDimension[size] = NULL;
        return size++;
    }

    void setLeaf(int node, int nodeMass, double[] values) {
        mass[node] = nodeMass;
        if (valueWidth > 0) {
            System.arraycopy(values, 0, leafValues, node * valueWidth, valueWidth);
        }
    }

    void setInternal(int node, int nodeMass, int dimension, double cut, int left, int right) {
        mass[node] = nodeMass;
        cutDimension[node] = dimension;
        cutValue[node] = cut;
        leftIndex[node] = left;
        rightIndex[node] = right;
    }

    NodeStore toNodeStore() {
        return NodeStore.builder().leftIndex(Arrays.copyOf(leftIndex, size))
                .rightIndex(Arrays.copyOf(rightIndex, size)).cutDimension(Arrays.copyOf(cutDimension, size))
                .cutValues(Arrays.copyOf(cutValue, size)).mass(Arrays.copyOf(mass, size))
                .leafValues(Arrays.copyOf(leafValues, size * valueWidth)).valueWidth(valueWidth).build();
    }
}
