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
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.Random;

import com.amazon.predictivemaintenance.util.ArrayUtils;

/**
 * A binary classification tree with several outputs that share the same
 * splits. Splits minimize the summed Gini impurity of the outputs, weighted by
 * the size of each child. Leaves store the fraction of positive labels for
 * every output.
 *
 * At each node the features are visited in a random order. The best split over
 * the first {@code featuresPerSplit} features is used; if none of them admits a
 * split that reduces impurity, the search continues through the remaining
 * features. Points {@code x} with {@code x[feature] <= cut} go left, where the
 * cut is the midpoint of two consecutive distinct training values.
 */
public class DecisionTree {

    // required impurity decrease for a split to be accepted
    static final double MIN_IMPURITY_DECREASE = 1e-12;

    private final NodeStore nodeStore;

    public DecisionTree(NodeStore nodeStore) {
        this.nodeStore = checkNotNull(nodeStore, "nodeStore must not be null");
        checkArgument(nodeStore.getValueWidth() > 0, "decision trees need at least one output");
    }

    /**
     * grows a tree
     *
     * @param columns          training features by column, columns[feature][row]
     * @param labels           labels by row, labels[row][output] in {0, 1}
     * @param sampleIndices    rows used by this tree, repeats allowed; reordered in
     *                         place
     * @param maxDepth         maximum depth of a leaf
     * @param minLeafSize      minimum number of rows in a leaf
     * @param featuresPerSplit number of features examined before the search may
     *                         stop
     * @param random           source of randomness for this tree
     * @return the tree
     */
    public static DecisionTree grow(double[][] columns, double[][] labels, int[] sampleIndices, int maxDepth,
            int minLeafSize, int featuresPerSplit, Random random) {
        checkArgument(columns.length > 0, "at least one feature is required");
        checkArgument(sampleIndices.length > 0, "a tree needs at least one row");
        checkArgument(maxDepth >= 0, "maxDepth cannot be negative");
        checkArgument(minLeafSize > 0, "minLeafSize must be positive");
        checkArgument(featuresPerSplit > 0 && featuresPerSplit <= columns.length, "incorrect featuresPerSplit");
        int outputs = labels[sampleIndices[0]].length;
        NodeStoreWriter writer = new NodeStoreWriter(2 * sampleIndices.length - 1, outputs);
        Grower grower = new Grower(columns, labels, sampleIndices, maxDepth, minLeafSize, featuresPerSplit, random,
                writer, outputs);
        grower.grow(writer.allocate(), 0, sampleIndices.length, 0);
        return new DecisionTree(writer.toNodeStore());
    }

    public double[] predict(double[] point) {
        double[] answer = new double[nodeStore.getValueWidth()];
        nodeStore.addLeafValues(nodeStore.findLeaf(point), answer);
        return answer;
    }

    /**
     * adds the leaf values reached by the point into the accumulator
     *
     * @param point       a point of the training dimension
     * @param accumulator array with one entry per output
     */
    public void addPrediction(double[] point, double[] accumulator) {
        nodeStore.addLeafValues(nodeStore.findLeaf(point), accumulator);
    }

    public int getOutputs() {
        return nodeStore.getValueWidth();
    }

    public NodeStore getNodeStore() {
        return nodeStore;
    }

    private static class Grower {
        private final double[][] columns;
        private final double[][] labels;
        private final int[] indices;
        private final int maxDepth;
        private final int minLeafSize;
        private final int featuresPerSplit;
        private final Random random;
        private final NodeStoreWriter writer;
        private final int outputs;
        private final int[] featureOrder;
        private final int[] scratch;
        private final double[] leftSums;
        private final double[] totalSums;

        Grower(double[][] columns, double[][] labels, int[] indices, int maxDepth, int minLeafSize,
                int featuresPerSplit, Random random, NodeStoreWriter writer, int outputs) {
            this.columns = columns;
            this.labels = labels;
            this.indices = indices;
            this.maxDepth = maxDepth;
            this.minLeafSize = minLeafSize;
            this.featuresPerSplit = featuresPerSplit;
            this.random = random;
            this.writer = writer;
            this.outputs = outputs;
            this.featureOrder = ArrayUtils.identity(columns.length);
            this.scratch = new int[indices.length];
            this.leftSums = new double[outputs];
            this.totalSums = new double[outputs];
        }

        void grow(int node, int from, int to, int depth) {
            int mass = to - from;
            double[] sums = new double[outputs];
            for (int i = from; i < to; i++) {
                double[] label = labels[indices[i]];
                for (int k = 0; k < outputs; k++) {
                    sums[k] += label[k];
                }
            }
            double impurity = impurity(sums, mass);
            if (depth >= maxDepth || mass < 2 * minLeafSize || impurity <= MIN_IMPURITY_DECREASE) {
                makeLeaf(node, mass, sums);
                return;
            }
            System.arraycopy(sums, 0, totalSums, 0, outputs);

            ArrayUtils.shufflePrefix(featureOrder, featureOrder.length, random);
            int bestFeature = -1;
            double bestCut = 0;
            double bestScore = impurity - MIN_IMPURITY_DECREASE;
            for (int f = 0; f < featureOrder.length; f++) {
                if (f >= featuresPerSplit && bestFeature >= 0) {
                    break;
                }
                int feature = featureOrder[f];
                double[] candidate = bestSplit(feature, from, to, bestScore);
                if (candidate != null) {
                    bestScore = candidate[0];
                    bestCut = candidate[1];
                    bestFeature = feature;
                }
            }
            if (bestFeature < 0) {
                makeLeaf(node, mass, sums);
                return;
            }
            int split = partition(from, to, bestFeature, bestCut);
            int left = writer.allocate();
            int right = writer.allocate();
            writer.setInternal(node, mass, bestFeature, bestCut, left, right);
            grow(left, from, split, depth + 1);
            grow(right, split, to, depth + 1);
        }

        void makeLeaf(int node, int mass, double[] sums) {
            double[] fractions = new double[outputs];
            for (int k = 0; k < outputs; k++) {
                fractions[k] = sums[k] / mass;
            }
            writer.setLeaf(node, mass, fractions);
        }

        /**
         * @return {score, cut} of the best split on the feature that beats the
         *         given score, or null
         */
        double[] bestSplit(int feature, int from, int to, double scoreToBeat) {
            double[] keys = columns[feature];
            System.arraycopy(indices, from, scratch, from, to - from);
            ArrayUtils.sortByKey(scratch, keys, from, to);
            if (keys[scratch[from]] == keys[scratch[to - 1]]) {
                return null;
            }
            int mass = to - from;
            Arrays.fill(leftSums, 0);
            double[] answer = null;
            double best = scoreToBeat;
            for (int i = from; i < to - 1; i++) {
                double[] label = labels[scratch[i]];
                for (int k = 0; k < outputs; k++) {
                    leftSums[k] += label[k];
                }
                int leftCount = i - from + 1;
                int rightCount = mass - leftCount;
                double current = keys[scratch[i]];
                double next = keys[scratch[i + 1]];
                if (current == next || leftCount < minLeafSize || rightCount < minLeafSize) {
                    continue;
                }
                double score = (leftCount * leftImpurity(leftCount) + rightCount * rightImpurity(rightCount)) / mass;
                if (score < best) {
                    best = score;
                    double cut = current + (next - current) / 2;
                    if (cut >= next) {
                        cut = current;
                    }
                    answer = new double[] { score, cut };
                }
            }
            return answer;
        }

        double leftImpurity(int count) {
            return impurity(leftSums, count);
        }

        double rightImpurity(int count) {
            double sum = 0;
            for (int k = 0; k < outputs; k++) {
                double p = (totalSums[k] - leftSums[k]) / count;
                sum += 2 * p * (1 - p);
            }
            return sum;
        }

        // summed binary Gini impurity over the outputs
        static double impurity(double[] sums, int count) {
            double sum = 0;
            for (double positives : sums) {
                double p = positives / count;
                sum += 2 * p * (1 - p);
            }
            return sum;
        }

        int partition(int from, int to, int feature, double cut) {
            double[] keys = columns[feature];
            int i = from;
            int j = to - 1;
            while (i <= j) {
                if (keys[indices[i]] <= cut) {
                    ++i;
                } else {
                    ArrayUtils.swap(indices, i, j--);
                }
            }
            return i;
        }
    }
}
