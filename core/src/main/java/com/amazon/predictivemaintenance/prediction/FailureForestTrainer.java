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

package com.amazon.predictivemaintenance.prediction;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.exceptions.InsufficientLabelsException;
import com.amazon.predictivemaintenance.executor.AbstractTreeBuildExecutor;
import com.amazon.predictivemaintenance.executor.ParallelTreeBuildExecutor;
import com.amazon.predictivemaintenance.executor.SequentialTreeBuildExecutor;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.tree.DecisionTree;

/**
 * Trains a {@link FailureForest}. Every tree is grown on a bootstrap sample of
 * the examples (drawn with replacement, as many draws as examples) and
 * considers {@code featuresPerSplit} randomly ordered features per split,
 * {@code ceil(sqrt(d))} unless configured.
 */
@Getter
@Slf4j
public class FailureForestTrainer {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_MAX_DEPTH = 12;

    public static final int DEFAULT_MIN_LEAF_SIZE = 2;

    public static final int DEFAULT_MIN_POSITIVE_EXAMPLES = 5;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final int numberOfTrees;

    private final int maxDepth;

    private final int minLeafSize;

    // null means ceil(sqrt(d))
    private final Integer featuresPerSplit;

    private final int minPositiveExamples;

    private final long randomSeed;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final AbstractTreeBuildExecutor executor;

    protected FailureForestTrainer(Builder<?> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.maxDepth > 0, "maxDepth must be greater than 0");
        checkArgument(builder.minLeafSize > 0, "minLeafSize must be greater than 0");
        checkArgument(builder.minPositiveExamples > 0, "minPositiveExamples must be greater than 0");
        checkArgument(builder.featuresPerSplit == null || builder.featuresPerSplit > 0,
                "featuresPerSplit must be greater than 0");
        this.numberOfTrees = builder.numberOfTrees;
        this.maxDepth = builder.maxDepth;
        this.minLeafSize = builder.minLeafSize;
        this.featuresPerSplit = builder.featuresPerSplit;
        this.minPositiveExamples = builder.minPositiveExamples;
        this.randomSeed = (builder.randomSeed == null) ? new Random().nextLong() : builder.randomSeed;
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            this.threadPoolSize = (builder.threadPoolSize == null)
                    ? Math.max(1, Runtime.getRuntime().availableProcessors() - 1)
                    : builder.threadPoolSize;
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
            this.executor = new ParallelTreeBuildExecutor(threadPoolSize);
        } else {
            this.threadPoolSize = 0;
            this.executor = new SequentialTreeBuildExecutor();
        }
    }

    public FailureForest train(LabeledDataset data, String scope) {
        return train(data, scope, () -> false);
    }

    /**
     * train a forest
     *
     * @param data      labeled examples of one schema
     * @param scope     training scope, reported in exceptions
     * @param cancelled polled between trees
     * @return the forest
     * @throws InsufficientLabelsException                if fewer than
     *                                                    {@code minPositiveExamples}
     *                                                    examples are positive at
     *                                                    the longest horizon
     * @throws java.util.concurrent.CancellationException if cancelled
     */
    public FailureForest train(LabeledDataset data, String scope, BooleanSupplier cancelled) {
        checkNotNull(data, "data must not be null");
        int positives = data.positives();
        if (positives < minPositiveExamples) {
            throw new InsufficientLabelsException(scope, positives, minPositiveExamples);
        }
        List<LabeledExample> examples = data.getExamples();
        FeatureSchema schema = examples.get(0).getVector().getSchema();
        int n = examples.size();
        int dimensions = schema.size();
        int outputs = data.getHorizons().length;

        double[][] columns = new double[dimensions][n];
        double[][] labels = new double[n][outputs];
        for (int i = 0; i < n; i++) {
            LabeledExample example = examples.get(i);
            checkArgument(schema.getFingerprint().equals(example.getVector().getSchema().getFingerprint()),
                    "examples mix feature schemas");
            for (int d = 0; d < dimensions; d++) {
                columns[d][i] = example.getVector().get(d);
            }
            for (int k = 0; k < outputs; k++) {
                labels[i][k] = example.isPositive(k) ? 1.0 : 0.0;
            }
        }

        int perSplit = (featuresPerSplit == null) ? (int) Math.ceil(Math.sqrt(dimensions))
                : Math.min(featuresPerSplit, dimensions);
        Random random = new Random(randomSeed);
        long[] seeds = new long[numberOfTrees];
        for (int i = 0; i < numberOfTrees; i++) {
            seeds[i] = random.nextLong();
        }

        List<DecisionTree> trees = executor.buildAll(numberOfTrees, i -> {
            Random treeRandom = new Random(seeds[i]);
            int[] bootstrap = new int[n];
            for (int j = 0; j < n; j++) {
                bootstrap[j] = treeRandom.nextInt(n);
            }
            return DecisionTree.grow(columns, labels, bootstrap, maxDepth, minLeafSize, perSplit, treeRandom);
        }, cancelled);
        log.debug("trained failure forest for {} over {} examples ({} positive), {} trees", scope, n, positives,
                numberOfTrees);
        return new FailureForest(schema, data.getHorizons(), trees);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int minLeafSize = DEFAULT_MIN_LEAF_SIZE;
        private Integer featuresPerSplit = null;
        private int minPositiveExamples = DEFAULT_MIN_POSITIVE_EXAMPLES;
        private Long randomSeed = null;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Integer threadPoolSize = null;

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return (T) this;
        }

        public T minLeafSize(int minLeafSize) {
            this.minLeafSize = minLeafSize;
            return (T) this;
        }

        public T featuresPerSplit(int featuresPerSplit) {
            this.featuresPerSplit = featuresPerSplit;
            return (T) this;
        }

        public T minPositiveExamples(int minPositiveExamples) {
            this.minPositiveExamples = minPositiveExamples;
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return (T) this;
        }

        public FailureForestTrainer build() {
            return new FailureForestTrainer(this);
        }
    }
}
