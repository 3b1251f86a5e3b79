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

package com.amazon.predictivemaintenance.anomalydetection;

import static com.amazon.predictivemaintenance.CommonUtils.ceilLog2;
import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;
import static com.amazon.predictivemaintenance.inputtypes.FeatureSchema.MISSING_VALUE_SENTINEL;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.BooleanSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.executor.AbstractTreeBuildExecutor;
import com.amazon.predictivemaintenance.executor.ParallelTreeBuildExecutor;
import com.amazon.predictivemaintenance.executor.SequentialTreeBuildExecutor;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.tree.IsolationTree;
import com.amazon.predictivemaintenance.util.ArrayUtils;

/**
 * Trains an {@link IsolationForest} on a baseline of feature vectors that are
 * assumed to be mostly normal.
 *
 * Each tree is grown on a subsample of {@code min(sampleSize, n)} vectors drawn
 * without replacement, with a height limit of {@code ceil(log2(subsample))}.
 * After growth the baseline is scored and the threshold is placed so that the
 * top {@code round(n * contamination)} baseline scores are above it.
 *
 * Given the same baseline and random seed, training returns the same forest
 * whether trees are built sequentially or in parallel.
 */
@Getter
@Slf4j
public class IsolationForestTrainer {

    public static final int DEFAULT_NUMBER_OF_TREES = 100;

    public static final int DEFAULT_SAMPLE_SIZE = 256;

    public static final double DEFAULT_CONTAMINATION = 0.05;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    /**
     * Smallest baseline accepted; a tree over a single point has no path length
     * to normalize against.
     */
    public static final int MIN_BASELINE_SIZE = 2;

    private final int numberOfTrees;

    private final int sampleSize;

    private final double contamination;

    private final long randomSeed;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    private final AbstractTreeBuildExecutor executor;

    protected IsolationForestTrainer(Builder<?> builder) {
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.sampleSize > 1, "sampleSize must be greater than 1");
        checkArgument(builder.contamination > 0 && builder.contamination < 0.5,
                "contamination must be in the open interval (0, 0.5)");
        this.numberOfTrees = builder.numberOfTrees;
        this.sampleSize = builder.sampleSize;
        this.contamination = builder.contamination;
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

    public IsolationForest train(List<FeatureVector> baseline) {
        return train(baseline, () -> false);
    }

    /**
     * train a forest
     *
     * @param baseline  vectors of one schema, assumed mostly normal
     * @param cancelled polled between trees
     * @return the calibrated forest
     * @throws java.util.concurrent.CancellationException if cancelled
     */
    public IsolationForest train(List<FeatureVector> baseline, BooleanSupplier cancelled) {
        checkNotNull(baseline, "baseline must not be null");
        checkArgument(baseline.size() >= MIN_BASELINE_SIZE,
                "at least " + MIN_BASELINE_SIZE + " baseline vectors are required");
        FeatureSchema schema = baseline.get(0).getSchema();
        int n = baseline.size();
        double[][] points = new double[n][];
        for (int i = 0; i < n; i++) {
            FeatureVector vector = baseline.get(i);
            checkArgument(schema.getFingerprint().equals(vector.getSchema().getFingerprint()),
                    "baseline mixes feature schemas");
            points[i] = vector.getValues();
        }

        int subsample = Math.min(sampleSize, n);
        int heightLimit = ceilLog2(subsample);
        Random random = new Random(randomSeed);
        long[] seeds = new long[numberOfTrees];
        for (int i = 0; i < numberOfTrees; i++) {
            seeds[i] = random.nextLong();
        }

        List<IsolationTree> trees = executor.buildAll(numberOfTrees, i -> {
            Random treeRandom = new Random(seeds[i]);
            int[] indices = ArrayUtils.identity(n);
            ArrayUtils.shufflePrefix(indices, subsample, treeRandom);
            return IsolationTree.grow(points, Arrays.copyOf(indices, subsample), heightLimit, treeRandom);
        }, cancelled);

        double[] mean = new double[schema.size()];
        double[] deviation = new double[schema.size()];
        baselineStatistics(points, mean, deviation);

        // placeholder threshold while the baseline is scored
        IsolationForest uncalibrated = new IsolationForest(schema, trees, subsample, contamination, 1.0, mean,
                deviation);
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = uncalibrated.score(points[i]);
        }
        double threshold = calibrate(scores, contamination);
        log.debug("trained isolation forest over {} vectors, {} trees, threshold {}", n, numberOfTrees, threshold);
        return new IsolationForest(schema, trees, subsample, contamination, threshold, mean, deviation);
    }

    /**
     * The threshold such that the top {@code round(n * contamination)} scores are
     * strictly above it. When the cut falls inside a block of equal scores,
     * either the whole block or none of it is flagged, whichever count is closer
     * to the target; an equal distance flags none of it. A baseline of
     * identical scores flags nothing.
     *
     * @param scores        baseline scores, reordered in place
     * @param contamination expected anomalous fraction
     * @return the threshold
     */
    static double calibrate(double[] scores, double contamination) {
        Arrays.sort(scores);
        int n = scores.length;
        int flagged = (int) Math.round(n * contamination);
        if (flagged == 0) {
            return scores[n - 1];
        }
        double cut = scores[n - flagged];
        // [first, end) holds the scores equal to the cut
        int first = n - flagged;
        while (first > 0 && scores[first - 1] == cut) {
            --first;
        }
        int end = n - flagged + 1;
        while (end < n && scores[end] == cut) {
            ++end;
        }
        int overshoot = (n - first) - flagged;
        int shortfall = flagged - (n - end);
        if (first > 0 && overshoot < shortfall) {
            return (scores[first - 1] + cut) / 2;
        }
        return (end == n) ? cut : (cut + scores[end]) / 2;
    }

    // sentinel values are left out; a feature that is always a sentinel keeps the
    // sentinel as its mean
    static void baselineStatistics(double[][] points, double[] mean, double[] deviation) {
        int dimensions = mean.length;
        for (int d = 0; d < dimensions; d++) {
            double sum = 0;
            int count = 0;
            for (double[] point : points) {
                if (point[d] != MISSING_VALUE_SENTINEL) {
                    sum += point[d];
                    ++count;
                }
            }
            if (count == 0) {
                mean[d] = MISSING_VALUE_SENTINEL;
                deviation[d] = 0;
                continue;
            }
            mean[d] = sum / count;
            double squares = 0;
            for (double[] point : points) {
                if (point[d] != MISSING_VALUE_SENTINEL) {
                    double difference = point[d] - mean[d];
                    squares += difference * difference;
                }
            }
            deviation[d] = (count > 1) ? Math.sqrt(squares / (count - 1)) : 0;
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = DEFAULT_SAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private Long randomSeed = null;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Integer threadPoolSize = null;

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T sampleSize(int sampleSize) {
            this.sampleSize = sampleSize;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
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

        public IsolationForestTrainer build() {
            return new IsolationForestTrainer(this);
        }
    }
}
