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

import static com.amazon.predictivemaintenance.CommonUtils.averagePathLength;
import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.tree.IsolationTree;

/**
 * A trained isolation forest with its calibration. The anomaly score of a point
 * is {@code 2^(-E[h(x)] / c(n))}, where {@code E[h(x)]} is the mean adjusted
 * path length over the trees and {@code c(n)} is the average path length of an
 * unsuccessful search in a tree over {@code n} points. Scores lie in [0, 1];
 * higher means more anomalous. A point is anomalous when its score is strictly
 * above the calibrated threshold.
 *
 * The baseline mean and deviation of every feature are kept for attribution.
 */
public class IsolationForest implements ITrainedModel {

    private final FeatureSchema schema;

    private final List<IsolationTree> trees;

    // number of points each tree was grown on
    private final int sampleSize;

    private final double contamination;

    private final double threshold;

    private final double[] baselineMean;

    private final double[] baselineDeviation;

    private final double normalizer;

    public IsolationForest(FeatureSchema schema, List<IsolationTree> trees, int sampleSize, double contamination,
            double threshold, double[] baselineMean, double[] baselineDeviation) {
        this.schema = checkNotNull(schema, "schema must not be null");
        checkNotNull(trees, "trees must not be null");
        checkArgument(!trees.isEmpty(), "a forest needs at least one tree");
        checkArgument(sampleSize > 1, "sampleSize must be at least 2");
        checkArgument(contamination > 0 && contamination < 0.5, "contamination must be in (0, 0.5)");
        checkArgument(threshold >= 0 && threshold <= 1, "threshold must be in [0, 1]");
        checkArgument(baselineMean != null && baselineMean.length == schema.size(), "incorrect baseline mean");
        checkArgument(baselineDeviation != null && baselineDeviation.length == schema.size(),
                "incorrect baseline deviation");
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        this.sampleSize = sampleSize;
        this.contamination = contamination;
        this.threshold = threshold;
        this.baselineMean = Arrays.copyOf(baselineMean, baselineMean.length);
        this.baselineDeviation = Arrays.copyOf(baselineDeviation, baselineDeviation.length);
        this.normalizer = averagePathLength(sampleSize);
    }

    @Override
    public ModelKind getModelKind() {
        return ModelKind.ANOMALY;
    }

    @Override
    public FeatureSchema getSchema() {
        return schema;
    }

    /**
     * score a feature vector
     *
     * @param vector a vector of the training schema
     * @return the anomaly score in [0, 1]
     * @throws IllegalArgumentException if the vector's schema differs from the
     *                                  training schema
     */
    public double score(FeatureVector vector) {
        checkNotNull(vector, "vector must not be null");
        checkArgument(schema.getFingerprint().equals(vector.getSchema().getFingerprint()),
                "schema " + vector.getSchema().getFingerprint() + " does not match model schema "
                        + schema.getFingerprint());
        return score(vector.getValues());
    }

    public double score(double[] point) {
        checkArgument(point.length == schema.size(), "incorrect dimension");
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        return Math.pow(2, -(sum / trees.size()) / normalizer);
    }

    public boolean isAnomalous(double score) {
        return score > threshold;
    }

    public List<IsolationTree> getTrees() {
        return trees;
    }

    public int getNumberOfTrees() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public double getThreshold() {
        return threshold;
    }

    public double[] getBaselineMean() {
        return Arrays.copyOf(baselineMean, baselineMean.length);
    }

    public double[] getBaselineDeviation() {
        return Arrays.copyOf(baselineDeviation, baselineDeviation.length);
    }

    double baselineMean(int index) {
        return baselineMean[index];
    }

    double baselineDeviation(int index) {
        return baselineDeviation[index];
    }
}
