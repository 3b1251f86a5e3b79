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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.tree.DecisionTree;

/**
 * A bagged ensemble of multi-output decision trees estimating, for each
 * horizon, the probability that the equipment fails within the horizon.
 * Probabilities are the mean of the trees' leaf fractions, made non-decreasing
 * across horizons.
 */
public class FailureForest implements ITrainedModel {

    private final FeatureSchema schema;

    private final long[] horizons;

    private final List<DecisionTree> trees;

    public FailureForest(FeatureSchema schema, long[] horizons, List<DecisionTree> trees) {
        this.schema = checkNotNull(schema, "schema must not be null");
        checkNotNull(horizons, "horizons must not be null");
        checkNotNull(trees, "trees must not be null");
        checkArgument(horizons.length > 0, "at least one horizon is required");
        checkArgument(!trees.isEmpty(), "a forest needs at least one tree");
        for (int i = 1; i < horizons.length; i++) {
            checkArgument(horizons[i] > horizons[i - 1], "horizons must be strictly increasing");
        }
        for (DecisionTree tree : trees) {
            checkArgument(tree.getOutputs() == horizons.length, "tree outputs do not match the horizons");
        }
        this.horizons = horizons.clone();
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
    }

    @Override
    public ModelKind getModelKind() {
        return ModelKind.FAILURE;
    }

    @Override
    public FeatureSchema getSchema() {
        return schema;
    }

    /**
     * @param vector a vector of the training schema
     * @return one probability per horizon, non-decreasing
     * @throws IllegalArgumentException if the vector's schema differs from the
     *                                  training schema
     */
    public double[] probabilities(FeatureVector vector) {
        checkNotNull(vector, "vector must not be null");
        checkArgument(schema.getFingerprint().equals(vector.getSchema().getFingerprint()),
                "schema " + vector.getSchema().getFingerprint() + " does not match model schema "
                        + schema.getFingerprint());
        return probabilities(vector.getValues());
    }

    public double[] probabilities(double[] point) {
        checkArgument(point.length == schema.size(), "incorrect dimension");
        double[] answer = new double[horizons.length];
        for (DecisionTree tree : trees) {
            tree.addPrediction(point, answer);
        }
        for (int i = 0; i < answer.length; i++) {
            answer[i] = Math.min(1.0, answer[i] / trees.size());
            if (i > 0) {
                answer[i] = Math.max(answer[i], answer[i - 1]);
            }
        }
        return answer;
    }

    /**
     * How closely the trees agree on a point: one minus twice the mean, over
     * the horizons, of the standard deviation of the trees' leaf fractions.
     * Leaf fractions lie in [0, 1], so their standard deviation is at most 0.5.
     *
     * @param point a point of the training dimension
     * @return 1 when every tree gives the same fractions, down to 0 when the
     *         trees split evenly between 0 and 1 on every horizon
     */
    public double agreement(double[] point) {
        checkArgument(point.length == schema.size(), "incorrect dimension");
        double[] sum = new double[horizons.length];
        double[] sumOfSquares = new double[horizons.length];
        for (DecisionTree tree : trees) {
            double[] votes = tree.predict(point);
            for (int i = 0; i < votes.length; i++) {
                sum[i] += votes[i];
                sumOfSquares[i] += votes[i] * votes[i];
            }
        }
        double spread = 0;
        for (int i = 0; i < horizons.length; i++) {
            double mean = sum[i] / trees.size();
            spread += Math.sqrt(Math.max(0, sumOfSquares[i] / trees.size() - mean * mean));
        }
        return Math.max(0, Math.min(1, 1 - 2 * spread / horizons.length));
    }

    /**
     * The time at which the piecewise-linear cumulative failure curve through
     * {@code (0, 0)} and {@code (horizon_i, p_i)} reaches the given level.
     *
     * @param probabilities non-decreasing probabilities, one per horizon
     * @param level         a probability in (0, 1]
     * @return the remaining useful life, or empty if the longest horizon stays
     *         below the level
     */
    public OptionalLong remainingLife(double[] probabilities, double level) {
        checkArgument(probabilities.length == horizons.length, "one probability per horizon is required");
        checkArgument(level > 0 && level <= 1, "level must be in (0, 1]");
        double previousTime = 0;
        double previousProbability = 0;
        for (int i = 0; i < horizons.length; i++) {
            if (probabilities[i] >= level) {
                double fraction = (level - previousProbability) / (probabilities[i] - previousProbability);
                return OptionalLong.of(Math.round(previousTime + fraction * (horizons[i] - previousTime)));
            }
            previousTime = horizons[i];
            previousProbability = probabilities[i];
        }
        return OptionalLong.empty();
    }

    public long[] getHorizons() {
        return horizons.clone();
    }

    public List<DecisionTree> getTrees() {
        return trees;
    }

    public int getNumberOfTrees() {
        return trees.size();
    }
}
