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

package com.amazon.predictivemaintenance.lifecycle;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.exceptions.ValidationRegressionException;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.prediction.LabeledDataset;
import com.amazon.predictivemaintenance.prediction.LabeledExample;

/**
 * Checks a candidate model on held-out data before publication.
 */
@Slf4j
public class ArtifactValidator {

    private final RetrainingPolicy policy;

    public ArtifactValidator(RetrainingPolicy policy) {
        this.policy = checkNotNull(policy, "policy must not be null");
    }

    /**
     * The candidate may flag at most {@code holdoutFlagRateMultiplier *
     * contamination} of the held-out baseline.
     *
     * @param scope     training scope
     * @param candidate the candidate forest
     * @param holdout   newest baseline vectors, not used in training
     * @return the flagged fraction, 0 for an empty holdout
     * @throws ValidationRegressionException if too many held-out vectors are
     *                                       flagged
     */
    public double validateAnomaly(String scope, IsolationForest candidate, List<FeatureVector> holdout) {
        if (holdout.isEmpty()) {
            log.debug("no holdout for anomaly candidate of {}, skipping validation", scope);
            return 0;
        }
        int flagged = 0;
        for (FeatureVector vector : holdout) {
            if (candidate.isAnomalous(candidate.score(vector))) {
                ++flagged;
            }
        }
        double rate = (double) flagged / holdout.size();
        double limit = policy.getHoldoutFlagRateMultiplier() * candidate.getContamination();
        if (rate > limit) {
            throw new ValidationRegressionException(ModelKind.ANOMALY, scope, "holdoutFlagRate", rate, limit);
        }
        return rate;
    }

    /**
     * The candidate's recall on held-out positives must reach the recall floor
     * and may not fall more than {@code maxRecallRegression} below the active
     * model's recall on the same examples.
     *
     * @param scope     training scope
     * @param candidate the candidate forest
     * @param active    the forest in effect, or null
     * @param holdout   newest labeled examples, not used in training
     * @return the candidate's recall, or NaN when the holdout has no positives
     * @throws ValidationRegressionException if recall is too low
     */
    public double validateFailure(String scope, FailureForest candidate, FailureForest active,
            LabeledDataset holdout) {
        int positives = holdout.positives();
        if (positives == 0) {
            log.debug("no held-out positives for failure candidate of {}, skipping validation", scope);
            return Double.NaN;
        }
        double recall = recall(candidate, holdout);
        if (recall < policy.getRecallFloor()) {
            throw new ValidationRegressionException(ModelKind.FAILURE, scope, "recall", recall,
                    policy.getRecallFloor());
        }
        if (active != null && active.getSchema().getFingerprint().equals(candidate.getSchema().getFingerprint())) {
            double activeRecall = recall(active, holdout);
            double required = activeRecall - policy.getMaxRecallRegression();
            if (recall < required) {
                throw new ValidationRegressionException(ModelKind.FAILURE, scope, "recall", recall, required);
            }
        }
        return recall;
    }

    /**
     * @return fraction of examples positive at the longest horizon whose
     *         predicted probability at that horizon exceeds the recall probability
     */
    double recall(FailureForest forest, LabeledDataset data) {
        int last = data.getHorizons().length - 1;
        int positives = 0;
        int found = 0;
        for (LabeledExample example : data.getExamples()) {
            if (example.isPositive(last)) {
                ++positives;
                double[] probabilities = forest.probabilities(example.getVector());
                if (probabilities[probabilities.length - 1] > policy.getRecallProbability()) {
                    ++found;
                }
            }
        }
        return (positives == 0) ? Double.NaN : (double) found / positives;
    }
}
