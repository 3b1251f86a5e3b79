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

import lombok.Getter;

import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.returntypes.FailureForecast;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * Produces failure forecasts from a failure forest artifact. Remaining useful
 * life is read off the forecast as the time at which the interpolated
 * cumulative failure probability reaches {@code rulProbabilityLevel}.
 *
 * The confidence of a forecast is the forest's agreement on the vector scaled
 * by the data behind it: half credit for the model alone, the other half in
 * proportion to the readings in the window, saturating at
 * {@code confidenceSampleCount}.
 */
@Getter
public class FailurePredictor {

    public static final double DEFAULT_RUL_PROBABILITY_LEVEL = 0.5;

    public static final int DEFAULT_CONFIDENCE_SAMPLE_COUNT = 100;

    private final double rulProbabilityLevel;

    private final int confidenceSampleCount;

    protected FailurePredictor(Builder<?> builder) {
        checkArgument(builder.rulProbabilityLevel > 0 && builder.rulProbabilityLevel <= 1,
                "rulProbabilityLevel must be in (0, 1]");
        checkArgument(builder.confidenceSampleCount > 0, "confidenceSampleCount must be positive");
        this.rulProbabilityLevel = builder.rulProbabilityLevel;
        this.confidenceSampleCount = builder.confidenceSampleCount;
    }

    public FailureForecast predict(FeatureVector vector, ModelArtifact<FailureForest> artifact) {
        checkNotNull(vector, "vector must not be null");
        checkNotNull(artifact, "artifact must not be null");
        FailureForest forest = artifact.getModel();
        double[] probabilities = forest.probabilities(vector);
        return new FailureForecast(vector.getEquipmentId(), vector.getTimestamp(), forest.getHorizons(),
                probabilities, forest.remainingLife(probabilities, rulProbabilityLevel),
                confidence(forest.agreement(vector.getValues()), vector.getSampleCount()), artifact.getVersion());
    }

    double confidence(double agreement, int sampleCount) {
        double dataFactor = Math.min(1.0, (double) sampleCount / confidenceSampleCount);
        return agreement * (0.5 + 0.5 * dataFactor);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private double rulProbabilityLevel = DEFAULT_RUL_PROBABILITY_LEVEL;
        private int confidenceSampleCount = DEFAULT_CONFIDENCE_SAMPLE_COUNT;

        public T rulProbabilityLevel(double rulProbabilityLevel) {
            this.rulProbabilityLevel = rulProbabilityLevel;
            return (T) this;
        }

        public T confidenceSampleCount(int confidenceSampleCount) {
            this.confidenceSampleCount = confidenceSampleCount;
            return (T) this;
        }

        public FailurePredictor build() {
            return new FailurePredictor(this);
        }
    }
}
