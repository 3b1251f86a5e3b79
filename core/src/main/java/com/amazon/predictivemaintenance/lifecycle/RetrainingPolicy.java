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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * When to retrain, and what a candidate must achieve on the held-out newest
 * data before it replaces the active artifact.
 */
@Getter
public class RetrainingPolicy {

    public static final long DAY = 24 * 3_600_000L;

    public static final long DEFAULT_DATA_VOLUME_THRESHOLD = 10_000;

    public static final long DEFAULT_RETRAIN_INTERVAL = 7 * DAY;

    public static final double DEFAULT_MAX_FALSE_POSITIVE_RATE = 0.3;

    public static final int DEFAULT_MIN_FEEDBACK = 20;

    public static final double DEFAULT_HOLDOUT_FRACTION = 0.2;

    /**
     * The flagged fraction of the held-out baseline may be at most this multiple
     * of the configured contamination.
     */
    public static final double DEFAULT_HOLDOUT_FLAG_RATE_MULTIPLIER = 3.0;

    public static final double DEFAULT_RECALL_FLOOR = 0.5;

    public static final double DEFAULT_MAX_RECALL_REGRESSION = 0.1;

    // a held-out example counts as predicted positive above this probability
    public static final double DEFAULT_RECALL_PROBABILITY = 0.4;

    public static final int DEFAULT_HISTORY_SIZE = 5;

    private final long dataVolumeThreshold;

    private final long retrainInterval;

    private final double maxFalsePositiveRate;

    private final int minFeedback;

    private final double holdoutFraction;

    private final double holdoutFlagRateMultiplier;

    private final double recallFloor;

    private final double maxRecallRegression;

    private final double recallProbability;

    private final int historySize;

    protected RetrainingPolicy(Builder<?> builder) {
        checkArgument(builder.dataVolumeThreshold > 0, "dataVolumeThreshold must be positive");
        checkArgument(builder.retrainInterval > 0, "retrainInterval must be positive");
        checkArgument(builder.maxFalsePositiveRate > 0 && builder.maxFalsePositiveRate <= 1,
                "maxFalsePositiveRate must be in (0, 1]");
        checkArgument(builder.minFeedback > 0, "minFeedback must be positive");
        checkArgument(builder.holdoutFraction >= 0 && builder.holdoutFraction < 1, "holdoutFraction must be in [0, 1)");
        checkArgument(builder.holdoutFlagRateMultiplier >= 1, "holdoutFlagRateMultiplier must be at least 1");
        checkArgument(builder.recallFloor >= 0 && builder.recallFloor <= 1, "recallFloor must be in [0, 1]");
        checkArgument(builder.maxRecallRegression >= 0, "maxRecallRegression cannot be negative");
        checkArgument(builder.recallProbability >= 0 && builder.recallProbability < 1,
                "recallProbability must be in [0, 1)");
        checkArgument(builder.historySize > 0, "historySize must be positive");
        this.dataVolumeThreshold = builder.dataVolumeThreshold;
        this.retrainInterval = builder.retrainInterval;
        this.maxFalsePositiveRate = builder.maxFalsePositiveRate;
        this.minFeedback = builder.minFeedback;
        this.holdoutFraction = builder.holdoutFraction;
        this.holdoutFlagRateMultiplier = builder.holdoutFlagRateMultiplier;
        this.recallFloor = builder.recallFloor;
        this.maxRecallRegression = builder.maxRecallRegression;
        this.recallProbability = builder.recallProbability;
        this.historySize = builder.historySize;
    }

    public static RetrainingPolicy defaults() {
        return builder().build();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private long dataVolumeThreshold = DEFAULT_DATA_VOLUME_THRESHOLD;
        private long retrainInterval = DEFAULT_RETRAIN_INTERVAL;
        private double maxFalsePositiveRate = DEFAULT_MAX_FALSE_POSITIVE_RATE;
        private int minFeedback = DEFAULT_MIN_FEEDBACK;
        private double holdoutFraction = DEFAULT_HOLDOUT_FRACTION;
        private double holdoutFlagRateMultiplier = DEFAULT_HOLDOUT_FLAG_RATE_MULTIPLIER;
        private double recallFloor = DEFAULT_RECALL_FLOOR;
        private double maxRecallRegression = DEFAULT_MAX_RECALL_REGRESSION;
        private double recallProbability = DEFAULT_RECALL_PROBABILITY;
        private int historySize = DEFAULT_HISTORY_SIZE;

        public T dataVolumeThreshold(long dataVolumeThreshold) {
            this.dataVolumeThreshold = dataVolumeThreshold;
            return (T) this;
        }

        public T retrainInterval(long retrainInterval) {
            this.retrainInterval = retrainInterval;
            return (T) this;
        }

        public T maxFalsePositiveRate(double maxFalsePositiveRate) {
            this.maxFalsePositiveRate = maxFalsePositiveRate;
            return (T) this;
        }

        public T minFeedback(int minFeedback) {
            this.minFeedback = minFeedback;
            return (T) this;
        }

        public T holdoutFraction(double holdoutFraction) {
            this.holdoutFraction = holdoutFraction;
            return (T) this;
        }

        public T holdoutFlagRateMultiplier(double holdoutFlagRateMultiplier) {
            this.holdoutFlagRateMultiplier = holdoutFlagRateMultiplier;
            return (T) this;
        }

        public T recallFloor(double recallFloor) {
            this.recallFloor = recallFloor;
            return (T) this;
        }

        public T maxRecallRegression(double maxRecallRegression) {
            this.maxRecallRegression = maxRecallRegression;
            return (T) this;
        }

        public T recallProbability(double recallProbability) {
            this.recallProbability = recallProbability;
            return (T) this;
        }

        public T historySize(int historySize) {
            this.historySize = historySize;
            return (T) this;
        }

        public RetrainingPolicy build() {
            return new RetrainingPolicy(this);
        }
    }
}
