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

package com.amazon.predictivemaintenance.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

import com.amazon.predictivemaintenance.alerts.AlertPolicy;
import com.amazon.predictivemaintenance.anomalydetection.AnomalyScorer;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForestTrainer;
import com.amazon.predictivemaintenance.lifecycle.RetrainingPolicy;
import com.amazon.predictivemaintenance.prediction.FailureForestTrainer;
import com.amazon.predictivemaintenance.prediction.FailurePredictor;
import com.amazon.predictivemaintenance.prediction.LabelBuilder;
import com.amazon.predictivemaintenance.preprocessor.FeatureExtractor;

/**
 * All tunable settings of a pipeline as a plain bean, so that they can be kept
 * in a configuration file. Durations are in hours or minutes as the field names
 * say. Every field starts at the default of the component it configures.
 */
@Data
public class PipelineConfig {

    private boolean parallelExecutionEnabled = false;

    private Integer threadPoolSize = null;

    private ExtractionConfig extraction = new ExtractionConfig();

    private AnomalyConfig anomaly = new AnomalyConfig();

    private FailureConfig failure = new FailureConfig();

    private AlertConfig alerts = new AlertConfig();

    private LifecycleConfig lifecycle = new LifecycleConfig();

    @Data
    public static class BoundsConfig {
        private Channel channel;
        private double min;
        private double max;

        public BoundsConfig() {
        }

        public BoundsConfig(Channel channel, double min, double max) {
            this.channel = channel;
            this.min = min;
            this.max = max;
        }
    }

    @Data
    public static class ExtractionConfig {
        private int minSamples = FeatureExtractor.DEFAULT_MIN_SAMPLES;
        // channels not listed keep their default bounds
        private List<BoundsConfig> bounds = new ArrayList<>();
    }

    @Data
    public static class AnomalyConfig {
        private int numberOfTrees = IsolationForestTrainer.DEFAULT_NUMBER_OF_TREES;
        private int sampleSize = IsolationForestTrainer.DEFAULT_SAMPLE_SIZE;
        private double contamination = IsolationForestTrainer.DEFAULT_CONTAMINATION;
        private Long randomSeed = null;
        private double attributionZThreshold = AnomalyScorer.DEFAULT_ATTRIBUTION_Z_THRESHOLD;
    }

    @Data
    public static class FailureConfig {
        private int numberOfTrees = FailureForestTrainer.DEFAULT_NUMBER_OF_TREES;
        private int maxDepth = FailureForestTrainer.DEFAULT_MAX_DEPTH;
        private int minLeafSize = FailureForestTrainer.DEFAULT_MIN_LEAF_SIZE;
        private Integer featuresPerSplit = null;
        private int minPositiveExamples = FailureForestTrainer.DEFAULT_MIN_POSITIVE_EXAMPLES;
        private long[] horizonHours = { 24, 72, 168 };
        private double rulProbabilityLevel = FailurePredictor.DEFAULT_RUL_PROBABILITY_LEVEL;
        private int confidenceSampleCount = FailurePredictor.DEFAULT_CONFIDENCE_SAMPLE_COUNT;
        private Long randomSeed = null;
    }

    @Data
    public static class AlertConfig {
        private double criticalProbability = AlertPolicy.DEFAULT_CRITICAL_PROBABILITY;
        private double criticalRemainingLifeHours = AlertPolicy.DEFAULT_CRITICAL_REMAINING_LIFE / AlertPolicy.HOUR;
        private double warningProbability = AlertPolicy.DEFAULT_WARNING_PROBABILITY;
        // null selects the longest horizon
        private Long warningHorizonHours = null;
        private double pairingToleranceMinutes = AlertPolicy.DEFAULT_PAIRING_TOLERANCE / AlertPolicy.MINUTE;
        private double cooldownMinutes = AlertPolicy.DEFAULT_COOLDOWN / AlertPolicy.MINUTE;
        private double clearWindowMinutes = AlertPolicy.DEFAULT_CLEAR_WINDOW / AlertPolicy.MINUTE;
        private int resolvedHistorySize = AlertPolicy.DEFAULT_RESOLVED_HISTORY_SIZE;
    }

    @Data
    public static class LifecycleConfig {
        private long dataVolumeThreshold = RetrainingPolicy.DEFAULT_DATA_VOLUME_THRESHOLD;
        private double retrainIntervalHours = RetrainingPolicy.DEFAULT_RETRAIN_INTERVAL / (double) AlertPolicy.HOUR;
        private double maxFalsePositiveRate = RetrainingPolicy.DEFAULT_MAX_FALSE_POSITIVE_RATE;
        private int minFeedback = RetrainingPolicy.DEFAULT_MIN_FEEDBACK;
        private double holdoutFraction = RetrainingPolicy.DEFAULT_HOLDOUT_FRACTION;
        private double holdoutFlagRateMultiplier = RetrainingPolicy.DEFAULT_HOLDOUT_FLAG_RATE_MULTIPLIER;
        private double recallFloor = RetrainingPolicy.DEFAULT_RECALL_FLOOR;
        private double maxRecallRegression = RetrainingPolicy.DEFAULT_MAX_RECALL_REGRESSION;
        private double recallProbability = RetrainingPolicy.DEFAULT_RECALL_PROBABILITY;
        private int historySize = RetrainingPolicy.DEFAULT_HISTORY_SIZE;
    }

    public ChannelBounds toChannelBounds() {
        ChannelBounds.Builder<?> builder = ChannelBounds.builder();
        for (BoundsConfig config : extraction.getBounds()) {
            builder.bounds(config.getChannel(), config.getMin(), config.getMax());
        }
        return builder.build();
    }

    public FeatureExtractor toFeatureExtractor() {
        return FeatureExtractor.builder().minSamples(extraction.getMinSamples()).bounds(toChannelBounds()).build();
    }

    public IsolationForestTrainer toAnomalyTrainer() {
        IsolationForestTrainer.Builder<?> builder = IsolationForestTrainer.builder()
                .numberOfTrees(anomaly.getNumberOfTrees()).sampleSize(anomaly.getSampleSize())
                .contamination(anomaly.getContamination()).parallelExecutionEnabled(parallelExecutionEnabled);
        if (anomaly.getRandomSeed() != null) {
            builder.randomSeed(anomaly.getRandomSeed());
        }
        if (threadPoolSize != null) {
            builder.threadPoolSize(threadPoolSize);
        }
        return builder.build();
    }

    public AnomalyScorer toAnomalyScorer() {
        return AnomalyScorer.builder().attributionZThreshold(anomaly.getAttributionZThreshold()).build();
    }

    public FailureForestTrainer toFailureTrainer() {
        FailureForestTrainer.Builder<?> builder = FailureForestTrainer.builder()
                .numberOfTrees(failure.getNumberOfTrees()).maxDepth(failure.getMaxDepth())
                .minLeafSize(failure.getMinLeafSize()).minPositiveExamples(failure.getMinPositiveExamples())
                .parallelExecutionEnabled(parallelExecutionEnabled);
        if (failure.getFeaturesPerSplit() != null) {
            builder.featuresPerSplit(failure.getFeaturesPerSplit());
        }
        if (failure.getRandomSeed() != null) {
            builder.randomSeed(failure.getRandomSeed());
        }
        if (threadPoolSize != null) {
            builder.threadPoolSize(threadPoolSize);
        }
        return builder.build();
    }

    public LabelBuilder toLabelBuilder() {
        long[] horizons = new long[failure.getHorizonHours().length];
        for (int i = 0; i < horizons.length; i++) {
            horizons[i] = failure.getHorizonHours()[i] * LabelBuilder.HOUR;
        }
        return LabelBuilder.builder().horizons(horizons).build();
    }

    public FailurePredictor toFailurePredictor() {
        return FailurePredictor.builder().rulProbabilityLevel(failure.getRulProbabilityLevel())
                .confidenceSampleCount(failure.getConfidenceSampleCount()).build();
    }

    public AlertPolicy toAlertPolicy() {
        AlertPolicy.Builder<?> builder = AlertPolicy.builder().criticalProbability(alerts.getCriticalProbability())
                .criticalRemainingLife(Math.round(alerts.getCriticalRemainingLifeHours() * AlertPolicy.HOUR))
                .warningProbability(alerts.getWarningProbability())
                .pairingTolerance(Math.round(alerts.getPairingToleranceMinutes() * AlertPolicy.MINUTE))
                .cooldown(Math.round(alerts.getCooldownMinutes() * AlertPolicy.MINUTE))
                .clearWindow(Math.round(alerts.getClearWindowMinutes() * AlertPolicy.MINUTE))
                .resolvedHistorySize(alerts.getResolvedHistorySize());
        if (alerts.getWarningHorizonHours() != null) {
            builder.warningHorizon(alerts.getWarningHorizonHours() * AlertPolicy.HOUR);
        }
        return builder.build();
    }

    public RetrainingPolicy toRetrainingPolicy() {
        return RetrainingPolicy.builder().dataVolumeThreshold(lifecycle.getDataVolumeThreshold())
                .retrainInterval(Math.round(lifecycle.getRetrainIntervalHours() * AlertPolicy.HOUR))
                .maxFalsePositiveRate(lifecycle.getMaxFalsePositiveRate()).minFeedback(lifecycle.getMinFeedback())
                .holdoutFraction(lifecycle.getHoldoutFraction())
                .holdoutFlagRateMultiplier(lifecycle.getHoldoutFlagRateMultiplier())
                .recallFloor(lifecycle.getRecallFloor()).maxRecallRegression(lifecycle.getMaxRecallRegression())
                .recallProbability(lifecycle.getRecallProbability()).historySize(lifecycle.getHistorySize()).build();
    }
}
