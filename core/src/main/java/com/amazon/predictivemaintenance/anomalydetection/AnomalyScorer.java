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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.returntypes.AnomalyResult;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * Scores feature vectors against an isolation forest artifact and attributes
 * anomalies to channels. Scoring is a pure function of the vector and the
 * artifact; the scorer itself holds only configuration.
 *
 * The deviation of a channel is the largest absolute z-score, against the
 * baseline, among the channel's own features. Channels above
 * {@code attributionZThreshold} contribute; when none does, the most deviating
 * channel is reported alone.
 */
@Getter
public class AnomalyScorer {

    public static final double DEFAULT_ATTRIBUTION_Z_THRESHOLD = 2.0;

    // deviations are floored at max(MIN_DEVIATION, RELATIVE_DEVIATION_FLOOR * |mean|)
    public static final double MIN_DEVIATION = 1e-6;

    public static final double RELATIVE_DEVIATION_FLOOR = 0.01;

    private final double attributionZThreshold;

    protected AnomalyScorer(Builder<?> builder) {
        checkArgument(builder.attributionZThreshold > 0, "attributionZThreshold must be positive");
        this.attributionZThreshold = builder.attributionZThreshold;
    }

    /**
     * score a vector
     *
     * @param vector   features of one window
     * @param artifact the anomaly artifact in effect for the vector's equipment
     * @return the result
     * @throws IllegalArgumentException if the schemas differ
     */
    public AnomalyResult score(FeatureVector vector, ModelArtifact<IsolationForest> artifact) {
        checkNotNull(vector, "vector must not be null");
        checkNotNull(artifact, "artifact must not be null");
        IsolationForest forest = artifact.getModel();
        double score = forest.score(vector);
        boolean anomalous = forest.isAnomalous(score);
        Map<Channel, Double> deviations = channelDeviations(vector, forest);
        List<Channel> contributing = anomalous ? contributingChannels(deviations) : Collections.emptyList();
        return new AnomalyResult(vector.getEquipmentId(), vector.getTimestamp(), score, anomalous,
                forest.getThreshold(), contributing, deviations, artifact.getVersion());
    }

    Map<Channel, Double> channelDeviations(FeatureVector vector, IsolationForest forest) {
        FeatureSchema schema = forest.getSchema();
        Map<Channel, Double> deviations = new EnumMap<>(Channel.class);
        for (Channel channel : schema.getChannels()) {
            if (vector.getMissingChannels().contains(channel)) {
                continue;
            }
            double largest = 0;
            boolean present = false;
            for (Statistic statistic : schema.getStatistics()) {
                int index = schema.indexOf(channel, statistic);
                double mean = forest.baselineMean(index);
                if (vector.isSentinel(schema.getName(index)) || mean == FeatureSchema.MISSING_VALUE_SENTINEL) {
                    continue;
                }
                double deviation = Math.max(forest.baselineDeviation(index),
                        Math.max(MIN_DEVIATION, RELATIVE_DEVIATION_FLOOR * Math.abs(mean)));
                largest = Math.max(largest, Math.abs(vector.get(index) - mean) / deviation);
                present = true;
            }
            if (present) {
                deviations.put(channel, largest);
            }
        }
        return deviations;
    }

    List<Channel> contributingChannels(Map<Channel, Double> deviations) {
        List<Channel> ordered = new ArrayList<>(deviations.keySet());
        // stable sort keeps channel order among equal deviations
        ordered.sort((a, b) -> Double.compare(deviations.get(b), deviations.get(a)));
        List<Channel> answer = new ArrayList<>();
        for (Channel channel : ordered) {
            if (deviations.get(channel) > attributionZThreshold) {
                answer.add(channel);
            }
        }
        if (answer.isEmpty() && !ordered.isEmpty()) {
            answer.add(ordered.get(0));
        }
        return answer;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private double attributionZThreshold = DEFAULT_ATTRIBUTION_Z_THRESHOLD;

        public T attributionZThreshold(double attributionZThreshold) {
            this.attributionZThreshold = attributionZThreshold;
            return (T) this;
        }

        public AnomalyScorer build() {
            return new AnomalyScorer(this);
        }
    }
}
