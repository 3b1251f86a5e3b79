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

package com.amazon.predictivemaintenance.returntypes;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.predictivemaintenance.config.Channel;

/**
 * The anomaly score of one feature vector. Contributing channels are ordered by
 * decreasing deviation from the baseline and are only reported for anomalous
 * vectors.
 */
@Getter
public class AnomalyResult {

    private final String equipmentId;

    private final long timestamp;

    private final double score;

    private final boolean anomalous;

    private final double threshold;

    private final List<Channel> contributingChannels;

    // largest absolute z-score among each present channel's features
    private final Map<Channel, Double> channelDeviations;

    private final long artifactVersion;

    public AnomalyResult(String equipmentId, long timestamp, double score, boolean anomalous, double threshold,
            List<Channel> contributingChannels, Map<Channel, Double> channelDeviations, long artifactVersion) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        checkArgument(score >= 0 && score <= 1, "score must be in [0, 1]");
        this.timestamp = timestamp;
        this.score = score;
        this.anomalous = anomalous;
        this.threshold = threshold;
        this.contributingChannels = Collections.unmodifiableList(new ArrayList<>(
                checkNotNull(contributingChannels, "contributingChannels must not be null")));
        this.channelDeviations = (channelDeviations == null || channelDeviations.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(channelDeviations));
        this.artifactVersion = artifactVersion;
    }

    @Override
    public String toString() {
        return String.format("AnomalyResult{%s@%d score=%.4f anomalous=%b channels=%s}", equipmentId, timestamp,
                score, anomalous, contributingChannels);
    }
}
