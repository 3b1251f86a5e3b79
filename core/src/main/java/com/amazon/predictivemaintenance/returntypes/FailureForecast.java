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

import java.util.Arrays;
import java.util.Collections;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Failure probabilities of one feature vector by horizon, with the estimated
 * remaining useful life when it is known and a confidence in [0, 1] that
 * grows with the agreement of the trees and the number of readings behind the
 * vector.
 */
public class FailureForecast {

    private final String equipmentId;

    private final long timestamp;

    private final long[] horizons;

    private final double[] probabilities;

    // negative when unknown
    private final long remainingLife;

    private final double confidence;

    private final long artifactVersion;

    public FailureForecast(String equipmentId, long timestamp, long[] horizons, double[] probabilities,
            OptionalLong remainingLife, double confidence, long artifactVersion) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        checkNotNull(horizons, "horizons must not be null");
        checkNotNull(probabilities, "probabilities must not be null");
        checkArgument(horizons.length > 0 && horizons.length == probabilities.length,
                "one probability per horizon is required");
        for (int i = 0; i < horizons.length; i++) {
            checkArgument(probabilities[i] >= 0 && probabilities[i] <= 1, "probabilities must be in [0, 1]");
            checkArgument(i == 0 || (horizons[i] > horizons[i - 1] && probabilities[i] >= probabilities[i - 1]),
                    "probabilities must not decrease with the horizon");
        }
        this.timestamp = timestamp;
        this.horizons = horizons.clone();
        this.probabilities = probabilities.clone();
        this.remainingLife = checkNotNull(remainingLife, "remainingLife must not be null").orElse(-1L);
        checkArgument(confidence >= 0 && confidence <= 1, "confidence must be in [0, 1]");
        this.confidence = confidence;
        this.artifactVersion = artifactVersion;
    }

    public String getEquipmentId() {
        return equipmentId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long[] getHorizons() {
        return horizons.clone();
    }

    public double[] getProbabilities() {
        return probabilities.clone();
    }

    public SortedMap<Long, Double> getProbabilityByHorizon() {
        SortedMap<Long, Double> answer = new TreeMap<>();
        for (int i = 0; i < horizons.length; i++) {
            answer.put(horizons[i], probabilities[i]);
        }
        return Collections.unmodifiableSortedMap(answer);
    }

    /**
     * @param horizon one of the forecast horizons
     * @return the probability of failure within the horizon
     */
    public double getProbability(long horizon) {
        int position = Arrays.binarySearch(horizons, horizon);
        checkArgument(position >= 0, "horizon " + horizon + " is not forecast");
        return probabilities[position];
    }

    public double getShortestHorizonProbability() {
        return probabilities[0];
    }

    public double getLongestHorizonProbability() {
        return probabilities[probabilities.length - 1];
    }

    public long getShortestHorizon() {
        return horizons[0];
    }

    public long getLongestHorizon() {
        return horizons[horizons.length - 1];
    }

    public OptionalLong getEstimatedRemainingLife() {
        return (remainingLife < 0) ? OptionalLong.empty() : OptionalLong.of(remainingLife);
    }

    public double getConfidence() {
        return confidence;
    }

    public long getArtifactVersion() {
        return artifactVersion;
    }

    @Override
    public String toString() {
        return String.format("FailureForecast{%s@%d p=%s rul=%s confidence=%.2f}", equipmentId, timestamp,
                Arrays.toString(probabilities), getEstimatedRemainingLife(), confidence);
    }
}
