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

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.OptionalLong;

import lombok.Getter;

import com.amazon.predictivemaintenance.inputtypes.FeatureVector;

/**
 * A feature vector with one binary label per horizon and, when a failure
 * follows, the time to that failure.
 */
public class LabeledExample {

    @Getter
    private final FeatureVector vector;

    private final boolean[] labels;

    // negative when no later failure is known
    private final long timeToFailure;

    public LabeledExample(FeatureVector vector, boolean[] labels, long timeToFailure) {
        this.vector = checkNotNull(vector, "vector must not be null");
        this.labels = Arrays.copyOf(checkNotNull(labels, "labels must not be null"), labels.length);
        this.timeToFailure = timeToFailure;
    }

    public boolean isPositive(int horizonIndex) {
        return labels[horizonIndex];
    }

    public boolean[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public OptionalLong getTimeToFailure() {
        return (timeToFailure < 0) ? OptionalLong.empty() : OptionalLong.of(timeToFailure);
    }

    public long getTimestamp() {
        return vector.getTimestamp();
    }
}
