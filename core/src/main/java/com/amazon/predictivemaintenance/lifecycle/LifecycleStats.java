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

/**
 * Counters that drive the retraining triggers of one model slot.
 */
public class LifecycleStats {

    private long samplesSinceTraining;

    // -1 until the slot is first trained
    private long lastTrainedAt = -1;

    private int feedbackCount;

    private int falsePositiveCount;

    public synchronized void recordSamples(long count) {
        samplesSinceTraining += count;
    }

    public synchronized void recordFeedback(boolean falsePositive) {
        ++feedbackCount;
        if (falsePositive) {
            ++falsePositiveCount;
        }
    }

    /**
     * start a new training period
     *
     * @param trainedAt time of the training
     */
    public synchronized void reset(long trainedAt) {
        samplesSinceTraining = 0;
        lastTrainedAt = trainedAt;
        feedbackCount = 0;
        falsePositiveCount = 0;
    }

    public synchronized long getSamplesSinceTraining() {
        return samplesSinceTraining;
    }

    public synchronized long getLastTrainedAt() {
        return lastTrainedAt;
    }

    public synchronized int getFeedbackCount() {
        return feedbackCount;
    }

    public synchronized double getFalsePositiveRate() {
        return (feedbackCount == 0) ? 0 : (double) falsePositiveCount / feedbackCount;
    }
}
