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

package com.amazon.predictivemaintenance.testutils;

import java.util.Arrays;

/**
 * A regularly sampled multi-channel series. Row {@code i} holds the values
 * taken at {@code timestamps[i]}; NaN marks a channel that was not reported.
 */
public class SensorSeries {

    public final long[] timestamps;
    public final double[][] values;
    // times at which the simulated equipment failed, in increasing order
    public final long[] failureTimestamps;

    public SensorSeries(long[] timestamps, double[][] values, long[] failureTimestamps) {
        if (timestamps.length != values.length) {
            throw new IllegalArgumentException("one row of values per timestamp is required");
        }
        this.timestamps = timestamps;
        this.values = values;
        this.failureTimestamps = failureTimestamps;
    }

    public SensorSeries(long[] timestamps, double[][] values) {
        this(timestamps, values, new long[0]);
    }

    public int size() {
        return timestamps.length;
    }

    /**
     * @param from first row, inclusive
     * @param to   last row, exclusive
     * @return a copy of the rows in the range, keeping the failures inside it
     */
    public SensorSeries slice(int from, int to) {
        double[][] rows = new double[to - from][];
        for (int i = from; i < to; i++) {
            rows[i - from] = values[i].clone();
        }
        long[] times = Arrays.copyOfRange(timestamps, from, to);
        long[] failures = Arrays.stream(failureTimestamps)
                .filter(t -> to > from && t >= times[0] && t <= times[times.length - 1]).toArray();
        return new SensorSeries(times, rows, failures);
    }

    /**
     * marks one channel as not reported over a range of rows, in place
     *
     * @param channel channel position
     * @param from    first row, inclusive
     * @param to      last row, exclusive
     * @return this series
     */
    public SensorSeries dropChannel(int channel, int from, int to) {
        for (int i = from; i < to; i++) {
            values[i][channel] = Double.NaN;
        }
        return this;
    }
}
