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
import java.util.Random;

/**
 * Generates equipment telemetry: each channel is a constant operating level
 * plus Gaussian noise. Degradation is simulated as a linear ramp of one channel
 * towards a degraded level, optionally followed by a failure after which the
 * equipment is repaired and returns to its operating level.
 *
 * Channel positions follow the declaration order of the sensor channels:
 * temperature, vibration, pressure, power.
 */
public class SensorSeriesTestData {

    public static final int TEMPERATURE = 0;
    public static final int VIBRATION = 1;
    public static final int PRESSURE = 2;
    public static final int POWER = 3;

    public static final long MINUTE = 60_000L;

    public static final double[] DEFAULT_LEVELS = { 65.0, 10.0, 120.0, 45.0 };
    public static final double[] DEFAULT_NOISE = { 0.5, 0.4, 1.5, 1.0 };

    private final double[] levels;
    private final double[] noise;
    private final long interval;

    public SensorSeriesTestData(double[] levels, double[] noise, long interval) {
        if (levels.length != noise.length) {
            throw new IllegalArgumentException("one noise level per channel is required");
        }
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.levels = levels.clone();
        this.noise = noise.clone();
        this.interval = interval;
    }

    public SensorSeriesTestData() {
        this(DEFAULT_LEVELS, DEFAULT_NOISE, MINUTE);
    }

    public long getInterval() {
        return interval;
    }

    public double getLevel(int channel) {
        return levels[channel];
    }

    /**
     * healthy operation
     *
     * @param start first timestamp
     * @param count number of rows
     * @param seed  random seed
     * @return the series
     */
    public SensorSeries generate(long start, int count, long seed) {
        Random random = new Random(seed);
        long[] timestamps = new long[count];
        double[][] values = new double[count][];
        for (int i = 0; i < count; i++) {
            timestamps[i] = start + i * interval;
            values[i] = healthyRow(random);
        }
        return new SensorSeries(timestamps, values);
    }

    /**
     * healthy operation followed by a linear ramp of one channel, reaching
     * {@code rampEnd} on the last row
     *
     * @param start     first timestamp
     * @param count     number of rows
     * @param channel   degrading channel
     * @param rampFrom  first row of the ramp
     * @param rampStart level at the start of the ramp
     * @param rampEnd   level on the last row
     * @param seed      random seed
     * @return the series
     */
    public SensorSeries generateWithRamp(long start, int count, int channel, int rampFrom, double rampStart,
            double rampEnd, long seed) {
        SensorSeries series = generate(start, count, seed);
        int length = count - rampFrom;
        for (int i = rampFrom; i < count; i++) {
            double fraction = (length <= 1) ? 1.0 : (i - rampFrom) / (double) (length - 1);
            double offset = series.values[i][channel] - levels[channel];
            series.values[i][channel] = rampStart + fraction * (rampEnd - rampStart) + offset;
        }
        return series;
    }

    /**
     * repeated cycles of healthy operation, degradation of one channel and
     * failure; a failure is recorded one interval after the last degraded row,
     * and the row at that time is already healthy
     *
     * @param start     first timestamp
     * @param cycles    number of failures
     * @param healthy   healthy rows per cycle
     * @param degrading degrading rows per cycle
     * @param channel   degrading channel
     * @param degraded  level reached just before a failure
     * @param seed      random seed
     * @return the series with its failure timestamps
     */
    public SensorSeries generateRunToFailure(long start, int cycles, int healthy, int degrading, int channel,
            double degraded, long seed) {
        Random random = new Random(seed);
        int cycleLength = healthy + degrading + 1;
        int count = cycles * cycleLength;
        long[] timestamps = new long[count];
        double[][] values = new double[count][];
        long[] failures = new long[cycles];
        for (int c = 0; c < cycles; c++) {
            for (int j = 0; j < cycleLength; j++) {
                int i = c * cycleLength + j;
                timestamps[i] = start + i * interval;
                values[i] = healthyRow(random);
                if (j >= healthy && j < healthy + degrading) {
                    double fraction = (j - healthy + 1) / (double) degrading;
                    values[i][channel] += fraction * (degraded - levels[channel]);
                }
            }
            // the failure happens at the slot after the last degraded row
            failures[c] = start + ((long) c * cycleLength + healthy + degrading) * interval;
        }
        return new SensorSeries(timestamps, values, failures);
    }

    double[] healthyRow(Random random) {
        double[] row = new double[levels.length];
        for (int j = 0; j < levels.length; j++) {
            row[j] = levels[j] + noise[j] * random.nextGaussian();
        }
        return row;
    }

    @Override
    public String toString() {
        return "SensorSeriesTestData" + Arrays.toString(levels) + " every " + interval + "ms";
    }
}
