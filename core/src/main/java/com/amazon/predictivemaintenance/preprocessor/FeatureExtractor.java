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

package com.amazon.predictivemaintenance.preprocessor;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;
import static com.amazon.predictivemaintenance.inputtypes.FeatureSchema.MISSING_VALUE_SENTINEL;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Getter;

import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.config.ChannelBounds;
import com.amazon.predictivemaintenance.exceptions.InsufficientDataException;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Ratio;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.inputtypes.Reading;
import com.amazon.predictivemaintenance.inputtypes.Window;

/**
 * Summarizes a window of readings into a {@link FeatureVector}. The extractor
 * holds only immutable configuration; {@link #extract(Window)} is a pure
 * function of the window and can be called concurrently.
 *
 * Raw values outside the configured {@link ChannelBounds} are clipped to the
 * nearest bound and counted. A channel with no value in the window has all its
 * features, and every ratio that uses it, set to
 * {@link FeatureSchema#MISSING_VALUE_SENTINEL}. A ratio whose denominator mean
 * is zero is treated the same way.
 */
@Getter
public class FeatureExtractor {

    /**
     * Minimum number of usable readings (readings with at least one channel
     * present) in a window.
     */
    public static final int DEFAULT_MIN_SAMPLES = 10;

    public static final double MILLIS_PER_HOUR = 3_600_000.0;

    // denominators smaller than this in absolute value do not produce a ratio
    public static final double RATIO_EPSILON = 1e-9;

    private final FeatureSchema schema;

    private final ChannelBounds bounds;

    private final int minSamples;

    protected FeatureExtractor(Builder<?> builder) {
        checkArgument(builder.minSamples > 0, "minSamples must be positive");
        this.schema = checkNotNull(builder.schema, "schema must not be null");
        this.bounds = checkNotNull(builder.bounds, "bounds must not be null");
        this.minSamples = builder.minSamples;
    }

    /**
     * compute the feature vector of a window, time stamped with the newest reading
     *
     * @param window readings of one unit of equipment
     * @return the feature vector
     * @throws InsufficientDataException if fewer than {@code minSamples} readings
     *                                   are usable
     */
    public FeatureVector extract(Window window) {
        checkNotNull(window, "window must not be null");
        List<Reading> readings = window.getReadings();
        int usable = 0;
        for (Reading reading : readings) {
            if (reading.isUsable()) {
                ++usable;
            }
        }
        if (usable < minSamples) {
            throw new InsufficientDataException(window.getEquipmentId(), usable, minSamples);
        }

        double[] values = new double[schema.size()];
        Set<Channel> missing = EnumSet.noneOf(Channel.class);
        Set<String> sentinels = new LinkedHashSet<>();
        Map<Channel, Double> means = new EnumMap<>(Channel.class);
        int clipped = 0;

        for (Channel channel : schema.getChannels()) {
            ChannelSeries series = collect(readings, channel);
            clipped += series.clipped;
            if (series.size == 0) {
                missing.add(channel);
                for (Statistic statistic : schema.getStatistics()) {
                    int index = schema.indexOf(channel, statistic);
                    values[index] = MISSING_VALUE_SENTINEL;
                    sentinels.add(schema.getName(index));
                }
                continue;
            }
            double mean = series.mean();
            means.put(channel, mean);
            for (Statistic statistic : schema.getStatistics()) {
                values[schema.indexOf(channel, statistic)] = series.statistic(statistic, mean);
            }
        }

        List<Ratio> ratios = schema.getRatios();
        for (int i = 0; i < ratios.size(); i++) {
            Ratio ratio = ratios.get(i);
            int index = schema.indexOfRatio(i);
            Double numerator = means.get(ratio.getNumerator());
            Double denominator = means.get(ratio.getDenominator());
            if (numerator == null || denominator == null || Math.abs(denominator) < RATIO_EPSILON) {
                values[index] = MISSING_VALUE_SENTINEL;
                sentinels.add(schema.getName(index));
            } else {
                values[index] = numerator / denominator;
            }
        }

        return new FeatureVector(window.getEquipmentId(), window.getEquipmentClass(), window.getEndTimestamp(),
                schema, values, usable, clipped, missing, sentinels);
    }

    ChannelSeries collect(List<Reading> readings, Channel channel) {
        ChannelSeries series = new ChannelSeries(readings.size());
        for (Reading reading : readings) {
            if (reading.hasChannel(channel)) {
                double value = reading.getValue(channel).getAsDouble();
                if (bounds.isOutOfBounds(channel, value)) {
                    ++series.clipped;
                    value = bounds.clip(channel, value);
                }
                series.add(reading.getTimestamp(), value);
            }
        }
        return series;
    }

    /**
     * the present values of one channel, in time order
     */
    static class ChannelSeries {
        final long[] timestamps;
        final double[] values;
        int size;
        int clipped;

        ChannelSeries(int capacity) {
            timestamps = new long[capacity];
            values = new double[capacity];
        }

        void add(long timestamp, double value) {
            timestamps[size] = timestamp;
            values[size++] = value;
        }

        double mean() {
            double sum = 0;
            for (int i = 0; i < size; i++) {
                sum += values[i];
            }
            return sum / size;
        }

        double statistic(Statistic statistic, double mean) {
            switch (statistic) {
            case MEAN:
                return mean;
            case STD:
                return standardDeviation(mean);
            case MIN:
                return min();
            case MAX:
                return max();
            case LAST:
                return values[size - 1];
            case RATE_OF_CHANGE:
                return rateOfChange();
            case TREND:
                return trend();
            default:
                throw new IllegalStateException("unknown statistic " + statistic);
            }
        }

        // sample deviation, zero for a single value
        double standardDeviation(double mean) {
            if (size < 2) {
                return 0;
            }
            double sum = 0;
            for (int i = 0; i < size; i++) {
                double difference = values[i] - mean;
                sum += difference * difference;
            }
            return Math.sqrt(sum / (size - 1));
        }

        double min() {
            double answer = values[0];
            for (int i = 1; i < size; i++) {
                answer = Math.min(answer, values[i]);
            }
            return answer;
        }

        double max() {
            double answer = values[0];
            for (int i = 1; i < size; i++) {
                answer = Math.max(answer, values[i]);
            }
            return answer;
        }

        // mean of first differences per hour; pairs sharing a timestamp are skipped
        double rateOfChange() {
            double sum = 0;
            int pairs = 0;
            for (int i = 1; i < size; i++) {
                long elapsed = timestamps[i] - timestamps[i - 1];
                if (elapsed > 0) {
                    sum += (values[i] - values[i - 1]) / (elapsed / MILLIS_PER_HOUR);
                    ++pairs;
                }
            }
            return (pairs == 0) ? 0 : sum / pairs;
        }

        // least squares slope of value against hours
        double trend() {
            if (size < 2) {
                return 0;
            }
            double meanTime = 0;
            double meanValue = 0;
            for (int i = 0; i < size; i++) {
                meanTime += (timestamps[i] - timestamps[0]) / MILLIS_PER_HOUR;
                meanValue += values[i];
            }
            meanTime /= size;
            meanValue /= size;
            double covariance = 0;
            double variance = 0;
            for (int i = 0; i < size; i++) {
                double time = (timestamps[i] - timestamps[0]) / MILLIS_PER_HOUR - meanTime;
                covariance += time * (values[i] - meanValue);
                variance += time * time;
            }
            return (variance == 0) ? 0 : covariance / variance;
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private FeatureSchema schema = FeatureSchema.defaultSchema();
        private ChannelBounds bounds = ChannelBounds.defaults();
        private int minSamples = DEFAULT_MIN_SAMPLES;

        public T schema(FeatureSchema schema) {
            this.schema = schema;
            return (T) this;
        }

        public T bounds(ChannelBounds bounds) {
            this.bounds = bounds;
            return (T) this;
        }

        public T minSamples(int minSamples) {
            this.minSamples = minSamples;
            return (T) this;
        }

        public FeatureExtractor build() {
            return new FeatureExtractor(this);
        }
    }
}
