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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Arrays;

/**
 * Physically plausible ranges for each channel. Raw values outside a range are
 * clipped to the nearest bound by the feature extractor.
 */
public class ChannelBounds {

    public static final double DEFAULT_TEMPERATURE_MIN = -50.0;
    public static final double DEFAULT_TEMPERATURE_MAX = 250.0;
    public static final double DEFAULT_VIBRATION_MIN = 0.0;
    public static final double DEFAULT_VIBRATION_MAX = 100.0;
    public static final double DEFAULT_PRESSURE_MIN = 0.0;
    public static final double DEFAULT_PRESSURE_MAX = 500.0;
    public static final double DEFAULT_POWER_MIN = 0.0;
    public static final double DEFAULT_POWER_MAX = 1000.0;

    private final double[] lower;
    private final double[] upper;

    protected ChannelBounds(Builder<?> builder) {
        this.lower = builder.lower.clone();
        this.upper = builder.upper.clone();
        for (Channel channel : Channel.values()) {
            checkArgument(lower[channel.ordinal()] < upper[channel.ordinal()],
                    "lower bound must be below upper bound for " + channel);
        }
    }

    public static ChannelBounds defaults() {
        return builder().build();
    }

    public double getLower(Channel channel) {
        return lower[checkNotNull(channel, "channel must not be null").ordinal()];
    }

    public double getUpper(Channel channel) {
        return upper[checkNotNull(channel, "channel must not be null").ordinal()];
    }

    public boolean isOutOfBounds(Channel channel, double value) {
        return value < getLower(channel) || value > getUpper(channel);
    }

    public double clip(Channel channel, double value) {
        return Math.max(getLower(channel), Math.min(getUpper(channel), value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChannelBounds)) {
            return false;
        }
        ChannelBounds that = (ChannelBounds) o;
        return Arrays.equals(lower, that.lower) && Arrays.equals(upper, that.upper);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(lower) + Arrays.hashCode(upper);
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private final double[] lower = new double[Channel.values().length];
        private final double[] upper = new double[Channel.values().length];

        public Builder() {
            bounds(Channel.TEMPERATURE, DEFAULT_TEMPERATURE_MIN, DEFAULT_TEMPERATURE_MAX);
            bounds(Channel.VIBRATION, DEFAULT_VIBRATION_MIN, DEFAULT_VIBRATION_MAX);
            bounds(Channel.PRESSURE, DEFAULT_PRESSURE_MIN, DEFAULT_PRESSURE_MAX);
            bounds(Channel.POWER, DEFAULT_POWER_MIN, DEFAULT_POWER_MAX);
        }

        public T bounds(Channel channel, double min, double max) {
            checkNotNull(channel, "channel must not be null");
            lower[channel.ordinal()] = min;
            upper[channel.ordinal()] = max;
            return (T) this;
        }

        public ChannelBounds build() {
            return new ChannelBounds(this);
        }
    }
}
