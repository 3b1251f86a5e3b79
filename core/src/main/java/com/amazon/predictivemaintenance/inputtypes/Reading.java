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

package com.amazon.predictivemaintenance.inputtypes;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

import com.amazon.predictivemaintenance.config.Channel;

/**
 * A single timestamped set of channel values reported by one unit of
 * equipment. Channels that were not reported are absent. Instances are
 * immutable.
 */
public class Reading {

    // equipment identifier
    private final String equipmentId;

    // epoch milliseconds
    private final long timestamp;

    // indexed by Channel.ordinal(), NaN when the channel was not reported
    private final double[] values;

    public Reading(String equipmentId, long timestamp, Map<Channel, Double> values) {
        checkNotNull(values, "values must not be null");
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.timestamp = timestamp;
        this.values = new double[Channel.values().length];
        Arrays.fill(this.values, Double.NaN);
        for (Map.Entry<Channel, Double> entry : values.entrySet()) {
            checkNotNull(entry.getKey(), "channel must not be null");
            if (entry.getValue() != null) {
                checkArgument(!Double.isInfinite(entry.getValue()), "channel values must be finite");
                this.values[entry.getKey().ordinal()] = entry.getValue();
            }
        }
    }

    /**
     * convenience constructor taking values in {@link Channel} order; NaN marks
     * an absent channel
     *
     * @param equipmentId equipment identifier
     * @param timestamp   epoch milliseconds
     * @param values      values in channel order
     */
    public Reading(String equipmentId, long timestamp, double[] values) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(values.length == Channel.values().length, "one value per channel is required");
        this.timestamp = timestamp;
        this.values = Arrays.copyOf(values, values.length);
    }

    public String getEquipmentId() {
        return equipmentId;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public boolean hasChannel(Channel channel) {
        return !Double.isNaN(values[channel.ordinal()]);
    }

    public OptionalDouble getValue(Channel channel) {
        double value = values[channel.ordinal()];
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * @return true if at least one channel is present
     */
    public boolean isUsable() {
        for (double value : values) {
            if (!Double.isNaN(value)) {
                return true;
            }
        }
        return false;
    }

    public Map<Channel, Double> getValues() {
        EnumMap<Channel, Double> answer = new EnumMap<>(Channel.class);
        for (Channel channel : Channel.values()) {
            if (hasChannel(channel)) {
                answer.put(channel, values[channel.ordinal()]);
            }
        }
        return answer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Reading)) {
            return false;
        }
        Reading reading = (Reading) o;
        return timestamp == reading.timestamp && equipmentId.equals(reading.equipmentId)
                && Arrays.equals(values, reading.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * equipmentId.hashCode() + Long.hashCode(timestamp)) + Arrays.hashCode(values);
    }
}
