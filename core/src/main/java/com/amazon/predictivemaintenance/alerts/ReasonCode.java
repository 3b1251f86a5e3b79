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

package com.amazon.predictivemaintenance.alerts;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Optional;

import com.amazon.predictivemaintenance.config.Channel;

/**
 * Why an alert was raised. Failure codes are declared in decreasing priority.
 */
public enum ReasonCode {

    TEMPERATURE_ANOMALY(Channel.TEMPERATURE),
    VIBRATION_ANOMALY(Channel.VIBRATION),
    PRESSURE_ANOMALY(Channel.PRESSURE),
    POWER_ANOMALY(Channel.POWER),
    FAILURE_RISK_SHORT_HORIZON(null),
    LOW_REMAINING_LIFE(null),
    FAILURE_RISK_LONG_HORIZON(null);

    private final Channel channel;

    ReasonCode(Channel channel) {
        this.channel = channel;
    }

    public static ReasonCode anomalyOf(Channel channel) {
        checkNotNull(channel, "channel must not be null");
        for (ReasonCode code : values()) {
            if (code.channel == channel) {
                return code;
            }
        }
        throw new IllegalArgumentException("no reason code for " + channel);
    }

    public boolean isChannelAnomaly() {
        return channel != null;
    }

    public Optional<Channel> getChannel() {
        return Optional.ofNullable(channel);
    }
}
