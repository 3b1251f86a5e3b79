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

/**
 * The fixed set of sensor channels reported by monitored equipment. The
 * declaration order is the order in which per-channel features appear in a
 * {@link com.amazon.predictivemaintenance.inputtypes.FeatureSchema}, and must
 * not be changed without bumping the schema version.
 */
public enum Channel {

    /**
     * housing or bearing temperature, degrees Celsius
     */
    TEMPERATURE("temperature"),
    /**
     * RMS vibration velocity, mm/s
     */
    VIBRATION("vibration"),
    /**
     * line or hydraulic pressure, psi
     */
    PRESSURE("pressure"),
    /**
     * electrical power draw, kW
     */
    POWER("power");

    private final String featurePrefix;

    Channel(String featurePrefix) {
        this.featurePrefix = featurePrefix;
    }

    public String getFeaturePrefix() {
        return featurePrefix;
    }
}
