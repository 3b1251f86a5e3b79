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
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

import com.amazon.predictivemaintenance.config.Channel;

/**
 * The fixed-width numeric summary of one window, laid out according to a
 * {@link FeatureSchema}. Besides the values it carries the observability
 * metadata of the extraction: how many samples contributed, how many raw values
 * were clipped, and which channels were missing (their dependent features hold
 * {@link FeatureSchema#MISSING_VALUE_SENTINEL}).
 */
public class FeatureVector {

    private final String equipmentId;

    private final String equipmentClass;

    private final long timestamp;

    private final FeatureSchema schema;

    private final double[] values;

    private final int sampleCount;

    private final int clippedCount;

    private final Set<Channel> missingChannels;

    private final Set<String> sentinelFeatures;

    public FeatureVector(String equipmentId, String equipmentClass, long timestamp, FeatureSchema schema,
            double[] values, int sampleCount, int clippedCount, Set<Channel> missingChannels,
            Set<String> sentinelFeatures) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.equipmentClass = checkNotNull(equipmentClass, "equipmentClass must not be null");
        this.schema = checkNotNull(schema, "schema must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(values.length == schema.size(), "values do not match the schema");
        checkArgument(clippedCount >= 0 && sampleCount >= 0, "counts must be non-negative");
        this.timestamp = timestamp;
        this.values = Arrays.copyOf(values, values.length);
        this.sampleCount = sampleCount;
        this.clippedCount = clippedCount;
        this.missingChannels = (missingChannels == null || missingChannels.isEmpty())
                ? Collections.unmodifiableSet(EnumSet.noneOf(Channel.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(missingChannels));
        this.sentinelFeatures = (sentinelFeatures == null) ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sentinelFeatures));
    }

    /**
     * a vector without extraction metadata, used when features come from an
     * external source such as a labeled training set
     *
     * @param equipmentId    equipment identifier
     * @param equipmentClass equipment class
     * @param timestamp      evaluation time
     * @param schema         schema of the values
     * @param values         feature values
     */
    public FeatureVector(String equipmentId, String equipmentClass, long timestamp, FeatureSchema schema,
            double[] values) {
        this(equipmentId, equipmentClass, timestamp, schema, values, 0, 0, null, null);
    }

    public String getEquipmentId() {
        return equipmentId;
    }

    public String getEquipmentClass() {
        return equipmentClass;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public FeatureSchema getSchema() {
        return schema;
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double get(int index) {
        return values[index];
    }

    public double get(String name) {
        return values[schema.indexOf(name)];
    }

    public int size() {
        return values.length;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getClippedCount() {
        return clippedCount;
    }

    public Set<Channel> getMissingChannels() {
        return missingChannels;
    }

    public Set<String> getSentinelFeatures() {
        return sentinelFeatures;
    }

    public boolean isSentinel(String name) {
        return sentinelFeatures.contains(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        FeatureVector that = (FeatureVector) o;
        return timestamp == that.timestamp && sampleCount == that.sampleCount && clippedCount == that.clippedCount
                && equipmentId.equals(that.equipmentId) && equipmentClass.equals(that.equipmentClass)
                && schema.equals(that.schema) && Arrays.equals(values, that.values)
                && missingChannels.equals(that.missingChannels) && sentinelFeatures.equals(that.sentinelFeatures);
    }

    @Override
    public int hashCode() {
        int result = equipmentId.hashCode();
        result = 31 * result + Long.hashCode(timestamp);
        result = 31 * result + Arrays.hashCode(values);
        return 31 * result + clippedCount;
    }
}
