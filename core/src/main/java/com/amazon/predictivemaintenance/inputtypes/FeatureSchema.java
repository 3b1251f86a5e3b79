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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.zip.CRC32;

import com.amazon.predictivemaintenance.config.Channel;

/**
 * The ordered, versioned list of features computed from a window. Training and
 * inference share one schema instance per equipment class, and models record
 * the fingerprint of the schema they were trained on so that a vector laid out
 * differently is rejected instead of being silently misread.
 *
 * Per-channel features come first, channel by channel in the order given, each
 * channel contributing one feature per statistic. Cross-channel ratios follow.
 */
public class FeatureSchema {

    /**
     * Value of every feature that depends on a channel absent from the window.
     * It lies far outside any plausible reading so trees separate it rather than
     * confusing it with a real zero.
     */
    public static final double MISSING_VALUE_SENTINEL = -1.0E6;

    public static final int DEFAULT_VERSION = 1;

    /**
     * statistics computed for each channel
     */
    public enum Statistic {
        MEAN("mean"), STD("std"), MIN("min"), MAX("max"), LAST("last"), RATE_OF_CHANGE("rate_of_change"),
        TREND("trend");

        private final String suffix;

        Statistic(String suffix) {
            this.suffix = suffix;
        }

        public String getSuffix() {
            return suffix;
        }
    }

    /**
     * ratio of the window means of two channels
     */
    public static class Ratio {
        private final Channel numerator;
        private final Channel denominator;

        public Ratio(Channel numerator, Channel denominator) {
            this.numerator = checkNotNull(numerator, "numerator must not be null");
            this.denominator = checkNotNull(denominator, "denominator must not be null");
            checkArgument(numerator != denominator, "a ratio needs two distinct channels");
        }

        public Channel getNumerator() {
            return numerator;
        }

        public Channel getDenominator() {
            return denominator;
        }

        public String getName() {
            return numerator.getFeaturePrefix() + "_per_" + denominator.getFeaturePrefix();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Ratio)) {
                return false;
            }
            Ratio ratio = (Ratio) o;
            return numerator == ratio.numerator && denominator == ratio.denominator;
        }

        @Override
        public int hashCode() {
            return Objects.hash(numerator, denominator);
        }
    }

    private final int version;

    private final List<Channel> channels;

    private final List<Statistic> statistics;

    private final List<Ratio> ratios;

    private final List<String> names;

    private final Map<String, Integer> positions;

    private final String fingerprint;

    protected FeatureSchema(Builder<?> builder) {
        checkArgument(builder.version > 0, "version must be positive");
        checkArgument(!builder.channels.isEmpty(), "at least one channel is required");
        checkArgument(!builder.statistics.isEmpty(), "at least one statistic is required");
        checkArgument(EnumSet.copyOf(builder.channels).size() == builder.channels.size(), "duplicate channel");
        checkArgument(EnumSet.copyOf(builder.statistics).size() == builder.statistics.size(), "duplicate statistic");
        for (Ratio ratio : builder.ratios) {
            checkArgument(builder.channels.contains(ratio.getNumerator())
                    && builder.channels.contains(ratio.getDenominator()), "ratio uses a channel outside the schema");
        }
        this.version = builder.version;
        this.channels = Collections.unmodifiableList(new ArrayList<>(builder.channels));
        this.statistics = Collections.unmodifiableList(new ArrayList<>(builder.statistics));
        this.ratios = Collections.unmodifiableList(new ArrayList<>(builder.ratios));

        List<String> list = new ArrayList<>();
        for (Channel channel : channels) {
            for (Statistic statistic : statistics) {
                list.add(channel.getFeaturePrefix() + "_" + statistic.getSuffix());
            }
        }
        for (Ratio ratio : ratios) {
            list.add(ratio.getName());
        }
        this.names = Collections.unmodifiableList(list);
        this.positions = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            checkArgument(positions.put(names.get(i), i) == null, "duplicate feature " + names.get(i));
        }

        CRC32 crc = new CRC32();
        crc.update(String.join(",", names).getBytes(StandardCharsets.UTF_8));
        this.fingerprint = String.format("v%d-%08x", version, crc.getValue());
    }

    /**
     * all channels, all statistics, vibration/temperature and power/pressure
     * ratios
     *
     * @return the version 1 schema
     */
    public static FeatureSchema defaultSchema() {
        return builder().build();
    }

    public int getVersion() {
        return version;
    }

    public List<Channel> getChannels() {
        return channels;
    }

    public List<Statistic> getStatistics() {
        return statistics;
    }

    public List<Ratio> getRatios() {
        return ratios;
    }

    public List<String> getNames() {
        return names;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public int size() {
        return names.size();
    }

    public String getName(int index) {
        return names.get(index);
    }

    public int indexOf(String name) {
        Integer position = positions.get(name);
        checkArgument(position != null, "unknown feature " + name);
        return position;
    }

    public int indexOf(Channel channel, Statistic statistic) {
        int channelPosition = channels.indexOf(channel);
        int statisticPosition = statistics.indexOf(statistic);
        checkArgument(channelPosition >= 0 && statisticPosition >= 0, "feature not in schema");
        return channelPosition * statistics.size() + statisticPosition;
    }

    public int indexOfRatio(int ratioPosition) {
        checkArgument(ratioPosition >= 0 && ratioPosition < ratios.size(), "incorrect ratio position");
        return channels.size() * statistics.size() + ratioPosition;
    }

    /**
     * @param index position of a feature
     * @return the channels whose readings the feature is computed from
     */
    public Set<Channel> channelsOf(int index) {
        checkArgument(index >= 0 && index < names.size(), "incorrect feature index");
        int perChannel = channels.size() * statistics.size();
        if (index < perChannel) {
            return EnumSet.of(channels.get(index / statistics.size()));
        }
        Ratio ratio = ratios.get(index - perChannel);
        return EnumSet.of(ratio.getNumerator(), ratio.getDenominator());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureSchema)) {
            return false;
        }
        FeatureSchema that = (FeatureSchema) o;
        return version == that.version && names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, names);
    }

    @Override
    public String toString() {
        return fingerprint + names;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private int version = DEFAULT_VERSION;
        private List<Channel> channels = List.of(Channel.values());
        private List<Statistic> statistics = List.of(Statistic.values());
        private List<Ratio> ratios = List.of(new Ratio(Channel.VIBRATION, Channel.TEMPERATURE),
                new Ratio(Channel.POWER, Channel.PRESSURE));

        public T version(int version) {
            this.version = version;
            return (T) this;
        }

        public T channels(List<Channel> channels) {
            this.channels = checkNotNull(channels, "channels must not be null");
            return (T) this;
        }

        public T statistics(List<Statistic> statistics) {
            this.statistics = checkNotNull(statistics, "statistics must not be null");
            return (T) this;
        }

        public T ratios(List<Ratio> ratios) {
            this.ratios = checkNotNull(ratios, "ratios must not be null");
            return (T) this;
        }

        public FeatureSchema build() {
            return new FeatureSchema(this);
        }
    }
}
