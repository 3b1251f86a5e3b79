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

package com.amazon.predictivemaintenance.prediction;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

import com.amazon.predictivemaintenance.inputtypes.FailureEvent;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;

/**
 * Turns feature vectors and historical failures into labeled examples.
 *
 * For a vector of equipment {@code e} stamped {@code t} and a horizon
 * {@code H}, the label is positive if and only if a failure of {@code e} occurs
 * in {@code [t, t + H]}. Only failures at or after {@code t} are consulted. If
 * {@code t + H} lies past the end of the observed failure history and no
 * failure is known within the horizon, the label is unknown; such vectors are
 * excluded and counted as censored.
 */
@Getter
public class LabelBuilder {

    public static final long HOUR = 3_600_000L;

    public static final long[] DEFAULT_HORIZONS = { 24 * HOUR, 72 * HOUR, 168 * HOUR };

    private final long[] horizons;

    protected LabelBuilder(Builder<?> builder) {
        checkNotNull(builder.horizons, "horizons must not be null");
        checkArgument(builder.horizons.length > 0, "at least one horizon is required");
        for (int i = 0; i < builder.horizons.length; i++) {
            checkArgument(builder.horizons[i] > 0, "horizons must be positive");
            checkArgument(i == 0 || builder.horizons[i] > builder.horizons[i - 1],
                    "horizons must be strictly increasing");
        }
        this.horizons = builder.horizons.clone();
    }

    public long[] getHorizons() {
        return horizons.clone();
    }

    /**
     * label a set of vectors
     *
     * @param vectors        vectors of any number of units
     * @param failures       failure history
     * @param observationEnd time up to which the failure history is complete
     * @return the labeled examples in time order
     */
    public LabeledDataset build(List<FeatureVector> vectors, List<FailureEvent> failures, long observationEnd) {
        checkNotNull(vectors, "vectors must not be null");
        checkNotNull(failures, "failures must not be null");
        Map<String, long[]> failureTimes = failureTimes(failures);
        List<LabeledExample> examples = new ArrayList<>();
        int censored = 0;
        for (FeatureVector vector : vectors) {
            long t = vector.getTimestamp();
            long next = nextFailure(failureTimes.get(vector.getEquipmentId()), t);
            boolean[] labels = new boolean[horizons.length];
            boolean known = true;
            for (int i = 0; i < horizons.length; i++) {
                labels[i] = next >= 0 && next - t <= horizons[i];
                if (!labels[i] && t + horizons[i] > observationEnd) {
                    known = false;
                    break;
                }
            }
            if (known) {
                examples.add(new LabeledExample(vector, labels, (next >= 0) ? next - t : -1));
            } else {
                ++censored;
            }
        }
        return new LabeledDataset(horizons, examples, censored);
    }

    static Map<String, long[]> failureTimes(List<FailureEvent> failures) {
        Map<String, List<Long>> grouped = new HashMap<>();
        for (FailureEvent failure : failures) {
            grouped.computeIfAbsent(failure.getEquipmentId(), k -> new ArrayList<>()).add(failure.getTimestamp());
        }
        Map<String, long[]> answer = new HashMap<>();
        for (Map.Entry<String, List<Long>> entry : grouped.entrySet()) {
            long[] times = entry.getValue().stream().mapToLong(Long::longValue).toArray();
            Arrays.sort(times);
            answer.put(entry.getKey(), times);
        }
        return answer;
    }

    // earliest failure at or after t, -1 if none
    static long nextFailure(long[] times, long t) {
        if (times == null) {
            return -1;
        }
        int position = Arrays.binarySearch(times, t);
        if (position < 0) {
            position = -position - 1;
        } else {
            while (position > 0 && times[position - 1] == t) {
                --position;
            }
        }
        return (position < times.length) ? times[position] : -1;
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private long[] horizons = DEFAULT_HORIZONS.clone();

        public T horizons(long... horizons) {
            this.horizons = horizons;
            return (T) this;
        }

        public LabelBuilder build() {
            return new LabelBuilder(this);
        }
    }
}
