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

import static com.amazon.predictivemaintenance.prediction.LabelBuilder.HOUR;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.inputtypes.FailureEvent;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;

public class LabelBuilderTest {

    static final FeatureSchema SCHEMA = FeatureSchema.builder().channels(List.of(Channel.VIBRATION))
            .statistics(List.of(Statistic.MEAN)).ratios(List.of()).build();

    private final LabelBuilder labelBuilder = LabelBuilder.builder().horizons(HOUR, 2 * HOUR, 4 * HOUR).build();

    // one vector per hour at hours 0..last
    private static List<FeatureVector> hourly(String equipmentId, int last) {
        List<FeatureVector> answer = new ArrayList<>();
        for (int h = last; h >= 0; h--) {
            answer.add(new FeatureVector(equipmentId, "Pump", h * HOUR, SCHEMA, new double[] { h }));
        }
        return answer;
    }

    private static LabeledExample at(LabeledDataset data, long timestamp) {
        return data.getExamples().stream().filter(e -> e.getTimestamp() == timestamp).findFirst().orElseThrow();
    }

    @Test
    public void testLabelsLookForwardOnly() {
        List<FailureEvent> failures = List.of(new FailureEvent("pump-1", 10 * HOUR, "seal"));
        LabeledDataset data = labelBuilder.build(hourly("pump-1", 12), failures, 20 * HOUR);

        assertEquals(13, data.size());
        assertEquals(0, data.getCensoredCount());
        assertArrayEquals(new boolean[] { false, false, false }, at(data, 5 * HOUR).getLabels());
        assertArrayEquals(new boolean[] { false, false, true }, at(data, 7 * HOUR).getLabels());
        assertArrayEquals(new boolean[] { true, true, true }, at(data, 9 * HOUR).getLabels());
        assertArrayEquals(new boolean[] { true, true, true }, at(data, 10 * HOUR).getLabels());
        assertEquals(3 * HOUR, at(data, 7 * HOUR).getTimeToFailure().getAsLong());

        // the failure is in the past for these
        assertArrayEquals(new boolean[] { false, false, false }, at(data, 11 * HOUR).getLabels());
        assertFalse(at(data, 11 * HOUR).getTimeToFailure().isPresent());

        assertEquals(2, data.positives(0));
        assertEquals(5, data.positives());
        for (int i = 1; i < data.size(); i++) {
            assertTrue(data.getExamples().get(i).getTimestamp() > data.getExamples().get(i - 1).getTimestamp());
        }
    }

    @Test
    public void testUnknownNegativesAreCensored() {
        List<FailureEvent> failures = List.of(new FailureEvent("pump-1", 10 * HOUR, "seal"));
        LabeledDataset data = labelBuilder.build(hourly("pump-1", 12), failures, 12 * HOUR);
        // hours 11 and 12 cannot be known negatives at every horizon
        assertEquals(2, data.getCensoredCount());
        assertEquals(11, data.size());
        assertEquals(10 * HOUR, data.getExamples().get(data.size() - 1).getTimestamp());
    }

    @Test
    public void testFailuresOfOtherEquipmentAreIgnored() {
        List<FailureEvent> failures = List.of(new FailureEvent("pump-2", 5 * HOUR, null));
        LabeledDataset data = labelBuilder.build(hourly("pump-1", 6), failures, 20 * HOUR);
        assertEquals(0, data.positives());
        assertEquals("unknown", failures.get(0).getFailureMode());
    }

    @Test
    public void testNextFailure() {
        long[] times = { 5, 10, 10, 20 };
        assertEquals(5, LabelBuilder.nextFailure(times, 0));
        assertEquals(10, LabelBuilder.nextFailure(times, 10));
        assertEquals(20, LabelBuilder.nextFailure(times, 11));
        assertEquals(-1, LabelBuilder.nextFailure(times, 21));
        assertEquals(-1, LabelBuilder.nextFailure(null, 0));

        Map<String, long[]> grouped = LabelBuilder.failureTimes(List.of(new FailureEvent("a", 9, "x"),
                new FailureEvent("b", 1, "x"), new FailureEvent("a", 3, "x")));
        assertArrayEquals(new long[] { 3, 9 }, grouped.get("a"));
    }

    @Test
    public void testHeadAndTail() {
        LabeledDataset data = labelBuilder.build(hourly("pump-1", 9), List.of(), 100 * HOUR);
        assertEquals(3, data.head(3).size());
        assertEquals(0, data.head(3).getExamples().get(0).getTimestamp());
        assertEquals(9 * HOUR, data.tail(2).getExamples().get(1).getTimestamp());
    }

    @Test
    public void testHorizonsMustIncrease() {
        assertThrows(IllegalArgumentException.class, () -> LabelBuilder.builder().horizons(2, 1).build());
        assertThrows(IllegalArgumentException.class, () -> LabelBuilder.builder().horizons().build());
        assertThrows(IllegalArgumentException.class, () -> LabelBuilder.builder().horizons(0, 1).build());
        assertArrayEquals(LabelBuilder.DEFAULT_HORIZONS, LabelBuilder.builder().build().getHorizons());
    }
}
