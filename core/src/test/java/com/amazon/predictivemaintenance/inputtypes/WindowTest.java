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

import static com.amazon.predictivemaintenance.TestUtils.MINUTE;
import static com.amazon.predictivemaintenance.TestUtils.START;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.predictivemaintenance.config.Channel;

public class WindowTest {

    private List<Reading> history;

    @BeforeEach
    public void setUp() {
        history = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            history.add(new Reading("unit-1", START + i * MINUTE, new double[] { 60 + i, 10, 100, 50 }));
        }
    }

    @Test
    public void testLastSamples() {
        Window window = Window.lastSamples("unit-1", "CNC Mill", history, 5);
        assertEquals(5, window.size());
        assertEquals(START + 15 * MINUTE, window.getStartTimestamp());
        assertEquals(START + 19 * MINUTE, window.getEndTimestamp());

        assertEquals(20, Window.lastSamples("unit-1", "CNC Mill", history, 50).size());
    }

    @Test
    public void testLastDuration() {
        // (end - 5 minutes, end]
        Window window = Window.lastDuration("unit-1", "CNC Mill", history, START + 10 * MINUTE, 5 * MINUTE);
        assertEquals(5, window.size());
        assertEquals(START + 6 * MINUTE, window.getStartTimestamp());
        assertEquals(START + 10 * MINUTE, window.getEndTimestamp());

        Window empty = Window.lastDuration("unit-1", "CNC Mill", history, START - MINUTE, MINUTE);
        assertTrue(empty.isEmpty());
        assertThrows(IllegalArgumentException.class, empty::getEndTimestamp);
    }

    @Test
    public void testRejectsForeignOrUnorderedReadings() {
        List<Reading> foreign = new ArrayList<>(history);
        foreign.add(new Reading("unit-2", START + 30 * MINUTE, Map.of(Channel.POWER, 1.0)));
        assertThrows(IllegalArgumentException.class, () -> new Window("unit-1", "CNC Mill", foreign));

        List<Reading> unordered = new ArrayList<>(history);
        unordered.add(new Reading("unit-1", START, Map.of(Channel.POWER, 1.0)));
        assertThrows(IllegalArgumentException.class, () -> new Window("unit-1", "CNC Mill", unordered));
    }

    @Test
    public void testReadingChannels() {
        Reading reading = new Reading("unit-1", START, Map.of(Channel.VIBRATION, 12.5));
        assertTrue(reading.hasChannel(Channel.VIBRATION));
        assertFalse(reading.hasChannel(Channel.POWER));
        assertEquals(12.5, reading.getValue(Channel.VIBRATION).getAsDouble());
        assertFalse(reading.getValue(Channel.POWER).isPresent());
        assertTrue(reading.isUsable());

        Reading empty = new Reading("unit-1", START, new double[] { Double.NaN, Double.NaN, Double.NaN, Double.NaN });
        assertFalse(empty.isUsable());
        assertThrows(IllegalArgumentException.class,
                () -> new Reading("unit-1", START, Map.of(Channel.POWER, Double.POSITIVE_INFINITY)));
    }
}
