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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A contiguous, timestamp ordered run of readings from a single unit of
 * equipment. Windows are built on demand and never stored.
 */
public class Window {

    private final String equipmentId;

    private final String equipmentClass;

    private final List<Reading> readings;

    public Window(String equipmentId, String equipmentClass, List<Reading> readings) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.equipmentClass = checkNotNull(equipmentClass, "equipmentClass must not be null");
        checkNotNull(readings, "readings must not be null");
        long previous = Long.MIN_VALUE;
        for (Reading reading : readings) {
            checkArgument(equipmentId.equals(reading.getEquipmentId()),
                    "window for " + equipmentId + " contains a reading of " + reading.getEquipmentId());
            checkArgument(reading.getTimestamp() >= previous, "readings must be ordered by timestamp");
            previous = reading.getTimestamp();
        }
        this.readings = Collections.unmodifiableList(new ArrayList<>(readings));
    }

    /**
     * the last {@code count} readings of an ordered history
     *
     * @param equipmentId    equipment identifier
     * @param equipmentClass equipment class
     * @param history        timestamp ordered readings of that equipment
     * @param count          number of samples to keep
     * @return a window holding at most {@code count} readings
     */
    public static Window lastSamples(String equipmentId, String equipmentClass, List<Reading> history, int count) {
        checkNotNull(history, "history must not be null");
        checkArgument(count > 0, "count must be positive");
        int from = Math.max(0, history.size() - count);
        return new Window(equipmentId, equipmentClass, history.subList(from, history.size()));
    }

    /**
     * readings with timestamps in {@code (end - duration, end]}
     *
     * @param equipmentId    equipment identifier
     * @param equipmentClass equipment class
     * @param history        timestamp ordered readings of that equipment
     * @param end            evaluation time, epoch millis
     * @param duration       window length in millis
     * @return the window ending at {@code end}
     */
    public static Window lastDuration(String equipmentId, String equipmentClass, List<Reading> history, long end,
            long duration) {
        checkNotNull(history, "history must not be null");
        checkArgument(duration > 0, "duration must be positive");
        List<Reading> selected = new ArrayList<>();
        for (Reading reading : history) {
            if (reading.getTimestamp() > end - duration && reading.getTimestamp() <= end) {
                selected.add(reading);
            }
        }
        return new Window(equipmentId, equipmentClass, selected);
    }

    public String getEquipmentId() {
        return equipmentId;
    }

    public String getEquipmentClass() {
        return equipmentClass;
    }

    public List<Reading> getReadings() {
        return readings;
    }

    public int size() {
        return readings.size();
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }

    /**
     * @return timestamp of the newest reading; the evaluation timestamp of the
     *         features computed from this window
     */
    public long getEndTimestamp() {
        checkArgument(!readings.isEmpty(), "empty window has no end");
        return readings.get(readings.size() - 1).getTimestamp();
    }

    public long getStartTimestamp() {
        checkArgument(!readings.isEmpty(), "empty window has no start");
        return readings.get(0).getTimestamp();
    }
}
