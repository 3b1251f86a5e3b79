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

package com.amazon.predictivemaintenance;

import java.util.ArrayList;
import java.util.List;

import com.amazon.predictivemaintenance.inputtypes.FailureEvent;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.inputtypes.Reading;
import com.amazon.predictivemaintenance.inputtypes.Window;
import com.amazon.predictivemaintenance.preprocessor.FeatureExtractor;
import com.amazon.predictivemaintenance.testutils.SensorSeries;

public class TestUtils {

    public static final String CNC_MILL = "CNC Mill";

    public static final long MINUTE = 60_000L;

    public static final long HOUR = 60 * MINUTE;

    // 2023-11-14T22:13:20Z
    public static final long START = 1_700_000_000_000L;

    public static List<Reading> readings(String equipmentId, SensorSeries series) {
        List<Reading> answer = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            answer.add(new Reading(equipmentId, series.timestamps[i], series.values[i]));
        }
        return answer;
    }

    /**
     * sliding windows over a series
     *
     * @param equipmentId    unit of the readings
     * @param equipmentClass class of the unit
     * @param series         the series
     * @param size           rows per window
     * @param step           rows between the starts of consecutive windows
     * @return the windows in time order
     */
    public static List<Window> windows(String equipmentId, String equipmentClass, SensorSeries series, int size,
            int step) {
        List<Reading> readings = readings(equipmentId, series);
        List<Window> answer = new ArrayList<>();
        for (int from = 0; from + size <= readings.size(); from += step) {
            answer.add(new Window(equipmentId, equipmentClass, readings.subList(from, from + size)));
        }
        return answer;
    }

    public static List<FeatureVector> vectors(FeatureExtractor extractor, List<Window> windows) {
        List<FeatureVector> answer = new ArrayList<>();
        for (Window window : windows) {
            answer.add(extractor.extract(window));
        }
        return answer;
    }

    public static List<FailureEvent> failures(String equipmentId, SensorSeries series) {
        List<FailureEvent> answer = new ArrayList<>();
        for (long timestamp : series.failureTimestamps) {
            answer.add(new FailureEvent(equipmentId, timestamp, "bearing"));
        }
        return answer;
    }
}
