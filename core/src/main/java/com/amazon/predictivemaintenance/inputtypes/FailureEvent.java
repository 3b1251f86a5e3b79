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

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * A historical failure of one unit of equipment, the ground truth used to label
 * training vectors.
 */
@Getter
public class FailureEvent {

    private final String equipmentId;

    // epoch millis of the failure
    private final long timestamp;

    // free-form failure mode, e.g. "bearing", "overheating"
    private final String failureMode;

    public FailureEvent(String equipmentId, long timestamp, String failureMode) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.timestamp = timestamp;
        this.failureMode = (failureMode == null) ? "unknown" : failureMode;
    }
}
