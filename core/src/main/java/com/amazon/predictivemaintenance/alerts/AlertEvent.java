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

import lombok.Getter;

/**
 * An entry of the alert stream: what happened to an alert, and the alert as it
 * was right after.
 */
@Getter
public final class AlertEvent {

    private final AlertEventType type;

    private final Alert alert;

    private final long time;

    public AlertEvent(AlertEventType type, Alert alert, long time) {
        this.type = checkNotNull(type, "type must not be null");
        this.alert = checkNotNull(alert, "alert must not be null");
        this.time = time;
    }

    @Override
    public String toString() {
        return type + "@" + time + " " + alert;
    }
}
