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

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Recommended maintenance actions by equipment class and reason code. Lookup
 * falls back from the class-specific entry to the class-agnostic entry for the
 * code, then to a generic action, and never fails.
 */
public class ActionCatalog {

    public static final String GENERIC_ACTION = "Schedule an inspection and continue regular monitoring";

    private final Map<String, Map<ReasonCode, String>> byClass;

    private final Map<ReasonCode, String> byCode;

    private final String genericAction;

    protected ActionCatalog(Builder<?> builder) {
        this.byClass = new HashMap<>();
        for (Map.Entry<String, Map<ReasonCode, String>> entry : builder.byClass.entrySet()) {
            byClass.put(entry.getKey(), new EnumMap<>(entry.getValue()));
        }
        this.byCode = new EnumMap<>(builder.byCode);
        this.genericAction = checkNotNull(builder.genericAction, "genericAction must not be null");
    }

    public String recommend(String equipmentClass, ReasonCode code) {
        if (equipmentClass != null && code != null) {
            Map<ReasonCode, String> classActions = byClass.get(equipmentClass);
            if (classActions != null && classActions.containsKey(code)) {
                return classActions.get(code);
            }
        }
        if (code != null && byCode.containsKey(code)) {
            return byCode.get(code);
        }
        return genericAction;
    }

    public static ActionCatalog defaults() {
        return builder().build();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private final Map<String, Map<ReasonCode, String>> byClass = new HashMap<>();
        private final Map<ReasonCode, String> byCode = new EnumMap<>(ReasonCode.class);
        private String genericAction = GENERIC_ACTION;

        public Builder() {
            action(ReasonCode.VIBRATION_ANOMALY, "Inspect bearings, check lubrication and verify alignment");
            action(ReasonCode.TEMPERATURE_ANOMALY, "Check cooling system and inspect for friction sources");
            action(ReasonCode.PRESSURE_ANOMALY, "Inspect seals and hydraulic lines for leaks");
            action(ReasonCode.POWER_ANOMALY, "Inspect electrical connections and motor load");
            action(ReasonCode.FAILURE_RISK_SHORT_HORIZON, "Stop for immediate maintenance and replace worn parts");
            action(ReasonCode.LOW_REMAINING_LIFE, "Plan a component replacement before the next shift");
            action(ReasonCode.FAILURE_RISK_LONG_HORIZON, "Schedule preventive maintenance within the week");
            action("CNC Mill", ReasonCode.VIBRATION_ANOMALY, "Inspect spindle bearings and tool holder balance");
            action("Robotic Arm", ReasonCode.VIBRATION_ANOMALY, "Inspect joint reducers and recalibrate the arm");
            action("Injection Molder", ReasonCode.PRESSURE_ANOMALY, "Inspect the hydraulic pump and check valves");
        }

        public T action(ReasonCode code, String action) {
            byCode.put(checkNotNull(code, "code must not be null"), checkNotNull(action, "action must not be null"));
            return (T) this;
        }

        public T action(String equipmentClass, ReasonCode code, String action) {
            checkNotNull(equipmentClass, "equipmentClass must not be null");
            byClass.computeIfAbsent(equipmentClass, k -> new EnumMap<>(ReasonCode.class))
                    .put(checkNotNull(code, "code must not be null"), checkNotNull(action, "action must not be null"));
            return (T) this;
        }

        public T genericAction(String genericAction) {
            this.genericAction = genericAction;
            return (T) this;
        }

        public ActionCatalog build() {
            return new ActionCatalog(this);
        }
    }
}
