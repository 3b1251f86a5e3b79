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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;
import static com.amazon.predictivemaintenance.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

import lombok.Getter;

import com.amazon.predictivemaintenance.config.Severity;

/**
 * An immutable snapshot of a maintenance alert. Changes to an alert produce a
 * new snapshot with the same id: its suppression may be extended, its severity
 * raised, and it may be resolved once.
 */
@Getter
public final class Alert {

    private final String id;

    private final String equipmentId;

    private final String equipmentClass;

    private final long createdAt;

    private final Severity severity;

    // channel codes in contribution order, then failure codes by priority
    private final List<ReasonCode> reasonCodes;

    private final ReasonCode dominantReasonCode;

    private final String recommendedAction;

    private final long suppressedUntil;

    private final long lastSignalAt;

    private final AlertStatus status;

    // -1 while active
    private final long resolvedAt;

    private final MaintenanceImpact impact;

    public Alert(String id, String equipmentId, String equipmentClass, long createdAt, Severity severity,
            List<ReasonCode> reasonCodes, ReasonCode dominantReasonCode, String recommendedAction,
            long suppressedUntil, long lastSignalAt, AlertStatus status, long resolvedAt, MaintenanceImpact impact) {
        this.id = checkNotNull(id, "id must not be null");
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.equipmentClass = checkNotNull(equipmentClass, "equipmentClass must not be null");
        this.severity = checkNotNull(severity, "severity must not be null");
        this.dominantReasonCode = checkNotNull(dominantReasonCode, "dominantReasonCode must not be null");
        this.recommendedAction = checkNotNull(recommendedAction, "recommendedAction must not be null");
        this.status = checkNotNull(status, "status must not be null");
        checkNotNull(reasonCodes, "reasonCodes must not be null");
        checkArgument(reasonCodes.contains(dominantReasonCode), "the dominant reason must be one of the reasons");
        checkArgument(status == AlertStatus.ACTIVE || resolvedAt >= createdAt, "incorrect resolution time");
        this.createdAt = createdAt;
        this.reasonCodes = Collections.unmodifiableList(new ArrayList<>(reasonCodes));
        this.suppressedUntil = suppressedUntil;
        this.lastSignalAt = lastSignalAt;
        this.resolvedAt = (status == AlertStatus.ACTIVE) ? -1 : resolvedAt;
        this.impact = impact;
    }

    public boolean isActive() {
        return status == AlertStatus.ACTIVE;
    }

    public OptionalLong getResolvedAt() {
        return isActive() ? OptionalLong.empty() : OptionalLong.of(resolvedAt);
    }

    /**
     * @param signalTime time of the qualifying signal
     * @param codes      reasons of the signal
     * @param cooldown   suppression period after the signal
     * @return this alert with its suppression extended and reasons merged
     */
    Alert refresh(long signalTime, List<ReasonCode> codes, long cooldown) {
        checkState(isActive(), "a resolved alert cannot be refreshed");
        long last = Math.max(lastSignalAt, signalTime);
        return new Alert(id, equipmentId, equipmentClass, createdAt, severity, merge(codes), dominantReasonCode,
                recommendedAction, Math.max(suppressedUntil, signalTime + cooldown), last, status, -1, impact);
    }

    Alert escalate(Severity newSeverity, long signalTime, List<ReasonCode> codes, long cooldown,
            MaintenanceImpact newImpact) {
        checkState(isActive(), "a resolved alert cannot be escalated");
        checkArgument(newSeverity.isHigherThan(severity), "escalation must raise the severity");
        long last = Math.max(lastSignalAt, signalTime);
        return new Alert(id, equipmentId, equipmentClass, createdAt, newSeverity, merge(codes), dominantReasonCode,
                recommendedAction, Math.max(suppressedUntil, signalTime + cooldown), last, status, -1, newImpact);
    }

    Alert resolve(long time) {
        checkState(isActive(), "alert " + id + " is already resolved");
        return new Alert(id, equipmentId, equipmentClass, createdAt, severity, reasonCodes, dominantReasonCode,
                recommendedAction, suppressedUntil, lastSignalAt, AlertStatus.RESOLVED, Math.max(time, createdAt),
                impact);
    }

    private List<ReasonCode> merge(List<ReasonCode> codes) {
        Set<ReasonCode> merged = new LinkedHashSet<>(reasonCodes);
        merged.addAll(codes);
        return new ArrayList<>(merged);
    }

    @Override
    public String toString() {
        return String.format("Alert{%s %s %s %s %s}", id, equipmentId, severity, dominantReasonCode, status);
    }
}
