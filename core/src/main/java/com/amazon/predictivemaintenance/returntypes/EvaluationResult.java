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

package com.amazon.predictivemaintenance.returntypes;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

import com.amazon.predictivemaintenance.alerts.AlertEvent;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;

/**
 * The outcome of evaluating one window. Outputs of models that were not
 * available are absent, never zero.
 */
public class EvaluationResult {

    @Getter
    private final String equipmentId;

    @Getter
    private final EvaluationStatus status;

    private final FeatureVector features;

    private final AnomalyResult anomaly;

    private final FailureForecast forecast;

    @Getter
    private final List<AlertEvent> alertEvents;

    @Getter
    private final Set<ModelKind> unavailableModels;

    // why the evaluation is degraded, empty when scored
    @Getter
    private final String message;

    EvaluationResult(String equipmentId, EvaluationStatus status, FeatureVector features, AnomalyResult anomaly,
            FailureForecast forecast, List<AlertEvent> alertEvents, Set<ModelKind> unavailableModels,
            String message) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.status = checkNotNull(status, "status must not be null");
        this.features = features;
        this.anomaly = anomaly;
        this.forecast = forecast;
        this.alertEvents = (alertEvents == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(alertEvents));
        this.unavailableModels = (unavailableModels == null || unavailableModels.isEmpty())
                ? Collections.unmodifiableSet(EnumSet.noneOf(ModelKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(unavailableModels));
        this.message = (message == null) ? "" : message;
    }

    public static EvaluationResult scored(FeatureVector features, AnomalyResult anomaly, FailureForecast forecast,
            List<AlertEvent> alertEvents, Set<ModelKind> unavailableModels, String message) {
        EvaluationStatus status = (unavailableModels == null || unavailableModels.isEmpty()) ? EvaluationStatus.SCORED
                : EvaluationStatus.PARTIALLY_SCORED;
        return new EvaluationResult(features.getEquipmentId(), status, features, anomaly, forecast, alertEvents,
                unavailableModels, message);
    }

    public static EvaluationResult insufficientData(String equipmentId, String message) {
        return new EvaluationResult(equipmentId, EvaluationStatus.INSUFFICIENT_DATA, null, null, null, null, null,
                message);
    }

    public static EvaluationResult failed(String equipmentId, String message) {
        return new EvaluationResult(equipmentId, EvaluationStatus.FAILED, null, null, null, null, null, message);
    }

    public Optional<FeatureVector> getFeatures() {
        return Optional.ofNullable(features);
    }

    public Optional<AnomalyResult> getAnomaly() {
        return Optional.ofNullable(anomaly);
    }

    public Optional<FailureForecast> getForecast() {
        return Optional.ofNullable(forecast);
    }

    @Override
    public String toString() {
        return "EvaluationResult{" + equipmentId + " " + status + (message.isEmpty() ? "" : " " + message) + "}";
    }
}
