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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.alerts.AlertEvent;
import com.amazon.predictivemaintenance.alerts.AlertSynthesizer;
import com.amazon.predictivemaintenance.anomalydetection.AnomalyScorer;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.config.PipelineConfig;
import com.amazon.predictivemaintenance.exceptions.ArtifactUnavailableException;
import com.amazon.predictivemaintenance.exceptions.InsufficientDataException;
import com.amazon.predictivemaintenance.ingest.WindowSupplier;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.inputtypes.Reading;
import com.amazon.predictivemaintenance.inputtypes.Window;
import com.amazon.predictivemaintenance.lifecycle.ModelLifecycleManager;
import com.amazon.predictivemaintenance.lifecycle.ModelRegistry;
import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.prediction.FailurePredictor;
import com.amazon.predictivemaintenance.preprocessor.FeatureExtractor;
import com.amazon.predictivemaintenance.returntypes.AnomalyResult;
import com.amazon.predictivemaintenance.returntypes.EvaluationResult;
import com.amazon.predictivemaintenance.returntypes.FailureForecast;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * Evaluates windows end to end: features, anomaly score, failure forecast, and
 * alert synthesis. Each window is evaluated against the artifacts in effect
 * when the evaluation starts; a publication that happens meanwhile applies to
 * later evaluations only.
 *
 * Failures are contained per unit of equipment and reported through the
 * {@link EvaluationResult} status; one unit's failure never prevents the others
 * in a batch from being evaluated.
 */
@Slf4j
@Getter
public class MaintenancePipeline {

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final FeatureExtractor featureExtractor;

    private final AnomalyScorer anomalyScorer;

    private final FailurePredictor failurePredictor;

    private final AlertSynthesizer alertSynthesizer;

    private final ModelLifecycleManager lifecycleManager;

    private final boolean parallelExecutionEnabled;

    private final int threadPoolSize;

    @Getter(AccessLevel.NONE)
    private ForkJoinPool forkJoinPool;

    // newest reading already counted towards retraining, per unit
    @Getter(AccessLevel.NONE)
    private final Map<String, Long> lastCounted = new ConcurrentHashMap<>();

    protected MaintenancePipeline(Builder<?> builder) {
        this.featureExtractor = checkNotNull(builder.featureExtractor, "featureExtractor must not be null");
        this.anomalyScorer = checkNotNull(builder.anomalyScorer, "anomalyScorer must not be null");
        this.failurePredictor = checkNotNull(builder.failurePredictor, "failurePredictor must not be null");
        this.alertSynthesizer = checkNotNull(builder.alertSynthesizer, "alertSynthesizer must not be null");
        this.lifecycleManager = checkNotNull(builder.lifecycleManager, "lifecycleManager must not be null");
        this.parallelExecutionEnabled = builder.parallelExecutionEnabled;
        if (parallelExecutionEnabled) {
            this.threadPoolSize = (builder.threadPoolSize == null)
                    ? Math.max(1, Runtime.getRuntime().availableProcessors() - 1)
                    : builder.threadPoolSize;
            checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        } else {
            this.threadPoolSize = 0;
        }
    }

    /**
     * evaluate one window
     *
     * @param window readings of one unit
     * @return the result; never throws for data or model problems of the unit
     */
    public EvaluationResult evaluate(Window window) {
        checkNotNull(window, "window must not be null");
        String equipmentId = window.getEquipmentId();
        try {
            recordNewSamples(window);
            FeatureVector vector = featureExtractor.extract(window);
            ModelRegistry registry = lifecycleManager.getRegistry();
            Set<ModelKind> unavailable = EnumSet.noneOf(ModelKind.class);
            List<String> messages = new ArrayList<>();

            AnomalyResult anomaly = null;
            try {
                ModelArtifact<IsolationForest> artifact = registry
                        .resolve(ModelKind.ANOMALY, window.getEquipmentClass(), equipmentId, IsolationForest.class)
                        .orElseThrow(() -> new ArtifactUnavailableException(ModelKind.ANOMALY, equipmentId));
                anomaly = anomalyScorer.score(vector, artifact);
            } catch (ArtifactUnavailableException e) {
                unavailable.add(ModelKind.ANOMALY);
                messages.add(e.getMessage());
            }

            FailureForecast forecast = null;
            try {
                ModelArtifact<FailureForest> artifact = registry
                        .resolve(ModelKind.FAILURE, window.getEquipmentClass(), equipmentId, FailureForest.class)
                        .orElseThrow(() -> new ArtifactUnavailableException(ModelKind.FAILURE, equipmentId));
                forecast = failurePredictor.predict(vector, artifact);
            } catch (ArtifactUnavailableException e) {
                unavailable.add(ModelKind.FAILURE);
                messages.add(e.getMessage());
            }

            List<AlertEvent> events = Collections.emptyList();
            if (anomaly != null || forecast != null) {
                events = alertSynthesizer.fuse(window.getEquipmentClass(), anomaly, forecast);
            }
            if (!unavailable.isEmpty()) {
                log.warn("partially scored {}: {}", equipmentId, messages);
            }
            log.debug("evaluated {}: anomaly={} forecast={} events={}", equipmentId, anomaly, forecast,
                    events.size());
            return EvaluationResult.scored(vector, anomaly, forecast, events, unavailable,
                    String.join("; ", messages));
        } catch (InsufficientDataException e) {
            log.debug("not enough data for {}: {}", equipmentId, e.getMessage());
            return EvaluationResult.insufficientData(equipmentId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("evaluation of {} failed", equipmentId, e);
            return EvaluationResult.failed(equipmentId, String.valueOf(e.getMessage()));
        }
    }

    /**
     * evaluate a batch of windows, in parallel when enabled
     *
     * @param windows windows of distinct units
     * @return one result per window, in the order of the windows
     */
    public List<EvaluationResult> evaluateAll(List<Window> windows) {
        checkNotNull(windows, "windows must not be null");
        if (!parallelExecutionEnabled) {
            return windows.stream().map(this::evaluate).collect(Collectors.toList());
        }
        return submitAndJoin(() -> windows.parallelStream().map(this::evaluate).collect(Collectors.toList()));
    }

    /**
     * Evaluate the windows supplied for a tick, then resolve alerts that have
     * gone quiet. Resolution events reach the alert sinks.
     *
     * @param supplier source of windows
     * @param now      time of the tick
     * @return one result per supplied window
     */
    public List<EvaluationResult> tick(WindowSupplier supplier, long now) {
        checkNotNull(supplier, "supplier must not be null");
        List<EvaluationResult> results = evaluateAll(supplier.windowsAt(now));
        List<AlertEvent> resolved = alertSynthesizer.resolveStale(now);
        if (!resolved.isEmpty()) {
            log.info("resolved {} alerts at {}", resolved.size(), now);
        }
        return results;
    }

    void recordNewSamples(Window window) {
        if (window.isEmpty()) {
            return;
        }
        Long previous = lastCounted.put(window.getEquipmentId(), window.getEndTimestamp());
        long count = 0;
        for (Reading reading : window.getReadings()) {
            if (previous == null || reading.getTimestamp() > previous) {
                ++count;
            }
        }
        if (count > 0) {
            lifecycleManager.recordSamples(window.getEquipmentClass(), window.getEquipmentId(), count);
        }
    }

    private synchronized ForkJoinPool pool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return pool().submit(callable).join();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private FeatureExtractor featureExtractor = FeatureExtractor.builder().build();
        private AnomalyScorer anomalyScorer = AnomalyScorer.builder().build();
        private FailurePredictor failurePredictor = FailurePredictor.builder().build();
        private AlertSynthesizer alertSynthesizer = AlertSynthesizer.builder().build();
        private ModelLifecycleManager lifecycleManager = null;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Integer threadPoolSize = null;

        /**
         * Configure every component from a configuration bean. The alert
         * synthesizer and lifecycle manager are built with their default
         * collaborators; set them afterwards to supply sinks, stores or label
         * sources.
         *
         * @param config pipeline settings
         * @return this builder
         */
        public T config(PipelineConfig config) {
            checkNotNull(config, "config must not be null");
            this.featureExtractor = config.toFeatureExtractor();
            this.anomalyScorer = config.toAnomalyScorer();
            this.failurePredictor = config.toFailurePredictor();
            this.alertSynthesizer = AlertSynthesizer.builder().policy(config.toAlertPolicy()).build();
            this.lifecycleManager = ModelLifecycleManager.builder().policy(config.toRetrainingPolicy())
                    .anomalyTrainer(config.toAnomalyTrainer()).failureTrainer(config.toFailureTrainer())
                    .labelBuilder(config.toLabelBuilder()).build();
            this.parallelExecutionEnabled = config.isParallelExecutionEnabled();
            this.threadPoolSize = config.getThreadPoolSize();
            return (T) this;
        }

        public T featureExtractor(FeatureExtractor featureExtractor) {
            this.featureExtractor = featureExtractor;
            return (T) this;
        }

        public T anomalyScorer(AnomalyScorer anomalyScorer) {
            this.anomalyScorer = anomalyScorer;
            return (T) this;
        }

        public T failurePredictor(FailurePredictor failurePredictor) {
            this.failurePredictor = failurePredictor;
            return (T) this;
        }

        public T alertSynthesizer(AlertSynthesizer alertSynthesizer) {
            this.alertSynthesizer = alertSynthesizer;
            return (T) this;
        }

        public T lifecycleManager(ModelLifecycleManager lifecycleManager) {
            this.lifecycleManager = lifecycleManager;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return (T) this;
        }

        public MaintenancePipeline build() {
            if (lifecycleManager == null) {
                lifecycleManager = ModelLifecycleManager.builder().build();
            }
            return new MaintenancePipeline(this);
        }
    }
}
