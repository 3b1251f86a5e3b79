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

package com.amazon.predictivemaintenance.lifecycle;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;
import static com.amazon.predictivemaintenance.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForestTrainer;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.exceptions.InsufficientLabelsException;
import com.amazon.predictivemaintenance.exceptions.ValidationRegressionException;
import com.amazon.predictivemaintenance.ingest.FailureLabelSource;
import com.amazon.predictivemaintenance.inputtypes.FailureEvent;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.prediction.FailureForestTrainer;
import com.amazon.predictivemaintenance.prediction.LabelBuilder;
import com.amazon.predictivemaintenance.prediction.LabeledDataset;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ArtifactStore;
import com.amazon.predictivemaintenance.store.InMemoryArtifactStore;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * Owns the trained artifacts of both model kinds: decides when a slot is due
 * for retraining, trains a candidate on the older part of the data, validates
 * it on the newest part, and publishes it to the store and the registry.
 *
 * Training never holds a lock used by scoring. A candidate becomes visible to
 * scorers through a single reference swap in the {@link ModelRegistry}; a
 * candidate that fails validation or is cancelled is discarded and the active
 * artifact stays in effect.
 */
@Slf4j
public class ModelLifecycleManager {

    @Getter
    private final ModelRegistry registry;

    @Getter
    private final ArtifactStore store;

    @Getter
    private final RetrainingPolicy policy;

    private final IsolationForestTrainer anomalyTrainer;

    private final FailureForestTrainer failureTrainer;

    private final LabelBuilder labelBuilder;

    private final FailureLabelSource labelSource;

    private final ArtifactValidator validator;

    private final Executor executor;

    private final LongSupplier clock;

    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<ArtifactKey, LifecycleStats> stats = new ConcurrentHashMap<>();

    private final Map<ArtifactKey, Object> trainingLocks = new ConcurrentHashMap<>();

    // unit slots served by their class model since the unit lacked positive labels
    private final Set<ArtifactKey> fallbacks = ConcurrentHashMap.newKeySet();

    protected ModelLifecycleManager(Builder<?> builder) {
        this.policy = checkNotNull(builder.policy, "policy must not be null");
        this.registry = (builder.registry == null) ? new ModelRegistry(policy.getHistorySize()) : builder.registry;
        this.store = checkNotNull(builder.store, "store must not be null");
        this.anomalyTrainer = checkNotNull(builder.anomalyTrainer, "anomalyTrainer must not be null");
        this.failureTrainer = checkNotNull(builder.failureTrainer, "failureTrainer must not be null");
        this.labelBuilder = checkNotNull(builder.labelBuilder, "labelBuilder must not be null");
        this.labelSource = builder.labelSource;
        this.executor = checkNotNull(builder.executor, "executor must not be null");
        this.clock = checkNotNull(builder.clock, "clock must not be null");
        this.validator = new ArtifactValidator(policy);
        builder.listeners.forEach(this::addListener);
    }

    public void addListener(LifecycleListener listener) {
        listeners.add(checkNotNull(listener, "listener must not be null"));
    }

    public void removeListener(LifecycleListener listener) {
        listeners.remove(listener);
    }

    public LifecycleStats getStats(ArtifactKey key) {
        return stats.computeIfAbsent(checkNotNull(key, "key must not be null"), k -> new LifecycleStats());
    }

    /**
     * count newly ingested samples of a unit against the class slots and the
     * unit's own slots
     *
     * @param equipmentClass class of the unit
     * @param equipmentId    the unit
     * @param count          number of new samples
     */
    public void recordSamples(String equipmentClass, String equipmentId, long count) {
        checkArgument(count >= 0, "count cannot be negative");
        for (ArtifactKey key : keysOf(equipmentClass, equipmentId)) {
            getStats(key).recordSamples(count);
        }
    }

    /**
     * record an operator's verdict on an alert of a unit
     *
     * @param equipmentClass class of the unit
     * @param equipmentId    the unit
     * @param falsePositive  true if the alert was not warranted
     */
    public void recordAlertFeedback(String equipmentClass, String equipmentId, boolean falsePositive) {
        for (ArtifactKey key : keysOf(equipmentClass, equipmentId)) {
            getStats(key).recordFeedback(falsePositive);
        }
    }

    /**
     * @param key a slot
     * @param now current time
     * @return the first trigger that applies to the slot, in the order INITIAL,
     *         DATA_VOLUME, SCHEDULE, DRIFT; a unit slot that fell back to its
     *         class model is judged by the class slot
     */
    public Optional<RetrainingTrigger> dueTrigger(ArtifactKey key, long now) {
        checkNotNull(key, "key must not be null");
        ArtifactKey slot = key;
        if (registry.active(key).isEmpty() && fallbacks.contains(key)) {
            slot = key.classKey();
        }
        Optional<ModelArtifact<? extends ITrainedModel>> active = registry.active(slot);
        if (active.isEmpty()) {
            return Optional.of(RetrainingTrigger.INITIAL);
        }
        LifecycleStats slotStats = getStats(slot);
        if (slotStats.getSamplesSinceTraining() >= policy.getDataVolumeThreshold()) {
            return Optional.of(RetrainingTrigger.DATA_VOLUME);
        }
        if (now - active.get().getTrainedAt() >= policy.getRetrainInterval()) {
            return Optional.of(RetrainingTrigger.SCHEDULE);
        }
        if (slotStats.getFeedbackCount() >= policy.getMinFeedback()
                && slotStats.getFalsePositiveRate() >= policy.getMaxFalsePositiveRate()) {
            return Optional.of(RetrainingTrigger.DRIFT);
        }
        return Optional.empty();
    }

    /**
     * retrain a slot if a trigger applies
     *
     * @param key     a slot
     * @param vectors training vectors of the slot's equipment class
     * @param now     current time
     * @return the published artifact, or empty when no trigger applies
     */
    public Optional<ModelArtifact<? extends ITrainedModel>> retrainIfDue(ArtifactKey key,
            List<FeatureVector> vectors, long now) {
        Optional<RetrainingTrigger> trigger = dueTrigger(key, now);
        if (trigger.isEmpty()) {
            return Optional.empty();
        }
        log.info("retraining {} ({})", key, trigger.get());
        return Optional.of(retrain(key, vectors));
    }

    public ModelArtifact<? extends ITrainedModel> retrain(ArtifactKey key, List<FeatureVector> vectors) {
        return retrain(key, vectors, () -> false);
    }

    /**
     * Train, validate and publish a new artifact for a slot. The newest
     * {@code holdoutFraction} of the vectors, by timestamp, is held out for
     * validation. A failure model for a unit that lacks positive labels falls
     * back to a model for the unit's class.
     *
     * @param key       a slot
     * @param vectors   training vectors of the slot's equipment class
     * @param cancelled polled during training
     * @return the published artifact
     * @throws ValidationRegressionException if the candidate fails validation
     * @throws InsufficientLabelsException   if the class lacks positive labels
     * @throws CancellationException         if cancelled before publication
     */
    public ModelArtifact<? extends ITrainedModel> retrain(ArtifactKey key, List<FeatureVector> vectors,
            BooleanSupplier cancelled) {
        checkNotNull(key, "key must not be null");
        checkNotNull(vectors, "vectors must not be null");
        checkNotNull(cancelled, "cancelled must not be null");
        synchronized (trainingLocks.computeIfAbsent(key, k -> new Object())) {
            try {
                if (key.getModelKind() == ModelKind.ANOMALY) {
                    return trainAnomaly(key, vectors, cancelled);
                }
                return trainFailure(key, vectors, cancelled);
            } catch (CancellationException e) {
                log.info("training of {} was cancelled", key);
                emit(LifecycleEventType.CANCELLED, key, 0, e.getMessage());
                throw e;
            } catch (ValidationRegressionException e) {
                log.warn("candidate for {} rejected: {}", key, e.getMessage());
                emit(LifecycleEventType.VALIDATION_FAILED, key, 0, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * retrain in the background
     *
     * @param key     a slot
     * @param vectors training vectors of the slot's equipment class
     * @return a handle to cancel the training and obtain its outcome
     */
    public TrainingHandle retrainAsync(ArtifactKey key, List<FeatureVector> vectors) {
        TrainingHandle handle = new TrainingHandle(key);
        List<FeatureVector> copy = new ArrayList<>(vectors);
        executor.execute(() -> {
            try {
                handle.complete(retrain(key, copy, handle::isCancelled));
            } catch (Throwable e) {
                handle.fail(e);
                if (e instanceof Error) {
                    throw (Error) e;
                }
            }
        });
        return handle;
    }

    /**
     * reinstate the artifact a slot held before its latest publication
     *
     * @param key a slot
     * @return the reinstated artifact, or empty when the slot has no history
     */
    public Optional<ModelArtifact<? extends ITrainedModel>> rollback(ArtifactKey key) {
        Optional<ModelArtifact<? extends ITrainedModel>> previous = registry.rollback(key);
        if (previous.isPresent()) {
            log.warn("rolled back {} to version {}", key, previous.get().getVersion());
            emit(LifecycleEventType.ROLLED_BACK, key, previous.get().getVersion(), "");
        } else {
            log.warn("no earlier artifact to roll back to for {}", key);
        }
        return previous;
    }

    /**
     * make the latest stored artifact of a slot active
     *
     * @param key a slot
     * @return the loaded artifact, if the store has one
     */
    public Optional<ModelArtifact<? extends ITrainedModel>> loadFromStore(ArtifactKey key) {
        Optional<ModelArtifact<? extends ITrainedModel>> latest = store.loadLatest(key);
        latest.ifPresent(artifact -> {
            Optional<ModelArtifact<? extends ITrainedModel>> active = registry.active(key);
            if (active.isEmpty() || active.get().getVersion() != artifact.getVersion()) {
                registry.publish(artifact);
                getStats(key).reset(artifact.getTrainedAt());
                log.info("loaded {} from the artifact store", artifact);
            }
        });
        return latest;
    }

    ModelArtifact<IsolationForest> trainAnomaly(ArtifactKey key, List<FeatureVector> vectors,
            BooleanSupplier cancelled) {
        List<FeatureVector> scoped = scoped(key, vectors);
        int holdout = holdoutSize(scoped.size(), IsolationForestTrainer.MIN_BASELINE_SIZE);
        List<FeatureVector> training = scoped.subList(0, scoped.size() - holdout);
        List<FeatureVector> held = scoped.subList(scoped.size() - holdout, scoped.size());
        IsolationForest candidate = anomalyTrainer.train(training, cancelled);
        double flagRate = validator.validateAnomaly(key.getScope(), candidate, held);
        log.debug("anomaly candidate for {} flags {} of the holdout", key, flagRate);
        return publishCandidate(key, candidate, training.get(0).getTimestamp(),
                training.get(training.size() - 1).getTimestamp(), cancelled);
    }

    ModelArtifact<FailureForest> trainFailure(ArtifactKey key, List<FeatureVector> vectors,
            BooleanSupplier cancelled) {
        checkState(labelSource != null, "a failure label source is required to train failure models");
        List<FailureEvent> failures = labelSource.failures(key.getEquipmentClass());
        long observationEnd = labelSource.observationEnd(key.getEquipmentClass());
        try {
            return trainFailureScope(key, vectors, failures, observationEnd, cancelled);
        } catch (InsufficientLabelsException e) {
            if (!key.isEquipmentScoped()) {
                throw e;
            }
            ArtifactKey classKey = key.classKey();
            log.info("{}; falling back to {}", e.getMessage(), classKey);
            emit(LifecycleEventType.LABEL_FALLBACK, key, 0, e.getMessage());
            ModelArtifact<FailureForest> published = trainFailureScope(classKey, vectors, failures, observationEnd,
                    cancelled);
            fallbacks.add(key);
            return published;
        }
    }

    ModelArtifact<FailureForest> trainFailureScope(ArtifactKey key, List<FeatureVector> vectors,
            List<FailureEvent> failures, long observationEnd, BooleanSupplier cancelled) {
        LabeledDataset labeled = labelBuilder.build(scoped(key, vectors), failures, observationEnd);
        if (labeled.getCensoredCount() > 0) {
            log.debug("{} vectors of {} have censored labels", labeled.getCensoredCount(), key);
        }
        int holdout = holdoutSize(labeled.size(), 1);
        LabeledDataset training = labeled.head(labeled.size() - holdout);
        LabeledDataset held = labeled.tail(holdout);
        FailureForest candidate = failureTrainer.train(training, key.getScope(), cancelled);
        FailureForest active = registry.active(key).map(a -> a.as(FailureForest.class).getModel()).orElse(null);
        double recall = validator.validateFailure(key.getScope(), candidate, active, held);
        log.debug("failure candidate for {} has holdout recall {}", key, recall);
        return publishCandidate(key, candidate, training.getExamples().get(0).getTimestamp(),
                training.getExamples().get(training.size() - 1).getTimestamp(), cancelled);
    }

    <M extends ITrainedModel> ModelArtifact<M> publishCandidate(ArtifactKey key, M model, long trainingStart,
            long trainingEnd, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("training of " + key + " was cancelled before publication");
        }
        long stored = store.loadLatest(key).map(a -> a.getVersion()).orElse(0L);
        long version = Math.max(registry.latestVersion(key), stored) + 1;
        ModelArtifact<M> artifact = new ModelArtifact<>(key, version, clock.getAsLong(), trainingStart, trainingEnd,
                model);
        store.publish(artifact);
        registry.publish(artifact);
        fallbacks.remove(key);
        getStats(key).reset(artifact.getTrainedAt());
        log.info("published {}", artifact);
        emit(LifecycleEventType.PUBLISHED, key, version, "");
        return artifact;
    }

    // the vectors of the slot, oldest first
    List<FeatureVector> scoped(ArtifactKey key, List<FeatureVector> vectors) {
        List<FeatureVector> answer = new ArrayList<>();
        for (FeatureVector vector : vectors) {
            if (!vector.getEquipmentClass().equals(key.getEquipmentClass())) {
                continue;
            }
            if (key.isEquipmentScoped() && !key.getEquipmentId().get().equals(vector.getEquipmentId())) {
                continue;
            }
            answer.add(vector);
        }
        answer.sort(Comparator.comparingLong(FeatureVector::getTimestamp));
        return answer;
    }

    // leaves at least minTraining elements for training
    int holdoutSize(int size, int minTraining) {
        int holdout = (int) Math.round(size * policy.getHoldoutFraction());
        return Math.max(0, Math.min(holdout, size - minTraining));
    }

    List<ArtifactKey> keysOf(String equipmentClass, String equipmentId) {
        checkNotNull(equipmentClass, "equipmentClass must not be null");
        List<ArtifactKey> keys = new ArrayList<>();
        for (ModelKind kind : ModelKind.values()) {
            keys.add(ArtifactKey.forClass(kind, equipmentClass));
            if (equipmentId != null) {
                keys.add(ArtifactKey.forEquipment(kind, equipmentClass, equipmentId));
            }
        }
        return keys;
    }

    void emit(LifecycleEventType type, ArtifactKey key, long version, String detail) {
        LifecycleEvent event = new LifecycleEvent(type, key, version, clock.getAsLong(), detail);
        for (LifecycleListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("lifecycle listener failed on {}", event, e);
            }
        }
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private ModelRegistry registry = null;
        private ArtifactStore store = new InMemoryArtifactStore();
        private RetrainingPolicy policy = RetrainingPolicy.defaults();
        private IsolationForestTrainer anomalyTrainer = IsolationForestTrainer.builder().build();
        private FailureForestTrainer failureTrainer = FailureForestTrainer.builder().build();
        private LabelBuilder labelBuilder = LabelBuilder.builder().build();
        private FailureLabelSource labelSource = null;
        private Executor executor = ForkJoinPool.commonPool();
        private LongSupplier clock = System::currentTimeMillis;
        private final List<LifecycleListener> listeners = new ArrayList<>();

        public T registry(ModelRegistry registry) {
            this.registry = registry;
            return (T) this;
        }

        public T store(ArtifactStore store) {
            this.store = store;
            return (T) this;
        }

        public T policy(RetrainingPolicy policy) {
            this.policy = policy;
            return (T) this;
        }

        public T anomalyTrainer(IsolationForestTrainer anomalyTrainer) {
            this.anomalyTrainer = anomalyTrainer;
            return (T) this;
        }

        public T failureTrainer(FailureForestTrainer failureTrainer) {
            this.failureTrainer = failureTrainer;
            return (T) this;
        }

        public T labelBuilder(LabelBuilder labelBuilder) {
            this.labelBuilder = labelBuilder;
            return (T) this;
        }

        public T labelSource(FailureLabelSource labelSource) {
            this.labelSource = labelSource;
            return (T) this;
        }

        public T executor(Executor executor) {
            this.executor = executor;
            return (T) this;
        }

        public T clock(LongSupplier clock) {
            this.clock = clock;
            return (T) this;
        }

        public T listener(LifecycleListener listener) {
            this.listeners.add(listener);
            return (T) this;
        }

        public ModelLifecycleManager build() {
            return new ModelLifecycleManager(this);
        }
    }
}
