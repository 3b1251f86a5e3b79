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

import static com.amazon.predictivemaintenance.prediction.LabelBuilder.HOUR;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForestTrainer;
import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.exceptions.InsufficientLabelsException;
import com.amazon.predictivemaintenance.exceptions.ValidationRegressionException;
import com.amazon.predictivemaintenance.ingest.FailureLabelSource;
import com.amazon.predictivemaintenance.inputtypes.FailureEvent;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.prediction.FailureForestTrainer;
import com.amazon.predictivemaintenance.prediction.LabelBuilder;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.InMemoryArtifactStore;
import com.amazon.predictivemaintenance.store.ModelArtifact;

@ExtendWith(MockitoExtension.class)
public class ModelLifecycleManagerTest {

    static final String CNC_MILL = "CNC Mill";

    static final FeatureSchema SCHEMA = FeatureSchema.builder()
            .channels(List.of(Channel.TEMPERATURE, Channel.VIBRATION))
            .statistics(List.of(Statistic.MEAN, Statistic.MAX)).ratios(List.of()).build();

    static final ArtifactKey ANOMALY_KEY = ArtifactKey.forClass(ModelKind.ANOMALY, CNC_MILL);

    static final ArtifactKey FAILURE_KEY = ArtifactKey.forClass(ModelKind.FAILURE, CNC_MILL);

    @Mock
    private LifecycleListener listener;

    private final AtomicLong now = new AtomicLong(1_000_000L);

    private InMemoryArtifactStore store;

    private ModelLifecycleManager manager;

    @BeforeEach
    public void setUp() {
        store = new InMemoryArtifactStore();
        manager = builder().build();
    }

    private ModelLifecycleManager.Builder<?> builder() {
        return ModelLifecycleManager.builder().store(store).clock(now::get).listener(listener)
                .policy(RetrainingPolicy.builder().dataVolumeThreshold(1000).retrainInterval(10 * HOUR)
                        .minFeedback(4).maxFalsePositiveRate(0.5).holdoutFlagRateMultiplier(6).build())
                .anomalyTrainer(IsolationForestTrainer.builder().numberOfTrees(20).randomSeed(1).build())
                .failureTrainer(FailureForestTrainer.builder().numberOfTrees(20).randomSeed(2).build())
                .labelBuilder(LabelBuilder.builder().horizons(HOUR, 2 * HOUR, 4 * HOUR).build())
                .executor(Runnable::run);
    }

    // normal operation of mill-1, one vector per minute
    static List<FeatureVector> baseline(int n, double vibrationShift, long seed) {
        Random random = new Random(seed);
        List<FeatureVector> answer = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double[] values = { 65 + random.nextGaussian(), 66 + random.nextGaussian(),
                    10 + vibrationShift + random.nextGaussian(), 12 + vibrationShift + random.nextGaussian() };
            answer.add(new FeatureVector("mill-1", CNC_MILL, i * 60_000L, SCHEMA, values));
        }
        return answer;
    }

    // mill-1 fails every ten hours and its vibration climbs towards each failure; mill-2 never fails
    static List<FeatureVector> wearCycles() {
        List<FeatureVector> answer = new ArrayList<>();
        for (int h = 0; h < 200; h++) {
            long t = h * HOUR + HOUR / 2;
            double phase = h % 10;
            answer.add(new FeatureVector("mill-1", CNC_MILL, t, SCHEMA,
                    new double[] { 65, 66, 10 + phase, 12 + phase }));
            answer.add(new FeatureVector("mill-2", CNC_MILL, t, SCHEMA, new double[] { 65, 66, 10, 12 }));
        }
        return answer;
    }

    static FailureLabelSource labelSource() {
        List<FailureEvent> failures = new ArrayList<>();
        for (int k = 1; k <= 20; k++) {
            failures.add(new FailureEvent("mill-1", k * 10 * HOUR, "spindle"));
        }
        FailureLabelSource source = mock(FailureLabelSource.class);
        when(source.failures(CNC_MILL)).thenReturn(failures);
        when(source.observationEnd(CNC_MILL)).thenReturn(204 * HOUR);
        return source;
    }

    private List<LifecycleEventType> eventTypes() {
        ArgumentCaptor<LifecycleEvent> captor = ArgumentCaptor.forClass(LifecycleEvent.class);
        verify(listener, atLeastOnce()).onEvent(captor.capture());
        return captor.getAllValues().stream().map(LifecycleEvent::getType).collect(Collectors.toList());
    }

    @Test
    public void testTriggers() {
        assertEquals(Optional.of(RetrainingTrigger.INITIAL), manager.dueTrigger(ANOMALY_KEY, now.get()));
        List<FeatureVector> vectors = baseline(200, 0, 3);
        assertTrue(manager.retrainIfDue(ANOMALY_KEY, vectors, now.get()).isPresent());
        assertFalse(manager.dueTrigger(ANOMALY_KEY, now.get()).isPresent());
        assertFalse(manager.retrainIfDue(ANOMALY_KEY, vectors, now.get()).isPresent());

        manager.recordAlertFeedback(CNC_MILL, "mill-1", true);
        manager.recordAlertFeedback(CNC_MILL, "mill-1", true);
        manager.recordAlertFeedback(CNC_MILL, "mill-1", false);
        assertFalse(manager.dueTrigger(ANOMALY_KEY, now.get()).isPresent());
        manager.recordAlertFeedback(CNC_MILL, "mill-1", false);
        assertEquals(Optional.of(RetrainingTrigger.DRIFT), manager.dueTrigger(ANOMALY_KEY, now.get()));

        assertEquals(Optional.of(RetrainingTrigger.SCHEDULE),
                manager.dueTrigger(ANOMALY_KEY, now.get() + 10 * HOUR));

        manager.recordSamples(CNC_MILL, "mill-1", 1000);
        assertEquals(Optional.of(RetrainingTrigger.DATA_VOLUME),
                manager.dueTrigger(ANOMALY_KEY, now.get() + 10 * HOUR));
        assertEquals(1000, manager.getStats(ArtifactKey.forEquipment(ModelKind.FAILURE, CNC_MILL, "mill-1"))
                .getSamplesSinceTraining());
    }

    @Test
    public void testRetrainPublishesNewVersions() {
        List<FeatureVector> vectors = baseline(200, 0, 4);
        ModelArtifact<? extends ITrainedModel> first = manager.retrain(ANOMALY_KEY, vectors);
        now.addAndGet(HOUR);
        ModelArtifact<? extends ITrainedModel> second = manager.retrain(ANOMALY_KEY, vectors);

        assertEquals(1, first.getVersion());
        assertEquals(2, second.getVersion());
        assertEquals(now.get(), second.getTrainedAt());
        assertEquals(0, second.getTrainingStart());
        // the newest fifth is held out
        assertEquals(159 * 60_000L, second.getTrainingEnd());
        assertEquals(List.of(1L, 2L), store.versions(ANOMALY_KEY));
        assertEquals(2, manager.getRegistry().active(ANOMALY_KEY).get().getVersion());
        assertEquals(1, manager.getRegistry().history(ANOMALY_KEY).get(0).getVersion());
        assertTrue(second.getModel() instanceof IsolationForest);
        assertEquals(List.of(LifecycleEventType.PUBLISHED, LifecycleEventType.PUBLISHED), eventTypes());
    }

    @Test
    public void testValidationFailureKeepsActiveArtifact() {
        List<FeatureVector> healthy = baseline(200, 0, 5);
        manager.retrain(ANOMALY_KEY, healthy);

        // the newest vectors, which land in the holdout, are far from the training data
        List<FeatureVector> drifted = new ArrayList<>(healthy.subList(0, 160));
        for (FeatureVector vector : baseline(200, 20, 6).subList(160, 200)) {
            drifted.add(vector);
        }
        ValidationRegressionException exception = assertThrows(ValidationRegressionException.class,
                () -> manager.retrain(ANOMALY_KEY, drifted));
        assertEquals(ModelKind.ANOMALY, exception.getModelKind());
        assertTrue(exception.getMeasured() > exception.getRequired());
        assertEquals(1, manager.getRegistry().active(ANOMALY_KEY).get().getVersion());
        assertEquals(List.of(1L), store.versions(ANOMALY_KEY));
        assertEquals(List.of(LifecycleEventType.PUBLISHED, LifecycleEventType.VALIDATION_FAILED), eventTypes());
    }

    @Test
    public void testFailureModelFallsBackToClass() {
        ModelLifecycleManager withLabels = builder().labelSource(labelSource()).build();
        ArtifactKey unitKey = ArtifactKey.forEquipment(ModelKind.FAILURE, CNC_MILL, "mill-2");

        ModelArtifact<? extends ITrainedModel> artifact = withLabels.retrain(unitKey, wearCycles());
        assertEquals(FAILURE_KEY, artifact.getKey());
        assertFalse(withLabels.getRegistry().active(unitKey).isPresent());
        assertEquals(List.of(LifecycleEventType.LABEL_FALLBACK, LifecycleEventType.PUBLISHED), eventTypes());

        FailureForest forest = artifact.as(FailureForest.class).getModel();
        double[] nearFailure = forest.probabilities(new double[] { 65, 66, 19, 21 });
        double[] healthy = forest.probabilities(new double[] { 65, 66, 10, 12 });
        assertTrue(nearFailure[0] > 0.9);
        assertTrue(healthy[2] < 0.1);
    }

    @Test
    public void testFallenBackUnitFollowsClassTriggers() {
        ModelLifecycleManager withLabels = builder().labelSource(labelSource()).build();
        ArtifactKey unitKey = ArtifactKey.forEquipment(ModelKind.FAILURE, CNC_MILL, "mill-2");
        List<FeatureVector> vectors = wearCycles();

        assertTrue(withLabels.retrainIfDue(unitKey, vectors, now.get()).isPresent());
        assertFalse(withLabels.dueTrigger(unitKey, now.get()).isPresent());
        assertFalse(withLabels.retrainIfDue(unitKey, vectors, now.get()).isPresent());
        assertEquals(1, withLabels.getRegistry().active(FAILURE_KEY).get().getVersion());
        assertEquals(List.of(LifecycleEventType.LABEL_FALLBACK, LifecycleEventType.PUBLISHED), eventTypes());

        withLabels.recordSamples(CNC_MILL, "mill-2", 1000);
        assertEquals(Optional.of(RetrainingTrigger.DATA_VOLUME), withLabels.dueTrigger(unitKey, now.get()));
    }

    @Test
    public void testFailureModelForUnitWithLabels() {
        ModelLifecycleManager withLabels = builder().labelSource(labelSource()).build();
        ArtifactKey unitKey = ArtifactKey.forEquipment(ModelKind.FAILURE, CNC_MILL, "mill-1");
        ModelArtifact<? extends ITrainedModel> artifact = withLabels.retrain(unitKey, wearCycles());
        assertEquals(unitKey, artifact.getKey());
        assertEquals(1, withLabels.getRegistry().resolve(ModelKind.FAILURE, CNC_MILL, "mill-1",
                FailureForest.class).get().getVersion());
    }

    @Test
    public void testMissingLabels() {
        FailureLabelSource source = mock(FailureLabelSource.class);
        when(source.failures("Lathe")).thenReturn(List.of());
        when(source.observationEnd("Lathe")).thenReturn(0L);
        ModelLifecycleManager withLabels = builder().labelSource(source).build();
        assertThrows(InsufficientLabelsException.class,
                () -> withLabels.retrain(ArtifactKey.forClass(ModelKind.FAILURE, "Lathe"), wearCycles()));

        assertThrows(IllegalStateException.class, () -> manager.retrain(FAILURE_KEY, wearCycles()));
    }

    @Test
    public void testCancellation() {
        assertThrows(CancellationException.class,
                () -> manager.retrain(ANOMALY_KEY, baseline(200, 0, 7), () -> true));
        assertFalse(manager.getRegistry().active(ANOMALY_KEY).isPresent());
        assertTrue(store.versions(ANOMALY_KEY).isEmpty());
        assertEquals(List.of(LifecycleEventType.CANCELLED), eventTypes());
    }

    @Test
    public void testAsyncHandle() {
        TrainingHandle handle = manager.retrainAsync(ANOMALY_KEY, baseline(200, 0, 8));
        assertTrue(handle.isDone());
        assertEquals(ANOMALY_KEY, handle.getKey());
        assertEquals(1, handle.getResult().join().getVersion());

        AtomicReference<Runnable> pending = new AtomicReference<>();
        ModelLifecycleManager deferred = builder().executor(pending::set).build();
        TrainingHandle cancelled = deferred.retrainAsync(ANOMALY_KEY, baseline(200, 0, 9));
        assertFalse(cancelled.isDone());
        cancelled.cancel();
        pending.get().run();
        assertTrue(cancelled.isCancelled());
        assertTrue(cancelled.getResult().isCompletedExceptionally());
        assertEquals(1, store.loadLatest(ANOMALY_KEY).get().getVersion());
    }

    @Test
    public void testAsyncHandleCompletesOnError() {
        FailureLabelSource source = mock(FailureLabelSource.class);
        when(source.failures(CNC_MILL)).thenThrow(new OutOfMemoryError("tree growth"));
        AtomicReference<Runnable> pending = new AtomicReference<>();
        ModelLifecycleManager deferred = builder().labelSource(source).executor(pending::set).build();

        TrainingHandle handle = deferred.retrainAsync(FAILURE_KEY, wearCycles());
        assertThrows(OutOfMemoryError.class, () -> pending.get().run());
        assertTrue(handle.isDone());
        assertTrue(handle.getResult().isCompletedExceptionally());
        assertFalse(deferred.getRegistry().active(FAILURE_KEY).isPresent());
    }

    @Test
    public void testVersionsContinueFromStore() {
        List<FeatureVector> vectors = baseline(200, 0, 10);
        ModelArtifact<? extends ITrainedModel> trained = manager.retrain(ANOMALY_KEY, vectors);
        store.publish(trained.withVersion(7));

        ModelLifecycleManager restarted = builder().build();
        assertEquals(8, restarted.retrain(ANOMALY_KEY, vectors).getVersion());

        ModelLifecycleManager loaded = builder().build();
        assertEquals(8, loaded.loadFromStore(ANOMALY_KEY).get().getVersion());
        assertEquals(8, loaded.getRegistry().active(ANOMALY_KEY).get().getVersion());
        assertFalse(loaded.dueTrigger(ANOMALY_KEY, now.get()).isPresent());
        assertFalse(loaded.loadFromStore(FAILURE_KEY).isPresent());
    }

    @Test
    public void testRollback() {
        List<FeatureVector> vectors = baseline(200, 0, 11);
        assertFalse(manager.rollback(ANOMALY_KEY).isPresent());
        manager.retrain(ANOMALY_KEY, vectors);
        manager.retrain(ANOMALY_KEY, vectors);
        assertEquals(1, manager.rollback(ANOMALY_KEY).get().getVersion());
        assertEquals(1, manager.getRegistry().active(ANOMALY_KEY).get().getVersion());
        assertEquals(List.of(LifecycleEventType.PUBLISHED, LifecycleEventType.PUBLISHED,
                LifecycleEventType.ROLLED_BACK), eventTypes());
        // the next publication does not reuse a version
        assertEquals(3, manager.retrain(ANOMALY_KEY, vectors).getVersion());
    }

    @Test
    public void testHoldoutSize() {
        assertEquals(40, manager.holdoutSize(200, 2));
        assertEquals(0, manager.holdoutSize(2, 2));
        assertEquals(1, manager.holdoutSize(3, 2));
        assertEquals(0, manager.holdoutSize(0, 1));
    }
}
