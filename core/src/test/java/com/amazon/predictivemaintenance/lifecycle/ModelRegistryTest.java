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

import static com.amazon.predictivemaintenance.tree.NodeStore.NULL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;
import com.amazon.predictivemaintenance.prediction.FailureForest;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ModelArtifact;
import com.amazon.predictivemaintenance.tree.DecisionTree;
import com.amazon.predictivemaintenance.tree.NodeStore;

public class ModelRegistryTest {

    static final FeatureSchema SCHEMA = FeatureSchema.builder().channels(List.of(Channel.PRESSURE))
            .statistics(List.of(Statistic.MEAN)).ratios(List.of()).build();

    static final ArtifactKey CLASS_KEY = ArtifactKey.forClass(ModelKind.FAILURE, "Pump");

    static final ArtifactKey UNIT_KEY = ArtifactKey.forEquipment(ModelKind.FAILURE, "Pump", "pump-1");

    static ModelArtifact<FailureForest> artifact(ArtifactKey key, long version) {
        NodeStore leaf = NodeStore.builder().leftIndex(new int[] { NULL }).rightIndex(new int[] { NULL })
                .cutDimension(new int[] { NULL }).cutValues(new double[1]).mass(new int[] { 1 }).valueWidth(1)
                .leafValues(new double[] { version / 100.0 }).build();
        FailureForest forest = new FailureForest(SCHEMA, new long[] { 3_600_000L },
                List.of(new DecisionTree(leaf)));
        return new ModelArtifact<>(key, version, version * 1000, 0, 10, forest);
    }

    @Test
    public void testPublishSwapsAndKeepsHistory() {
        ModelRegistry registry = new ModelRegistry(2);
        assertFalse(registry.active(CLASS_KEY).isPresent());
        assertFalse(registry.publish(artifact(CLASS_KEY, 1)).isPresent());
        assertEquals(1, registry.publish(artifact(CLASS_KEY, 2)).get().getVersion());
        registry.publish(artifact(CLASS_KEY, 3));
        registry.publish(artifact(CLASS_KEY, 4));

        assertEquals(4, registry.active(CLASS_KEY).get().getVersion());
        List<ModelArtifact<? extends ITrainedModel>> history = registry.history(CLASS_KEY);
        assertEquals(2, history.size());
        assertEquals(3, history.get(0).getVersion());
        assertEquals(2, history.get(1).getVersion());
        assertEquals(4, registry.latestVersion(CLASS_KEY));
        assertEquals(0, registry.latestVersion(UNIT_KEY));
        assertTrue(registry.history(UNIT_KEY).isEmpty());
    }

    @Test
    public void testRollback() {
        ModelRegistry registry = new ModelRegistry(5);
        assertFalse(registry.rollback(CLASS_KEY).isPresent());
        registry.publish(artifact(CLASS_KEY, 1));
        assertFalse(registry.rollback(CLASS_KEY).isPresent());
        registry.publish(artifact(CLASS_KEY, 2));
        registry.publish(artifact(CLASS_KEY, 3));

        assertEquals(2, registry.rollback(CLASS_KEY).get().getVersion());
        assertEquals(2, registry.active(CLASS_KEY).get().getVersion());
        assertEquals(1, registry.rollback(CLASS_KEY).get().getVersion());
        assertEquals(1, registry.active(CLASS_KEY).get().getVersion());
        assertFalse(registry.rollback(CLASS_KEY).isPresent());
        assertEquals(1, registry.active(CLASS_KEY).get().getVersion());
    }

    @Test
    public void testResolvePrefersEquipmentScope() {
        ModelRegistry registry = new ModelRegistry(1);
        assertFalse(registry.resolve(ModelKind.FAILURE, "Pump", "pump-1", FailureForest.class).isPresent());
        ModelArtifact<FailureForest> classArtifact = artifact(CLASS_KEY, 1);
        registry.publish(classArtifact);
        assertSame(classArtifact, registry.resolve(ModelKind.FAILURE, "Pump", "pump-1", FailureForest.class).get());
        assertSame(classArtifact, registry.resolve(ModelKind.FAILURE, "Pump", null, FailureForest.class).get());

        ModelArtifact<FailureForest> unitArtifact = artifact(UNIT_KEY, 1);
        registry.publish(unitArtifact);
        assertSame(unitArtifact, registry.resolve(ModelKind.FAILURE, "Pump", "pump-1", FailureForest.class).get());
        assertSame(classArtifact, registry.resolve(ModelKind.FAILURE, "Pump", "pump-2", FailureForest.class).get());
        assertFalse(registry.resolve(ModelKind.ANOMALY, "Pump", "pump-1", IsolationForest.class).isPresent());
        assertFalse(registry.resolve(ModelKind.FAILURE, "Compressor", null, FailureForest.class).isPresent());
        assertThrows(IllegalArgumentException.class,
                () -> registry.resolve(ModelKind.FAILURE, "Pump", null, IsolationForest.class));
    }

    @Test
    public void testReadersNeverSeeAMissingArtifact() throws Exception {
        ModelRegistry registry = new ModelRegistry(3);
        registry.publish(artifact(CLASS_KEY, 1));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int r = 0; r < 3; r++) {
                readers.add(pool.submit(() -> {
                    start.await();
                    long last = 0;
                    for (int i = 0; i < 10_000; i++) {
                        Optional<ModelArtifact<FailureForest>> seen = registry.resolve(ModelKind.FAILURE, "Pump",
                                "pump-1", FailureForest.class);
                        if (seen.isEmpty() || seen.get().getVersion() < last) {
                            return false;
                        }
                        last = seen.get().getVersion();
                    }
                    return true;
                }));
            }
            start.countDown();
            for (long version = 2; version <= 200; version++) {
                registry.publish(artifact(CLASS_KEY, version));
            }
            for (Future<Boolean> reader : readers) {
                assertTrue(reader.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(200, registry.active(CLASS_KEY).get().getVersion());
        assertThrows(IllegalArgumentException.class, () -> new ModelRegistry(0));
    }
}
