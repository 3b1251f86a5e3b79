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

package com.amazon.predictivemaintenance.serialize;

import static com.amazon.predictivemaintenance.serialize.ModelArtifactSerDeTests.PUMP;
import static com.amazon.predictivemaintenance.serialize.ModelArtifactSerDeTests.anomalyArtifact;
import static com.amazon.predictivemaintenance.serialize.ModelArtifactSerDeTests.failureArtifact;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.lifecycle.ModelLifecycleManager;
import com.amazon.predictivemaintenance.lifecycle.RetrainingPolicy;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ModelArtifact;

public class JsonDirectoryArtifactStoreTest {

    @TempDir
    Path root;

    @Test
    public void testPublishAndLoad() {
        JsonDirectoryArtifactStore store = new JsonDirectoryArtifactStore(root);
        ArtifactKey key = ArtifactKey.forClass(ModelKind.ANOMALY, PUMP);
        assertTrue(store.versions(key).isEmpty());
        assertFalse(store.loadLatest(key).isPresent());

        store.publish(anomalyArtifact(1));
        store.publish(anomalyArtifact(3));

        assertEquals(List.of(1L, 3L), store.versions(key));
        assertTrue(Files.isRegularFile(root.resolve("ANOMALY").resolve("Pump").resolve("v3.json")));
        assertEquals(3, store.loadLatest(key).get().getVersion());
        ModelArtifact<? extends ITrainedModel> first = store.load(key, 1).get();
        assertEquals(key, first.getKey());
        assertTrue(first.getModel() instanceof IsolationForest);
        assertFalse(store.load(key, 2).isPresent());
    }

    @Test
    public void testVersionsOnlyIncrease() {
        JsonDirectoryArtifactStore store = new JsonDirectoryArtifactStore(root);
        store.publish(anomalyArtifact(2));
        assertThrows(IllegalStateException.class, () -> store.publish(anomalyArtifact(2)));
        assertThrows(IllegalStateException.class, () -> store.publish(anomalyArtifact(1)));
        assertThrows(NullPointerException.class, () -> store.publish(null));
    }

    @Test
    public void testEquipmentScopedKeys() throws Exception {
        JsonDirectoryArtifactStore store = new JsonDirectoryArtifactStore(root);
        store.publish(failureArtifact(1));
        ArtifactKey unitKey = ArtifactKey.forEquipment(ModelKind.FAILURE, PUMP, "pump-1");

        assertEquals(List.of(1L), store.versions(unitKey));
        assertTrue(store.versions(ArtifactKey.forClass(ModelKind.FAILURE, PUMP)).isEmpty());
        assertTrue(store.versions(ArtifactKey.forEquipment(ModelKind.FAILURE, PUMP, "pump-2")).isEmpty());

        // no temporary files are left behind
        try (Stream<Path> files = Files.walk(root)) {
            assertTrue(files.noneMatch(path -> path.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    public void testPathSegmentsAreEncoded() {
        JsonDirectoryArtifactStore store = new JsonDirectoryArtifactStore(root);
        Path directory = store.directoryOf(ArtifactKey.forEquipment(ModelKind.FAILURE, "CNC Mill/5-axis", "../x"));

        assertTrue(directory.normalize().startsWith(root.resolve("FAILURE")));
        assertEquals(3, root.relativize(directory).getNameCount());
    }

    @ParameterizedTest
    @ValueSource(strings = { ".", ".." })
    public void testDotSegmentsStayBelowRoot(String segment) {
        JsonDirectoryArtifactStore store = new JsonDirectoryArtifactStore(root);
        Path classDirectory = store.directoryOf(ArtifactKey.forClass(ModelKind.ANOMALY, segment));
        Path unitDirectory = store.directoryOf(ArtifactKey.forEquipment(ModelKind.ANOMALY, PUMP, segment));

        assertEquals(classDirectory, classDirectory.normalize());
        assertEquals(unitDirectory, unitDirectory.normalize());
        assertEquals(root.resolve("ANOMALY").resolve(segment.replace(".", "%2E")), classDirectory);
        assertEquals(3, root.relativize(unitDirectory).getNameCount());
        assertEquals("...", JsonDirectoryArtifactStore.encode("..."));
        assertThrows(IllegalArgumentException.class,
                () -> store.directoryOf(ArtifactKey.forEquipment(ModelKind.ANOMALY, PUMP, "")));
    }

    @Test
    public void testOtherFilesIgnored() throws Exception {
        JsonDirectoryArtifactStore store = new JsonDirectoryArtifactStore(root);
        store.publish(anomalyArtifact(1));
        Path directory = root.resolve("ANOMALY").resolve("Pump");
        Files.writeString(directory.resolve("notes.txt"), "retrained after overhaul");
        Files.writeString(directory.resolve("vx.json"), "{}");
        Files.writeString(directory.resolve("v.json"), "{}");

        assertEquals(List.of(1L), store.versions(ArtifactKey.forClass(ModelKind.ANOMALY, PUMP)));
        assertFalse(JsonDirectoryArtifactStore.isArtifactFile("v12.json.tmp"));
        assertTrue(JsonDirectoryArtifactStore.isArtifactFile("v12.json"));
        assertEquals(12, JsonDirectoryArtifactStore.parseVersion("v12.json"));
    }

    @Test
    public void testLifecycleManagerRestoresFromDirectory() {
        ArtifactKey key = ArtifactKey.forClass(ModelKind.ANOMALY, PUMP);
        ModelLifecycleManager writer = ModelLifecycleManager.builder().store(new JsonDirectoryArtifactStore(root))
                .policy(RetrainingPolicy.builder().holdoutFlagRateMultiplier(10).build()).build();
        ModelArtifact<? extends ITrainedModel> published = writer
                .retrain(key, ModelArtifactSerDeTests.vectors("pump-1", 400, 5));
        assertEquals(1, published.getVersion());

        ModelLifecycleManager reader = ModelLifecycleManager.builder()
                .store(new JsonDirectoryArtifactStore(root)).build();
        assertFalse(reader.getRegistry().active(key).isPresent());
        assertEquals(1, reader.loadFromStore(key).get().getVersion());
        assertEquals(1, reader.getRegistry().active(key).get().getVersion());
    }
}
