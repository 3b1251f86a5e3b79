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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * The artifacts in effect, one per slot, with a bounded history of the
 * artifacts they replaced. Readers take a snapshot of the active reference and
 * never block; publication and rollback swap the reference atomically.
 */
public class ModelRegistry {

    private final int historySize;

    private final Map<ArtifactKey, Slot> slots = new ConcurrentHashMap<>();

    public ModelRegistry(int historySize) {
        checkArgument(historySize > 0, "historySize must be positive");
        this.historySize = historySize;
    }

    public Optional<ModelArtifact<? extends ITrainedModel>> active(ArtifactKey key) {
        Slot slot = slots.get(key);
        return (slot == null) ? Optional.empty() : Optional.ofNullable(slot.active.get());
    }

    /**
     * The artifact in effect for a unit of equipment: its own artifact when one
     * is active, otherwise the artifact of its class.
     *
     * @param kind           model kind
     * @param equipmentClass class of the equipment
     * @param equipmentId    the unit, or null for the class artifact only
     * @param type           model class
     * @param <M>            model type
     * @return the artifact, if any
     */
    public <M extends ITrainedModel> Optional<ModelArtifact<M>> resolve(ModelKind kind, String equipmentClass,
            String equipmentId, Class<M> type) {
        if (equipmentId != null) {
            Optional<ModelArtifact<? extends ITrainedModel>> own = active(
                    ArtifactKey.forEquipment(kind, equipmentClass, equipmentId));
            if (own.isPresent()) {
                return Optional.of(own.get().as(type));
            }
        }
        return active(ArtifactKey.forClass(kind, equipmentClass)).map(a -> a.as(type));
    }

    /**
     * make an artifact active for its key
     *
     * @param artifact the new artifact
     * @return the artifact it replaced, if any
     */
    public Optional<ModelArtifact<? extends ITrainedModel>> publish(ModelArtifact<? extends ITrainedModel> artifact) {
        checkNotNull(artifact, "artifact must not be null");
        Slot slot = slots.computeIfAbsent(artifact.getKey(), k -> new Slot());
        synchronized (slot) {
            ModelArtifact<? extends ITrainedModel> previous = slot.active.getAndSet(artifact);
            if (previous != null) {
                slot.history.addFirst(previous);
                while (slot.history.size() > historySize) {
                    slot.history.removeLast();
                }
            }
            return Optional.ofNullable(previous);
        }
    }

    /**
     * reinstate the artifact replaced most recently
     *
     * @param key a slot
     * @return the reinstated artifact, or empty when there is no history
     */
    public Optional<ModelArtifact<? extends ITrainedModel>> rollback(ArtifactKey key) {
        Slot slot = slots.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            ModelArtifact<? extends ITrainedModel> previous = slot.history.pollFirst();
            if (previous != null) {
                slot.active.set(previous);
            }
            return Optional.ofNullable(previous);
        }
    }

    /**
     * @param key a slot
     * @return replaced artifacts, most recent first
     */
    public List<ModelArtifact<? extends ITrainedModel>> history(ArtifactKey key) {
        Slot slot = slots.get(key);
        if (slot == null) {
            return new ArrayList<>();
        }
        synchronized (slot) {
            return new ArrayList<>(slot.history);
        }
    }

    /**
     * @param key a slot
     * @return the highest version the registry has seen for the slot, 0 if none
     */
    public long latestVersion(ArtifactKey key) {
        Slot slot = slots.get(key);
        if (slot == null) {
            return 0;
        }
        synchronized (slot) {
            long answer = (slot.active.get() == null) ? 0 : slot.active.get().getVersion();
            for (ModelArtifact<? extends ITrainedModel> artifact : slot.history) {
                answer = Math.max(answer, artifact.getVersion());
            }
            return answer;
        }
    }

    public int getHistorySize() {
        return historySize;
    }

    private static class Slot {
        final AtomicReference<ModelArtifact<? extends ITrainedModel>> active = new AtomicReference<>();
        final Deque<ModelArtifact<? extends ITrainedModel>> history = new ArrayDeque<>();
    }
}
