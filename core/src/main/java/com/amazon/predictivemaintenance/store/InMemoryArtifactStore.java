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

package com.amazon.predictivemaintenance.store;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;
import static com.amazon.predictivemaintenance.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import com.amazon.predictivemaintenance.ITrainedModel;

/**
 * An {@link ArtifactStore} backed by concurrent maps, one version map per key.
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final Map<ArtifactKey, NavigableMap<Long, ModelArtifact<? extends ITrainedModel>>> artifacts
            = new ConcurrentHashMap<>();

    @Override
    public Optional<ModelArtifact<? extends ITrainedModel>> loadLatest(ArtifactKey key) {
        NavigableMap<Long, ModelArtifact<? extends ITrainedModel>> versions = artifacts.get(key);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.lastEntry().getValue());
    }

    @Override
    public Optional<ModelArtifact<? extends ITrainedModel>> load(ArtifactKey key, long version) {
        NavigableMap<Long, ModelArtifact<? extends ITrainedModel>> versions = artifacts.get(key);
        return (versions == null) ? Optional.empty() : Optional.ofNullable(versions.get(version));
    }

    @Override
    public List<Long> versions(ArtifactKey key) {
        NavigableMap<Long, ModelArtifact<? extends ITrainedModel>> versions = artifacts.get(key);
        return (versions == null) ? new ArrayList<>() : new ArrayList<>(versions.keySet());
    }

    @Override
    public void publish(ModelArtifact<? extends ITrainedModel> artifact) {
        checkNotNull(artifact, "artifact must not be null");
        NavigableMap<Long, ModelArtifact<? extends ITrainedModel>> versions = artifacts
                .computeIfAbsent(artifact.getKey(), k -> new ConcurrentSkipListMap<>());
        synchronized (versions) {
            checkState(versions.isEmpty() || versions.lastKey() < artifact.getVersion(),
                    "version " + artifact.getVersion() + " of " + artifact.getKey() + " is not new");
            versions.put(artifact.getVersion(), artifact);
        }
    }
}
