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

import java.util.List;
import java.util.Optional;

import com.amazon.predictivemaintenance.ITrainedModel;

/**
 * Persistent home of model artifacts. Versions are strictly increasing per key;
 * the store never overwrites a published version.
 */
public interface ArtifactStore {

    /**
     * @param key an artifact slot
     * @return the artifact with the highest version for the key, if any
     */
    Optional<ModelArtifact<? extends ITrainedModel>> loadLatest(ArtifactKey key);

    Optional<ModelArtifact<? extends ITrainedModel>> load(ArtifactKey key, long version);

    /**
     * @param key an artifact slot
     * @return the published versions in increasing order
     */
    List<Long> versions(ArtifactKey key);

    /**
     * publish an artifact
     *
     * @param artifact a new artifact
     * @throws IllegalStateException if the version is not above the latest
     *                               published version of its key
     */
    void publish(ModelArtifact<? extends ITrainedModel> artifact);
}
