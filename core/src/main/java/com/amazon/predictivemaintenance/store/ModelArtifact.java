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

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.predictivemaintenance.ITrainedModel;

/**
 * An immutable, versioned trained model together with the data it was trained
 * on. Scorers hold a reference to one artifact for the duration of a call.
 *
 * @param <M> the model type
 */
@Getter
public final class ModelArtifact<M extends ITrainedModel> {

    private final ArtifactKey key;

    private final long version;

    private final long trainedAt;

    // timestamps of the oldest and newest training vectors
    private final long trainingStart;

    private final long trainingEnd;

    private final M model;

    public ModelArtifact(ArtifactKey key, long version, long trainedAt, long trainingStart, long trainingEnd,
            M model) {
        this.key = checkNotNull(key, "key must not be null");
        this.model = checkNotNull(model, "model must not be null");
        checkArgument(version > 0, "version must be positive");
        checkArgument(trainingStart <= trainingEnd, "incorrect training window");
        checkArgument(key.getModelKind() == model.getModelKind(), "model kind does not match the key");
        this.version = version;
        this.trainedAt = trainedAt;
        this.trainingStart = trainingStart;
        this.trainingEnd = trainingEnd;
    }

    /**
     * a typed view of this artifact
     *
     * @param type the expected model class
     * @param <T>  the model type
     * @return this artifact
     * @throws IllegalArgumentException if the model is of another class
     */
    @SuppressWarnings("unchecked")
    public <T extends ITrainedModel> ModelArtifact<T> as(Class<T> type) {
        checkArgument(type.isInstance(model), "artifact " + key + " does not hold a " + type.getSimpleName());
        return (ModelArtifact<T>) this;
    }

    /**
     * @param newVersion version of the copy
     * @return the same model and training window under a different version
     */
    public ModelArtifact<M> withVersion(long newVersion) {
        return new ModelArtifact<>(key, newVersion, trainedAt, trainingStart, trainingEnd, model);
    }

    @Override
    public String toString() {
        return key + "@v" + version;
    }
}
