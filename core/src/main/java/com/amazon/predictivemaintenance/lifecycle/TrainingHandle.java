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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.Getter;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ModelArtifact;

/**
 * A retraining running in the background. Cancelling is cooperative: training
 * stops before its next tree and the candidate is discarded.
 */
public class TrainingHandle {

    @Getter
    private final ArtifactKey key;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final CompletableFuture<ModelArtifact<? extends ITrainedModel>> result = new CompletableFuture<>();

    TrainingHandle(ArtifactKey key) {
        this.key = key;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return completes with the published artifact, or exceptionally with the
     *         reason nothing was published
     */
    public CompletableFuture<ModelArtifact<? extends ITrainedModel>> getResult() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    void complete(ModelArtifact<? extends ITrainedModel> artifact) {
        result.complete(artifact);
    }

    void fail(Throwable throwable) {
        result.completeExceptionally(throwable);
    }
}
