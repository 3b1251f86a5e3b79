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

import lombok.Getter;

import com.amazon.predictivemaintenance.ITrainedModel;
import com.amazon.predictivemaintenance.state.ModelArtifactMapper;
import com.amazon.predictivemaintenance.state.ModelArtifactState;
import com.amazon.predictivemaintenance.store.ModelArtifact;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * {@link ModelArtifact} serialization. The {@link ModelArtifactMapper} turns an
 * artifact into a state object, which
 * <a href="https://github.com/google/gson">Gson</a> writes as JSON. The Gson
 * instance is exposed so that callers can customize the output, for example by
 * enabling pretty printing.
 */
@Getter
public class ModelArtifactSerDe {

    private final ModelArtifactMapper mapper;
    private final Gson gson;

    public ModelArtifactSerDe() {
        this(new ModelArtifactMapper(), new GsonBuilder().serializeSpecialFloatingPointValues().create());
    }

    /**
     * @param mapper converts artifacts to state objects and back
     * @param gson   writes and reads the {@link ModelArtifactState} objects
     */
    public ModelArtifactSerDe(ModelArtifactMapper mapper, Gson gson) {
        this.mapper = mapper;
        this.gson = gson;
    }

    public String toJson(ModelArtifact<? extends ITrainedModel> artifact) {
        return gson.toJson(mapper.toState(artifact));
    }

    /**
     * @param json a string written by {@link #toJson(ModelArtifact)}
     * @return the artifact, with the same key, version and model
     */
    public ModelArtifact<? extends ITrainedModel> fromJson(String json) {
        ModelArtifactState state = gson.fromJson(json, ModelArtifactState.class);
        return mapper.toModel(state);
    }
}
