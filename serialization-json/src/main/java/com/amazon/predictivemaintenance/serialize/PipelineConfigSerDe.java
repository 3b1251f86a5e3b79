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

import java.io.Reader;

import lombok.Getter;

import com.amazon.predictivemaintenance.config.PipelineConfig;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Reads and writes {@link PipelineConfig} as JSON. Fields absent from the input
 * keep their defaults.
 */
@Getter
public class PipelineConfigSerDe {

    private final Gson gson;

    public PipelineConfigSerDe() {
        this(new GsonBuilder().setPrettyPrinting().create());
    }

    public PipelineConfigSerDe(Gson gson) {
        this.gson = gson;
    }

    public String toJson(PipelineConfig config) {
        return gson.toJson(config);
    }

    public PipelineConfig fromJson(String json) {
        return gson.fromJson(json, PipelineConfig.class);
    }

    public PipelineConfig fromJson(Reader reader) {
        return gson.fromJson(reader, PipelineConfig.class);
    }
}
