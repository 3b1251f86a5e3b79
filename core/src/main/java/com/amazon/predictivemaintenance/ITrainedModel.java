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

package com.amazon.predictivemaintenance;

import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;

/**
 * A trained model held inside a
 * {@link com.amazon.predictivemaintenance.store.ModelArtifact}. Models are
 * immutable once built; every thread that scores with a model sees the same
 * state.
 */
public interface ITrainedModel {

    ModelKind getModelKind();

    /**
     * @return the schema of the vectors the model was trained on
     */
    FeatureSchema getSchema();
}
