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

package com.amazon.predictivemaintenance.exceptions;

import com.amazon.predictivemaintenance.config.ModelKind;

/**
 * No trained model is active for the requested key. Inference reports the
 * result as unscored instead of substituting a default score.
 */
public class ArtifactUnavailableException extends MaintenanceException {

    private final ModelKind modelKind;

    public ArtifactUnavailableException(ModelKind modelKind, String scope) {
        super(scope, String.format("no active %s model for %s", modelKind, scope));
        this.modelKind = modelKind;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }
}
