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
 * A candidate artifact failed the minimum quality check. The candidate is
 * discarded and the previously active artifact remains in use.
 */
public class ValidationRegressionException extends MaintenanceException {

    private final ModelKind modelKind;

    private final double measured;

    private final double required;

    public ValidationRegressionException(ModelKind modelKind, String scope, String metric, double measured,
            double required) {
        super(scope, String.format("candidate %s model for %s failed validation: %s = %.4f, required %.4f", modelKind,
                scope, metric, measured, required));
        this.modelKind = modelKind;
        this.measured = measured;
        this.required = required;
    }

    public ModelKind getModelKind() {
        return modelKind;
    }

    public double getMeasured() {
        return measured;
    }

    public double getRequired() {
        return required;
    }
}
