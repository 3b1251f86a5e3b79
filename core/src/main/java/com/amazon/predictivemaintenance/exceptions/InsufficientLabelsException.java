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

/**
 * Not enough positive examples to train a failure model at the requested
 * scope. Training is expected to fall back to a coarser scope.
 */
public class InsufficientLabelsException extends MaintenanceException {

    private final int positives;

    private final int required;

    public InsufficientLabelsException(String scope, int positives, int required) {
        super(scope, String.format("scope %s has %d positive examples, at least %d are required", scope, positives,
                required));
        this.positives = positives;
        this.required = required;
    }

    public int getPositives() {
        return positives;
    }

    public int getRequired() {
        return required;
    }
}
