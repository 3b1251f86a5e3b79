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
 * Base class of the failures raised by the analytics pipeline. Every failure is
 * scoped: it names the equipment or the model scope it concerns, so that a
 * caller evaluating many units can record it against that unit and continue
 * with the others.
 */
public class MaintenanceException extends RuntimeException {

    private final String scope;

    public MaintenanceException(String scope, String message) {
        super(message);
        this.scope = scope;
    }

    public MaintenanceException(String scope, String message, Throwable cause) {
        super(message, cause);
        this.scope = scope;
    }

    /**
     * @return the equipment id, or the model key, the failure belongs to
     */
    public String getScope() {
        return scope;
    }
}
