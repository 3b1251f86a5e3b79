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
 * A window is too short or too sparse to summarize. This is not fatal; the
 * caller should wait for more readings and retry.
 */
public class InsufficientDataException extends MaintenanceException {

    private final int available;

    private final int required;

    public InsufficientDataException(String equipmentId, int available, int required) {
        super(equipmentId, String.format("equipment %s has %d usable readings, at least %d are required", equipmentId,
                available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
