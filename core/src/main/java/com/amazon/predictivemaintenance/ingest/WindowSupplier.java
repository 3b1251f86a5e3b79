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

package com.amazon.predictivemaintenance.ingest;

import java.util.List;

import com.amazon.predictivemaintenance.inputtypes.Window;

/**
 * Supplies the windows to evaluate at an evaluation tick, at most one per unit
 * of equipment.
 */
@FunctionalInterface
public interface WindowSupplier {

    /**
     * @param evaluationTime epoch millis of the tick
     * @return windows ending at or before the evaluation time
     */
    List<Window> windowsAt(long evaluationTime);
}
