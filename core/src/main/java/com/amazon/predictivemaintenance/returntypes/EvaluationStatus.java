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

package com.amazon.predictivemaintenance.returntypes;

public enum EvaluationStatus {
    /** both models scored the window */
    SCORED,
    /** at least one model had no artifact in effect; its output is absent */
    PARTIALLY_SCORED,
    /** the window had too few usable readings; retry with more data */
    INSUFFICIENT_DATA,
    /** the window could not be evaluated, for example because of a schema mismatch */
    FAILED
}
