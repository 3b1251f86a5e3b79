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

package com.amazon.predictivemaintenance.lifecycle;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import lombok.Getter;

import com.amazon.predictivemaintenance.store.ArtifactKey;

@Getter
public final class LifecycleEvent {

    private final LifecycleEventType type;

    private final ArtifactKey key;

    // version involved, 0 when no artifact was produced
    private final long version;

    private final long time;

    private final String detail;

    public LifecycleEvent(LifecycleEventType type, ArtifactKey key, long version, long time, String detail) {
        this.type = checkNotNull(type, "type must not be null");
        this.key = checkNotNull(key, "key must not be null");
        this.version = version;
        this.time = time;
        this.detail = (detail == null) ? "" : detail;
    }

    @Override
    public String toString() {
        return type + " " + key + " v" + version + " " + detail;
    }
}
