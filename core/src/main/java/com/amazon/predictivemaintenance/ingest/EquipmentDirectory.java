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

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.amazon.predictivemaintenance.inputtypes.EquipmentProfile;

/**
 * Lookup of equipment metadata maintained by the ingestion layer.
 */
@FunctionalInterface
public interface EquipmentDirectory {

    Optional<EquipmentProfile> find(String equipmentId);

    static EquipmentDirectory empty() {
        return equipmentId -> Optional.empty();
    }

    static EquipmentDirectory of(Collection<EquipmentProfile> profiles) {
        checkNotNull(profiles, "profiles must not be null");
        Map<String, EquipmentProfile> byId = new HashMap<>();
        for (EquipmentProfile profile : profiles) {
            byId.put(profile.getEquipmentId(), profile);
        }
        return equipmentId -> Optional.ofNullable(byId.get(equipmentId));
    }
}
