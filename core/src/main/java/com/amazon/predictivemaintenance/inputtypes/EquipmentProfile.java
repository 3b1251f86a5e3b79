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

package com.amazon.predictivemaintenance.inputtypes;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import lombok.Getter;

/**
 * Static description of one unit of equipment.
 */
@Getter
public class EquipmentProfile {

    private final String equipmentId;

    private final String equipmentClass;

    // year the unit went into service
    private final int commissionedYear;

    public EquipmentProfile(String equipmentId, String equipmentClass, int commissionedYear) {
        this.equipmentId = checkNotNull(equipmentId, "equipmentId must not be null");
        this.equipmentClass = checkNotNull(equipmentClass, "equipmentClass must not be null");
        this.commissionedYear = commissionedYear;
    }

    public int ageInYears(int currentYear) {
        return Math.max(0, currentYear - commissionedYear);
    }
}
