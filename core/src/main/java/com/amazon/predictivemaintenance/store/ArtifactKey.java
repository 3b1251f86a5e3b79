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

package com.amazon.predictivemaintenance.store;

import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.Objects;
import java.util.Optional;

import com.amazon.predictivemaintenance.config.ModelKind;

/**
 * Identifies the slot an artifact occupies: a model kind and a scope. The scope
 * is an equipment class, optionally narrowed to one unit of equipment.
 */
public final class ArtifactKey {

    private final ModelKind modelKind;

    private final String equipmentClass;

    // null for class-level artifacts
    private final String equipmentId;

    private ArtifactKey(ModelKind modelKind, String equipmentClass, String equipmentId) {
        this.modelKind = checkNotNull(modelKind, "modelKind must not be null");
        this.equipmentClass = checkNotNull(equipmentClass, "equipmentClass must not be null");
        this.equipmentId = equipmentId;
    }

    public static ArtifactKey forClass(ModelKind modelKind, String equipmentClass) {
        return new ArtifactKey(modelKind, equipmentClass, null);
    }

    public static ArtifactKey forEquipment(ModelKind modelKind, String equipmentClass, String equipmentId) {
        return new ArtifactKey(modelKind, equipmentClass, checkNotNull(equipmentId, "equipmentId must not be null"));
    }

    public ModelKind getModelKind() {
        return modelKind;
    }

    public String getEquipmentClass() {
        return equipmentClass;
    }

    public Optional<String> getEquipmentId() {
        return Optional.ofNullable(equipmentId);
    }

    public boolean isEquipmentScoped() {
        return equipmentId != null;
    }

    /**
     * @return the key of the class-level slot of the same kind
     */
    public ArtifactKey classKey() {
        return isEquipmentScoped() ? forClass(modelKind, equipmentClass) : this;
    }

    public String getScope() {
        return isEquipmentScoped() ? equipmentClass + "/" + equipmentId : equipmentClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArtifactKey)) {
            return false;
        }
        ArtifactKey that = (ArtifactKey) o;
        return modelKind == that.modelKind && equipmentClass.equals(that.equipmentClass)
                && Objects.equals(equipmentId, that.equipmentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelKind, equipmentClass, equipmentId);
    }

    @Override
    public String toString() {
        return modelKind + ":" + getScope();
    }
}
