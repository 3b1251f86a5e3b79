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

package com.amazon.predictivemaintenance.alerts;

import static com.amazon.predictivemaintenance.CommonUtils.checkArgument;
import static com.amazon.predictivemaintenance.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Estimates downtime and repair cost of a failure as
 * {@code base(class) * ageFactor * severityFactor}, where the age factor is
 * {@code 1 + 0.1 * (age - 3)} for equipment older than three years and the
 * severity factor is {@code 1 + failure probability}.
 */
public class ImpactEstimator {

    public static final double DEFAULT_DOWNTIME_HOURS = 24;

    public static final double DEFAULT_REPAIR_COST = 6000;

    public static final int AGE_ALLOWANCE_YEARS = 3;

    public static final double AGE_FACTOR_PER_YEAR = 0.1;

    private final Map<String, double[]> baseByClass;

    private final double[] fallback;

    protected ImpactEstimator(Builder<?> builder) {
        this.baseByClass = new HashMap<>(builder.baseByClass);
        this.fallback = new double[] { builder.defaultDowntimeHours, builder.defaultRepairCost };
    }

    /**
     * @param equipmentClass     class of the equipment
     * @param ageInYears         age of the equipment, when known
     * @param failureProbability probability used for the severity factor
     * @return the estimate
     */
    public MaintenanceImpact estimate(String equipmentClass, OptionalInt ageInYears, double failureProbability) {
        checkNotNull(equipmentClass, "equipmentClass must not be null");
        checkArgument(failureProbability >= 0 && failureProbability <= 1, "probability must be in [0, 1]");
        double[] base = baseByClass.getOrDefault(equipmentClass, fallback);
        int age = ageInYears.orElse(0);
        double ageFactor = (age > AGE_ALLOWANCE_YEARS) ? 1 + (age - AGE_ALLOWANCE_YEARS) * AGE_FACTOR_PER_YEAR : 1;
        double severityFactor = 1 + failureProbability;
        return new MaintenanceImpact(base[0] * ageFactor * severityFactor, base[1] * ageFactor * severityFactor);
    }

    public static ImpactEstimator defaults() {
        return builder().build();
    }

    public static Builder<?> builder() {
        return new Builder<>();
    }

    public static class Builder<T extends Builder<T>> {

        private final Map<String, double[]> baseByClass = new HashMap<>();
        private double defaultDowntimeHours = DEFAULT_DOWNTIME_HOURS;
        private double defaultRepairCost = DEFAULT_REPAIR_COST;

        public Builder() {
            base("CNC Mill", 24, 5000);
            base("Injection Molder", 36, 8000);
            base("Robotic Arm", 16, 4000);
            base("Assembly Line", 48, 12000);
            base("Packaging Unit", 12, 3000);
        }

        public T base(String equipmentClass, double downtimeHours, double repairCost) {
            checkNotNull(equipmentClass, "equipmentClass must not be null");
            checkArgument(downtimeHours >= 0 && repairCost >= 0, "base impact cannot be negative");
            baseByClass.put(equipmentClass, new double[] { downtimeHours, repairCost });
            return (T) this;
        }

        public T fallback(double downtimeHours, double repairCost) {
            checkArgument(downtimeHours >= 0 && repairCost >= 0, "base impact cannot be negative");
            this.defaultDowntimeHours = downtimeHours;
            this.defaultRepairCost = repairCost;
            return (T) this;
        }

        public ImpactEstimator build() {
            return new ImpactEstimator(this);
        }
    }
}
