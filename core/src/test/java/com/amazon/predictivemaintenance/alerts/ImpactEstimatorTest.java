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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.OptionalInt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ImpactEstimatorTest {

    private final ImpactEstimator estimator = ImpactEstimator.defaults();

    @ParameterizedTest
    @CsvSource({ "CNC Mill, 24, 5000", "Injection Molder, 36, 8000", "Robotic Arm, 16, 4000",
            "Assembly Line, 48, 12000", "Packaging Unit, 12, 3000", "Lathe, 24, 6000" })
    public void testBaseImpact(String equipmentClass, double downtime, double cost) {
        MaintenanceImpact impact = estimator.estimate(equipmentClass, OptionalInt.empty(), 0);
        assertEquals(downtime, impact.getDowntimeHours(), 1e-9);
        assertEquals(cost, impact.getRepairCost(), 1e-9);
    }

    @Test
    public void testAgeAndProbabilityScale() {
        assertEquals(new MaintenanceImpact(36, 8000), estimator.estimate("Injection Molder", OptionalInt.of(3), 0));
        MaintenanceImpact old = estimator.estimate("Injection Molder", OptionalInt.of(5), 0.5);
        assertEquals(36 * 1.2 * 1.5, old.getDowntimeHours(), 1e-9);
        assertEquals(8000 * 1.2 * 1.5, old.getRepairCost(), 1e-9);
    }

    @Test
    public void testCustomBase() {
        ImpactEstimator custom = ImpactEstimator.builder().base("Lathe", 10, 1000).fallback(1, 100).build();
        assertEquals(new MaintenanceImpact(20, 2000), custom.estimate("Lathe", OptionalInt.empty(), 1));
        assertEquals(new MaintenanceImpact(1, 100), custom.estimate("Press", OptionalInt.empty(), 0));
        assertThrows(IllegalArgumentException.class, () -> custom.estimate("Lathe", OptionalInt.empty(), 1.5));
        assertThrows(IllegalArgumentException.class, () -> ImpactEstimator.builder().base("Lathe", -1, 0));
    }
}
