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

import static com.amazon.predictivemaintenance.alerts.ActionCatalog.GENERIC_ACTION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.amazon.predictivemaintenance.config.Channel;

public class ActionCatalogTest {

    private final ActionCatalog catalog = ActionCatalog.defaults();

    @Test
    public void testClassSpecificActionWins() {
        assertEquals("Inspect spindle bearings and tool holder balance",
                catalog.recommend("CNC Mill", ReasonCode.VIBRATION_ANOMALY));
        assertEquals("Inspect bearings, check lubrication and verify alignment",
                catalog.recommend("Packaging Unit", ReasonCode.VIBRATION_ANOMALY));
        assertEquals("Inspect the hydraulic pump and check valves",
                catalog.recommend("Injection Molder", ReasonCode.PRESSURE_ANOMALY));
        assertEquals("Check cooling system and inspect for friction sources",
                catalog.recommend("CNC Mill", ReasonCode.TEMPERATURE_ANOMALY));
    }

    @ParameterizedTest
    @EnumSource(ReasonCode.class)
    public void testEveryCodeHasAnAction(ReasonCode code) {
        assertNotNull(catalog.recommend("Unknown", code));
        assertEquals(code.isChannelAnomaly(), code.getChannel().isPresent());
    }

    @Test
    public void testGenericFallback() {
        assertEquals("Plan a component replacement before the next shift",
                catalog.recommend(null, ReasonCode.LOW_REMAINING_LIFE));
        assertEquals(GENERIC_ACTION, catalog.recommend("CNC Mill", null));

        ActionCatalog custom = ActionCatalog.builder().genericAction("Call the vendor")
                .action("Lathe", ReasonCode.POWER_ANOMALY, "Check the spindle drive").build();
        assertEquals("Check the spindle drive", custom.recommend("Lathe", ReasonCode.POWER_ANOMALY));
        assertEquals("Call the vendor", custom.recommend("Lathe", null));
    }

    @Test
    public void testAnomalyCodes() {
        for (Channel channel : Channel.values()) {
            assertEquals(channel, ReasonCode.anomalyOf(channel).getChannel().get());
        }
    }
}
