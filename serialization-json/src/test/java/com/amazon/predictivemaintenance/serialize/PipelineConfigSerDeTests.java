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

package com.amazon.predictivemaintenance.serialize;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.predictivemaintenance.MaintenancePipeline;
import com.amazon.predictivemaintenance.alerts.AlertPolicy;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForestTrainer;
import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.config.PipelineConfig;
import com.amazon.predictivemaintenance.lifecycle.RetrainingPolicy;
import com.amazon.predictivemaintenance.prediction.FailureForestTrainer;
import com.amazon.predictivemaintenance.preprocessor.FeatureExtractor;

public class PipelineConfigSerDeTests {

    private PipelineConfigSerDe serDe;

    @BeforeEach
    public void setUp() {
        serDe = new PipelineConfigSerDe();
    }

    private PipelineConfig fixture() throws Exception {
        try (Reader reader = new InputStreamReader(
                PipelineConfigSerDeTests.class.getResourceAsStream("/pipeline-config.json"),
                StandardCharsets.UTF_8)) {
            return serDe.fromJson(reader);
        }
    }

    @Test
    public void testReadFixture() throws Exception {
        PipelineConfig config = fixture();

        assertTrue(config.isParallelExecutionEnabled());
        assertEquals(2, (int) config.getThreadPoolSize());
        assertEquals(6, config.getExtraction().getMinSamples());
        assertEquals(1, config.getExtraction().getBounds().size());
        assertEquals(Channel.VIBRATION, config.getExtraction().getBounds().get(0).getChannel());
        assertEquals(60.0, config.getExtraction().getBounds().get(0).getMax());
        assertEquals(40, config.getAnomaly().getNumberOfTrees());
        assertEquals(0.01, config.getAnomaly().getContamination());
        assertEquals(7L, (long) config.getAnomaly().getRandomSeed());
        assertArrayEquals(new long[] { 12, 48 }, config.getFailure().getHorizonHours());
        assertEquals(0.7, config.getAlerts().getCriticalProbability());
        assertEquals(10, config.getLifecycle().getMinFeedback());
    }

    @Test
    public void testAbsentFieldsKeepDefaults() throws Exception {
        PipelineConfig config = fixture();

        assertEquals(IsolationForestTrainer.DEFAULT_SAMPLE_SIZE, config.getAnomaly().getSampleSize());
        assertEquals(FailureForestTrainer.DEFAULT_NUMBER_OF_TREES, config.getFailure().getNumberOfTrees());
        assertNull(config.getFailure().getRandomSeed());
        assertEquals(AlertPolicy.DEFAULT_WARNING_PROBABILITY, config.getAlerts().getWarningProbability());
        assertEquals(RetrainingPolicy.DEFAULT_HOLDOUT_FRACTION, config.getLifecycle().getHoldoutFraction());

        PipelineConfig empty = serDe.fromJson("{}");
        assertEquals(new PipelineConfig(), empty);
        assertEquals(FeatureExtractor.DEFAULT_MIN_SAMPLES, empty.getExtraction().getMinSamples());
    }

    @Test
    public void testComponentsFromFixture() throws Exception {
        PipelineConfig config = fixture();

        AlertPolicy policy = config.toAlertPolicy();
        assertEquals(0.7, policy.getCriticalProbability());
        assertEquals(48 * AlertPolicy.HOUR, (long) policy.getWarningHorizon());
        assertEquals(90 * AlertPolicy.MINUTE, policy.getClearWindow());
        assertEquals(24 * AlertPolicy.HOUR, config.toRetrainingPolicy().getRetrainInterval());
        assertEquals(6, config.toFeatureExtractor().getMinSamples());

        MaintenancePipeline pipeline = MaintenancePipeline.builder().config(config).build();
        assertTrue(pipeline.isParallelExecutionEnabled());
        assertEquals(2, pipeline.getThreadPoolSize());
        assertEquals(0.7, pipeline.getAlertSynthesizer().getPolicy().getCriticalProbability());
    }

    @Test
    public void testRoundTrip() throws Exception {
        PipelineConfig config = fixture();
        String json = serDe.toJson(config);
        assertEquals(config, serDe.fromJson(json));
    }

    @Test
    public void testInvalidValuesRejectedByComponents() {
        PipelineConfig config = serDe.fromJson("{\"anomaly\": {\"contamination\": 0.7}}");
        assertEquals(0.7, config.getAnomaly().getContamination());
        assertThrows(IllegalArgumentException.class, config::toAnomalyTrainer);
    }
}
