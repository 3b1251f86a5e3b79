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

package com.amazon.predictivemaintenance.anomalydetection;

import static com.amazon.predictivemaintenance.inputtypes.FeatureSchema.MISSING_VALUE_SENTINEL;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.predictivemaintenance.config.Channel;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema;
import com.amazon.predictivemaintenance.inputtypes.FeatureSchema.Statistic;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;

public class IsolationForestTrainerTest {

    static final FeatureSchema SCHEMA = FeatureSchema.builder()
            .channels(List.of(Channel.TEMPERATURE, Channel.VIBRATION))
            .statistics(List.of(Statistic.MEAN, Statistic.MAX)).ratios(List.of()).build();

    private static List<FeatureVector> baseline;

    static List<FeatureVector> gaussianBaseline(int n, long seed) {
        Random random = new Random(seed);
        List<FeatureVector> answer = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double[] values = { 65 + random.nextGaussian(), 66 + random.nextGaussian(), 10 + random.nextGaussian(),
                    12 + random.nextGaussian() };
            answer.add(new FeatureVector("unit-1", "CNC Mill", i, SCHEMA, values));
        }
        return answer;
    }

    @BeforeAll
    public static void setUp() {
        baseline = gaussianBaseline(1000, 42);
    }

    @Test
    public void testSequentialAndParallelAgree() {
        IsolationForest sequential = IsolationForestTrainer.builder().numberOfTrees(40).randomSeed(7).build()
                .train(baseline);
        IsolationForest parallel = IsolationForestTrainer.builder().numberOfTrees(40).randomSeed(7)
                .parallelExecutionEnabled(true).threadPoolSize(3).build().train(baseline);
        assertEquals(sequential.getThreshold(), parallel.getThreshold());
        for (int i = 0; i < 20; i++) {
            double[] point = baseline.get(i * 7).getValues();
            assertEquals(sequential.score(point), parallel.score(point));
        }
        assertEquals(sequential.score(new double[] { 80, 90, 30, 40 }),
                parallel.score(new double[] { 80, 90, 30, 40 }));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.01, 0.05, 0.1 })
    public void testCalibratedFlagRate(double contamination) {
        IsolationForest forest = IsolationForestTrainer.builder().numberOfTrees(50).contamination(contamination)
                .randomSeed(11).build().train(baseline);
        int expected = (int) Math.round(baseline.size() * contamination);
        int flagged = 0;
        for (FeatureVector vector : baseline) {
            if (forest.isAnomalous(forest.score(vector))) {
                ++flagged;
            }
        }
        assertTrue(Math.abs(flagged - expected) <= 2, "flagged " + flagged);
    }

    @Test
    public void testOutliersScoreHigher() {
        IsolationForest forest = IsolationForestTrainer.builder().numberOfTrees(100).randomSeed(3).build()
                .train(baseline);
        double inlier = forest.score(new double[] { 65, 66, 10, 12 });
        double outlier = forest.score(new double[] { 65, 66, 25, 30 });
        assertTrue(outlier > inlier);
        assertTrue(forest.isAnomalous(outlier));
        assertTrue(inlier < 0.5);
        assertEquals(256, forest.getSampleSize());
        assertEquals(100, forest.getNumberOfTrees());
    }

    @Test
    public void testBaselineStatistics() {
        IsolationForest forest = IsolationForestTrainer.builder().numberOfTrees(5).randomSeed(3).build()
                .train(baseline);
        double[] mean = forest.getBaselineMean();
        double[] deviation = forest.getBaselineDeviation();
        assertEquals(65, mean[0], 0.2);
        assertEquals(10, mean[2], 0.2);
        assertEquals(1, deviation[3], 0.1);

        double[][] points = { { 1, MISSING_VALUE_SENTINEL }, { 3, MISSING_VALUE_SENTINEL } };
        double[] m = new double[2];
        double[] d = new double[2];
        IsolationForestTrainer.baselineStatistics(points, m, d);
        assertArrayEquals(new double[] { 2, MISSING_VALUE_SENTINEL }, m);
        assertArrayEquals(new double[] { Math.sqrt(2), 0 }, d, 1e-12);
    }

    @Test
    public void testCalibrate() {
        assertEquals(0.7, IsolationForestTrainer.calibrate(new double[] { 0.5, 0.1, 0.9, 0.3 }, 0.25), 1e-12);
        assertEquals(0.9, IsolationForestTrainer.calibrate(new double[] { 0.5, 0.1, 0.9, 0.3 }, 0.01), 1e-12);
    }

    static int countAbove(double[] scores, double threshold) {
        int count = 0;
        for (double score : scores) {
            if (score > threshold) {
                ++count;
            }
        }
        return count;
    }

    @Test
    public void testCalibrateWithTiedScores() {
        // three tied scores straddle the cut for two flags; flagging one is closer than flagging four
        double[] narrow = { 0.3, 0.3, 0.3, 0.3, 0.3, 0.3, 0.6, 0.6, 0.6, 0.9 };
        double threshold = IsolationForestTrainer.calibrate(narrow.clone(), 0.2);
        assertEquals(0.75, threshold, 1e-12);
        assertEquals(1, countAbove(narrow, threshold));

        // four tied scores for three flags: the whole block is closer
        double[] wide = { 0.3, 0.3, 0.3, 0.3, 0.3, 0.3, 0.6, 0.6, 0.6, 0.6 };
        threshold = IsolationForestTrainer.calibrate(wide.clone(), 0.3);
        assertEquals(0.45, threshold, 1e-12);
        assertEquals(4, countAbove(wide, threshold));

        double[] flat = { 0.5, 0.5, 0.5, 0.5 };
        assertEquals(0.5, IsolationForestTrainer.calibrate(flat.clone(), 0.25), 1e-12);
        assertEquals(0, countAbove(flat, 0.5));
    }

    @Test
    public void testRepeatedBaselineFlagsNothing() {
        List<FeatureVector> repeated = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            repeated.add(new FeatureVector("unit-1", "CNC Mill", i, SCHEMA, new double[] { 65, 66, 10, 12 }));
        }
        IsolationForest forest = IsolationForestTrainer.builder().numberOfTrees(10).contamination(0.05)
                .randomSeed(5).build().train(repeated);
        assertFalse(forest.isAnomalous(forest.score(repeated.get(0))));
    }

    @Test
    public void testInvalidInput() {
        IsolationForestTrainer trainer = IsolationForestTrainer.builder().numberOfTrees(5).randomSeed(0).build();
        assertThrows(IllegalArgumentException.class, () -> trainer.train(baseline.subList(0, 1)));

        List<FeatureVector> mixed = new ArrayList<>(baseline.subList(0, 10));
        FeatureSchema other = FeatureSchema.builder().channels(List.of(Channel.TEMPERATURE))
                .statistics(List.of(Statistic.MEAN, Statistic.MAX, Statistic.MIN, Statistic.LAST)).ratios(List.of())
                .build();
        mixed.add(new FeatureVector("unit-1", "CNC Mill", 10, other, new double[4]));
        assertThrows(IllegalArgumentException.class, () -> trainer.train(mixed));

        assertThrows(CancellationException.class, () -> trainer.train(baseline, () -> true));
        assertThrows(IllegalArgumentException.class, () -> IsolationForestTrainer.builder().contamination(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> IsolationForestTrainer.builder().sampleSize(1).build());
    }
}
