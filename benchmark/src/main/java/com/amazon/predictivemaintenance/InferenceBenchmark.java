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

package com.amazon.predictivemaintenance;

import java.util.ArrayList;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.predictivemaintenance.anomalydetection.AnomalyScorer;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForest;
import com.amazon.predictivemaintenance.anomalydetection.IsolationForestTrainer;
import com.amazon.predictivemaintenance.config.ModelKind;
import com.amazon.predictivemaintenance.inputtypes.FeatureVector;
import com.amazon.predictivemaintenance.inputtypes.Reading;
import com.amazon.predictivemaintenance.inputtypes.Window;
import com.amazon.predictivemaintenance.preprocessor.FeatureExtractor;
import com.amazon.predictivemaintenance.store.ArtifactKey;
import com.amazon.predictivemaintenance.store.ModelArtifact;
import com.amazon.predictivemaintenance.testutils.SensorSeries;
import com.amazon.predictivemaintenance.testutils.SensorSeriesTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class InferenceBenchmark {

    public final static int WINDOW_COUNT = 1_000;
    public final static int BASELINE_SIZE = 2_000;
    public final static String EQUIPMENT_CLASS = "CNC Mill";

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "60", "240" })
        int windowSize;

        @Param({ "50", "100" })
        int numberOfTrees;

        List<Window> windows;
        FeatureExtractor extractor;
        AnomalyScorer scorer;
        ModelArtifact<IsolationForest> artifact;

        @Setup(Level.Trial)
        public void setUp() {
            extractor = FeatureExtractor.builder().build();
            scorer = AnomalyScorer.builder().build();
            SensorSeriesTestData generator = new SensorSeriesTestData();
            List<FeatureVector> baseline = new ArrayList<>();
            for (Window window : windows(generator, BASELINE_SIZE, 11)) {
                baseline.add(extractor.extract(window));
            }
            IsolationForest forest = IsolationForestTrainer.builder().numberOfTrees(numberOfTrees).randomSeed(17)
                    .build().train(baseline);
            artifact = new ModelArtifact<>(ArtifactKey.forClass(ModelKind.ANOMALY, EQUIPMENT_CLASS), 1, 0,
                    baseline.get(0).getTimestamp(), baseline.get(baseline.size() - 1).getTimestamp(), forest);
            windows = windows(generator, WINDOW_COUNT, 23);
        }

        List<Window> windows(SensorSeriesTestData generator, int count, long seed) {
            SensorSeries series = generator.generate(0L, count + windowSize, seed);
            List<Reading> readings = new ArrayList<>();
            for (int i = 0; i < series.size(); i++) {
                readings.add(new Reading("unit-1", series.timestamps[i], series.values[i]));
            }
            List<Window> answer = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                answer.add(new Window("unit-1", EQUIPMENT_CLASS, readings.subList(i, i + windowSize)));
            }
            return answer;
        }
    }

    @Benchmark
    @OperationsPerInvocation(WINDOW_COUNT)
    public void extractOnly(BenchmarkState state, Blackhole blackhole) {
        for (Window window : state.windows) {
            blackhole.consume(state.extractor.extract(window));
        }
    }

    @Benchmark
    @OperationsPerInvocation(WINDOW_COUNT)
    public void extractAndScore(BenchmarkState state, Blackhole blackhole) {
        for (Window window : state.windows) {
            blackhole.consume(state.scorer.score(state.extractor.extract(window), state.artifact));
        }
    }
}
