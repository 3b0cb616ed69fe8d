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

package com.hbc.anomaly;

import java.util.Map;

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

import com.hbc.anomaly.config.AnomalyConfig;
import com.hbc.anomaly.engine.AnomalyDetectionEngine;
import com.hbc.anomaly.engine.ComponentSignal;
import com.hbc.anomaly.engine.FeatureVector;
import com.hbc.anomaly.engine.RegionSnapshot;
import com.hbc.anomaly.testutils.SignalDataSets;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class AnomalyDetectionEngineBenchmark {

    public final static int DATA_SIZE = 10_000;
    public final static int INITIAL_DATA_SIZE = 1_000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "100", "500" })
        int windowSize;

        @Param({ "0", "4", "9" })
        int numberOfComponents;

        double[] primary;
        FeatureVector[] components;
        AnomalyDetectionEngine engine;

        @Setup(Level.Trial)
        public void setUpData() {
            primary = SignalDataSets.noisySine(INITIAL_DATA_SIZE + DATA_SIZE, 0.5, 0.1, 96, 0.02, 17);
            double[][] values = SignalDataSets.components(INITIAL_DATA_SIZE + DATA_SIZE, numberOfComponents, 0.4,
                    0.05, 23);
            ComponentSignal[] signals = ComponentSignal.values();
            components = new FeatureVector[values.length];
            for (int i = 0; i < values.length; i++) {
                FeatureVector.Builder builder = FeatureVector.builder();
                for (int j = 0; j < numberOfComponents; j++) {
                    // index 0 is the primary signal
                    builder.put(signals[j + 1], values[i][j]);
                }
                components[i] = builder.build();
            }
        }

        @Setup(Level.Invocation)
        public void setUpEngine() {
            engine = new AnomalyDetectionEngine(AnomalyConfig.builder().windowSize(windowSize).build());
            for (int i = 0; i < INITIAL_DATA_SIZE; i++) {
                engine.update("region", primary[i], components[i]);
            }
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public AnomalyDetectionEngine updateOnly(BenchmarkState state) {
        AnomalyDetectionEngine engine = state.engine;
        for (int i = INITIAL_DATA_SIZE; i < state.primary.length; i++) {
            engine.update("region", state.primary[i], state.components[i]);
        }
        return engine;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public AnomalyDetectionEngine updateAndExport(BenchmarkState state, Blackhole blackhole) {
        AnomalyDetectionEngine engine = state.engine;
        for (int i = INITIAL_DATA_SIZE; i < state.primary.length; i++) {
            engine.update("region", state.primary[i], state.components[i]);
            RegionSnapshot snapshot = engine.snapshot("region");
            Map<String, Double> metrics = snapshot.toMetrics();
            blackhole.consume(metrics);
        }
        return engine;
    }
}
