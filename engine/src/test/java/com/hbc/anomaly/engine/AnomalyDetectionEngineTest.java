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

package com.hbc.anomaly.engine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.hbc.anomaly.config.AnomalyConfig;
import com.hbc.anomaly.testutils.SignalDataSets;

public class AnomalyDetectionEngineTest {

    @Test
    void unknownRegionHasNoData() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        RegionSnapshot snapshot = assertDoesNotThrow(() -> engine.snapshot("nonexistent_region"));
        assertFalse(snapshot.hasData());
        assertEquals("nonexistent_region", snapshot.getRegion());
        assertEquals(0, snapshot.getObservationCount());
        assertFalse(snapshot.isAnomaly());
        assertEquals(0, snapshot.getMdScore());
        assertTrue(engine.regions().isEmpty());
        assertFalse(engine.containsRegion("nonexistent_region"));
    }

    @Test
    void blankRegionIsRejected() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        assertThrows(IllegalArgumentException.class, () -> engine.update(null, 0.5));
        assertThrows(IllegalArgumentException.class, () -> engine.update("  ", 0.5));
        assertThrows(IllegalArgumentException.class, () -> engine.snapshot(""));
        assertThrows(NullPointerException.class, () -> new AnomalyDetectionEngine(null));
    }

    @Test
    void regionsAreCaseNormalized() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        engine.update("MN", 0.5);
        engine.update(" mn ", 0.6);
        engine.update("Mn", 0.7);
        assertEquals(1, engine.regions().size());
        assertEquals(3, engine.snapshot("mn").getObservationCount());
        assertEquals(3, engine.snapshot("MN").getObservationCount());
    }

    @Test
    void constantSignalRaisesNoFlags() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        Map<String, Double> components = new HashMap<>();
        components.put("economic_stress", 0.3);
        RegionSnapshot snapshot = null;
        for (double value : SignalDataSets.constant(25, 0.42)) {
            snapshot = engine.update("ca", value, components).get();
            assertEquals(0.0, snapshot.getZScore());
            assertEquals(0.0, snapshot.getResidualZScore());
            assertFalse(snapshot.isStaticAnomaly());
            assertFalse(snapshot.isZScoreAnomaly());
            assertFalse(snapshot.isSeasonalAnomaly());
            assertFalse(snapshot.isResidualAnomaly());
            assertEquals(0.0, snapshot.getMdScore());
            assertFalse(snapshot.isMdAnomaly());
        }
        assertEquals(0.0, snapshot.getMultivariate().getContributions().get("behavior_index"));
        assertEquals(0.0, snapshot.getMultivariate().getContributions().get("economic_stress"));
    }

    @Test
    void outlierIsFlaggedByUnivariateLayer() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        for (double value : SignalDataSets.uniform(500, 0.40, 0.60, 99)) {
            engine.update("tx", value);
        }
        RegionSnapshot snapshot = engine.update("tx", 0.99).get();
        assertTrue(snapshot.isStaticAnomaly());
        assertTrue(snapshot.isZScoreAnomaly());
        assertTrue(snapshot.isSeasonalAnomaly());
        assertTrue(snapshot.isAnomaly());
        assertTrue(snapshot.isWarmedUp());
        assertEquals(501, snapshot.getObservationCount());
    }

    @Test
    void jointComponentSpikeIsFlaggedByMultivariateLayer() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        double[][] rows = SignalDataSets.components(300, 4, 0.4, 0.02, 8);
        double[] primary = SignalDataSets.gaussian(300, 0.5, 0.02, 9);
        ComponentSignal[] signals = { ComponentSignal.ECONOMIC_STRESS, ComponentSignal.ENVIRONMENTAL_STRESS,
                ComponentSignal.POLITICAL_STRESS, ComponentSignal.CRIME_STRESS };
        for (int i = 0; i < rows.length; i++) {
            FeatureVector.Builder builder = FeatureVector.builder();
            for (int j = 0; j < signals.length; j++) {
                builder.put(signals[j], rows[i][j]);
            }
            engine.update("ny", primary[i], builder.build());
        }
        // every component moderately elevated at the same time
        FeatureVector.Builder builder = FeatureVector.builder();
        for (ComponentSignal signal : signals) {
            builder.put(signal, 0.48);
        }
        RegionSnapshot snapshot = engine.update("ny", 0.5, builder.build()).get();
        assertTrue(snapshot.isMdAnomaly());
        assertTrue(snapshot.getMdScore() > AnomalyConfig.DEFAULT_MULTIVARIATE_THRESHOLD);
        assertThat(snapshot.getFeatureNames(), containsInAnyOrder("behavior_index", "economic_stress",
                "environmental_stress", "political_stress", "crime_stress"));
    }

    @ParameterizedTest
    @ValueSource(doubles = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY })
    void nonFinitePrimaryIsDropped(double value) {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        engine.update("wa", 0.5);
        engine.update("wa", 0.6);
        RegionSnapshot before = engine.snapshot("wa");

        Optional<RegionSnapshot> result = engine.update("wa", value);

        assertFalse(result.isPresent());
        assertEquals(before, engine.snapshot("wa"));
        assertEquals(1, engine.getRejectedObservations());
        assertFalse(engine.update("or", value).isPresent());
        assertFalse(engine.containsRegion("or"));
        assertEquals(2, engine.getRejectedObservations());
    }

    @Test
    void nonFiniteComponentDropsWholeObservation() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        Map<String, Double> components = new HashMap<>();
        components.put("economic_stress", 0.2);
        engine.update("fl", 0.5, components);
        engine.update("fl", 0.55, components);
        RegionSnapshot before = engine.snapshot("fl");

        components.put("crime_stress", Double.NaN);
        assertFalse(engine.update("fl", 0.9, components).isPresent());

        RegionSnapshot after = engine.snapshot("fl");
        assertEquals(before, after);
        assertEquals(2, after.getObservationCount());
        assertFalse(after.getFeatureNames().contains("crime_stress"));
        assertEquals(1, engine.getRejectedObservations());
    }

    @Test
    void omittedComponentDoesNotContribute() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        double[][] rows = SignalDataSets.components(60, 2, 0.4, 0.05, 21);
        for (double[] row : rows) {
            Map<String, Double> components = new HashMap<>();
            components.put("economic_stress", row[0]);
            components.put("mobility_activity", row[1]);
            engine.update("ga", 0.5 + row[0] - row[1], components);
        }
        Map<String, Double> partial = new HashMap<>();
        partial.put("economic_stress", 0.4);
        RegionSnapshot snapshot = engine.update("ga", 0.5, partial).get();
        Map<String, Double> contributions = snapshot.getMultivariate().getContributions();
        assertThat(contributions.keySet(), contains("behavior_index", "economic_stress"));
        assertEquals(contributions.get("behavior_index") + contributions.get("economic_stress"),
                snapshot.getMdScore(), 1e-12);
        assertTrue(snapshot.getFeatureNames().contains("mobility_activity"));
    }

    @Test
    void primaryValueWinsOverComponentOfSameName() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        Map<String, Double> components = new HashMap<>();
        components.put("behavior_index", 100.0);
        for (int i = 0; i < 20; i++) {
            engine.update("az", 0.5, components);
        }
        RegionSnapshot snapshot = engine.snapshot("az");
        assertEquals(0.0, snapshot.getMdScore());
        assertEquals(0.5, snapshot.getBaseline());
    }

    @Test
    void warmupIsReported() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine(
                AnomalyConfig.builder().warmupObservations(3).build());
        assertFalse(engine.update("co", 0.1).get().isWarmedUp());
        assertFalse(engine.update("co", 0.2).get().isWarmedUp());
        assertTrue(engine.update("co", 0.3).get().isWarmedUp());
    }

    @Test
    void snapshotsAndRemoval() {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        engine.update("wi", 0.5);
        engine.update("al", 0.5);
        engine.update("al", 0.6);
        assertThat(engine.regions(), contains("al", "wi"));
        Map<String, RegionSnapshot> snapshots = engine.snapshots();
        assertThat(snapshots.keySet(), contains("al", "wi"));
        assertEquals(2, snapshots.get("al").getObservationCount());
        assertThrows(UnsupportedOperationException.class, () -> snapshots.remove("al"));

        assertTrue(engine.removeRegion("AL"));
        assertFalse(engine.removeRegion("al"));
        assertFalse(engine.snapshot("al").hasData());
        assertEquals(1, engine.update("al", 0.9).get().getObservationCount());
    }

    @Test
    void removalWaitsForUpdateInProgress() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine() {
            @Override
            protected RegionState createRegionState(String regionId) {
                return new RegionState(regionId, getConfig()) {
                    @Override
                    public RegionSnapshot update(double primaryValue, FeatureVector components) {
                        entered.countDown();
                        awaitLatch(release);
                        return super.update(primaryValue, components);
                    }
                };
            }
        };
        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<Optional<RegionSnapshot>> update = executor.submit(() -> engine.update("nv", 0.5));
        assertTrue(entered.await(10, TimeUnit.SECONDS));

        Future<Boolean> removal = executor.submit(() -> engine.removeRegion("nv"));
        assertThrows(TimeoutException.class, () -> removal.get(200, TimeUnit.MILLISECONDS));

        release.countDown();
        assertEquals(1, update.get(10, TimeUnit.SECONDS).get().getObservationCount());
        assertTrue(removal.get(10, TimeUnit.SECONDS));
        assertFalse(engine.containsRegion("nv"));
        assertFalse(engine.snapshot("nv").hasData());
        executor.shutdown();
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            assertTrue(latch.await(10, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void defaultConfigIsUsed() {
        AnomalyConfig config = AnomalyConfig.builder().windowSize(5).build();
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine(config);
        assertSame(config, engine.getConfig());
        assertEquals(AnomalyConfig.DEFAULT_WINDOW_SIZE, new AnomalyDetectionEngine().getConfig().getWindowSize());
    }

    @Test
    void parallelUpdatesAreSerializedPerRegion() throws Exception {
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        int threads = 8;
        int updatesPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            double[] data = SignalDataSets.gaussian(updatesPerThread, 0.5, 0.05, t);
            String own = "region-" + t;
            futures.add(executor.submit(() -> {
                start.await();
                for (double value : data) {
                    engine.update("shared", value);
                    engine.update(own, value);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(threads * updatesPerThread, engine.snapshot("shared").getObservationCount());
        for (int t = 0; t < threads; t++) {
            assertEquals(updatesPerThread, engine.snapshot("region-" + t).getObservationCount());
        }
        assertEquals(threads + 1, engine.regions().size());
    }

    @Test
    void snapshotsNeverObserveAPartialUpdate() throws Exception {
        int updates = 3000;
        AnomalyDetectionEngine engine = new AnomalyDetectionEngine(
                AnomalyConfig.builder().windowSize(updates).build());
        AtomicBoolean done = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(3);

        Future<?> writer = executor.submit(() -> {
            // value i arrives as observation i + 1
            for (int i = 0; i < updates; i++) {
                engine.update("ut", i);
            }
            done.set(true);
        });
        Callable<Integer> reader = () -> {
            int checked = 0;
            while (!done.get()) {
                RegionSnapshot snapshot = engine.snapshot("ut");
                if (!snapshot.hasData()) {
                    continue;
                }
                double latest = snapshot.getObservationCount() - 1;
                // univariate and seasonal outputs describe the same observation
                assertEquals(latest, snapshot.getBaseline() + snapshot.getResidual(), 1e-6);
                assertEquals(0.95 * latest, snapshot.getStaticUpperBound(), 1e-6);
                ++checked;
            }
            return checked;
        };
        Future<Integer> firstReader = executor.submit(reader);
        Future<Integer> secondReader = executor.submit(reader);

        writer.get(60, TimeUnit.SECONDS);
        firstReader.get(60, TimeUnit.SECONDS);
        secondReader.get(60, TimeUnit.SECONDS);
        executor.shutdown();
        assertEquals(updates, engine.snapshot("ut").getObservationCount());
    }
}
