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

import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.config.AnomalyConfig;

/**
 * Entry point of the anomaly detection layers. The engine owns one
 * {@link RegionState} per region, created on the first observation of that
 * region, and routes every observation to it.
 * <p>
 * Updates of different regions proceed in parallel; updates of the same region
 * are serialized, and removal of a region waits for an update in progress.
 * Observations carrying a NaN or infinite value, in the primary signal or in
 * any component, are logged and dropped before any window is touched. The engine performs no I/O and starts no
 * threads.
 * <p>
 * Region state is kept for the lifetime of the engine; it is released only
 * through {@link #removeRegion(String)}.
 */
public class AnomalyDetectionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final AnomalyConfig config;

    private final ConcurrentMap<String, RegionState> regions = new ConcurrentHashMap<>();

    private final AtomicLong rejectedObservations = new AtomicLong();

    public AnomalyDetectionEngine() {
        this(AnomalyConfig.defaultConfig());
    }

    public AnomalyDetectionEngine(AnomalyConfig config) {
        this.config = checkNotNull(config, "config cannot be null");
    }

    public Optional<RegionSnapshot> update(String region, double primaryValue) {
        return update(region, primaryValue, FeatureVector.empty());
    }

    public Optional<RegionSnapshot> update(String region, double primaryValue, Map<String, Double> components) {
        return update(region, primaryValue, FeatureVector.of(components));
    }

    /**
     * Feeds one observation to the detector chain of the region.
     *
     * @param region       region identifier, normalized with
     *                     {@link RegionIds#normalize(String)}
     * @param primaryValue the behavior index for this cycle
     * @param components   the component values for this cycle, possibly a subset
     *                     of the known components or empty
     * @return the region's outputs after the update, or empty if the observation
     *         was rejected
     * @throws IllegalArgumentException if the region identifier is null or blank
     */
    public Optional<RegionSnapshot> update(String region, double primaryValue, FeatureVector components) {
        String regionId = RegionIds.normalize(region);
        FeatureVector features = (components == null) ? FeatureVector.empty() : components;

        if (!Double.isFinite(primaryValue)) {
            reject(regionId, ComponentSignal.BEHAVIOR_INDEX.getFeatureName(), primaryValue);
            return Optional.empty();
        }
        Optional<Map.Entry<String, Double>> nonFinite = features.firstNonFinite();
        if (nonFinite.isPresent()) {
            reject(regionId, nonFinite.get().getKey(), nonFinite.get().getValue());
            return Optional.empty();
        }

        // applied inside compute so that a concurrent removeRegion cannot orphan the update
        RegionSnapshot[] result = new RegionSnapshot[1];
        regions.compute(regionId, (id, state) -> {
            RegionState current = (state == null) ? createRegionState(id) : state;
            result[0] = current.update(primaryValue, features);
            return current;
        });
        return Optional.of(result[0]);
    }

    /**
     * @param region region identifier
     * @return the latest outputs of the region, or a snapshot without data if
     *         the region has never been observed
     * @throws IllegalArgumentException if the region identifier is null or blank
     */
    public RegionSnapshot snapshot(String region) {
        String regionId = RegionIds.normalize(region);
        RegionState state = regions.get(regionId);
        return (state == null) ? RegionSnapshot.noData(regionId) : state.snapshot();
    }

    /**
     * @return the latest outputs of every known region, keyed and sorted by
     *         region
     */
    public Map<String, RegionSnapshot> snapshots() {
        Map<String, RegionSnapshot> result = new TreeMap<>();
        regions.forEach((regionId, state) -> result.put(regionId, state.snapshot()));
        return Collections.unmodifiableMap(result);
    }

    public Set<String> regions() {
        return Collections.unmodifiableSet(new TreeSet<>(regions.keySet()));
    }

    public boolean containsRegion(String region) {
        return regions.containsKey(RegionIds.normalize(region));
    }

    /**
     * Discards all state of a region. A later observation of the same region
     * starts from an empty history. An update of the region that is in progress
     * completes before the state is removed.
     *
     * @param region region identifier
     * @return true if the region was known
     */
    public boolean removeRegion(String region) {
        String regionId = RegionIds.normalize(region);
        boolean removed = regions.remove(regionId) != null;
        if (removed) {
            LOGGER.debug("removed state of region {}", regionId);
        }
        return removed;
    }

    /**
     * @return the number of observations dropped because of non-finite values
     */
    public long getRejectedObservations() {
        return rejectedObservations.get();
    }

    public AnomalyConfig getConfig() {
        return config;
    }

    /**
     * Called while the region's map entry is locked; must not access other
     * regions of this engine.
     */
    protected RegionState createRegionState(String regionId) {
        LOGGER.debug("creating state for region {}", regionId);
        return new RegionState(regionId, config);
    }

    private void reject(String regionId, String field, double value) {
        rejectedObservations.incrementAndGet();
        LOGGER.warn("dropping observation for region {}: {} is {}", regionId, field, value);
    }
}
