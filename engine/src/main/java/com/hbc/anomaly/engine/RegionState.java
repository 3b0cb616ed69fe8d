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

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.config.AnomalyConfig;
import com.hbc.anomaly.detector.MultivariateDetector;
import com.hbc.anomaly.detector.SeasonalDetector;
import com.hbc.anomaly.detector.UnivariateDetector;
import com.hbc.anomaly.returntypes.MultivariateResult;
import com.hbc.anomaly.returntypes.SeasonalResult;
import com.hbc.anomaly.returntypes.UnivariateResult;

/**
 * The detector chain of a single region. An update runs the univariate, the
 * seasonal and the multivariate detector in that order under the write lock;
 * the seasonal detector reads the raw window the univariate detector has just
 * extended, so the order cannot change. Snapshots take the read lock and
 * therefore observe either the state before an update or the state after it.
 * <p>
 * Values passed to {@link #update(double, FeatureVector)} must be finite; the
 * engine filters them before they get here.
 */
public class RegionState {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegionState.class);

    private final String region;

    private final int warmupObservations;

    private final UnivariateDetector univariate;

    private final SeasonalDetector seasonal;

    private final MultivariateDetector multivariate;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long observationCount = 0;

    public RegionState(String region, AnomalyConfig config) {
        checkNotNull(config, "config cannot be null");
        this.region = checkNotNull(region, "region cannot be null");
        this.warmupObservations = config.getWarmupObservations();
        this.univariate = new UnivariateDetector(config);
        this.seasonal = new SeasonalDetector(config, univariate.getValueStatistics());
        this.multivariate = new MultivariateDetector(config);
    }

    /**
     * used to assemble a chain from detectors created elsewhere; the seasonal
     * detector is expected to read the raw window of the univariate detector
     */
    protected RegionState(String region, int warmupObservations, UnivariateDetector univariate,
            SeasonalDetector seasonal, MultivariateDetector multivariate) {
        checkArgument(warmupObservations >= 0, "warmupObservations cannot be negative");
        this.region = checkNotNull(region, "region cannot be null");
        this.warmupObservations = warmupObservations;
        this.univariate = checkNotNull(univariate, "univariate detector cannot be null");
        this.seasonal = checkNotNull(seasonal, "seasonal detector cannot be null");
        this.multivariate = checkNotNull(multivariate, "multivariate detector cannot be null");
    }

    /**
     * @param primaryValue the behavior index for this cycle
     * @param components   the component values for this cycle; the primary value
     *                     is added under {@code behavior_index}
     * @return the outputs after this update
     */
    public RegionSnapshot update(double primaryValue, FeatureVector components) {
        FeatureVector features = checkNotNull(components, "components cannot be null").withPrimary(primaryValue);
        RegionSnapshot snapshot;
        lock.writeLock().lock();
        try {
            univariate.update(primaryValue);
            seasonal.update(primaryValue);
            multivariate.update(features.asMap());
            ++observationCount;
            snapshot = createSnapshot();
        } finally {
            lock.writeLock().unlock();
        }
        if (snapshot.isAnomaly() && LOGGER.isDebugEnabled()) {
            LOGGER.debug("region {} observation {} flagged: static={} zScore={} seasonal={} residual={} md={}",
                    region, snapshot.getObservationCount(), snapshot.isStaticAnomaly(),
                    snapshot.isZScoreAnomaly(), snapshot.isSeasonalAnomaly(), snapshot.isResidualAnomaly(),
                    snapshot.isMdAnomaly());
        }
        return snapshot;
    }

    public RegionSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return createSnapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds a lock
    private RegionSnapshot createSnapshot() {
        if (observationCount == 0) {
            return RegionSnapshot.noData(region);
        }
        UnivariateResult univariateResult = univariate.getLastResult();
        SeasonalResult seasonalResult = seasonal.getLastResult();
        MultivariateResult multivariateResult = multivariate.getLastResult();
        return new RegionSnapshot(region, observationCount, observationCount >= warmupObservations,
                univariateResult, seasonalResult, multivariateResult, multivariate.getFeatureNames());
    }

    public String getRegion() {
        return region;
    }

    public long getObservationCount() {
        lock.readLock().lock();
        try {
            return observationCount;
        } finally {
            lock.readLock().unlock();
        }
    }
}
