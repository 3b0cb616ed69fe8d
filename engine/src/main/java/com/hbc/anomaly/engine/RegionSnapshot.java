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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.hbc.anomaly.returntypes.MultivariateResult;
import com.hbc.anomaly.returntypes.SeasonalResult;
import com.hbc.anomaly.returntypes.UnivariateResult;

/**
 * An immutable copy of every output of the three detectors of one region, taken
 * between two updates. A region that has never been observed is represented by
 * {@link #noData(String)}: no observations, every number 0 and every flag
 * false.
 */
@Getter
@EqualsAndHashCode
@ToString
public class RegionSnapshot {

    private final String region;

    private final long observationCount;

    // true once the region has seen the configured number of warmup observations
    private final boolean warmedUp;

    private final UnivariateResult univariate;

    private final SeasonalResult seasonal;

    private final MultivariateResult multivariate;

    // features that currently hold a window in the multivariate detector
    private final Set<String> featureNames;

    public RegionSnapshot(String region, long observationCount, boolean warmedUp, UnivariateResult univariate,
            SeasonalResult seasonal, MultivariateResult multivariate, Set<String> featureNames) {
        this.region = checkNotNull(region, "region cannot be null");
        this.observationCount = observationCount;
        this.warmedUp = warmedUp;
        this.univariate = checkNotNull(univariate, "univariate result cannot be null");
        this.seasonal = checkNotNull(seasonal, "seasonal result cannot be null");
        this.multivariate = checkNotNull(multivariate, "multivariate result cannot be null");
        this.featureNames = Collections.unmodifiableSet(new TreeSet<>(featureNames));
    }

    public static RegionSnapshot noData(String region) {
        return new RegionSnapshot(region, 0, false, UnivariateResult.EMPTY, SeasonalResult.EMPTY,
                MultivariateResult.EMPTY, Collections.emptySet());
    }

    public boolean hasData() {
        return observationCount > 0;
    }

    /**
     * @return true if any detector flagged the latest observation
     */
    public boolean isAnomaly() {
        return univariate.isAnomaly() || seasonal.isAnomaly() || multivariate.isAnomaly();
    }

    public double getStaticUpperBound() {
        return univariate.getUpperBound();
    }

    public double getStaticLowerBound() {
        return univariate.getLowerBound();
    }

    public boolean isStaticAnomaly() {
        return univariate.isStaticAnomaly();
    }

    public double getZScore() {
        return univariate.getZScore();
    }

    public boolean isZScoreAnomaly() {
        return univariate.isZScoreAnomaly();
    }

    public double getBaseline() {
        return seasonal.getBaseline();
    }

    public double getUpperBand() {
        return seasonal.getUpperBand();
    }

    public double getLowerBand() {
        return seasonal.getLowerBand();
    }

    public boolean isSeasonalAnomaly() {
        return seasonal.isSeasonalAnomaly();
    }

    public double getResidual() {
        return seasonal.getResidual();
    }

    public double getResidualZScore() {
        return seasonal.getResidualZScore();
    }

    public boolean isResidualAnomaly() {
        return seasonal.isResidualAnomaly();
    }

    public double getMdScore() {
        return multivariate.getMdScore();
    }

    public boolean isMdAnomaly() {
        return multivariate.isMdAnomaly();
    }

    /**
     * @return every exported value keyed by its metric name, flags as 0/1, in
     *         the order of {@link AnomalyMetric}
     */
    public Map<String, Double> toMetrics() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (AnomalyMetric metric : AnomalyMetric.values()) {
            metrics.put(metric.getMetricName(), metric.extract(this));
        }
        return metrics;
    }
}
