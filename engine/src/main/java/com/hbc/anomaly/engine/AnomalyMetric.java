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

import java.util.function.ToDoubleFunction;

/**
 * The values published per region to the metrics exporter. Flags are exported
 * as 0 or 1.
 */
public enum AnomalyMetric {

    STATIC_UPPER_BOUND("staticUpperBound", Layer.UNIVARIATE, false, RegionSnapshot::getStaticUpperBound),
    STATIC_LOWER_BOUND("staticLowerBound", Layer.UNIVARIATE, false, RegionSnapshot::getStaticLowerBound),
    STATIC_ANOMALY("staticAnomaly", Layer.UNIVARIATE, true, s -> indicator(s.isStaticAnomaly())),
    Z_SCORE("zScore", Layer.UNIVARIATE, false, RegionSnapshot::getZScore),
    Z_SCORE_ANOMALY("zScoreAnomaly", Layer.UNIVARIATE, true, s -> indicator(s.isZScoreAnomaly())),
    BASELINE("baseline", Layer.SEASONAL, false, RegionSnapshot::getBaseline),
    UPPER_BAND("upperBand", Layer.SEASONAL, false, RegionSnapshot::getUpperBand),
    LOWER_BAND("lowerBand", Layer.SEASONAL, false, RegionSnapshot::getLowerBand),
    SEASONAL_ANOMALY("seasonalAnomaly", Layer.SEASONAL, true, s -> indicator(s.isSeasonalAnomaly())),
    RESIDUAL("residual", Layer.SEASONAL, false, RegionSnapshot::getResidual),
    RESIDUAL_Z_SCORE("residualZScore", Layer.SEASONAL, false, RegionSnapshot::getResidualZScore),
    RESIDUAL_ANOMALY("residualAnomaly", Layer.SEASONAL, true, s -> indicator(s.isResidualAnomaly())),
    MD_SCORE("mdScore", Layer.MULTIVARIATE, false, RegionSnapshot::getMdScore),
    MD_ANOMALY("mdAnomaly", Layer.MULTIVARIATE, true, s -> indicator(s.isMdAnomaly()));

    public enum Layer {
        UNIVARIATE, SEASONAL, MULTIVARIATE
    }

    private final String metricName;

    private final Layer layer;

    private final boolean flag;

    private final ToDoubleFunction<RegionSnapshot> extractor;

    AnomalyMetric(String metricName, Layer layer, boolean flag, ToDoubleFunction<RegionSnapshot> extractor) {
        this.metricName = metricName;
        this.layer = layer;
        this.flag = flag;
        this.extractor = extractor;
    }

    public String getMetricName() {
        return metricName;
    }

    public Layer getLayer() {
        return layer;
    }

    public boolean isFlag() {
        return flag;
    }

    public double extract(RegionSnapshot snapshot) {
        return extractor.applyAsDouble(snapshot);
    }

    private static double indicator(boolean value) {
        return value ? 1 : 0;
    }
}
