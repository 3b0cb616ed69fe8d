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

package com.hbc.anomaly.detector;

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;
import static com.hbc.anomaly.CommonUtils.safeDivide;
import static java.lang.Math.abs;

import lombok.AccessLevel;
import lombok.Getter;

import com.hbc.anomaly.config.AnomalyConfig;
import com.hbc.anomaly.returntypes.UnivariateResult;
import com.hbc.anomaly.statistics.IRollingStatistics;
import com.hbc.anomaly.statistics.RollingBuffer;

/**
 * Layer 1: flags an observation against the recent history of the same signal,
 * with no notion of trend. Two tests are applied after the value enters the
 * window: static percentile bounds and a z-score against the window mean.
 * <p>
 * There is no special casing of a short history. With only a handful of
 * observations the bounds and the z-score are computed from whatever the window
 * holds, and callers should not rely on the flags until the window has some
 * depth.
 */
@Getter
public class UnivariateDetector {

    // the raw values; also read by the seasonal detector
    @Getter(AccessLevel.NONE)
    protected final RollingBuffer values;

    protected final double lowerPercentile;

    protected final double upperPercentile;

    protected final double zScoreThreshold;

    protected UnivariateResult lastResult = UnivariateResult.EMPTY;

    public UnivariateDetector(RollingBuffer values, double lowerPercentile, double upperPercentile,
            double zScoreThreshold) {
        checkNotNull(values, "values cannot be null");
        checkArgument(lowerPercentile >= 0 && lowerPercentile <= upperPercentile && upperPercentile <= 100,
                "incorrect percentiles");
        checkArgument(zScoreThreshold > 0, "zScoreThreshold must be positive");
        this.values = values;
        this.lowerPercentile = lowerPercentile;
        this.upperPercentile = upperPercentile;
        this.zScoreThreshold = zScoreThreshold;
    }

    public UnivariateDetector(AnomalyConfig config) {
        this(new RollingBuffer(config.getWindowSize()), config.getStaticLowerPercentile(),
                config.getStaticUpperPercentile(), config.getZScoreThreshold());
    }

    /**
     * pushes the value into the window and recomputes the bounds and the z-score
     *
     * @param value a finite observation
     * @return the outputs for this observation
     */
    public UnivariateResult update(double value) {
        values.push(value);

        double lowerBound = values.percentile(lowerPercentile, value);
        double upperBound = values.percentile(upperPercentile, value);
        boolean staticAnomaly = value < lowerBound || value > upperBound;

        double zScore = safeDivide(value - values.mean(), values.std());
        boolean zScoreAnomaly = abs(zScore) > zScoreThreshold;

        lastResult = new UnivariateResult(lowerBound, upperBound, staticAnomaly, zScore, zScoreAnomaly);
        return lastResult;
    }

    /**
     * @return a read-only view of the raw value window
     */
    public IRollingStatistics getValueStatistics() {
        return values;
    }

    public int getObservationsInWindow() {
        return values.size();
    }
}
