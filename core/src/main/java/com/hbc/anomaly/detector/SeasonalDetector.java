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
import com.hbc.anomaly.returntypes.SeasonalResult;
import com.hbc.anomaly.statistics.IRollingStatistics;
import com.hbc.anomaly.statistics.RollingBuffer;

/**
 * Layer 2: tracks an exponentially weighted baseline of the signal. Bands of
 * width {@code bandK} raw standard deviations around the baseline catch values
 * far from the smoothed level, and a z-score of the residual (value minus
 * baseline) against its own window catches sudden changes in the rate of
 * deviation. A new level is absorbed by the baseline, a spike against a stable
 * level is not.
 * <p>
 * The raw standard deviation is read from a window this detector does not own
 * (the univariate detector's). That window must already contain the current
 * value when {@link #update(double)} is invoked.
 */
@Getter
public class SeasonalDetector {

    // shared, read only
    protected final IRollingStatistics rawValues;

    @Getter(AccessLevel.NONE)
    protected final RollingBuffer residuals;

    protected final double ewmaAlpha;

    protected final double bandK;

    protected final double residualZScoreThreshold;

    protected double baseline = 0;

    protected boolean initialized = false;

    protected SeasonalResult lastResult = SeasonalResult.EMPTY;

    public SeasonalDetector(IRollingStatistics rawValues, RollingBuffer residuals, double ewmaAlpha, double bandK,
            double residualZScoreThreshold) {
        checkNotNull(rawValues, "raw value statistics cannot be null");
        checkNotNull(residuals, "residuals cannot be null");
        checkArgument(ewmaAlpha > 0 && ewmaAlpha <= 1, "ewmaAlpha must be in (0, 1]");
        checkArgument(bandK >= 0, "bandK cannot be negative");
        checkArgument(residualZScoreThreshold > 0, "residualZScoreThreshold must be positive");
        this.rawValues = rawValues;
        this.residuals = residuals;
        this.ewmaAlpha = ewmaAlpha;
        this.bandK = bandK;
        this.residualZScoreThreshold = residualZScoreThreshold;
    }

    public SeasonalDetector(AnomalyConfig config, IRollingStatistics rawValues) {
        this(rawValues, new RollingBuffer(config.getWindowSize()), config.getEwmaAlpha(), config.getSeasonalBandK(),
                config.getResidualZScoreThreshold());
    }

    /**
     * advances the baseline, then evaluates the bands and the residual z-score
     *
     * @param value a finite observation
     * @return the outputs for this observation
     */
    public SeasonalResult update(double value) {
        if (!initialized) {
            baseline = value;
            initialized = true;
        } else if (value != baseline) {
            // convex combination, stays within the range of finite inputs
            baseline = ewmaAlpha * value + (1 - ewmaAlpha) * baseline;
        }

        double halfWidth = bandK * rawValues.std();
        double upperBand = baseline + halfWidth;
        double lowerBand = baseline - halfWidth;
        boolean seasonalAnomaly = value < lowerBand || value > upperBand;

        double residual = value - baseline;
        residuals.push(residual);
        double residualZScore = safeDivide(residual - residuals.mean(), residuals.std());
        boolean residualAnomaly = abs(residualZScore) > residualZScoreThreshold;

        lastResult = new SeasonalResult(baseline, upperBand, lowerBand, seasonalAnomaly, residual, residualZScore,
                residualAnomaly);
        return lastResult;
    }

    /**
     * @return a read-only view of the residual window
     */
    public IRollingStatistics getResidualStatistics() {
        return residuals;
    }
}
