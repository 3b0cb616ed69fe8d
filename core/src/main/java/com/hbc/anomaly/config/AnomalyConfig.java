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

package com.hbc.anomaly.config;

import static com.hbc.anomaly.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Process-wide thresholds and window sizes shared by every region. Instances
 * are immutable and created through {@link #builder()}.
 */
@Getter
public class AnomalyConfig {

    public static final int DEFAULT_WINDOW_SIZE = 500;
    public static final double DEFAULT_STATIC_LOWER_PERCENTILE = 5.0;
    public static final double DEFAULT_STATIC_UPPER_PERCENTILE = 95.0;
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.5;
    public static final double DEFAULT_EWMA_ALPHA = 0.1;
    public static final double DEFAULT_SEASONAL_BAND_K = 2.0;
    public static final double DEFAULT_RESIDUAL_Z_SCORE_THRESHOLD = 2.5;
    public static final double DEFAULT_MULTIVARIATE_THRESHOLD = 15.0;
    public static final int DEFAULT_WARMUP_OBSERVATIONS = 10;

    // capacity of every rolling window (raw values, residuals, each feature)
    private final int windowSize;

    private final double staticLowerPercentile;

    private final double staticUpperPercentile;

    private final double zScoreThreshold;

    // weight of the newest value in the baseline
    private final double ewmaAlpha;

    // half-width of the seasonal bands in units of the raw standard deviation
    private final double seasonalBandK;

    private final double residualZScoreThreshold;

    // bound on the sum of squared per-dimension z-scores
    private final double multivariateThreshold;

    // below this many observations a region's flags are reported as not warmed up
    private final int warmupObservations;

    protected AnomalyConfig(Builder builder) {
        this.windowSize = builder.windowSize;
        this.staticLowerPercentile = builder.staticLowerPercentile;
        this.staticUpperPercentile = builder.staticUpperPercentile;
        this.zScoreThreshold = builder.zScoreThreshold;
        this.ewmaAlpha = builder.ewmaAlpha;
        this.seasonalBandK = builder.seasonalBandK;
        this.residualZScoreThreshold = builder.residualZScoreThreshold;
        this.multivariateThreshold = builder.multivariateThreshold;
        this.warmupObservations = builder.warmupObservations;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a configuration with every option at its default value
     */
    public static AnomalyConfig defaultConfig() {
        return builder().build();
    }

    /**
     * @return a builder seeded with the values of this configuration
     */
    public Builder toBuilder() {
        return builder().windowSize(windowSize).staticLowerPercentile(staticLowerPercentile)
                .staticUpperPercentile(staticUpperPercentile).zScoreThreshold(zScoreThreshold).ewmaAlpha(ewmaAlpha)
                .seasonalBandK(seasonalBandK).residualZScoreThreshold(residualZScoreThreshold)
                .multivariateThreshold(multivariateThreshold).warmupObservations(warmupObservations);
    }

    @Override
    public String toString() {
        return "AnomalyConfig{windowSize=" + windowSize + ", staticLowerPercentile=" + staticLowerPercentile
                + ", staticUpperPercentile=" + staticUpperPercentile + ", zScoreThreshold=" + zScoreThreshold
                + ", ewmaAlpha=" + ewmaAlpha + ", seasonalBandK=" + seasonalBandK + ", residualZScoreThreshold="
                + residualZScoreThreshold + ", multivariateThreshold=" + multivariateThreshold
                + ", warmupObservations=" + warmupObservations + "}";
    }

    public static class Builder {

        private int windowSize = DEFAULT_WINDOW_SIZE;
        private double staticLowerPercentile = DEFAULT_STATIC_LOWER_PERCENTILE;
        private double staticUpperPercentile = DEFAULT_STATIC_UPPER_PERCENTILE;
        private double zScoreThreshold = DEFAULT_Z_SCORE_THRESHOLD;
        private double ewmaAlpha = DEFAULT_EWMA_ALPHA;
        private double seasonalBandK = DEFAULT_SEASONAL_BAND_K;
        private double residualZScoreThreshold = DEFAULT_RESIDUAL_Z_SCORE_THRESHOLD;
        private double multivariateThreshold = DEFAULT_MULTIVARIATE_THRESHOLD;
        private int warmupObservations = DEFAULT_WARMUP_OBSERVATIONS;

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder staticLowerPercentile(double staticLowerPercentile) {
            this.staticLowerPercentile = staticLowerPercentile;
            return this;
        }

        public Builder staticUpperPercentile(double staticUpperPercentile) {
            this.staticUpperPercentile = staticUpperPercentile;
            return this;
        }

        public Builder zScoreThreshold(double zScoreThreshold) {
            this.zScoreThreshold = zScoreThreshold;
            return this;
        }

        public Builder ewmaAlpha(double ewmaAlpha) {
            this.ewmaAlpha = ewmaAlpha;
            return this;
        }

        public Builder seasonalBandK(double seasonalBandK) {
            this.seasonalBandK = seasonalBandK;
            return this;
        }

        public Builder residualZScoreThreshold(double residualZScoreThreshold) {
            this.residualZScoreThreshold = residualZScoreThreshold;
            return this;
        }

        public Builder multivariateThreshold(double multivariateThreshold) {
            this.multivariateThreshold = multivariateThreshold;
            return this;
        }

        public Builder warmupObservations(int warmupObservations) {
            this.warmupObservations = warmupObservations;
            return this;
        }

        void validate() {
            checkArgument(windowSize >= 2, "windowSize must be at least 2");
            checkArgument(staticLowerPercentile >= 0 && staticLowerPercentile <= 100,
                    "staticLowerPercentile must be in [0, 100]");
            checkArgument(staticUpperPercentile >= 0 && staticUpperPercentile <= 100,
                    "staticUpperPercentile must be in [0, 100]");
            checkArgument(staticLowerPercentile <= staticUpperPercentile,
                    "staticLowerPercentile cannot exceed staticUpperPercentile");
            checkArgument(zScoreThreshold > 0, "zScoreThreshold must be positive");
            checkArgument(ewmaAlpha > 0 && ewmaAlpha <= 1, "ewmaAlpha must be in (0, 1]");
            checkArgument(seasonalBandK >= 0, "seasonalBandK cannot be negative");
            checkArgument(residualZScoreThreshold > 0, "residualZScoreThreshold must be positive");
            checkArgument(multivariateThreshold > 0, "multivariateThreshold must be positive");
            checkArgument(warmupObservations >= 0, "warmupObservations cannot be negative");
        }

        public AnomalyConfig build() {
            validate();
            return new AnomalyConfig(this);
        }
    }
}
