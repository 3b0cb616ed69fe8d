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
import static com.hbc.anomaly.CommonUtils.safeDivide;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import lombok.AccessLevel;
import lombok.Getter;

import com.hbc.anomaly.config.AnomalyConfig;
import com.hbc.anomaly.returntypes.MultivariateResult;
import com.hbc.anomaly.statistics.IRollingStatistics;
import com.hbc.anomaly.statistics.RollingBuffer;

/**
 * Layer 3: a Mahalanobis style distance with a diagonal covariance. Every named
 * feature keeps its own window; the score of an observation is the sum over the
 * features present in it of the squared z-score against that feature's window.
 * Cross-feature correlation is ignored.
 * <p>
 * A feature that is missing from an observation is skipped for that update: its
 * window is untouched and it contributes nothing to the score. It is not treated
 * as a zero. A feature whose window has fewer than two values, or no spread,
 * contributes 0.
 */
@Getter
public class MultivariateDetector {

    protected final int windowSize;

    protected final double threshold;

    @Getter(AccessLevel.NONE)
    protected final Map<String, RollingBuffer> features = new HashMap<>();

    protected MultivariateResult lastResult = MultivariateResult.EMPTY;

    public MultivariateDetector(int windowSize, double threshold) {
        checkArgument(windowSize > 0, "windowSize must be positive");
        checkArgument(threshold > 0, "threshold must be positive");
        this.windowSize = windowSize;
        this.threshold = threshold;
    }

    public MultivariateDetector(AnomalyConfig config) {
        this(config.getWindowSize(), config.getMultivariateThreshold());
    }

    /**
     * pushes each present feature into its window (creating the window on first
     * sight) and scores the observation
     *
     * @param observation finite values keyed by feature name; may be partial or
     *                    empty
     * @return the outputs for this observation
     */
    public MultivariateResult update(Map<String, Double> observation) {
        Map<String, Double> contributions = new HashMap<>();
        double score = 0;
        if (observation != null) {
            for (Map.Entry<String, Double> entry : observation.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                double value = entry.getValue();
                RollingBuffer buffer = features.computeIfAbsent(entry.getKey(), k -> new RollingBuffer(windowSize));
                buffer.push(value);
                double contribution = 0;
                if (buffer.size() >= 2) {
                    double z = safeDivide(value - buffer.mean(), buffer.std());
                    contribution = z * z;
                }
                contributions.put(entry.getKey(), contribution);
                score += contribution;
            }
        }
        lastResult = new MultivariateResult(score, score > threshold, contributions);
        return lastResult;
    }

    /**
     * @return the names of every feature seen so far, sorted
     */
    public Set<String> getFeatureNames() {
        return Collections.unmodifiableSet(new TreeSet<>(features.keySet()));
    }

    /**
     * @param name a feature name
     * @return a read-only view of that feature's window, if it has been seen
     */
    public Optional<IRollingStatistics> getFeatureStatistics(String name) {
        return Optional.ofNullable(features.get(name));
    }
}
