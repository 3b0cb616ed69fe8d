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

package com.hbc.anomaly.returntypes;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outputs of the multivariate detector for one observation. The score is the
 * sum of the squared per-dimension z-scores listed in {@code contributions};
 * features absent from the observation have no entry.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MultivariateResult {

    public static final MultivariateResult EMPTY = new MultivariateResult(0, false, Collections.emptyMap());

    private final double mdScore;

    private final boolean mdAnomaly;

    private final Map<String, Double> contributions;

    public MultivariateResult(double mdScore, boolean mdAnomaly, Map<String, Double> contributions) {
        this.mdScore = mdScore;
        this.mdAnomaly = mdAnomaly;
        this.contributions = Collections.unmodifiableMap(new TreeMap<>(contributions));
    }

    public boolean isAnomaly() {
        return mdAnomaly;
    }
}
