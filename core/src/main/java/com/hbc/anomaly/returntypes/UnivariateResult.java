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

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outputs of the univariate detector for one observation: percentile bounds of
 * the window and the z-score of the observation against it.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class UnivariateResult {

    public static final UnivariateResult EMPTY = new UnivariateResult(0, 0, false, 0, false);

    private final double lowerBound;

    private final double upperBound;

    private final boolean staticAnomaly;

    private final double zScore;

    private final boolean zScoreAnomaly;

    public boolean isAnomaly() {
        return staticAnomaly || zScoreAnomaly;
    }
}
