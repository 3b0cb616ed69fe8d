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
 * Outputs of the seasonal/residual detector for one observation.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SeasonalResult {

    public static final SeasonalResult EMPTY = new SeasonalResult(0, 0, 0, false, 0, 0, false);

    // exponentially weighted moving average of the raw values
    private final double baseline;

    private final double upperBand;

    private final double lowerBand;

    private final boolean seasonalAnomaly;

    // value minus baseline
    private final double residual;

    private final double residualZScore;

    private final boolean residualAnomaly;

    public boolean isAnomaly() {
        return seasonalAnomaly || residualAnomaly;
    }
}
