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

package com.hbc.anomaly.engine.state;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

import lombok.Data;

@Data
public class RegionSnapshotState implements Serializable {
    private static final long serialVersionUID = 1L;

    private String region;

    private long observationCount;

    private boolean warmedUp;

    private double staticLowerBound;

    private double staticUpperBound;

    private boolean staticAnomaly;

    private double zScore;

    private boolean zScoreAnomaly;

    private double baseline;

    private double upperBand;

    private double lowerBand;

    private boolean seasonalAnomaly;

    private double residual;

    private double residualZScore;

    private boolean residualAnomaly;

    private double mdScore;

    private boolean mdAnomaly;

    private Map<String, Double> mdContributions;

    private List<String> featureNames;
}
