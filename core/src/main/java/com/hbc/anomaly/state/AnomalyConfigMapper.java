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

package com.hbc.anomaly.state;

import static com.hbc.anomaly.CommonUtils.checkNotNull;

import com.hbc.anomaly.config.AnomalyConfig;

public class AnomalyConfigMapper implements IStateMapper<AnomalyConfig, AnomalyConfigState> {

    @Override
    public AnomalyConfigState toState(AnomalyConfig model) {
        checkNotNull(model, "config cannot be null");
        AnomalyConfigState state = new AnomalyConfigState();
        state.setWindowSize(model.getWindowSize());
        state.setStaticLowerPercentile(model.getStaticLowerPercentile());
        state.setStaticUpperPercentile(model.getStaticUpperPercentile());
        state.setZScoreThreshold(model.getZScoreThreshold());
        state.setEwmaAlpha(model.getEwmaAlpha());
        state.setSeasonalBandK(model.getSeasonalBandK());
        state.setResidualZScoreThreshold(model.getResidualZScoreThreshold());
        state.setMultivariateThreshold(model.getMultivariateThreshold());
        state.setWarmupObservations(model.getWarmupObservations());
        return state;
    }

    /**
     * the state goes through the same validation as a freshly built configuration
     */
    @Override
    public AnomalyConfig toModel(AnomalyConfigState state) {
        checkNotNull(state, "state cannot be null");
        return AnomalyConfig.builder().windowSize(state.getWindowSize())
                .staticLowerPercentile(state.getStaticLowerPercentile())
                .staticUpperPercentile(state.getStaticUpperPercentile()).zScoreThreshold(state.getZScoreThreshold())
                .ewmaAlpha(state.getEwmaAlpha()).seasonalBandK(state.getSeasonalBandK())
                .residualZScoreThreshold(state.getResidualZScoreThreshold())
                .multivariateThreshold(state.getMultivariateThreshold())
                .warmupObservations(state.getWarmupObservations()).build();
    }
}
