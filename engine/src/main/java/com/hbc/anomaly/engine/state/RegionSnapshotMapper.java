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

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;

import com.hbc.anomaly.engine.RegionSnapshot;
import com.hbc.anomaly.returntypes.MultivariateResult;
import com.hbc.anomaly.returntypes.SeasonalResult;
import com.hbc.anomaly.returntypes.UnivariateResult;
import com.hbc.anomaly.state.IStateMapper;

/**
 * Flattens a {@link RegionSnapshot} into a plain state object for the
 * dashboard. Only outputs are carried; the windows behind them are not.
 */
public class RegionSnapshotMapper implements IStateMapper<RegionSnapshot, RegionSnapshotState> {

    @Override
    public RegionSnapshotState toState(RegionSnapshot model) {
        checkNotNull(model, "snapshot cannot be null");
        RegionSnapshotState state = new RegionSnapshotState();
        state.setRegion(model.getRegion());
        state.setObservationCount(model.getObservationCount());
        state.setWarmedUp(model.isWarmedUp());

        state.setStaticLowerBound(model.getStaticLowerBound());
        state.setStaticUpperBound(model.getStaticUpperBound());
        state.setStaticAnomaly(model.isStaticAnomaly());
        state.setZScore(model.getZScore());
        state.setZScoreAnomaly(model.isZScoreAnomaly());

        state.setBaseline(model.getBaseline());
        state.setUpperBand(model.getUpperBand());
        state.setLowerBand(model.getLowerBand());
        state.setSeasonalAnomaly(model.isSeasonalAnomaly());
        state.setResidual(model.getResidual());
        state.setResidualZScore(model.getResidualZScore());
        state.setResidualAnomaly(model.isResidualAnomaly());

        state.setMdScore(model.getMdScore());
        state.setMdAnomaly(model.isMdAnomaly());
        state.setMdContributions(new LinkedHashMap<>(model.getMultivariate().getContributions()));
        state.setFeatureNames(new ArrayList<>(model.getFeatureNames()));
        return state;
    }

    @Override
    public RegionSnapshot toModel(RegionSnapshotState state) {
        checkNotNull(state, "state cannot be null");
        checkArgument(state.getRegion() != null && !state.getRegion().isBlank(), "state has no region");
        UnivariateResult univariate = new UnivariateResult(state.getStaticLowerBound(), state.getStaticUpperBound(),
                state.isStaticAnomaly(), state.getZScore(), state.isZScoreAnomaly());
        SeasonalResult seasonal = new SeasonalResult(state.getBaseline(), state.getUpperBand(),
                state.getLowerBand(), state.isSeasonalAnomaly(), state.getResidual(), state.getResidualZScore(),
                state.isResidualAnomaly());
        MultivariateResult multivariate = new MultivariateResult(state.getMdScore(), state.isMdAnomaly(),
                (state.getMdContributions() == null) ? Collections.emptyMap() : state.getMdContributions());
        return new RegionSnapshot(state.getRegion(), state.getObservationCount(), state.isWarmedUp(), univariate,
                seasonal, multivariate,
                (state.getFeatureNames() == null) ? Collections.emptySet() : new HashSet<>(state.getFeatureNames()));
    }
}
