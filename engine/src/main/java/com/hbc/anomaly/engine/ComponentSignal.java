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

package com.hbc.anomaly.engine;

import java.util.Locale;
import java.util.Optional;

/**
 * The signals the ingestion pipeline produces for a region. The behavior index
 * is the primary signal; the others are its component sub-indices. Any other
 * feature name is still accepted by the multivariate detector, this catalogue
 * only names the ones that are known.
 */
public enum ComponentSignal {

    BEHAVIOR_INDEX("behavior_index"),
    ECONOMIC_STRESS("economic_stress"),
    ENVIRONMENTAL_STRESS("environmental_stress"),
    MOBILITY_ACTIVITY("mobility_activity"),
    DIGITAL_ATTENTION("digital_attention"),
    PUBLIC_HEALTH_STRESS("public_health_stress"),
    POLITICAL_STRESS("political_stress"),
    CRIME_STRESS("crime_stress"),
    MISINFORMATION_STRESS("misinformation_stress"),
    SOCIAL_COHESION_STRESS("social_cohesion_stress");

    private final String featureName;

    ComponentSignal(String featureName) {
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }

    public boolean isPrimary() {
        return this == BEHAVIOR_INDEX;
    }

    /**
     * @param name a feature name, case insensitive
     * @return the catalogue entry with that feature name, if any
     */
    public static Optional<ComponentSignal> fromFeatureName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (ComponentSignal signal : values()) {
            if (signal.featureName.equals(key)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }
}
