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

import static com.hbc.anomaly.CommonUtils.checkArgument;

import java.util.Locale;

/**
 * Canonical form of region identifiers: surrounding whitespace removed and lower
 * case, so that "MN", " mn" and "Mn" address the same region state.
 */
public class RegionIds {

    private RegionIds() {
    }

    /**
     * @param region a region identifier as supplied by a caller
     * @return the canonical identifier
     * @throws IllegalArgumentException if the identifier is null or blank
     */
    public static String normalize(String region) {
        checkArgument(region != null && !region.isBlank(), "region identifier cannot be null or blank");
        return region.trim().toLowerCase(Locale.ROOT);
    }
}
