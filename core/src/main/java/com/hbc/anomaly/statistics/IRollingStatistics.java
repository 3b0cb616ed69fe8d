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

package com.hbc.anomaly.statistics;

/**
 * A read-only view of a window of observations. Detectors that consult a window
 * they do not own receive this view instead of the buffer itself.
 */
public interface IRollingStatistics {

    int size();

    int getCapacity();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @return the arithmetic mean of the window, 0 if empty
     */
    double mean();

    /**
     * @return the population standard deviation of the window; exactly 0 for
     *         fewer than 2 values or a numerically constant window
     */
    double std();

    /**
     * @param percentile   a value in [0, 100]
     * @param valueIfEmpty returned when the window holds no observations
     * @return the linearly interpolated percentile of the window
     */
    double percentile(double percentile, double valueIfEmpty);

    default double percentile(double percentile) {
        return percentile(percentile, 0);
    }

    /**
     * @return the contents of the window, oldest first
     */
    double[] toArray();
}
