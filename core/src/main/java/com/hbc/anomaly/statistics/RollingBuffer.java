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

import static com.hbc.anomaly.CommonUtils.NUMERICAL_ZERO;
import static com.hbc.anomaly.CommonUtils.checkArgument;
import static java.lang.Math.abs;
import static java.lang.Math.max;
import static java.lang.Math.sqrt;

import java.util.Arrays;

/**
 * A fixed capacity window of doubles with first-in-first-out eviction. Values
 * are stored in a circular array; statistics are computed on demand over the
 * current contents and never modify the buffer.
 */
public class RollingBuffer implements IRollingStatistics {

    public static final int DEFAULT_CAPACITY = 500;

    protected final double[] values;

    // position of the oldest value
    protected int start = 0;

    protected int size = 0;

    public RollingBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public RollingBuffer(int capacity) {
        checkArgument(capacity > 0, "capacity must be positive");
        this.values = new double[capacity];
    }

    /**
     * appends a value, evicting the oldest one if the buffer is full
     *
     * @param value the observation
     */
    public void push(double value) {
        if (size < values.length) {
            values[(start + size) % values.length] = value;
            ++size;
        } else {
            values[start] = value;
            start = (start + 1) % values.length;
        }
    }

    /**
     * @param index position in the window, 0 being the oldest value
     * @return the value at that position
     */
    public double get(int index) {
        checkArgument(index >= 0 && index < size, "index out of range");
        return values[(start + index) % values.length];
    }

    public void clear() {
        start = 0;
        size = 0;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int getCapacity() {
        return values.length;
    }

    public boolean isFull() {
        return size == values.length;
    }

    @Override
    public double mean() {
        if (size == 0) {
            return 0;
        }
        double sum = 0;
        for (int i = 0; i < size; i++) {
            sum += get(i);
        }
        return sum / size;
    }

    @Override
    public double std() {
        if (size < 2) {
            return 0;
        }
        double mean = mean();
        double first = get(0);
        boolean constant = true;
        double sumSquared = 0;
        for (int i = 0; i < size; i++) {
            double value = get(i);
            constant &= (value == first);
            double difference = value - mean;
            sumSquared += difference * difference;
        }
        if (constant) {
            return 0;
        }
        double deviation = sqrt(sumSquared / size);
        // rounding noise around a (nearly) constant window is not spread
        return (deviation > NUMERICAL_ZERO * max(1.0, abs(mean))) ? deviation : 0;
    }

    @Override
    public double percentile(double percentile, double valueIfEmpty) {
        checkArgument(percentile >= 0 && percentile <= 100, "percentile must be in [0, 100]");
        if (size == 0) {
            return valueIfEmpty;
        }
        if (size == 1) {
            return get(0);
        }
        double[] sorted = toArray();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (size - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    @Override
    public double[] toArray() {
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = get(i);
        }
        return result;
    }

    @Override
    public String toString() {
        return "RollingBuffer{capacity=" + values.length + ", values=" + Arrays.toString(toArray()) + "}";
    }
}
