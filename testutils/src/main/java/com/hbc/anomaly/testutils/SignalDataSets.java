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

package com.hbc.anomaly.testutils;

import static java.lang.Math.PI;
import static java.lang.Math.sin;

import java.util.Arrays;
import java.util.Random;

/**
 * Synthetic behavior index series. All generators take an explicit seed so that
 * tests and benchmarks are repeatable.
 */
public class SignalDataSets {

    private SignalDataSets() {
    }

    public static double[] constant(int size, double value) {
        double[] data = new double[size];
        Arrays.fill(data, value);
        return data;
    }

    public static double[] uniform(int size, double min, double max, long seed) {
        Random prg = new Random(seed);
        double[] data = new double[size];
        for (int i = 0; i < size; i++) {
            data[i] = min + (max - min) * prg.nextDouble();
        }
        return data;
    }

    public static double[] gaussian(int size, double mean, double sigma, long seed) {
        Random prg = new Random(seed);
        double[] data = new double[size];
        for (int i = 0; i < size; i++) {
            data[i] = mean + sigma * prg.nextGaussian();
        }
        return data;
    }

    /**
     * a sinusoid around {@code level} with additive gaussian noise
     */
    public static double[] noisySine(int size, double level, double amplitude, int period, double noise, long seed) {
        Random prg = new Random(seed);
        double[] data = new double[size];
        for (int i = 0; i < size; i++) {
            data[i] = level + amplitude * sin(2 * PI * i / period) + noise * prg.nextGaussian();
        }
        return data;
    }

    /**
     * gaussian noise whose mean moves from {@code before} to {@code after} at
     * position {@code shiftAt}
     */
    public static double[] levelShift(int size, double before, double after, int shiftAt, double sigma, long seed) {
        Random prg = new Random(seed);
        double[] data = new double[size];
        for (int i = 0; i < size; i++) {
            data[i] = ((i < shiftAt) ? before : after) + sigma * prg.nextGaussian();
        }
        return data;
    }

    /**
     * rows of correlated component values: each column is the shared driver plus
     * independent noise
     *
     * @param size    number of rows
     * @param columns number of components
     * @param level   mean of every column
     * @param sigma   standard deviation of the independent noise
     * @param seed    random seed
     * @return size x columns values
     */
    public static double[][] components(int size, int columns, double level, double sigma, long seed) {
        Random prg = new Random(seed);
        double[][] data = new double[size][columns];
        for (int i = 0; i < size; i++) {
            double driver = 0.5 * sigma * prg.nextGaussian();
            for (int j = 0; j < columns; j++) {
                data[i][j] = level + driver + sigma * prg.nextGaussian();
            }
        }
        return data;
    }
}
