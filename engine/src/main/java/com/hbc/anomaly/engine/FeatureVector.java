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
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The named component values observed for a region in one cycle. The vector may
 * hold any subset of the {@link ComponentSignal} catalogue as well as names
 * outside it. Feature names are trimmed and lower-cased; insertion order is
 * kept. Instances are immutable.
 */
public class FeatureVector {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeatureVector.class);

    private static final FeatureVector EMPTY = new FeatureVector(Collections.emptyMap());

    private final Map<String, Double> values;

    private FeatureVector(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FeatureVector empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Entries with a null value, or a null or blank name, are treated as absent
     * features. Names that are equal after normalization keep the value met last
     * in the iteration order of {@code components}.
     *
     * @param components values keyed by feature name, may be null
     * @return the corresponding vector
     */
    public static FeatureVector of(Map<String, Double> components) {
        if (components == null || components.isEmpty()) {
            return EMPTY;
        }
        Map<String, Double> values = new LinkedHashMap<>();
        components.forEach((name, value) -> {
            if (name == null || name.isBlank() || value == null) {
                return;
            }
            String key = normalizeName(name);
            Double previous = values.put(key, value);
            if (previous != null) {
                LOGGER.warn("feature {} given more than once, {} replaces {}", key, value, previous);
            }
        });
        return values.isEmpty() ? EMPTY : new FeatureVector(values);
    }

    public static String normalizeName(String name) {
        checkArgument(name != null && !name.isBlank(), "feature name cannot be null or blank");
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @param primaryValue the behavior index for the same cycle
     * @return a vector holding the primary value under
     *         {@link ComponentSignal#BEHAVIOR_INDEX}, replacing any value already
     *         stored under that name, followed by the components of this vector
     */
    public FeatureVector withPrimary(double primaryValue) {
        Map<String, Double> merged = new LinkedHashMap<>();
        merged.put(ComponentSignal.BEHAVIOR_INDEX.getFeatureName(), primaryValue);
        values.forEach((name, value) -> {
            if (!ComponentSignal.BEHAVIOR_INDEX.getFeatureName().equals(name)) {
                merged.put(name, value);
            }
        });
        return new FeatureVector(merged);
    }

    /**
     * @return the first feature whose value is NaN or infinite, if any
     */
    public Optional<Map.Entry<String, Double>> firstNonFinite() {
        return values.entrySet().stream().filter(e -> !Double.isFinite(e.getValue())).findFirst();
    }

    public Optional<Double> get(String name) {
        return Optional.ofNullable(values.get(normalizeName(name)));
    }

    public Optional<Double> get(ComponentSignal signal) {
        return Optional.ofNullable(values.get(signal.getFeatureName()));
    }

    public boolean contains(String name) {
        return values.containsKey(normalizeName(name));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector)) {
            return false;
        }
        return values.equals(((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureVector" + values;
    }

    public static class Builder {

        private final Map<String, Double> values = new LinkedHashMap<>();

        public Builder put(String name, double value) {
            values.put(normalizeName(name), value);
            return this;
        }

        public Builder put(ComponentSignal signal, double value) {
            checkNotNull(signal, "signal cannot be null");
            values.put(signal.getFeatureName(), value);
            return this;
        }

        public FeatureVector build() {
            return values.isEmpty() ? EMPTY : new FeatureVector(new LinkedHashMap<>(values));
        }
    }
}
