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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

public class FeatureVectorTest {

    @Test
    void namesAreNormalized() {
        FeatureVector vector = FeatureVector.builder().put(" Economic_Stress ", 0.3)
                .put(ComponentSignal.CRIME_STRESS, 0.1).build();
        assertThat(vector.names(), contains("economic_stress", "crime_stress"));
        assertEquals(Optional.of(0.3), vector.get("ECONOMIC_STRESS"));
        assertEquals(Optional.of(0.1), vector.get(ComponentSignal.CRIME_STRESS));
        assertEquals(Optional.empty(), vector.get(ComponentSignal.DIGITAL_ATTENTION));
        assertTrue(vector.contains("Crime_Stress"));
        assertEquals(2, vector.size());
    }

    @Test
    void blankNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> FeatureVector.builder().put(" ", 1.0));
        assertThrows(IllegalArgumentException.class, () -> FeatureVector.builder().put((String) null, 1.0));
        assertThrows(NullPointerException.class, () -> FeatureVector.builder().put((ComponentSignal) null, 1.0));
    }

    @Test
    void ofSkipsNullValues() {
        Map<String, Double> components = new LinkedHashMap<>();
        components.put("economic_stress", 0.2);
        components.put("mobility_activity", null);
        FeatureVector vector = FeatureVector.of(components);
        assertThat(vector.names(), contains("economic_stress"));

        assertSame(FeatureVector.empty(), FeatureVector.of(null));
        assertSame(FeatureVector.empty(), FeatureVector.of(new HashMap<>()));
        assertTrue(FeatureVector.builder().build().isEmpty());
    }

    @Test
    void ofSkipsNullAndBlankNames() {
        Map<String, Double> components = new HashMap<>();
        components.put(null, 0.7);
        components.put(" ", 0.8);
        components.put("economic_stress", 0.2);
        FeatureVector vector = FeatureVector.of(components);
        assertThat(vector.names(), contains("economic_stress"));

        Map<String, Double> onlyInvalid = new HashMap<>();
        onlyInvalid.put(null, 0.7);
        assertSame(FeatureVector.empty(), FeatureVector.of(onlyInvalid));

        AnomalyDetectionEngine engine = new AnomalyDetectionEngine();
        RegionSnapshot snapshot = engine.update("mn", 0.5, components).get();
        assertThat(snapshot.getFeatureNames(), contains("behavior_index", "economic_stress"));
    }

    @Test
    void collidingNamesKeepLastValue() {
        Map<String, Double> components = new LinkedHashMap<>();
        components.put("Economic_Stress", 0.2);
        components.put("crime_stress", 0.1);
        components.put("economic_stress ", 0.3);
        FeatureVector vector = FeatureVector.of(components);
        assertThat(vector.names(), contains("economic_stress", "crime_stress"));
        assertEquals(Optional.of(0.3), vector.get("economic_stress"));
    }

    @Test
    void primaryValueReplacesComponentOfSameName() {
        FeatureVector vector = FeatureVector.builder().put("economic_stress", 0.2).put("behavior_index", 9.0)
                .build();
        FeatureVector merged = vector.withPrimary(0.5);
        assertThat(merged.names(), contains("behavior_index", "economic_stress"));
        assertEquals(Optional.of(0.5), merged.get(ComponentSignal.BEHAVIOR_INDEX));
        assertEquals(Optional.of(9.0), vector.get(ComponentSignal.BEHAVIOR_INDEX));
        assertEquals(1, FeatureVector.empty().withPrimary(0.5).size());
    }

    @Test
    void nonFiniteValueIsReported() {
        FeatureVector finite = FeatureVector.builder().put("a", 1.0).put("b", 2.0).build();
        assertFalse(finite.firstNonFinite().isPresent());

        FeatureVector vector = FeatureVector.builder().put("a", 1.0).put("b", Double.POSITIVE_INFINITY)
                .put("c", Double.NaN).build();
        Map.Entry<String, Double> entry = vector.firstNonFinite().get();
        assertEquals("b", entry.getKey());
        assertEquals(Double.POSITIVE_INFINITY, entry.getValue());
    }

    @Test
    void vectorsAreImmutableValues() {
        FeatureVector first = FeatureVector.builder().put("a", 1.0).build();
        FeatureVector second = FeatureVector.builder().put("A", 1.0).build();
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertThrows(UnsupportedOperationException.class, () -> first.asMap().put("b", 2.0));
    }
}
