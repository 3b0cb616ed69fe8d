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

package com.hbc.anomaly.serialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hbc.anomaly.config.AnomalyConfig;
import com.hbc.anomaly.engine.AnomalyDetectionEngine;
import com.hbc.anomaly.engine.RegionSnapshot;
import com.hbc.anomaly.engine.state.RegionSnapshotMapper;
import com.hbc.anomaly.engine.state.RegionSnapshotState;
import com.hbc.anomaly.state.AnomalyConfigMapper;
import com.hbc.anomaly.state.AnomalyConfigState;

/**
 * JSON rendering of region snapshots for the dashboard. Snapshots are first
 * converted to state objects with {@link RegionSnapshotMapper} and then written
 * with a <a href="https://github.com/FasterXML/jackson">Jackson</a>
 * {@link ObjectMapper}. JSON property names are the state field names, which
 * match the exported metric names ({@code zScore}, {@code mdAnomaly}, ...).
 */
@Getter
public class AnomalySnapshotSerDe {

    private static final TypeReference<LinkedHashMap<String, RegionSnapshotState>> STATE_MAP = new TypeReference<>() {
    };

    private final RegionSnapshotMapper snapshotMapper;

    private final AnomalyConfigMapper configMapper;

    private final ObjectMapper objectMapper;

    public AnomalySnapshotSerDe() {
        this(new RegionSnapshotMapper(), new AnomalyConfigMapper(), defaultObjectMapper());
    }

    /**
     * @param snapshotMapper converts snapshots to state objects
     * @param configMapper   converts configurations to state objects
     * @param objectMapper   writes and reads the state objects; callers can
     *                       customize it, for example to enable indentation
     */
    public AnomalySnapshotSerDe(RegionSnapshotMapper snapshotMapper, AnomalyConfigMapper configMapper,
            ObjectMapper objectMapper) {
        this.snapshotMapper = snapshotMapper;
        this.configMapper = configMapper;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public String toJson(RegionSnapshot snapshot) throws JsonProcessingException {
        return objectMapper.writeValueAsString(snapshotMapper.toState(snapshot));
    }

    /**
     * @param json a snapshot written by {@link #toJson(RegionSnapshot)}
     * @return the snapshot
     * @throws JsonProcessingException if the text is not valid JSON or does not
     *                                 describe a snapshot, for example because
     *                                 the region is missing
     */
    public RegionSnapshot fromJson(String json) throws JsonProcessingException {
        RegionSnapshotState state = objectMapper.readValue(json, RegionSnapshotState.class);
        try {
            return snapshotMapper.toModel(state);
        } catch (IllegalArgumentException e) {
            throw new JsonMappingException(null, "invalid snapshot: " + e.getMessage(), e);
        }
    }

    /**
     * @param snapshots snapshots keyed by region
     * @return a JSON object with one member per region, in region order
     */
    public String toJson(Map<String, RegionSnapshot> snapshots) throws JsonProcessingException {
        Map<String, RegionSnapshotState> states = new TreeMap<>();
        snapshots.forEach((region, snapshot) -> states.put(region, snapshotMapper.toState(snapshot)));
        return objectMapper.writeValueAsString(states);
    }

    public Map<String, RegionSnapshot> snapshotsFromJson(String json) throws JsonProcessingException {
        Map<String, RegionSnapshot> snapshots = new LinkedHashMap<>();
        for (Map.Entry<String, RegionSnapshotState> entry : objectMapper.readValue(json, STATE_MAP).entrySet()) {
            try {
                snapshots.put(entry.getKey(), snapshotMapper.toModel(entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new JsonMappingException(null, "invalid snapshot of " + entry.getKey() + ": " + e.getMessage(),
                        e);
            }
        }
        return Collections.unmodifiableMap(snapshots);
    }

    /**
     * @param engine an engine
     * @return the latest snapshot of every region of the engine as JSON
     */
    public String toJson(AnomalyDetectionEngine engine) throws JsonProcessingException {
        return toJson(engine.snapshots());
    }

    public String toJson(AnomalyConfig config) throws JsonProcessingException {
        return objectMapper.writeValueAsString(configMapper.toState(config));
    }

    /**
     * @param json a configuration written by {@link #toJson(AnomalyConfig)}
     * @return the validated configuration
     * @throws JsonProcessingException if the text is not valid JSON or describes
     *                                 an invalid configuration
     */
    public AnomalyConfig configFromJson(String json) throws JsonProcessingException {
        AnomalyConfigState state = objectMapper.readValue(json, AnomalyConfigState.class);
        try {
            return configMapper.toModel(state);
        } catch (IllegalArgumentException e) {
            throw new JsonMappingException(null, "invalid configuration: " + e.getMessage(), e);
        }
    }
}
