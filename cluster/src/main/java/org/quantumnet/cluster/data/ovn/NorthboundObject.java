/*
 * Copyright 2024 The QuantumNet Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.quantumnet.cluster.data.ovn;

import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base class of every row of the OVN Northbound database handled by the
 * control plane. Field JSON names are the Northbound column names.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public abstract class NorthboundObject {

    private static final ObjectMapper COPIER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonProperty("_uuid")
    public String uuid;

    @JsonProperty("external_ids")
    public Map<String, String> externalIds = new HashMap<>();

    /**
     * The value the object is stored under: its name for named tables, its
     * UUID otherwise.
     */
    @JsonIgnore
    public abstract String key();

    public String externalId(String key) {
        return externalIds == null ? null : externalIds.get(key);
    }

    public NorthboundObject putExternalId(String key, String value) {
        if (externalIds == null) externalIds = new HashMap<>();
        externalIds.put(key, value);
        return this;
    }

    /**
     * A deep copy of this object, sharing no mutable state with it.
     */
    @SuppressWarnings("unchecked")
    public <T extends NorthboundObject> T copy() {
        return (T) COPIER.convertValue(this, getClass());
    }
}
