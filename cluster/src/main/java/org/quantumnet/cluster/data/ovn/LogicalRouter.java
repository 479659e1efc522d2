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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

public class LogicalRouter extends NorthboundObject {

    public LogicalRouter() {}

    public LogicalRouter(String uuid, String name) {
        this.uuid = uuid;
        this.name = name;
    }

    public String name;

    public Boolean enabled;

    public List<String> ports = new ArrayList<>();

    public List<String> nat = new ArrayList<>();

    @JsonProperty("load_balancer")
    public List<String> loadBalancer = new ArrayList<>();

    public Map<String, String> options = new HashMap<>();

    @Override
    public String key() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof LogicalRouter)) return false;
        final LogicalRouter other = (LogicalRouter) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(name, other.name)
                && Objects.equal(enabled, other.enabled)
                && Objects.equal(ports, other.ports)
                && Objects.equal(nat, other.nat)
                && Objects.equal(loadBalancer, other.loadBalancer)
                && Objects.equal(options, other.options)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, enabled, ports, nat, loadBalancer,
                                options, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("name", name)
                .add("enabled", enabled)
                .add("ports", ports)
                .add("nat", nat)
                .add("loadBalancer", loadBalancer)
                .add("options", options)
                .add("externalIds", externalIds).toString();
    }
}
