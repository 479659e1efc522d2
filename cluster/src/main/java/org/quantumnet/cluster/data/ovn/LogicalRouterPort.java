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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

public class LogicalRouterPort extends NorthboundObject {

    public LogicalRouterPort() {}

    public LogicalRouterPort(String uuid, String name, String mac,
                             List<String> networks) {
        this.uuid = uuid;
        this.name = name;
        this.mac = mac;
        this.networks = networks;
    }

    public String name;

    public String mac;

    /** Router addresses in CIDR form, e.g. "10.0.0.1/24". */
    public List<String> networks = new ArrayList<>();

    public Boolean enabled;

    public String peer;

    public Map<String, String> options = new HashMap<>();

    @Override
    public String key() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof LogicalRouterPort)) return false;
        final LogicalRouterPort other = (LogicalRouterPort) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(name, other.name)
                && Objects.equal(mac, other.mac)
                && Objects.equal(networks, other.networks)
                && Objects.equal(enabled, other.enabled)
                && Objects.equal(peer, other.peer)
                && Objects.equal(options, other.options)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, mac, networks, enabled, peer,
                                options, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("name", name)
                .add("mac", mac)
                .add("networks", networks)
                .add("enabled", enabled)
                .add("peer", peer)
                .add("options", options)
                .add("externalIds", externalIds).toString();
    }
}
