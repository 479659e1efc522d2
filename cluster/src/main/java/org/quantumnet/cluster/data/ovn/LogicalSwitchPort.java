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

/**
 * A port on a logical switch.
 */
public class LogicalSwitchPort extends NorthboundObject {

    /** Type of a VM port. */
    public static final String TYPE_NORMAL = "";
    public static final String TYPE_ROUTER = "router";
    public static final String TYPE_LOCALNET = "localnet";
    public static final String TYPE_DIRECT = "direct";
    public static final String TYPE_VHOST_USER = "dpdkvhostuser";

    public static final String OPT_REQUESTED_CHASSIS = "requested-chassis";
    public static final String OPT_VHOST_SOCK = "vhost-sock";
    public static final String OPT_ROUTER_PORT = "router-port";
    public static final String OPT_NETWORK_NAME = "network_name";

    public LogicalSwitchPort() {}

    public LogicalSwitchPort(String uuid, String name) {
        this.uuid = uuid;
        this.name = name;
    }

    public String name;

    public String type = TYPE_NORMAL;

    /** "MAC IP..." strings, or the keywords "router" and "unknown". */
    public List<String> addresses = new ArrayList<>();

    @JsonProperty("port_security")
    public List<String> portSecurity = new ArrayList<>();

    public Boolean enabled;

    public Integer tag;

    public Map<String, String> options = new HashMap<>();

    @JsonProperty("dhcpv4_options")
    public String dhcpv4Options;

    @Override
    public String key() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof LogicalSwitchPort)) return false;
        final LogicalSwitchPort other = (LogicalSwitchPort) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(name, other.name)
                && Objects.equal(type, other.type)
                && Objects.equal(addresses, other.addresses)
                && Objects.equal(portSecurity, other.portSecurity)
                && Objects.equal(enabled, other.enabled)
                && Objects.equal(tag, other.tag)
                && Objects.equal(options, other.options)
                && Objects.equal(dhcpv4Options, other.dhcpv4Options)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, type, addresses, portSecurity,
                                enabled, tag, options, dhcpv4Options,
                                externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("name", name)
                .add("type", type)
                .add("addresses", addresses)
                .add("portSecurity", portSecurity)
                .add("enabled", enabled)
                .add("tag", tag)
                .add("options", options)
                .add("dhcpv4Options", dhcpv4Options)
                .add("externalIds", externalIds).toString();
    }
}
