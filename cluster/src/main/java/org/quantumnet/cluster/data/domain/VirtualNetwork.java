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

package org.quantumnet.cluster.data.domain;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A tenant network. Each network is realised as one logical switch.
 */
public class VirtualNetwork {

    public VirtualNetwork() {}

    public VirtualNetwork(String id, String projectId, String name,
                          Spec spec) {
        this.id = id;
        this.projectId = projectId;
        this.name = name;
        this.spec = spec;
    }

    public String id;

    @JsonProperty("project_id")
    public String projectId;

    public String name;

    public Spec spec = new Spec();

    @JsonIgnore
    public boolean dhcpEnabled() {
        return spec != null && spec.ipConfig != null
               && spec.ipConfig.dhcp != null && spec.ipConfig.dhcp.enabled;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof VirtualNetwork)) return false;
        final VirtualNetwork other = (VirtualNetwork) obj;
        return Objects.equal(id, other.id)
                && Objects.equal(projectId, other.projectId)
                && Objects.equal(name, other.name)
                && Objects.equal(spec, other.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, projectId, name, spec);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("projectId", projectId)
                .add("name", name)
                .add("spec", spec).toString();
    }

    public static class Spec {

        public NetworkType type = NetworkType.OVERLAY;

        public VlanConfig vlan;

        @JsonProperty("ip_config")
        public IpConfig ipConfig;

        public int mtu;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Spec)) return false;
            final Spec other = (Spec) obj;
            return Objects.equal(type, other.type)
                    && Objects.equal(vlan, other.vlan)
                    && Objects.equal(ipConfig, other.ipConfig)
                    && mtu == other.mtu;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(type, vlan, ipConfig, mtu);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("type", type)
                    .add("vlan", vlan)
                    .add("ipConfig", ipConfig)
                    .add("mtu", mtu).toString();
        }
    }

    public static class VlanConfig {

        public VlanConfig() {}

        public VlanConfig(int vlanId, String physicalNetwork) {
            this.vlanId = vlanId;
            this.physicalNetwork = physicalNetwork;
        }

        @JsonProperty("vlan_id")
        public int vlanId;

        @JsonProperty("physical_network")
        public String physicalNetwork;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof VlanConfig)) return false;
            final VlanConfig other = (VlanConfig) obj;
            return vlanId == other.vlanId
                    && Objects.equal(physicalNetwork, other.physicalNetwork);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(vlanId, physicalNetwork);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("vlanId", vlanId)
                    .add("physicalNetwork", physicalNetwork).toString();
        }
    }

    public static class IpConfig {

        public IpConfig() {}

        public IpConfig(String ipv4Subnet, String ipv4Gateway) {
            this.ipv4Subnet = ipv4Subnet;
            this.ipv4Gateway = ipv4Gateway;
        }

        @JsonProperty("ipv4_subnet")
        public String ipv4Subnet;

        @JsonProperty("ipv4_gateway")
        public String ipv4Gateway;

        public DhcpConfig dhcp;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof IpConfig)) return false;
            final IpConfig other = (IpConfig) obj;
            return Objects.equal(ipv4Subnet, other.ipv4Subnet)
                    && Objects.equal(ipv4Gateway, other.ipv4Gateway)
                    && Objects.equal(dhcp, other.dhcp);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(ipv4Subnet, ipv4Gateway, dhcp);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("ipv4Subnet", ipv4Subnet)
                    .add("ipv4Gateway", ipv4Gateway)
                    .add("dhcp", dhcp).toString();
        }
    }

    public static class DhcpConfig {

        public boolean enabled;

        @JsonProperty("lease_time_sec")
        public int leaseTimeSec;

        @JsonProperty("dns_servers")
        public List<String> dnsServers = new ArrayList<>();

        @JsonProperty("domain_name")
        public String domainName;

        @JsonProperty("ntp_servers")
        public List<String> ntpServers = new ArrayList<>();

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof DhcpConfig)) return false;
            final DhcpConfig other = (DhcpConfig) obj;
            return enabled == other.enabled
                    && leaseTimeSec == other.leaseTimeSec
                    && Objects.equal(dnsServers, other.dnsServers)
                    && Objects.equal(domainName, other.domainName)
                    && Objects.equal(ntpServers, other.ntpServers);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(enabled, leaseTimeSec, dnsServers,
                                    domainName, ntpServers);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("enabled", enabled)
                    .add("leaseTimeSec", leaseTimeSec)
                    .add("dnsServers", dnsServers)
                    .add("domainName", domainName)
                    .add("ntpServers", ntpServers).toString();
        }
    }
}
