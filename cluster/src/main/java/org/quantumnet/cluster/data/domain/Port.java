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
 * A virtual NIC attached to a network.
 */
public class Port {

    public Port() {}

    public Port(String id, String networkId, Spec spec) {
        this.id = id;
        this.networkId = networkId;
        this.spec = spec;
    }

    public String id;

    @JsonProperty("network_id")
    public String networkId;

    @JsonProperty("project_id")
    public String projectId;

    public Spec spec = new Spec();

    public Status status = new Status();

    /**
     * The IP addresses of all the fixed IPs of this port, in order.
     */
    @JsonIgnore
    public List<String> ipAddresses() {
        List<String> ips = new ArrayList<>();
        if (spec == null || spec.fixedIps == null) return ips;
        for (FixedIp fixedIp : spec.fixedIps) {
            if (fixedIp.ipAddress != null && !fixedIp.ipAddress.isEmpty())
                ips.add(fixedIp.ipAddress);
        }
        return ips;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Port)) return false;
        final Port other = (Port) obj;
        return Objects.equal(id, other.id)
                && Objects.equal(networkId, other.networkId)
                && Objects.equal(projectId, other.projectId)
                && Objects.equal(spec, other.spec)
                && Objects.equal(status, other.status);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, networkId, projectId, spec, status);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("networkId", networkId)
                .add("projectId", projectId)
                .add("spec", spec)
                .add("status", status).toString();
    }

    public static class Spec {

        @JsonProperty("mac_address")
        public String macAddress;

        @JsonProperty("fixed_ips")
        public List<FixedIp> fixedIps = new ArrayList<>();

        @JsonProperty("security_group_ids")
        public List<String> securityGroupIds = new ArrayList<>();

        @JsonProperty("port_security_enabled")
        public boolean portSecurityEnabled;

        public Binding binding;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Spec)) return false;
            final Spec other = (Spec) obj;
            return Objects.equal(macAddress, other.macAddress)
                    && Objects.equal(fixedIps, other.fixedIps)
                    && Objects.equal(securityGroupIds, other.securityGroupIds)
                    && portSecurityEnabled == other.portSecurityEnabled
                    && Objects.equal(binding, other.binding);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(macAddress, fixedIps, securityGroupIds,
                                    portSecurityEnabled, binding);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("macAddress", macAddress)
                    .add("fixedIps", fixedIps)
                    .add("securityGroupIds", securityGroupIds)
                    .add("portSecurityEnabled", portSecurityEnabled)
                    .add("binding", binding).toString();
        }
    }

    public static class FixedIp {

        public FixedIp() {}

        public FixedIp(String subnetId, String ipAddress) {
            this.subnetId = subnetId;
            this.ipAddress = ipAddress;
        }

        @JsonProperty("subnet_id")
        public String subnetId;

        @JsonProperty("ip_address")
        public String ipAddress;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof FixedIp)) return false;
            final FixedIp other = (FixedIp) obj;
            return Objects.equal(subnetId, other.subnetId)
                    && Objects.equal(ipAddress, other.ipAddress);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(subnetId, ipAddress);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("subnetId", subnetId)
                    .add("ipAddress", ipAddress).toString();
        }
    }

    public static class Binding {

        public Binding() {}

        public Binding(BindingType type) {
            this.type = type;
        }

        public BindingType type = BindingType.NORMAL;

        @JsonProperty("vhost_socket")
        public String vhostSocket;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Binding)) return false;
            final Binding other = (Binding) obj;
            return Objects.equal(type, other.type)
                    && Objects.equal(vhostSocket, other.vhostSocket);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(type, vhostSocket);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("type", type)
                    .add("vhostSocket", vhostSocket).toString();
        }
    }

    public static class Status {

        @JsonProperty("vm_id")
        public String vmId;

        @JsonProperty("host_id")
        public String hostId;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Status)) return false;
            final Status other = (Status) obj;
            return Objects.equal(vmId, other.vmId)
                    && Objects.equal(hostId, other.hostId);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(vmId, hostId);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("vmId", vmId)
                    .add("hostId", hostId).toString();
        }
    }
}
