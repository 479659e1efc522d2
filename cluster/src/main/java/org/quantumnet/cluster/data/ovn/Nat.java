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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A NAT rule of a logical router, stored by UUID. The owning router is
 * recorded in the external ids.
 */
public class Nat extends NorthboundObject {

    public Nat() {}

    public Nat(String uuid, NatType type, String externalIp,
               String logicalIp) {
        this.uuid = uuid;
        this.type = type;
        this.externalIp = externalIp;
        this.logicalIp = logicalIp;
    }

    public NatType type;

    @JsonProperty("external_ip")
    public String externalIp;

    @JsonProperty("logical_ip")
    public String logicalIp;

    @JsonProperty("logical_port")
    public String logicalPort;

    @JsonProperty("external_mac")
    public String externalMac;

    @Override
    public String key() {
        return uuid;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Nat)) return false;
        final Nat other = (Nat) obj;
        return Objects.equal(uuid, other.uuid)
                && type == other.type
                && Objects.equal(externalIp, other.externalIp)
                && Objects.equal(logicalIp, other.logicalIp)
                && Objects.equal(logicalPort, other.logicalPort)
                && Objects.equal(externalMac, other.externalMac)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, type, externalIp, logicalIp,
                                logicalPort, externalMac, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("type", type)
                .add("externalIp", externalIp)
                .add("logicalIp", logicalIp)
                .add("logicalPort", logicalPort)
                .add("externalMac", externalMac)
                .add("externalIds", externalIds).toString();
    }
}
