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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import org.quantumnet.util.PortRange;

public class SecurityGroupRule {

    /** Value of the ICMP type and code fields meaning "any". */
    public static final int ICMP_ANY = -1;

    public SecurityGroupRule() {}

    public SecurityGroupRule(String id, RuleDirection direction,
                             String protocol, RuleAction action) {
        this.id = id;
        this.direction = direction;
        this.protocol = protocol;
        this.action = action;
    }

    public String id;

    public RuleDirection direction;

    public String protocol;

    @JsonProperty("port_min")
    public int portMin;

    @JsonProperty("port_max")
    public int portMax;

    @JsonProperty("icmp_type")
    public Integer icmpType;

    @JsonProperty("icmp_code")
    public Integer icmpCode;

    @JsonProperty("remote_ip_prefix")
    public String remoteIpPrefix;

    @JsonProperty("remote_security_group_id")
    public String remoteSecurityGroupId;

    public RuleAction action;

    public long priority;

    public String description;

    @JsonIgnore
    public boolean isEgress() {
        return direction == RuleDirection.EGRESS;
    }

    @JsonIgnore
    public boolean isIngress() {
        return direction == RuleDirection.INGRESS;
    }

    /**
     * The destination port range of the rule, or null when the rule does not
     * restrict ports (port-min zero). A zero port-max means port-min alone.
     *
     * @throws IllegalArgumentException if either bound is not a port number
     *         or the range is inverted.
     */
    @JsonIgnore
    public PortRange portRange() {
        PortRange.checkPort(portMin);
        PortRange.checkPort(portMax);
        if (portMin == 0) return null;
        return PortRange.of(portMin, portMax == 0 ? portMin : portMax);
    }

    @Override
    public boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof SecurityGroupRule)) return false;
        final SecurityGroupRule other = (SecurityGroupRule) obj;

        return Objects.equal(id, other.id)
                && Objects.equal(direction, other.direction)
                && Objects.equal(protocol, other.protocol)
                && portMin == other.portMin
                && portMax == other.portMax
                && Objects.equal(icmpType, other.icmpType)
                && Objects.equal(icmpCode, other.icmpCode)
                && Objects.equal(remoteIpPrefix, other.remoteIpPrefix)
                && Objects.equal(remoteSecurityGroupId,
                                 other.remoteSecurityGroupId)
                && Objects.equal(action, other.action)
                && priority == other.priority
                && Objects.equal(description, other.description);
    }

    @Override
    public int hashCode() {

        return Objects.hashCode(id, direction, protocol, portMin, portMax,
                icmpType, icmpCode, remoteIpPrefix, remoteSecurityGroupId,
                action, priority, description);
    }

    @Override
    public String toString() {

        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("direction", direction)
                .add("protocol", protocol)
                .add("portMin", portMin)
                .add("portMax", portMax)
                .add("icmpType", icmpType)
                .add("icmpCode", icmpCode)
                .add("remoteIpPrefix", remoteIpPrefix)
                .add("remoteSecurityGroupId", remoteSecurityGroupId)
                .add("action", action)
                .add("priority", priority)
                .add("description", description).toString();
    }
}
