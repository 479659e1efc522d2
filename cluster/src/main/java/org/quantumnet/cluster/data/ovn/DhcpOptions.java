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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * DHCPv4 options served on one subnet, stored by UUID.
 */
public class DhcpOptions extends NorthboundObject {

    public static final String SERVER_ID = "server_id";
    public static final String SERVER_MAC = "server_mac";
    public static final String ROUTER = "router";
    public static final String LEASE_TIME = "lease_time";
    public static final String DNS_SERVER = "dns_server";
    public static final String DOMAIN_NAME = "domain_name";
    public static final String NTP_SERVER = "ntp_server";
    public static final String MTU = "mtu";

    public DhcpOptions() {}

    public DhcpOptions(String uuid, String cidr) {
        this.uuid = uuid;
        this.cidr = cidr;
    }

    public String cidr;

    public Map<String, String> options = new HashMap<>();

    @Override
    public String key() {
        return uuid;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof DhcpOptions)) return false;
        final DhcpOptions other = (DhcpOptions) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(cidr, other.cidr)
                && Objects.equal(options, other.options)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, cidr, options, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("cidr", cidr)
                .add("options", options)
                .add("externalIds", externalIds).toString();
    }
}
