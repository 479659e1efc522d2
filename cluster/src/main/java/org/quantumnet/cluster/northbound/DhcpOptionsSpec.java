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

package org.quantumnet.cluster.northbound;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.MoreObjects;

/**
 * Explicit DHCP settings of a subnet, for DHCP options that are not
 * derived from a network.
 */
public class DhcpOptionsSpec {

    public String cidr;

    public String serverId;

    /** Generated when empty. */
    public String serverMac;

    public String router;

    public int leaseTime;

    public List<String> dnsServers = new ArrayList<>();

    public int mtu;

    public String domainName;

    public DhcpOptionsSpec() {}

    public DhcpOptionsSpec(String cidr, String router) {
        this.cidr = cidr;
        this.serverId = router;
        this.router = router;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cidr", cidr)
                .add("serverId", serverId)
                .add("serverMac", serverMac)
                .add("router", router)
                .add("leaseTime", leaseTime)
                .add("dnsServers", dnsServers)
                .add("mtu", mtu)
                .add("domainName", domainName).toString();
    }
}
