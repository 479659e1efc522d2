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

import com.google.common.collect.ImmutableList;

/**
 * Built-in security group templates offered to tenants.
 */
public final class SecurityGroupPresets {

    private SecurityGroupPresets() {}

    /**
     * Returns fresh copies of every preset. The groups have no id; callers
     * assign one before translating them.
     */
    public static List<SecurityGroup> all() {
        return ImmutableList.of(
            preset("allow-ssh", "Allow SSH access",
                   tcp("allow-ssh-rule", 22, "Allow SSH (TCP 22)")),
            preset("allow-web", "Allow HTTP and HTTPS traffic",
                   tcp("allow-http-rule", 80, "Allow HTTP (TCP 80)"),
                   tcp("allow-https-rule", 443, "Allow HTTPS (TCP 443)")),
            preset("allow-rdp", "Allow RDP access",
                   tcp("allow-rdp-rule", 3389, "Allow RDP (TCP 3389)")),
            preset("allow-icmp", "Allow ICMP (ping)", icmpAll()),
            preset("allow-database", "Allow common database ports",
                   tcp("allow-mysql-rule", 3306, "Allow MySQL (TCP 3306)"),
                   tcp("allow-postgres-rule", 5432,
                       "Allow PostgreSQL (TCP 5432)"),
                   tcp("allow-mongodb-rule", 27017,
                       "Allow MongoDB (TCP 27017)"),
                   tcp("allow-redis-rule", 6379, "Allow Redis (TCP 6379)")),
            preset("allow-internal", "Allow all internal RFC1918 traffic",
                   prefix("allow-10-rule", "10.0.0.0/8"),
                   prefix("allow-172-rule", "172.16.0.0/12"),
                   prefix("allow-192-rule", "192.168.0.0/16")));
    }

    /**
     * Returns the preset with the given name, or null if there is none.
     */
    public static SecurityGroup get(String name) {
        for (SecurityGroup sg : all()) {
            if (sg.name.equals(name)) return sg;
        }
        return null;
    }

    private static SecurityGroup preset(String name, String description,
                                        SecurityGroupRule... rules) {
        SecurityGroup sg = new SecurityGroup(
            null, name, true, new ArrayList<>(List.of(rules)));
        sg.description = description;
        return sg;
    }

    private static SecurityGroupRule tcp(String id, int port, String desc) {
        SecurityGroupRule rule = ingressAllow(id, "tcp", desc);
        rule.portMin = port;
        rule.portMax = port;
        return rule;
    }

    private static SecurityGroupRule icmpAll() {
        SecurityGroupRule rule =
            ingressAllow("allow-icmp-rule", "icmp", "Allow all ICMP");
        rule.icmpType = SecurityGroupRule.ICMP_ANY;
        rule.icmpCode = SecurityGroupRule.ICMP_ANY;
        return rule;
    }

    private static SecurityGroupRule prefix(String id, String cidr) {
        SecurityGroupRule rule = ingressAllow(id, "any", "Allow " + cidr);
        rule.remoteIpPrefix = cidr;
        return rule;
    }

    private static SecurityGroupRule ingressAllow(String id, String protocol,
                                                  String description) {
        SecurityGroupRule rule = new SecurityGroupRule(
            id, RuleDirection.INGRESS, protocol, RuleAction.ALLOW);
        rule.description = description;
        return rule;
    }
}
