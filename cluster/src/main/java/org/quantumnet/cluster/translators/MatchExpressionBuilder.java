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

package org.quantumnet.cluster.translators;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import org.apache.commons.lang3.StringUtils;

import org.quantumnet.cluster.data.domain.RuleDirection;
import org.quantumnet.cluster.data.domain.SecurityGroupRule;
import org.quantumnet.cluster.naming.OvnNames;
import org.quantumnet.packets.IPSubnet;
import org.quantumnet.util.PortRange;

/**
 * Builds the OVN match expression of a security group rule.
 *
 * The expression is the conjunction of, in order: the port group scope, the
 * IP version, the protocol with its ports or ICMP type and code, the remote
 * prefix and the remote security group.
 */
public final class MatchExpressionBuilder {

    public static final String PROTO_ANY = "any";
    public static final int MAX_ICMP_VALUE = 255;
    public static final int MAX_IP_PROTO = 255;

    private static final Joiner AND = Joiner.on(" && ");

    private static final ImmutableMap<String, Integer> IP_PROTOCOLS =
        ImmutableMap.of("gre", 47, "esp", 50, "ah", 51, "vrrp", 112);

    private MatchExpressionBuilder() {}

    /**
     * Builds the match expression of the given rule, scoped to the given
     * port group.
     *
     * @throws RuleTranslationException if the rule has no direction or any
     *         of its fields is out of range.
     */
    public static String build(SecurityGroupRule rule, String portGroup)
            throws RuleTranslationException {
        if (rule.direction == null)
            throw new RuleTranslationException(rule.id, "missing direction");

        boolean ingress = rule.direction == RuleDirection.INGRESS;
        List<String> clauses = new ArrayList<>();

        clauses.add((ingress ? "outport" : "inport") + " == @" + portGroup);

        IPSubnet remote = remotePrefix(rule);
        boolean ipv6 = remote != null && remote.isIpv6();
        clauses.add(ipv6 ? "ip6" : "ip4");

        String protocol = StringUtils.lowerCase(
            StringUtils.trimToEmpty(rule.protocol), Locale.ROOT);
        if (!protocol.isEmpty() && !PROTO_ANY.equals(protocol)) {
            protocolClauses(rule, protocol, clauses);
        }

        if (remote != null && !remote.isAny()) {
            String field = (ipv6 ? "ip6" : "ip4") + (ingress ? ".src" : ".dst");
            clauses.add(field + " == " + rule.remoteIpPrefix.trim());
        }

        if (StringUtils.isNotEmpty(rule.remoteSecurityGroupId)) {
            String remotePg = OvnNames.portGroup(rule.remoteSecurityGroupId);
            clauses.add((ingress ? "inport" : "outport") + " == @" + remotePg);
        }

        return AND.join(clauses);
    }

    private static IPSubnet remotePrefix(SecurityGroupRule rule)
            throws RuleTranslationException {
        if (StringUtils.isBlank(rule.remoteIpPrefix)) return null;
        try {
            return IPSubnet.fromCidr(rule.remoteIpPrefix);
        } catch (IllegalArgumentException e) {
            throw new RuleTranslationException(
                rule.id, "invalid remote prefix " + rule.remoteIpPrefix, e);
        }
    }

    private static void protocolClauses(SecurityGroupRule rule,
                                        String protocol, List<String> clauses)
            throws RuleTranslationException {
        switch (protocol) {
            case "tcp":
            case "udp":
            case "sctp":
                clauses.add(protocol);
                PortRange ports = portRange(rule);
                if (ports == null) {
                    break;
                } else if (ports.isSingle()) {
                    clauses.add(protocol + ".dst == " + ports.first());
                } else {
                    clauses.add(protocol + ".dst >= " + ports.first());
                    clauses.add(protocol + ".dst <= " + ports.last());
                }
                break;
            case "icmp":
                icmpClauses(rule, "icmp4", clauses);
                break;
            case "icmpv6":
                icmpClauses(rule, "icmp6", clauses);
                break;
            default:
                clauses.add("ip.proto == " + ipProtocol(rule, protocol));
        }
    }

    private static PortRange portRange(SecurityGroupRule rule)
            throws RuleTranslationException {
        try {
            return rule.portRange();
        } catch (IllegalArgumentException e) {
            throw new RuleTranslationException(rule.id, e.getMessage(), e);
        }
    }

    private static void icmpClauses(SecurityGroupRule rule, String field,
                                    List<String> clauses)
            throws RuleTranslationException {
        clauses.add(field);
        Integer type = icmpValue(rule, "type", rule.icmpType);
        if (type != null)
            clauses.add(field + ".type == " + type);
        Integer code = icmpValue(rule, "code", rule.icmpCode);
        if (code != null)
            clauses.add(field + ".code == " + code);
    }

    /** Null when the value matches everything. */
    private static Integer icmpValue(SecurityGroupRule rule, String what,
                                     Integer value)
            throws RuleTranslationException {
        if (value == null || value < 0) return null;
        if (value > MAX_ICMP_VALUE)
            throw new RuleTranslationException(
                rule.id, "ICMP " + what + " " + value + " out of range");
        return value;
    }

    /**
     * Named protocols map to their number; any other name is passed through
     * as given, numbers must be a valid IP protocol.
     */
    private static String ipProtocol(SecurityGroupRule rule, String protocol)
            throws RuleTranslationException {
        Integer known = IP_PROTOCOLS.get(protocol);
        if (known != null) return known.toString();
        if (!StringUtils.isNumeric(protocol)) return protocol;

        Integer number = Ints.tryParse(protocol);
        if (number == null || number > MAX_IP_PROTO)
            throw new RuleTranslationException(
                rule.id, "protocol number " + protocol + " out of range");
        return number.toString();
    }
}
