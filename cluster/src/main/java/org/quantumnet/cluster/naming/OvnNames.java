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

package org.quantumnet.cluster.naming;

import org.apache.commons.lang3.StringUtils;

/**
 * Derives Northbound object names from platform identifiers. These names
 * are looked up directly in the database by other tools and are part of the
 * external contract.
 */
public final class OvnNames {

    private OvnNames() {}

    public static final String SWITCH_PREFIX = "ls-";
    public static final String SWITCH_PORT_PREFIX = "lsp-";
    public static final String ROUTER_PREFIX = "lr-";
    public static final String LOAD_BALANCER_PREFIX = "lb-";
    public static final String PORT_GROUP_PREFIX = "pg_sg_";
    public static final String ADDRESS_SET_PREFIX = "as_sg_";
    public static final String RULE_PREFIX = "rule-";

    public static String logicalSwitch(String networkId) {
        return SWITCH_PREFIX + networkId;
    }

    public static String logicalSwitchPort(String portId) {
        return SWITCH_PORT_PREFIX + portId;
    }

    public static String logicalRouter(String routerId) {
        return ROUTER_PREFIX + routerId;
    }

    /** The router side of a router to switch link. */
    public static String routerPort(String routerName, String switchName) {
        return routerName + "-to-" + switchName;
    }

    /** The switch side of a router to switch link. */
    public static String switchRouterPort(String switchName,
                                          String routerName) {
        return switchName + "-to-" + routerName;
    }

    public static String localnetPort(String switchName) {
        return switchName + "-localnet";
    }

    public static String loadBalancer(String lbId) {
        return LOAD_BALANCER_PREFIX + lbId;
    }

    /**
     * Port group of a security group. Port group names may not contain
     * dashes, so these become underscores.
     */
    public static String portGroup(String sgId) {
        return PORT_GROUP_PREFIX + StringUtils.replace(sgId, "-", "_");
    }

    public static String addressSet(String sgId) {
        return ADDRESS_SET_PREFIX + StringUtils.replace(sgId, "-", "_");
    }

    /**
     * ACL name of a rule: its description, or "rule-" followed by the first
     * eight characters of its id.
     */
    public static String ruleAcl(String ruleId, String description) {
        if (StringUtils.isNotEmpty(description)) return description;
        return RULE_PREFIX + StringUtils.left(StringUtils.defaultString(ruleId),
                                              8);
    }
}
