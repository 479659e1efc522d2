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

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * The Northbound tables the control plane writes, with the column each
 * object is keyed by and the columns holding UUID references to rows of
 * other tables.
 */
public enum NorthboundTable {

    LOGICAL_SWITCH(LogicalSwitch.class, "Logical_Switch", "name",
                   "ports", "acls", "load_balancer"),
    LOGICAL_SWITCH_PORT(LogicalSwitchPort.class, "Logical_Switch_Port",
                        "name", "dhcpv4_options"),
    LOGICAL_ROUTER(LogicalRouter.class, "Logical_Router", "name",
                   "ports", "nat", "load_balancer"),
    LOGICAL_ROUTER_PORT(LogicalRouterPort.class, "Logical_Router_Port",
                        "name"),
    ACL(Acl.class, "ACL", "_uuid"),
    ADDRESS_SET(AddressSet.class, "Address_Set", "name"),
    PORT_GROUP(PortGroup.class, "Port_Group", "name", "ports", "acls"),
    DHCP_OPTIONS(DhcpOptions.class, "DHCP_Options",
                 "_uuid"),
    NAT(Nat.class, "NAT", "_uuid"),
    LOAD_BALANCER(OvnLoadBalancer.class, "Load_Balancer", "name");

    public static final String UUID_COLUMN = "_uuid";

    private final Class<? extends NorthboundObject> clazz;
    private final String tableName;
    private final String keyColumn;
    private final Set<String> referenceColumns;

    private NorthboundTable(Class<? extends NorthboundObject> clazz,
                            String tableName, String keyColumn,
                            String... referenceColumns) {
        this.clazz = clazz;
        this.tableName = tableName;
        this.keyColumn = keyColumn;
        this.referenceColumns = ImmutableSet.copyOf(referenceColumns);
    }

    public Class<? extends NorthboundObject> clazz() {
        return clazz;
    }

    public String tableName() {
        return tableName;
    }

    public String keyColumn() {
        return keyColumn;
    }

    /** Whether objects of this table are keyed by their UUID. */
    public boolean keyedByUuid() {
        return UUID_COLUMN.equals(keyColumn);
    }

    public boolean isReference(String column) {
        return referenceColumns.contains(column);
    }

    public Set<String> referenceColumns() {
        return referenceColumns;
    }

    public static NorthboundTable forClass(Class<?> clazz) {
        for (NorthboundTable table : values()) {
            if (table.clazz == clazz) return table;
        }
        throw new IllegalArgumentException(
            clazz.getSimpleName() + " is not a Northbound table");
    }
}
