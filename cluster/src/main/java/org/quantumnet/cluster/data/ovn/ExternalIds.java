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

/**
 * Keys of the external_ids column linking Northbound rows back to the
 * platform objects they were created for. These names are read by other
 * tools inspecting the database and must not change.
 */
public final class ExternalIds {

    private ExternalIds() {}

    public static final String NETWORK_ID = "limiquantix-network-id";
    public static final String PROJECT_ID = "limiquantix-project-id";
    public static final String NAME = "limiquantix-name";
    public static final String PORT_ID = "limiquantix-port-id";
    public static final String VM_ID = "limiquantix-vm-id";
    public static final String ROUTER_ID = "limiquantix-router-id";
    public static final String SWITCH = "limiquantix-switch";
    public static final String SG_ID = "limiquantix-sg-id";
    public static final String SG_NAME = "limiquantix-sg-name";
    public static final String RULE_ID = "limiquantix-rule-id";
    public static final String BUILTIN = "limiquantix-builtin";
    public static final String FLOATING_IP = "limiquantix-floating-ip";
    public static final String SNAT = "limiquantix-snat";
    public static final String LB_ID = "limiquantix-lb-id";
    public static final String ROUTER = "limiquantix-router";
}
