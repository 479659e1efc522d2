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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AclAction {

    ALLOW("allow"),
    /** Allow and commit the connection to conntrack. */
    ALLOW_RELATED("allow-related"),
    ALLOW_STATELESS("allow-stateless"),
    DROP("drop"),
    REJECT("reject");

    private final String value;

    private AclAction(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AclAction forValue(String v) {
        if (v == null) return null;
        for (AclAction action : AclAction.values()) {
            if (v.equalsIgnoreCase(action.value)) {
                return action;
            }
        }

        return null;
    }
}
