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

public enum AclDirection {

    /** Traffic delivered to the logical port. */
    TO_LPORT("to-lport"),
    /** Traffic sent by the logical port. */
    FROM_LPORT("from-lport");

    private final String value;

    private AclDirection(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AclDirection forValue(String v) {
        if (v == null) return null;
        for (AclDirection direction : AclDirection.values()) {
            if (v.equalsIgnoreCase(direction.value)) {
                return direction;
            }
        }

        return null;
    }
}
