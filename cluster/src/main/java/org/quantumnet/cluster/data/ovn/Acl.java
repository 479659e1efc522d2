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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * One firewall entry. ACL rows have no name key and are stored by UUID.
 */
public class Acl extends NorthboundObject {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 32767;

    public Acl() {}

    public Acl(String uuid, AclDirection direction, int priority,
               String match, AclAction action, String name) {
        this.uuid = uuid;
        this.direction = direction;
        setPriority(priority);
        this.match = match;
        this.action = action;
        this.name = name;
    }

    public AclDirection direction;

    private int priority;

    public String match;

    public AclAction action;

    public String name;

    public boolean log;

    @JsonProperty("priority")
    public int getPriority() {
        return priority;
    }

    /**
     * Sets the priority, which must be within [0, 32767].
     */
    @JsonProperty("priority")
    public void setPriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY)
            throw new IllegalArgumentException(
                "ACL priority " + priority + " is outside ["
                + MIN_PRIORITY + ", " + MAX_PRIORITY + "]");
        this.priority = priority;
    }

    @Override
    public String key() {
        return uuid;
    }

    /**
     * Whether the two ACLs enforce the same policy, regardless of their
     * identity and naming.
     */
    public boolean sameRule(Acl other) {
        return other != null
                && direction == other.direction
                && priority == other.priority
                && Objects.equal(match, other.match)
                && action == other.action;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof Acl)) return false;
        final Acl other = (Acl) obj;
        return Objects.equal(uuid, other.uuid)
                && sameRule(other)
                && Objects.equal(name, other.name)
                && log == other.log
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, direction, priority, match, action,
                                name, log, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("direction", direction)
                .add("priority", priority)
                .add("match", match)
                .add("action", action)
                .add("name", name)
                .add("log", log)
                .add("externalIds", externalIds).toString();
    }
}
