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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * The set of logical ports a security group applies to, together with the
 * ACLs generated for that group. Both lists hold UUIDs.
 */
public class PortGroup extends NorthboundObject {

    public PortGroup() {}

    public PortGroup(String uuid, String name) {
        this.uuid = uuid;
        this.name = name;
    }

    public String name;

    public List<String> ports = new ArrayList<>();

    public List<String> acls = new ArrayList<>();

    @Override
    public String key() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof PortGroup)) return false;
        final PortGroup other = (PortGroup) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(name, other.name)
                && Objects.equal(ports, other.ports)
                && Objects.equal(acls, other.acls)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, ports, acls, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("name", name)
                .add("ports", ports)
                .add("acls", acls)
                .add("externalIds", externalIds).toString();
    }
}
