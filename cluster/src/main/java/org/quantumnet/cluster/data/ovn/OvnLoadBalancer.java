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

import java.util.HashMap;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

public class OvnLoadBalancer extends NorthboundObject {

    public OvnLoadBalancer() {}

    public OvnLoadBalancer(String uuid, String name, String protocol) {
        this.uuid = uuid;
        this.name = name;
        this.protocol = protocol;
    }

    public String name;

    /** "vip:port" to comma separated "backend:port" list. */
    public Map<String, String> vips = new HashMap<>();

    public String protocol;

    @Override
    public String key() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof OvnLoadBalancer)) return false;
        final OvnLoadBalancer other = (OvnLoadBalancer) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(name, other.name)
                && Objects.equal(vips, other.vips)
                && Objects.equal(protocol, other.protocol)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, vips, protocol, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("name", name)
                .add("vips", vips)
                .add("protocol", protocol)
                .add("externalIds", externalIds).toString();
    }
}
