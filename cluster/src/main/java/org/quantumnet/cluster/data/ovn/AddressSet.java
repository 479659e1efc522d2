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

public class AddressSet extends NorthboundObject {

    public AddressSet() {}

    public AddressSet(String uuid, String name, List<String> addresses) {
        this.uuid = uuid;
        this.name = name;
        this.addresses = addresses;
    }

    public String name;

    public List<String> addresses = new ArrayList<>();

    @Override
    public String key() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof AddressSet)) return false;
        final AddressSet other = (AddressSet) obj;
        return Objects.equal(uuid, other.uuid)
                && Objects.equal(name, other.name)
                && Objects.equal(addresses, other.addresses)
                && Objects.equal(externalIds, other.externalIds);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid, name, addresses, externalIds);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("uuid", uuid)
                .add("name", name)
                .add("addresses", addresses)
                .add("externalIds", externalIds).toString();
    }
}
