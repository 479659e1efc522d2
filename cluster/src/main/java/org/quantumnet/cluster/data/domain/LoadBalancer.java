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

package org.quantumnet.cluster.data.domain;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A tenant load balancer: one virtual IP, listeners on ports of that VIP and
 * backend members bound to listeners.
 */
public class LoadBalancer {

    public LoadBalancer() {}

    public LoadBalancer(String id, String projectId, String name, Spec spec) {
        this.id = id;
        this.projectId = projectId;
        this.name = name;
        this.spec = spec;
    }

    public String id;

    @JsonProperty("project_id")
    public String projectId;

    public String name;

    public Spec spec = new Spec();

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof LoadBalancer)) return false;
        final LoadBalancer other = (LoadBalancer) obj;
        return Objects.equal(id, other.id)
                && Objects.equal(projectId, other.projectId)
                && Objects.equal(name, other.name)
                && Objects.equal(spec, other.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, projectId, name, spec);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("projectId", projectId)
                .add("name", name)
                .add("spec", spec).toString();
    }

    public static class Spec {

        public String vip;

        public String protocol;

        public List<Listener> listeners = new ArrayList<>();

        public List<Member> members = new ArrayList<>();

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Spec)) return false;
            final Spec other = (Spec) obj;
            return Objects.equal(vip, other.vip)
                    && Objects.equal(protocol, other.protocol)
                    && Objects.equal(listeners, other.listeners)
                    && Objects.equal(members, other.members);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(vip, protocol, listeners, members);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("vip", vip)
                    .add("protocol", protocol)
                    .add("listeners", listeners)
                    .add("members", members).toString();
        }
    }

    public static class Listener {

        public Listener() {}

        public Listener(String id, int port) {
            this.id = id;
            this.port = port;
        }

        public String id;

        public int port;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Listener)) return false;
            final Listener other = (Listener) obj;
            return Objects.equal(id, other.id) && port == other.port;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(id, port);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("id", id)
                    .add("port", port).toString();
        }
    }

    public static class Member {

        public Member() {}

        public Member(String listenerId, String address, int port) {
            this.listenerId = listenerId;
            this.address = address;
            this.port = port;
        }

        /** Listener this member serves; empty means every listener. */
        @JsonProperty("listener_id")
        public String listenerId;

        public String address;

        public int port;

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof Member)) return false;
            final Member other = (Member) obj;
            return Objects.equal(listenerId, other.listenerId)
                    && Objects.equal(address, other.address)
                    && port == other.port;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(listenerId, address, port);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("listenerId", listenerId)
                    .add("address", address)
                    .add("port", port).toString();
        }
    }
}
