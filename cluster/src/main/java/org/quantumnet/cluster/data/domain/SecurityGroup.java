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
import org.apache.commons.collections4.ListUtils;

public class SecurityGroup {

    public SecurityGroup() {}

    public SecurityGroup(String id, String name, boolean stateful,
                         List<SecurityGroupRule> rules) {
        this.id = id;
        this.name = name;
        this.stateful = stateful;
        this.rules = rules;
    }

    public String id;

    public String name;

    public String description;

    @JsonProperty("project_id")
    public String projectId;

    /**
     * Whether the group relies on connection tracking. Stateful groups
     * admit return traffic of allowed connections.
     */
    public boolean stateful;

    public List<SecurityGroupRule> rules = new ArrayList<>();

    @Override
    public boolean equals(Object obj) {

        if (obj == this) return true;

        if (!(obj instanceof SecurityGroup)) return false;
        final SecurityGroup other = (SecurityGroup) obj;

        return Objects.equal(id, other.id)
                && Objects.equal(name, other.name)
                && Objects.equal(description, other.description)
                && Objects.equal(projectId, other.projectId)
                && stateful == other.stateful
                && ListUtils.isEqualList(rules, other.rules);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, name, description, projectId, stateful,
                ListUtils.hashCodeForList(rules));
    }

    @Override
    public String toString() {

        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("name", name)
                .add("description", description)
                .add("projectId", projectId)
                .add("stateful", stateful)
                .add("rules", rules)
                .toString();
    }
}
