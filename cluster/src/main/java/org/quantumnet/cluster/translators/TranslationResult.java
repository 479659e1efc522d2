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

package org.quantumnet.cluster.translators;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import org.quantumnet.cluster.data.ovn.Acl;
import org.quantumnet.cluster.data.ovn.PortGroup;

/**
 * The Northbound objects generated for one security group, together with
 * the rules that could not be translated.
 */
public class TranslationResult {

    private final List<Acl> acls;
    private final PortGroup portGroup;
    private final List<SkippedRule> skippedRules;

    public TranslationResult(List<Acl> acls, PortGroup portGroup,
                             List<SkippedRule> skippedRules) {
        this.acls = ImmutableList.copyOf(acls);
        this.portGroup = portGroup;
        this.skippedRules = ImmutableList.copyOf(skippedRules);
    }

    /** ACLs in generation order: built-ins, user rules, default egress. */
    public List<Acl> getAcls() {
        return acls;
    }

    public PortGroup getPortGroup() {
        return portGroup;
    }

    public List<SkippedRule> getSkippedRules() {
        return skippedRules;
    }

    public boolean hasSkippedRules() {
        return !skippedRules.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("acls", acls)
                .add("portGroup", portGroup)
                .add("skippedRules", skippedRules).toString();
    }

    public static class SkippedRule {

        private final String ruleId;
        private final String reason;

        public SkippedRule(String ruleId, String reason) {
            this.ruleId = ruleId;
            this.reason = reason;
        }

        public String getRuleId() {
            return ruleId;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public boolean equals(Object obj) {
            if (obj == this) return true;
            if (!(obj instanceof SkippedRule)) return false;
            final SkippedRule other = (SkippedRule) obj;
            return Objects.equal(ruleId, other.ruleId)
                    && Objects.equal(reason, other.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(ruleId, reason);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("ruleId", ruleId)
                    .add("reason", reason).toString();
        }
    }
}
