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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.quantumnet.cluster.data.domain.RuleAction;
import org.quantumnet.cluster.data.domain.RuleDirection;
import org.quantumnet.cluster.data.domain.SecurityGroup;
import org.quantumnet.cluster.data.domain.SecurityGroupRule;
import org.quantumnet.cluster.data.ovn.Acl;
import org.quantumnet.cluster.data.ovn.AclAction;
import org.quantumnet.cluster.data.ovn.AclDirection;
import org.quantumnet.cluster.data.ovn.ExternalIds;
import org.quantumnet.cluster.data.ovn.PortGroup;
import org.quantumnet.cluster.naming.IdGenerator;
import org.quantumnet.cluster.naming.OvnNames;

/**
 * Compiles security groups into OVN ACLs attached to a port group.
 *
 * The ACLs of a group are always regenerated as a whole. A stateful group
 * starts with the connection tracking ACLs, then gets one ACL per rule, and
 * always ends with the default egress allow ACL. Rules that cannot be
 * translated are skipped and reported in the result.
 */
public class AclTranslator {

    private static final Logger log =
        LoggerFactory.getLogger(AclTranslator.class);

    public static final String BUILTIN_ESTABLISHED = "stateful-established";
    public static final String BUILTIN_RELATED = "stateful-related";
    public static final String BUILTIN_DROP_INVALID = "drop-invalid";
    public static final String BUILTIN_DEFAULT_EGRESS = "default-egress-allow";

    private final IdGenerator ids;

    @Inject
    public AclTranslator(IdGenerator ids) {
        this.ids = ids;
    }

    public TranslationResult translate(SecurityGroup sg) {
        Preconditions.checkNotNull(sg, "security group is null");

        log.info("Translating security group {} ({}) with {} rules, "
                 + "stateful={}", sg.id, sg.name, ruleCount(sg), sg.stateful);

        String pgName = OvnNames.portGroup(sg.id);
        List<Acl> acls = new ArrayList<>();
        List<TranslationResult.SkippedRule> skipped = new ArrayList<>();

        if (sg.stateful) {
            acls.addAll(statefulAcls(pgName, sg.id));
        }

        if (sg.rules != null) {
            for (SecurityGroupRule rule : sg.rules) {
                try {
                    acls.add(translateRule(rule, sg.id, pgName, sg.stateful));
                } catch (RuleTranslationException e) {
                    log.warn("Skipping rule {} of security group {}: {}",
                             rule.id, sg.id, e.getMessage());
                    skipped.add(new TranslationResult.SkippedRule(
                        rule.id, e.getMessage()));
                }
            }
        }

        acls.add(defaultEgressAllow(pgName, sg.id));

        PortGroup pg = new PortGroup(ids.newUuid(), pgName);
        pg.putExternalId(ExternalIds.SG_ID, sg.id);
        pg.putExternalId(ExternalIds.SG_NAME, sg.name);
        for (Acl acl : acls) {
            pg.acls.add(acl.uuid);
        }

        log.info("Translated security group {} into {} ACLs on port group {}",
                 sg.id, acls.size(), pgName);
        return new TranslationResult(acls, pg, skipped);
    }

    /**
     * Translates a single rule of the given security group.
     */
    public Acl translateRule(SecurityGroupRule rule, String sgId,
                             boolean stateful)
            throws RuleTranslationException {
        Preconditions.checkNotNull(rule, "rule is null");
        return translateRule(rule, sgId, OvnNames.portGroup(sgId), stateful);
    }

    private Acl translateRule(SecurityGroupRule rule, String sgId,
                              String pgName, boolean stateful)
            throws RuleTranslationException {
        String match = MatchExpressionBuilder.build(rule, pgName);
        Acl acl = new Acl(ids.newUuid(),
                          direction(rule.direction),
                          AclPriorities.userRule(rule.priority),
                          match,
                          action(rule.action, stateful),
                          OvnNames.ruleAcl(rule.id, rule.description));
        acl.putExternalId(ExternalIds.RULE_ID, rule.id);
        acl.putExternalId(ExternalIds.SG_ID, sgId);

        log.debug("Rule {} -> {} {} {} {}", rule.id, acl.direction.value(),
                  acl.getPriority(), match, acl.action.value());
        return acl;
    }

    static AclDirection direction(RuleDirection direction) {
        return direction == RuleDirection.EGRESS ? AclDirection.FROM_LPORT
                                                 : AclDirection.TO_LPORT;
    }

    /**
     * Allow becomes allow-related in stateful groups so that replies are
     * admitted. A missing action means allow.
     */
    static AclAction action(RuleAction action, boolean stateful) {
        if (action == RuleAction.DROP) return AclAction.DROP;
        if (action == RuleAction.REJECT) return AclAction.REJECT;
        return stateful ? AclAction.ALLOW_RELATED : AclAction.ALLOW;
    }

    private List<Acl> statefulAcls(String pgName, String sgId) {
        List<Acl> acls = new ArrayList<>(4);
        acls.add(builtin(AclDirection.TO_LPORT,
                         AclPriorities.STATEFUL_ESTABLISHED,
                         "outport == @" + pgName + " && ct.est && !ct.new",
                         AclAction.ALLOW, "stateful-established-ingress",
                         BUILTIN_ESTABLISHED, sgId));
        acls.add(builtin(AclDirection.FROM_LPORT,
                         AclPriorities.STATEFUL_ESTABLISHED,
                         "inport == @" + pgName + " && ct.est && !ct.new",
                         AclAction.ALLOW, "stateful-established-egress",
                         BUILTIN_ESTABLISHED, sgId));
        acls.add(builtin(AclDirection.TO_LPORT,
                         AclPriorities.STATEFUL_RELATED,
                         "outport == @" + pgName + " && ct.rel && !ct.new",
                         AclAction.ALLOW, "stateful-related-ingress",
                         BUILTIN_RELATED, sgId));
        acls.add(builtin(AclDirection.TO_LPORT,
                         AclPriorities.DROP_INVALID,
                         "outport == @" + pgName + " && ct.inv",
                         AclAction.DROP, "drop-invalid",
                         BUILTIN_DROP_INVALID, sgId));
        return acls;
    }

    private Acl defaultEgressAllow(String pgName, String sgId) {
        return builtin(AclDirection.FROM_LPORT,
                       AclPriorities.DEFAULT_EGRESS_ALLOW,
                       "inport == @" + pgName, AclAction.ALLOW,
                       "default-egress-allow", BUILTIN_DEFAULT_EGRESS, sgId);
    }

    private Acl builtin(AclDirection direction, int priority, String match,
                        AclAction action, String name, String builtin,
                        String sgId) {
        Acl acl = new Acl(ids.newUuid(), direction, priority, match, action,
                          name);
        acl.putExternalId(ExternalIds.BUILTIN, builtin);
        acl.putExternalId(ExternalIds.SG_ID, sgId);
        return acl;
    }

    private static int ruleCount(SecurityGroup sg) {
        return sg.rules == null ? 0 : sg.rules.size();
    }
}
