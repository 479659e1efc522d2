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

/**
 * ACL priorities. Higher values are evaluated first.
 *
 * <pre>
 * 32767      established connections
 * 32766      related connections
 * 32000      drop invalid connections
 * 2000-2999  administrative overrides, never generated here
 * 1000-1999  user security group rules
 * 100        default egress allow
 * 0          implicit default deny
 * </pre>
 */
public final class AclPriorities {

    private AclPriorities() {}

    public static final int STATEFUL_ESTABLISHED = 32767;
    public static final int STATEFUL_RELATED = STATEFUL_ESTABLISHED - 1;
    public static final int DROP_INVALID = 32000;
    public static final int ADMIN_RULE_BASE = 2000;
    public static final int USER_RULE_BASE = 1000;
    public static final int DEFAULT_EGRESS_ALLOW = 100;
    public static final int DEFAULT_DENY = 0;

    /**
     * The ACL priority of a user rule. The result is always in
     * [USER_RULE_BASE, ADMIN_RULE_BASE) so that user rules never outrank
     * administrative ones. Negative rule priorities count as zero.
     */
    public static int userRule(long rulePriority) {
        long max = ADMIN_RULE_BASE - 1 - USER_RULE_BASE;
        long offset = Math.min(Math.max(rulePriority, 0L), max);
        return USER_RULE_BASE + (int) offset;
    }
}
