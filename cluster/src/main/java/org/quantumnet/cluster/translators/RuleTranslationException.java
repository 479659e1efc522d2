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
 * Thrown when a security group rule cannot be expressed as an ACL.
 */
public class RuleTranslationException extends Exception {

    private static final long serialVersionUID = -2409176285518434721L;

    private final String ruleId;

    public RuleTranslationException(String ruleId, String message) {
        super("Rule " + ruleId + ": " + message);
        this.ruleId = ruleId;
    }

    public RuleTranslationException(String ruleId, String message,
                                    Throwable cause) {
        super("Rule " + ruleId + ": " + message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
