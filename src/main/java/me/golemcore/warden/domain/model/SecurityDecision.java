package me.golemcore.warden.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Gate verdict for one tool call. Computed exactly once per call.
 */
@Value
@Builder
@Jacksonized
public class SecurityDecision {

    String toolCallId;
    String toolName;
    GateOutcome outcome;
    SecurityTier baseTier;
    SecurityTier effectiveTier;
    String matchedPattern;
    String reason;
    boolean subAgent;
    boolean schemaFailure;
    boolean unknownTool;
    Instant timestamp;

    public boolean isAllowed() {
        return outcome == GateOutcome.ALLOW;
    }

    public boolean isDenied() {
        return outcome == GateOutcome.DENY;
    }

    public boolean needsApproval() {
        return outcome == GateOutcome.NEEDS_APPROVAL;
    }
}
