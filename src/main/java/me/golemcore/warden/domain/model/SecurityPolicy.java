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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thresholds the security gate compares effective tiers against.
 *
 * <p>
 * Tiers at or below {@link #autoApproveUpTo} are allowed, tiers above
 * {@link #denyAbove} are denied, everything in between needs a human. Per-tool
 * overrides replace the registry's declared tier before pattern scanning.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecurityPolicy {

    @Builder.Default
    private SecurityTier autoApproveUpTo = SecurityTier.T1;

    @Builder.Default
    private SecurityTier denyAbove = SecurityTier.T4;

    @Builder.Default
    private long approvalTimeoutSeconds = 60;

    @Builder.Default
    private Map<String, SecurityTier> toolOverrides = new LinkedHashMap<>();

    @Builder.Default
    private List<DangerousPattern> dangerousPatterns = new ArrayList<>();

    /**
     * When false, a tool override can only raise the declared tier. Sub-agent
     * policies are built with this flag cleared.
     */
    @Builder.Default
    private boolean overridesMayLowerTier = true;

    public GateOutcome classify(SecurityTier effectiveTier) {
        if (effectiveTier.isAbove(denyAbove)) {
            return GateOutcome.DENY;
        }
        if (effectiveTier.isAtMost(autoApproveUpTo)) {
            return GateOutcome.ALLOW;
        }
        return GateOutcome.NEEDS_APPROVAL;
    }

    public SecurityTier applyOverride(String toolName, SecurityTier declared) {
        SecurityTier override = toolOverrides != null ? toolOverrides.get(toolName) : null;
        if (override == null) {
            return declared;
        }
        return overridesMayLowerTier ? override : SecurityTier.max(declared, override);
    }

    /**
     * Returns true when every tier this policy allows is also allowed by
     * {@code other}, and every tier {@code other} denies is denied here too.
     */
    public boolean isAtLeastAsStrictAs(SecurityPolicy other) {
        return autoApproveUpTo.isAtMost(other.getAutoApproveUpTo())
                && denyAbove.isAtMost(other.getDenyAbove())
                && approvalTimeoutSeconds <= other.getApprovalTimeoutSeconds();
    }
}
