package me.golemcore.warden.security;

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

import me.golemcore.warden.domain.model.DangerousPattern;
import me.golemcore.warden.domain.model.SecurityPolicy;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Derives the policy a sub-agent runs under from its parent's.
 *
 * <p>
 * Every threshold of the result is the stricter of parent and overlay, pattern
 * lists are merged and tool overrides can only raise tiers. The result is
 * therefore never more permissive than the parent, however deeply sub-agents
 * are nested.
 */
@Component
public class SubAgentPolicyOverlay {

    private final Overlay configured;

    public SubAgentPolicyOverlay(WardenProperties properties) {
        WardenProperties.SubAgentProperties subAgent = properties.getSecurity().getSubAgent();
        this.configured = new Overlay(subAgent.getAutoApproveUpTo(), subAgent.getDenyAbove(),
                subAgent.getApprovalTimeoutSeconds(), subAgent.getExtraPatterns());
    }

    public SecurityPolicy apply(SecurityPolicy parent) {
        return overlay(parent, configured);
    }

    public static SecurityPolicy overlay(SecurityPolicy parent, Overlay overlay) {
        LinkedHashSet<DangerousPattern> patterns = new LinkedHashSet<>();
        if (parent.getDangerousPatterns() != null) {
            patterns.addAll(parent.getDangerousPatterns());
        }
        if (overlay.extraPatterns() != null) {
            patterns.addAll(overlay.extraPatterns());
        }
        return parent.toBuilder()
                .autoApproveUpTo(SecurityTier.min(parent.getAutoApproveUpTo(), overlay.autoApproveUpTo()))
                .denyAbove(SecurityTier.min(parent.getDenyAbove(), overlay.denyAbove()))
                .approvalTimeoutSeconds(
                        Math.min(parent.getApprovalTimeoutSeconds(), overlay.approvalTimeoutSeconds()))
                .toolOverrides(parent.getToolOverrides() != null
                        ? new LinkedHashMap<>(parent.getToolOverrides())
                        : new LinkedHashMap<>())
                .dangerousPatterns(new ArrayList<>(patterns))
                .overridesMayLowerTier(false)
                .build();
    }

    /**
     * Sub-agent limits layered on top of a parent policy.
     */
    public record Overlay(SecurityTier autoApproveUpTo, SecurityTier denyAbove, long approvalTimeoutSeconds,
            List<DangerousPattern> extraPatterns) {
    }
}
