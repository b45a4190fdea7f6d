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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.exception.SchemaException;
import me.golemcore.warden.domain.model.DangerousPattern;
import me.golemcore.warden.domain.model.GateContext;
import me.golemcore.warden.domain.model.GateOutcome;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.SecurityPolicy;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.service.DecisionLogService;
import me.golemcore.warden.domain.service.ToolRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mandatory interception point between a proposed tool call and its execution.
 *
 * <p>
 * Classification order:
 * <ol>
 * <li>Base tier from the registry, with per-tool overrides applied. Unknown
 * tools are T4 and denied outright.</li>
 * <li>Argument parsing and schema validation. Arguments that cannot be
 * understood force T4 and a deny, whatever the thresholds say.</li>
 * <li>Dangerous-pattern scan over the raw argument text and every string value;
 * a match forces T4.</li>
 * <li>Sub-agent sessions are classified under the overlaid, stricter
 * policy.</li>
 * <li>Threshold comparison: deny above {@code denyAbove}, allow up to
 * {@code autoApproveUpTo}, approval in between.</li>
 * </ol>
 * Every decision is appended to the decision log.
 */
@Component
@Slf4j
public class SecurityGate {

    private final ToolRegistry toolRegistry;
    private final ArgumentSchemaValidator schemaValidator;
    private final SubAgentPolicyOverlay subAgentOverlay;
    private final DecisionLogService decisionLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<List<DangerousPattern>, DangerousPatternMatcher> matchers = new ConcurrentHashMap<>();

    public SecurityGate(ToolRegistry toolRegistry, ArgumentSchemaValidator schemaValidator,
            SubAgentPolicyOverlay subAgentOverlay, DecisionLogService decisionLog, ObjectMapper objectMapper,
            Clock clock) {
        this.toolRegistry = toolRegistry;
        this.schemaValidator = schemaValidator;
        this.subAgentOverlay = subAgentOverlay;
        this.decisionLog = decisionLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Policy the gate applies for {@code context}: the overlaid one for
     * sub-agents, {@code policy} otherwise.
     */
    public SecurityPolicy effectivePolicy(SecurityPolicy policy, GateContext context) {
        return context.subAgent() ? subAgentOverlay.apply(policy) : policy;
    }

    public SecurityDecision decide(ToolCall call, SecurityPolicy policy, GateContext context) {
        SecurityPolicy effectivePolicy = effectivePolicy(policy, context);
        Optional<ToolComponent> tool = toolRegistry.find(call.getName());

        SecurityTier baseTier = tool.map(ToolComponent::getDeclaredTier).orElse(SecurityTier.T4);
        SecurityTier effectiveTier = effectivePolicy.applyOverride(call.getName(), baseTier);
        boolean unknownTool = tool.isEmpty();
        boolean schemaFailure = false;
        String reason = null;

        if (unknownTool) {
            effectiveTier = SecurityTier.T4;
            reason = "Unknown tool: " + call.getName();
        }

        try {
            schemaValidator.validate(call, tool.map(ToolComponent::getInputSchema).orElse(null));
        } catch (SchemaException e) {
            schemaFailure = true;
            effectiveTier = SecurityTier.T4;
            reason = e.getMessage();
        }

        DangerousPattern matched = matcherFor(effectivePolicy).firstMatch(scanTargets(call)).orElse(null);
        if (matched != null) {
            effectiveTier = SecurityTier.T4;
            if (reason == null) {
                reason = "Arguments match dangerous pattern: " + matched.getLabel();
            }
        }

        GateOutcome outcome = unknownTool || schemaFailure
                ? GateOutcome.DENY
                : effectivePolicy.classify(effectiveTier);
        if (reason == null) {
            reason = describeOutcome(outcome, effectiveTier, effectivePolicy);
        }

        SecurityDecision decision = SecurityDecision.builder()
                .toolCallId(call.getId())
                .toolName(call.getName())
                .outcome(outcome)
                .baseTier(baseTier)
                .effectiveTier(effectiveTier)
                .matchedPattern(matched != null ? matched.getLabel() : null)
                .reason(reason)
                .subAgent(context.subAgent())
                .schemaFailure(schemaFailure)
                .unknownTool(unknownTool)
                .timestamp(clock.instant())
                .build();

        logDecision(decision);
        decisionLog.record(context.sessionId(), decision);
        return decision;
    }

    private DangerousPatternMatcher matcherFor(SecurityPolicy policy) {
        List<DangerousPattern> patterns = policy.getDangerousPatterns() != null
                ? List.copyOf(policy.getDangerousPatterns())
                : List.of();
        return matchers.computeIfAbsent(patterns, DangerousPatternMatcher::compile);
    }

    private List<String> scanTargets(ToolCall call) {
        List<String> targets = new ArrayList<>();
        if (call.getRawArguments() != null) {
            targets.add(call.getRawArguments());
        } else if (call.getArguments() != null) {
            try {
                targets.add(objectMapper.writeValueAsString(call.getArguments()));
            } catch (JsonProcessingException e) {
                targets.add(String.valueOf(call.getArguments()));
            }
        }
        if (call.getArguments() != null) {
            collectStrings(call.getArguments(), targets);
        }
        return targets;
    }

    private void collectStrings(Object value, List<String> out) {
        if (value instanceof String text) {
            out.add(text);
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collectStrings(v, out));
        } else if (value instanceof Iterable<?> items) {
            items.forEach(v -> collectStrings(v, out));
        }
    }

    private String describeOutcome(GateOutcome outcome, SecurityTier tier, SecurityPolicy policy) {
        return switch (outcome) {
        case ALLOW -> "Tier " + tier + " is within auto-approve limit " + policy.getAutoApproveUpTo();
        case DENY -> "Tier " + tier + " exceeds deny threshold " + policy.getDenyAbove();
        case NEEDS_APPROVAL -> "Tier " + tier + " requires human approval";
        };
    }

    private void logDecision(SecurityDecision decision) {
        if (decision.isDenied()) {
            log.warn("[Gate] DENY {} ({}) tier {}->{} pattern={} reason={}", decision.getToolName(),
                    decision.getToolCallId(), decision.getBaseTier(), decision.getEffectiveTier(),
                    decision.getMatchedPattern(), decision.getReason());
        } else if (decision.needsApproval()) {
            log.info("[Gate] NEEDS_APPROVAL {} ({}) tier {}->{} pattern={}", decision.getToolName(),
                    decision.getToolCallId(), decision.getBaseTier(), decision.getEffectiveTier(),
                    decision.getMatchedPattern());
        } else {
            log.debug("[Gate] ALLOW {} ({}) tier {}", decision.getToolName(), decision.getToolCallId(),
                    decision.getEffectiveTier());
        }
    }
}
