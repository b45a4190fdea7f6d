package me.golemcore.warden.domain.loop;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Constraint;
import me.golemcore.warden.domain.model.Goal;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.SuccessCriterion;
import me.golemcore.warden.domain.service.ToolRegistry;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Assembles the model request for the next turn: system prompt with the goal
 * and constraints, the full conversation (including advisory hints already
 * appended as messages) and the registered tool definitions.
 */
@Component
@RequiredArgsConstructor
public class TurnContextBuilder {

    private static final String BASE_PROMPT = """
            You are an autonomous agent working toward a goal through tool calls.
            Every tool call passes a security gate. A result starting with "Policy violation:" means \
            the call was refused; do not repeat it unchanged, choose a safer approach instead.
            Messages starting with [Guardian] are advisory hints about your progress.
            When the task is done, reply with your final answer and no tool calls.""";

    private final ToolRegistry toolRegistry;
    private final WardenProperties properties;

    public LlmRequest build(AgentSession session) {
        return LlmRequest.builder()
                .sessionId(session.getId())
                .systemPrompt(buildSystemPrompt(session))
                .messages(new ArrayList<>(session.getMessages()))
                .tools(toolRegistry.definitions())
                .reasoningEffort(properties.getLoop().getReasoningEffort())
                .maxTokens(properties.getLoop().getMaxOutputTokens())
                .build();
    }

    String buildSystemPrompt(AgentSession session) {
        StringBuilder sb = new StringBuilder(BASE_PROMPT);
        if (session.isSubAgent()) {
            sb.append("\n\nYou are running as a sub-agent under a stricter security policy.");
        }
        Goal goal = session.getGoal();
        if (goal == null) {
            return sb.toString();
        }
        if (goal.getDescription() != null && !goal.getDescription().isBlank()) {
            sb.append("\n\n# Goal\n").append(goal.getDescription());
        }
        if (goal.getCriteria() != null && !goal.getCriteria().isEmpty()) {
            sb.append("\n\n# Success criteria\n");
            for (SuccessCriterion criterion : goal.getCriteria()) {
                sb.append("- ").append(criterion.getDescription() != null ? criterion.getDescription()
                        : criterion.getType()).append('\n');
            }
        }
        if (goal.getConstraints() != null && !goal.getConstraints().isEmpty()) {
            sb.append("\n# Constraints\n");
            for (Constraint constraint : goal.getConstraints()) {
                sb.append("- [").append(constraint.getKind()).append(' ').append(constraint.getCategory())
                        .append("] ");
                if (constraint.getDescription() != null) {
                    sb.append(constraint.getDescription());
                }
                if (constraint.getLimit() != null) {
                    sb.append(" (limit ").append(constraint.getLimit()).append(')');
                }
                sb.append('\n');
            }
        }
        return sb.toString().stripTrailing();
    }
}
