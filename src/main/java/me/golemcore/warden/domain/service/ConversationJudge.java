package me.golemcore.warden.domain.service;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Constraint;
import me.golemcore.warden.domain.model.Goal;
import me.golemcore.warden.domain.model.LlmChunk;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.SuccessCriterion;
import me.golemcore.warden.domain.model.Verdict;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Level-1 judge: asks the model to assess the whole conversation against the
 * goal and returns its structured judgment.
 *
 * <p>
 * The response is expected to be a JSON object with {@code verdict},
 * {@code confidence}, {@code reason} and {@code hint}. Markdown fences and
 * surrounding prose are tolerated. Anything that cannot be read as such a
 * judgment becomes {@code Continue}.
 */
@Component
@Slf4j
public class ConversationJudge {

    static final String DEFAULT_RETRY_HINT = "Try a different approach.";
    private static final String FENCE = "```";

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final WardenProperties.JudgeProperties properties;
    private final Clock clock;

    public ConversationJudge(LlmPort llmPort, ObjectMapper objectMapper, WardenProperties properties,
            Clock clock) {
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.properties = properties.getJudge();
        this.clock = clock;
    }

    /**
     * @return the judgment, or empty when the model could not be reached
     */
    public Optional<Verdict> judge(AgentSession session, Goal goal, double threshold) {
        LlmRequest request = LlmRequest.builder()
                .sessionId(session.getId())
                .messages(List.of(Message.user(buildPrompt(session, goal, threshold), clock.instant())))
                .tools(List.of())
                .build();
        CompletableFuture<String> response = llmPort.chatStream(request)
                .filter(chunk -> chunk.getType() == LlmChunk.Type.TEXT && chunk.getText() != null)
                .map(LlmChunk::getText)
                .collect(Collectors.joining())
                .toFuture();
        try {
            String text = response.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
            return Optional.of(parseVerdict(text));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            response.cancel(true);
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            response.cancel(true);
            log.warn("[Judge] LLM judge call failed for session {}: {}", session.getId(), e.toString());
            return Optional.empty();
        }
    }

    String buildPrompt(AgentSession session, Goal goal, double threshold) {
        String conversation = session.getMessages().stream()
                .filter(m -> !"system".equals(m.getRole()))
                .map(m -> "[" + m.getRole() + "] " + (m.getContent() != null ? m.getContent() : ""))
                .collect(Collectors.joining("\n"));
        String criteria = goal.getCriteria().stream()
                .map(c -> "- " + describe(c) + " (weight: " + c.getWeight() + ")")
                .collect(Collectors.joining("\n"));
        String constraints = goal.getConstraints() == null || goal.getConstraints().isEmpty() ? "- none"
                : goal.getConstraints().stream()
                        .map(c -> "- [" + c.getKind() + " " + c.getCategory() + "] " + describe(c))
                        .collect(Collectors.joining("\n"));

        return "You are a judge evaluating whether an AI agent achieved its goal.\n\n"
                + "Goal: " + (goal.getDescription() != null ? goal.getDescription() : session.getPrompt()) + "\n\n"
                + "Success criteria:\n" + criteria + "\n\n"
                + "Constraints:\n" + constraints + "\n\n"
                + String.format(Locale.ROOT, "Success threshold: %.0f%%%n%n", threshold * 100)
                + "Conversation:\n" + conversation + "\n\n"
                + "Evaluate the agent's output against the goal and criteria. Respond with ONLY valid JSON:\n"
                + "{\n"
                + "  \"verdict\": \"accept\" | \"retry\" | \"escalate\" | \"continue\",\n"
                + "  \"confidence\": 0.0-1.0,\n"
                + "  \"reason\": \"brief explanation\",\n"
                + "  \"hint\": \"actionable suggestion for retry (only if verdict is retry)\"\n"
                + "}";
    }

    Verdict parseVerdict(String response) {
        JsonNode node;
        try {
            node = objectMapper.readTree(extractJson(response));
        } catch (JsonProcessingException e) {
            log.warn("[Judge] Unparseable judge response, continuing: {}", e.getOriginalMessage());
            return continuing("Judge response was not valid JSON");
        }
        if (node == null || !node.isObject()) {
            return continuing("Judge response was not a JSON object");
        }

        String kind = node.path("verdict").asText("").toLowerCase(Locale.ROOT);
        double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0)));
        String reason = node.path("reason").asText("");
        String hint = node.path("hint").asText("");

        return switch (kind) {
        case "accept" -> Verdict.builder().kind(Verdict.Kind.ACCEPT).confidence(confidence)
                .reason(reason.isEmpty() ? "Judge accepted the result" : reason)
                .source(Verdict.Source.JUDGE).build();
        case "retry" -> Verdict.retry(reason.isEmpty() ? "Judge requested another attempt" : reason,
                hint.isBlank() ? DEFAULT_RETRY_HINT : hint, confidence, Verdict.Source.JUDGE);
        case "escalate" -> Verdict.escalate(reason.isEmpty() ? "Judge escalated the run" : reason,
                Verdict.Source.JUDGE);
        case "continue" -> Verdict.builder().kind(Verdict.Kind.CONTINUE).confidence(confidence).reason(reason)
                .source(Verdict.Source.JUDGE).build();
        default -> {
            log.warn("[Judge] Unknown verdict '{}' from judge, treating as continue", kind);
            yield continuing("Unknown judge verdict: " + kind);
        }
        };
    }

    /**
     * Pulls the JSON object out of a response that may be wrapped in a markdown
     * fence or surrounded by prose.
     */
    static String extractJson(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        int fenceStart = trimmed.indexOf(FENCE);
        if (fenceStart >= 0) {
            int contentStart = trimmed.indexOf('\n', fenceStart);
            int fenceEnd = contentStart >= 0 ? trimmed.indexOf(FENCE, contentStart) : -1;
            if (contentStart >= 0 && fenceEnd > contentStart) {
                return trimmed.substring(contentStart + 1, fenceEnd).trim();
            }
        }
        int open = trimmed.indexOf('{');
        int close = trimmed.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return trimmed.substring(open, close + 1);
        }
        return trimmed;
    }

    private static Verdict continuing(String reason) {
        return Verdict.builder().kind(Verdict.Kind.CONTINUE).reason(reason).source(Verdict.Source.JUDGE).build();
    }

    private static String describe(SuccessCriterion criterion) {
        if (criterion.getDescription() != null) {
            return criterion.getDescription();
        }
        return criterion.getPrompt() != null ? criterion.getPrompt() : String.valueOf(criterion.getType());
    }

    private static String describe(Constraint constraint) {
        String text = constraint.getDescription() != null ? constraint.getDescription() : "";
        return constraint.getLimit() != null ? text + " (limit " + constraint.getLimit() + ")" : text;
    }
}
