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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.warden.domain.model.LlmChunk;
import me.golemcore.warden.domain.model.LlmResponse;
import me.golemcore.warden.domain.model.ToolCall;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Folds a stream of model deltas into one step. Argument fragments are
 * concatenated per tool call and parsed once the stream ends; text that is not
 * a JSON object leaves {@link ToolCall#getArguments()} null so the gate can
 * fail closed on it.
 */
class LlmStreamAccumulator {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final StringBuilder text = new StringBuilder();
    private final Map<Integer, PendingCall> calls = new LinkedHashMap<>();
    private long inputTokens;
    private long outputTokens;
    private String stopReason;
    private boolean completed;

    LlmStreamAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    void accept(LlmChunk chunk) {
        if (chunk == null || chunk.getType() == null) {
            return;
        }
        switch (chunk.getType()) {
        case TEXT -> {
            if (chunk.getText() != null) {
                text.append(chunk.getText());
            }
        }
        case TOOL_CALL_START -> {
            PendingCall call = calls.computeIfAbsent(chunk.getIndex(), i -> new PendingCall());
            call.id = chunk.getToolCallId();
            call.name = chunk.getToolName();
            if (chunk.getDependsOn() != null) {
                call.dependsOn.addAll(chunk.getDependsOn());
            }
            if (chunk.getText() != null) {
                call.arguments.append(chunk.getText());
            }
        }
        case TOOL_CALL_DELTA -> {
            if (chunk.getText() != null) {
                calls.computeIfAbsent(chunk.getIndex(), i -> new PendingCall()).arguments.append(chunk.getText());
            }
        }
        case USAGE -> {
            inputTokens += chunk.getInputTokens();
            outputTokens += chunk.getOutputTokens();
        }
        case END_TURN -> {
            completed = true;
            stopReason = chunk.getStopReason();
        }
        default -> {
            // unknown chunk types are ignored
        }
        }
    }

    LlmResponse build() {
        List<ToolCall> toolCalls = new ArrayList<>();
        for (PendingCall pending : calls.values()) {
            String raw = pending.arguments.toString();
            toolCalls.add(ToolCall.builder()
                    .id(pending.id != null ? pending.id : "call_" + UUID.randomUUID())
                    .name(pending.name)
                    .rawArguments(raw)
                    .arguments(parseArguments(raw))
                    .dependsOn(new ArrayList<>(pending.dependsOn))
                    .build());
        }
        return LlmResponse.builder()
                .text(text.toString())
                .toolCalls(toolCalls)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .stopReason(stopReason)
                .completed(completed)
                .build();
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static final class PendingCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
        private final List<String> dependsOn = new ArrayList<>();
    }
}
