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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in a run's conversation. Roles are user,
 * assistant, system and tool.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String role;
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Map<String, Object> metadata;
    private Instant timestamp;

    @JsonIgnore
    public boolean isUserMessage() {
        return "user".equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return "assistant".equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return "tool".equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static Message user(String content, Instant timestamp) {
        return Message.builder().role("user").content(content).timestamp(timestamp).build();
    }

    public static Message advisory(String content, Instant timestamp) {
        return Message.builder()
                .role("user")
                .content(content)
                .metadata(Map.of("advisory", true))
                .timestamp(timestamp)
                .build();
    }
}
