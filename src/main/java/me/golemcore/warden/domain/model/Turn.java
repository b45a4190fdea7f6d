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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One completed loop iteration. Immutable once appended to a session.
 * {@code error} is set when the turn failed before its tool calls could be
 * collected.
 */
@Value
@Builder
@Jacksonized
public class Turn {

    int index;
    Instant startedAt;
    Instant completedAt;
    String assistantText;

    @Builder.Default
    List<ToolCall> toolCalls = List.of();

    @Builder.Default
    List<SecurityDecision> decisions = List.of();

    @Builder.Default
    List<ToolExecutionOutcome> results = List.of();

    @Builder.Default
    List<String> hints = List.of();

    long inputTokens;
    long outputTokens;
    String error;

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
