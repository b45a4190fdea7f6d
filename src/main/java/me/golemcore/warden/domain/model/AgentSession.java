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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Run context holding the conversation, the append-only turn list and the run
 * status. Owned and mutated only by the agent loop while the run is active.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSession {

    public enum Status {
        RUNNING, COMPLETED, FAILED, CANCELLED;

        public boolean isTerminal() {
            return this != RUNNING;
        }
    }

    private String id;
    private String parentSessionId;
    private boolean subAgent;

    @Builder.Default
    private Status status = Status.RUNNING;

    private String prompt;
    private Goal goal;
    private Integer maxTurns;
    private Long maxDurationSeconds;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<Turn> turns = new ArrayList<>();

    private long totalInputTokens;
    private long totalOutputTokens;
    private long activeMillis;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    private String failureReason;
    private String finalOutput;
    private Verdict lastVerdict;

    private boolean archived;
    private Instant archivedAt;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public void setTurns(List<Turn> turns) {
        this.turns = turns != null ? new ArrayList<>(turns) : new ArrayList<>();
    }

    /**
     * Appends a completed turn. Indices must be contiguous starting at zero.
     */
    public void appendTurn(Turn turn) {
        if (turn.getIndex() != turns.size()) {
            throw new IllegalStateException(
                    "Turn index " + turn.getIndex() + " does not follow " + turns.size() + " recorded turns");
        }
        turns.add(turn);
    }

    public void addMessage(Message message) {
        messages.add(message);
    }

    @JsonIgnore
    public int getNextTurnIndex() {
        return turns.size();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    @JsonIgnore
    public long getTotalTokens() {
        return totalInputTokens + totalOutputTokens;
    }

    /**
     * Assistant text of the most recent turn that produced any.
     */
    @JsonIgnore
    public String getLatestOutput() {
        for (int i = turns.size() - 1; i >= 0; i--) {
            String text = turns.get(i).getAssistantText();
            if (text != null && !text.isBlank()) {
                return text;
            }
        }
        return "";
    }

    @JsonIgnore
    public Turn getLastTurn() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }
}
