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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Append-only audit trail of security decisions, one JSON line per decision in
 * {@code decisions/<sessionId>.jsonl}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionLogService {

    private static final String DECISIONS_DIR = "decisions";
    private static final String NO_SESSION = "_global";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public void record(String sessionId, SecurityDecision decision) {
        try {
            String line = objectMapper.writeValueAsString(decision) + "\n";
            storagePort.appendText(DECISIONS_DIR, fileName(sessionId), line).join();
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Gate] Failed to append decision for {} to audit log: {}", decision.getToolCallId(),
                    e.getMessage());
        }
    }

    public List<SecurityDecision> read(String sessionId) {
        String content = storagePort.getText(DECISIONS_DIR, fileName(sessionId)).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<SecurityDecision> decisions = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                decisions.add(objectMapper.readValue(line, SecurityDecision.class));
            } catch (JsonProcessingException e) {
                log.warn("[Gate] Skipping unreadable decision log line for session {}: {}", sessionId,
                        e.getOriginalMessage());
            }
        }
        return decisions;
    }

    private String fileName(String sessionId) {
        return (sessionId != null && !sessionId.isBlank() ? sessionId : NO_SESSION) + ".jsonl";
    }
}
