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
import me.golemcore.warden.domain.exception.CorruptCheckpointException;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Checkpoint;
import me.golemcore.warden.port.outbound.CheckpointPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Serializes sessions into checkpoint blobs and reads them back for resume.
 *
 * <p>
 * A checkpoint taken after turn N records {@code turnIndex = N} and the full
 * session including that turn; resuming continues at turn N + 1.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckpointService {

    private final CheckpointPort checkpointPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Checkpoint save(AgentSession session) {
        int turnIndex = session.getTurns().size() - 1;
        Checkpoint checkpoint = Checkpoint.builder()
                .version(Checkpoint.FORMAT_VERSION)
                .sessionId(session.getId())
                .turnIndex(turnIndex)
                .timestamp(clock.instant())
                .session(session)
                .build();
        String blob;
        try {
            blob = objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint for session " + session.getId(), e);
        }
        checkpointPort.save(session.getId(), turnIndex, blob);
        log.debug("[Checkpoint] Saved session {} after turn {}", session.getId(), turnIndex);
        return checkpoint;
    }

    /**
     * Loads the current checkpoint of a session.
     *
     * @throws CorruptCheckpointException
     *             if a checkpoint exists but cannot be read back into a
     *             consistent session
     */
    public Optional<Checkpoint> loadLatest(String sessionId) {
        Optional<String> blob = checkpointPort.loadLatest(sessionId);
        if (blob.isEmpty()) {
            return Optional.empty();
        }
        Checkpoint checkpoint;
        try {
            checkpoint = objectMapper.readValue(blob.get(), Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new CorruptCheckpointException(sessionId, "Checkpoint for session " + sessionId
                    + " is unreadable: " + e.getOriginalMessage(), e);
        }
        validate(sessionId, checkpoint);
        log.info("[Checkpoint] Loaded session {} at turn {}", sessionId, checkpoint.getTurnIndex());
        return Optional.of(checkpoint);
    }

    public void delete(String sessionId) {
        checkpointPort.delete(sessionId);
        log.debug("[Checkpoint] Deleted checkpoint for session {}", sessionId);
    }

    public List<String> listCheckpointedSessions() {
        return checkpointPort.listSessionIds();
    }

    private void validate(String sessionId, Checkpoint checkpoint) {
        AgentSession session = checkpoint.getSession();
        String problem = null;
        if (session == null) {
            problem = "missing session";
        } else if (!sessionId.equals(checkpoint.getSessionId()) || !sessionId.equals(session.getId())) {
            problem = "session id mismatch";
        } else if (checkpoint.getTurnIndex() != session.getTurns().size() - 1) {
            problem = "turn index " + checkpoint.getTurnIndex() + " does not match "
                    + session.getTurns().size() + " recorded turns";
        } else {
            for (int i = 0; i < session.getTurns().size(); i++) {
                if (session.getTurns().get(i).getIndex() != i) {
                    problem = "non-contiguous turn indices";
                    break;
                }
            }
        }
        if (problem != null) {
            throw new CorruptCheckpointException(sessionId,
                    "Checkpoint for session " + sessionId + " is inconsistent: " + problem, null);
        }
    }
}
