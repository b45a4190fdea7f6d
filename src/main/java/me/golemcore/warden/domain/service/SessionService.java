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
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.port.outbound.SessionPort;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session persistence with an in-memory cache. Sessions are stored as JSON in
 * {@code sessions/<id>.json}, written atomically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, AgentSession> sessionCache = new ConcurrentHashMap<>();

    @Override
    public Optional<AgentSession> get(String sessionId) {
        AgentSession cached = sessionCache.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<AgentSession> loaded = load(sessionId + JSON_EXTENSION);
        loaded.ifPresent(session -> sessionCache.put(sessionId, session));
        return loaded;
    }

    @Override
    public void save(AgentSession session) {
        session.setUpdatedAt(clock.instant());
        sessionCache.put(session.getId(), session);

        try {
            String json = objectMapper.writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json, false).join();
            log.debug("Saved session: {}", session.getId());
        } catch (JsonProcessingException | CompletionException e) {
            log.error("Failed to save session: {}", session.getId(), e);
        }
    }

    @Override
    public void delete(String sessionId) {
        sessionCache.remove(sessionId);
        try {
            storagePort.deleteObject(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
            log.info("Deleted session: {}", sessionId);
        } catch (CompletionException e) {
            log.error("Failed to delete session: {}", sessionId, e);
        }
    }

    @Override
    public List<AgentSession> listAll() {
        // Merge cached sessions with any on-disk sessions not yet loaded
        try {
            List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION)) {
                    continue;
                }
                String id = file.substring(0, file.length() - JSON_EXTENSION.length());
                if (!sessionCache.containsKey(id)) {
                    load(file).ifPresent(session -> sessionCache.putIfAbsent(session.getId(), session));
                }
            }
        } catch (CompletionException e) {
            log.warn("Failed to scan sessions directory: {}", e.getMessage());
        }
        return sessionCache.values().stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(AgentSession::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private Optional<AgentSession> load(String file) {
        try {
            String json = storagePort.getText(SESSIONS_DIR, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, AgentSession.class));
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("Failed to load session file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
