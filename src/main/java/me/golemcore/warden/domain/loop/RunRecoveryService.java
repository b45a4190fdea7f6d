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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.service.CheckpointService;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resumes every checkpointed, non-terminal session once the application is
 * up, when {@code warden.loop.resume-on-startup} is set. Guardian and approval
 * state start fresh; only the session and its turns come from the checkpoint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunRecoveryService {

    private final CheckpointService checkpointService;
    private final AgentLoop agentLoop;
    private final WardenProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getLoop().isResumeOnStartup()) {
            return;
        }
        recoverAll();
    }

    /**
     * @return number of sessions handed to the run executor
     */
    public int recoverAll() {
        List<String> sessionIds = checkpointService.listCheckpointedSessions();
        int resumed = 0;
        for (String sessionId : sessionIds) {
            try {
                agentLoop.resumeAsync(sessionId);
                resumed++;
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("[Recovery] Skipping session {}: {}", sessionId, e.getMessage());
            }
        }
        if (resumed > 0) {
            log.info("[Recovery] Resumed {} of {} checkpointed sessions", resumed, sessionIds.size());
        }
        return resumed;
    }
}
