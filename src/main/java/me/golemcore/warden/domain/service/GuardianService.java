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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates one {@link GuardianWatchdog} per run.
 *
 * <p>
 * All watchdogs share a single guardian thread. Every watchdog's state is only
 * touched from that thread, and events reach it as tasks, so nothing is shared
 * with the loop except the event stream and the hint queue.
 */
@Service
@Slf4j
public class GuardianService {

    private final WardenProperties.GuardianProperties properties;
    private final RuntimeEventService runtimeEventService;
    private final ObjectMapper signatureMapper;
    private final Clock clock;
    private final ScheduledExecutorService executor;

    public GuardianService(WardenProperties properties, RuntimeEventService runtimeEventService,
            ObjectMapper objectMapper, Clock clock) {
        this.properties = properties.getGuardian();
        this.runtimeEventService = runtimeEventService;
        this.signatureMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.clock = clock;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "guardian");
            t.setDaemon(true);
            return t;
        });
        log.info("[Guardian] enabled: {}, stall: {}s, doom threshold: {}, budget: {} tokens",
                this.properties.isEnabled(), this.properties.getStallTimeoutSeconds(),
                this.properties.getDoomLoopThreshold(), this.properties.getBudgetTokens());
    }

    /**
     * Starts watching a session's events with fresh state.
     *
     * @param initialTokens
     *            tokens already spent by the session before this run segment,
     *            non-zero on resume
     */
    public GuardianWatchdog start(String sessionId, long initialTokens) {
        if (!properties.isEnabled()) {
            return GuardianWatchdog.disabled(sessionId);
        }
        GuardianWatchdog watchdog = new GuardianWatchdog(sessionId, properties, runtimeEventService, executor,
                signatureMapper, clock, initialTokens);
        watchdog.start();
        return watchdog;
    }

    @PreDestroy
    public void destroy() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
