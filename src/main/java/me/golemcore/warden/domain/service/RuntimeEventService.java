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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.RuntimeEvent;
import me.golemcore.warden.domain.model.RuntimeEventType;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes runtime events to any number of subscribers.
 *
 * <p>
 * Emission is serialized, so every subscriber sees events in sequence order.
 * Subscribers are invoked on the emitting thread and must not emit from inside
 * their callback; components that react by publishing (the guardian) hand
 * events to their own executor first. Events emitted while nobody listens are
 * dropped.
 */
@Service
@Slf4j
public class RuntimeEventService {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Sinks.Many<RuntimeEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Object emitLock = new Object();

    public RuntimeEventService(Clock clock) {
        this.clock = clock;
    }

    public RuntimeEvent emit(String sessionId, RuntimeEventType type, Map<String, Object> payload) {
        Map<String, Object> safePayload = payload != null ? new LinkedHashMap<>(payload) : Map.of();
        synchronized (emitLock) {
            RuntimeEvent event = RuntimeEvent.builder()
                    .sequence(sequence.incrementAndGet())
                    .type(type)
                    .timestamp(Instant.now(clock))
                    .sessionId(sessionId)
                    .payload(safePayload)
                    .build();
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.debug("[Events] Event {} for session {} not delivered: {}", type, sessionId, result);
            }
            return event;
        }
    }

    public RuntimeEvent emit(String sessionId, RuntimeEventType type) {
        return emit(sessionId, type, Map.of());
    }

    /**
     * Live stream of all events published from the moment of subscription.
     */
    public Flux<RuntimeEvent> stream() {
        return sink.asFlux();
    }

    /**
     * Live stream of one session's events; all events when {@code sessionId} is
     * null.
     */
    public Flux<RuntimeEvent> stream(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return stream();
        }
        return sink.asFlux().filter(event -> sessionId.equals(event.getSessionId()));
    }
}
