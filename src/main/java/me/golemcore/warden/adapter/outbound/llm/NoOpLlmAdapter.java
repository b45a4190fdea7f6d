package me.golemcore.warden.adapter.outbound.llm;

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
import me.golemcore.warden.domain.model.LlmChunk;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.port.outbound.LlmPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * No-op LLM adapter used when no real provider is wired in.
 *
 * <p>
 * Always answers with a placeholder final message and no tool calls, so a run
 * started without a provider terminates after one turn.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chatStream() called for session {} - no LLM configured",
                request.getSessionId());
        return Flux.just(
                LlmChunk.text(PLACEHOLDER),
                LlmChunk.usage(0, 0),
                LlmChunk.endTurn("stop"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
