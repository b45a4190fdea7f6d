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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.exception.TransientInfraException;
import me.golemcore.warden.domain.exception.TurnFailureException;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.LlmResponse;
import me.golemcore.warden.port.outbound.LlmPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Requests the model's next step: streams it, accumulates the deltas and
 * retries transient failures with backoff. A stream that ends without an
 * end-of-turn marker counts as a transient failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelTurnClient {

    private final LlmPort llmPort;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;

    /**
     * @throws TurnFailureException
     *             if the step could not be obtained
     * @throws CancellationException
     *             if the scope was cancelled while waiting
     */
    public LlmResponse requestStep(LlmRequest request, Duration timeout, TurnScope scope) {
        try {
            return retryPolicy.execute("Model call", () -> streamOnce(request, timeout, scope));
        } catch (CancellationException e) {
            throw e;
        } catch (TurnFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TurnFailureException("Model call failed: " + e.getMessage(), e);
        }
    }

    private LlmResponse streamOnce(LlmRequest request, Duration timeout, TurnScope scope) {
        if (scope.isCancelled()) {
            throw new CancellationException("Turn cancelled");
        }
        LlmStreamAccumulator accumulator = new LlmStreamAccumulator(objectMapper);
        CompletableFuture<LlmResponse> future = scope.track(llmPort.chatStream(request)
                .doOnNext(accumulator::accept)
                .then(Mono.fromSupplier(accumulator::build))
                .toFuture());
        try {
            LlmResponse response = future.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (!response.isCompleted()) {
                throw new TransientInfraException("Model stream ended without end-of-turn marker");
            }
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientInfraException("Model response timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (RetryPolicy.isTransient(cause)) {
                throw new TransientInfraException("Model stream failed: " + cause.getMessage(), cause);
            }
            throw new TurnFailureException("Model call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Interrupted while waiting for the model");
        } finally {
            scope.untrack(future);
        }
    }
}
