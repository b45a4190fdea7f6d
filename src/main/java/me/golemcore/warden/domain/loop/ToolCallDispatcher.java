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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.exception.PolicyViolationException;
import me.golemcore.warden.domain.exception.ToolExecutionException;
import me.golemcore.warden.domain.model.ApprovalOutcome;
import me.golemcore.warden.domain.model.ApprovalStatus;
import me.golemcore.warden.domain.model.GateOutcome;
import me.golemcore.warden.domain.model.RuntimeEventType;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.SecurityPolicy;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.ToolExecutionOutcome;
import me.golemcore.warden.domain.model.ToolFailureKind;
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.domain.service.ApprovalBroker;
import me.golemcore.warden.domain.service.RuntimeEventService;
import me.golemcore.warden.domain.service.ToolRegistry;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes the gated calls of one turn.
 *
 * <p>
 * Denied calls become policy-violation results without running. Calls that
 * need approval wait on the {@link ApprovalBroker} without holding a worker
 * thread. Allowed and approved calls run on a bounded pool, each under the
 * tool timeout. A call starts only after every call it depends on has
 * finished; when parallel execution is disabled every call also waits for the
 * one before it. Results come back ordered by call id.
 */
@Service
@Slf4j
public class ToolCallDispatcher {

    private final ToolRegistry toolRegistry;
    private final ApprovalBroker approvalBroker;
    private final RuntimeEventService runtimeEventService;
    private final RetryPolicy retryPolicy;
    private final WardenProperties.LoopProperties properties;
    private final Clock clock;
    private final ExecutorService executor;

    public ToolCallDispatcher(ToolRegistry toolRegistry, ApprovalBroker approvalBroker,
            RuntimeEventService runtimeEventService, RetryPolicy retryPolicy, WardenProperties properties,
            Clock clock) {
        this.toolRegistry = toolRegistry;
        this.approvalBroker = approvalBroker;
        this.runtimeEventService = runtimeEventService;
        this.retryPolicy = retryPolicy;
        this.properties = properties.getLoop();
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, this.properties.getMaxParallelTools()), r -> {
            Thread t = new Thread(r, "tool-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
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

    /**
     * Runs the calls and waits for all of them, at most until {@code deadline}.
     * When the deadline passes, the scope is cancelled and unfinished calls
     * are reported as CANCELLED.
     */
    public List<ToolExecutionOutcome> dispatch(String sessionId, List<GatedCall> calls, SecurityPolicy policy,
            TurnScope scope, Instant deadline) {
        if (calls.isEmpty()) {
            return List.of();
        }
        Map<String, CompletableFuture<ToolExecutionOutcome>> futures = new LinkedHashMap<>();
        CompletableFuture<?> previous = CompletableFuture.completedFuture(null);
        for (GatedCall gated : calls) {
            List<CompletableFuture<?>> prerequisites = new ArrayList<>();
            for (String dependency : gated.call().getDependsOn()) {
                CompletableFuture<ToolExecutionOutcome> upstream = futures.get(dependency);
                if (upstream != null) {
                    prerequisites.add(upstream);
                } else {
                    log.debug("[Dispatch] Call {} depends on unknown or later call {}, ignoring", gated.id(),
                            dependency);
                }
            }
            if (!properties.isParallelTools()) {
                prerequisites.add(previous);
            }
            CompletableFuture<ToolExecutionOutcome> outcome = CompletableFuture
                    .allOf(prerequisites.toArray(new CompletableFuture[0]))
                    .handle((ignored, error) -> null)
                    .thenComposeAsync(ignored -> resolve(sessionId, gated, policy, scope, deadline), executor)
                    .handle((result, error) -> error == null ? result : fromError(gated, error));
            futures.put(gated.id(), outcome);
            previous = outcome;
        }

        awaitAll(futures, scope, deadline);

        List<ToolExecutionOutcome> outcomes = new ArrayList<>();
        for (GatedCall gated : calls) {
            CompletableFuture<ToolExecutionOutcome> future = futures.get(gated.id());
            ToolExecutionOutcome outcome = future.isDone() && !future.isCompletedExceptionally()
                    ? future.join()
                    : outcome(gated, null, ToolResult.failure(ToolFailureKind.CANCELLED,
                            "Cancelled: turn time limit reached"), 0);
            outcomes.add(outcome);
        }
        outcomes.sort(Comparator.comparing(ToolExecutionOutcome::toolCallId,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return outcomes;
    }

    /**
     * Truncates tool output that exceeds {@code max-tool-output-chars}.
     */
    public String truncateToolOutput(String content, String toolName) {
        if (content == null) {
            return null;
        }
        int maxChars = properties.getMaxToolOutputChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars. The full result is too large for the context window."
                + " Try a more specific query, use filtering/pagination, or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Dispatch] Truncating '{}' result: {} chars -> ~{} chars", toolName, content.length(),
                cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private void awaitAll(Map<String, CompletableFuture<ToolExecutionOutcome>> futures, TurnScope scope,
            Instant deadline) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]));
        long remaining = Duration.between(clock.instant(), deadline).toMillis();
        try {
            all.get(Math.max(1, remaining), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Dispatch] Turn deadline reached with {} calls unfinished",
                    futures.values().stream().filter(f -> !f.isDone()).count());
            scope.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scope.cancel();
        } catch (ExecutionException | CancellationException e) {
            log.debug("[Dispatch] Unexpected dispatch failure: {}", e.getMessage());
        }
    }

    private CompletableFuture<ToolExecutionOutcome> resolve(String sessionId, GatedCall gated, SecurityPolicy policy,
            TurnScope scope, Instant deadline) {
        SecurityDecision decision = gated.decision();
        switch (decision.getOutcome()) {
        case DENY -> {
            ToolFailureKind kind = decision.isUnknownTool() ? ToolFailureKind.UNKNOWN_TOOL
                    : decision.isSchemaFailure() ? ToolFailureKind.SCHEMA_ERROR : ToolFailureKind.POLICY_DENIED;
            return CompletableFuture.completedFuture(
                    outcome(gated, null, ToolResult.failure(kind, decision.getReason()), 0));
        }
        case NEEDS_APPROVAL -> {
            Duration timeout = Duration.ofSeconds(policy.getApprovalTimeoutSeconds());
            return approvalBroker.requestApproval(sessionId, gated.call(), decision, timeout)
                    .thenApplyAsync(approval -> {
                        requireApproved(approval);
                        return invoke(sessionId, gated, ApprovalStatus.APPROVED, scope, deadline);
                    }, executor);
        }
        default -> {
            return CompletableFuture.completedFuture(invoke(sessionId, gated, null, scope, deadline));
        }
        }
    }

    private static void requireApproved(ApprovalOutcome approval) {
        if (!approval.isApproved()) {
            String message = approval.status() == ApprovalStatus.TIMED_OUT
                    ? "Approval timed out: " + approval.reason()
                    : "Approval denied: " + approval.reason();
            throw new PolicyViolationException(approval.toFailureKind(), message);
        }
    }

    private ToolExecutionOutcome invoke(String sessionId, GatedCall gated, ApprovalStatus approvalStatus,
            TurnScope scope, Instant deadline) {
        ToolCall call = gated.call();
        if (scope.isCancelled()) {
            return outcome(gated, approvalStatus,
                    ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled before execution"), 0);
        }
        ToolComponent tool = toolRegistry.find(call.getName()).orElse(null);
        if (tool == null) {
            return outcome(gated, approvalStatus,
                    ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + call.getName()), 0);
        }

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("toolCallId", call.getId());
        started.put("toolName", call.getName());
        runtimeEventService.emit(sessionId, RuntimeEventType.TOOL_STARTED, started);

        long startMillis = clock.millis();
        ToolResult result = executeWithRetries(tool, call, scope, deadline);
        if (result.isSuccess() && result.getOutput() != null) {
            result.setOutput(truncateToolOutput(result.getOutput(), call.getName()));
        }
        long duration = clock.millis() - startMillis;

        Map<String, Object> finished = new LinkedHashMap<>();
        finished.put("toolCallId", call.getId());
        finished.put("toolName", call.getName());
        finished.put("success", result.isSuccess());
        if (result.getFailureKind() != null) {
            finished.put("failureKind", result.getFailureKind().name());
        }
        finished.put("durationMillis", duration);
        runtimeEventService.emit(sessionId, RuntimeEventType.TOOL_FINISHED, finished);

        log.info("[Dispatch] {} ({}) finished in {}ms: {}", call.getName(), call.getId(), duration,
                result.isSuccess() ? "success" : result.getFailureKind());
        return outcome(gated, approvalStatus, result, duration);
    }

    private ToolResult executeWithRetries(ToolComponent tool, ToolCall call, TurnScope scope, Instant deadline) {
        int transientFailures = 0;
        int toolRetries = 0;
        while (true) {
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            long timeoutMillis = Math.min(TimeUnit.SECONDS.toMillis(properties.getToolTimeoutSeconds()),
                    Math.max(1, remaining));
            CompletableFuture<ToolResult> future;
            try {
                future = scope.track(tool.execute(call.getArguments()));
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            Throwable failure;
            try {
                ToolResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
                return result != null ? result : ToolResult.failure("Tool returned no result");
            } catch (TimeoutException e) {
                future.cancel(true);
                if (scope.isCancelled()) {
                    return ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled: turn time limit reached");
                }
                failure = e;
                if (remaining <= timeoutMillis || ++transientFailures >= retryPolicy.getMaxAttempts()) {
                    return ToolResult.failure(ToolFailureKind.TIMEOUT,
                            "Tool timed out after " + TimeUnit.MILLISECONDS.toSeconds(timeoutMillis) + "s");
                }
            } catch (CancellationException e) {
                return ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return ToolResult.failure(ToolFailureKind.CANCELLED, "Interrupted");
            } catch (ExecutionException e) {
                failure = e.getCause() != null ? e.getCause() : e;
                if (RetryPolicy.isTransient(failure)) {
                    if (++transientFailures >= retryPolicy.getMaxAttempts()) {
                        return ToolResult.failure("Tool execution failed: " + safeCauseMessage(failure));
                    }
                } else if (failure instanceof ToolExecutionException && toolRetries < tool.getMaxRetries()) {
                    toolRetries++;
                } else {
                    log.error("[Dispatch] Tool {} failed: {}", call.getName(), safeCauseMessage(failure));
                    return ToolResult.failure("Tool execution failed: " + safeCauseMessage(failure));
                }
            } finally {
                scope.untrack(future);
            }
            if (scope.isCancelled()) {
                return ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled");
            }
            long backoff = retryPolicy.backoffMillis(transientFailures + toolRetries - 1);
            log.warn("[Dispatch] Retrying {} ({}) in {}ms after: {}", call.getName(), call.getId(), backoff,
                    safeCauseMessage(failure));
            try {
                retryPolicy.sleep(backoff);
            } catch (CancellationException e) {
                return ToolResult.failure(ToolFailureKind.CANCELLED, "Interrupted");
            }
        }
    }

    private ToolExecutionOutcome fromError(GatedCall gated, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof PolicyViolationException violation) {
            ApprovalStatus status = violation.getFailureKind() == ToolFailureKind.APPROVAL_TIMED_OUT
                    ? ApprovalStatus.TIMED_OUT
                    : ApprovalStatus.DENIED;
            return outcome(gated, status, ToolResult.failure(violation.getFailureKind(), violation.getMessage()), 0);
        }
        if (cause instanceof CancellationException) {
            return outcome(gated, null, ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled"), 0);
        }
        log.error("[Dispatch] Call {} failed unexpectedly: {}", gated.id(), safeCauseMessage(cause));
        return outcome(gated, null, ToolResult.failure("Tool execution failed: " + safeCauseMessage(cause)), 0);
    }

    private static ToolExecutionOutcome outcome(GatedCall gated, ApprovalStatus approvalStatus, ToolResult result,
            long durationMillis) {
        GateOutcome gateOutcome = gated.decision() != null ? gated.decision().getOutcome() : GateOutcome.DENY;
        return new ToolExecutionOutcome(gated.id(), gated.call().getName(), gateOutcome, approvalStatus, result,
                durationMillis);
    }

    private static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message != null && !message.isBlank() ? message : cursor.getClass().getSimpleName();
    }
}
