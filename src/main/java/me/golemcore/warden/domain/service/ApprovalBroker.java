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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalOutcome;
import me.golemcore.warden.domain.model.ApprovalRequest;
import me.golemcore.warden.domain.model.ApprovalStatus;
import me.golemcore.warden.domain.model.RuntimeEventType;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.security.ActionSummarizer;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns "needs a human" into an awaited answer with a bounded wait.
 *
 * <p>
 * Each request is published as an {@code APPROVAL_REQUESTED} event; any
 * surface (REST, chat, TUI) answers it through {@link #resolve}. The first
 * transition out of PENDING wins, whether it comes from a resolver, the
 * deadline timer or a session cancel, and every later attempt is a no-op. The
 * broker holds no tool-execution logic.
 */
@Service
@Slf4j
public class ApprovalBroker {

    private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();
    private final RuntimeEventService runtimeEventService;
    private final ActionSummarizer actionSummarizer;
    private final Clock clock;
    private final ScheduledExecutorService timer;

    public ApprovalBroker(RuntimeEventService runtimeEventService, ActionSummarizer actionSummarizer,
            Clock clock) {
        this.runtimeEventService = runtimeEventService;
        this.actionSummarizer = actionSummarizer;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "approval-timer");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void destroy() {
        for (PendingApproval approval : new ArrayList<>(pending.values())) {
            complete(approval, ApprovalStatus.TIMED_OUT, "Runtime shutting down");
        }
        timer.shutdownNow();
        try {
            timer.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Creates a pending request for a call the gate classified as
     * NEEDS_APPROVAL and returns its eventual outcome. The future always
     * completes normally: with the resolver's answer, or TIMED_OUT once
     * {@code timeout} elapses.
     */
    public CompletableFuture<ApprovalOutcome> requestApproval(String sessionId, ToolCall call,
            SecurityDecision decision, Duration timeout) {
        if (!decision.needsApproval()) {
            throw new IllegalArgumentException(
                    "Approval requested for call " + call.getId() + " with outcome " + decision.getOutcome());
        }
        Instant now = clock.instant();
        ApprovalRequest request = ApprovalRequest.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .toolCallId(call.getId())
                .toolName(call.getName())
                .tier(decision.getEffectiveTier())
                .matchedPattern(decision.getMatchedPattern())
                .summary(actionSummarizer.describe(call))
                .createdAt(now)
                .deadline(now.plus(timeout))
                .status(ApprovalStatus.PENDING)
                .build();

        PendingApproval approval = new PendingApproval(request, new AtomicReference<>(ApprovalStatus.PENDING),
                new CompletableFuture<>(), new AtomicReference<>());
        pending.put(request.getId(), approval);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", request.getId());
        payload.put("toolCallId", request.getToolCallId());
        payload.put("toolName", request.getToolName());
        payload.put("tier", request.getTier().name());
        payload.put("summary", request.getSummary());
        payload.put("deadline", request.getDeadline().toString());
        if (request.getMatchedPattern() != null) {
            payload.put("matchedPattern", request.getMatchedPattern());
        }
        runtimeEventService.emit(sessionId, RuntimeEventType.APPROVAL_REQUESTED, payload);
        log.info("[Approval] Requested {} for {} ({}), deadline in {}s", request.getId(), request.getToolName(),
                request.getSummary(), timeout.toSeconds());

        long delayMillis = Math.max(0, timeout.toMillis());
        approval.timeoutTask().set(timer.schedule(
                () -> complete(approval, ApprovalStatus.TIMED_OUT,
                        "No decision within " + timeout.toSeconds() + "s"),
                delayMillis, TimeUnit.MILLISECONDS));
        if (approval.status().get().isTerminal()) {
            // resolved before the timer was registered
            cancelTimer(approval);
        }
        return approval.future();
    }

    /**
     * Resolves a pending request. Returns false when the request is unknown or
     * already resolved; the earlier outcome stands.
     */
    public boolean resolve(String requestId, ApprovalDecision decision, String reason) {
        PendingApproval approval = pending.get(requestId);
        if (approval == null) {
            log.debug("[Approval] No pending request for id: {}", requestId);
            return false;
        }
        String effectiveReason = reason != null && !reason.isBlank() ? reason
                : (decision == ApprovalDecision.APPROVE ? "Approved" : "Denied");
        return complete(approval, decision.toStatus(), effectiveReason);
    }

    public List<ApprovalRequest> listPending() {
        return pending.values().stream()
                .filter(approval -> approval.status().get() == ApprovalStatus.PENDING)
                .map(PendingApproval::request)
                .sorted(Comparator.comparing(ApprovalRequest::getCreatedAt))
                .toList();
    }

    public List<ApprovalRequest> listPending(String sessionId) {
        return listPending().stream()
                .filter(request -> request.getSessionId().equals(sessionId))
                .toList();
    }

    /**
     * Finds the single pending request whose id starts with {@code prefix}, so
     * chat surfaces can accept short ids. Ambiguous prefixes match nothing.
     */
    public Optional<String> findByPrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return Optional.empty();
        }
        List<String> matches = pending.keySet().stream()
                .filter(id -> id.startsWith(prefix))
                .toList();
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    /**
     * Resolves every pending request of a session as TIMED_OUT.
     *
     * @return number of requests resolved by this call
     */
    public int cancelSession(String sessionId) {
        int cancelled = 0;
        for (PendingApproval approval : new ArrayList<>(pending.values())) {
            if (approval.request().getSessionId().equals(sessionId)
                    && complete(approval, ApprovalStatus.TIMED_OUT, "Run cancelled")) {
                cancelled++;
            }
        }
        return cancelled;
    }

    private boolean complete(PendingApproval approval, ApprovalStatus status, String reason) {
        if (!approval.status().compareAndSet(ApprovalStatus.PENDING, status)) {
            return false;
        }
        ApprovalRequest request = approval.request();
        pending.remove(request.getId());
        cancelTimer(approval);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("requestId", request.getId());
        payload.put("toolCallId", request.getToolCallId());
        payload.put("toolName", request.getToolName());
        payload.put("status", status.name());
        payload.put("reason", reason);
        runtimeEventService.emit(request.getSessionId(), RuntimeEventType.APPROVAL_RESOLVED, payload);

        if (status == ApprovalStatus.APPROVED) {
            log.info("[Approval] {} approved for {}", request.getId(), request.getToolName());
        } else {
            log.warn("[Approval] {} {} for {}: {}", request.getId(), status, request.getToolName(), reason);
        }
        approval.future().complete(new ApprovalOutcome(request.getId(), status, reason));
        return true;
    }

    private void cancelTimer(PendingApproval approval) {
        ScheduledFuture<?> task = approval.timeoutTask().get();
        if (task != null) {
            task.cancel(false);
        }
    }

    private record PendingApproval(ApprovalRequest request, AtomicReference<ApprovalStatus> status,
            CompletableFuture<ApprovalOutcome> future, AtomicReference<ScheduledFuture<?>> timeoutTask) {
    }
}
