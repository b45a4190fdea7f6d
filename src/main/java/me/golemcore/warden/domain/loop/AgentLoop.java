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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.exception.ConstraintViolationException;
import me.golemcore.warden.domain.exception.CorruptCheckpointException;
import me.golemcore.warden.domain.exception.TurnFailureException;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Checkpoint;
import me.golemcore.warden.domain.model.GateContext;
import me.golemcore.warden.domain.model.LlmResponse;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.RunRequest;
import me.golemcore.warden.domain.model.RunResult;
import me.golemcore.warden.domain.model.RuntimeEventType;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.SecurityPolicy;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.ToolExecutionOutcome;
import me.golemcore.warden.domain.model.Turn;
import me.golemcore.warden.domain.model.Verdict;
import me.golemcore.warden.domain.model.WatchdogHint;
import me.golemcore.warden.domain.service.ApprovalBroker;
import me.golemcore.warden.domain.service.CheckpointService;
import me.golemcore.warden.domain.service.GoalEvaluator;
import me.golemcore.warden.domain.service.GuardianService;
import me.golemcore.warden.domain.service.GuardianWatchdog;
import me.golemcore.warden.domain.service.RuntimeEventService;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.SessionPort;
import me.golemcore.warden.security.SecurityGate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a run turn by turn until the goal is met, a limit is reached or the
 * run is cancelled.
 *
 * <p>
 * Each turn:
 * <ol>
 * <li>watchdog hints from the previous turn are appended as advisory
 * messages</li>
 * <li>the model's next step is requested and streamed</li>
 * <li>every proposed tool call passes the {@link SecurityGate}; the
 * {@link ToolCallDispatcher} runs, refuses or parks each one on the approval
 * broker</li>
 * <li>the turn is appended and the session checkpointed</li>
 * <li>the {@link GoalEvaluator} decides whether to stop, retry or go on</li>
 * </ol>
 * The session is owned by the thread running the loop. Everything else
 * (guardian, approvals, REST clients) observes it through the event stream.
 */
@Service
@Slf4j
public class AgentLoop {

    private static final Duration UNBOUNDED_TURN = Duration.ofDays(1);

    private final SessionPort sessionPort;
    private final CheckpointService checkpointService;
    private final SecurityGate securityGate;
    private final SecurityPolicy securityPolicy;
    private final ToolCallDispatcher toolCallDispatcher;
    private final ModelTurnClient modelTurnClient;
    private final TurnContextBuilder turnContextBuilder;
    private final GoalEvaluator goalEvaluator;
    private final GuardianService guardianService;
    private final ApprovalBroker approvalBroker;
    private final RuntimeEventService runtimeEventService;
    private final WardenProperties.LoopProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private final ExecutorService runExecutor;

    public AgentLoop(SessionPort sessionPort, CheckpointService checkpointService, SecurityGate securityGate,
            SecurityPolicy securityPolicy, ToolCallDispatcher toolCallDispatcher, ModelTurnClient modelTurnClient,
            TurnContextBuilder turnContextBuilder, GoalEvaluator goalEvaluator, GuardianService guardianService,
            ApprovalBroker approvalBroker, RuntimeEventService runtimeEventService, WardenProperties properties,
            ObjectMapper objectMapper, Clock clock) {
        this.sessionPort = sessionPort;
        this.checkpointService = checkpointService;
        this.securityGate = securityGate;
        this.securityPolicy = securityPolicy;
        this.toolCallDispatcher = toolCallDispatcher;
        this.modelTurnClient = modelTurnClient;
        this.turnContextBuilder = turnContextBuilder;
        this.goalEvaluator = goalEvaluator;
        this.guardianService = guardianService;
        this.approvalBroker = approvalBroker;
        this.runtimeEventService = runtimeEventService;
        this.properties = properties.getLoop();
        this.objectMapper = objectMapper;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.runExecutor = Executors.newFixedThreadPool(Math.max(1, this.properties.getRunThreads()), r -> {
            Thread t = new Thread(r, "agent-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        runExecutor.shutdownNow();
        try {
            runExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a new session to completion on the calling thread.
     */
    public RunResult run(RunRequest request) {
        ActiveRun run = register(createSession(request));
        return execute(run, false);
    }

    /**
     * Starts a new session on the run executor.
     */
    public RunHandle submit(RunRequest request) {
        ActiveRun run = register(createSession(request));
        CompletableFuture<RunResult> result = CompletableFuture.supplyAsync(() -> execute(run, false), runExecutor);
        return new RunHandle(run.session.getId(), result);
    }

    /**
     * Resumes a session from its latest checkpoint on the calling thread. A
     * terminal session is returned unchanged; an unreadable checkpoint fails
     * the session.
     *
     * @throws IllegalArgumentException
     *             if the session is unknown
     * @throws IllegalStateException
     *             if the session is already running
     */
    public RunResult resume(String sessionId) {
        Optional<ActiveRun> run = prepareResume(sessionId);
        if (run.isEmpty()) {
            return sessionPort.get(sessionId).map(RunResult::of)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        }
        return execute(run.get(), true);
    }

    /**
     * Resumes a session on the run executor.
     */
    public RunHandle resumeAsync(String sessionId) {
        Optional<ActiveRun> run = prepareResume(sessionId);
        if (run.isEmpty()) {
            RunResult result = sessionPort.get(sessionId).map(RunResult::of)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
            return new RunHandle(sessionId, CompletableFuture.completedFuture(result));
        }
        ActiveRun active = run.get();
        return new RunHandle(sessionId, CompletableFuture.supplyAsync(() -> execute(active, true), runExecutor));
    }

    /**
     * Cancels a running session: in-flight tool calls are cancelled, pending
     * approvals are resolved as timed out and the session ends CANCELLED.
     *
     * @return false if the session is not running
     */
    public boolean cancel(String sessionId) {
        ActiveRun run = activeRuns.get(sessionId);
        if (run == null) {
            return false;
        }
        log.info("[Loop] Cancelling session {}", sessionId);
        run.cancel();
        approvalBroker.cancelSession(sessionId);
        return true;
    }

    public boolean isRunning(String sessionId) {
        return activeRuns.containsKey(sessionId);
    }

    /**
     * Returns the session as last published by its run. While the run is active
     * this is a detached copy taken at the latest checkpoint, never the
     * instance the loop is mutating.
     */
    public Optional<AgentSession> getSession(String sessionId) {
        ActiveRun run = activeRuns.get(sessionId);
        if (run != null) {
            return Optional.of(run.snapshot);
        }
        return sessionPort.get(sessionId);
    }

    private AgentSession createSession(RunRequest request) {
        if (request == null || request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new IllegalArgumentException("Run prompt must not be blank");
        }
        Instant now = clock.instant();
        AgentSession session = AgentSession.builder()
                .id(UUID.randomUUID().toString())
                .parentSessionId(request.getParentSessionId())
                .subAgent(request.getParentSessionId() != null)
                .prompt(request.getPrompt())
                .goal(request.getGoal())
                .maxTurns(request.getMaxTurns())
                .maxDurationSeconds(request.getMaxDurationSeconds())
                .createdAt(now)
                .updatedAt(now)
                .build();
        session.addMessage(Message.user(request.getPrompt(), now));
        sessionPort.save(session);
        return session;
    }

    private ActiveRun register(AgentSession session) {
        ActiveRun run = new ActiveRun(session);
        publish(run);
        if (activeRuns.putIfAbsent(session.getId(), run) != null) {
            throw new IllegalStateException("Session already running: " + session.getId());
        }
        return run;
    }

    private Optional<ActiveRun> prepareResume(String sessionId) {
        if (activeRuns.containsKey(sessionId)) {
            throw new IllegalStateException("Session already running: " + sessionId);
        }
        Optional<Checkpoint> checkpoint;
        try {
            checkpoint = checkpointService.loadLatest(sessionId);
        } catch (CorruptCheckpointException e) {
            failCorrupt(sessionId, e);
            return Optional.empty();
        }
        AgentSession session = checkpoint.map(Checkpoint::getSession)
                .or(() -> sessionPort.get(sessionId))
                .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
        if (session.isTerminal()) {
            log.info("[Loop] Session {} is already {}, nothing to resume", sessionId, session.getStatus());
            return Optional.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnIndex", session.getNextTurnIndex());
        runtimeEventService.emit(sessionId, RuntimeEventType.RUN_RESUMED, payload);
        log.info("[Loop] Resuming session {} at turn {}", sessionId, session.getNextTurnIndex());
        return Optional.of(register(session));
    }

    private void failCorrupt(String sessionId, CorruptCheckpointException e) {
        log.error("[Loop] Corrupt checkpoint for session {}: {}", sessionId, e.getMessage());
        Instant now = clock.instant();
        AgentSession session = sessionPort.get(sessionId).orElseGet(() -> AgentSession.builder()
                .id(sessionId)
                .createdAt(now)
                .build());
        session.setStatus(AgentSession.Status.FAILED);
        session.setFailureReason("Corrupt checkpoint: " + e.getMessage());
        session.setCompletedAt(now);
        session.setUpdatedAt(now);
        session.setArchived(true);
        session.setArchivedAt(now);
        sessionPort.save(session);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", AgentSession.Status.FAILED.name());
        payload.put("reason", session.getFailureReason());
        runtimeEventService.emit(sessionId, RuntimeEventType.RUN_FAILED, payload);
    }

    private RunResult execute(ActiveRun run, boolean resumed) {
        AgentSession session = run.session;
        String sessionId = session.getId();
        GateContext context = session.isSubAgent() ? GateContext.subAgent(sessionId) : GateContext.topLevel(sessionId);
        SecurityPolicy effectivePolicy = securityGate.effectivePolicy(securityPolicy, context);
        run.startedAtMillis = clock.millis();
        run.priorActiveMillis = session.getActiveMillis();

        if (!resumed) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("prompt", session.getPrompt());
            payload.put("subAgent", session.isSubAgent());
            if (session.getParentSessionId() != null) {
                payload.put("parentSessionId", session.getParentSessionId());
            }
            runtimeEventService.emit(sessionId, RuntimeEventType.RUN_STARTED, payload);
            log.info("[Loop] Starting session {}{}", sessionId, session.isSubAgent() ? " (sub-agent)" : "");
        }

        try (GuardianWatchdog watchdog = guardianService.start(sessionId, session.getTotalTokens())) {
            int consecutiveFailures = 0;
            while (!session.isTerminal()) {
                if (run.cancelled) {
                    finish(run, AgentSession.Status.CANCELLED, "Run cancelled");
                    break;
                }
                try {
                    checkLimits(run);
                } catch (ConstraintViolationException e) {
                    finishOnLimit(run, e.getMessage());
                    break;
                }

                Turn turn = executeTurn(run, watchdog, context, effectivePolicy);
                if (turn == null) {
                    if (!run.cancelled) {
                        finish(run, AgentSession.Status.FAILED, "Run interrupted");
                    }
                    continue;
                }
                if (turn.isFailed()) {
                    consecutiveFailures++;
                    if (consecutiveFailures > properties.getMaxConsecutiveTurnFailures()) {
                        finish(run, AgentSession.Status.FAILED,
                                "Turn failed " + consecutiveFailures + " times in a row: " + turn.getError());
                    }
                    continue;
                }
                consecutiveFailures = 0;
                if (run.cancelled) {
                    continue;
                }
                applyVerdict(run, evaluate(session, turn));
            }
        } catch (RuntimeException e) {
            log.error("[Loop] Session {} failed unexpectedly", sessionId, e);
            if (!session.isTerminal()) {
                finish(run, AgentSession.Status.FAILED, "Unexpected error: " + e.getMessage());
            }
        } finally {
            activeRuns.remove(sessionId);
        }
        return RunResult.of(session);
    }

    private Turn executeTurn(ActiveRun run, GuardianWatchdog watchdog, GateContext context,
            SecurityPolicy effectivePolicy) {
        AgentSession session = run.session;
        String sessionId = session.getId();
        int index = session.getNextTurnIndex();
        Instant startedAt = clock.instant();

        List<String> hints = new ArrayList<>();
        for (WatchdogHint hint : watchdog.drainHints()) {
            session.addMessage(Message.advisory(hint.message(), hint.timestamp()));
            hints.add(hint.message());
        }

        runtimeEventService.emit(sessionId, RuntimeEventType.TURN_STARTED, Map.of("turnIndex", index));
        log.debug("[Loop] Session {} turn {} started", sessionId, index);

        TurnScope scope = new TurnScope();
        run.scope = scope;
        if (run.cancelled) {
            scope.cancel();
        }

        LlmResponse response;
        try {
            response = modelTurnClient.requestStep(turnContextBuilder.build(session), modelTimeout(run), scope);
        } catch (CancellationException e) {
            log.info("[Loop] Session {} turn {} cancelled while waiting for the model", sessionId, index);
            return null;
        } catch (TurnFailureException e) {
            Turn failed = Turn.builder()
                    .index(index)
                    .startedAt(startedAt)
                    .completedAt(clock.instant())
                    .hints(List.copyOf(hints))
                    .error(e.getMessage())
                    .build();
            session.appendTurn(failed);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("turnIndex", index);
            payload.put("error", e.getMessage());
            runtimeEventService.emit(sessionId, RuntimeEventType.TURN_FAILED, payload);
            log.warn("[Loop] Session {} turn {} failed: {}", sessionId, index, e.getMessage());
            checkpoint(run);
            return failed;
        }

        recordUsage(session, index, response);
        List<ToolCall> calls = response.getToolCalls() != null ? response.getToolCalls() : List.of();
        session.addMessage(Message.builder()
                .role("assistant")
                .content(response.getText())
                .toolCalls(calls.isEmpty() ? null : calls)
                .timestamp(clock.instant())
                .build());

        List<GatedCall> gated = new ArrayList<>();
        List<SecurityDecision> decisions = new ArrayList<>();
        for (ToolCall call : calls) {
            SecurityDecision decision = securityGate.decide(call, securityPolicy, context);
            call.setDeclaredTier(decision.getBaseTier());
            decisions.add(decision);
            gated.add(new GatedCall(call, decision));
            emitDecision(sessionId, call, decision);
        }

        List<ToolExecutionOutcome> outcomes = toolCallDispatcher.dispatch(sessionId, gated, effectivePolicy, scope,
                turnDeadline(run));
        for (ToolExecutionOutcome outcome : outcomes) {
            session.addMessage(Message.builder()
                    .role("tool")
                    .toolCallId(outcome.toolCallId())
                    .toolName(outcome.toolName())
                    .content(outcome.result().toModelContent())
                    .timestamp(clock.instant())
                    .build());
        }

        Turn turn = Turn.builder()
                .index(index)
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .assistantText(response.getText())
                .toolCalls(List.copyOf(calls))
                .decisions(List.copyOf(decisions))
                .results(List.copyOf(outcomes))
                .hints(List.copyOf(hints))
                .inputTokens(response.getInputTokens())
                .outputTokens(response.getOutputTokens())
                .build();
        session.appendTurn(turn);

        long failedCalls = outcomes.stream().filter(o -> !o.result().isSuccess()).count();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnIndex", index);
        payload.put("toolCalls", calls.size());
        payload.put("failedCalls", failedCalls);
        runtimeEventService.emit(sessionId, RuntimeEventType.TURN_COMPLETED, payload);
        log.info("[Loop] Session {} turn {} completed: {} tool calls, {} failed", sessionId, index, calls.size(),
                failedCalls);

        checkpoint(run);
        return turn;
    }

    private void recordUsage(AgentSession session, int index, LlmResponse response) {
        session.setTotalInputTokens(session.getTotalInputTokens() + response.getInputTokens());
        session.setTotalOutputTokens(session.getTotalOutputTokens() + response.getOutputTokens());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnIndex", index);
        payload.put("inputTokens", response.getInputTokens());
        payload.put("outputTokens", response.getOutputTokens());
        payload.put("totalTokens", session.getTotalTokens());
        runtimeEventService.emit(session.getId(), RuntimeEventType.USAGE_UPDATED, payload);
    }

    private void emitDecision(String sessionId, ToolCall call, SecurityDecision decision) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolCallId", call.getId());
        payload.put("toolName", call.getName());
        payload.put("outcome", decision.getOutcome().name());
        payload.put("baseTier", decision.getBaseTier().name());
        payload.put("effectiveTier", decision.getEffectiveTier().name());
        if (decision.getMatchedPattern() != null) {
            payload.put("matchedPattern", decision.getMatchedPattern());
        }
        payload.put("arguments", call.getRawArguments() != null ? call.getRawArguments() : "");
        runtimeEventService.emit(sessionId, RuntimeEventType.TOOL_CALL_DECIDED, payload);
    }

    private Verdict evaluate(AgentSession session, Turn turn) {
        Verdict verdict = goalEvaluator.evaluate(session, session.getGoal());
        session.setLastVerdict(verdict);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("turnIndex", turn.getIndex());
        payload.put("kind", verdict.getKind().name());
        payload.put("source", verdict.getSource() != null ? verdict.getSource().name() : null);
        payload.put("confidence", verdict.getConfidence());
        payload.put("score", verdict.getScore());
        payload.put("reason", verdict.getReason());
        runtimeEventService.emit(session.getId(), RuntimeEventType.VERDICT, payload);
        log.debug("[Loop] Session {} turn {} verdict {}: {}", session.getId(), turn.getIndex(), verdict.getKind(),
                verdict.getReason());
        return verdict;
    }

    private void applyVerdict(ActiveRun run, Verdict verdict) {
        AgentSession session = run.session;
        switch (verdict.getKind()) {
        case ACCEPT -> {
            session.setFinalOutput(session.getLatestOutput());
            finish(run, AgentSession.Status.COMPLETED, null);
        }
        case ESCALATE -> finish(run, AgentSession.Status.FAILED, "Escalated: " + verdict.getReason());
        case RETRY -> {
            StringBuilder feedback = new StringBuilder("[Evaluator] The goal is not met yet: ")
                    .append(verdict.getReason());
            if (verdict.getHint() != null && !verdict.getHint().isBlank()) {
                feedback.append("\nHint: ").append(verdict.getHint());
            }
            session.addMessage(Message.user(feedback.toString(), clock.instant()));
            checkpoint(run);
        }
        default -> {
            if (verdict.getHint() != null && !verdict.getHint().isBlank()) {
                session.addMessage(Message.advisory("[Evaluator] " + verdict.getHint(), clock.instant()));
                checkpoint(run);
            }
        }
        }
    }

    private void checkpoint(ActiveRun run) {
        AgentSession session = run.session;
        Instant now = clock.instant();
        session.setActiveMillis(activeMillis(run));
        session.setUpdatedAt(now);
        sessionPort.save(session);
        publish(run);
        if (session.getTurns().isEmpty()) {
            return;
        }
        Checkpoint checkpoint = checkpointService.save(session);
        runtimeEventService.emit(session.getId(), RuntimeEventType.CHECKPOINT_SAVED,
                Map.of("turnIndex", checkpoint.getTurnIndex()));
    }

    private void publish(ActiveRun run) {
        try {
            run.snapshot = objectMapper.convertValue(run.session, AgentSession.class);
        } catch (IllegalArgumentException e) {
            log.warn("[Loop] Could not snapshot session {}: {}", run.session.getId(), e.getMessage());
        }
    }

    private void checkLimits(ActiveRun run) {
        AgentSession session = run.session;
        int maxTurns = session.getMaxTurns() != null ? session.getMaxTurns() : properties.getMaxTurns();
        if (maxTurns > 0 && session.getTurns().size() >= maxTurns) {
            throw new ConstraintViolationException("Turn limit reached (" + maxTurns + ")");
        }
        long maxMillis = maxDurationMillis(session);
        if (maxMillis > 0 && activeMillis(run) >= maxMillis) {
            throw new ConstraintViolationException(
                    "Time limit reached (" + TimeUnit.MILLISECONDS.toSeconds(maxMillis) + "s)");
        }
    }

    private void finishOnLimit(ActiveRun run, String reason) {
        log.warn("[Loop] Session {}: {}", run.session.getId(), reason);
        if (properties.isCompleteOnLimit()) {
            run.session.setFinalOutput(run.session.getLatestOutput());
            finish(run, AgentSession.Status.COMPLETED, reason);
        } else {
            finish(run, AgentSession.Status.FAILED, reason);
        }
    }

    private void finish(ActiveRun run, AgentSession.Status status, String reason) {
        AgentSession session = run.session;
        String sessionId = session.getId();
        if (run.scope != null) {
            run.scope.cancel();
        }
        Instant now = clock.instant();
        session.setStatus(status);
        session.setFailureReason(reason);
        session.setActiveMillis(activeMillis(run));
        session.setCompletedAt(now);
        session.setUpdatedAt(now);
        session.setArchived(true);
        session.setArchivedAt(now);
        sessionPort.save(session);
        publish(run);
        checkpointService.delete(sessionId);
        approvalBroker.cancelSession(sessionId);

        RuntimeEventType type = switch (status) {
        case COMPLETED -> RuntimeEventType.RUN_COMPLETED;
        case CANCELLED -> RuntimeEventType.RUN_CANCELLED;
        default -> RuntimeEventType.RUN_FAILED;
        };
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status.name());
        payload.put("turns", session.getTurns().size());
        if (reason != null) {
            payload.put("reason", reason);
        }
        if (session.getFinalOutput() != null) {
            payload.put("output", session.getFinalOutput());
        }
        runtimeEventService.emit(sessionId, type, payload);

        if (status == AgentSession.Status.COMPLETED) {
            log.info("[Loop] Session {} completed after {} turns", sessionId, session.getTurns().size());
        } else {
            log.warn("[Loop] Session {} {} after {} turns: {}", sessionId, status, session.getTurns().size(),
                    reason);
        }
    }

    private long activeMillis(ActiveRun run) {
        return run.priorActiveMillis + Math.max(0, clock.millis() - run.startedAtMillis);
    }

    private long maxDurationMillis(AgentSession session) {
        long seconds = session.getMaxDurationSeconds() != null ? session.getMaxDurationSeconds()
                : properties.getMaxDurationSeconds();
        return TimeUnit.SECONDS.toMillis(seconds);
    }

    private Instant turnDeadline(ActiveRun run) {
        long maxMillis = maxDurationMillis(run.session);
        if (maxMillis <= 0) {
            return clock.instant().plus(UNBOUNDED_TURN);
        }
        return clock.instant().plusMillis(Math.max(0, maxMillis - activeMillis(run)));
    }

    private Duration modelTimeout(ActiveRun run) {
        long timeoutMillis = TimeUnit.SECONDS.toMillis(properties.getModelTimeoutSeconds());
        long maxMillis = maxDurationMillis(run.session);
        if (maxMillis > 0) {
            timeoutMillis = Math.min(timeoutMillis, Math.max(1, maxMillis - activeMillis(run)));
        }
        return Duration.ofMillis(timeoutMillis);
    }

    private static final class ActiveRun {
        private final AgentSession session;
        private volatile boolean cancelled;
        private volatile TurnScope scope;
        private volatile AgentSession snapshot;
        private long startedAtMillis;
        private long priorActiveMillis;

        private ActiveRun(AgentSession session) {
            this.session = session;
            this.snapshot = session;
        }

        private void cancel() {
            cancelled = true;
            TurnScope current = scope;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
