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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.RuntimeEvent;
import me.golemcore.warden.domain.model.RuntimeEventType;
import me.golemcore.warden.domain.model.WatchdogHint;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Observes one session's event stream and produces advisory hints.
 *
 * <p>
 * Detectors:
 * <ul>
 * <li><b>stall</b> - no event for {@code stall-timeout-seconds}</li>
 * <li><b>doom loop</b> - the same tool name and argument signature decided
 * {@code doom-loop-threshold} times within the last
 * {@code doom-loop-window} decisions</li>
 * <li><b>budget</b> - a warning at {@code budget-warn-percent} of
 * {@code budget-tokens}, and an overrun hint once the budget is exceeded</li>
 * </ul>
 * Hints are queued for the loop to pick up at the start of the next turn and
 * published as {@code WATCHDOG_HINT} events. The watchdog never touches the
 * session and never blocks a call.
 */
@Slf4j
public class GuardianWatchdog implements AutoCloseable {

    public static final String STALL = "stall";
    public static final String DOOM_LOOP = "doom_loop";
    public static final String BUDGET_WARNING = "budget_warning";
    public static final String BUDGET_OVERRUN = "budget_overrun";

    static final int SIGNATURE_PREFIX_LENGTH = 200;
    private static final long FLUSH_TIMEOUT_MILLIS = 1000;

    private final String sessionId;
    private final WardenProperties.GuardianProperties properties;
    private final RuntimeEventService runtimeEventService;
    private final ScheduledExecutorService executor;
    private final ObjectMapper signatureMapper;
    private final Clock clock;
    private final Queue<WatchdogHint> hints = new ConcurrentLinkedQueue<>();

    // Guardian-thread state
    private final Deque<String> recentSignatures = new ArrayDeque<>();
    private long lastEventAtMillis;
    private long tokens;
    private boolean budgetWarned;
    private boolean budgetOverrun;

    private Disposable subscription;
    private ScheduledFuture<?> stallTask;
    private volatile boolean closed;

    GuardianWatchdog(String sessionId, WardenProperties.GuardianProperties properties,
            RuntimeEventService runtimeEventService, ScheduledExecutorService executor, ObjectMapper signatureMapper,
            Clock clock, long initialTokens) {
        this.sessionId = sessionId;
        this.properties = properties;
        this.runtimeEventService = runtimeEventService;
        this.executor = executor;
        this.signatureMapper = signatureMapper;
        this.clock = clock;
        this.tokens = initialTokens;
        this.lastEventAtMillis = clock.millis();
    }

    static GuardianWatchdog disabled(String sessionId) {
        GuardianWatchdog watchdog = new GuardianWatchdog(sessionId, new WardenProperties.GuardianProperties(),
                null, null, null, Clock.systemUTC(), 0);
        watchdog.closed = true;
        return watchdog;
    }

    void start() {
        subscription = runtimeEventService.stream(sessionId).subscribe(this::enqueue);
        long stallMillis = TimeUnit.SECONDS.toMillis(properties.getStallTimeoutSeconds());
        if (stallMillis > 0) {
            long period = Math.max(50, Math.min(stallMillis / 4, 5000));
            stallTask = executor.scheduleAtFixedRate(this::checkStall, period, period, TimeUnit.MILLISECONDS);
        }
        log.debug("[Guardian] Watching session {}", sessionId);
    }

    /**
     * Returns and clears the hints produced so far. Waits briefly for events
     * already published to be processed, so a hint triggered by the previous
     * turn is never missed.
     */
    public List<WatchdogHint> drainHints() {
        if (!closed) {
            flush();
        }
        List<WatchdogHint> drained = new ArrayList<>();
        WatchdogHint hint;
        while ((hint = hints.poll()) != null) {
            drained.add(hint);
        }
        return drained;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (subscription != null) {
            subscription.dispose();
        }
        if (stallTask != null) {
            stallTask.cancel(false);
        }
        log.debug("[Guardian] Stopped watching session {}", sessionId);
    }

    private void enqueue(RuntimeEvent event) {
        if (event.getType() == RuntimeEventType.WATCHDOG_HINT) {
            return;
        }
        try {
            executor.execute(() -> process(event));
        } catch (RejectedExecutionException e) {
            log.debug("[Guardian] Executor stopped, dropping event {}", event.getType());
        }
    }

    private void flush() {
        try {
            executor.submit(() -> {
            }).get(FLUSH_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.debug("[Guardian] Flush for session {} incomplete: {}", sessionId, e.toString());
        }
    }

    void process(RuntimeEvent event) {
        if (closed) {
            return;
        }
        lastEventAtMillis = clock.millis();
        switch (event.getType()) {
        case TOOL_CALL_DECIDED -> onToolCall(event);
        case USAGE_UPDATED -> onUsage(event);
        case RUN_COMPLETED, RUN_FAILED, RUN_CANCELLED -> reset();
        default -> {
            // progress only
        }
        }
    }

    private void onToolCall(RuntimeEvent event) {
        String toolName = String.valueOf(event.get("toolName"));
        String signature = toolName + "|" + truncate(canonicalArguments(event.get("arguments")));
        int window = properties.effectiveDoomLoopWindow();
        recentSignatures.addLast(signature);
        while (recentSignatures.size() > window) {
            recentSignatures.removeFirst();
        }

        int threshold = properties.getDoomLoopThreshold();
        if (threshold <= 0) {
            return;
        }
        long count = recentSignatures.stream().filter(signature::equals).count();
        if (count >= threshold) {
            recentSignatures.removeIf(signature::equals);
            emitHint(DOOM_LOOP, String.format(
                    "[Guardian] You have called '%s' %d times with identical input. "
                            + "The repeated calls are not making progress; try a different approach or different arguments.",
                    toolName, count), Map.of("toolName", toolName, "count", count));
        }
    }

    private void onUsage(RuntimeEvent event) {
        tokens += asLong(event.get("inputTokens")) + asLong(event.get("outputTokens"));
        long budget = properties.getBudgetTokens();
        if (budget <= 0) {
            return;
        }
        long warnAt = budget * properties.getBudgetWarnPercent() / 100;
        if (!budgetOverrun && tokens > budget) {
            budgetOverrun = true;
            budgetWarned = true;
            emitHint(BUDGET_OVERRUN, String.format(
                    "[Guardian] Token budget exceeded: %d of %d tokens used. Wrap up now and summarize your results.",
                    tokens, budget), Map.of("tokens", tokens, "budget", budget));
        } else if (!budgetWarned && tokens >= warnAt) {
            budgetWarned = true;
            emitHint(BUDGET_WARNING, String.format(
                    "[Guardian] Token budget warning: %d of %d tokens used (%d%%). Start wrapping up.",
                    tokens, budget, tokens * 100 / budget), Map.of("tokens", tokens, "budget", budget));
        }
    }

    private void checkStall() {
        if (closed) {
            return;
        }
        long now = clock.millis();
        long stallMillis = TimeUnit.SECONDS.toMillis(properties.getStallTimeoutSeconds());
        long idle = now - lastEventAtMillis;
        if (idle >= stallMillis) {
            lastEventAtMillis = now;
            emitHint(STALL, String.format(
                    "[Guardian] No progress detected for %ds. Consider a different approach or summarize what you have.",
                    TimeUnit.MILLISECONDS.toSeconds(idle)), Map.of("idleSeconds", TimeUnit.MILLISECONDS.toSeconds(idle)));
        }
    }

    private void reset() {
        recentSignatures.clear();
        tokens = 0;
        budgetWarned = false;
        budgetOverrun = false;
    }

    private void emitHint(String detector, String message, Map<String, Object> details) {
        WatchdogHint hint = new WatchdogHint(detector, message, clock.instant());
        hints.add(hint);
        log.warn("[Guardian] {} hint for session {}: {}", detector, sessionId, message);
        Map<String, Object> payload = new LinkedHashMap<>(details);
        payload.put("detector", detector);
        payload.put("message", message);
        runtimeEventService.emit(sessionId, RuntimeEventType.WATCHDOG_HINT, payload);
    }

    /**
     * Re-serialises JSON arguments with sorted keys and no insignificant
     * whitespace, so formatting differences do not hide a repeated call. Text
     * that is not JSON is compared as-is.
     */
    private String canonicalArguments(Object arguments) {
        if (arguments == null) {
            return "";
        }
        try {
            Object parsed = arguments instanceof String text ? signatureMapper.readValue(text, Object.class)
                    : arguments;
            return signatureMapper.writeValueAsString(parsed);
        } catch (JsonProcessingException e) {
            return arguments.toString();
        }
    }

    private static String truncate(String text) {
        return text.length() > SIGNATURE_PREFIX_LENGTH ? text.substring(0, SIGNATURE_PREFIX_LENGTH) : text;
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
