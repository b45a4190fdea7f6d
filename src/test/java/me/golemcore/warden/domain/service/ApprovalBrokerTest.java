package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalOutcome;
import me.golemcore.warden.domain.model.ApprovalRequest;
import me.golemcore.warden.domain.model.ApprovalStatus;
import me.golemcore.warden.domain.model.GateOutcome;
import me.golemcore.warden.domain.model.RuntimeEvent;
import me.golemcore.warden.domain.model.RuntimeEventType;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.ToolFailureKind;
import me.golemcore.warden.security.ActionSummarizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApprovalBrokerTest {

    private static final String SESSION_ID = "session-1";

    private RuntimeEventService events;
    private ApprovalBroker broker;
    private List<RuntimeEvent> published;
    private Disposable subscription;

    @BeforeEach
    void setUp() {
        events = new RuntimeEventService(Clock.systemUTC());
        broker = new ApprovalBroker(events, new ActionSummarizer(), Clock.systemUTC());
        published = new CopyOnWriteArrayList<>();
        subscription = events.stream().subscribe(published::add);
    }

    @AfterEach
    void tearDown() {
        subscription.dispose();
        broker.destroy();
    }

    // ==================== timeout ====================

    @Test
    void shouldTimeOutWhenNobodyResolves() throws Exception {
        CompletableFuture<ApprovalOutcome> future = broker.requestApproval(SESSION_ID, call("call-1"),
                needsApproval("call-1"), Duration.ofMillis(100));

        ApprovalOutcome outcome = future.get(5, TimeUnit.SECONDS);

        assertEquals(ApprovalStatus.TIMED_OUT, outcome.status());
        assertEquals(ToolFailureKind.APPROVAL_TIMED_OUT, outcome.toFailureKind());
        assertTrue(outcome.toFailureKind().isPolicyViolation());
        assertTrue(broker.listPending().isEmpty());
        assertFalse(broker.resolve(outcome.requestId(), ApprovalDecision.APPROVE, "too late"));
    }

    // ==================== resolution ====================

    @Test
    void shouldCompleteWithResolverDecisionAndPublishEvents() throws Exception {
        CompletableFuture<ApprovalOutcome> future = broker.requestApproval(SESSION_ID, call("call-1"),
                needsApproval("call-1"), Duration.ofSeconds(30));
        ApprovalRequest pending = broker.listPending(SESSION_ID).get(0);

        assertEquals("Run command: ls -la", pending.getSummary());
        assertTrue(broker.resolve(pending.getId(), ApprovalDecision.APPROVE, null));

        ApprovalOutcome outcome = future.get(1, TimeUnit.SECONDS);
        assertTrue(outcome.isApproved());
        assertEquals("Approved", outcome.reason());
        assertEquals(List.of(RuntimeEventType.APPROVAL_REQUESTED, RuntimeEventType.APPROVAL_RESOLVED),
                published.stream().map(RuntimeEvent::getType).toList());
        assertEquals("APPROVED", published.get(1).get("status"));
    }

    @Test
    void shouldIgnoreSecondResolution() throws Exception {
        CompletableFuture<ApprovalOutcome> future = broker.requestApproval(SESSION_ID, call("call-1"),
                needsApproval("call-1"), Duration.ofSeconds(30));
        String id = broker.listPending().get(0).getId();

        assertTrue(broker.resolve(id, ApprovalDecision.DENY, "no"));
        assertFalse(broker.resolve(id, ApprovalDecision.APPROVE, "changed my mind"));

        ApprovalOutcome outcome = future.get(1, TimeUnit.SECONDS);
        assertEquals(ApprovalStatus.DENIED, outcome.status());
        assertEquals("no", outcome.reason());
        assertEquals(ToolFailureKind.APPROVAL_DENIED, outcome.toFailureKind());
    }

    @Test
    void shouldLetExactlyOneConcurrentResolverWin() throws Exception {
        broker.requestApproval(SESSION_ID, call("call-1"), needsApproval("call-1"), Duration.ofSeconds(30));
        String id = broker.listPending().get(0).getId();
        int resolvers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(resolvers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < resolvers; i++) {
                ApprovalDecision decision = i % 2 == 0 ? ApprovalDecision.APPROVE : ApprovalDecision.DENY;
                attempts.add(pool.submit(() -> {
                    start.await();
                    return broker.resolve(id, decision, null);
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, published.stream().filter(e -> e.getType() == RuntimeEventType.APPROVAL_RESOLVED).count());
    }

    @Test
    void shouldRejectDecisionThatDoesNotNeedApproval() {
        SecurityDecision allowed = SecurityDecision.builder()
                .toolCallId("call-1")
                .toolName("shell")
                .outcome(GateOutcome.ALLOW)
                .effectiveTier(SecurityTier.T0)
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> broker.requestApproval(SESSION_ID, call("call-1"), allowed, Duration.ofSeconds(1)));
    }

    // ==================== session cancel and lookup ====================

    @Test
    void shouldTimeOutAllPendingRequestsOfCancelledSession() throws Exception {
        CompletableFuture<ApprovalOutcome> first = broker.requestApproval(SESSION_ID, call("call-1"),
                needsApproval("call-1"), Duration.ofSeconds(30));
        CompletableFuture<ApprovalOutcome> second = broker.requestApproval(SESSION_ID, call("call-2"),
                needsApproval("call-2"), Duration.ofSeconds(30));
        CompletableFuture<ApprovalOutcome> other = broker.requestApproval("other", call("call-3"),
                needsApproval("call-3"), Duration.ofSeconds(30));

        assertEquals(2, broker.cancelSession(SESSION_ID));

        assertEquals(ApprovalStatus.TIMED_OUT, first.get(1, TimeUnit.SECONDS).status());
        assertEquals("Run cancelled", second.get(1, TimeUnit.SECONDS).reason());
        assertFalse(other.isDone());
        assertEquals(1, broker.listPending().size());
    }

    @Test
    void shouldFindRequestByUniquePrefix() {
        broker.requestApproval(SESSION_ID, call("call-1"), needsApproval("call-1"), Duration.ofSeconds(30));
        String id = broker.listPending().get(0).getId();

        assertEquals(id, broker.findByPrefix(id.substring(0, 8)).orElseThrow());
        assertTrue(broker.findByPrefix("").isEmpty());
        assertTrue(broker.findByPrefix("zzzz-not-an-id").isEmpty());
    }

    private static ToolCall call(String id) {
        return ToolCall.builder()
                .id(id)
                .name("shell")
                .rawArguments("{\"command\":\"ls -la\"}")
                .arguments(Map.of("command", "ls -la"))
                .build();
    }

    private static SecurityDecision needsApproval(String callId) {
        return SecurityDecision.builder()
                .toolCallId(callId)
                .toolName("shell")
                .outcome(GateOutcome.NEEDS_APPROVAL)
                .baseTier(SecurityTier.T2)
                .effectiveTier(SecurityTier.T2)
                .build();
    }
}
