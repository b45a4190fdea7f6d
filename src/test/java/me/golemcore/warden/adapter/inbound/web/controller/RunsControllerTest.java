package me.golemcore.warden.adapter.inbound.web.controller;

import me.golemcore.warden.adapter.inbound.web.dto.RunSummaryDto;
import me.golemcore.warden.adapter.inbound.web.dto.StartRunRequest;
import me.golemcore.warden.domain.loop.AgentLoop;
import me.golemcore.warden.domain.loop.RunHandle;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.GateOutcome;
import me.golemcore.warden.domain.model.RunRequest;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.service.DecisionLogService;
import me.golemcore.warden.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunsControllerTest {

    private AgentLoop agentLoop;
    private SessionPort sessionPort;
    private DecisionLogService decisionLogService;
    private RunsController controller;

    @BeforeEach
    void setUp() {
        agentLoop = mock(AgentLoop.class);
        sessionPort = mock(SessionPort.class);
        decisionLogService = mock(DecisionLogService.class);
        controller = new RunsController(agentLoop, sessionPort, decisionLogService);
    }

    // ==================== start ====================

    @Test
    void shouldStartRunAndReturnAccepted() {
        AgentSession session = session("run-1", Instant.parse("2026-01-01T00:00:00Z"));
        when(agentLoop.submit(any())).thenReturn(new RunHandle("run-1", new CompletableFuture<>()));
        when(agentLoop.getSession("run-1")).thenReturn(Optional.of(session));
        when(agentLoop.isRunning("run-1")).thenReturn(true);

        StartRunRequest request = StartRunRequest.builder().prompt("Fix   the\nbuild").maxTurns(5).build();

        StepVerifier.create(controller.startRun(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    RunSummaryDto body = response.getBody();
                    assertEquals("run-1", body.getId());
                    assertTrue(body.isRunning());
                    assertEquals("Fix the build", body.getPreview());
                })
                .verifyComplete();
        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(agentLoop).submit(captor.capture());
        assertEquals(5, captor.getValue().getMaxTurns());
    }

    @Test
    void shouldRejectBlankPrompt() {
        StartRunRequest request = StartRunRequest.builder().prompt(" ").build();

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.startRun(request));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    // ==================== queries ====================

    @Test
    void shouldListRunsNewestFirst() {
        when(sessionPort.listAll()).thenReturn(List.of(
                session("old", Instant.parse("2026-01-01T00:00:00Z")),
                session("new", Instant.parse("2026-02-01T00:00:00Z"))));

        StepVerifier.create(controller.listRuns())
                .assertNext(response -> assertEquals(List.of("new", "old"),
                        response.getBody().stream().map(RunSummaryDto::getId).toList()))
                .verifyComplete();
    }

    @Test
    void shouldListActiveRunsFromLoopSnapshot() {
        AgentSession cached = session("active", Instant.parse("2026-01-01T00:00:00Z"));
        AgentSession snapshot = session("active", Instant.parse("2026-01-01T00:00:00Z"));
        snapshot.setStatus(AgentSession.Status.CANCELLED);
        when(sessionPort.listAll()).thenReturn(List.of(cached));
        when(agentLoop.isRunning("active")).thenReturn(true);
        when(agentLoop.getSession("active")).thenReturn(Optional.of(snapshot));

        StepVerifier.create(controller.listRuns())
                .assertNext(response -> assertEquals("CANCELLED", response.getBody().get(0).getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldReturnRunDetail() {
        AgentSession session = session("run-1", Instant.parse("2026-01-01T00:00:00Z"));
        session.setStatus(AgentSession.Status.COMPLETED);
        session.setFinalOutput("All green");
        when(agentLoop.getSession("run-1")).thenReturn(Optional.of(session));

        StepVerifier.create(controller.getRun("run-1"))
                .assertNext(response -> {
                    assertEquals("COMPLETED", response.getBody().getStatus());
                    assertEquals("All green", response.getBody().getFinalOutput());
                    assertEquals("2026-01-01T00:00:00Z", response.getBody().getCreatedAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownRun() {
        when(agentLoop.getSession("nope")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.getRun("nope"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertThrows(ResponseStatusException.class, () -> controller.getDecisions("nope"));
    }

    @Test
    void shouldReturnDecisionLog() {
        when(agentLoop.getSession("run-1")).thenReturn(Optional.of(session("run-1", Instant.now())));
        when(decisionLogService.read("run-1")).thenReturn(List.of(SecurityDecision.builder()
                .toolCallId("call_1").outcome(GateOutcome.DENY).build()));

        StepVerifier.create(controller.getDecisions("run-1"))
                .assertNext(response -> assertEquals("call_1", response.getBody().get(0).getToolCallId()))
                .verifyComplete();
    }

    // ==================== control ====================

    @Test
    void shouldResumeRun() {
        when(agentLoop.getSession("run-1")).thenReturn(Optional.of(session("run-1", Instant.now())));

        StepVerifier.create(controller.resumeRun("run-1"))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
        verify(agentLoop).resumeAsync("run-1");
    }

    @Test
    void shouldMapUnknownResumeToNotFound() {
        when(agentLoop.resumeAsync("nope")).thenThrow(new IllegalArgumentException("Unknown session: nope"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.resumeRun("nope"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldCancelActiveRun() {
        when(agentLoop.getSession("run-1")).thenReturn(Optional.of(session("run-1", Instant.now())));
        when(agentLoop.cancel("run-1")).thenReturn(true);

        StepVerifier.create(controller.cancelRun("run-1"))
                .assertNext(response -> assertEquals(HttpStatus.ACCEPTED, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldReturnConflictWhenCancellingFinishedRun() {
        AgentSession session = session("run-1", Instant.now());
        session.setStatus(AgentSession.Status.COMPLETED);
        when(agentLoop.getSession("run-1")).thenReturn(Optional.of(session));
        when(agentLoop.cancel("run-1")).thenReturn(false);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.cancelRun("run-1"));
        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    private static AgentSession session(String id, Instant createdAt) {
        return AgentSession.builder().id(id).prompt("Fix the build").createdAt(createdAt).updatedAt(createdAt)
                .build();
    }
}
