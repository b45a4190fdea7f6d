package me.golemcore.warden.adapter.inbound.web.controller;

import me.golemcore.warden.adapter.inbound.web.dto.ApprovalResolutionRequest;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalRequest;
import me.golemcore.warden.domain.model.ApprovalStatus;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.service.ApprovalBroker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ApprovalsControllerTest {

    private ApprovalBroker broker;
    private ApprovalsController controller;

    @BeforeEach
    void setUp() {
        broker = mock(ApprovalBroker.class);
        controller = new ApprovalsController(broker);
    }

    @Test
    void shouldListPendingForSession() {
        when(broker.listPending("s1")).thenReturn(List.of(ApprovalRequest.builder()
                .id("abc123")
                .sessionId("s1")
                .toolName("shell")
                .tier(SecurityTier.T2)
                .summary("shell: git push")
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .deadline(Instant.parse("2026-01-01T00:01:00Z"))
                .status(ApprovalStatus.PENDING)
                .build()));

        StepVerifier.create(controller.listPending("s1"))
                .assertNext(response -> {
                    assertEquals(1, response.getBody().size());
                    assertEquals("T2", response.getBody().get(0).getTier());
                    assertEquals("2026-01-01T00:01:00Z", response.getBody().get(0).getDeadline());
                })
                .verifyComplete();
    }

    @Test
    void shouldResolveByUniquePrefix() {
        when(broker.findByPrefix("abc")).thenReturn(Optional.of("abc123"));
        when(broker.resolve("abc123", ApprovalDecision.DENY, "too risky")).thenReturn(true);

        StepVerifier.create(controller.resolve("abc",
                ApprovalResolutionRequest.builder().decision("no").reason("too risky").build()))
                .assertNext(response -> {
                    assertEquals("abc123", response.getBody().getRequestId());
                    assertEquals("DENIED", response.getBody().getStatus());
                })
                .verifyComplete();
        verify(broker).resolve("abc123", ApprovalDecision.DENY, "too risky");
    }

    @Test
    void shouldRejectUnknownDecision() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.resolve("abc",
                ApprovalResolutionRequest.builder().decision("maybe").build()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verifyNoInteractions(broker);
    }

    @Test
    void shouldReturnNotFoundWhenAlreadyResolved() {
        when(broker.findByPrefix("abc")).thenReturn(Optional.of("abc123"));
        when(broker.resolve("abc123", ApprovalDecision.APPROVE, null)).thenReturn(false);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.resolve("abc",
                ApprovalResolutionRequest.builder().decision("approve").build()));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
