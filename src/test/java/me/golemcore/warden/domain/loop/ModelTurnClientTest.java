package me.golemcore.warden.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.warden.domain.exception.TurnFailureException;
import me.golemcore.warden.domain.model.LlmChunk;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.LlmResponse;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModelTurnClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private LlmPort llmPort;
    private ModelTurnClient client;
    private final LlmRequest request = LlmRequest.builder().sessionId("s1").messages(List.of()).build();

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        WardenProperties.RetryProperties retry = new WardenProperties.RetryProperties();
        retry.setMaxAttempts(3);
        RetryPolicy retryPolicy = new RetryPolicy(retry, millis -> {
        }, () -> 0.5);
        client = new ModelTurnClient(llmPort, retryPolicy, new ObjectMapper());
    }

    // ==================== stream folding ====================

    @Test
    void shouldAssembleTextToolCallsAndUsage() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmChunk.text("Reading "),
                LlmChunk.text("both files."),
                LlmChunk.toolCallStart(0, "call_a", "read_file"),
                LlmChunk.toolCallDelta(0, "{\"path\":"),
                LlmChunk.toolCallStart(1, "call_b", "read_file"),
                LlmChunk.toolCallDelta(1, "{\"path\":\"b.txt\"}"),
                LlmChunk.toolCallDelta(0, "\"a.txt\"}"),
                LlmChunk.usage(120, 30),
                LlmChunk.endTurn("tool_use")));

        LlmResponse response = client.requestStep(request, TIMEOUT, new TurnScope());

        assertEquals("Reading both files.", response.getText());
        assertEquals(List.of("call_a", "call_b"), response.getToolCalls().stream().map(ToolCall::getId).toList());
        assertEquals(Map.of("path", "a.txt"), response.getToolCalls().get(0).getArguments());
        assertEquals(120, response.getInputTokens());
        assertEquals(30, response.getOutputTokens());
        assertEquals("tool_use", response.getStopReason());
    }

    @Test
    void shouldKeepRawTextWhenArgumentsAreNotJson() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmChunk.toolCallStart(0, "call_a", "shell"),
                LlmChunk.toolCallDelta(0, "{\"command\": \"ls"),
                LlmChunk.endTurn("tool_use")));

        ToolCall call = client.requestStep(request, TIMEOUT, new TurnScope()).getToolCalls().get(0);

        assertNull(call.getArguments());
        assertEquals("{\"command\": \"ls", call.getRawArguments());
    }

    @Test
    void shouldTreatBlankArgumentsAsEmptyObject() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmChunk.toolCallStart(0, null, "list_tools"),
                LlmChunk.endTurn("tool_use")));

        ToolCall call = client.requestStep(request, TIMEOUT, new TurnScope()).getToolCalls().get(0);

        assertTrue(call.getArguments().isEmpty());
        assertTrue(call.getId().startsWith("call_"));
    }

    // ==================== failures ====================

    @Test
    void shouldRetryStreamWithoutEndOfTurn() {
        AtomicInteger calls = new AtomicInteger();
        when(llmPort.chatStream(any())).thenAnswer(invocation -> calls.incrementAndGet() == 1
                ? Flux.just(LlmChunk.text("partial"))
                : Flux.just(LlmChunk.text("complete"), LlmChunk.endTurn("end_turn")));

        LlmResponse response = client.requestStep(request, TIMEOUT, new TurnScope());

        assertEquals("complete", response.getText());
        assertEquals(2, calls.get());
    }

    @Test
    void shouldFailTurnAfterTransientErrorsExhaustRetries() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalStateException("503 Service Unavailable")));

        TurnFailureException ex = assertThrows(TurnFailureException.class,
                () -> client.requestStep(request, TIMEOUT, new TurnScope()));

        assertTrue(ex.getMessage().contains("503"));
        verify(llmPort, times(3)).chatStream(any());
    }

    @Test
    void shouldNotRetryPermanentProviderError() {
        when(llmPort.chatStream(any())).thenReturn(Flux.error(new IllegalArgumentException("invalid model name")));

        assertThrows(TurnFailureException.class, () -> client.requestStep(request, TIMEOUT, new TurnScope()));
        verify(llmPort, times(1)).chatStream(any());
    }

    @Test
    void shouldTimeOutHangingStream() {
        when(llmPort.chatStream(any())).thenReturn(Flux.never());

        TurnFailureException ex = assertThrows(TurnFailureException.class,
                () -> client.requestStep(request, Duration.ofMillis(50), new TurnScope()));

        assertTrue(ex.getMessage().contains("timed out"));
    }

    @Test
    void shouldRefuseCancelledScope() {
        TurnScope scope = new TurnScope();
        scope.cancel();

        assertThrows(CancellationException.class, () -> client.requestStep(request, TIMEOUT, scope));
    }
}
