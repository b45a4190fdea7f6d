package me.golemcore.warden.domain.loop;

import me.golemcore.warden.domain.service.CheckpointService;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunRecoveryServiceTest {

    private CheckpointService checkpointService;
    private AgentLoop agentLoop;
    private WardenProperties properties;
    private RunRecoveryService recoveryService;

    @BeforeEach
    void setUp() {
        checkpointService = mock(CheckpointService.class);
        agentLoop = mock(AgentLoop.class);
        properties = new WardenProperties();
        recoveryService = new RunRecoveryService(checkpointService, agentLoop, properties);
    }

    @Test
    void shouldResumeEveryCheckpointedSession() {
        when(checkpointService.listCheckpointedSessions()).thenReturn(List.of("a", "b", "c"));
        when(agentLoop.resumeAsync("b")).thenThrow(new IllegalStateException("Session already running: b"));

        int resumed = recoveryService.recoverAll();

        assertEquals(2, resumed);
        verify(agentLoop).resumeAsync("a");
        verify(agentLoop).resumeAsync("c");
    }

    @Test
    void shouldSkipRecoveryOnStartupUnlessEnabled() {
        when(checkpointService.listCheckpointedSessions()).thenReturn(List.of("a"));

        recoveryService.onApplicationReady();

        verify(agentLoop, never()).resumeAsync(anyString());
    }

    @Test
    void shouldRecoverOnStartupWhenEnabled() {
        properties.getLoop().setResumeOnStartup(true);
        when(checkpointService.listCheckpointedSessions()).thenReturn(List.of("a"));

        recoveryService.onApplicationReady();

        verify(agentLoop).resumeAsync("a");
    }
}
