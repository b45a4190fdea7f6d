package me.golemcore.warden.domain.service;

import me.golemcore.warden.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.warden.domain.model.GateOutcome;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.infrastructure.config.AutoConfiguration;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionLogServiceTest {

    @TempDir
    Path tempDir;

    private DecisionLogService decisionLog;

    @BeforeEach
    void setUp() {
        WardenProperties properties = new WardenProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        decisionLog = new DecisionLogService(storage, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldAppendDecisionsInOrder() {
        decisionLog.record("s1", decision("call_1", GateOutcome.ALLOW));
        decisionLog.record("s1", decision("call_2", GateOutcome.DENY));
        decisionLog.record("s2", decision("call_3", GateOutcome.ALLOW));

        List<SecurityDecision> decisions = decisionLog.read("s1");

        assertEquals(List.of("call_1", "call_2"), decisions.stream().map(SecurityDecision::getToolCallId).toList());
        assertEquals(GateOutcome.DENY, decisions.get(1).getOutcome());
        assertEquals(SecurityTier.T3, decisions.get(1).getEffectiveTier());
    }

    @Test
    void shouldUseGlobalFileWithoutSession() {
        decisionLog.record(null, decision("call_1", GateOutcome.ALLOW));

        assertTrue(Files.exists(tempDir.resolve("decisions").resolve("_global.jsonl")));
        assertEquals(1, decisionLog.read("").size());
    }

    @Test
    void shouldSkipUnreadableLines() throws Exception {
        decisionLog.record("s1", decision("call_1", GateOutcome.ALLOW));
        Files.writeString(tempDir.resolve("decisions").resolve("s1.jsonl"), "garbage line\n",
                StandardOpenOption.APPEND);
        decisionLog.record("s1", decision("call_2", GateOutcome.ALLOW));

        assertEquals(2, decisionLog.read("s1").size());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertTrue(decisionLog.read("nobody").isEmpty());
    }

    private static SecurityDecision decision(String id, GateOutcome outcome) {
        return SecurityDecision.builder()
                .toolCallId(id)
                .toolName("shell")
                .outcome(outcome)
                .baseTier(SecurityTier.T3)
                .effectiveTier(SecurityTier.T3)
                .reason("test")
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .build();
    }
}
