package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.testsupport.StubTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolRegistryTest {

    @Test
    void shouldExposeDefinitionsSortedByName() {
        ToolRegistry registry = StubTool.registry(StubTool.echo("shell", SecurityTier.T2),
                StubTool.echo("read_file", SecurityTier.T0));

        assertEquals(List.of("read_file", "shell"),
                registry.definitions().stream().map(ToolDefinition::getName).toList());
        assertEquals(Optional.of(SecurityTier.T2), registry.declaredTier("shell"));
    }

    @Test
    void shouldReturnEmptyForUnknownTool() {
        ToolRegistry registry = StubTool.registry();

        assertTrue(registry.find("nope").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertTrue(registry.declaredTier("nope").isEmpty());
        assertEquals(null, registry.schema("nope"));
    }

    @Test
    void shouldReplaceToolWithSameName() {
        ToolRegistry registry = StubTool.registry(StubTool.echo("shell", SecurityTier.T2));
        StubTool replacement = StubTool.echo("shell", SecurityTier.T3);

        registry.register(replacement);

        assertEquals(1, registry.size());
        assertSame(replacement, registry.find("shell").orElseThrow());
    }

    @Test
    void shouldUnregisterTool() {
        ToolRegistry registry = StubTool.registry(StubTool.echo("shell", SecurityTier.T2));

        assertTrue(registry.unregister("shell"));
        assertFalse(registry.unregister("shell"));
        assertEquals(0, registry.size());
    }
}
