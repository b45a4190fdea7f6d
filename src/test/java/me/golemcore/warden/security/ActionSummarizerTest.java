package me.golemcore.warden.security;

import me.golemcore.warden.domain.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionSummarizerTest {

    private final ActionSummarizer summarizer = new ActionSummarizer();

    @Test
    void shouldDescribeShellCommand() {
        assertEquals("Run command: ls -la", summarizer.describe(call("shell", Map.of("command", "ls -la"))));
    }

    @Test
    void shouldDescribeFileOperation() {
        assertEquals("File delete: /tmp/a",
                summarizer.describe(call("filesystem", Map.of("operation", "delete", "path", "/tmp/a"))));
    }

    @Test
    void shouldDescribeSearchQuery() {
        assertEquals("Search: kotlin coroutines", summarizer.describe(call("web_search",
                Map.of("query", "kotlin coroutines"))));
    }

    @Test
    void shouldTruncateLongCommands() {
        String summary = summarizer.describe(call("shell", Map.of("command", "x".repeat(500))));

        assertTrue(summary.endsWith("..."));
        assertEquals("Run command: ".length() + 120 + 3, summary.length());
    }

    @Test
    void shouldFallBackToRawArgumentsWhenUnparsed() {
        ToolCall call = ToolCall.builder().id("c").name("shell").rawArguments("{broken").build();

        assertEquals("shell: {broken", summarizer.describe(call));
    }

    private static ToolCall call(String name, Map<String, Object> args) {
        return ToolCall.builder().id("c").name(name).arguments(args).build();
    }
}
