package me.golemcore.warden.security;

import me.golemcore.warden.domain.exception.SchemaException;
import me.golemcore.warden.domain.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentSchemaValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "path", Map.of("type", "string"),
                    "mode", Map.of("type", "string", "enum", List.of("read", "write")),
                    "lines", Map.of("type", "array", "items", Map.of("type", "integer"))),
            "required", List.of("path"),
            "additionalProperties", false);

    private final ArgumentSchemaValidator validator = new ArgumentSchemaValidator();

    @Test
    void shouldAcceptValidArguments() {
        ToolCall call = call(Map.of("path", "a.txt", "mode", "read", "lines", List.of(1, 2)));

        assertDoesNotThrow(() -> validator.validate(call, SCHEMA));
    }

    @Test
    void shouldRejectUnparsedArguments() {
        ToolCall call = ToolCall.builder().id("c1").name("file").rawArguments("{oops").build();

        SchemaException error = assertThrows(SchemaException.class, () -> validator.validate(call, null));

        assertEquals(List.of("arguments are not a valid JSON object"), error.getErrors());
    }

    @Test
    void shouldCollectAllViolations() {
        ToolCall call = call(Map.of("mode", "delete", "lines", List.of("x"), "force", true));

        SchemaException error = assertThrows(SchemaException.class, () -> validator.validate(call, SCHEMA));

        List<String> errors = error.getErrors();
        assertEquals(4, errors.size(), errors.toString());
        assertTrue(errors.contains("$: missing required property 'path'"));
        assertTrue(errors.stream().anyMatch(e -> e.startsWith("$.mode: value delete")));
        assertTrue(errors.contains("$.lines[0]: expected integer but was string"));
        assertTrue(errors.contains("$: unexpected property 'force'"));
    }

    @Test
    void shouldAcceptAnyObjectWithoutSchema() {
        assertDoesNotThrow(() -> validator.validate(call(Map.of("anything", 1)), null));
    }

    private static ToolCall call(Map<String, Object> args) {
        return ToolCall.builder().id("c1").name("file").rawArguments("{}").arguments(args).build();
    }
}
