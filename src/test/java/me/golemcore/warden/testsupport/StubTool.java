package me.golemcore.warden.testsupport;

import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.domain.service.ToolRegistry;
import org.springframework.beans.factory.ObjectProvider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Configurable in-memory tool for tests. Records every invocation.
 */
public class StubTool implements ToolComponent {

    private final String name;
    private final SecurityTier tier;
    private final Map<String, Object> schema;
    private final Function<Map<String, Object>, CompletableFuture<ToolResult>> behavior;
    private final List<Map<String, Object>> invocations = Collections.synchronizedList(new ArrayList<>());
    private int maxRetries;

    public StubTool(String name, SecurityTier tier, Map<String, Object> schema,
            Function<Map<String, Object>, CompletableFuture<ToolResult>> behavior) {
        this.name = name;
        this.tier = tier;
        this.schema = schema;
        this.behavior = behavior;
    }

    public static StubTool echo(String name, SecurityTier tier) {
        return new StubTool(name, tier, null,
                args -> CompletableFuture.completedFuture(ToolResult.success(name + " ok " + args)));
    }

    public static ToolRegistry registry(ToolComponent... tools) {
        @SuppressWarnings("unchecked")
        ObjectProvider<ToolComponent> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenAnswer(invocation -> Arrays.stream(tools));
        return new ToolRegistry(provider);
    }

    public StubTool withMaxRetries(int retries) {
        this.maxRetries = retries;
        return this;
    }

    public List<Map<String, Object>> getInvocations() {
        return invocations;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(name)
                .description("Stub tool " + name)
                .inputSchema(schema)
                .build();
    }

    @Override
    public SecurityTier getDeclaredTier() {
        return tier;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        invocations.add(parameters);
        return behavior.apply(parameters);
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }
}
