package me.golemcore.warden.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A named capability the model can invoke. Implementations declare a base risk
 * tier and a JSON schema for their input; the security gate classifies every
 * call against both before {@link #execute} is ever reached.
 *
 * <p>
 * Implementations must be safe to call concurrently. Cancelling the returned
 * future means the execution must stop: a process-backed tool destroys its
 * process rather than abandoning it.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Base risk tier of this tool before argument inspection.
     *
     * @return the declared tier
     */
    SecurityTier getDeclaredTier();

    /**
     * Executes the tool with arguments that already passed the security gate.
     *
     * @param parameters
     *            the parsed arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Schema of the input object, or {@code null} to accept any object.
     */
    default Map<String, Object> getInputSchema() {
        return getDefinition().getInputSchema();
    }

    /**
     * Extra attempts after a failed execution. Policy violations and timeouts are
     * never retried.
     */
    default int getMaxRetries() {
        return 0;
    }
}
