package me.golemcore.warden.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.SecurityTier;
import me.golemcore.warden.domain.model.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps tool names to their capabilities. Populated from tool beans at startup
 * and refreshed incrementally through {@link #register} and
 * {@link #unregister}.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();

    public ToolRegistry(ObjectProvider<ToolComponent> toolComponents) {
        toolComponents.orderedStream().forEach(this::register);
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public void register(ToolComponent tool) {
        if (tool == null || !tool.isEnabled()) {
            return;
        }
        ToolComponent previous = tools.put(tool.getToolName(), tool);
        if (previous != null && previous != tool) {
            log.info("[Tools] Replaced tool: {}", tool.getToolName());
        } else {
            log.debug("[Tools] Registered tool: {} ({})", tool.getToolName(), tool.getDeclaredTier());
        }
    }

    public boolean unregister(String toolName) {
        boolean removed = tools.remove(toolName) != null;
        if (removed) {
            log.info("[Tools] Unregistered tool: {}", toolName);
        }
        return removed;
    }

    public Optional<ToolComponent> find(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(toolName));
    }

    public Optional<SecurityTier> declaredTier(String toolName) {
        return find(toolName).map(ToolComponent::getDeclaredTier);
    }

    public Map<String, Object> schema(String toolName) {
        return find(toolName).map(ToolComponent::getInputSchema).orElse(null);
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .sorted(Comparator.comparing(ToolDefinition::getName))
                .toList();
    }

    public int size() {
        return tools.size();
    }
}
