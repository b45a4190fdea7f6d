package me.golemcore.warden.security;

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

import me.golemcore.warden.domain.model.ToolCall;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds a short human-readable description of a tool call for approval
 * prompts: the command of shell-like tools, the path of file tools, the query
 * of search tools, and truncated arguments otherwise.
 */
@Component
public class ActionSummarizer {

    private static final String UNKNOWN = "unknown";
    private static final int MAX_LENGTH = 120;

    public String describe(ToolCall call) {
        Map<String, Object> args = call.getArguments();
        if (args == null) {
            return call.getName() + ": " + truncate(call.getRawArguments() != null ? call.getRawArguments() : "");
        }
        if (args.get("command") instanceof String command) {
            return "Run command: " + truncate(command);
        }
        if (args.get("path") instanceof String path) {
            Object operation = args.getOrDefault("operation", call.getName());
            return "File " + operation + ": " + truncate(path);
        }
        if (args.get("query") instanceof String query) {
            return "Search: " + truncate(query);
        }
        if (args.get("url") instanceof String url) {
            return "Fetch: " + truncate(url);
        }
        String name = call.getName() != null ? call.getName() : UNKNOWN;
        return name + ": " + truncate(String.valueOf(args));
    }

    private String truncate(String text) {
        if (text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_LENGTH) + "...";
    }
}
