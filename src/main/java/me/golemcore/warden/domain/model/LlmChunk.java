package me.golemcore.warden.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One delta of a streamed model response.
 *
 * <p>
 * A tool call arrives as a {@code TOOL_CALL_START} carrying its id and name,
 * followed by any number of {@code TOOL_CALL_DELTA} fragments of its argument
 * text, correlated by {@code index}.
 */
@Data
@Builder
public class LlmChunk {

    public enum Type {
        TEXT, TOOL_CALL_START, TOOL_CALL_DELTA, USAGE, END_TURN
    }

    private Type type;
    private int index;
    private String text;
    private String toolCallId;
    private String toolName;
    private List<String> dependsOn;
    private long inputTokens;
    private long outputTokens;
    private String stopReason;

    public static LlmChunk text(String text) {
        return LlmChunk.builder().type(Type.TEXT).text(text).build();
    }

    public static LlmChunk toolCallStart(int index, String id, String name) {
        return LlmChunk.builder().type(Type.TOOL_CALL_START).index(index).toolCallId(id).toolName(name).build();
    }

    public static LlmChunk toolCallDelta(int index, String fragment) {
        return LlmChunk.builder().type(Type.TOOL_CALL_DELTA).index(index).text(fragment).build();
    }

    public static LlmChunk usage(long inputTokens, long outputTokens) {
        return LlmChunk.builder().type(Type.USAGE).inputTokens(inputTokens).outputTokens(outputTokens).build();
    }

    public static LlmChunk endTurn(String stopReason) {
        return LlmChunk.builder().type(Type.END_TURN).stopReason(stopReason).build();
    }
}
