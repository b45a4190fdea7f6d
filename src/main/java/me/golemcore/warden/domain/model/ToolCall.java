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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One action requested by the model.
 *
 * <p>
 * {@code rawArguments} is the exact argument text the model produced.
 * {@code arguments} holds the parsed object and stays {@code null} when the raw
 * text is not a JSON object. {@code dependsOn} lists ids of calls in the same
 * turn whose results this call needs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    private String id;
    private String name;
    private String rawArguments;
    private Map<String, Object> arguments;
    private SecurityTier declaredTier;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    public boolean hasParsedArguments() {
        return arguments != null;
    }
}
