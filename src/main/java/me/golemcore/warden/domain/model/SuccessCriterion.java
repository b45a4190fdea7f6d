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

/**
 * One weighted success criterion of a goal.
 *
 * <p>
 * Which fields are meaningful depends on {@link #type}: {@code pattern} and
 * {@code caseSensitive} for OUTPUT_CONTAINS, {@code expected} for
 * OUTPUT_EQUALS, {@code name} for CUSTOM, {@code prompt} for LLM_JUDGE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuccessCriterion {

    private String id;
    private CriterionType type;

    @Builder.Default
    private double weight = 1.0;

    private String description;
    private String pattern;
    private boolean caseSensitive;
    private String expected;
    private String name;
    private String prompt;

    public static SuccessCriterion outputContains(String id, String pattern, double weight) {
        return SuccessCriterion.builder()
                .id(id)
                .type(CriterionType.OUTPUT_CONTAINS)
                .pattern(pattern)
                .weight(weight)
                .description("Output contains '" + pattern + "'")
                .build();
    }

    public static SuccessCriterion outputEquals(String id, String expected, double weight) {
        return SuccessCriterion.builder()
                .id(id)
                .type(CriterionType.OUTPUT_EQUALS)
                .expected(expected)
                .weight(weight)
                .description("Output equals expected text")
                .build();
    }

    public static SuccessCriterion custom(String id, String name, double weight) {
        return SuccessCriterion.builder()
                .id(id)
                .type(CriterionType.CUSTOM)
                .name(name)
                .weight(weight)
                .description("Custom check '" + name + "'")
                .build();
    }

    public static SuccessCriterion llmJudge(String id, String prompt, double weight) {
        return SuccessCriterion.builder()
                .id(id)
                .type(CriterionType.LLM_JUDGE)
                .prompt(prompt)
                .weight(weight)
                .description(prompt)
                .build();
    }
}
