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
 * Input for starting a run. A non-null {@code parentSessionId} marks the run as
 * a sub-agent, which tightens the security policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    private String prompt;
    private Goal goal;
    private String parentSessionId;
    private Integer maxTurns;
    private Long maxDurationSeconds;
}
