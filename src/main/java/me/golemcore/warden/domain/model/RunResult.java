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
import lombok.Value;

/**
 * Terminal summary of a run.
 */
@Value
@Builder
public class RunResult {

    String sessionId;
    AgentSession.Status status;
    int turns;
    String output;
    String reason;
    Verdict lastVerdict;

    public static RunResult of(AgentSession session) {
        return RunResult.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .turns(session.getTurns().size())
                .output(session.getFinalOutput())
                .reason(session.getFailureReason())
                .lastVerdict(session.getLastVerdict())
                .build();
    }
}
