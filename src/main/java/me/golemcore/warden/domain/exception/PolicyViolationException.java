package me.golemcore.warden.domain.exception;

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

import me.golemcore.warden.domain.model.ToolFailureKind;

/**
 * A call was refused by policy: denied by the gate, denied by a human or left
 * unanswered past the approval deadline. Never retried.
 */
public class PolicyViolationException extends AgentRuntimeException {

    private static final long serialVersionUID = 1L;

    private final ToolFailureKind failureKind;

    public PolicyViolationException(ToolFailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public ToolFailureKind getFailureKind() {
        return failureKind;
    }
}
