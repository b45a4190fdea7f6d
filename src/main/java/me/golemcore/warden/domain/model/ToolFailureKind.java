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

/**
 * Classifies tool failures so the loop and the model can tell a policy refusal
 * from a runtime error.
 */
public enum ToolFailureKind {

    /** Denied by the security gate. */
    POLICY_DENIED,

    /** A human denied the approval request. */
    APPROVAL_DENIED,

    /** No one resolved the approval request before its deadline. */
    APPROVAL_TIMED_OUT,

    /** Arguments could not be parsed or did not match the tool schema. */
    SCHEMA_ERROR,

    /** Tool ran and failed. */
    EXECUTION_FAILED,

    /** Tool exceeded its execution timeout and was terminated. */
    TIMEOUT,

    /** Execution was cancelled by a turn limit or an explicit cancel. */
    CANCELLED,

    /** No tool with the requested name is registered. */
    UNKNOWN_TOOL;

    public boolean isPolicyViolation() {
        return this == POLICY_DENIED || this == APPROVAL_DENIED || this == APPROVAL_TIMED_OUT
                || this == SCHEMA_ERROR || this == UNKNOWN_TOOL;
    }
}
