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
 * Terminal answer for an approval request.
 */
public record ApprovalOutcome(String requestId, ApprovalStatus status, String reason) {

    public boolean isApproved() {
        return status == ApprovalStatus.APPROVED;
    }

    public ToolFailureKind toFailureKind() {
        return status == ApprovalStatus.TIMED_OUT ? ToolFailureKind.APPROVAL_TIMED_OUT
                : ToolFailureKind.APPROVAL_DENIED;
    }
}
