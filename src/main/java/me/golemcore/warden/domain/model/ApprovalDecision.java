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

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Answer an external approver submits for a pending request.
 */
public enum ApprovalDecision {
    APPROVE, DENY;

    @JsonCreator
    public static ApprovalDecision parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Approval decision must not be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "approve", "approved", "yes" -> APPROVE;
        case "deny", "denied", "no" -> DENY;
        default -> throw new IllegalArgumentException("Unknown approval decision: " + value);
        };
    }

    public ApprovalStatus toStatus() {
        return this == APPROVE ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED;
    }
}
