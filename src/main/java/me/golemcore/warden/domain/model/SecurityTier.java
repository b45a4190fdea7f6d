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
 * Ordinal risk classification assigned to a tool call. {@code T0} is safe,
 * {@code T4} is critical. Ordering follows declaration order.
 */
public enum SecurityTier {

    /** Read-only, side-effect free. */
    T0,

    /** Local reads or reversible writes. */
    T1,

    /** Workspace writes, outbound network. */
    T2,

    /** Arbitrary command execution. */
    T3,

    /** Destructive or privilege-escalating. */
    T4;

    public boolean isAbove(SecurityTier other) {
        return compareTo(other) > 0;
    }

    public boolean isAtMost(SecurityTier other) {
        return compareTo(other) <= 0;
    }

    public static SecurityTier max(SecurityTier a, SecurityTier b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static SecurityTier min(SecurityTier a, SecurityTier b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @JsonCreator
    public static SecurityTier parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Security tier must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("T")) {
            normalized = "T" + normalized;
        }
        return SecurityTier.valueOf(normalized);
    }
}
