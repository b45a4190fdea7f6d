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
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A regular expression scanned against serialized tool arguments, paired with a
 * human-readable label used in decisions and audit records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DangerousPattern {

    private String pattern;
    private String label;

    public static DangerousPattern of(String pattern, String label) {
        return new DangerousPattern(pattern, label);
    }
}
