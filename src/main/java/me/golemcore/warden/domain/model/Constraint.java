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
 * A limit the run must stay within. Hard constraints end the run when
 * violated; soft ones only produce advisory text.
 *
 * <p>
 * {@code limit} is measured in seconds for TIME, total tokens for COST and
 * completed turns for TURNS. The remaining categories are descriptive and are
 * passed to the judge as context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Constraint {

    public enum Category {
        TIME, COST, TURNS, SAFETY, SCOPE, QUALITY;

        public boolean isMeasurable() {
            return this == TIME || this == COST || this == TURNS;
        }
    }

    public enum Kind {
        HARD, SOFT
    }

    private Category category;

    @Builder.Default
    private Kind kind = Kind.HARD;

    private String description;
    private Double limit;

    public boolean isHard() {
        return kind == Kind.HARD;
    }

    public static Constraint hard(Category category, double limit, String description) {
        return new Constraint(category, Kind.HARD, description, limit);
    }

    public static Constraint soft(Category category, double limit, String description) {
        return new Constraint(category, Kind.SOFT, description, limit);
    }
}
