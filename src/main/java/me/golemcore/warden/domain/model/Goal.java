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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared success definition for a run. Set when the session starts and read
 * only afterwards. A {@code null} threshold or floor falls back to the
 * configured judge defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Goal {

    private String description;

    @Builder.Default
    private List<SuccessCriterion> criteria = new ArrayList<>();

    @Builder.Default
    private List<Constraint> constraints = new ArrayList<>();

    private Double successThreshold;
    private Double confidenceFloor;

    @JsonIgnore
    public boolean hasLlmJudge() {
        return criteria != null && criteria.stream().anyMatch(c -> c.getType() == CriterionType.LLM_JUDGE);
    }

    @JsonIgnore
    public double totalWeight() {
        if (criteria == null) {
            return 0.0;
        }
        return criteria.stream().mapToDouble(c -> Math.max(0.0, c.getWeight())).sum();
    }
}
