package me.golemcore.warden.domain.service;

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

import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Constraint;
import me.golemcore.warden.domain.model.ConstraintViolation;
import me.golemcore.warden.domain.model.Goal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the measurable constraints of a goal against the session: active run
 * time in seconds, total tokens and completed turns. A constraint is violated
 * once the observed value exceeds its limit.
 */
@Component
public class ConstraintChecker {

    public List<ConstraintViolation> check(AgentSession session, Goal goal) {
        if (goal == null || goal.getConstraints() == null) {
            return List.of();
        }
        List<ConstraintViolation> violations = new ArrayList<>();
        for (Constraint constraint : goal.getConstraints()) {
            if (constraint == null || constraint.getCategory() == null || !constraint.getCategory().isMeasurable()
                    || constraint.getLimit() == null) {
                continue;
            }
            double observed = observe(session, constraint.getCategory());
            if (observed > constraint.getLimit()) {
                violations.add(new ConstraintViolation(constraint, observed, describe(constraint, observed)));
            }
        }
        return violations;
    }

    private double observe(AgentSession session, Constraint.Category category) {
        return switch (category) {
        case TIME -> session.getActiveMillis() / 1000.0;
        case COST -> session.getTotalTokens();
        case TURNS -> session.getTurns().size();
        default -> 0.0;
        };
    }

    private String describe(Constraint constraint, double observed) {
        String label = constraint.getDescription() != null ? constraint.getDescription()
                : constraint.getCategory().name().toLowerCase(java.util.Locale.ROOT) + " limit";
        return String.format(java.util.Locale.ROOT, "%s: %.0f exceeds limit %.0f", label, observed,
                constraint.getLimit());
    }
}
