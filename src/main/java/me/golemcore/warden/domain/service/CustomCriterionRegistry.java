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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.CustomCriterion;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Named pure predicates available to CUSTOM goal criteria. Populated from
 * {@link CustomCriterion} beans and by programmatic registration.
 */
@Service
@Slf4j
public class CustomCriterionRegistry {

    private final Map<String, Predicate<String>> predicates = new ConcurrentHashMap<>();

    public CustomCriterionRegistry(ObjectProvider<CustomCriterion> criteria) {
        criteria.orderedStream()
                .filter(CustomCriterion::isEnabled)
                .forEach(criterion -> register(criterion.getName(), criterion::test));
    }

    public void register(String name, Predicate<String> predicate) {
        predicates.put(name, predicate);
        log.debug("[Judge] Registered custom criterion: {}", name);
    }

    /**
     * Evaluates a named predicate. Empty when no predicate has that name; a
     * predicate that throws counts as failed.
     */
    public Optional<Boolean> evaluate(String name, String output) {
        Predicate<String> predicate = name != null ? predicates.get(name) : null;
        if (predicate == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(predicate.test(output));
        } catch (RuntimeException e) {
            log.warn("[Judge] Custom criterion '{}' failed: {}", name, e.getMessage());
            return Optional.of(false);
        }
    }
}
