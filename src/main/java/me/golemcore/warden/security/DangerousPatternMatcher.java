package me.golemcore.warden.security;

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
import me.golemcore.warden.domain.model.DangerousPattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled set of dangerous-argument patterns.
 *
 * <p>
 * Patterns come from configuration as data. An entry that does not compile is
 * skipped with a warning so one bad regex cannot disable the whole scan.
 * Instances are immutable and thread-safe.
 */
@Slf4j
public final class DangerousPatternMatcher {

    private final List<CompiledPattern> patterns;

    private DangerousPatternMatcher(List<CompiledPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    public static DangerousPatternMatcher compile(Collection<DangerousPattern> definitions) {
        List<CompiledPattern> compiled = new ArrayList<>();
        if (definitions != null) {
            for (DangerousPattern definition : definitions) {
                if (definition == null || definition.getPattern() == null || definition.getPattern().isBlank()) {
                    continue;
                }
                try {
                    compiled.add(new CompiledPattern(Pattern.compile(definition.getPattern()), definition));
                } catch (PatternSyntaxException e) {
                    log.warn("[Gate] Skipping invalid dangerous pattern '{}': {}", definition.getPattern(),
                            e.getDescription());
                }
            }
        }
        return new DangerousPatternMatcher(compiled);
    }

    /**
     * First pattern matching any of the given texts, in configuration order.
     */
    public Optional<DangerousPattern> firstMatch(Collection<String> texts) {
        for (CompiledPattern compiled : patterns) {
            for (String text : texts) {
                if (text != null && compiled.regex().matcher(text).find()) {
                    return Optional.of(compiled.definition());
                }
            }
        }
        return Optional.empty();
    }

    public Optional<DangerousPattern> firstMatch(String text) {
        return firstMatch(List.of(text));
    }

    public int size() {
        return patterns.size();
    }

    private record CompiledPattern(Pattern regex, DangerousPattern definition) {
    }
}
