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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Control decision produced once per turn by the goal evaluator.
 */
@Value
@Builder
@Jacksonized
public class Verdict {

    public enum Kind {
        ACCEPT, RETRY, ESCALATE, CONTINUE
    }

    /** Which evaluation stage produced the verdict. */
    public enum Source {
        CRITERIA, JUDGE, CONSTRAINTS, NO_GOAL
    }

    Kind kind;
    Double confidence;
    Double score;
    String reason;
    String hint;
    Source source;

    @JsonIgnore
    public boolean isTerminal() {
        return kind == Kind.ACCEPT || kind == Kind.ESCALATE;
    }

    public static Verdict accept(double confidence, double score, Source source) {
        return Verdict.builder()
                .kind(Kind.ACCEPT)
                .confidence(confidence)
                .score(score)
                .reason("Goal criteria satisfied")
                .source(source)
                .build();
    }

    public static Verdict retry(String reason, String hint, Double confidence, Source source) {
        return Verdict.builder()
                .kind(Kind.RETRY)
                .confidence(confidence)
                .reason(reason)
                .hint(hint)
                .source(source)
                .build();
    }

    public static Verdict escalate(String reason, Source source) {
        return Verdict.builder()
                .kind(Kind.ESCALATE)
                .reason(reason)
                .source(source)
                .build();
    }

    public static Verdict continuing(String reason, Double score) {
        return Verdict.builder()
                .kind(Kind.CONTINUE)
                .score(score)
                .reason(reason)
                .source(Source.CRITERIA)
                .build();
    }
}
