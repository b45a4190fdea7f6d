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
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.ConstraintViolation;
import me.golemcore.warden.domain.model.CriterionResult;
import me.golemcore.warden.domain.model.Goal;
import me.golemcore.warden.domain.model.SuccessCriterion;
import me.golemcore.warden.domain.model.Turn;
import me.golemcore.warden.domain.model.Verdict;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides after every turn whether the run continues, stops or escalates.
 *
 * <p>
 * Order of evaluation:
 * <ol>
 * <li>Hard constraints. Any violation escalates, whatever the scores say.</li>
 * <li>Level 0: OUTPUT_CONTAINS, OUTPUT_EQUALS and CUSTOM criteria against the
 * latest output. The weighted score is normalized over the weight of all
 * criteria, so a goal that also has judge criteria cannot be accepted on the
 * cheap ones alone unless they carry enough weight. Reaching the threshold
 * accepts without calling the model.</li>
 * <li>Turns that still called tools are intermediate and continue.</li>
 * <li>Level 1: when a judge criterion is configured, the model assesses the
 * conversation. A judgment claiming confidence below the floor downgrades to
 * continue; escalation carries no confidence and is never downgraded.</li>
 * <li>Without a judge, a final answer below threshold is retried with the
 * unmet criteria as the hint.</li>
 * </ol>
 * Soft constraint violations are attached as hints only.
 */
@Service
@Slf4j
public class GoalEvaluator {

    private final ConstraintChecker constraintChecker;
    private final CustomCriterionRegistry customCriteria;
    private final ConversationJudge conversationJudge;
    private final WardenProperties.JudgeProperties properties;

    public GoalEvaluator(ConstraintChecker constraintChecker, CustomCriterionRegistry customCriteria,
            ConversationJudge conversationJudge, WardenProperties properties) {
        this.constraintChecker = constraintChecker;
        this.customCriteria = customCriteria;
        this.conversationJudge = conversationJudge;
        this.properties = properties.getJudge();
    }

    public Verdict evaluate(AgentSession session, Goal goal) {
        Turn lastTurn = session.getLastTurn();
        boolean intermediate = lastTurn != null && lastTurn.hasToolCalls();

        if (goal == null || (goal.getCriteria().isEmpty() && goal.getConstraints().isEmpty())) {
            return intermediate || lastTurn == null
                    ? Verdict.continuing("Awaiting final answer", null)
                    : Verdict.accept(1.0, 1.0, Verdict.Source.NO_GOAL);
        }

        List<ConstraintViolation> violations = constraintChecker.check(session, goal);
        List<ConstraintViolation> hard = violations.stream().filter(ConstraintViolation::isHard).toList();
        if (!hard.isEmpty()) {
            String reason = "Hard constraint violated: "
                    + hard.stream().map(ConstraintViolation::detail).collect(Collectors.joining("; "));
            log.warn("[Judge] Session {}: {}", session.getId(), reason);
            return Verdict.escalate(reason, Verdict.Source.CONSTRAINTS);
        }
        String softHint = softHint(violations);

        String output = lastTurn != null && lastTurn.getAssistantText() != null ? lastTurn.getAssistantText() : "";
        List<CriterionResult> results = scoreDeterministic(goal, output);
        double totalWeight = goal.totalWeight();
        double score = totalWeight > 0
                ? results.stream().mapToDouble(r -> Math.max(0.0, r.weight()) * r.score()).sum() / totalWeight
                : 0.0;
        double threshold = threshold(goal);

        if (!results.isEmpty() && score >= threshold) {
            log.info("[Judge] Session {} accepted at level 0 with score {}", session.getId(),
                    String.format(Locale.ROOT, "%.2f", score));
            return Verdict.accept(score, score, Verdict.Source.CRITERIA);
        }

        if (intermediate) {
            return withHint(Verdict.continuing("Turn still working with tools", score), softHint);
        }

        if (goal.hasLlmJudge()) {
            Optional<Verdict> judged = conversationJudge.judge(session, goal, threshold);
            if (judged.isEmpty()) {
                return withHint(Verdict.continuing("Judge unavailable", score), softHint);
            }
            return withHint(applyConfidenceFloor(judged.get(), goal), softHint);
        }

        List<String> unmet = results.stream()
                .filter(r -> !r.passed())
                .map(CriterionResult::reasoning)
                .toList();
        String reason = String.format(Locale.ROOT, "Score %.2f below threshold %.2f", score, threshold);
        String hint = unmet.isEmpty() ? ConversationJudge.DEFAULT_RETRY_HINT
                : "Unmet criteria: " + String.join("; ", unmet);
        return withHint(Verdict.retry(reason, hint, score, Verdict.Source.CRITERIA), softHint);
    }

    List<CriterionResult> scoreDeterministic(Goal goal, String output) {
        List<CriterionResult> results = new ArrayList<>();
        for (SuccessCriterion criterion : goal.getCriteria()) {
            if (criterion.getType() == null || !criterion.getType().isDeterministic()) {
                continue;
            }
            results.add(score(criterion, output));
        }
        return results;
    }

    private CriterionResult score(SuccessCriterion criterion, String output) {
        boolean passed;
        String reasoning;
        switch (criterion.getType()) {
        case OUTPUT_CONTAINS -> {
            String pattern = criterion.getPattern() != null ? criterion.getPattern() : "";
            passed = criterion.isCaseSensitive()
                    ? output.contains(pattern)
                    : output.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
            reasoning = (passed ? "output contains '" : "output does not contain '") + pattern + "'";
        }
        case OUTPUT_EQUALS -> {
            String expected = criterion.getExpected() != null ? criterion.getExpected().trim() : "";
            passed = output.trim().equals(expected);
            reasoning = passed ? "output equals expected text" : "output does not equal expected text";
        }
        case CUSTOM -> {
            Optional<Boolean> verdict = customCriteria.evaluate(criterion.getName(), output);
            passed = verdict.orElse(false);
            reasoning = verdict.isEmpty() ? "custom criterion '" + criterion.getName() + "' is not registered"
                    : "custom criterion '" + criterion.getName() + "' " + (passed ? "passed" : "failed");
        }
        default -> throw new IllegalArgumentException("Not a deterministic criterion: " + criterion.getType());
        }
        return new CriterionResult(criterion.getId(), criterion.getType(), criterion.getWeight(), passed ? 1.0 : 0.0,
                reasoning);
    }

    private Verdict applyConfidenceFloor(Verdict verdict, Goal goal) {
        double floor = goal.getConfidenceFloor() != null ? goal.getConfidenceFloor() : properties.getConfidenceFloor();
        boolean claimsConfidence = verdict.getKind() == Verdict.Kind.ACCEPT || verdict.getKind() == Verdict.Kind.RETRY;
        if (claimsConfidence && verdict.getConfidence() != null && verdict.getConfidence() < floor) {
            log.info("[Judge] {} with confidence {} below floor {}, continuing", verdict.getKind(),
                    verdict.getConfidence(), floor);
            return Verdict.builder()
                    .kind(Verdict.Kind.CONTINUE)
                    .confidence(verdict.getConfidence())
                    .reason("Judge " + verdict.getKind().name().toLowerCase(Locale.ROOT) + " below confidence floor: "
                            + verdict.getReason())
                    .source(Verdict.Source.JUDGE)
                    .build();
        }
        return verdict;
    }

    private double threshold(Goal goal) {
        return goal.getSuccessThreshold() != null ? goal.getSuccessThreshold() : properties.getDefaultThreshold();
    }

    private String softHint(List<ConstraintViolation> violations) {
        List<String> soft = violations.stream()
                .filter(v -> !v.isHard())
                .map(ConstraintViolation::detail)
                .toList();
        return soft.isEmpty() ? null : "Soft constraint exceeded: " + String.join("; ", soft);
    }

    private Verdict withHint(Verdict verdict, String extraHint) {
        if (extraHint == null) {
            return verdict;
        }
        String hint = verdict.getHint() != null ? verdict.getHint() + " " + extraHint : extraHint;
        return Verdict.builder()
                .kind(verdict.getKind())
                .confidence(verdict.getConfidence())
                .score(verdict.getScore())
                .reason(verdict.getReason())
                .hint(hint)
                .source(verdict.getSource())
                .build();
    }
}
