package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.component.CustomCriterion;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Constraint;
import me.golemcore.warden.domain.model.Goal;
import me.golemcore.warden.domain.model.SuccessCriterion;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.Turn;
import me.golemcore.warden.domain.model.Verdict;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GoalEvaluatorTest {

    private ConversationJudge judge;
    private CustomCriterionRegistry customCriteria;
    private GoalEvaluator evaluator;

    @BeforeEach
    void setUp() {
        judge = mock(ConversationJudge.class);
        @SuppressWarnings("unchecked")
        ObjectProvider<CustomCriterion> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenReturn(Stream.empty());
        customCriteria = new CustomCriterionRegistry(provider);
        evaluator = new GoalEvaluator(new ConstraintChecker(), customCriteria, judge, new WardenProperties());
    }

    // ==================== level 0 ====================

    @Test
    void shouldAcceptOnDeterministicCriterionWithoutCallingJudge() {
        Goal goal = Goal.builder()
                .description("Finish the task")
                .criteria(new ArrayList<>(List.of(
                        SuccessCriterion.outputContains("c1", "done", 1.0),
                        SuccessCriterion.llmJudge("c2", "Is the answer complete?", 0.0))))
                .successThreshold(0.8)
                .build();

        Verdict verdict = evaluator.evaluate(session(finalTurn("All work is done.")), goal);

        assertEquals(Verdict.Kind.ACCEPT, verdict.getKind());
        assertEquals(1.0, verdict.getConfidence());
        assertEquals(Verdict.Source.CRITERIA, verdict.getSource());
        verifyNoInteractions(judge);
    }

    @Test
    void shouldNormalizeScoreOverTotalWeight() {
        Goal goal = Goal.builder()
                .criteria(new ArrayList<>(List.of(
                        SuccessCriterion.outputContains("c1", "report", 3.0),
                        SuccessCriterion.outputEquals("c2", "exact", 1.0))))
                .successThreshold(0.7)
                .build();

        Verdict verdict = evaluator.evaluate(session(finalTurn("Here is the REPORT")), goal);

        assertEquals(Verdict.Kind.ACCEPT, verdict.getKind());
        assertEquals(0.75, verdict.getScore(), 1e-9);
    }

    @Test
    void shouldRetryWithUnmetCriteriaWhenNoJudgeConfigured() {
        Goal goal = Goal.builder()
                .criteria(new ArrayList<>(List.of(SuccessCriterion.outputContains("c1", "done", 1.0))))
                .successThreshold(0.8)
                .build();

        Verdict verdict = evaluator.evaluate(session(finalTurn("still working")), goal);

        assertEquals(Verdict.Kind.RETRY, verdict.getKind());
        assertTrue(verdict.getHint().startsWith("Unmet criteria: output does not contain 'done'"));
    }

    @Test
    void shouldScoreUnregisteredCustomCriterionAsFailed() {
        customCriteria.register("has_number", output -> output.matches(".*\\d.*"));
        Goal goal = Goal.builder()
                .criteria(new ArrayList<>(List.of(
                        SuccessCriterion.custom("c1", "has_number", 1.0),
                        SuccessCriterion.custom("c2", "missing", 1.0))))
                .successThreshold(1.0)
                .build();

        Verdict verdict = evaluator.evaluate(session(finalTurn("answer is 42")), goal);

        assertEquals(Verdict.Kind.RETRY, verdict.getKind());
        assertEquals(0.5, verdict.getConfidence(), 1e-9);
        assertTrue(verdict.getHint().contains("'missing' is not registered"));
    }

    @Test
    void shouldContinueWhileTurnStillUsesTools() {
        Goal goal = Goal.builder()
                .criteria(new ArrayList<>(List.of(
                        SuccessCriterion.outputContains("c1", "done", 1.0),
                        SuccessCriterion.llmJudge("c2", "complete?", 1.0))))
                .build();

        Verdict verdict = evaluator.evaluate(session(toolTurn("let me look")), goal);

        assertEquals(Verdict.Kind.CONTINUE, verdict.getKind());
        verifyNoInteractions(judge);
    }

    // ==================== level 1 ====================

    @Test
    void shouldUseJudgeVerdictWhenLevelZeroIsInconclusive() {
        Goal goal = judgeGoal();
        when(judge.judge(any(), any(), anyDouble())).thenReturn(Optional.of(Verdict.builder()
                .kind(Verdict.Kind.ACCEPT).confidence(0.95).reason("looks right").source(Verdict.Source.JUDGE)
                .build()));

        Verdict verdict = evaluator.evaluate(session(finalTurn("the answer")), goal);

        assertEquals(Verdict.Kind.ACCEPT, verdict.getKind());
        assertEquals(Verdict.Source.JUDGE, verdict.getSource());
        verify(judge).judge(any(), any(), anyDouble());
    }

    @Test
    void shouldDowngradeLowConfidenceAcceptToContinue() {
        Goal goal = judgeGoal();
        goal.setConfidenceFloor(0.7);
        when(judge.judge(any(), any(), anyDouble())).thenReturn(Optional.of(Verdict.builder()
                .kind(Verdict.Kind.ACCEPT).confidence(0.5).reason("maybe").source(Verdict.Source.JUDGE).build()));

        Verdict verdict = evaluator.evaluate(session(finalTurn("the answer")), goal);

        assertEquals(Verdict.Kind.CONTINUE, verdict.getKind());
        assertEquals(0.5, verdict.getConfidence());
    }

    @Test
    void shouldDowngradeLowConfidenceRetryToContinue() {
        Goal goal = judgeGoal();
        when(judge.judge(any(), any(), anyDouble()))
                .thenReturn(Optional.of(Verdict.retry("unsure", "try again", 0.2, Verdict.Source.JUDGE)));

        Verdict verdict = evaluator.evaluate(session(finalTurn("the answer")), goal);

        assertEquals(Verdict.Kind.CONTINUE, verdict.getKind());
    }

    @Test
    void shouldContinueWhenJudgeUnavailable() {
        Goal goal = judgeGoal();
        when(judge.judge(any(), any(), anyDouble())).thenReturn(Optional.empty());

        Verdict verdict = evaluator.evaluate(session(finalTurn("the answer")), goal);

        assertEquals(Verdict.Kind.CONTINUE, verdict.getKind());
    }

    // ==================== constraints ====================

    @Test
    void shouldEscalateOnHardConstraintEvenWhenCriteriaPass() {
        Goal goal = Goal.builder()
                .criteria(new ArrayList<>(List.of(SuccessCriterion.outputContains("c1", "done", 1.0))))
                .constraints(new ArrayList<>(List.of(Constraint.hard(Constraint.Category.COST, 100, "token cap"))))
                .build();
        AgentSession session = session(finalTurn("done"));
        session.setTotalInputTokens(90);
        session.setTotalOutputTokens(20);

        Verdict verdict = evaluator.evaluate(session, goal);

        assertEquals(Verdict.Kind.ESCALATE, verdict.getKind());
        assertEquals(Verdict.Source.CONSTRAINTS, verdict.getSource());
        assertTrue(verdict.getReason().contains("token cap: 110 exceeds limit 100"));
    }

    @Test
    void shouldSurfaceSoftConstraintAsHintWithoutStopping() {
        Goal goal = Goal.builder()
                .criteria(new ArrayList<>(List.of(SuccessCriterion.outputContains("c1", "done", 1.0))))
                .constraints(new ArrayList<>(List.of(Constraint.soft(Constraint.Category.TURNS, 0, "few turns"))))
                .build();

        Verdict verdict = evaluator.evaluate(session(toolTurn("working")), goal);

        assertEquals(Verdict.Kind.CONTINUE, verdict.getKind());
        assertTrue(verdict.getHint().contains("Soft constraint exceeded: few turns"));
    }

    @Test
    void shouldAcceptFinalAnswerWithoutGoal() {
        assertEquals(Verdict.Kind.ACCEPT, evaluator.evaluate(session(finalTurn("hi")), null).getKind());
        assertEquals(Verdict.Kind.CONTINUE, evaluator.evaluate(session(toolTurn("hi")), null).getKind());
    }

    private static Goal judgeGoal() {
        return Goal.builder()
                .description("Summarize the document")
                .criteria(new ArrayList<>(List.of(SuccessCriterion.llmJudge("c1", "Is the summary faithful?", 1.0))))
                .build();
    }

    private static AgentSession session(Turn turn) {
        AgentSession session = AgentSession.builder().id("session-1").prompt("do it").build();
        session.appendTurn(turn);
        return session;
    }

    private static Turn finalTurn(String text) {
        return Turn.builder().index(0).assistantText(text).build();
    }

    private static Turn toolTurn(String text) {
        return Turn.builder()
                .index(0)
                .assistantText(text)
                .toolCalls(List.of(ToolCall.builder().id("c1").name("read_file").rawArguments("{}").build()))
                .build();
    }
}
