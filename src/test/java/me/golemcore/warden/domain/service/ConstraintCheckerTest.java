package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.Constraint;
import me.golemcore.warden.domain.model.ConstraintViolation;
import me.golemcore.warden.domain.model.Goal;
import me.golemcore.warden.domain.model.Turn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstraintCheckerTest {

    private final ConstraintChecker checker = new ConstraintChecker();

    @Test
    void shouldMeasureTimeCostAndTurns() {
        AgentSession session = AgentSession.builder().id("s1").activeMillis(90_500).totalInputTokens(800)
                .totalOutputTokens(300).build();
        session.appendTurn(Turn.builder().index(0).build());
        session.appendTurn(Turn.builder().index(1).build());

        List<ConstraintViolation> violations = checker.check(session, goal(
                Constraint.hard(Constraint.Category.TIME, 90, null),
                Constraint.soft(Constraint.Category.COST, 1000, "token budget"),
                Constraint.hard(Constraint.Category.TURNS, 2, "turn cap")));

        assertEquals(2, violations.size());
        assertEquals("time limit: 91 exceeds limit 90", violations.get(0).detail());
        assertTrue(violations.get(0).isHard());
        assertEquals("token budget: 1100 exceeds limit 1000", violations.get(1).detail());
        assertFalse(violations.get(1).isHard());
    }

    @Test
    void shouldIgnoreDescriptiveCategoriesAndMissingLimits() {
        AgentSession session = AgentSession.builder().id("s1").totalInputTokens(5000).build();
        Constraint noLimit = Constraint.builder().category(Constraint.Category.COST).description("cheap").build();

        List<ConstraintViolation> violations = checker.check(session, goal(
                Constraint.hard(Constraint.Category.SAFETY, 0, "no prod writes"), noLimit));

        assertTrue(violations.isEmpty());
    }

    @Test
    void shouldReturnNothingWithoutGoal() {
        assertTrue(checker.check(AgentSession.builder().id("s1").build(), null).isEmpty());
    }

    private static Goal goal(Constraint... constraints) {
        return Goal.builder().constraints(new ArrayList<>(List.of(constraints))).build();
    }
}
