package me.golemcore.warden.security;

import me.golemcore.warden.domain.model.DangerousPattern;
import me.golemcore.warden.domain.model.GateOutcome;
import me.golemcore.warden.domain.model.SecurityPolicy;
import me.golemcore.warden.domain.model.SecurityTier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubAgentPolicyOverlayTest {

    static Stream<Arguments> tierCombinations() {
        List<Arguments> combinations = new ArrayList<>();
        for (SecurityTier parentAuto : SecurityTier.values()) {
            for (SecurityTier parentDeny : SecurityTier.values()) {
                for (SecurityTier childAuto : SecurityTier.values()) {
                    for (SecurityTier childDeny : SecurityTier.values()) {
                        combinations.add(Arguments.of(parentAuto, parentDeny, childAuto, childDeny));
                    }
                }
            }
        }
        return combinations.stream();
    }

    @ParameterizedTest
    @MethodSource("tierCombinations")
    void shouldNeverProduceLessRestrictivePolicy(SecurityTier parentAuto, SecurityTier parentDeny,
            SecurityTier childAuto, SecurityTier childDeny) {
        SecurityPolicy parent = SecurityPolicy.builder()
                .autoApproveUpTo(parentAuto)
                .denyAbove(parentDeny)
                .approvalTimeoutSeconds(60)
                .build();

        SecurityPolicy child = SubAgentPolicyOverlay.overlay(parent,
                new SubAgentPolicyOverlay.Overlay(childAuto, childDeny, 30, List.of()));

        assertTrue(child.getAutoApproveUpTo().isAtMost(parent.getAutoApproveUpTo()));
        assertTrue(child.getDenyAbove().isAtMost(parent.getDenyAbove()));
        assertTrue(child.isAtLeastAsStrictAs(parent));
        for (SecurityTier tier : SecurityTier.values()) {
            GateOutcome parentOutcome = parent.classify(tier);
            GateOutcome childOutcome = child.classify(tier);
            if (childOutcome == GateOutcome.ALLOW) {
                assertEquals(GateOutcome.ALLOW, parentOutcome);
            }
            if (parentOutcome == GateOutcome.DENY) {
                assertEquals(GateOutcome.DENY, childOutcome);
            }
        }
    }

    @Test
    void shouldUnionPatternsAndKeepParentUntouched() {
        DangerousPattern parentPattern = DangerousPattern.of("rm\\s+-r", "recursive delete");
        DangerousPattern extra = DangerousPattern.of("git\\s+push", "any push");
        SecurityPolicy parent = SecurityPolicy.builder()
                .dangerousPatterns(new ArrayList<>(List.of(parentPattern)))
                .toolOverrides(Map.of("shell", SecurityTier.T2))
                .build();

        SecurityPolicy child = SubAgentPolicyOverlay.overlay(parent,
                new SubAgentPolicyOverlay.Overlay(SecurityTier.T0, SecurityTier.T2, 10, List.of(extra,
                        parentPattern)));

        assertEquals(List.of(parentPattern, extra), child.getDangerousPatterns());
        assertEquals(List.of(parentPattern), parent.getDangerousPatterns());
        assertEquals(10, child.getApprovalTimeoutSeconds());
        assertFalse(child.isOverridesMayLowerTier());
        assertTrue(parent.isOverridesMayLowerTier());
    }

    @Test
    void shouldKeepShorterParentTimeout() {
        SecurityPolicy parent = SecurityPolicy.builder().approvalTimeoutSeconds(5).build();

        SecurityPolicy child = SubAgentPolicyOverlay.overlay(parent,
                new SubAgentPolicyOverlay.Overlay(SecurityTier.T0, SecurityTier.T2, 30, null));

        assertEquals(5, child.getApprovalTimeoutSeconds());
    }
}
