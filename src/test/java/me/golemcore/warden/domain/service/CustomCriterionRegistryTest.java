package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.component.CustomCriterion;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CustomCriterionRegistryTest {

    @Test
    void shouldRegisterEnabledBeans() {
        CustomCriterion enabled = criterion("mentions_tests", true);
        CustomCriterion disabled = criterion("always_true", false);

        CustomCriterionRegistry registry = new CustomCriterionRegistry(provider(enabled, disabled));

        assertEquals(Optional.of(true), registry.evaluate("mentions_tests", "all tests pass"));
        assertEquals(Optional.of(false), registry.evaluate("mentions_tests", "done"));
        assertTrue(registry.evaluate("always_true", "anything").isEmpty());
    }

    @Test
    void shouldTreatThrowingPredicateAsFailed() {
        CustomCriterionRegistry registry = new CustomCriterionRegistry(provider());
        registry.register("broken", output -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(Optional.of(false), registry.evaluate("broken", "output"));
    }

    @Test
    void shouldReturnEmptyForUnknownName() {
        CustomCriterionRegistry registry = new CustomCriterionRegistry(provider());

        assertTrue(registry.evaluate("missing", "output").isEmpty());
        assertTrue(registry.evaluate(null, "output").isEmpty());
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<CustomCriterion> provider(CustomCriterion... criteria) {
        ObjectProvider<CustomCriterion> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenAnswer(invocation -> Stream.of(criteria));
        return provider;
    }

    private static CustomCriterion criterion(String name, boolean enabled) {
        return new CustomCriterion() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean test(String output) {
                return output.contains("tests");
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }
        };
    }
}
