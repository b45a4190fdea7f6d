package me.golemcore.warden.adapter.inbound.web.controller;

import me.golemcore.warden.domain.model.RuntimeEventType;
import me.golemcore.warden.domain.service.RuntimeEventService;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventsControllerTest {

    private final RuntimeEventService events = new RuntimeEventService(Clock.systemUTC());
    private final EventsController controller = new EventsController(events);

    @Test
    void shouldStreamSessionEventsAsServerSentEvents() {
        StepVerifier.create(controller.streamEvents("s1").take(1))
                .then(() -> {
                    events.emit("s2", RuntimeEventType.RUN_STARTED);
                    events.emit("s1", RuntimeEventType.TURN_STARTED);
                })
                .assertNext(sse -> {
                    assertEquals("TURN_STARTED", sse.event());
                    assertEquals("s1", sse.data().getSessionId());
                    assertEquals(String.valueOf(sse.data().getSequence()), sse.id());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }
}
