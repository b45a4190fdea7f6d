package me.golemcore.warden.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.warden.domain.model.RuntimeEvent;
import me.golemcore.warden.domain.service.RuntimeEventService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Live runtime events as server-sent events, optionally filtered by session.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventsController {

    private final RuntimeEventService runtimeEventService;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<RuntimeEvent>> streamEvents(@RequestParam(required = false) String sessionId) {
        return runtimeEventService.stream(sessionId)
                .onBackpressureBuffer(1024)
                .publishOn(Schedulers.boundedElastic())
                .map(event -> ServerSentEvent.<RuntimeEvent>builder()
                        .id(String.valueOf(event.getSequence()))
                        .event(event.getType().name())
                        .data(event)
                        .build());
    }
}
