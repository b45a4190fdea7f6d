package me.golemcore.warden.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.adapter.inbound.web.dto.RunDetailDto;
import me.golemcore.warden.adapter.inbound.web.dto.RunSummaryDto;
import me.golemcore.warden.adapter.inbound.web.dto.StartRunRequest;
import me.golemcore.warden.domain.loop.AgentLoop;
import me.golemcore.warden.domain.loop.RunHandle;
import me.golemcore.warden.domain.model.AgentSession;
import me.golemcore.warden.domain.model.RunRequest;
import me.golemcore.warden.domain.model.SecurityDecision;
import me.golemcore.warden.domain.service.DecisionLogService;
import me.golemcore.warden.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Run lifecycle endpoints: start, inspect, resume and cancel.
 */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
@Slf4j
public class RunsController {

    private static final int PREVIEW_MAX_LEN = 160;
    private static final String RUN_NOT_FOUND = "Run not found";

    private final AgentLoop agentLoop;
    private final SessionPort sessionPort;
    private final DecisionLogService decisionLogService;

    @PostMapping
    public Mono<ResponseEntity<RunSummaryDto>> startRun(@RequestBody StartRunRequest request) {
        if (request == null || request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "prompt is required");
        }
        RunHandle handle = agentLoop.submit(RunRequest.builder()
                .prompt(request.getPrompt())
                .goal(request.getGoal())
                .parentSessionId(request.getParentSessionId())
                .maxTurns(request.getMaxTurns())
                .maxDurationSeconds(request.getMaxDurationSeconds())
                .build());
        log.info("[API] Started run {}", handle.sessionId());
        AgentSession session = agentLoop.getSession(handle.sessionId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, RUN_NOT_FOUND));
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(toSummary(session)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<RunSummaryDto>>> listRuns() {
        List<RunSummaryDto> runs = sessionPort.listAll().stream()
                .map(session -> agentLoop.isRunning(session.getId())
                        ? agentLoop.getSession(session.getId()).orElse(session)
                        : session)
                .sorted(Comparator.comparing(AgentSession::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed())
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(runs));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<RunDetailDto>> getRun(@PathVariable String id) {
        AgentSession session = agentLoop.getSession(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, RUN_NOT_FOUND));
        return Mono.just(ResponseEntity.ok(toDetail(session)));
    }

    @GetMapping("/{id}/decisions")
    public Mono<ResponseEntity<List<SecurityDecision>>> getDecisions(@PathVariable String id) {
        if (agentLoop.getSession(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, RUN_NOT_FOUND);
        }
        return Mono.just(ResponseEntity.ok(decisionLogService.read(id)));
    }

    @PostMapping("/{id}/resume")
    public Mono<ResponseEntity<RunSummaryDto>> resumeRun(@PathVariable String id) {
        try {
            agentLoop.resumeAsync(id);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, RUN_NOT_FOUND);
        }
        AgentSession session = agentLoop.getSession(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, RUN_NOT_FOUND));
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(toSummary(session)));
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<RunSummaryDto>> cancelRun(@PathVariable String id) {
        AgentSession session = agentLoop.getSession(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, RUN_NOT_FOUND));
        if (!agentLoop.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Run is not active: " + session.getStatus());
        }
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(toSummary(session)));
    }

    private RunSummaryDto toSummary(AgentSession session) {
        return RunSummaryDto.builder()
                .id(session.getId())
                .status(session.getStatus().name())
                .running(agentLoop.isRunning(session.getId()))
                .subAgent(session.isSubAgent())
                .turnCount(session.getTurns().size())
                .createdAt(format(session.getCreatedAt()))
                .updatedAt(format(session.getUpdatedAt()))
                .preview(preview(session.getPrompt()))
                .build();
    }

    private RunDetailDto toDetail(AgentSession session) {
        return RunDetailDto.builder()
                .id(session.getId())
                .parentSessionId(session.getParentSessionId())
                .status(session.getStatus().name())
                .running(agentLoop.isRunning(session.getId()))
                .subAgent(session.isSubAgent())
                .prompt(session.getPrompt())
                .goal(session.getGoal())
                .turns(List.copyOf(session.getTurns()))
                .totalInputTokens(session.getTotalInputTokens())
                .totalOutputTokens(session.getTotalOutputTokens())
                .activeMillis(session.getActiveMillis())
                .finalOutput(session.getFinalOutput())
                .failureReason(session.getFailureReason())
                .lastVerdict(session.getLastVerdict())
                .archived(session.isArchived())
                .createdAt(format(session.getCreatedAt()))
                .updatedAt(format(session.getUpdatedAt()))
                .completedAt(format(session.getCompletedAt()))
                .build();
    }

    private static String preview(String prompt) {
        if (prompt == null) {
            return null;
        }
        String normalized = prompt.replaceAll("\\s+", " ").trim();
        return normalized.length() > PREVIEW_MAX_LEN ? normalized.substring(0, PREVIEW_MAX_LEN) + "..." : normalized;
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
