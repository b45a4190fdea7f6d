package me.golemcore.warden.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.adapter.inbound.web.dto.ApprovalRequestDto;
import me.golemcore.warden.adapter.inbound.web.dto.ApprovalResolutionRequest;
import me.golemcore.warden.adapter.inbound.web.dto.ApprovalResolutionResponse;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalRequest;
import me.golemcore.warden.domain.service.ApprovalBroker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Pending approval requests and their resolution. Request ids may be
 * shortened to any unique prefix.
 */
@RestController
@RequestMapping("/api/approvals")
@RequiredArgsConstructor
@Slf4j
public class ApprovalsController {

    private final ApprovalBroker approvalBroker;

    @GetMapping
    public Mono<ResponseEntity<List<ApprovalRequestDto>>> listPending(
            @RequestParam(required = false) String sessionId) {
        List<ApprovalRequest> pending = sessionId == null || sessionId.isBlank()
                ? approvalBroker.listPending()
                : approvalBroker.listPending(sessionId);
        return Mono.just(ResponseEntity.ok(pending.stream().map(this::toDto).toList()));
    }

    @PostMapping("/{id}")
    public Mono<ResponseEntity<ApprovalResolutionResponse>> resolve(@PathVariable String id,
            @RequestBody ApprovalResolutionRequest request) {
        if (request == null || request.getDecision() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "decision is required");
        }
        ApprovalDecision decision;
        try {
            decision = ApprovalDecision.parse(request.getDecision());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        String requestId = approvalBroker.findByPrefix(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No pending approval: " + id));
        if (!approvalBroker.resolve(requestId, decision, request.getReason())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No pending approval: " + id);
        }
        log.info("[API] Approval {} resolved: {}", requestId, decision);
        return Mono.just(ResponseEntity.ok(ApprovalResolutionResponse.builder()
                .requestId(requestId)
                .status(decision.toStatus().name())
                .build()));
    }

    private ApprovalRequestDto toDto(ApprovalRequest request) {
        return ApprovalRequestDto.builder()
                .id(request.getId())
                .sessionId(request.getSessionId())
                .toolCallId(request.getToolCallId())
                .toolName(request.getToolName())
                .tier(request.getTier() != null ? request.getTier().name() : null)
                .matchedPattern(request.getMatchedPattern())
                .summary(request.getSummary())
                .createdAt(request.getCreatedAt() != null ? request.getCreatedAt().toString() : null)
                .deadline(request.getDeadline() != null ? request.getDeadline().toString() : null)
                .build();
    }
}
