package me.golemcore.warden.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.warden.domain.model.Goal;
import me.golemcore.warden.domain.model.Turn;
import me.golemcore.warden.domain.model.Verdict;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDetailDto {
    private String id;
    private String parentSessionId;
    private String status;
    private boolean running;
    private boolean subAgent;
    private String prompt;
    private Goal goal;
    private List<Turn> turns;
    private long totalInputTokens;
    private long totalOutputTokens;
    private long activeMillis;
    private String finalOutput;
    private String failureReason;
    private Verdict lastVerdict;
    private boolean archived;
    private String createdAt;
    private String updatedAt;
    private String completedAt;
}
