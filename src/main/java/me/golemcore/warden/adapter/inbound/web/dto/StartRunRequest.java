package me.golemcore.warden.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.warden.domain.model.Goal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartRunRequest {
    private String prompt;
    private Goal goal;
    private String parentSessionId;
    private Integer maxTurns;
    private Long maxDurationSeconds;
}
