package me.golemcore.warden.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummaryDto {
    private String id;
    private String status;
    private boolean running;
    private boolean subAgent;
    private int turnCount;
    private String createdAt;
    private String updatedAt;
    private String preview;
}
