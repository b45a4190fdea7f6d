package me.golemcore.warden.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalRequestDto {
    private String id;
    private String sessionId;
    private String toolCallId;
    private String toolName;
    private String tier;
    private String matchedPattern;
    private String summary;
    private String createdAt;
    private String deadline;
}
