package me.golemcore.warden.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/approvals/{id}}: {@code decision} is approve or
 * deny.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalResolutionRequest {
    private String decision;
    private String reason;
}
