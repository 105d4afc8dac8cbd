package com.marketplace.conversation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Append-only record of a gated decision")
public class AuditEntry {

    private String id;

    @Schema(description = "Epoch milliseconds")
    private long timestamp;

    @Schema(description = "What happened", example = "action_approved")
    private String action;

    private String buyerId;

    @Schema(description = "Pending action or outbound message the entry refers to, if any")
    private String referenceId;

    private AuditActor actor;

    private AuditOutcome outcome;

    @Schema(description = "True when the decision was taken under the supervised regime")
    private boolean compliance;

    private Map<String, Object> details;
}
