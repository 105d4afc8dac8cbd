package com.marketplace.conversation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Human decision on a pending action")
public class PendingActionDecision {

    @Schema(description = "true to approve, false to reject", example = "true")
    private Boolean approved;

    @Schema(description = "Operator taking the decision", example = "ops-anna")
    private String decidedBy;

    @Schema(description = "Reply text to send instead of the engine's suggestion")
    private String responseOverride;
}
