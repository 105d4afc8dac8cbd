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
@Schema(description = "Everything the engine decided for one inbound message")
public class MessageOutcome {

    private String buyerId;

    private AnalysisResult analysis;

    @Schema(description = "Reply the engine would send; null means no response")
    private String candidateResponse;

    private GateResult gate;

    @Schema(description = "False when saving the conversation or audit trail failed; the result is still valid")
    private boolean persisted;

    @Schema(description = "Epoch milliseconds")
    private long evaluatedAt;
}
