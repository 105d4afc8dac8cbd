package com.marketplace.conversation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of analysing one inbound buyer message")
public class AnalysisResult {

    @Schema(description = "Buyer the message came from", example = "buyer-7781")
    private String buyerId;

    @Schema(description = "Classified intent", example = "GREETING")
    private Intent intent;

    @Schema(description = "How urgently the seller should look at this buyer", example = "MEDIUM")
    private PriorityTier priorityTier;

    @Schema(description = "Fraud-risk score of this message (0-100)", example = "0")
    private int fraudRisk;

    @Schema(description = "Risk tier: LOW (<30), MEDIUM (30-69), HIGH (>=70) with default thresholds", example = "LOW")
    private RiskTier riskTier;

    @Schema(description = "Signals that contributed to the fraud-risk score")
    private List<RiskSignal> riskSignals;

    @Schema(description = "Conversation state before this message", example = "INITIAL")
    private ConversationState previousState;

    @Schema(description = "Conversation state after this message", example = "INITIAL")
    private ConversationState state;

    @Schema(description = "Whether a human must approve any reply", example = "false")
    private boolean requiresHuman;

    @Schema(description = "Messages received in this conversation, including this one", example = "1")
    private int messageCount;
}
