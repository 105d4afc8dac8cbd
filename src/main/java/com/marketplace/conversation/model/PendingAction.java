package com.marketplace.conversation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.concurrent.CompletableFuture;

/**
 * Action held back until a human approves it. Removed from the active set once resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingAction {
    private String id;
    private ActionType actionType;
    private String buyerId;
    private String originalMessage;
    private AnalysisResult analysis;
    private String candidateResponse;   // null when the engine had nothing safe to suggest
    private long createdAt;
    private long expiresAt;             // always > createdAt
    private ApprovalOutcome outcome;
    private String decidedBy;           // operator id, or "SYSTEM" for expiry and supersession
    private long decidedAt;             // 0 until resolved

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private CompletableFuture<ApprovalOutcome> decision = new CompletableFuture<>();

    public boolean isExpiredAt(long now) {
        return now >= expiresAt;
    }
}
