package com.marketplace.conversation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Working state of one buyer's conversation. Keyed by buyer id, never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {
    private String buyerId;
    private ConversationState state;
    private int messageCount;
    private int fraudScore;             // highest score seen since the last explicit reset
    private long createdAt;
    private long lastActivity;
    private boolean requiresAttention;
    private int recoveryAttempts;       // follow-ups sent since the buyer last wrote

    public static Conversation start(String buyerId, long now) {
        return Conversation.builder()
                .buyerId(buyerId)
                .state(ConversationState.INITIAL)
                .messageCount(0)
                .fraudScore(0)
                .createdAt(now)
                .lastActivity(now)
                .requiresAttention(false)
                .recoveryAttempts(0)
                .build();
    }

    public void accumulateFraudScore(int score) {
        this.fraudScore = Math.max(this.fraudScore, score);
    }
}
