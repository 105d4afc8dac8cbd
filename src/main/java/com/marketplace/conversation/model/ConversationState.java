package com.marketplace.conversation.model;

public enum ConversationState {
    INITIAL,
    NEGOTIATING,
    COORDINATING,
    COMMITTED,
    ABANDONED,
    RECOVERED;

    public boolean needsSellerAttention() {
        return this == COMMITTED || this == COORDINATING;
    }
}
