package com.marketplace.conversation.model;

public enum ApprovalOutcome {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    // Anything but an explicit approval means nothing is sent.
    public boolean permitsExecution() {
        return this == APPROVED;
    }
}
