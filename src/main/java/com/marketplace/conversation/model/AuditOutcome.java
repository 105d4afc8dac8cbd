package com.marketplace.conversation.model;

public enum AuditOutcome {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED,
    DEFERRED,
    SENT,
    FAILED;

    public static AuditOutcome of(ApprovalOutcome outcome) {
        return AuditOutcome.valueOf(outcome.name());
    }
}
