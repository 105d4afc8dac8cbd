package com.marketplace.conversation.model;

public enum AuditActor {
    AUTOMATED,
    HUMAN
}
