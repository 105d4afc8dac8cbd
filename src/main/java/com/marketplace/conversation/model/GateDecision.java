package com.marketplace.conversation.model;

public enum GateDecision {
    AUTHORIZED,
    PENDING_HUMAN,
    NO_RESPONSE
}
