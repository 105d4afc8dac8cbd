package com.marketplace.conversation.model;

public enum PriorityTier {
    HIGH,
    MEDIUM,
    LOW
}
