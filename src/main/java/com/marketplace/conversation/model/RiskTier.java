package com.marketplace.conversation.model;

public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskTier fromScore(int score, int mediumThreshold, int highThreshold) {
        if (score >= highThreshold) return HIGH;
        if (score >= mediumThreshold) return MEDIUM;
        return LOW;
    }
}
