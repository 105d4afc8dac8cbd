package com.marketplace.conversation.model;

/**
 * Additive fraud-risk signals. Points are fixed so a score can be explained by listing its signals.
 */
public enum RiskSignal {
    NEW_ACCOUNT(Source.PROFILE, 20),
    UNVERIFIED_PROFILE(Source.PROFILE, 15),
    NO_PROFILE_PHOTO(Source.PROFILE, 10),
    LONG_DISTANCE(Source.PROFILE, 15),
    LOW_REPUTATION(Source.PROFILE, 10),

    EXTERNAL_CONTACT_REQUEST(Source.CONTENT, 40),
    OFF_PLATFORM_PAYMENT(Source.CONTENT, 40),
    SUSPICIOUS_LINK(Source.CONTENT, 40),
    SENSITIVE_DATA_REQUEST(Source.CONTENT, 40),
    URGENCY_PRESSURE(Source.CONTENT, 15),

    // A 40-point content signal from a buyer that also has a profile signal
    FRAUD_FROM_RISKY_PROFILE(Source.COMBINED, 20);

    public enum Source { PROFILE, CONTENT, COMBINED }

    private final Source source;
    private final int points;

    RiskSignal(Source source, int points) {
        this.source = source;
        this.points = points;
    }

    public Source getSource() {
        return source;
    }

    public int getPoints() {
        return points;
    }
}
