package com.marketplace.conversation.model;

/**
 * Follow-up replies sent to a buyer who went silent, in the order they are tried.
 */
public enum RecoveryStage {
    FIRST("24h", 24),
    SECOND("48h", 48);

    private final String templateKey;
    private final long afterHours;

    RecoveryStage(String templateKey, long afterHours) {
        this.templateKey = templateKey;
        this.afterHours = afterHours;
    }

    public String getTemplateKey() {
        return templateKey;
    }

    public long getAfterHours() {
        return afterHours;
    }

    /**
     * Value of {@link Conversation#getRecoveryAttempts()} once this stage has been sent.
     */
    public int attemptsAfter() {
        return ordinal() + 1;
    }
}
