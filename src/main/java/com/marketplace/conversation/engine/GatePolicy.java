package com.marketplace.conversation.engine;

import com.marketplace.conversation.config.RegimeConfig;
import com.marketplace.conversation.model.Intent;
import com.marketplace.conversation.model.RiskTier;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable, validated view of the operating regime. Every gating decision reads from here,
 * so autonomous and supervised operation share one code path and differ only in values.
 */
public final class GatePolicy {

    private final RegimeConfig.Mode mode;
    private final boolean humanConfirmationRequired;
    private final int mediumThreshold;
    private final int highThreshold;
    private final Duration pendingActionTtl;
    private final String disclosureMessage;

    private GatePolicy(RegimeConfig.Mode mode,
                       boolean humanConfirmationRequired,
                       int mediumThreshold,
                       int highThreshold,
                       Duration pendingActionTtl,
                       String disclosureMessage) {
        this.mode = mode;
        this.humanConfirmationRequired = humanConfirmationRequired;
        this.mediumThreshold = mediumThreshold;
        this.highThreshold = highThreshold;
        this.pendingActionTtl = pendingActionTtl;
        this.disclosureMessage = disclosureMessage;
    }

    /**
     * @throws IllegalStateException if the regime settings are inconsistent
     */
    public static GatePolicy from(RegimeConfig config) {
        config.validate();
        String disclosure = config.isSupervised() && config.getDisclosure().isEnabled()
                ? config.getDisclosure().getMessage().trim()
                : null;
        return new GatePolicy(
                config.getMode(),
                config.isRequireHumanConfirmation(),
                config.getRiskThresholds().getMedium(),
                config.getRiskThresholds().getHigh(),
                Duration.ofHours(config.getPendingActionTtlHours()),
                disclosure);
    }

    public boolean requiresHuman(RiskTier tier, Intent intent) {
        return humanConfirmationRequired || tier == RiskTier.HIGH || intent == Intent.FRAUD;
    }

    public RiskTier tierFor(int score) {
        return RiskTier.fromScore(score, mediumThreshold, highThreshold);
    }

    /**
     * Text to send once a human approved {@code reply}. Only the supervised regime adds the disclosure.
     */
    public String approvedText(String reply) {
        if (disclosureMessage == null) {
            return reply;
        }
        return disclosureMessage + "\n\n" + reply;
    }

    public Optional<String> disclosureMessage() {
        return Optional.ofNullable(disclosureMessage);
    }

    public boolean isSupervised() {
        return mode == RegimeConfig.Mode.SUPERVISED;
    }

    public RegimeConfig.Mode getMode() {
        return mode;
    }

    public Duration getPendingActionTtl() {
        return pendingActionTtl;
    }

    public int getHighThreshold() {
        return highThreshold;
    }

    public int getMediumThreshold() {
        return mediumThreshold;
    }
}
