package com.marketplace.conversation.engine;

import com.marketplace.conversation.config.RiskSignalConfig;
import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.RiskAssessment;
import com.marketplace.conversation.model.RiskSignal;
import com.marketplace.conversation.model.RiskTier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scores fraud risk as a capped sum of fixed-weight signals.
 * Nothing is multiplied, so every score can be read back as the list of signals that fired.
 */
@Component
public class RiskScorer {

    static final int MAX_SCORE = 100;

    private final RiskSignalConfig config;
    private final GatePolicy gatePolicy;

    public RiskScorer(RiskSignalConfig config, GatePolicy gatePolicy) {
        this.config = config;
        this.gatePolicy = gatePolicy;
    }

    public RiskAssessment assess(String normalizedText, BuyerProfile buyer) {
        List<RiskSignal> profile = profileSignals(buyer);
        List<RiskSignal> content = contentSignals(normalizedText);

        List<RiskSignal> signals = new ArrayList<>(profile);
        signals.addAll(content);
        if (!profile.isEmpty() && content.stream().anyMatch(FraudIndicators.fraudSignals()::containsKey)) {
            signals.add(RiskSignal.FRAUD_FROM_RISKY_PROFILE);
        }

        int sum = signals.stream().mapToInt(RiskSignal::getPoints).sum();
        int score = Math.min(sum, MAX_SCORE);

        return RiskAssessment.builder()
                .score(score)
                .tier(gatePolicy.tierFor(score))
                .signals(List.copyOf(signals))
                .build();
    }

    public RiskTier tierFor(int score) {
        return gatePolicy.tierFor(score);
    }

    List<RiskSignal> profileSignals(BuyerProfile buyer) {
        List<RiskSignal> signals = new ArrayList<>();
        if (buyer == null || isTrusted(buyer)) {
            return signals;
        }
        if (buyer.getRating() == 0) {
            signals.add(RiskSignal.NEW_ACCOUNT);
        }
        if (!buyer.isVerified()) {
            signals.add(RiskSignal.UNVERIFIED_PROFILE);
        }
        if (!buyer.isHasPhoto()) {
            signals.add(RiskSignal.NO_PROFILE_PHOTO);
        }
        if (buyer.getDistanceKm() > config.getLongDistanceKm()) {
            signals.add(RiskSignal.LONG_DISTANCE);
        }
        if (buyer.getRating() < config.getLowReputationRating()) {
            signals.add(RiskSignal.LOW_REPUTATION);
        }
        return signals;
    }

    List<RiskSignal> contentSignals(String normalizedText) {
        List<RiskSignal> signals = new ArrayList<>();
        if (normalizedText == null || normalizedText.isEmpty()) {
            return signals;
        }
        for (Map.Entry<RiskSignal, TextPattern> entry : FraudIndicators.fraudSignals().entrySet()) {
            if (entry.getValue().matches(normalizedText)) {
                signals.add(entry.getKey());
            }
        }
        if (FraudIndicators.URGENCY.matches(normalizedText)) {
            signals.add(RiskSignal.URGENCY_PRESSURE);
        }
        return signals;
    }

    private boolean isTrusted(BuyerProfile buyer) {
        return buyer.isVerified()
                && buyer.getRating() >= config.getTrustedRating()
                && buyer.getPurchaseCount() >= config.getTrustedPurchases();
    }
}
