package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.Intent;
import com.marketplace.conversation.model.PriorityTier;
import org.springframework.stereotype.Component;

/**
 * Ranks how promising a buyer is, so the seller answers ready-to-buy buyers first.
 */
@Component
public class PriorityCalculator {

    private static final TextPattern NOW = TextPattern.phrases("now", "ahora");
    private static final TextPattern URGENT = TextPattern.phrases("urgent", "urgente");
    private static final TextPattern LOWBALL = TextPattern.regex("lowball",
            "(?<![0-9])(?:10|20) ?€", "\\bmitad\\b");

    private static final int ESTABLISHED_RATING = 10;

    public PriorityTier calculate(Intent intent, BuyerProfile buyer, String normalizedText) {
        if (intent == Intent.DIRECT_PURCHASE) return PriorityTier.HIGH;
        if (intent == Intent.PAYMENT && NOW.matches(normalizedText)) return PriorityTier.HIGH;
        if (URGENT.matches(normalizedText) && buyer.getRating() > ESTABLISHED_RATING) return PriorityTier.HIGH;

        if (intent == Intent.FRAUD) return PriorityTier.LOW;
        if (buyer.getRating() == 0 && buyer.getPurchaseCount() == 0) return PriorityTier.LOW;
        if (intent == Intent.NEGOTIATION && LOWBALL.matches(normalizedText)) return PriorityTier.LOW;

        return PriorityTier.MEDIUM;
    }
}
