package com.marketplace.conversation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskSignalConfig {

    // Buyers further away than this are unlikely to pick the item up in person.
    private double longDistanceKm = 500.0;

    // Rated accounts below this count get the low-reputation signal.
    private int lowReputationRating = 5;

    // Verified buyers at or above both of these contribute no profile signals.
    private int trustedRating = 20;
    private int trustedPurchases = 5;
}
