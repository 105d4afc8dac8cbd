package com.marketplace.conversation.service;

import com.marketplace.conversation.config.RegimeConfig;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Human-like wait before a reply goes out, uniform between the configured bounds.
 */
@Component
public class ResponseDelayCalculator {

    private final RegimeConfig regimeConfig;

    public ResponseDelayCalculator(RegimeConfig regimeConfig) {
        this.regimeConfig = regimeConfig;
    }

    public Duration nextDelay() {
        long min = regimeConfig.getResponseDelay().getMinSeconds();
        long max = regimeConfig.getResponseDelay().getMaxSeconds();
        long seconds = min >= max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        return Duration.ofSeconds(seconds);
    }
}
