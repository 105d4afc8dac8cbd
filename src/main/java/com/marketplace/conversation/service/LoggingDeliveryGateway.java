package com.marketplace.conversation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Dry-run delivery: logs the reply instead of sending it. Active unless
 * {@code engine.delivery=external}, in which case another {@link DeliveryGateway} bean must exist.
 */
@Component
@ConditionalOnProperty(name = "engine.delivery", havingValue = "log", matchIfMissing = true)
public class LoggingDeliveryGateway implements DeliveryGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryGateway.class);

    @Override
    public boolean deliver(String buyerId, String text, Duration jitterDelay) {
        log.info("[DRY-RUN] reply to buyer={} after {}s: {}", buyerId, jitterDelay.getSeconds(), text);
        return true;
    }
}
