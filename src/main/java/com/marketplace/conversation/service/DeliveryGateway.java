package com.marketplace.conversation.service;

import java.time.Duration;

/**
 * Hands an approved reply to whatever actually talks to the marketplace.
 */
public interface DeliveryGateway {

    /**
     * @param jitterDelay the human-like delay the reply was scheduled with
     * @return true if the message was delivered
     */
    boolean deliver(String buyerId, String text, Duration jitterDelay);
}
