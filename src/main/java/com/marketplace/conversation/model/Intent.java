package com.marketplace.conversation.model;

/**
 * Classified purpose of an inbound buyer message.
 */
public enum Intent {
    GREETING,
    AVAILABILITY,
    PRODUCT_CONDITION,
    PRICE,
    NEGOTIATION,
    SHIPPING,
    PAYMENT,
    LOCATION,
    DIRECT_PURCHASE,
    INFORMATION,
    FRAUD,
    UNKNOWN
}
