package com.marketplace.conversation.model;

public enum ActionType {
    SEND_MESSAGE,
    ACCEPT_OFFER,
    REJECT_OFFER,
    BLOCK_USER,
    SHARE_CONTACT
}
