package com.marketplace.conversation.model;

public record ConversationSummary(boolean exists,
                                  ConversationState state,
                                  int messageCount,
                                  boolean requiresAttention,
                                  int fraudScore,
                                  long lastActivity) {

    public static ConversationSummary notFound() {
        return new ConversationSummary(false, null, 0, false, 0, 0L);
    }

    public static ConversationSummary of(Conversation conversation) {
        return new ConversationSummary(true,
                conversation.getState(),
                conversation.getMessageCount(),
                conversation.isRequiresAttention(),
                conversation.getFraudScore(),
                conversation.getLastActivity());
    }
}
