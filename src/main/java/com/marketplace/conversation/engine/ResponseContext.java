package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.ConversationState;
import com.marketplace.conversation.model.Intent;
import com.marketplace.conversation.model.ProductInfo;
import com.marketplace.conversation.model.RiskAssessment;

/**
 * Inputs for choosing a reply to one message.
 */
public record ResponseContext(ConversationState state,
                              Intent intent,
                              RiskAssessment risk,
                              ProductInfo product,
                              BuyerProfile buyer,
                              String message) {
}
