package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.ConversationState;
import com.marketplace.conversation.model.Intent;
import org.springframework.stereotype.Component;

/**
 * Transition table for buyer conversations.
 *
 * <ul>
 *   <li>Initial stays Initial until the buyer negotiates or commits.</li>
 *   <li>Initial, Negotiating or Recovered + Negotiation -> Negotiating.</li>
 *   <li>Any non-terminal state + DirectPurchase -> Committed.</li>
 *   <li>Committed + Location -> Coordinating. Coordinating is only reachable through Committed.</li>
 *   <li>Abandoned + any message -> Recovered, which then moves like Negotiating.</li>
 *   <li>Inactivity (detected by a sweep, never by {@link #next}) -> Abandoned.</li>
 * </ul>
 *
 * Fraud never changes the state; risk is handled by the scorer and the gate.
 */
@Component
public class ConversationStateMachine {

    public ConversationState next(ConversationState current, Intent intent) {
        if (current == null) {
            current = ConversationState.INITIAL;
        }
        if (current == ConversationState.ABANDONED) {
            return ConversationState.RECOVERED;
        }

        switch (current) {
            case INITIAL:
            case NEGOTIATING:
            case RECOVERED:
                if (intent == Intent.DIRECT_PURCHASE) return ConversationState.COMMITTED;
                if (intent == Intent.NEGOTIATION) return ConversationState.NEGOTIATING;
                return current;
            case COMMITTED:
                if (intent == Intent.LOCATION) return ConversationState.COORDINATING;
                return current;
            case COORDINATING:
            default:
                return current;
        }
    }

    public ConversationState onInactivity(ConversationState current) {
        return ConversationState.ABANDONED;
    }

    public boolean canTransition(ConversationState from, ConversationState to) {
        if (from == to) return true;
        if (to == ConversationState.ABANDONED) return true;
        for (Intent intent : Intent.values()) {
            if (next(from, intent) == to) return true;
        }
        return false;
    }
}
