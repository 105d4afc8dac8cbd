package com.marketplace.conversation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {
    private String id;
    private String buyerId;
    private String text;
    private long enqueuedAt;
    private long sendAfter;             // epoch ms; moved forward on every deferral
    private long delaySeconds;          // human-like delay computed at enqueue time
    private boolean humanConfirmed;
    private boolean disclosureIncluded;
    private String pendingActionId;
    private int deferrals;
}
