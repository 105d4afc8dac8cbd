package com.marketplace.conversation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GateResult {
    private GateDecision decision;
    private String pendingActionId;     // set when decision == PENDING_HUMAN
    private String outboundMessageId;   // set when decision == AUTHORIZED
    private long scheduledSendAt;       // 0 unless AUTHORIZED
    private boolean auditPersisted;

    public static GateResult noResponse() {
        return GateResult.builder()
                .decision(GateDecision.NO_RESPONSE)
                .auditPersisted(true)
                .build();
    }
}
