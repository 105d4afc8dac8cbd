package com.marketplace.conversation.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
public class PendingActionExpiryService {

    private static final Logger log = LoggerFactory.getLogger(PendingActionExpiryService.class);

    private final ActionGateService actionGate;

    public PendingActionExpiryService(ActionGateService actionGate) {
        this.actionGate = actionGate;
    }

    @Scheduled(fixedRateString = "${engine.expiry-sweep-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "30")
    public void expireOverdueActions() {
        int expired = actionGate.expireOverdue();
        if (expired > 0) {
            log.info("Expired {} pending actions past their deadline", expired);
        }
    }
}
