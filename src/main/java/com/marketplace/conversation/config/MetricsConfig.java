package com.marketplace.conversation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activePendingActions;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activePendingActions = registry.gauge("gate.pending.active", new AtomicInteger(0));
    }

    public void recordAnalysis(String intent, String riskTier, int fraudRisk) {
        Counter.builder("analysis.count")
                .tag("intent", intent)
                .tag("risk_tier", riskTier)
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.fraud_risk")
                .tag("intent", intent)
                .register(registry)
                .record(fraudRisk);
    }

    public void recordGateDecision(String decision) {
        Counter.builder("gate.decision.count")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordPendingResolved(String outcome) {
        Counter.builder("gate.pending.resolved.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void updateActivePendingActions(int count) {
        activePendingActions.set(count);
    }

    public void recordDelivery(String status) {
        Counter.builder("delivery.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDeferral(String reason) {
        Counter.builder("delivery.deferred.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPersistenceFailure(String target) {
        Counter.builder("persistence.failure.count")
                .tag("target", target)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordConversationsAbandoned(int count) {
        Counter.builder("conversation.abandoned.count")
                .register(registry)
                .increment(count);
    }

    public void recordRecoverySubmitted(String stage, String decision) {
        Counter.builder("conversation.recovery.count")
                .tag("stage", stage)
                .tag("decision", decision)
                .register(registry)
                .increment();
    }
}
