package com.marketplace.conversation.service;

import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.engine.GatePolicy;
import com.marketplace.conversation.model.ActionType;
import com.marketplace.conversation.model.AnalysisResult;
import com.marketplace.conversation.model.ApprovalOutcome;
import com.marketplace.conversation.model.AuditActor;
import com.marketplace.conversation.model.AuditOutcome;
import com.marketplace.conversation.model.GateDecision;
import com.marketplace.conversation.model.GateResult;
import com.marketplace.conversation.model.OutboundMessage;
import com.marketplace.conversation.model.PendingAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Decides whether a reply may go out on its own or must wait for a human.
 *
 * <p>Held replies become {@link PendingAction}s with a deadline. Anything other than an explicit
 * approval before the deadline (rejection, expiry, supersession by a newer action) resolves the
 * action without sending. Every resolution is audited.
 */
@Service
public class ActionGateService {

    private static final Logger log = LoggerFactory.getLogger(ActionGateService.class);

    static final String SYSTEM_ACTOR = "SYSTEM";

    private final GatePolicy gatePolicy;
    private final PendingActionRegistry registry;
    private final AuditTrailService auditTrail;
    private final OutboundDispatchService dispatcher;
    private final ResponseDelayCalculator delayCalculator;
    private final ReviewNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final TaskScheduler scheduler;
    private final Clock clock;
    // At most one deadline timer per awaited action, cancelled when the action resolves
    private final Map<String, ScheduledFuture<?>> deadlineTimers = new ConcurrentHashMap<>();

    public ActionGateService(GatePolicy gatePolicy,
                             PendingActionRegistry registry,
                             AuditTrailService auditTrail,
                             OutboundDispatchService dispatcher,
                             ResponseDelayCalculator delayCalculator,
                             ReviewNotificationService notificationService,
                             MetricsConfig metricsConfig,
                             TaskScheduler scheduler,
                             Clock clock) {
        this.gatePolicy = gatePolicy;
        this.registry = registry;
        this.auditTrail = auditTrail;
        this.dispatcher = dispatcher;
        this.delayCalculator = delayCalculator;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * @param candidateResponse reply suggested by the selector, or null when there is nothing to send
     */
    public GateResult submit(AnalysisResult analysis, String originalMessage, String candidateResponse) {
        if (analysis.isRequiresHuman()) {
            return hold(analysis, originalMessage, candidateResponse);
        }
        if (candidateResponse == null) {
            metricsConfig.recordGateDecision(GateDecision.NO_RESPONSE.name());
            return GateResult.noResponse();
        }
        return authorize(analysis, candidateResponse);
    }

    /**
     * Applies a human decision. Approval needs reply text, either the suggestion or an override.
     *
     * @return the resolved action, or empty if it is not active (unknown or already resolved)
     * @throws IllegalArgumentException if the decision is incomplete
     */
    public Optional<PendingAction> decide(String actionId, boolean approved, String decidedBy,
                                          String responseOverride) {
        if (decidedBy == null || decidedBy.isBlank()) {
            throw new IllegalArgumentException("decidedBy is required");
        }
        Optional<PendingAction> current = registry.find(actionId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        boolean overridden = responseOverride != null && !responseOverride.isBlank();
        String reply = overridden ? responseOverride.trim() : current.get().getCandidateResponse();
        if (approved && (reply == null || reply.isBlank())) {
            throw new IllegalArgumentException(
                    "Pending action " + actionId + " has no suggested reply, a responseOverride is required");
        }

        Optional<PendingAction> claimed = registry.remove(actionId);
        if (claimed.isEmpty()) {
            log.warn("Pending action {} was resolved concurrently, decision by {} ignored", actionId, decidedBy);
            return Optional.empty();
        }
        PendingAction action = claimed.get();
        long now = clock.millis();

        if (action.isExpiredAt(now)) {
            resolveExpired(action, now);
            return Optional.of(action);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("decidedBy", decidedBy);
        if (!approved) {
            resolve(action, ApprovalOutcome.REJECTED, decidedBy, now);
            auditTrail.record("action_rejected", action.getBuyerId(), action.getId(),
                    AuditActor.HUMAN, AuditOutcome.REJECTED, details);
            log.info("Pending action {} for buyer={} rejected by {}", actionId, action.getBuyerId(), decidedBy);
            return Optional.of(action);
        }

        String text = gatePolicy.approvedText(reply);
        OutboundMessage outbound = dispatcher.enqueue(action.getBuyerId(), text, delayCalculator.nextDelay(),
                true, gatePolicy.disclosureMessage().isPresent(), action.getId());
        resolve(action, ApprovalOutcome.APPROVED, decidedBy, now);

        details.put("outboundMessageId", outbound.getId());
        details.put("overridden", overridden);
        details.put("disclosure", outbound.isDisclosureIncluded());
        auditTrail.record("action_approved", action.getBuyerId(), action.getId(),
                AuditActor.HUMAN, AuditOutcome.APPROVED, details);
        log.info("Pending action {} for buyer={} approved by {}, reply {} queued",
                actionId, action.getBuyerId(), decidedBy, outbound.getId());
        return Optional.of(action);
    }

    /**
     * Expires every action whose deadline has passed.
     * @return number of actions expired
     */
    public int expireOverdue() {
        int expired = 0;
        for (String actionId : registry.overdueIds(clock.millis())) {
            if (expireIfOverdue(actionId)) {
                expired++;
            }
        }
        return expired;
    }

    /**
     * Completes with the human decision, or with {@link ApprovalOutcome#EXPIRED} once the deadline
     * passes. Cancelling the returned future only stops the caller waiting.
     */
    public CompletableFuture<ApprovalOutcome> awaitDecision(String actionId) {
        Optional<PendingAction> active = registry.find(actionId);
        if (active.isEmpty()) {
            return CompletableFuture.completedFuture(
                    registry.resolvedOutcome(actionId).orElse(ApprovalOutcome.REJECTED));
        }
        PendingAction action = active.get();
        deadlineTimers.computeIfAbsent(actionId, id -> scheduleDeadline(action));
        return action.getDecision().copy();
    }

    public List<PendingAction> listPending() {
        return registry.active();
    }

    public Optional<PendingAction> findPending(String actionId) {
        return registry.find(actionId);
    }

    private GateResult hold(AnalysisResult analysis, String originalMessage, String candidateResponse) {
        long now = clock.millis();
        PendingAction action = PendingAction.builder()
                .id(UUID.randomUUID().toString())
                .actionType(ActionType.SEND_MESSAGE)
                .buyerId(analysis.getBuyerId())
                .originalMessage(originalMessage)
                .analysis(analysis)
                .candidateResponse(candidateResponse)
                .createdAt(now)
                .expiresAt(now + gatePolicy.getPendingActionTtl().toMillis())
                .outcome(ApprovalOutcome.PENDING)
                .build();

        boolean persisted = true;
        Optional<PendingAction> superseded = registry.register(action);
        if (superseded.isPresent()) {
            PendingAction previous = superseded.get();
            resolve(previous, ApprovalOutcome.REJECTED, SYSTEM_ACTOR, now);
            Map<String, Object> supersededDetails = new LinkedHashMap<>();
            supersededDetails.put("supersededBy", action.getId());
            persisted = auditTrail.record("action_superseded", previous.getBuyerId(), previous.getId(),
                    AuditActor.AUTOMATED, AuditOutcome.REJECTED, supersededDetails);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actionType", action.getActionType().name());
        details.put("intent", analysis.getIntent().name());
        details.put("fraudRisk", analysis.getFraudRisk());
        details.put("riskTier", analysis.getRiskTier().name());
        details.put("hasSuggestion", candidateResponse != null);
        details.put("expiresAt", action.getExpiresAt());
        persisted &= auditTrail.record("action_pending", action.getBuyerId(), action.getId(),
                AuditActor.AUTOMATED, AuditOutcome.PENDING, details);

        metricsConfig.recordGateDecision(GateDecision.PENDING_HUMAN.name());
        metricsConfig.updateActivePendingActions(registry.size());
        log.info("Reply for buyer={} held for human review as action {} (intent={}, risk={})",
                action.getBuyerId(), action.getId(), analysis.getIntent(), analysis.getFraudRisk());

        try {
            notificationService.notifyHumanDecisionRequired(action);
        } catch (RuntimeException e) {
            log.error("Could not dispatch review notification for action {}: {}", action.getId(), e.getMessage(), e);
        }

        return GateResult.builder()
                .decision(GateDecision.PENDING_HUMAN)
                .pendingActionId(action.getId())
                .auditPersisted(persisted)
                .build();
    }

    private GateResult authorize(AnalysisResult analysis, String candidateResponse) {
        OutboundMessage outbound = dispatcher.enqueue(analysis.getBuyerId(), candidateResponse,
                delayCalculator.nextDelay(), false, false, null);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("intent", analysis.getIntent().name());
        details.put("fraudRisk", analysis.getFraudRisk());
        details.put("delaySeconds", outbound.getDelaySeconds());
        boolean persisted = auditTrail.record("send_authorized", analysis.getBuyerId(), outbound.getId(),
                AuditActor.AUTOMATED, AuditOutcome.APPROVED, details);

        metricsConfig.recordGateDecision(GateDecision.AUTHORIZED.name());
        return GateResult.builder()
                .decision(GateDecision.AUTHORIZED)
                .outboundMessageId(outbound.getId())
                .scheduledSendAt(outbound.getSendAfter())
                .auditPersisted(persisted)
                .build();
    }

    private ScheduledFuture<?> scheduleDeadline(PendingAction action) {
        return scheduler.schedule(() -> onDeadline(action.getId()), Instant.ofEpochMilli(action.getExpiresAt()));
    }

    // The timer may fire slightly before the clock reaches the deadline; wait again in that case.
    private void onDeadline(String actionId) {
        deadlineTimers.remove(actionId);
        if (expireIfOverdue(actionId)) {
            return;
        }
        registry.find(actionId).ifPresent(action ->
                deadlineTimers.computeIfAbsent(actionId, id -> scheduleDeadline(action)));
    }

    private boolean expireIfOverdue(String actionId) {
        long now = clock.millis();
        Optional<PendingAction> current = registry.find(actionId);
        if (current.isEmpty() || !current.get().isExpiredAt(now)) {
            return false;
        }
        Optional<PendingAction> claimed = registry.remove(actionId);
        if (claimed.isEmpty()) {
            return false;
        }
        resolveExpired(claimed.get(), now);
        return true;
    }

    private void resolveExpired(PendingAction action, long now) {
        resolve(action, ApprovalOutcome.EXPIRED, SYSTEM_ACTOR, now);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("createdAt", action.getCreatedAt());
        details.put("expiresAt", action.getExpiresAt());
        auditTrail.record("action_expired", action.getBuyerId(), action.getId(),
                AuditActor.AUTOMATED, AuditOutcome.EXPIRED, details);
        log.info("Pending action {} for buyer={} expired without a decision, nothing sent",
                action.getId(), action.getBuyerId());
    }

    private void resolve(PendingAction action, ApprovalOutcome outcome, String decidedBy, long now) {
        action.setOutcome(outcome);
        action.setDecidedBy(decidedBy);
        action.setDecidedAt(now);
        registry.markResolved(action.getId(), outcome);
        ScheduledFuture<?> timer = deadlineTimers.remove(action.getId());
        if (timer != null) {
            timer.cancel(false);
        }
        action.getDecision().complete(outcome);
        metricsConfig.recordPendingResolved(outcome.name());
        metricsConfig.updateActivePendingActions(registry.size());
    }
}
