package com.marketplace.conversation.service;

import com.marketplace.conversation.config.EngineConfig;
import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.engine.ConversationStateMachine;
import com.marketplace.conversation.engine.GatePolicy;
import com.marketplace.conversation.engine.ResponseSelector;
import com.marketplace.conversation.model.AnalysisResult;
import com.marketplace.conversation.model.Conversation;
import com.marketplace.conversation.model.ConversationState;
import com.marketplace.conversation.model.GateResult;
import com.marketplace.conversation.model.Intent;
import com.marketplace.conversation.model.PriorityTier;
import com.marketplace.conversation.model.RecoveryStage;
import com.marketplace.conversation.model.RiskTier;
import com.marketplace.conversation.repository.ConversationRepository;
import com.marketplace.conversation.repository.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Marks conversations Abandoned once the buyer has been silent for {@code engine.abandon-after-hours},
 * then tries to win them back with one follow-up after 24h of silence and another after 48h.
 * Follow-ups go through the action gate like any other reply.
 */
@Service
public class ConversationSweepService {

    private static final Logger log = LoggerFactory.getLogger(ConversationSweepService.class);

    private final ConversationStore store;
    private final ConversationRepository conversationRepo;
    private final ConversationStateMachine stateMachine;
    private final BuyerLockRegistry buyerLocks;
    private final ResponseSelector responseSelector;
    private final GatePolicy gatePolicy;
    private final ActionGateService actionGate;
    private final EngineConfig engineConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ConversationSweepService(ConversationStore store,
                                    ConversationRepository conversationRepo,
                                    ConversationStateMachine stateMachine,
                                    BuyerLockRegistry buyerLocks,
                                    ResponseSelector responseSelector,
                                    GatePolicy gatePolicy,
                                    ActionGateService actionGate,
                                    EngineConfig engineConfig,
                                    MetricsConfig metricsConfig,
                                    Clock clock) {
        this.store = store;
        this.conversationRepo = conversationRepo;
        this.stateMachine = stateMachine;
        this.buyerLocks = buyerLocks;
        this.responseSelector = responseSelector;
        this.gatePolicy = gatePolicy;
        this.actionGate = actionGate;
        this.engineConfig = engineConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${engine.abandon-sweep-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "5")
    public int markInactiveConversations() {
        long cutoff = clock.millis() - TimeUnit.HOURS.toMillis(engineConfig.getAbandonAfterHours());
        int abandoned = 0;

        for (Conversation candidate : store.findAll()) {
            if (candidate.getState() == ConversationState.ABANDONED || candidate.getLastActivity() > cutoff) {
                continue;
            }
            String buyerId = candidate.getBuyerId();
            boolean changed = buyerLocks.withLock(buyerId, () -> abandonIfStillInactive(buyerId, cutoff));
            if (changed) {
                abandoned++;
            }
        }

        if (abandoned > 0) {
            log.info("Marked {} inactive conversations as abandoned", abandoned);
            metricsConfig.recordConversationsAbandoned(abandoned);
        }
        return abandoned;
    }

    // Re-checked under the buyer lock, a message may have arrived since the scan.
    private boolean abandonIfStillInactive(String buyerId, long cutoff) {
        Conversation conversation = store.find(buyerId).orElse(null);
        if (conversation == null
                || conversation.getState() == ConversationState.ABANDONED
                || conversation.getLastActivity() > cutoff) {
            return false;
        }
        ConversationState previous = conversation.getState();
        conversation.setState(stateMachine.onInactivity(previous));
        conversation.setRequiresAttention(false);
        store.put(conversation);
        log.debug("Conversation with buyer={} abandoned (was {})", buyerId, previous);
        persist(conversation);
        return true;
    }

    @Scheduled(fixedRateString = "${engine.abandon-sweep-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "10")
    public int sendRecoveryReplies() {
        if (!engineConfig.isRecoveryEnabled()) {
            return 0;
        }
        long now = clock.millis();
        int submitted = 0;

        for (Conversation candidate : store.findAll()) {
            if (dueRecovery(candidate, now).isEmpty()) {
                continue;
            }
            String buyerId = candidate.getBuyerId();
            if (buyerLocks.withLock(buyerId, () -> recoverIfDue(buyerId, now))) {
                submitted++;
            }
        }

        if (submitted > 0) {
            log.info("Submitted {} recovery replies to abandoned conversations", submitted);
        }
        return submitted;
    }

    /**
     * Latest stage whose silence threshold has passed and that has not been sent yet.
     * A buyer silent for three days gets only the 48h follow-up.
     */
    Optional<RecoveryStage> dueRecovery(Conversation conversation, long now) {
        if (conversation.getState() != ConversationState.ABANDONED
                || conversation.getMessageCount() >= engineConfig.getRecoveryMaxMessages()) {
            return Optional.empty();
        }
        long silentHours = TimeUnit.MILLISECONDS.toHours(now - conversation.getLastActivity());
        RecoveryStage due = null;
        for (RecoveryStage stage : RecoveryStage.values()) {
            if (silentHours >= stage.getAfterHours() && conversation.getRecoveryAttempts() < stage.attemptsAfter()) {
                due = stage;
            }
        }
        return Optional.ofNullable(due);
    }

    private boolean recoverIfDue(String buyerId, long now) {
        Conversation conversation = store.find(buyerId).orElse(null);
        if (conversation == null) {
            return false;
        }
        Optional<RecoveryStage> stage = dueRecovery(conversation, now);
        if (stage.isEmpty()) {
            return false;
        }
        RiskTier tier = gatePolicy.tierFor(conversation.getFraudScore());
        if (tier == RiskTier.HIGH) {
            log.debug("No recovery for buyer={}, fraud score {}", buyerId, conversation.getFraudScore());
            return false;
        }
        Optional<String> text = responseSelector.recovery(stage.get(), buyerId);
        if (text.isEmpty()) {
            return false;
        }

        AnalysisResult analysis = AnalysisResult.builder()
                .buyerId(buyerId)
                .intent(Intent.UNKNOWN)
                .priorityTier(PriorityTier.LOW)
                .fraudRisk(conversation.getFraudScore())
                .riskTier(tier)
                .riskSignals(List.of())
                .previousState(conversation.getState())
                .state(conversation.getState())
                .requiresHuman(gatePolicy.requiresHuman(tier, Intent.UNKNOWN))
                .messageCount(conversation.getMessageCount())
                .build();
        GateResult gate = actionGate.submit(analysis, null, text.get());

        conversation.setRecoveryAttempts(stage.get().attemptsAfter());
        store.put(conversation);
        persist(conversation);

        metricsConfig.recordRecoverySubmitted(stage.get().getTemplateKey(), gate.getDecision().name());
        log.info("Recovery reply ({}) for buyer={} submitted: {}", stage.get().getTemplateKey(), buyerId,
                gate.getDecision());
        return true;
    }

    private void persist(Conversation conversation) {
        try {
            conversationRepo.save(conversation);
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("conversation");
            log.warn("Conversation for buyer={} not persisted: {}", conversation.getBuyerId(), e.getMessage());
        }
    }
}
