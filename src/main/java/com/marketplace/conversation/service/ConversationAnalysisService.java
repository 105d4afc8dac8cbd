package com.marketplace.conversation.service;

import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.engine.ConversationStateMachine;
import com.marketplace.conversation.engine.GatePolicy;
import com.marketplace.conversation.engine.IntentClassifier;
import com.marketplace.conversation.engine.MessageNormalizer;
import com.marketplace.conversation.engine.PriorityCalculator;
import com.marketplace.conversation.engine.ResponseContext;
import com.marketplace.conversation.engine.ResponseSelector;
import com.marketplace.conversation.engine.RiskScorer;
import com.marketplace.conversation.model.AnalysisResult;
import com.marketplace.conversation.model.AuditActor;
import com.marketplace.conversation.model.AuditOutcome;
import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.Conversation;
import com.marketplace.conversation.model.ConversationState;
import com.marketplace.conversation.model.ConversationSummary;
import com.marketplace.conversation.model.GateResult;
import com.marketplace.conversation.model.InboundMessage;
import com.marketplace.conversation.model.Intent;
import com.marketplace.conversation.model.MessageOutcome;
import com.marketplace.conversation.model.PriorityTier;
import com.marketplace.conversation.model.ProductInfo;
import com.marketplace.conversation.model.RiskAssessment;
import com.marketplace.conversation.model.RiskTier;
import com.marketplace.conversation.repository.ConversationRepository;
import com.marketplace.conversation.repository.ConversationStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Main orchestrator for inbound buyer messages.
 *
 * Flow, under the buyer's lock:
 * 1. Normalise the text, classify the intent and score the fraud risk
 * 2. Load the conversation (in-memory store, then Aerospike, else a new one)
 * 3. Apply the state transition and update counters
 * 4. Select a candidate reply and pass it through the action gate
 * 5. Persist the conversation, best effort
 * 6. Return the outcome, flagged when anything was not persisted
 */
@Service
public class ConversationAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ConversationAnalysisService.class);

    private final IntentClassifier classifier;
    private final RiskScorer riskScorer;
    private final PriorityCalculator priorityCalculator;
    private final ConversationStateMachine stateMachine;
    private final ResponseSelector responseSelector;
    private final GatePolicy gatePolicy;
    private final ActionGateService actionGate;
    private final AuditTrailService auditTrail;
    private final ListingDataService listingData;
    private final ConversationStore store;
    private final ConversationRepository conversationRepo;
    private final BuyerLockRegistry buyerLocks;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final Executor analysisExecutor;

    public ConversationAnalysisService(IntentClassifier classifier,
                                       RiskScorer riskScorer,
                                       PriorityCalculator priorityCalculator,
                                       ConversationStateMachine stateMachine,
                                       ResponseSelector responseSelector,
                                       GatePolicy gatePolicy,
                                       ActionGateService actionGate,
                                       AuditTrailService auditTrail,
                                       ListingDataService listingData,
                                       ConversationStore store,
                                       ConversationRepository conversationRepo,
                                       BuyerLockRegistry buyerLocks,
                                       MetricsConfig metricsConfig,
                                       Clock clock,
                                       @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.classifier = classifier;
        this.riskScorer = riskScorer;
        this.priorityCalculator = priorityCalculator;
        this.stateMachine = stateMachine;
        this.responseSelector = responseSelector;
        this.gatePolicy = gatePolicy;
        this.actionGate = actionGate;
        this.auditTrail = auditTrail;
        this.listingData = listingData;
        this.store = store;
        this.conversationRepo = conversationRepo;
        this.buyerLocks = buyerLocks;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Entry point for the REST API: resolves buyer and product, then analyses.
     */
    public MessageOutcome process(InboundMessage message) {
        BuyerProfile buyer = listingData.getOrCreateBuyer(message);
        ProductInfo product = listingData.getProduct(message);
        return analyze(message.getMessage(), buyer, product);
    }

    /**
     * Same as {@link #process}, on the analysis worker pool. At most {@code engine.worker-threads}
     * analyses run at once; the rest queue.
     */
    public CompletableFuture<MessageOutcome> processAsync(InboundMessage message) {
        return CompletableFuture.supplyAsync(() -> process(message), analysisExecutor);
    }

    /**
     * Analyses one message. Messages from the same buyer are applied one at a time.
     */
    @Observed(name = "conversation.analyze", contextualName = "analyze-message")
    public MessageOutcome analyze(String message, BuyerProfile buyer, ProductInfo product) {
        if (buyer == null || buyer.getId() == null || buyer.getId().isBlank()) {
            throw new IllegalArgumentException("buyer with an id is required");
        }
        return buyerLocks.withLock(buyer.getId(), () -> analyzeLocked(message, buyer, product));
    }

    /**
     * Same as {@link #analyze}, on the analysis worker pool.
     */
    public CompletableFuture<MessageOutcome> analyzeAsync(String message, BuyerProfile buyer, ProductInfo product) {
        return CompletableFuture.supplyAsync(() -> analyze(message, buyer, product), analysisExecutor);
    }

    public ConversationSummary getSummary(String buyerId) {
        return buyerLocks.withLock(buyerId, () -> {
            Optional<Conversation> conversation = store.find(buyerId);
            if (conversation.isEmpty()) {
                conversation = Optional.ofNullable(hydrate(buyerId));
                conversation.ifPresent(store::put);
            }
            return conversation.map(ConversationSummary::of).orElseGet(ConversationSummary::notFound);
        });
    }

    /**
     * Clears the accumulated fraud score after a human has cleared the buyer.
     * @return the updated summary, or empty when there is no conversation with this buyer
     */
    public Optional<ConversationSummary> resetFraudScore(String buyerId, String resetBy) {
        return buyerLocks.withLock(buyerId, () -> {
            Conversation conversation = store.find(buyerId).orElseGet(() -> hydrate(buyerId));
            if (conversation == null) {
                return Optional.empty();
            }
            int previous = conversation.getFraudScore();
            conversation.setFraudScore(0);
            store.put(conversation);
            persist(conversation);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("previousFraudScore", previous);
            details.put("resetBy", resetBy);
            auditTrail.record("fraud_score_reset", buyerId, null, AuditActor.HUMAN, AuditOutcome.APPROVED, details);
            log.info("Fraud score for buyer={} reset from {} by {}", buyerId, previous, resetBy);
            return Optional.of(ConversationSummary.of(conversation));
        });
    }

    private MessageOutcome analyzeLocked(String message, BuyerProfile buyer, ProductInfo product) {
        long now = clock.millis();
        String buyerId = buyer.getId();

        // 1. Pure analysis of the text and profile
        String text = MessageNormalizer.normalize(message);
        Intent intent = classifier.classify(text);
        RiskAssessment risk = riskScorer.assess(text, buyer);
        PriorityTier priority = priorityCalculator.calculate(intent, buyer, text);
        boolean requiresHuman = gatePolicy.requiresHuman(risk.getTier(), intent);

        // 2-3. Conversation update
        Conversation conversation = store.find(buyerId).orElseGet(() -> {
            Conversation hydrated = hydrate(buyerId);
            return hydrated != null ? hydrated : Conversation.start(buyerId, now);
        });
        ConversationState previousState = conversation.getState();
        ConversationState nextState = stateMachine.next(previousState, intent);

        conversation.setState(nextState);
        conversation.setMessageCount(conversation.getMessageCount() + 1);
        conversation.setLastActivity(now);
        conversation.setRecoveryAttempts(0);
        conversation.accumulateFraudScore(risk.getScore());
        conversation.setRequiresAttention(requiresHuman || nextState.needsSellerAttention());
        store.put(conversation);

        AnalysisResult analysis = AnalysisResult.builder()
                .buyerId(buyerId)
                .intent(intent)
                .priorityTier(priority)
                .fraudRisk(risk.getScore())
                .riskTier(risk.getTier())
                .riskSignals(risk.getSignals())
                .previousState(previousState)
                .state(nextState)
                .requiresHuman(requiresHuman)
                .messageCount(conversation.getMessageCount())
                .build();

        // 4. Reply and gate
        String candidate = responseSelector
                .select(new ResponseContext(nextState, intent, risk, product, buyer, message))
                .orElse(null);
        GateResult gate = actionGate.submit(analysis, message, candidate);

        // 5. Persist
        boolean persisted = persist(conversation) && gate.isAuditPersisted();

        // 6. Metrics and logs
        metricsConfig.recordAnalysis(intent.name(), risk.getTier().name(), risk.getScore());
        if (risk.getTier() == RiskTier.HIGH) {
            log.warn("High fraud risk from buyer={}: score={}, intent={}, signals={}",
                    buyerId, risk.getScore(), intent, risk.getSignals());
        }
        if (previousState != nextState) {
            log.info("Conversation with buyer={} moved {} -> {} on {}", buyerId, previousState, nextState, intent);
        }
        log.debug("Analysed message from buyer={}: intent={}, priority={}, risk={}, gate={}",
                buyerId, intent, priority, risk.getScore(), gate.getDecision());

        return MessageOutcome.builder()
                .buyerId(buyerId)
                .analysis(analysis)
                .candidateResponse(candidate)
                .gate(gate)
                .persisted(persisted)
                .evaluatedAt(now)
                .build();
    }

    private Conversation hydrate(String buyerId) {
        try {
            return conversationRepo.findByBuyerId(buyerId);
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("conversation_read");
            log.warn("Could not load conversation for buyer={}, starting fresh: {}", buyerId, e.getMessage());
            return null;
        }
    }

    private boolean persist(Conversation conversation) {
        try {
            conversationRepo.save(conversation);
            return true;
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("conversation");
            log.warn("Conversation for buyer={} not persisted: {}", conversation.getBuyerId(), e.getMessage());
            return false;
        }
    }
}
