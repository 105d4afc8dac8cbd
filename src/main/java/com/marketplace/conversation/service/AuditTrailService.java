package com.marketplace.conversation.service;

import com.marketplace.conversation.config.EngineConfig;
import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.engine.GatePolicy;
import com.marketplace.conversation.model.AuditActor;
import com.marketplace.conversation.model.AuditEntry;
import com.marketplace.conversation.model.AuditOutcome;
import com.marketplace.conversation.repository.AuditEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only record of gated decisions. Entries are kept in memory for the review API,
 * logged, and written to Aerospike on a best-effort basis. Once the in-memory window has
 * dropped entries, older ones are read back from Aerospike.
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    private final AuditEntryRepository auditRepo;
    private final GatePolicy gatePolicy;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final int retention;
    private final Deque<AuditEntry> recent = new ArrayDeque<>();
    private boolean evicted;            // guarded by recent

    public AuditTrailService(AuditEntryRepository auditRepo,
                             GatePolicy gatePolicy,
                             EngineConfig engineConfig,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.auditRepo = auditRepo;
        this.gatePolicy = gatePolicy;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.retention = Math.max(1, engineConfig.getAuditRetention());
    }

    /**
     * @return true if the entry also reached the audit store
     */
    public boolean record(String action, String buyerId, String referenceId,
                          AuditActor actor, AuditOutcome outcome, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.millis())
                .action(action)
                .buyerId(buyerId)
                .referenceId(referenceId)
                .actor(actor)
                .outcome(outcome)
                .compliance(gatePolicy.isSupervised())
                .details(details != null ? new LinkedHashMap<>(details) : Collections.emptyMap())
                .build();

        synchronized (recent) {
            recent.addFirst(entry);
            while (recent.size() > retention) {
                recent.removeLast();
                evicted = true;
            }
        }

        log.info("[AUDIT] action={} buyer={} ref={} actor={} outcome={} compliance={} details={}",
                action, buyerId, referenceId, actor, outcome, entry.isCompliance(), entry.getDetails());

        try {
            auditRepo.save(entry);
            return true;
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("audit");
            log.warn("Audit entry {} kept in memory only, store unavailable: {}", entry.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Newest first. A null or empty buyer id returns entries for every buyer.
     */
    public List<AuditEntry> recent(String buyerId, int limit) {
        List<AuditEntry> result = new ArrayList<>();
        boolean truncated;
        synchronized (recent) {
            Iterator<AuditEntry> it = recent.iterator();
            while (it.hasNext() && result.size() < limit) {
                AuditEntry entry = it.next();
                if (buyerId == null || buyerId.isEmpty() || buyerId.equals(entry.getBuyerId())) {
                    result.add(entry);
                }
            }
            truncated = evicted;
        }
        if (result.size() >= limit || !truncated) {
            return result;
        }

        try {
            return merge(result, auditRepo.findRecent(buyerId, limit), limit);
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("audit_read");
            log.warn("Older audit entries unavailable, returning the {} held in memory: {}",
                    result.size(), e.getMessage());
            return result;
        }
    }

    // Entries that never reached the store exist only in memory, so both sources are combined.
    private static List<AuditEntry> merge(List<AuditEntry> inMemory, List<AuditEntry> stored, int limit) {
        Map<String, AuditEntry> byId = new LinkedHashMap<>();
        inMemory.forEach(entry -> byId.put(entry.getId(), entry));
        stored.forEach(entry -> byId.putIfAbsent(entry.getId(), entry));

        List<AuditEntry> merged = new ArrayList<>(byId.values());
        merged.sort(Comparator.comparingLong(AuditEntry::getTimestamp).reversed());
        return merged.size() > limit ? new ArrayList<>(merged.subList(0, limit)) : merged;
    }
}
