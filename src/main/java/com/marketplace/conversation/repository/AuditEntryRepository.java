package com.marketplace.conversation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.conversation.config.AerospikeConfig;
import com.marketplace.conversation.model.AuditActor;
import com.marketplace.conversation.model.AuditEntry;
import com.marketplace.conversation.model.AuditOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Audit entries are written once and never updated.
 */
@Repository
public class AuditEntryRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditEntryRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AuditEntryRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(AuditEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT, entry.getId());

        client.put(writePolicy, key,
                new Bin("id", entry.getId()),
                new Bin("ts", entry.getTimestamp()),
                new Bin("action", entry.getAction()),
                new Bin("buyerId", entry.getBuyerId()),
                new Bin("refId", entry.getReferenceId() != null ? entry.getReferenceId() : ""),
                new Bin("actor", entry.getActor().name()),
                new Bin("outcome", entry.getOutcome().name()),
                new Bin("compliance", entry.isCompliance()),
                new Bin("details", serializeDetails(entry.getDetails())));
    }

    /**
     * Most recent entries first, optionally restricted to one buyer.
     */
    public List<AuditEntry> findRecent(String buyerId, int limit) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT,
                (key, record) -> {
                    try {
                        if (buyerId != null && !buyerId.isEmpty()
                                && !buyerId.equals(record.getString("buyerId"))) {
                            return;
                        }
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditEntry::getTimestamp).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private AuditEntry mapRecord(Record record) {
        String refId = record.getString("refId");
        return AuditEntry.builder()
                .id(record.getString("id"))
                .timestamp(record.getLong("ts"))
                .action(record.getString("action"))
                .buyerId(record.getString("buyerId"))
                .referenceId(refId == null || refId.isEmpty() ? null : refId)
                .actor(AuditActor.valueOf(record.getString("actor")))
                .outcome(AuditOutcome.valueOf(record.getString("outcome")))
                .compliance(record.getBoolean("compliance"))
                .details(deserializeDetails(record.getString("details")))
                .build();
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details != null ? details : Collections.emptyMap());
        } catch (Exception e) {
            log.error("Failed to serialize audit details", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize audit details", e);
            return Collections.emptyMap();
        }
    }
}
