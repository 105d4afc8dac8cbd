package com.marketplace.conversation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.marketplace.conversation.config.AerospikeConfig;
import com.marketplace.conversation.model.Conversation;
import com.marketplace.conversation.model.ConversationState;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class ConversationRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ConversationRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(Conversation conversation) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONVERSATIONS, conversation.getBuyerId());

        client.put(writePolicy, key,
                new Bin("buyerId", conversation.getBuyerId()),
                new Bin("state", conversation.getState().name()),
                new Bin("msgCount", conversation.getMessageCount()),
                new Bin("fraudScore", conversation.getFraudScore()),
                new Bin("createdAt", conversation.getCreatedAt()),
                new Bin("lastActivity", conversation.getLastActivity()),
                new Bin("needsAttn", conversation.isRequiresAttention()),
                new Bin("recoveries", conversation.getRecoveryAttempts()));
    }

    public Conversation findByBuyerId(String buyerId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CONVERSATIONS, buyerId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        return Conversation.builder()
                .buyerId(record.getString("buyerId"))
                .state(ConversationState.valueOf(record.getString("state")))
                .messageCount(record.getInt("msgCount"))
                .fraudScore(record.getInt("fraudScore"))
                .createdAt(record.getLong("createdAt"))
                .lastActivity(record.getLong("lastActivity"))
                .requiresAttention(record.getBoolean("needsAttn"))
                .recoveryAttempts(record.getInt("recoveries"))
                .build();
    }
}
