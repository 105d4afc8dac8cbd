package com.marketplace.conversation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.marketplace.conversation.config.AerospikeConfig;
import com.marketplace.conversation.model.BuyerProfile;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class BuyerProfileRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public BuyerProfileRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public BuyerProfile findById(String buyerId) {
        Key key = new Key(namespace, AerospikeConfig.SET_BUYERS, buyerId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        return BuyerProfile.builder()
                .id(record.getString("id"))
                .username(record.getString("username"))
                .rating(record.getInt("rating"))
                .purchaseCount(record.getInt("purchases"))
                .distanceKm(record.getDouble("distanceKm"))
                .lastActivity(record.getLong("lastActivity"))
                .verified(record.getBoolean("verified"))
                .hasPhoto(record.getBoolean("hasPhoto"))
                .build();
    }

    public void save(BuyerProfile buyer) {
        Key key = new Key(namespace, AerospikeConfig.SET_BUYERS, buyer.getId());

        client.put(writePolicy, key,
                new Bin("id", buyer.getId()),
                new Bin("username", buyer.getUsername()),
                new Bin("rating", buyer.getRating()),
                new Bin("purchases", buyer.getPurchaseCount()),
                new Bin("distanceKm", buyer.getDistanceKm()),
                new Bin("lastActivity", buyer.getLastActivity()),
                new Bin("verified", buyer.isVerified()),
                new Bin("hasPhoto", buyer.isHasPhoto()));
    }
}
