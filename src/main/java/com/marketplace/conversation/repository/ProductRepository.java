package com.marketplace.conversation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.marketplace.conversation.config.AerospikeConfig;
import com.marketplace.conversation.model.ProductInfo;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;

@Repository
public class ProductRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ProductRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public ProductInfo findById(String productId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PRODUCTS, productId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        return ProductInfo.builder()
                .id(record.getString("id"))
                .title(record.getString("title"))
                .price(toDecimal(record.getString("price")))
                .floorPrice(toDecimal(record.getString("floorPrice")))
                .description(record.getString("description"))
                .condition(record.getString("condition"))
                .category(record.getString("category"))
                .shipping(record.getBoolean("shipping"))
                .zone(record.getString("zone"))
                .build();
    }

    public void save(ProductInfo product) {
        Key key = new Key(namespace, AerospikeConfig.SET_PRODUCTS, product.getId());

        // Prices stored as strings to keep BigDecimal precision
        client.put(writePolicy, key,
                new Bin("id", product.getId()),
                new Bin("title", product.getTitle()),
                new Bin("price", product.getPrice() != null ? product.getPrice().toPlainString() : null),
                new Bin("floorPrice", product.getFloorPrice() != null ? product.getFloorPrice().toPlainString() : null),
                new Bin("description", product.getDescription()),
                new Bin("condition", product.getCondition()),
                new Bin("category", product.getCategory()),
                new Bin("shipping", product.isShipping()),
                new Bin("zone", product.getZone()));
    }

    private static BigDecimal toDecimal(String value) {
        return value == null || value.isEmpty() ? null : new BigDecimal(value);
    }
}
