package com.marketplace.conversation.service;

import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.InboundMessage;
import com.marketplace.conversation.model.ProductInfo;
import com.marketplace.conversation.repository.BuyerProfileRepository;
import com.marketplace.conversation.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Resolves the buyer and product snapshots an inbound message is analysed against.
 * Snapshots sent with the message win and are stored; otherwise they are looked up by id.
 */
@Service
public class ListingDataService {

    private static final Logger log = LoggerFactory.getLogger(ListingDataService.class);

    private final BuyerProfileRepository buyerRepo;
    private final ProductRepository productRepo;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ListingDataService(BuyerProfileRepository buyerRepo,
                              ProductRepository productRepo,
                              MetricsConfig metricsConfig,
                              Clock clock) {
        this.buyerRepo = buyerRepo;
        this.productRepo = productRepo;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * A buyer seen for the first time without a snapshot gets an unrated, unverified profile,
     * so it scores as a new account.
     */
    public BuyerProfile getOrCreateBuyer(InboundMessage message) {
        BuyerProfile snapshot = message.getBuyer();
        String buyerId = pickId(message.getBuyerId(), snapshot != null ? snapshot.getId() : null, "buyer");

        if (snapshot != null) {
            snapshot.setId(buyerId);
            saveBuyer(snapshot);
            return snapshot;
        }

        BuyerProfile stored = null;
        try {
            stored = buyerRepo.findById(buyerId);
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("buyer_read");
            log.warn("Could not load buyer={}, treating as new: {}", buyerId, e.getMessage());
        }
        if (stored != null) {
            return stored;
        }

        BuyerProfile created = BuyerProfile.builder()
                .id(buyerId)
                .lastActivity(clock.millis())
                .build();
        saveBuyer(created);
        log.debug("Created profile for unknown buyer={}", buyerId);
        return created;
    }

    /**
     * @throws IllegalArgumentException if no snapshot was sent and the product is unknown
     */
    public ProductInfo getProduct(InboundMessage message) {
        ProductInfo snapshot = message.getProduct();
        String productId = pickId(message.getProductId(), snapshot != null ? snapshot.getId() : null, "product");

        if (snapshot != null) {
            snapshot.setId(productId);
            try {
                productRepo.save(snapshot);
            } catch (Exception e) {
                metricsConfig.recordPersistenceFailure("product");
                log.warn("Product {} snapshot not persisted: {}", productId, e.getMessage());
            }
            return snapshot;
        }

        ProductInfo stored;
        try {
            stored = productRepo.findById(productId);
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("product_read");
            log.warn("Could not load product {}: {}", productId, e.getMessage());
            stored = null;
        }
        if (stored == null) {
            throw new IllegalArgumentException("Unknown product " + productId + ", send a product snapshot");
        }
        return stored;
    }

    private void saveBuyer(BuyerProfile buyer) {
        try {
            buyerRepo.save(buyer);
        } catch (Exception e) {
            metricsConfig.recordPersistenceFailure("buyer");
            log.warn("Buyer {} profile not persisted: {}", buyer.getId(), e.getMessage());
        }
    }

    private static String pickId(String explicitId, String snapshotId, String kind) {
        if (explicitId != null && !explicitId.isBlank()) {
            if (snapshotId != null && !snapshotId.isBlank() && !snapshotId.equals(explicitId)) {
                throw new IllegalArgumentException(
                        kind + "Id " + explicitId + " does not match " + kind + " snapshot id " + snapshotId);
            }
            return explicitId;
        }
        if (snapshotId != null && !snapshotId.isBlank()) {
            return snapshotId;
        }
        throw new IllegalArgumentException(kind + "Id or a " + kind + " snapshot is required");
    }
}
