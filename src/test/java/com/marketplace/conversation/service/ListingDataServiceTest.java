package com.marketplace.conversation.service;

import com.aerospike.client.AerospikeException;
import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.InboundMessage;
import com.marketplace.conversation.model.ProductInfo;
import com.marketplace.conversation.repository.BuyerProfileRepository;
import com.marketplace.conversation.repository.ProductRepository;
import com.marketplace.conversation.testutil.MutableClock;
import com.marketplace.conversation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListingDataServiceTest {

    @Mock private BuyerProfileRepository buyerRepo;
    @Mock private ProductRepository productRepo;
    @Mock private MetricsConfig metricsConfig;

    private MutableClock clock;
    private ListingDataService listingData;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T10:00:00Z"));
        listingData = new ListingDataService(buyerRepo, productRepo, metricsConfig, clock);
    }

    private static InboundMessage byIds(String buyerId, String productId) {
        return InboundMessage.builder().buyerId(buyerId).productId(productId).message("Hola").build();
    }

    @Test
    void getOrCreateBuyer_snapshotIsStoredAndUsed() {
        BuyerProfile snapshot = TestDataFactory.trustedBuyer("B-1");
        InboundMessage message = InboundMessage.builder().buyer(snapshot).message("Hola").build();

        BuyerProfile buyer = listingData.getOrCreateBuyer(message);

        assertThat(buyer).isSameAs(snapshot);
        verify(buyerRepo).save(snapshot);
        verify(buyerRepo, never()).findById(any());
    }

    @Test
    void getOrCreateBuyer_knownBuyerIsLoaded() {
        BuyerProfile stored = TestDataFactory.trustedBuyer("B-1");
        when(buyerRepo.findById("B-1")).thenReturn(stored);

        assertThat(listingData.getOrCreateBuyer(byIds("B-1", "item-001"))).isSameAs(stored);
        verify(buyerRepo, never()).save(any());
    }

    @Test
    void getOrCreateBuyer_unknownBuyerGetsUnratedProfile() {
        BuyerProfile buyer = listingData.getOrCreateBuyer(byIds("B-new", "item-001"));

        assertThat(buyer.getId()).isEqualTo("B-new");
        assertThat(buyer.getRating()).isZero();
        assertThat(buyer.getPurchaseCount()).isZero();
        assertThat(buyer.isVerified()).isFalse();
        assertThat(buyer.getLastActivity()).isEqualTo(clock.millis());
        verify(buyerRepo).save(buyer);
    }

    @Test
    void getOrCreateBuyer_lookupFailureTreatsBuyerAsNew() {
        when(buyerRepo.findById("B-1")).thenThrow(new AerospikeException("timeout"));

        BuyerProfile buyer = listingData.getOrCreateBuyer(byIds("B-1", "item-001"));

        assertThat(buyer.getRating()).isZero();
        verify(metricsConfig).recordPersistenceFailure("buyer_read");
    }

    @Test
    void getOrCreateBuyer_mismatchedIdsAreRejected() {
        InboundMessage message = InboundMessage.builder()
                .buyerId("B-1")
                .buyer(TestDataFactory.trustedBuyer("B-2"))
                .build();

        assertThatThrownBy(() -> listingData.getOrCreateBuyer(message))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    void getOrCreateBuyer_noIdAtAllIsRejected() {
        assertThatThrownBy(() -> listingData.getOrCreateBuyer(byIds(null, "item-001")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("buyerId");
    }

    @Test
    void getProduct_snapshotIsStoredEvenIfSaveFails() {
        ProductInfo snapshot = TestDataFactory.product("item-001");
        doThrow(new AerospikeException("timeout")).when(productRepo).save(snapshot);
        InboundMessage message = InboundMessage.builder().buyerId("B-1").product(snapshot).build();

        assertThat(listingData.getProduct(message)).isSameAs(snapshot);
        verify(metricsConfig).recordPersistenceFailure("product");
    }

    @Test
    void getProduct_knownProductIsLoaded() {
        ProductInfo stored = TestDataFactory.product("item-001");
        when(productRepo.findById("item-001")).thenReturn(stored);

        assertThat(listingData.getProduct(byIds("B-1", "item-001"))).isSameAs(stored);
    }

    @Test
    void getProduct_unknownProductWithoutSnapshotIsRejected() {
        assertThatThrownBy(() -> listingData.getProduct(byIds("B-1", "item-404")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("item-404");
    }
}
