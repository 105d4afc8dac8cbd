package com.marketplace.conversation.engine;

import com.marketplace.conversation.config.EngineConfig;
import com.marketplace.conversation.model.*;
import com.marketplace.conversation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResponseSelectorTest {

    @Mock private ObjectProvider<CandidateTextSource> candidateProvider;
    @Mock private CandidateTextSource candidateSource;

    private ResponseTemplateCatalog catalog;
    private ResponseSelector selector;
    private ProductInfo product;
    private BuyerProfile buyer;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/templates/responses.json")) {
            catalog = ResponseTemplateCatalog.fromStream(in);
        }
        selector = new ResponseSelector(catalog, candidateProvider, new EngineConfig());
        product = TestDataFactory.product("item-001");
        buyer = TestDataFactory.trustedBuyer("B-1");
    }

    private static RiskAssessment risk(int score, RiskTier tier, RiskSignal... signals) {
        return RiskAssessment.builder().score(score).tier(tier).signals(List.of(signals)).build();
    }

    private Optional<String> select(ConversationState state, Intent intent, RiskAssessment risk) {
        return selector.select(new ResponseContext(state, intent, risk, product, buyer, "msg"));
    }

    @Test
    void greetingFromInitial_confirmsAvailabilityAndIsPersonalized() {
        Optional<String> reply = select(ConversationState.INITIAL, Intent.GREETING, risk(0, RiskTier.LOW));

        assertThat(reply).hasValueSatisfying(text -> assertThat(text)
                .contains("disponible")
                .contains("laura_m")
                .contains("iPhone 12 128GB")
                .doesNotContain("{"));
    }

    @Test
    void highRisk_externalContact_getsSafetyReplyInsteadOfBucket() {
        Optional<String> reply = select(ConversationState.INITIAL, Intent.GREETING,
                risk(100, RiskTier.HIGH, RiskSignal.NEW_ACCOUNT, RiskSignal.EXTERNAL_CONTACT_REQUEST));

        assertThat(reply).hasValueSatisfying(text -> assertThat(text)
                .contains("chat de Wallapop")
                .doesNotContain("disponible"));
    }

    @Test
    void highRisk_profileOnly_getsGenericSafetyReply() {
        Optional<String> reply = select(ConversationState.INITIAL, Intent.PRICE,
                risk(70, RiskTier.HIGH, RiskSignal.NEW_ACCOUNT, RiskSignal.UNVERIFIED_PROFILE,
                        RiskSignal.NO_PROFILE_PHOTO, RiskSignal.LONG_DISTANCE, RiskSignal.LOW_REPUTATION));

        assertThat(reply).contains(
                "Lo siento, así no me parece seguro. Si te interesa el iPhone 12 128GB, seguimos por Wallapop.");
    }

    @Test
    void unknownIntent_hasNoResponse() {
        assertThat(select(ConversationState.INITIAL, Intent.UNKNOWN, risk(0, RiskTier.LOW))).isEmpty();
    }

    @Test
    void priceWhileNegotiating_offersDiscountedPrice() {
        assertThat(select(ConversationState.NEGOTIATING, Intent.PRICE, risk(0, RiskTier.LOW)))
                .hasValueSatisfying(text -> assertThat(text).contains("332€"));
    }

    @Test
    void recoveredConversation_usesNegotiatingBucket() {
        assertThat(select(ConversationState.RECOVERED, Intent.PRICE, risk(0, RiskTier.LOW)))
                .hasValueSatisfying(text -> assertThat(text).contains("332€"));
    }

    @Test
    void priceOutsideNegotiation_quotesAskingPrice() {
        assertThat(select(ConversationState.INITIAL, Intent.PRICE, risk(0, RiskTier.LOW)))
                .hasValueSatisfying(text -> assertThat(text).contains("350€"));
    }

    @Test
    void selection_isDeterministic() {
        RiskAssessment low = risk(0, RiskTier.LOW);
        assertThat(select(ConversationState.INITIAL, Intent.AVAILABILITY, low))
                .isEqualTo(select(ConversationState.INITIAL, Intent.AVAILABILITY, low));
    }

    @Test
    void missingUsername_dropsPlaceholderCleanly() {
        buyer.setUsername(null);

        assertThat(select(ConversationState.INITIAL, Intent.GREETING, risk(0, RiskTier.LOW)))
                .hasValueSatisfying(text -> assertThat(text).startsWith("¡Hola!"));
    }

    @Test
    void candidateSource_isUsedBeforeTemplates() {
        when(candidateProvider.getIfAvailable()).thenReturn(candidateSource);
        when(candidateSource.suggest(any())).thenReturn(Optional.of("  Texto generado  "));

        assertThat(select(ConversationState.INITIAL, Intent.PRICE, risk(0, RiskTier.LOW)))
                .contains("Texto generado");
    }

    @Test
    void candidateSource_isNeverAskedForHighRisk() {
        Optional<String> reply = select(ConversationState.INITIAL, Intent.FRAUD,
                risk(100, RiskTier.HIGH, RiskSignal.OFF_PLATFORM_PAYMENT));

        assertThat(reply).hasValueSatisfying(text -> assertThat(text).contains("Wallapop"));
        verifyNoInteractions(candidateProvider);
    }

    @Test
    void failingCandidateSource_fallsBackToTemplates() {
        when(candidateProvider.getIfAvailable()).thenReturn(candidateSource);
        when(candidateSource.suggest(any())).thenThrow(new IllegalStateException("model offline"));

        assertThat(select(ConversationState.INITIAL, Intent.PRICE, risk(0, RiskTier.LOW)))
                .hasValueSatisfying(text -> assertThat(text).contains("350€"));
    }

    @Test
    void discountedPrice_neverGoesBelowFloor() {
        ProductInfo tight = TestDataFactory.product("item-002");
        tight.setPrice(new BigDecimal("330"));
        tight.setFloorPrice(new BigDecimal("320"));

        assertThat(ResponseSelector.discountedPrice(tight)).isEqualByComparingTo("320");
        assertThat(ResponseSelector.discountedPrice(product)).isEqualByComparingTo("332");
    }

    @Test
    void selection_dependsOnlyOnBuyerAndEnumNames() {
        List<String> bucket = catalog.bucket(Intent.DIRECT_PURCHASE, ConversationState.NEGOTIATING);
        int index = Math.floorMod(Objects.hash("B-1", "DIRECT_PURCHASE", "NEGOTIATING"), bucket.size());

        assertThat(select(ConversationState.NEGOTIATING, Intent.DIRECT_PURCHASE, risk(0, RiskTier.LOW)))
                .contains(selector.personalize(bucket.get(index), product, buyer));
    }

    @Test
    void recovery_usesStageTemplatesWithoutPlaceholders() {
        assertThat(selector.recovery(RecoveryStage.FIRST, "B-1"))
                .hasValueSatisfying(text -> assertThat(catalog.recovery("24h")).contains(text));
        assertThat(selector.recovery(RecoveryStage.SECOND, "B-1"))
                .hasValueSatisfying(text -> assertThat(text).contains("Wallapop").doesNotContain("{"));
        assertThat(selector.recovery(RecoveryStage.SECOND, "B-1"))
                .isEqualTo(selector.recovery(RecoveryStage.SECOND, "B-1"));
    }

    @Test
    void recovery_withoutTemplates_isEmpty() throws Exception {
        ResponseTemplateCatalog bare = ResponseTemplateCatalog.fromStream(
                new ByteArrayInputStream("{\"intents\":{}}".getBytes(StandardCharsets.UTF_8)));

        assertThat(new ResponseSelector(bare, candidateProvider, new EngineConfig()).recovery(RecoveryStage.FIRST, "B-1"))
                .isEmpty();
    }
}
