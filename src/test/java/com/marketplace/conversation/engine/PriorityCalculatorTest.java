package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.Intent;
import com.marketplace.conversation.model.PriorityTier;
import com.marketplace.conversation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityCalculatorTest {

    private final PriorityCalculator calculator = new PriorityCalculator();
    private final BuyerProfile trusted = TestDataFactory.trustedBuyer("B-1");

    @Test
    void directPurchase_isHigh() {
        assertThat(calculator.calculate(Intent.DIRECT_PURCHASE, TestDataFactory.newBuyer("B-2"), "lo quiero"))
                .isEqualTo(PriorityTier.HIGH);
    }

    @Test
    void paymentNow_isHigh() {
        assertThat(calculator.calculate(Intent.PAYMENT, trusted, "te pago ahora por bizum"))
                .isEqualTo(PriorityTier.HIGH);
        assertThat(calculator.calculate(Intent.PAYMENT, trusted, "como se paga"))
                .isEqualTo(PriorityTier.MEDIUM);
    }

    @Test
    void urgentFromEstablishedBuyer_isHigh() {
        assertThat(calculator.calculate(Intent.AVAILABILITY, trusted, "es urgente, sigue disponible?"))
                .isEqualTo(PriorityTier.HIGH);
    }

    @Test
    void fraudAndUnratedBuyersAndLowballs_areLow() {
        assertThat(calculator.calculate(Intent.FRAUD, trusted, "dame tu whatsapp"))
                .isEqualTo(PriorityTier.LOW);
        assertThat(calculator.calculate(Intent.GREETING, TestDataFactory.newBuyer("B-2"), "hola"))
                .isEqualTo(PriorityTier.LOW);
        assertThat(calculator.calculate(Intent.NEGOTIATION, trusted, "te doy 20€"))
                .isEqualTo(PriorityTier.LOW);
        assertThat(calculator.calculate(Intent.NEGOTIATION, trusted, "te lo dejo por la mitad"))
                .isEqualTo(PriorityTier.LOW);
    }

    @Test
    void ordinaryQuestion_isMedium() {
        assertThat(calculator.calculate(Intent.NEGOTIATION, trusted, "me lo dejas en 320€?"))
                .isEqualTo(PriorityTier.MEDIUM);
        assertThat(calculator.calculate(Intent.PRICE, trusted, "cuanto cuesta"))
                .isEqualTo(PriorityTier.MEDIUM);
    }

    @Test
    void onlyAhoraAndTheListedLowballAmounts_changeTheTier() {
        assertThat(calculator.calculate(Intent.PAYMENT, trusted, "ya te pago por bizum"))
                .isEqualTo(PriorityTier.MEDIUM);
        assertThat(calculator.calculate(Intent.NEGOTIATION, trusted, "te doy 15€"))
                .isEqualTo(PriorityTier.MEDIUM);
        assertThat(calculator.calculate(Intent.NEGOTIATION, trusted, "te doy 5 €"))
                .isEqualTo(PriorityTier.MEDIUM);
        assertThat(calculator.calculate(Intent.NEGOTIATION, trusted, "te doy 10 €"))
                .isEqualTo(PriorityTier.LOW);
    }
}
