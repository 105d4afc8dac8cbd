package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.RiskSignal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message-content patterns shared by the classifier and the risk scorer.
 * Text must already be normalized (no accents, lower case).
 */
public final class FraudIndicators {

    public static final TextPattern EXTERNAL_CONTACT = TextPattern.phrases("external-contact",
            "whatsapp", "whats app", "wasap", "wsp", "telegram", "signal",
            "email", "e-mail", "mail", "correo electronico",
            "mi telefono", "tu telefono", "tu movil", "tu numero", "mi numero",
            "llamame", "escribeme al", "hablamos por fuera", "fuera de la app");

    public static final TextPattern OFF_PLATFORM_PAYMENT = TextPattern.phrases("off-platform-payment",
            "western union", "moneygram", "money gram", "ria money",
            "paypal familia", "paypal amigos", "amigos y familiares",
            "por adelantado", "pago adelantado", "adelantado",
            "transportista", "mi hijo", "desde el extranjero", "estoy en el extranjero",
            "bitcoin", "cripto", "criptomoneda", "usdt",
            "tarjeta regalo", "gift card", "cheque");

    public static final TextPattern SUSPICIOUS_LINK = TextPattern.regex("suspicious-link",
            "https?://\\S+",
            "\\bwww\\.\\S+",
            "\\bbit\\.ly\\b", "\\btinyurl\\b", "\\bgoo\\.gl\\b", "\\bcutt\\.ly\\b",
            "\\bwa\\.me\\b", "\\bt\\.me/",
            "\\b[a-z0-9-]+\\.[a-z]{2,}/[a-z0-9]{5,}");

    public static final TextPattern SENSITIVE_DATA = TextPattern.phrases("sensitive-data",
            "dni", "nie", "pasaporte", "documento de identidad",
            "numero de cuenta", "iban", "numero de tarjeta", "datos de la tarjeta", "datos de tu tarjeta",
            "verificar tarjeta", "verificar tu tarjeta", "cvv", "pin",
            "contrasena", "codigo de verificacion", "codigo sms", "el codigo que te llegue",
            "desbloquear");

    public static final TextPattern URGENCY = TextPattern.phrases("urgency",
            "urgente", "urgentemente", "urgencia", "hoy mismo", "ahora mismo", "ya mismo",
            "cuanto antes", "lo antes posible", "rapido", "date prisa", "solo hoy", "ultima oportunidad");

    /**
     * Content signals worth 40 points each. Any of them also makes the message a Fraud intent,
     * so every Fraud classification carries at least one of these signals.
     */
    private static final Map<RiskSignal, TextPattern> FRAUD_SIGNALS = new LinkedHashMap<>();

    static {
        FRAUD_SIGNALS.put(RiskSignal.EXTERNAL_CONTACT_REQUEST, EXTERNAL_CONTACT);
        FRAUD_SIGNALS.put(RiskSignal.OFF_PLATFORM_PAYMENT, OFF_PLATFORM_PAYMENT);
        FRAUD_SIGNALS.put(RiskSignal.SUSPICIOUS_LINK, SUSPICIOUS_LINK);
        FRAUD_SIGNALS.put(RiskSignal.SENSITIVE_DATA_REQUEST, SENSITIVE_DATA);
    }

    private FraudIndicators() {}

    public static Map<RiskSignal, TextPattern> fraudSignals() {
        return Collections.unmodifiableMap(FRAUD_SIGNALS);
    }

    public static boolean anyFraudIndicator(String normalizedText) {
        for (TextPattern pattern : FRAUD_SIGNALS.values()) {
            if (pattern.matches(normalizedText)) return true;
        }
        return false;
    }
}
