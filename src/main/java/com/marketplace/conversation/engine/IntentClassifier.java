package com.marketplace.conversation.engine;

import com.marketplace.conversation.model.Intent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Maps normalized message text to an intent by walking an explicit priority list of rules.
 * The first matching rule wins, so fraud indicators are never masked by a friendly "hola".
 */
@Component
public class IntentClassifier {

    static final TextPattern DIRECT_PURCHASE = TextPattern.phrases("direct-purchase",
            "lo quiero", "me lo llevo", "lo compro", "te lo compro", "me lo quedo",
            "trato hecho", "trato", "cerramos el trato", "me interesa comprarlo ya");

    static final TextPattern NEGOTIATION = TextPattern.phrases("negotiation",
            "menos", "rebaja", "rebajar", "rebajas", "descuento", "ultima oferta", "ultimo precio",
            "te ofrezco", "te doy", "me lo dejas", "me lo dejarias", "negociable", "mitad", "regatear");

    static final TextPattern PRICE_WORDS = TextPattern.phrases("price",
            "precio", "cuanto", "cuesta", "cuestan", "euros", "eur");

    static final TextPattern PRICE_SYMBOL = TextPattern.regex("price-symbol", "€");

    static final TextPattern LOCATION = TextPattern.phrases("location",
            "donde", "zona", "direccion", "cerca de", "ubicacion", "quedamos", "quedar",
            "punto de encuentro", "recoger", "recogida", "en mano");

    static final TextPattern PAYMENT = TextPattern.phrases("payment",
            "pago", "pagar", "pagas", "pagaria", "bizum", "efectivo", "transferencia");

    static final TextPattern SHIPPING = TextPattern.phrases("shipping",
            "envio", "envios", "enviar", "envias", "enviarias", "mandar", "mandas",
            "correos", "mensajeria", "seur", "mrw", "gastos de envio");

    static final TextPattern PRODUCT_CONDITION = TextPattern.phrases("product-condition",
            "estado", "funciona", "roto", "rota", "nuevo", "nueva", "usado", "usada",
            "aranazo", "aranazos", "golpe", "golpes", "garantia", "bateria", "defecto");

    static final TextPattern AVAILABILITY = TextPattern.phrases("availability",
            "disponible", "disponibles", "vendido", "vendida", "reservado", "reservada",
            "queda", "quedan", "sigue", "todavia lo tienes", "aun lo tienes");

    static final TextPattern INFORMATION = TextPattern.phrases("information",
            "info", "informacion", "detalles", "caracteristicas", "medidas", "talla", "modelo",
            "dimensiones", "peso", "mas fotos", "capacidad");

    static final TextPattern GREETING = TextPattern.phrases("greeting",
            "hola", "holi", "buenas", "hey", "buenos dias", "buenas tardes", "buenas noches",
            "saludos", "que tal", "me interesa", "hello", "hi");

    private static final List<IntentRule> PRIORITY_ORDER = List.of(
            new IntentRule(Intent.FRAUD, "fraud-indicators", FraudIndicators::anyFraudIndicator),
            IntentRule.of(Intent.DIRECT_PURCHASE, DIRECT_PURCHASE),
            IntentRule.of(Intent.NEGOTIATION, NEGOTIATION),
            new IntentRule(Intent.PRICE, "price", text -> PRICE_WORDS.matches(text) || PRICE_SYMBOL.matches(text)),
            IntentRule.of(Intent.LOCATION, LOCATION),
            IntentRule.of(Intent.PAYMENT, PAYMENT),
            IntentRule.of(Intent.SHIPPING, SHIPPING),
            IntentRule.of(Intent.PRODUCT_CONDITION, PRODUCT_CONDITION),
            // "Hola, esta disponible?" opens a conversation; the greeting reply confirms availability.
            new IntentRule(Intent.GREETING, "greeting-with-availability",
                    text -> GREETING.matches(text) && AVAILABILITY.matches(text)),
            IntentRule.of(Intent.AVAILABILITY, AVAILABILITY),
            IntentRule.of(Intent.INFORMATION, INFORMATION),
            IntentRule.of(Intent.GREETING, GREETING));

    public Intent classify(String normalizedText) {
        return firstMatch(normalizedText)
                .map(IntentRule::intent)
                .orElse(Intent.UNKNOWN);
    }

    public Optional<IntentRule> firstMatch(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return Optional.empty();
        }
        for (IntentRule rule : PRIORITY_ORDER) {
            if (rule.matches(normalizedText)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<IntentRule> getRules() {
        return PRIORITY_ORDER;
    }
}
