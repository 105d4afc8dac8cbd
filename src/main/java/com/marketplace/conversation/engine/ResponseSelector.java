package com.marketplace.conversation.engine;

import com.marketplace.conversation.config.EngineConfig;
import com.marketplace.conversation.model.BuyerProfile;
import com.marketplace.conversation.model.ProductInfo;
import com.marketplace.conversation.model.RecoveryStage;
import com.marketplace.conversation.model.RiskSignal;
import com.marketplace.conversation.model.RiskTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the reply for an analysed message. High-risk messages always get a safety reply that
 * keeps the conversation on the platform. An empty result means "do not reply"; callers must
 * not make one up.
 */
@Component
public class ResponseSelector {

    private static final Logger log = LoggerFactory.getLogger(ResponseSelector.class);

    static final String FALLBACK_SAFETY_REPLY =
            "Prefiero que sigamos hablando y pagando por {plataforma}, así estamos los dos protegidos.";

    // Strongest signal first: it decides which safety reply is used.
    private static final List<RiskSignal> SAFETY_ORDER = List.of(
            RiskSignal.EXTERNAL_CONTACT_REQUEST,
            RiskSignal.SENSITIVE_DATA_REQUEST,
            RiskSignal.OFF_PLATFORM_PAYMENT,
            RiskSignal.SUSPICIOUS_LINK);

    private static final BigDecimal NEGOTIATION_FACTOR = new BigDecimal("0.95");

    private final ResponseTemplateCatalog catalog;
    private final ObjectProvider<CandidateTextSource> candidateSource;
    private final EngineConfig config;

    public ResponseSelector(ResponseTemplateCatalog catalog,
                            ObjectProvider<CandidateTextSource> candidateSource,
                            EngineConfig config) {
        this.catalog = catalog;
        this.candidateSource = candidateSource;
        this.config = config;
    }

    public Optional<String> select(ResponseContext ctx) {
        if (ctx.risk() != null && ctx.risk().getTier() == RiskTier.HIGH) {
            return Optional.of(personalize(safetyTemplate(ctx), ctx.product(), ctx.buyer()));
        }

        Optional<String> generated = fromCandidateSource(ctx);
        if (generated.isPresent()) {
            return generated;
        }

        List<String> bucket = catalog.bucket(ctx.intent(), ctx.state());
        if (bucket.isEmpty()) {
            log.debug("No reply template for intent={} state={}", ctx.intent(), ctx.state());
            return Optional.empty();
        }
        String template = pick(bucket, ctx);
        return Optional.of(personalize(template, ctx.product(), ctx.buyer()));
    }

    /**
     * Follow-up for a buyer who went silent. Empty when no template is configured for the stage.
     */
    public Optional<String> recovery(RecoveryStage stage, String buyerId) {
        List<String> templates = catalog.recovery(stage.getTemplateKey());
        if (templates.isEmpty()) {
            log.debug("No recovery template for stage {}", stage);
            return Optional.empty();
        }
        return Optional.of(personalize(pick(templates, buyerId, stage.name()), null, null));
    }

    private String safetyTemplate(ResponseContext ctx) {
        String key = SAFETY_ORDER.stream()
                .filter(ctx.risk()::hasSignal)
                .map(RiskSignal::name)
                .findFirst()
                .orElse(ResponseTemplateCatalog.GENERIC_SAFETY);
        List<String> templates = catalog.safety(key);
        return templates.isEmpty() ? FALLBACK_SAFETY_REPLY : pick(templates, ctx);
    }

    private Optional<String> fromCandidateSource(ResponseContext ctx) {
        CandidateTextSource source = candidateSource.getIfAvailable();
        if (source == null) {
            return Optional.empty();
        }
        try {
            return source.suggest(ctx)
                    .map(String::trim)
                    .filter(text -> !text.isEmpty());
        } catch (RuntimeException e) {
            log.warn("Candidate text source failed for buyer {}, falling back to templates: {}",
                    ctx.buyer() != null ? ctx.buyer().getId() : null, e.getMessage());
            return Optional.empty();
        }
    }

    // Same buyer, intent and state always get the same wording, across restarts too.
    private static String pick(List<String> templates, ResponseContext ctx) {
        String buyerId = ctx.buyer() != null ? ctx.buyer().getId() : null;
        return pick(templates, buyerId, name(ctx.intent()), name(ctx.state()));
    }

    private static String pick(List<String> templates, String... keys) {
        int index = Math.floorMod(Objects.hash((Object[]) keys), templates.size());
        return templates.get(index);
    }

    private static String name(Enum<?> value) {
        return value != null ? value.name() : null;
    }

    String personalize(String template, ProductInfo product, BuyerProfile buyer) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("{plataforma}", config.getPlatformName());
        if (product != null) {
            BigDecimal discounted = discountedPrice(product);
            values.put("{producto}", nullToEmpty(product.getTitle()));
            values.put("{precio}", formatMoney(product.getPrice()));
            values.put("{precio_minimo}", formatMoney(product.getFloorPrice()));
            values.put("{precio_rebajado}", formatMoney(discounted));
            values.put("{descuento}", product.getPrice() != null && discounted != null
                    ? formatMoney(product.getPrice().subtract(discounted)) : "");
            values.put("{zona}", nullToEmpty(product.getZone()));
            values.put("{estado}", nullToEmpty(product.getCondition()));
            values.put("{categoria}", nullToEmpty(product.getCategory()));
            values.put("{descripcion}", nullToEmpty(product.getDescription()));
            values.put("{envio}", product.isShipping()
                    ? "Sí, hago envíos por {plataforma}"
                    : "Solo entrego en mano en " + nullToEmpty(product.getZone()));
        }
        String username = buyer != null ? buyer.getUsername() : null;
        if (username == null || username.isBlank()) {
            values.put(" {usuario}", "");
            values.put("{usuario}", "");
        } else {
            values.put("{usuario}", username);
        }

        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        // {envio} itself may introduce {plataforma}
        return result.replace("{plataforma}", config.getPlatformName());
    }

    /**
     * Five percent off the asking price, rounded down, never below the floor price.
     */
    static BigDecimal discountedPrice(ProductInfo product) {
        if (product.getPrice() == null) return null;
        BigDecimal discounted = product.getPrice().multiply(NEGOTIATION_FACTOR).setScale(0, RoundingMode.FLOOR);
        if (product.getFloorPrice() != null && discounted.compareTo(product.getFloorPrice()) < 0) {
            return product.getFloorPrice();
        }
        return discounted;
    }

    static String formatMoney(BigDecimal amount) {
        if (amount == null) return "";
        return amount.stripTrailingZeros().toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
