package com.marketplace.conversation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Operating regime. AUTONOMOUS lets low and medium risk replies go out on their own;
 * SUPERVISED routes every reply through a human. Both are read through {@code GatePolicy}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "regime")
public class RegimeConfig {

    public enum Mode { AUTONOMOUS, SUPERVISED }

    private Mode mode = Mode.AUTONOMOUS;

    private boolean requireHumanConfirmation = false;

    // Rolling one-hour window, all buyers together
    private int maxMessagesPerHour = 30;

    // Rolling one-hour window, per buyer
    private int maxMessagesPerBuyerPerHour = 10;

    // Minimum gap between two sends, applied globally and per buyer
    private long minDelaySeconds = 120;

    private long pendingActionTtlHours = 24;

    private RiskThresholds riskThresholds = new RiskThresholds();

    private ResponseDelay responseDelay = new ResponseDelay();

    private Disclosure disclosure = new Disclosure();

    private ActiveHours activeHours = new ActiveHours();

    public boolean isSupervised() {
        return mode == Mode.SUPERVISED;
    }

    /**
     * Rejects inconsistent settings. Called once while the gate policy bean is built.
     */
    public void validate() {
        if (mode == null) {
            throw new IllegalStateException("regime.mode is required");
        }
        if (isSupervised() && !requireHumanConfirmation) {
            throw new IllegalStateException(
                    "regime.mode=SUPERVISED requires regime.require-human-confirmation=true");
        }
        if (maxMessagesPerHour <= 0 || maxMessagesPerBuyerPerHour <= 0) {
            throw new IllegalStateException("regime message limits must be positive");
        }
        if (minDelaySeconds < 0) {
            throw new IllegalStateException("regime.min-delay-seconds must not be negative");
        }
        if (pendingActionTtlHours <= 0) {
            throw new IllegalStateException("regime.pending-action-ttl-hours must be positive");
        }
        int medium = riskThresholds.getMedium();
        int high = riskThresholds.getHigh();
        if (medium <= 0 || medium >= high || high > 100) {
            throw new IllegalStateException(String.format(
                    "regime.risk-thresholds must satisfy 0 < medium < high <= 100 (medium=%d, high=%d)",
                    medium, high));
        }
        if (responseDelay.getMinSeconds() < 0 || responseDelay.getMinSeconds() > responseDelay.getMaxSeconds()) {
            throw new IllegalStateException("regime.response-delay requires 0 <= min-seconds <= max-seconds");
        }
        if (isSupervised() && disclosure.isEnabled()
                && (disclosure.getMessage() == null || disclosure.getMessage().isBlank())) {
            throw new IllegalStateException("regime.disclosure.message is required when disclosure is enabled");
        }
        if (activeHours.isEnabled()
                && (activeHours.getStartHour() < 0 || activeHours.getEndHour() > 24
                    || activeHours.getStartHour() >= activeHours.getEndHour())) {
            throw new IllegalStateException("regime.active-hours requires 0 <= start-hour < end-hour <= 24");
        }
    }

    @Data
    public static class RiskThresholds {
        private int medium = 30;
        private int high = 70;
    }

    @Data
    public static class ResponseDelay {
        private long minSeconds = 30;
        private long maxSeconds = 120;
    }

    @Data
    public static class Disclosure {
        private boolean enabled = true;
        private String message = "Este mensaje ha sido generado por un sistema automatizado.";
    }

    @Data
    public static class ActiveHours {
        private boolean enabled = false;
        private int startHour = 9;
        private int endHour = 22;
        private String timezone = "Europe/Madrid";
    }
}
