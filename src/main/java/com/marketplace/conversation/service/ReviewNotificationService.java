package com.marketplace.conversation.service;

import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.config.TwilioNotificationConfig;
import com.marketplace.conversation.model.AnalysisResult;
import com.marketplace.conversation.model.PendingAction;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Tells the human reviewer that a pending action is waiting. Sent over Twilio when enabled,
 * otherwise only logged. Never affects the gate decision.
 */
@Service
public class ReviewNotificationService {

    private static final Logger log = LoggerFactory.getLogger(ReviewNotificationService.class);

    private static final int PREVIEW_LENGTH = 120;

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public ReviewNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Review notifications via Twilio enabled. Channel: {}", config.getChannel());
        } else {
            log.info("Review notifications via Twilio are DISABLED, pending actions are only logged.");
        }
    }

    @Async("analysisExecutor")
    @Observed(name = "notification.send", contextualName = "notify-review")
    public void notifyHumanDecisionRequired(PendingAction action) {
        String body = buildMessageBody(action);
        if (!config.isEnabled()) {
            log.info("Human decision required:\n{}", body);
            metricsConfig.recordNotification("log", "success");
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getReviewerNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Review notification sent for action={}, sid={}", action.getId(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send review notification for action={}: {}", action.getId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(PendingAction action) {
        AnalysisResult analysis = action.getAnalysis();
        StringBuilder body = new StringBuilder()
                .append("[REVIEW REQUIRED] ").append(action.getActionType()).append('\n')
                .append("Buyer: ").append(action.getBuyerId()).append('\n');
        if (analysis != null) {
            body.append("Intent: ").append(analysis.getIntent())
                    .append(" | Risk: ").append(analysis.getFraudRisk())
                    .append(" (").append(analysis.getRiskTier()).append(")\n");
        }
        body.append("Message: ").append(preview(action.getOriginalMessage())).append('\n')
                .append("Suggested reply: ")
                .append(action.getCandidateResponse() != null ? preview(action.getCandidateResponse()) : "(none)");
        if (config.getReviewBaseUrl() != null && !config.getReviewBaseUrl().isBlank()) {
            body.append('\n').append(config.getReviewBaseUrl()).append('/').append(action.getId());
        }
        return body.toString();
    }

    private static String preview(String text) {
        if (text == null) return "";
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
