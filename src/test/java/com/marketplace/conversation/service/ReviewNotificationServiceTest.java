package com.marketplace.conversation.service;

import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.config.TwilioNotificationConfig;
import com.marketplace.conversation.model.PendingAction;
import com.marketplace.conversation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ReviewNotificationServiceTest {

    @Mock private MetricsConfig metricsConfig;

    private TwilioNotificationConfig config;
    private ReviewNotificationService service;

    @BeforeEach
    void setUp() {
        config = new TwilioNotificationConfig();
        service = new ReviewNotificationService(config, metricsConfig);
    }

    @Test
    void buildMessageBody_summarisesTheActionForTheReviewer() {
        config.setReviewBaseUrl("https://ops.example.com/actions");
        PendingAction action = TestDataFactory.pendingAction("PA-1", "B-9");

        String body = service.buildMessageBody(action);

        assertThat(body)
                .startsWith("[REVIEW REQUIRED] SEND_MESSAGE")
                .contains("Buyer: B-9")
                .contains("Intent: FRAUD | Risk: 100 (HIGH)")
                .contains("Message: Dame tu whatsapp")
                .contains("Suggested reply: Prefiero seguir por el chat.")
                .endsWith("https://ops.example.com/actions/PA-1");
    }

    @Test
    void buildMessageBody_withoutSuggestionOrUrl() {
        PendingAction action = TestDataFactory.pendingAction("PA-1", "B-9");
        action.setCandidateResponse(null);

        assertThat(service.buildMessageBody(action))
                .endsWith("Suggested reply: (none)")
                .doesNotContain("http");
    }

    @Test
    void buildMessageBody_truncatesLongMessages() {
        PendingAction action = TestDataFactory.pendingAction("PA-1", "B-9");
        action.setOriginalMessage("a".repeat(300));

        assertThat(service.buildMessageBody(action)).contains("a".repeat(120) + "...");
    }

    @Test
    void notifyHumanDecisionRequired_whenTwilioDisabled_onlyLogs() {
        service.notifyHumanDecisionRequired(TestDataFactory.pendingAction("PA-1", "B-9"));

        verify(metricsConfig).recordNotification("log", "success");
    }
}
