package com.marketplace.conversation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;
    private String authToken;
    private String fromNumber;
    private String reviewerNumber;
    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"

    // Linked from review notifications, e.g. https://ops.example.com/actions
    private String reviewBaseUrl;
}
