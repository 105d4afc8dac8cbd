package com.marketplace.conversation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineConfig {

    // Upper bound on analyses for different buyers running at the same time.
    private int workerThreads = 4;

    private long abandonAfterHours = 24;

    private int abandonSweepIntervalMinutes = 60;

    // Follow-up replies to abandoned conversations, only while the buyer has sent fewer than recoveryMaxMessages
    private boolean recoveryEnabled = true;

    private int recoveryMaxMessages = 10;

    private int expirySweepIntervalSeconds = 60;

    private int dispatchIntervalSeconds = 5;

    private String templatesLocation = "classpath:templates/responses.json";

    // Substituted for {plataforma} in reply templates
    private String platformName = "Wallapop";

    // Audit entries kept in memory for the review API
    private int auditRetention = 1000;

    // "log" delivers through the dry-run gateway; "external" expects another DeliveryGateway bean
    private String delivery = "log";
}
