package com.marketplace.conversation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI conversationEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Conversation Engine API")
                        .version("1.0.0")
                        .description(
                                "Decision engine for marketplace buyer conversations.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Receive a buyer message via `POST /conversations/messages`\n" +
                                "2. Classify intent with ordered keyword rules (fraud indicators first)\n" +
                                "3. Score fraud risk (0-100) from additive profile and content signals\n" +
                                "4. Advance the conversation state machine\n" +
                                "5. Select a reply template, or a safety reply when risk is **HIGH** (>=70)\n" +
                                "6. Gate the reply: send automatically, or hold it as a pending action for a human\n\n" +
                                "**Regimes:** `AUTONOMOUS` gates only high-risk and fraud messages; " +
                                "`SUPERVISED` gates every reply and adds an automation disclosure.\n\n" +
                                "Pending actions expire after the configured TTL and are then treated as rejected.")
                        .contact(new Contact().name("Marketplace Conversations Team")));
    }
}
