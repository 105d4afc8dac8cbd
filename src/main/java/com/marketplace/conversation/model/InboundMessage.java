package com.marketplace.conversation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Inbound buyer message. Snapshots are stored when given, otherwise looked up by id.")
public class InboundMessage {

    @Schema(description = "Buyer id; taken from the buyer snapshot when omitted", example = "buyer-7781")
    private String buyerId;

    @Schema(description = "Listing id; taken from the product snapshot when omitted", example = "item-001")
    private String productId;

    @Schema(description = "Raw message text", example = "Hola! Está disponible?")
    private String message;

    private BuyerProfile buyer;

    private ProductInfo product;
}
