package com.marketplace.conversation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Listing the buyer is writing about")
public class ProductInfo {

    @Schema(description = "Listing identifier", example = "item-001")
    private String id;

    @Schema(description = "Listing title", example = "iPhone 12 128GB")
    private String title;

    @Schema(description = "Asking price", example = "350")
    private BigDecimal price;

    @Schema(description = "Lowest price the seller accepts", example = "320")
    private BigDecimal floorPrice;

    private String description;

    @Schema(description = "Condition as published", example = "como nuevo")
    private String condition;

    private String category;

    @Schema(description = "Whether the seller ships the item")
    private boolean shipping;

    @Schema(description = "Seller's zone for hand delivery", example = "Chamberí")
    private String zone;
}
