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
@Schema(description = "Snapshot of a buyer's marketplace profile")
public class BuyerProfile {

    @Schema(description = "Buyer identifier", example = "buyer-7781")
    private String id;

    @Schema(description = "Public username used in replies", example = "laura_m")
    private String username;

    @Schema(description = "Number of ratings received", example = "25")
    private int rating;

    @Schema(description = "Completed purchases", example = "10")
    private int purchaseCount;

    @Schema(description = "Distance to the seller in kilometers", example = "5.2")
    private double distanceKm;

    @Schema(description = "Last activity in epoch milliseconds")
    private long lastActivity;

    private boolean verified;

    private boolean hasPhoto;
}
