package com.hhplus.furniture.presentation.inventory.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.inventory.dto.StockAdjustment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("item_id")
    private Long itemId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("quantity")
    private int quantity;

    public static StockAdjustmentResponse from(StockAdjustment adjustment) {
        return StockAdjustmentResponse.builder()
                .message("Inventory updated successfully")
                .itemId(adjustment.getCatalogItemId())
                .name(adjustment.getName())
                .quantity(adjustment.getQuantityOnHand())
                .build();
    }
}
