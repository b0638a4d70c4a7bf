package com.hhplus.furniture.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.cart.dto.CartView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CartLineResponse {

    @JsonProperty("item_id")
    private Long itemId;

    @JsonProperty("furniture_type")
    private String furnitureType;

    @JsonProperty("name")
    private String name;

    @JsonProperty("color")
    private String color;

    @JsonProperty("material")
    private String material;

    @JsonProperty("is_adjustable")
    private Boolean adjustable;

    @JsonProperty("has_armrest")
    private Boolean armrest;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("subtotal")
    private BigDecimal subtotal;

    public static CartLineResponse from(CartView.Line line) {
        return CartLineResponse.builder()
                .itemId(line.getCatalogItemId())
                .furnitureType(line.getKind())
                .name(line.getName())
                .color(line.getColor())
                .material(line.getMaterial())
                .adjustable(line.getAdjustable())
                .armrest(line.getArmrest())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .subtotal(line.getSubtotal())
                .build();
    }
}
