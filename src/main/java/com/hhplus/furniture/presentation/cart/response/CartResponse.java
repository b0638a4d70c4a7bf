package com.hhplus.furniture.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.cart.dto.CartView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CartResponse {

    @JsonProperty("items")
    private List<CartLineResponse> items;

    @JsonProperty("total_quantity")
    private int totalQuantity;

    @JsonProperty("total_price")
    private BigDecimal totalPrice;

    @JsonProperty("coupon_code")
    private String couponCode;

    @JsonProperty("discount_percent")
    private Integer discountPercent;

    @JsonProperty("discounted_total")
    private BigDecimal discountedTotal;

    public static CartResponse from(CartView view) {
        return CartResponse.builder()
                .items(view.getLines().stream()
                        .map(CartLineResponse::from)
                        .collect(Collectors.toList()))
                .totalQuantity(view.getTotalQuantity())
                .totalPrice(view.getTotalPrice())
                .couponCode(view.getCouponCode())
                .discountPercent(view.getDiscountPercent())
                .discountedTotal(view.getDiscountedTotal())
                .build();
    }
}
