package com.hhplus.furniture.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.application.checkout.CheckoutResult;
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
public class CheckoutResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("total_price")
    private BigDecimal totalPrice;

    @JsonProperty("credit_used")
    private BigDecimal creditUsed;

    public static CheckoutResponse from(CheckoutResult result) {
        return CheckoutResponse.builder()
                .message(result.getMessage())
                .orderId(result.getOrderId())
                .totalPrice(result.getTotalPrice())
                .creditUsed(result.getCreditUsed())
                .build();
    }
}
