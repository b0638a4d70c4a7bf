package com.hhplus.furniture.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    @JsonProperty("credit_card_num")
    private String creditCardNum;

    @JsonProperty("coupon_code")
    private String couponCode;
}
