package com.hhplus.furniture.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemResponse {

    @JsonProperty("added")
    private boolean added;

    @JsonProperty("message")
    private String message;

    @JsonProperty("cart")
    private CartResponse cart;
}
