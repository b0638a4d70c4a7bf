package com.hhplus.furniture.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.furniture.presentation.catalog.request.FurnitureItemRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 담기/제거 요청 DTO (제거 시 amount는 무시)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemRequest {

    @JsonProperty("object_type")
    private String objectType;

    private FurnitureItemRequest item;

    private Integer amount;
}
