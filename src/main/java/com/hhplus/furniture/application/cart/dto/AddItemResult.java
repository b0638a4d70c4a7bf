package com.hhplus.furniture.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 장바구니 담기 결과. 재고가 부족하면 added=false이고 장바구니는 바뀌지 않는다.
 */
@Getter
@AllArgsConstructor
public class AddItemResult {

    private final boolean added;
    private final String itemName;
    private final CartView cart;
}
