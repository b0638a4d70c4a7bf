package com.hhplus.furniture.domain.cart;

import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.PricePolicy;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 장바구니 한 줄 (상품, 수량). 수량을 바꾸면 새 줄로 교체한다.
 */
@Getter
public class CartLine {

    private final Furniture furniture;
    private final int quantity;

    CartLine(Furniture furniture, int quantity) {
        this.furniture = furniture;
        this.quantity = quantity;
    }

    public BigDecimal subtotal() {
        return PricePolicy.money(furniture.price().multiply(BigDecimal.valueOf(quantity)));
    }

    /**
     * 단가에 할인율을 적용한 뒤 수량을 곱한 금액
     */
    public BigDecimal discountedSubtotal(int discountPercent) {
        return PricePolicy.money(furniture.calculateDiscount(discountPercent).multiply(BigDecimal.valueOf(quantity)));
    }
}
