package com.hhplus.furniture.domain.cart;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.catalog.VariantKey;

/**
 * 장바구니에 없는 상품을 제거하려 할 때 발생하는 예외
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(VariantKey key) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "variant=" + key);
    }
}
