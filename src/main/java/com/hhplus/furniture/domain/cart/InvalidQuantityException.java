package com.hhplus.furniture.domain.cart;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

/**
 * 유효하지 않은 장바구니 수량일 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity) {
        super(ErrorCode.INVALID_QUANTITY, String.format("%s (입력값: %s)", CartConstants.MSG_INVALID_CART_QUANTITY, quantity));
    }
}
