package com.hhplus.furniture.domain.coupon;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class InvalidCouponException extends DomainException {

    public InvalidCouponException(String detail) {
        super(ErrorCode.INVALID_COUPON_DISCOUNT, detail);
    }
}
