package com.hhplus.furniture.domain.catalog;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class InvalidPriceRangeException extends DomainException {

    public InvalidPriceRangeException(String detail) {
        super(ErrorCode.INVALID_PRICE_RANGE, detail);
    }
}
