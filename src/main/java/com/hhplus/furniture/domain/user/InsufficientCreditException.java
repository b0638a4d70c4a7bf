package com.hhplus.furniture.domain.user;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

import java.math.BigDecimal;

public class InsufficientCreditException extends DomainException {

    public InsufficientCreditException(Long userId, BigDecimal credit, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_CREDIT,
                String.format("userId=%d, credit=%s, requested=%s", userId, credit, requested));
    }
}
