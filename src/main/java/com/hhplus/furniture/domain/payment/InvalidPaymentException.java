package com.hhplus.furniture.domain.payment;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class InvalidPaymentException extends DomainException {

    public InvalidPaymentException() {
        super(ErrorCode.INVALID_PAYMENT);
    }
}
