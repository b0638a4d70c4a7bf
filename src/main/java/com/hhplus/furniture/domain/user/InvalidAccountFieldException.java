package com.hhplus.furniture.domain.user;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class InvalidAccountFieldException extends DomainException {

    public InvalidAccountFieldException(String detail) {
        super(ErrorCode.INVALID_ACCOUNT_FIELD, detail);
    }
}
