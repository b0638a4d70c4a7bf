package com.hhplus.furniture.domain.user;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class DuplicateEmailException extends DomainException {

    public DuplicateEmailException(String email) {
        super(ErrorCode.DUPLICATE_EMAIL, "email=" + email);
    }
}
