package com.hhplus.furniture.domain.user;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class ManagerNotFoundException extends DomainException {

    public ManagerNotFoundException(Long managerId) {
        super(ErrorCode.MANAGER_NOT_FOUND, "managerId=" + managerId);
    }
}
