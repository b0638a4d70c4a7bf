package com.hhplus.furniture.domain.inventory;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class InvalidStockQuantityException extends DomainException {

    public InvalidStockQuantityException(int quantity) {
        super(ErrorCode.INVALID_QUANTITY, "재고 조정 수량은 0 이상이어야 합니다: " + quantity);
    }
}
