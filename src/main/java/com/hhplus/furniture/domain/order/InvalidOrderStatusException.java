package com.hhplus.furniture.domain.order;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

/**
 * 주문 상태를 진행할 수 없을 때 발생하는 예외 (400 Bad Request)
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(Long orderId, String detail) {
        super(ErrorCode.INVALID_ORDER_STATUS, "orderId=" + orderId + ", " + detail);
    }
}
