package com.hhplus.furniture.domain.inventory;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

/**
 * 재고 조정 방향
 */
public enum StockDirection {
    INCREASE,
    DECREASE;

    /**
     * 요청의 sign 값("+", "-", "1", "-1", "increase", "decrease")을 방향으로 변환한다.
     */
    public static StockDirection fromSign(String sign) {
        if (sign == null) {
            throw new DomainException(ErrorCode.INVALID_QUANTITY, "sign은 필수입니다");
        }
        switch (sign.trim().toLowerCase()) {
            case "+":
            case "1":
            case "+1":
            case "increase":
                return INCREASE;
            case "-":
            case "-1":
            case "decrease":
                return DECREASE;
            default:
                throw new DomainException(ErrorCode.INVALID_QUANTITY, "알 수 없는 sign: " + sign);
        }
    }
}
