package com.hhplus.furniture.domain.payment;

import java.math.BigDecimal;

/**
 * 결제 수단 검증 포트. 잔액 변경 전에 호출된다.
 */
public interface PaymentValidator {

    /**
     * @param amountDue  크레딧 적용 후 결제해야 할 금액
     * @param cardNumber 결제 카드 번호 (amountDue가 0이면 없어도 된다)
     */
    boolean isValid(BigDecimal amountDue, String cardNumber);
}
