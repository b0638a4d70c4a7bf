package com.hhplus.furniture.domain.payment;

import java.math.BigDecimal;

/**
 * CardPaymentValidator - 카드 번호 형식 검증
 *
 * 규칙:
 * - 결제 금액이 0이면 카드 없이 통과
 * - 공백/하이픈을 제외하고 ASCII 숫자로만 이루어진 번호면 통과 (자릿수 제한 없음)
 */
public class CardPaymentValidator implements PaymentValidator {

    @Override
    public boolean isValid(BigDecimal amountDue, String cardNumber) {
        if (amountDue == null || amountDue.signum() < 0) {
            return false;
        }
        if (amountDue.signum() == 0) {
            return true;
        }
        if (cardNumber == null) {
            return false;
        }

        String digits = cardNumber.replaceAll("[\\s-]", "");
        return !digits.isEmpty() && digits.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
