package com.hhplus.furniture.domain.catalog;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 할인/세금 계산 규칙 (금액은 소수점 둘째 자리, HALF_UP)
 */
public final class PricePolicy {

    public static final int MONEY_SCALE = 2;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PricePolicy() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }

    /**
     * 할인율 적용: 0 ≤ d < 100 이면 price × (1 - d/100), d ≥ 100 이면 0
     *
     * @throws DomainException 할인율이 음수인 경우
     */
    public static BigDecimal discount(BigDecimal price, int discountPercent) {
        if (discountPercent < 0) {
            throw new DomainException(ErrorCode.INVALID_DISCOUNT, "discountPercent=" + discountPercent);
        }
        if (discountPercent >= 100) {
            return money(BigDecimal.ZERO);
        }
        BigDecimal remainingRatio = HUNDRED.subtract(BigDecimal.valueOf(discountPercent));
        return money(price.multiply(remainingRatio).divide(HUNDRED, MONEY_SCALE + 4, RoundingMode.HALF_UP));
    }

    /**
     * 세금 적용: price × (1 + t/100)
     *
     * @throws DomainException 세율이 음수인 경우
     */
    public static BigDecimal tax(BigDecimal price, BigDecimal taxRate) {
        if (taxRate == null || taxRate.signum() < 0) {
            throw new DomainException(ErrorCode.INVALID_TAX_RATE, "taxRate=" + taxRate);
        }
        BigDecimal ratio = HUNDRED.add(taxRate);
        return money(price.multiply(ratio).divide(HUNDRED, MONEY_SCALE + 4, RoundingMode.HALF_UP));
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
