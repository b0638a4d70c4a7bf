package com.hhplus.furniture.domain.user;

import com.hhplus.furniture.domain.catalog.PricePolicy;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * CreditDomainService - 결제 시 크레딧 적용 계산
 *
 * 저장소 의존성 없는 순수 계산이며 잔액을 변경하지 않는다.
 * - 크레딧 ≤ 결제 금액: 크레딧 전액 사용, 결제 금액에서 차감
 * - 크레딧 > 결제 금액: 결제 금액만큼 사용, 남은 결제 금액 0
 */
public class CreditDomainService {

    public CreditPlan plan(BigDecimal availableCredit, BigDecimal total) {
        if (total == null || total.signum() < 0) {
            throw new IllegalArgumentException("결제 금액은 0 이상이어야 합니다");
        }
        BigDecimal credit = availableCredit == null ? BigDecimal.ZERO : availableCredit;
        if (credit.signum() < 0) {
            throw new IllegalArgumentException("크레딧은 0 이상이어야 합니다");
        }

        BigDecimal creditUsed = credit.min(total);
        return new CreditPlan(PricePolicy.money(creditUsed), PricePolicy.money(total.subtract(creditUsed)));
    }

    @Getter
    @AllArgsConstructor
    public static class CreditPlan {
        private final BigDecimal creditUsed;
        private final BigDecimal remainingTotal;

        public boolean isFullyCovered() {
            return remainingTotal.signum() == 0;
        }
    }
}
