package com.hhplus.furniture.domain.catalog;

/**
 * 상품 재고 확인 포트. 구현체는 조회 실패 시 false를 반환한다.
 */
@FunctionalInterface
public interface AvailabilityChecker {

    boolean isAvailable(VariantKey key, int amount);
}
