package com.hhplus.furniture.domain.cart;

/**
 * CartRepository - 사용자별 장바구니 저장소 포트
 */
public interface CartRepository {

    ShoppingCart findOrCreateByUserId(Long userId);

    void deleteByUserId(Long userId);
}
