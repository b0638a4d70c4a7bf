package com.hhplus.furniture.infrastructure.persistence.cart;

import com.hhplus.furniture.domain.cart.CartRepository;
import com.hhplus.furniture.domain.cart.ShoppingCart;
import org.springframework.stereotype.Repository;

import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemory Cart Repository 구현
 *
 * 장바구니는 영속화하지 않는다. 애플리케이션 재시작 시 비워진다.
 */
@Repository
public class InMemoryCartRepository implements CartRepository {

    private final ConcurrentHashMap<Long, ShoppingCart> carts = new ConcurrentHashMap<>();

    @Override
    public ShoppingCart findOrCreateByUserId(Long userId) {
        return carts.computeIfAbsent(userId, ShoppingCart::new);
    }

    @Override
    public void deleteByUserId(Long userId) {
        carts.remove(userId);
    }
}
