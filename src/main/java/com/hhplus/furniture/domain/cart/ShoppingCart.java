package com.hhplus.furniture.domain.cart;

import com.hhplus.furniture.domain.catalog.AvailabilityChecker;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.PricePolicy;
import com.hhplus.furniture.domain.catalog.VariantKey;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * ShoppingCart - 사용자 한 명의 주문 전 상품 목록 (Rich Domain Model)
 *
 * 핵심 비즈니스 규칙:
 * - 줄 순서는 추가 순서를 유지
 * - 같은 상품(VariantKey)은 한 줄만 존재하며, 다시 담으면 수량을 교체한다 (합산하지 않음)
 * - 추가/교체는 재고 확인을 통과한 경우에만 반영
 * - 주문으로 전환되기 전까지 저장되지 않는다
 */
public class ShoppingCart {

    @Getter
    private final Long userId;

    private final List<CartLine> lines = new ArrayList<>();

    public ShoppingCart(Long userId) {
        this.userId = userId;
    }

    /**
     * 상품을 담거나 이미 담긴 상품의 수량을 교체한다.
     *
     * @return 재고 부족으로 반영하지 못하면 false
     * @throws InvalidQuantityException 수량이 1 미만인 경우
     */
    public synchronized boolean add(Furniture furniture, int amount, AvailabilityChecker checker) {
        if (furniture == null) {
            throw new IllegalArgumentException("상품은 필수입니다");
        }
        if (amount < CartConstants.MIN_CART_QUANTITY) {
            throw new InvalidQuantityException(amount);
        }
        if (!furniture.checkAvailability(checker, amount)) {
            return false;
        }

        CartLine line = new CartLine(furniture, amount);
        Optional<CartLine> existing = findLine(furniture.variantKey());
        if (existing.isPresent()) {
            lines.set(lines.indexOf(existing.get()), line);
        } else {
            lines.add(line);
        }
        return true;
    }

    /**
     * @throws CartItemNotFoundException 장바구니에 없는 상품인 경우
     */
    public synchronized void remove(Furniture furniture) {
        CartLine line = findLine(furniture.variantKey())
                .orElseThrow(() -> new CartItemNotFoundException(furniture.variantKey()));
        lines.remove(line);
    }

    public synchronized BigDecimal total() {
        return PricePolicy.money(lines.stream()
                .map(CartLine::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /**
     * 줄마다 단가에 할인율을 적용한 합계
     */
    public synchronized BigDecimal discountedTotal(int discountPercent) {
        return PricePolicy.money(lines.stream()
                .map(line -> line.discountedSubtotal(discountPercent))
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    private Optional<CartLine> findLine(VariantKey key) {
        return lines.stream()
                .filter(line -> line.getFurniture().variantKey().equals(key))
                .findFirst();
    }

    public synchronized List<CartLine> lines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public synchronized int totalQuantity() {
        return lines.stream().mapToInt(CartLine::getQuantity).sum();
    }

    public synchronized boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * 주문으로 전환된 줄만 제거한다. 결제 중에 새로 담거나 수량을 바꾼 줄은 남는다.
     */
    public synchronized void removeCheckedOut(List<CartLine> checkedOut) {
        lines.removeIf(line -> checkedOut.stream().anyMatch(done -> done == line));
    }
}
