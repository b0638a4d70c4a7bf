package com.hhplus.furniture.domain.cart;

import com.hhplus.furniture.domain.catalog.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * ShoppingCartTest - 장바구니 도메인 규칙
 *
 * - 같은 상품은 한 줄, 다시 담으면 수량 교체
 * - 재고 확인 실패 시 변경 없음
 * - 합계/할인 합계
 */
@DisplayName("ShoppingCart 단위 테스트")
class ShoppingCartTest {

    private static final AvailabilityChecker ALWAYS = (key, amount) -> true;
    private static final AvailabilityChecker NEVER = (key, amount) -> false;

    private final FurnitureFactory factory = new FurnitureFactory();
    private ShoppingCart cart;
    private Furniture table;
    private Furniture chair;

    @BeforeEach
    void setup() {
        cart = new ShoppingCart(1L);
        table = factory.create(VariantKey.table(FurnitureKind.DINING_TABLE, "brown", "metal"),
                Optional.of(new CatalogEntry(2L, "Brown Metal Dining Table", "", new BigDecimal("99.99"))));
        chair = factory.create(VariantKey.chair(FurnitureKind.GAMING_CHAIR, "black", true, true),
                Optional.of(new CatalogEntry(7L, "Black Gaming Chair", "", new BigDecimal("250.00"))));
    }

    @Test
    @DisplayName("담기 - 추가 순서 유지")
    void testAdd_KeepsOrder() {
        assertThat(cart.add(table, 2, ALWAYS)).isTrue();
        assertThat(cart.add(chair, 1, ALWAYS)).isTrue();

        assertThat(cart.lines()).extracting(CartLine::getFurniture).containsExactly(table, chair);
        assertThat(cart.totalQuantity()).isEqualTo(3);
    }

    @Test
    @DisplayName("같은 상품을 다시 담으면 수량을 교체 (합산하지 않음)")
    void testAdd_ReplacesQuantity() {
        cart.add(table, 2, ALWAYS);
        cart.add(table, 5, ALWAYS);

        assertThat(cart.lines()).hasSize(1);
        assertThat(cart.lines().get(0).getQuantity()).isEqualTo(5);
    }

    @Test
    @DisplayName("재고 부족이면 false, 장바구니는 변경되지 않음")
    void testAdd_NotAvailable() {
        cart.add(table, 2, ALWAYS);

        assertThat(cart.add(table, 9, NEVER)).isFalse();
        assertThat(cart.add(chair, 1, NEVER)).isFalse();

        assertThat(cart.lines()).hasSize(1);
        assertThat(cart.lines().get(0).getQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("수량이 1 미만이면 예외")
    void testAdd_InvalidQuantity() {
        assertThatThrownBy(() -> cart.add(table, 0, ALWAYS))
                .isInstanceOf(InvalidQuantityException.class);
        assertThat(cart.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("제거 - 없는 상품이면 예외")
    void testRemove() {
        cart.add(table, 1, ALWAYS);

        cart.remove(table);

        assertThat(cart.isEmpty()).isTrue();
        assertThatThrownBy(() -> cart.remove(chair))
                .isInstanceOf(CartItemNotFoundException.class);
    }

    @Test
    @DisplayName("합계 - 단가 × 수량의 합")
    void testTotal() {
        cart.add(table, 2, ALWAYS);
        cart.add(chair, 1, ALWAYS);

        assertThat(cart.total()).isEqualByComparingTo("449.98");
    }

    @Test
    @DisplayName("할인 합계 - 줄마다 단가에 할인 적용")
    void testDiscountedTotal() {
        cart.add(table, 2, ALWAYS);
        cart.add(chair, 1, ALWAYS);

        // 99.99 × 0.9 = 89.991 → 89.99, ×2 = 179.98 / 250 × 0.9 = 225.00
        assertThat(cart.discountedTotal(10)).isEqualByComparingTo("404.98");
        assertThat(cart.discountedTotal(100)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("빈 장바구니 합계는 0")
    void testEmptyTotal() {
        assertThat(cart.total()).isEqualByComparingTo("0.00");
        assertThat(cart.totalQuantity()).isZero();
    }

    @Test
    @DisplayName("lines()는 수정 불가능한 복사본")
    void testLinesUnmodifiable() {
        cart.add(table, 1, ALWAYS);

        assertThatThrownBy(() -> cart.lines().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("주문된 줄만 제거 - 이후에 담거나 수량을 바꾼 줄은 유지")
    void testRemoveCheckedOut() {
        cart.add(table, 2, ALWAYS);
        List<CartLine> checkedOut = cart.lines();

        cart.add(chair, 1, ALWAYS);
        cart.removeCheckedOut(checkedOut);

        assertThat(cart.lines()).extracting(CartLine::getFurniture).containsExactly(chair);

        cart.add(table, 1, ALWAYS);
        List<CartLine> snapshot = cart.lines();
        cart.add(table, 4, ALWAYS);
        cart.removeCheckedOut(snapshot);

        assertThat(cart.lines()).hasSize(1);
        assertThat(cart.lines().get(0).getFurniture()).isEqualTo(table);
        assertThat(cart.lines().get(0).getQuantity()).isEqualTo(4);
    }
}
