package com.hhplus.furniture.application.cart;

import com.hhplus.furniture.application.cart.dto.AddItemResult;
import com.hhplus.furniture.application.cart.dto.CartView;
import com.hhplus.furniture.application.catalog.CatalogService;
import com.hhplus.furniture.application.catalog.dto.VariantCommand;
import com.hhplus.furniture.application.coupon.CouponService;
import com.hhplus.furniture.application.inventory.InventoryService;
import com.hhplus.furniture.common.TestFixtures;
import com.hhplus.furniture.domain.cart.CartItemNotFoundException;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import com.hhplus.furniture.domain.coupon.Coupon;
import com.hhplus.furniture.infrastructure.persistence.cart.InMemoryCartRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * CartServiceTest - Application 계층 단위 테스트
 *
 * 장바구니 저장소는 실제 InMemoryCartRepository를 사용하고
 * 카탈로그/재고/쿠폰은 Mock으로 대체한다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartService 단위 테스트")
class CartServiceTest {

    private static final Long USER_ID = 1L;

    @Mock
    private CatalogService catalogService;

    @Mock
    private InventoryService inventoryService;

    @Mock
    private CouponService couponService;

    private CartService cartService;
    private VariantCommand tableCommand;
    private Furniture table;

    @BeforeEach
    void setup() {
        cartService = new CartService(new InMemoryCartRepository(), catalogService, inventoryService, couponService);
        tableCommand = VariantCommand.table(FurnitureKind.DINING_TABLE, "brown", "metal");
        table = TestFixtures.priced(TestFixtures.catalogItem(2L, TestFixtures.brownMetalTable(),
                "Brown Metal Dining Table", "99.99", 10));
    }

    @Test
    @DisplayName("담기 - 재고가 있으면 추가")
    void testAddItem_Success() {
        // Given
        when(catalogService.variantOf(tableCommand)).thenReturn(table);
        when(inventoryService.isAvailable(table.variantKey(), 3)).thenReturn(true);

        // When
        AddItemResult result = cartService.addItem(USER_ID, tableCommand, 3);

        // Then
        assertThat(result.isAdded()).isTrue();
        assertThat(result.getItemName()).isEqualTo("Brown Metal Dining Table");
        assertThat(result.getCart().getTotalQuantity()).isEqualTo(3);
        assertThat(result.getCart().getTotalPrice()).isEqualByComparingTo("299.97");
    }

    @Test
    @DisplayName("담기 - 재고 부족이면 added=false, 장바구니 변경 없음")
    void testAddItem_NotEnoughStock() {
        when(catalogService.variantOf(tableCommand)).thenReturn(table);
        when(inventoryService.isAvailable(any(), anyInt())).thenReturn(false);

        AddItemResult result = cartService.addItem(USER_ID, tableCommand, 50);

        assertThat(result.isAdded()).isFalse();
        assertThat(result.getCart().getLines()).isEmpty();
        assertThat(cartService.cartOf(USER_ID).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("조회 - 유효한 쿠폰이면 할인 합계 포함")
    void testView_WithCoupon() {
        when(catalogService.variantOf(tableCommand)).thenReturn(table);
        when(inventoryService.isAvailable(any(), anyInt())).thenReturn(true);
        when(couponService.lookup("SAVE10")).thenReturn(Optional.of(Coupon.create("SAVE10", 10)));
        cartService.addItem(USER_ID, tableCommand, 2);

        CartView view = cartService.view(USER_ID, "SAVE10");

        assertThat(view.getTotalPrice()).isEqualByComparingTo("199.98");
        assertThat(view.getDiscountPercent()).isEqualTo(10);
        assertThat(view.getDiscountedTotal()).isEqualByComparingTo("179.98");
        assertThat(view.getLines().get(0).getMaterial()).isEqualTo("metal");
    }

    @Test
    @DisplayName("조회 - 잘못된 쿠폰이면 할인 없음")
    void testView_InvalidCoupon() {
        when(couponService.lookup("BOGUS")).thenReturn(Optional.empty());

        CartView view = cartService.view(USER_ID, "BOGUS");

        assertThat(view.getCouponCode()).isNull();
        assertThat(view.getDiscountedTotal()).isNull();
    }

    @Test
    @DisplayName("조회 - 쿠폰 코드가 없으면 쿠폰 조회하지 않음")
    void testView_NoCoupon() {
        cartService.view(USER_ID, null);

        verifyNoInteractions(couponService);
    }

    @Test
    @DisplayName("제거 - 담긴 상품 제거, 없는 상품은 예외")
    void testRemoveItem() {
        when(catalogService.variantOf(tableCommand)).thenReturn(table);
        when(inventoryService.isAvailable(any(), anyInt())).thenReturn(true);
        cartService.addItem(USER_ID, tableCommand, 1);

        CartView view = cartService.removeItem(USER_ID, tableCommand);

        assertThat(view.getLines()).isEmpty();
        assertThatThrownBy(() -> cartService.removeItem(USER_ID, tableCommand))
                .isInstanceOf(CartItemNotFoundException.class);
    }

    @Test
    @DisplayName("폐기 - 다음 조회 시 새 장바구니")
    void testDiscard() {
        when(catalogService.variantOf(tableCommand)).thenReturn(table);
        when(inventoryService.isAvailable(any(), anyInt())).thenReturn(true);
        cartService.addItem(USER_ID, tableCommand, 1);

        cartService.discard(USER_ID);

        assertThat(cartService.cartOf(USER_ID).isEmpty()).isTrue();
    }
}
