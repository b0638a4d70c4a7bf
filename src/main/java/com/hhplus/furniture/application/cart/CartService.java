package com.hhplus.furniture.application.cart;

import com.hhplus.furniture.application.cart.dto.AddItemResult;
import com.hhplus.furniture.application.cart.dto.CartView;
import com.hhplus.furniture.application.catalog.CatalogService;
import com.hhplus.furniture.application.catalog.dto.VariantCommand;
import com.hhplus.furniture.application.coupon.CouponService;
import com.hhplus.furniture.application.inventory.InventoryService;
import com.hhplus.furniture.domain.cart.CartRepository;
import com.hhplus.furniture.domain.cart.ShoppingCart;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.coupon.Coupon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * CartService - 장바구니 유스케이스
 *
 * 흐름 (담기):
 * 1. 요청 속성으로 상품 생성 (카탈로그 조회)
 * 2. 재고 확인 후 담기 또는 수량 교체
 * 3. 결과 반환 (재고 부족은 예외가 아닌 added=false)
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final CatalogService catalogService;
    private final InventoryService inventoryService;
    private final CouponService couponService;

    public CartService(CartRepository cartRepository, CatalogService catalogService,
                       InventoryService inventoryService, CouponService couponService) {
        this.cartRepository = cartRepository;
        this.catalogService = catalogService;
        this.inventoryService = inventoryService;
        this.couponService = couponService;
    }

    /**
     * 장바구니 조회. 유효한 쿠폰 코드가 주어지면 할인 후 합계도 함께 계산한다.
     */
    public CartView view(Long userId, String couponCode) {
        ShoppingCart cart = cartRepository.findOrCreateByUserId(userId);
        return lookupCoupon(couponCode)
                .map(coupon -> CartView.withCoupon(cart, coupon.getCode(), coupon.getDiscountPercent()))
                .orElseGet(() -> CartView.from(cart));
    }

    public AddItemResult addItem(Long userId, VariantCommand command, int amount) {
        Furniture furniture = catalogService.variantOf(command);
        ShoppingCart cart = cartRepository.findOrCreateByUserId(userId);

        boolean added = cart.add(furniture, amount, inventoryService);
        if (added) {
            log.info("[CartService] 장바구니 담기: userId={}, variant={}, quantity={}",
                    userId, furniture.variantKey(), amount);
        } else {
            log.info("[CartService] 재고 부족으로 담기 실패: userId={}, variant={}, quantity={}",
                    userId, furniture.variantKey(), amount);
        }
        return new AddItemResult(added, furniture.name(), CartView.from(cart));
    }

    /**
     * @throws com.hhplus.furniture.domain.cart.CartItemNotFoundException 장바구니에 없는 상품
     */
    public CartView removeItem(Long userId, VariantCommand command) {
        Furniture furniture = catalogService.variantOf(command);
        ShoppingCart cart = cartRepository.findOrCreateByUserId(userId);
        cart.remove(furniture);

        log.info("[CartService] 장바구니 제거: userId={}, variant={}", userId, furniture.variantKey());
        return CartView.from(cart);
    }

    /**
     * 쿠폰 코드 조회. 잘못된 코드이거나 조회 오류면 빈 값 (예외 없음).
     */
    public Optional<Coupon> lookupCoupon(String couponCode) {
        if (couponCode == null || couponCode.isBlank()) {
            return Optional.empty();
        }
        return couponService.lookup(couponCode);
    }

    public ShoppingCart cartOf(Long userId) {
        return cartRepository.findOrCreateByUserId(userId);
    }

    public void discard(Long userId) {
        cartRepository.deleteByUserId(userId);
    }
}
