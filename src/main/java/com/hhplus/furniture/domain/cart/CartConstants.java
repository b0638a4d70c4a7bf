package com.hhplus.furniture.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 */
public class CartConstants {

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    public static final String MSG_INVALID_CART_QUANTITY =
            String.format("장바구니 수량은 %d 이상의 정수여야 합니다", MIN_CART_QUANTITY);

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
