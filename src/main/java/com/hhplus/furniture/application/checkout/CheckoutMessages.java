package com.hhplus.furniture.application.checkout;

/**
 * 결제 결과 메시지 (API 응답 계약)
 */
public final class CheckoutMessages {

    public static final String SUCCESS = "The order was placed successfully";
    public static final String EMPTY_CART = "There are no items in the cart";
    public static final String NOT_ENOUGH_STOCK = "There is not enough stock for %s";
    public static final String INVALID_PAYMENT = "Payment details are invalid";
    public static final String FAILED = "Checkout failed: %s";

    private CheckoutMessages() {
        throw new AssertionError("CheckoutMessages는 인스턴스화할 수 없습니다");
    }

    public static String notEnoughStock(String itemName) {
        return String.format(NOT_ENOUGH_STOCK, itemName);
    }

    public static String failed(String reason) {
        return String.format(FAILED, reason);
    }
}
