package com.hhplus.furniture.application.checkout;

import com.hhplus.furniture.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 결제 결과. 실패도 예외가 아닌 (success=false, message)로 전달된다.
 */
@Getter
@ToString
@AllArgsConstructor
public class CheckoutResult {

    private final boolean success;
    private final String message;
    private final Long orderId;
    private final BigDecimal totalPrice;
    private final BigDecimal creditUsed;

    public static CheckoutResult success(Order order) {
        return new CheckoutResult(true, CheckoutMessages.SUCCESS, order.getOrderId(),
                order.getTotalPrice(), order.getCreditUsed());
    }

    public static CheckoutResult failure(String message) {
        return new CheckoutResult(false, message, null, null, null);
    }
}
