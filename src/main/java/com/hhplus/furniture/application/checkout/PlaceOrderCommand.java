package com.hhplus.furniture.application.checkout;

import com.hhplus.furniture.domain.cart.CartLine;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * 결제 트랜잭션 입력 (검증이 끝난 장바구니 스냅샷)
 */
@Getter
@AllArgsConstructor
public class PlaceOrderCommand {

    private final Long userId;
    private final List<CartLine> lines;
    private final Long couponId;
    private final BigDecimal totalBeforeCredit;
    private final String cardNumber;
}
