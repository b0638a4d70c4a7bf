package com.hhplus.furniture.application.cart.dto;

import com.hhplus.furniture.domain.cart.CartLine;
import com.hhplus.furniture.domain.cart.ShoppingCart;
import com.hhplus.furniture.domain.catalog.ChairVariant;
import com.hhplus.furniture.domain.catalog.Furniture;
import com.hhplus.furniture.domain.catalog.TableVariant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 조회 결과
 */
@Getter
@Builder
@AllArgsConstructor
public class CartView {

    private final Long userId;
    private final List<Line> lines;
    private final int totalQuantity;
    private final BigDecimal totalPrice;
    private final String couponCode;
    private final Integer discountPercent;
    private final BigDecimal discountedTotal;

    public static CartView from(ShoppingCart cart) {
        return builder()
                .userId(cart.getUserId())
                .lines(toLines(cart))
                .totalQuantity(cart.totalQuantity())
                .totalPrice(cart.total())
                .build();
    }

    public static CartView withCoupon(ShoppingCart cart, String couponCode, int discountPercent) {
        return builder()
                .userId(cart.getUserId())
                .lines(toLines(cart))
                .totalQuantity(cart.totalQuantity())
                .totalPrice(cart.total())
                .couponCode(couponCode)
                .discountPercent(discountPercent)
                .discountedTotal(cart.discountedTotal(discountPercent))
                .build();
    }

    private static List<Line> toLines(ShoppingCart cart) {
        return cart.lines().stream()
                .map(Line::from)
                .collect(Collectors.toList());
    }

    @Getter
    @AllArgsConstructor
    public static class Line {
        private final Long catalogItemId;
        private final String kind;
        private final String name;
        private final String color;
        private final String material;
        private final Boolean adjustable;
        private final Boolean armrest;
        private final int quantity;
        private final BigDecimal unitPrice;
        private final BigDecimal subtotal;

        static Line from(CartLine line) {
            Furniture furniture = line.getFurniture();
            String material = furniture instanceof TableVariant ? ((TableVariant) furniture).material() : null;
            Boolean adjustable = null;
            Boolean armrest = null;
            if (furniture instanceof ChairVariant) {
                ChairVariant chair = (ChairVariant) furniture;
                adjustable = chair.isAdjustable();
                armrest = chair.hasArmrest();
            }
            return new Line(furniture.catalogItemId().orElse(null), furniture.kind().name(), furniture.name(),
                    furniture.color(), material, adjustable, armrest,
                    line.getQuantity(), furniture.price(), line.subtotal());
        }
    }
}
