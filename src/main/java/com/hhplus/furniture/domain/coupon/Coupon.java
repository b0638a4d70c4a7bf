package com.hhplus.furniture.domain.coupon;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Coupon - 할인 코드
 *
 * 비즈니스 규칙:
 * - 코드는 유일하며 대문자로 저장
 * - 할인율은 0~100 (생성 시 검증)
 */
@Entity
@Table(name = "coupons")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Coupon {

    public static final int MAX_CODE_LENGTH = 48;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "coupon_id")
    private Long couponId;

    @Column(name = "code", nullable = false, unique = true, length = MAX_CODE_LENGTH)
    private String code;

    @Column(name = "discount_percent", nullable = false)
    private int discountPercent;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public static Coupon create(String code, int discountPercent) {
        String normalized = normalizeCode(code);
        if (normalized.isEmpty() || normalized.length() > MAX_CODE_LENGTH) {
            throw new InvalidCouponException("쿠폰 코드는 1~" + MAX_CODE_LENGTH + "자여야 합니다: " + code);
        }
        if (discountPercent < 0 || discountPercent > 100) {
            throw new InvalidCouponException("discountPercent=" + discountPercent);
        }

        return Coupon.builder()
                .code(normalized)
                .discountPercent(discountPercent)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static String normalizeCode(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }
}
