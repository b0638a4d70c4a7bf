package com.hhplus.furniture.domain.coupon;

import java.util.Optional;

/**
 * CouponRepository - 쿠폰 저장소 포트
 */
public interface CouponRepository {

    Optional<Coupon> findByCode(String code);

    Optional<Coupon> findById(Long couponId);

    boolean existsByCode(String code);

    Coupon save(Coupon coupon);

    long count();
}
