package com.hhplus.furniture.infrastructure.persistence.coupon;

import com.hhplus.furniture.domain.coupon.Coupon;
import com.hhplus.furniture.domain.coupon.CouponRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 CouponRepository 구현. 코드는 대문자로 정규화된 값으로 조회한다.
 */
@Repository
@Primary
public class MySQLCouponRepository implements CouponRepository {

    private final CouponJpaRepository couponJpaRepository;

    public MySQLCouponRepository(CouponJpaRepository couponJpaRepository) {
        this.couponJpaRepository = couponJpaRepository;
    }

    @Override
    public Optional<Coupon> findByCode(String code) {
        return couponJpaRepository.findByCode(Coupon.normalizeCode(code));
    }

    @Override
    public Optional<Coupon> findById(Long couponId) {
        return couponJpaRepository.findById(couponId);
    }

    @Override
    public boolean existsByCode(String code) {
        return couponJpaRepository.existsByCode(Coupon.normalizeCode(code));
    }

    @Override
    public Coupon save(Coupon coupon) {
        return couponJpaRepository.save(coupon);
    }

    @Override
    public long count() {
        return couponJpaRepository.count();
    }
}
