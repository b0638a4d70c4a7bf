package com.hhplus.furniture.application.coupon;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;
import com.hhplus.furniture.domain.coupon.Coupon;
import com.hhplus.furniture.domain.coupon.CouponRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * CouponService - 쿠폰 코드 조회/등록
 */
@Service
public class CouponService {

    private static final Logger log = LoggerFactory.getLogger(CouponService.class);

    private final CouponRepository couponRepository;

    public CouponService(CouponRepository couponRepository) {
        this.couponRepository = couponRepository;
    }

    /**
     * 코드로 쿠폰을 찾는다. 없는 코드이거나 조회에 실패하면 빈 값.
     */
    public Optional<Coupon> lookup(String code) {
        String normalized = Coupon.normalizeCode(code);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        try {
            Optional<Coupon> coupon = couponRepository.findByCode(normalized);
            if (coupon.isEmpty()) {
                log.info("[CouponService] 존재하지 않는 쿠폰 코드: code={}", normalized);
            }
            return coupon;
        } catch (DataAccessException e) {
            log.warn("[CouponService] 쿠폰 조회 실패: code={}", normalized, e);
            return Optional.empty();
        }
    }

    /**
     * @throws com.hhplus.furniture.domain.coupon.InvalidCouponException 할인율이 0~100 범위를 벗어난 경우
     * @throws DomainException 이미 존재하는 코드인 경우
     */
    @Transactional
    public Coupon register(String code, int discountPercent) {
        Coupon coupon = Coupon.create(code, discountPercent);
        if (couponRepository.existsByCode(coupon.getCode())) {
            throw new DomainException(ErrorCode.DUPLICATE_COUPON_CODE, "code=" + coupon.getCode());
        }
        Coupon saved = couponRepository.save(coupon);
        log.info("[CouponService] 쿠폰 등록: couponId={}, code={}, discount={}%",
                saved.getCouponId(), saved.getCode(), saved.getDiscountPercent());
        return saved;
    }
}
