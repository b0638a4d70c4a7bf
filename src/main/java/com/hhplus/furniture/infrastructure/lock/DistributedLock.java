package com.hhplus.furniture.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redis 분산락 어노테이션
 *
 * 키는 Spring EL로 평가된다. (#p0, #p1 : 메서드 파라미터)
 *
 * 예제:
 * @DistributedLock(key = LockKeyGenerator.INVENTORY_KEY_TEMPLATE)
 * public StockAdjustment adjust(VariantKey key, int quantity, StockDirection direction) { ... }
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    String key();

    /**
     * 락 획득 대기 시간. 초과하면 LOCK_ACQUISITION_FAILED
     */
    long waitTime() default 5;

    /**
     * 락 유지 시간. 해제되지 않으면 이 시간 후 자동 해제
     */
    long leaseTime() default 3;

    TimeUnit timeUnit() default TimeUnit.SECONDS;
}
