package com.hhplus.furniture.infrastructure.lock;

/**
 * 분산락 키 생성 유틸리티
 *
 * 패턴: resource_type:resource_id
 */
public class LockKeyGenerator {

    /**
     * 재고 조정용 락 키 템플릿 (첫 번째 파라미터는 VariantKey)
     * 예: adjust(DINING_TABLE(brown, wood), ...) → "inventory:DINING_TABLE(brown, wood)"
     */
    public static final String INVENTORY_KEY_TEMPLATE =
            "'inventory:' + #p0";

    /**
     * 크레딧 충전용 락 키 템플릿
     * 예: addCredit(userId=10, ...) → "user:credit:10"
     */
    public static final String USER_CREDIT_KEY_TEMPLATE =
            "'user:credit:' + #p0";

    public static String inventory(Object variantKey) {
        return "inventory:" + variantKey;
    }

    public static String userCredit(Long userId) {
        return "user:credit:" + userId;
    }

    private LockKeyGenerator() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }
}
