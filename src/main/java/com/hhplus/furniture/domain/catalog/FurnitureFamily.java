package com.hhplus.furniture.domain.catalog;

/**
 * 가구 계열. 테이블은 소재로, 의자는 높이 조절/팔걸이 여부로 구분된다.
 */
public enum FurnitureFamily {
    TABLE,
    CHAIR;

    /**
     * 함께 판매할 수 있는 반대 계열 (테이블 ↔ 의자)
     */
    public FurnitureFamily complement() {
        return this == TABLE ? CHAIR : TABLE;
    }
}
