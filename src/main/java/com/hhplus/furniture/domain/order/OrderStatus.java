package com.hhplus.furniture.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 주문 생명주기 상태
 *
 * 상태 전환 규칙 (한 단계씩, 앞으로만):
 * PENDING → SHIPPED → DELIVERED
 * 취소 상태는 없다.
 */
@Getter
public enum OrderStatus {
    PENDING("주문 접수"),
    SHIPPED("배송 중"),
    DELIVERED("배송 완료");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    public boolean isFinal() {
        return this == DELIVERED;
    }

    /**
     * 다음 상태. 최종 상태에서는 호출할 수 없다.
     */
    public OrderStatus next() {
        switch (this) {
            case PENDING:
                return SHIPPED;
            case SHIPPED:
                return DELIVERED;
            default:
                throw new IllegalStateException("다음 상태가 없습니다: " + name());
        }
    }
}
