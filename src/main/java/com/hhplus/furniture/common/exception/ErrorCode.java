package com.hhplus.furniture.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_USER_NOT_FOUND, APP_SESSION_UNAUTHORIZED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Catalog Domain
    INVALID_FURNITURE_ATTRIBUTE("DOMAIN_CATALOG_INVALID_ATTRIBUTE", "허용되지 않는 가구 속성입니다", 400),
    CATALOG_ITEM_NOT_FOUND("DOMAIN_CATALOG_ITEM_NOT_FOUND", "카탈로그 상품을 찾을 수 없습니다", 404),
    UNPRICED_VARIANT("DOMAIN_CATALOG_UNPRICED_VARIANT", "가격이 확인되지 않은 상품입니다", 400),
    INVALID_PRICE_RANGE("DOMAIN_CATALOG_INVALID_PRICE_RANGE", "유효하지 않은 가격 범위입니다", 400),
    INVALID_DISCOUNT("DOMAIN_CATALOG_INVALID_DISCOUNT", "할인율은 음수일 수 없습니다", 400),
    INVALID_TAX_RATE("DOMAIN_CATALOG_INVALID_TAX_RATE", "세율은 음수일 수 없습니다", 400),

    // Inventory Domain
    INSUFFICIENT_STOCK("DOMAIN_INVENTORY_INSUFFICIENT_STOCK", "재고가 부족합니다", 400),
    INVALID_QUANTITY("DOMAIN_INVENTORY_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400),

    // Cart Domain
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니에 없는 상품입니다", 404),

    // Coupon Domain
    INVALID_COUPON_DISCOUNT("DOMAIN_COUPON_INVALID_DISCOUNT", "쿠폰 할인율은 0~100 사이여야 합니다", 400),
    DUPLICATE_COUPON_CODE("DOMAIN_COUPON_DUPLICATE_CODE", "이미 존재하는 쿠폰 코드입니다", 409),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "유효하지 않은 주문 상태입니다", 400),

    // Payment Domain
    INVALID_PAYMENT("DOMAIN_PAYMENT_INVALID", "결제 수단이 유효하지 않습니다", 400),

    // Account Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),
    MANAGER_NOT_FOUND("DOMAIN_MANAGER_NOT_FOUND", "매니저를 찾을 수 없습니다", 404),
    DUPLICATE_EMAIL("DOMAIN_ACCOUNT_DUPLICATE_EMAIL", "이미 등록된 이메일입니다", 409),
    INVALID_ACCOUNT_FIELD("DOMAIN_ACCOUNT_INVALID_FIELD", "계정 입력값이 유효하지 않습니다", 400),
    INVALID_CREDIT("DOMAIN_USER_INVALID_CREDIT", "유효하지 않은 크레딧입니다", 400),
    INSUFFICIENT_CREDIT("DOMAIN_USER_INSUFFICIENT_CREDIT", "크레딧이 부족합니다", 400),

    // ========== Application Layer Errors ==========

    UNAUTHORIZED("APP_SESSION_UNAUTHORIZED", "로그인이 필요합니다", 401),
    INVALID_CREDENTIALS("APP_SESSION_INVALID_CREDENTIALS", "이메일 또는 비밀번호가 올바르지 않습니다", 401),
    FORBIDDEN("APP_SESSION_FORBIDDEN", "권한이 없습니다", 403),
    INVALID_INPUT("APP_INVALID_INPUT", "요청 값이 유효하지 않습니다", 400),

    // ========== System Errors (5XX) ==========

    DATABASE_ERROR("SYSTEM_DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    SESSION_STORE_ERROR("SYSTEM_SESSION_STORE_ERROR", "세션 저장소 오류가 발생했습니다", 500),
    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "분산락 획득에 실패했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
