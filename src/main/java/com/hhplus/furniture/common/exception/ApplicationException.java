package com.hhplus.furniture.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 유스케이스 실패 예외
 *
 * DomainException과의 차이:
 * - DomainException: 도메인 규칙 자체의 위반 (예: 재고 부족)
 * - ApplicationException: 호출자 권한/세션처럼 유스케이스 전제 조건 실패 (예: 인증 실패)
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
