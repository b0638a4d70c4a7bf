package com.hhplus.furniture.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 유효성 검증 실패, 상태 전이 오류처럼 클라이언트 오류(4XX)로 응답되는 예외.
 * 예: InsufficientStockException, InvalidOrderStatusException
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
