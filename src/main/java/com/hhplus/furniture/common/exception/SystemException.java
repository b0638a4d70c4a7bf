package com.hhplus.furniture.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 데이터베이스, Redis, 분산락 획득 실패 등 항상 서버 오류(5XX)로 응답된다.
 * 계정 변경 경로에서는 롤백 후 원인 예외를 감싸서 다시 던진다.
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
