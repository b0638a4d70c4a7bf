package com.hhplus.furniture.domain.catalog;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

/**
 * 가구 종류에 허용되지 않는 색상/소재 등 속성 검증 실패
 */
public class InvalidFurnitureAttributeException extends DomainException {

    public InvalidFurnitureAttributeException(String detail) {
        super(ErrorCode.INVALID_FURNITURE_ATTRIBUTE, detail);
    }
}
