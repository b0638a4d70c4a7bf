package com.hhplus.furniture.domain.catalog;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

/**
 * 카탈로그 행이 확인되지 않은 상품의 가격을 사용하려 할 때 발생
 */
public class UnpricedVariantException extends DomainException {

    public UnpricedVariantException(VariantKey key) {
        super(ErrorCode.UNPRICED_VARIANT, "variant=" + key);
    }
}
