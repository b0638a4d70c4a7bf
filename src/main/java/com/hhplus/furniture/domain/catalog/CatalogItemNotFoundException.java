package com.hhplus.furniture.domain.catalog;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class CatalogItemNotFoundException extends DomainException {

    public CatalogItemNotFoundException(VariantKey key) {
        super(ErrorCode.CATALOG_ITEM_NOT_FOUND, "variant=" + key);
    }

    public CatalogItemNotFoundException(Long catalogItemId) {
        super(ErrorCode.CATALOG_ITEM_NOT_FOUND, "catalogItemId=" + catalogItemId);
    }
}
