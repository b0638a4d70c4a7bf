package com.hhplus.furniture.domain.inventory;

import com.hhplus.furniture.common.exception.DomainException;
import com.hhplus.furniture.common.exception.ErrorCode;

public class InsufficientStockException extends DomainException {

    private final String itemName;

    public InsufficientStockException(Long catalogItemId, String itemName, int onHand, int requested) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("catalogItemId=%d, name=%s, onHand=%d, requested=%d",
                        catalogItemId, itemName, onHand, requested));
        this.itemName = itemName;
    }

    public String getItemName() {
        return itemName;
    }
}
