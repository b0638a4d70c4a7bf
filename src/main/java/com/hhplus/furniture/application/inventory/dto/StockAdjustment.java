package com.hhplus.furniture.application.inventory.dto;

import com.hhplus.furniture.domain.catalog.CatalogItem;
import com.hhplus.furniture.domain.inventory.StockDirection;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 재고 조정 결과
 */
@Getter
@AllArgsConstructor
public class StockAdjustment {

    private final Long catalogItemId;
    private final String name;
    private final StockDirection direction;
    private final int adjustedBy;
    private final int quantityOnHand;

    public static StockAdjustment of(CatalogItem item, StockDirection direction, int adjustedBy) {
        return new StockAdjustment(item.getId(), item.getName(), direction, adjustedBy, item.getQuantity());
    }
}
