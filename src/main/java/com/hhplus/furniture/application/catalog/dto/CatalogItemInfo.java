package com.hhplus.furniture.application.catalog.dto;

import com.hhplus.furniture.domain.catalog.CatalogItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 카탈로그 조회 결과 (캐시 저장 대상이므로 기본 생성자 필요)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogItemInfo {

    private Long catalogItemId;
    private String kind;
    private String name;
    private String description;
    private String color;
    private String material;
    private Boolean adjustable;
    private Boolean armrest;
    private BigDecimal price;
    private String dimensions;

    public static CatalogItemInfo from(CatalogItem item) {
        boolean table = item.getKind().isTable();
        return CatalogItemInfo.builder()
                .catalogItemId(item.getId())
                .kind(item.getKind().name())
                .name(item.getName())
                .description(item.getDescription())
                .color(item.getColor())
                .material(table ? item.getMaterial() : null)
                .adjustable(table ? null : item.isAdjustable())
                .armrest(table ? null : item.isArmrest())
                .price(item.getPrice())
                .dimensions(item.getHeight() + "x" + item.getDepth() + "x" + item.getWidth())
                .build();
    }
}
