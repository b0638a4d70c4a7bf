package com.hhplus.furniture.domain.catalog;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 카탈로그 행에서 조회한 가격/이름/설명 스냅샷.
 * 상품 객체 생성 시점의 값이며 이후 카탈로그가 바뀌어도 갱신되지 않는다.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class CatalogEntry {

    private final Long catalogItemId;
    private final String name;
    private final String description;
    private final BigDecimal price;
}
