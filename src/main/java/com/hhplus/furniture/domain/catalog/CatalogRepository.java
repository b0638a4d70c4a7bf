package com.hhplus.furniture.domain.catalog;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * CatalogRepository - 카탈로그/재고 저장소 포트
 */
public interface CatalogRepository {

    /**
     * 모든 식별 속성(고정 치수 포함)이 정확히 일치하는 행을 찾는다.
     */
    Optional<CatalogItem> findByKey(VariantKey key);

    Optional<CatalogItem> findById(Long id);

    /**
     * 비관적 쓰기 락(SELECT ... FOR UPDATE)으로 조회한다. 트랜잭션 안에서만 호출해야 한다.
     */
    Optional<CatalogItem> findByIdForUpdate(Long id);

    List<CatalogItem> findByPriceBetween(BigDecimal minPrice, BigDecimal maxPrice);

    /**
     * 지정한 종류들 중 해당 색상이면서 재고가 있는 행을 id 순으로 조회한다.
     */
    List<CatalogItem> findInStock(List<FurnitureKind> kinds, String color);

    CatalogItem save(CatalogItem item);

    long count();
}
