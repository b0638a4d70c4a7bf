package com.hhplus.furniture.infrastructure.persistence.catalog;

import com.hhplus.furniture.domain.catalog.CatalogItem;
import com.hhplus.furniture.domain.catalog.CatalogRepository;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import com.hhplus.furniture.domain.catalog.VariantKey;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 CatalogRepository 구현
 *
 * 상품은 VariantKey.storageKey()로 만든 variant_key 컬럼(유일)으로 찾는다.
 * 치수는 가구 종류에 고정되어 있으므로 키에 포함하지 않는다.
 */
@Repository
@Primary
public class MySQLCatalogRepository implements CatalogRepository {

    private final CatalogItemJpaRepository catalogItemJpaRepository;

    public MySQLCatalogRepository(CatalogItemJpaRepository catalogItemJpaRepository) {
        this.catalogItemJpaRepository = catalogItemJpaRepository;
    }

    @Override
    public Optional<CatalogItem> findByKey(VariantKey key) {
        return catalogItemJpaRepository.findByVariantKey(key.storageKey());
    }

    @Override
    public Optional<CatalogItem> findById(Long id) {
        return catalogItemJpaRepository.findById(id);
    }

    @Override
    public Optional<CatalogItem> findByIdForUpdate(Long id) {
        return catalogItemJpaRepository.findByIdForUpdate(id);
    }

    @Override
    public List<CatalogItem> findByPriceBetween(BigDecimal minPrice, BigDecimal maxPrice) {
        return catalogItemJpaRepository.findByPriceBetweenOrderByPriceAscIdAsc(minPrice, maxPrice);
    }

    @Override
    public List<CatalogItem> findInStock(List<FurnitureKind> kinds, String color) {
        return catalogItemJpaRepository.findInStock(kinds, color);
    }

    @Override
    public CatalogItem save(CatalogItem item) {
        return catalogItemJpaRepository.save(item);
    }

    @Override
    public long count() {
        return catalogItemJpaRepository.count();
    }
}
