package com.hhplus.furniture.infrastructure.persistence.catalog;

import com.hhplus.furniture.domain.catalog.CatalogItem;
import com.hhplus.furniture.domain.catalog.FurnitureKind;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * CatalogItem JPA Repository (inventory 테이블)
 */
public interface CatalogItemJpaRepository extends JpaRepository<CatalogItem, Long> {

    Optional<CatalogItem> findByVariantKey(String variantKey);

    List<CatalogItem> findByPriceBetweenOrderByPriceAscIdAsc(BigDecimal minPrice, BigDecimal maxPrice);

    @Query("SELECT c FROM CatalogItem c " +
           "WHERE c.kind IN :kinds AND c.color = :color AND c.quantity > 0 " +
           "ORDER BY c.id ASC")
    List<CatalogItem> findInStock(@Param("kinds") List<FurnitureKind> kinds, @Param("color") String color);

    /**
     * SELECT ... FOR UPDATE. 결제 트랜잭션의 재고 차감에 사용한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CatalogItem c WHERE c.id = :id")
    Optional<CatalogItem> findByIdForUpdate(@Param("id") Long id);
}
