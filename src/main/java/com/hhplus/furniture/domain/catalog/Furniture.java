package com.hhplus.furniture.domain.catalog;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Furniture - 구매 가능한 가구 구성(상품)의 공통 기능
 *
 * 구현체는 TableVariant, ChairVariant 두 가지뿐이며 FurnitureFactory가 생성한다.
 * 카탈로그 행을 찾지 못한 상품도 만들어질 수 있고, 이 경우 price()를 호출하면
 * UnpricedVariantException이 발생한다.
 */
public interface Furniture {

    VariantKey variantKey();

    Optional<CatalogEntry> catalogEntry();

    /**
     * 상품 상세 설명 텍스트
     */
    String describe();

    default FurnitureKind kind() {
        return variantKey().getKind();
    }

    default String color() {
        return variantKey().getColor();
    }

    default boolean isPriced() {
        return catalogEntry().isPresent();
    }

    default BigDecimal price() {
        return catalogEntry()
                .map(CatalogEntry::getPrice)
                .orElseThrow(() -> new UnpricedVariantException(variantKey()));
    }

    default String name() {
        return catalogEntry()
                .map(CatalogEntry::getName)
                .orElse(kind().getDisplayName());
    }

    default String description() {
        return catalogEntry()
                .map(CatalogEntry::getDescription)
                .orElse("");
    }

    default Optional<Long> catalogItemId() {
        return catalogEntry().map(CatalogEntry::getCatalogItemId);
    }

    default boolean checkAvailability(AvailabilityChecker checker, int amount) {
        return checker.isAvailable(variantKey(), amount);
    }

    default BigDecimal calculateDiscount(int discountPercent) {
        return PricePolicy.discount(price(), discountPercent);
    }

    default BigDecimal applyTax(BigDecimal taxRate) {
        return PricePolicy.tax(price(), taxRate);
    }
}
