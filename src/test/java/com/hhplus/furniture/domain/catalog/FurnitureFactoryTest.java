package com.hhplus.furniture.domain.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FurnitureFactory 단위 테스트")
class FurnitureFactoryTest {

    private final FurnitureFactory factory = new FurnitureFactory();

    @Test
    @DisplayName("테이블 생성 - 카탈로그 스냅샷의 가격/이름 사용")
    void testCreateTable_Priced() {
        VariantKey key = factory.keyOf(FurnitureKind.DINING_TABLE, "brown", "metal", null, null);
        CatalogEntry entry = new CatalogEntry(2L, "Brown Metal Dining Table", "Sturdy table", new BigDecimal("99.99"));

        Furniture furniture = factory.create(key, Optional.of(entry));

        assertThat(furniture).isInstanceOf(TableVariant.class);
        assertThat(furniture.isPriced()).isTrue();
        assertThat(furniture.price()).isEqualByComparingTo("99.99");
        assertThat(furniture.name()).isEqualTo("Brown Metal Dining Table");
        assertThat(furniture.catalogItemId()).contains(2L);
        assertThat(((TableVariant) furniture).material()).isEqualTo("metal");
    }

    @Test
    @DisplayName("의자 생성 - 카탈로그 행이 없으면 가격 조회 시 예외")
    void testCreateChair_Unpriced() {
        VariantKey key = factory.keyOf(FurnitureKind.WORK_CHAIR, "white", null, false, true);

        Furniture furniture = factory.create(key, Optional.empty());

        assertThat(furniture).isInstanceOf(ChairVariant.class);
        assertThat(furniture.isPriced()).isFalse();
        assertThat(furniture.name()).isEqualTo("Work Chair");
        assertThat(furniture.catalogItemId()).isEmpty();
        assertThatThrownBy(furniture::price).isInstanceOf(UnpricedVariantException.class);
        assertThat(furniture.describe()).contains("Price: N/A");
    }

    @Test
    @DisplayName("keyOf - 테이블에 소재가 없으면 예외")
    void testKeyOf_TableWithoutMaterial() {
        assertThatThrownBy(() -> factory.keyOf(FurnitureKind.WORK_DESK, "white", null, null, null))
                .isInstanceOf(InvalidFurnitureAttributeException.class);
    }

    @Test
    @DisplayName("keyOf - 의자에 소재를 지정하면 예외")
    void testKeyOf_ChairWithMaterial() {
        assertThatThrownBy(() -> factory.keyOf(FurnitureKind.GAMING_CHAIR, "blue", "wood", true, true))
                .isInstanceOf(InvalidFurnitureAttributeException.class);
    }

    @Test
    @DisplayName("keyOf - 의자 옵션 누락 시 예외")
    void testKeyOf_ChairMissingOptions() {
        assertThatThrownBy(() -> factory.keyOf(FurnitureKind.GAMING_CHAIR, "blue", null, true, null))
                .isInstanceOf(InvalidFurnitureAttributeException.class);
    }

    @Test
    @DisplayName("할인/세금 계산은 카탈로그 가격 기준")
    void testDiscountAndTax() {
        VariantKey key = factory.keyOf(FurnitureKind.DINING_TABLE, "gray", "wood", null, null);
        Furniture furniture = factory.create(key,
                Optional.of(new CatalogEntry(3L, "Gray Wood Dining Table", "", new BigDecimal("120.00"))));

        assertThat(furniture.calculateDiscount(25)).isEqualByComparingTo("90.00");
        assertThat(furniture.applyTax(new BigDecimal("10"))).isEqualByComparingTo("132.00");
    }

    @Test
    @DisplayName("재고 확인은 AvailabilityChecker에 위임")
    void testCheckAvailability() {
        VariantKey key = factory.keyOf(FurnitureKind.DINING_TABLE, "gray", "wood", null, null);
        Furniture furniture = factory.create(key, Optional.empty());

        assertThat(furniture.checkAvailability((k, amount) -> amount <= 5, 5)).isTrue();
        assertThat(furniture.checkAvailability((k, amount) -> amount <= 5, 6)).isFalse();
    }
}
