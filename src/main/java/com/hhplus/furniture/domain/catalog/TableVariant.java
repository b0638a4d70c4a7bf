package com.hhplus.furniture.domain.catalog;

import lombok.EqualsAndHashCode;

import java.util.Optional;

/**
 * 테이블 상품 (식탁, 작업용 책상, 커피 테이블)
 */
@EqualsAndHashCode(of = "variantKey")
public final class TableVariant implements Furniture {

    private final VariantKey variantKey;
    private final CatalogEntry catalogEntry;

    TableVariant(VariantKey variantKey, CatalogEntry catalogEntry) {
        if (!variantKey.getKind().isTable()) {
            throw new InvalidFurnitureAttributeException(variantKey.getKind().name() + "은(는) 테이블이 아닙니다");
        }
        this.variantKey = variantKey;
        this.catalogEntry = catalogEntry;
    }

    public String material() {
        return variantKey.getMaterial();
    }

    @Override
    public VariantKey variantKey() {
        return variantKey;
    }

    @Override
    public Optional<CatalogEntry> catalogEntry() {
        return Optional.ofNullable(catalogEntry);
    }

    @Override
    public String describe() {
        FurnitureKind kind = kind();
        return String.format("%s: %s%n  Description: %s%n  Price: %s%n  Dimensions: %s%n  Color: %s%n  Material: %s%n"
                        + "  Available colors: %s%n  Available materials: %s",
                kind.getDisplayName(), name(), description(),
                isPriced() ? price().toPlainString() : "N/A",
                kind.getDimensions(), color(), material(),
                String.join(", ", kind.getAllowedColors()),
                String.join(", ", kind.getAllowedMaterials()));
    }

    @Override
    public String toString() {
        return "TableVariant" + variantKey;
    }
}
