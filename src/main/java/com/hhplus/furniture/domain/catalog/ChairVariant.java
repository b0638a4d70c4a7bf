package com.hhplus.furniture.domain.catalog;

import lombok.EqualsAndHashCode;

import java.util.Optional;

/**
 * 의자 상품 (게이밍 의자, 작업용 의자)
 */
@EqualsAndHashCode(of = "variantKey")
public final class ChairVariant implements Furniture {

    private final VariantKey variantKey;
    private final CatalogEntry catalogEntry;

    ChairVariant(VariantKey variantKey, CatalogEntry catalogEntry) {
        if (variantKey.getKind().isTable()) {
            throw new InvalidFurnitureAttributeException(variantKey.getKind().name() + "은(는) 의자가 아닙니다");
        }
        this.variantKey = variantKey;
        this.catalogEntry = catalogEntry;
    }

    public boolean isAdjustable() {
        return variantKey.isAdjustable();
    }

    public boolean hasArmrest() {
        return variantKey.isArmrest();
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
        return String.format("%s: %s%n  Description: %s%n  Price: %s%n  Dimensions: %s%n  Color: %s%n"
                        + "  Adjustable: %s%n  Has armrest: %s%n  Available colors: %s",
                kind.getDisplayName(), name(), description(),
                isPriced() ? price().toPlainString() : "N/A",
                kind.getDimensions(), color(),
                isAdjustable() ? "Yes" : "No",
                hasArmrest() ? "Yes" : "No",
                String.join(", ", kind.getAllowedColors()));
    }

    @Override
    public String toString() {
        return "ChairVariant" + variantKey;
    }
}
